// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class RocksEnvTest extends AbstractEnvTest {

  @Rule
  public TemporaryFolder dbFolder = new TemporaryFolder();

  @Override
  protected Env env() {
    return RocksEnv.getDefault();
  }

  @Override
  protected String root() {
    return dbFolder.getRoot().getAbsolutePath();
  }

  @Test
  public void rocksEnv() {
    assertThat(Env.getDefault()).isSameAs(RocksEnv.getDefault());
    assertThat(Env.getDefault().getCurrentTime())
        .isCloseTo(System.currentTimeMillis() / 1000, within(5L));
  }
}
