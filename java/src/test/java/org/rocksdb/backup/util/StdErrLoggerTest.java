// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.rocksdb.backup.InfoLogLevel;

public class StdErrLoggerTest {

  @Test
  public void prefixesMessages() {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final StdErrLogger logger = new StdErrLogger(InfoLogLevel.DEBUG_LEVEL,
        "[backup]", new PrintStream(bytes, true, StandardCharsets.UTF_8));

    logger.log(InfoLogLevel.WARN_LEVEL, "disk is slow");

    assertThat(bytes.toString(StandardCharsets.UTF_8))
        .isEqualTo("[backup] [WARN_LEVEL] disk is slow" + System.lineSeparator());
  }

  @Test
  public void withoutPrefix() {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final StdErrLogger logger = new StdErrLogger(InfoLogLevel.DEBUG_LEVEL,
        null, new PrintStream(bytes, true, StandardCharsets.UTF_8));

    logger.log(InfoLogLevel.INFO_LEVEL, "hello");

    assertThat(bytes.toString(StandardCharsets.UTF_8))
        .isEqualTo("[INFO_LEVEL] hello" + System.lineSeparator());
  }

  @Test
  public void levels() {
    final StdErrLogger logger = new StdErrLogger(InfoLogLevel.WARN_LEVEL);
    assertThat(logger.infoLogLevel()).isEqualTo(InfoLogLevel.WARN_LEVEL);
    assertThat(logger.isEnabled(InfoLogLevel.INFO_LEVEL)).isFalse();
    assertThat(logger.isEnabled(InfoLogLevel.ERROR_LEVEL)).isTrue();

    logger.setInfoLogLevel(InfoLogLevel.DEBUG_LEVEL);
    assertThat(logger.isEnabled(InfoLogLevel.INFO_LEVEL)).isTrue();
  }
}
