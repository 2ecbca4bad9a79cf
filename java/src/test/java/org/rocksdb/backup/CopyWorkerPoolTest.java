// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Before;
import org.junit.Test;

public class CopyWorkerPoolTest {
  private RocksMemEnv env;

  @Before
  public void setUp() throws RocksDBException {
    env = new RocksMemEnv();
    env.createDirIfMissing("/src");
    env.createDirIfMissing("/dst");
  }

  @Test
  public void copiesEverySubmittedItem() throws RocksDBException {
    final List<CopyWorkItem> items = new ArrayList<>();
    try (final CopyWorkerPool pool =
             new CopyWorkerPool(4, new FileCopier(new AtomicBoolean()))) {
      assertThat(pool.numThreads()).isEqualTo(4);
      for (int i = 0; i < 20; i++) {
        FakeBackupableDB.write(env, "/src/" + i + ".sst", "file-" + i);
        final CopyWorkItem item = new CopyWorkItem("/src/" + i + ".sst",
            "/dst/" + i + ".sst", env, env, false, null, 0);
        pool.submit(item);
        items.add(item);
      }

      for (int i = 0; i < items.size(); i++) {
        final CopyResult result = items.get(i).result().join();
        assertThat(result.status().isOk()).isTrue();
        assertThat(result.checksum())
            .isEqualTo(FileCopierTest.crc32c("file-" + i));
        assertThat(FakeBackupableDB.read(env, "/dst/" + i + ".sst"))
            .isEqualTo("file-" + i);
      }
    }
  }

  @Test
  public void failureEndsUpInResult() {
    try (final CopyWorkerPool pool =
             new CopyWorkerPool(1, new FileCopier(new AtomicBoolean()))) {
      final CopyWorkItem missing = new CopyWorkItem("/src/missing.sst",
          "/dst/missing.sst", env, env, false, null, 0);
      pool.submit(missing);

      final CopyResult result = missing.result().join();
      assertThat(result.status().getCode()).isEqualTo(Status.Code.NotFound);
      assertThat(result.size()).isEqualTo(0);
    }
  }

  @Test(timeout = 10_000)
  public void errorKeepsWorkerAlive() throws RocksDBException {
    final FaultInjectionEnv dstEnv = new FaultInjectionEnv(env);
    FakeBackupableDB.write(env, "/src/0.sst", "x");
    try (final CopyWorkerPool pool =
             new CopyWorkerPool(1, new FileCopier(new AtomicBoolean()))) {
      dstEnv.beforeWrite(() -> {
        throw new AssertionError("injected");
      });
      final CopyWorkItem failing = new CopyWorkItem("/src/0.sst",
          "/dst/0.sst", env, dstEnv, false, null, 0);
      pool.submit(failing);
      assertThatThrownBy(() -> failing.result().join())
          .isInstanceOf(CompletionException.class)
          .hasCauseInstanceOf(AssertionError.class);
      assertThat(failing.result().isCompletedExceptionally()).isTrue();

      dstEnv.beforeWrite(null);
      final CopyWorkItem next = new CopyWorkItem("/src/0.sst",
          "/dst/0.sst", env, dstEnv, false, null, 0);
      pool.submit(next);
      assertThat(next.result().join().status().isOk()).isTrue();
      assertThat(FakeBackupableDB.read(env, "/dst/0.sst")).isEqualTo("x");
    }
  }

  @Test
  public void submitAfterClose() {
    final CopyWorkerPool pool =
        new CopyWorkerPool(2, new FileCopier(new AtomicBoolean()));
    pool.close();

    final CopyWorkItem item = new CopyWorkItem("/src/0.sst", "/dst/0.sst",
        env, env, false, null, 0);
    pool.submit(item);

    assertThat(item.result().isDone()).isTrue();
    assertThat(item.result().join().status().getCode())
        .isEqualTo(Status.Code.Incomplete);
  }

  @Test
  public void closeDrainsQueuedItems() throws RocksDBException {
    final CopyWorkerPool pool =
        new CopyWorkerPool(1, new FileCopier(new AtomicBoolean()));
    final List<CopyWorkItem> items = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      FakeBackupableDB.write(env, "/src/" + i + ".sst", "x");
      final CopyWorkItem item = new CopyWorkItem("/src/" + i + ".sst",
          "/dst/" + i + ".sst", env, env, false, null, 0);
      pool.submit(item);
      items.add(item);
    }
    pool.close();

    for (final CopyWorkItem item : items) {
      assertThat(item.result().isDone()).isTrue();
      assertThat(item.result().join().status().isOk()).isTrue();
    }
  }
}
