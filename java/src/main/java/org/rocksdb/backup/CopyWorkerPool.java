// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.ArrayList;
import java.util.List;
import org.rocksdb.backup.util.Channel;

/**
 * A fixed set of threads that drain a {@link Channel} of
 * {@link CopyWorkItem}s. Errors end up in the {@link CopyResult} of the
 * item, the worker itself keeps running.
 */
class CopyWorkerPool implements AutoCloseable {
  private final Channel<CopyWorkItem> files = new Channel<>();
  private final List<Thread> threads = new ArrayList<>();
  private final FileCopier copier;

  CopyWorkerPool(final int numThreads, final FileCopier copier) {
    this.copier = copier;
    for (int i = 0; i < numThreads; i++) {
      final Thread t = new Thread(this::run, "rocksdb:backup-copy-" + i);
      t.setDaemon(true);
      threads.add(t);
    }
    for (final Thread t : threads) {
      t.start();
    }
  }

  /**
   * Queues a copy; if the pool is already closed the item completes right
   * away with {@link Status.Code#Incomplete}.
   */
  void submit(final CopyWorkItem item) {
    if (!files.write(item)) {
      item.result().complete(
          CopyResult.failed(Status.incomplete("Backup engine is closed")));
    }
  }

  int numThreads() {
    return threads.size();
  }

  private void run() {
    CopyWorkItem item;
    while ((item = files.read()) != null) {
      CopyResult result;
      try {
        result = copier.copyFile(item.srcPath, item.dstPath, item.srcEnv,
            item.dstEnv, item.sync, item.rateLimiter, item.sizeLimit);
      } catch (final RocksDBException e) {
        result = CopyResult.failed(e);
      } catch (final Throwable t) {
        item.result().completeExceptionally(t);
        continue;
      }
      item.result().complete(result);
    }
  }

  /**
   * Lets the workers finish the queued items and waits for them to exit.
   */
  @Override
  public void close() {
    files.sendEof();
    boolean interrupted = false;
    for (final Thread t : threads) {
      while (t.isAlive()) {
        try {
          t.join();
        } catch (final InterruptedException e) {
          interrupted = true;
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
