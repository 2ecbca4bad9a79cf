// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.concurrent.CompletableFuture;

/**
 * A single copy handed to the {@link CopyWorkerPool}. The worker that
 * picks it up completes {@link #result()}.
 */
final class CopyWorkItem {
  final String srcPath;
  final String dstPath;
  final Env srcEnv;
  final Env dstEnv;
  final boolean sync;
  /* @Nullable */ final RateLimiter rateLimiter;
  final long sizeLimit;
  private final CompletableFuture<CopyResult> result =
      new CompletableFuture<>();

  /**
   * @param sizeLimit maximum number of bytes to copy, 0 for the whole file.
   */
  CopyWorkItem(final String srcPath, final String dstPath, final Env srcEnv,
      final Env dstEnv, final boolean sync,
      /* @Nullable */ final RateLimiter rateLimiter, final long sizeLimit) {
    this.srcPath = srcPath;
    this.dstPath = dstPath;
    this.srcEnv = srcEnv;
    this.dstEnv = dstEnv;
    this.sync = sync;
    this.rateLimiter = rateLimiter;
    this.sizeLimit = sizeLimit;
  }

  CompletableFuture<CopyResult> result() {
    return result;
  }
}
