// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.CRC32C;

/**
 * Streams files in fixed size chunks while computing their CRC32C.
 *
 * <p>Both operations check the shared stop flag before every chunk and
 * give up with {@link Status.Code#Incomplete} once it is raised.</p>
 */
class FileCopier {
  static final int DEFAULT_COPY_BUFFER_SIZE = 5 * 1024 * 1024;

  private final AtomicBoolean stopped;

  FileCopier(final AtomicBoolean stopped) {
    this.stopped = stopped;
  }

  /**
   * Copies {@code src} to {@code dst}, truncating any existing destination.
   *
   * @param rateLimiter throttles the copy, may be null.
   * @param sizeLimit maximum number of bytes to copy, 0 for no limit.
   *
   * @return size and checksum of the copied bytes, never an error status.
   *
   * @throws RocksDBException if the copy fails or is stopped.
   */
  CopyResult copyFile(final String src, final String dst, final Env srcEnv,
      final Env dstEnv, final boolean sync,
      /* @Nullable */ final RateLimiter rateLimiter, final long sizeLimit)
      throws RocksDBException {
    long remaining = sizeLimit == 0 ? Long.MAX_VALUE : sizeLimit;
    long size = 0;
    final CRC32C crc = new CRC32C();
    final byte[] buffer = new byte[bufferSize(rateLimiter)];

    try (final SequentialFile srcFile = srcEnv.newSequentialFile(src);
         final WritableFile dstFile = dstEnv.newWritableFile(dst)) {
      while (true) {
        checkStopped();
        final int toRead = (int) Math.min(buffer.length, remaining);
        final int n = toRead == 0 ? 0 : srcFile.read(buffer, 0, toRead);
        if (n == 0) {
          break;
        }
        if (rateLimiter != null) {
          rateLimiter.request(n, IOPriority.IO_LOW);
        }
        remaining -= n;
        size += n;
        crc.update(buffer, 0, n);
        dstFile.append(buffer, 0, n);
      }
      if (sync) {
        dstFile.sync();
      }
    }
    return new CopyResult(size, (int) crc.getValue(), Status.OK);
  }

  /**
   * Computes the CRC32C of the first {@code sizeLimit} bytes of a file.
   *
   * @param sizeLimit maximum number of bytes to read, 0 for no limit.
   *
   * @return size and checksum of the bytes read.
   *
   * @throws RocksDBException if the file cannot be read or the backup is
   *     stopped.
   */
  CopyResult calculateChecksum(final String src, final Env srcEnv,
      final long sizeLimit) throws RocksDBException {
    long remaining = sizeLimit == 0 ? Long.MAX_VALUE : sizeLimit;
    long size = 0;
    final CRC32C crc = new CRC32C();
    final byte[] buffer = new byte[DEFAULT_COPY_BUFFER_SIZE];

    try (final SequentialFile srcFile = srcEnv.newSequentialFile(src)) {
      while (true) {
        checkStopped();
        final int toRead = (int) Math.min(buffer.length, remaining);
        final int n = toRead == 0 ? 0 : srcFile.read(buffer, 0, toRead);
        if (n == 0) {
          break;
        }
        remaining -= n;
        size += n;
        crc.update(buffer, 0, n);
      }
    }
    return new CopyResult(size, (int) crc.getValue(), Status.OK);
  }

  private void checkStopped() throws RocksDBException {
    if (stopped.get()) {
      throw new RocksDBException(Status.incomplete("Backup stopped"));
    }
  }

  private static int bufferSize(/* @Nullable */ final RateLimiter rateLimiter) {
    if (rateLimiter == null) {
      return DEFAULT_COPY_BUFFER_SIZE;
    }
    return (int) Math.min(DEFAULT_COPY_BUFFER_SIZE,
        rateLimiter.getSingleBurstBytes());
  }
}
