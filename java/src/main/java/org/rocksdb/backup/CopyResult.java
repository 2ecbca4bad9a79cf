// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * Outcome of one file copy or checksum computation. A failed copy carries
 * its error in {@link #status()} rather than throwing.
 */
public final class CopyResult {
  private final long size;
  private final int checksum;
  private final Status status;

  public CopyResult(final long size, final int checksum, final Status status) {
    this.size = size;
    this.checksum = checksum;
    this.status = status;
  }

  static CopyResult failed(final Status status) {
    return new CopyResult(0, 0, status);
  }

  static CopyResult failed(final RocksDBException e) {
    return failed(e.getStatus() != null ? e.getStatus()
        : Status.ioError(e.getMessage()));
  }

  /**
   * @return number of bytes copied.
   */
  public long size() {
    return size;
  }

  /**
   * @return the CRC32C of the copied bytes, as an unsigned 32-bit value
   *     stored in an int.
   */
  public int checksum() {
    return checksum;
  }

  public Status status() {
    return status;
  }

  @Override
  public String toString() {
    return "CopyResult{size=" + size + ", checksum="
        + Integer.toUnsignedString(checksum) + ", status=" + status + "}";
  }
}
