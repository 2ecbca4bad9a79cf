// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * A RocksDBException encapsulates the failure of a backup engine, environment
 * or rate limiter operation. The attached {@link Status} tells callers which
 * kind of failure occurred, e.g. {@link Status.Code#Corruption} for a checksum
 * mismatch or {@link Status.Code#Incomplete} for a stopped backup.
 */
public class RocksDBException extends Exception {
  private static final long serialVersionUID = -5187634878466267120L;

  /**
   * The error status that led to this exception.
   */
  /* @Nullable */ private final Status status;

  /**
   * Constructs a RocksDBException without a status.
   *
   * @param message the specified error message.
   */
  public RocksDBException(final String message) {
    this(message, (Status) null);
  }

  /**
   * Constructs a RocksDBException.
   *
   * @param message the detail message. The detail message is saved for later retrieval by the
   *     {@link #getMessage()} method.
   * @param status the error status that led to this exception.
   */
  public RocksDBException(final String message, final Status status) {
    super(message);
    this.status = status;
  }

  /**
   * Constructs a RocksDBException.
   *
   * @param status the error status that led to this exception.
   */
  public RocksDBException(final Status status) {
    super(status.getState() != null ? status.getState()
        : status.getCodeString());
    this.status = status;
  }

  /**
   * Constructs a RocksDBException wrapping a lower level failure,
   * typically an {@link java.io.IOException} raised by the filesystem.
   *
   * @param status the error status that led to this exception.
   * @param cause the underlying failure.
   */
  public RocksDBException(final Status status, final Throwable cause) {
    super(status.getState() != null ? status.getState()
        : status.getCodeString(), cause);
    this.status = status;
  }

  /**
   * Get the status attached to this exception
   *
   * @return The status, or null if no status is available
   */
  public Status getStatus() {
    return status;
  }
}
