// Copyright (c) Facebook, Inc. and its affiliates. All Rights Reserved.
package org.rocksdb.backup;

/**
 * Log levels understood by {@link Logger}. A message is emitted when its
 * level is at least the logger's configured level.
 */
public enum InfoLogLevel {
  DEBUG_LEVEL((byte)0),
  INFO_LEVEL((byte)1),
  WARN_LEVEL((byte)2),
  ERROR_LEVEL((byte)3),
  FATAL_LEVEL((byte)4),

  /**
   * Always emitted unless the logger is switched off, used for the options
   * dump written when a backup engine is opened.
   */
  HEADER_LEVEL((byte)5);

  private final byte value_;

  InfoLogLevel(final byte value) {
    value_ = value;
  }

  /**
   * Returns the byte value of the enumerations value
   *
   * @return byte representation
   */
  public byte getValue() {
    return value_;
  }
}
