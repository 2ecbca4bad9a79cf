// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * A file stored in a backup directory, shared by every backup that lists
 * it. {@link #refs()} counts those backups.
 */
public final class FileInfo {
  private final String filename;
  private final long size;
  private final int checksum;
  private int refs;

  /**
   * @param filename path relative to the backup directory, without a
   *     leading {@code /}.
   * @param size the file size in bytes.
   * @param checksum CRC32C of the content, unsigned.
   */
  public FileInfo(final String filename, final long size, final int checksum) {
    this.filename = filename;
    this.size = size;
    this.checksum = checksum;
  }

  public String filename() {
    return filename;
  }

  public long size() {
    return size;
  }

  public int checksum() {
    return checksum;
  }

  public int refs() {
    return refs;
  }

  void incrementRefs() {
    ++refs;
  }

  void decrementRefs() {
    if (refs == 0) {
      throw new IllegalStateException("refs of " + filename + " already 0");
    }
    --refs;
  }

  @Override
  public String toString() {
    return filename + " (size " + size + ", crc32 "
        + Integer.toUnsignedString(checksum) + ", refs " + refs + ")";
  }
}
