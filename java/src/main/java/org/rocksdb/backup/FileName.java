// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * A database file name decomposed into its {@link FileType} and file
 * number.
 */
public final class FileName {
  private final FileType type;
  private final long number;

  private FileName(final FileType type, final long number) {
    this.type = type;
    this.number = number;
  }

  public FileType type() {
    return type;
  }

  /**
   * @return the file number, or 0 for files that carry none such as
   *     {@code CURRENT}.
   */
  public long number() {
    return number;
  }

  /**
   * <p>Parses the name of a file that lives in a database directory.
   * Accepted forms:</p>
   * <pre>
   *   dbname/IDENTITY
   *   dbname/CURRENT
   *   dbname/LOCK
   *   dbname/LOG
   *   dbname/LOG.old.[0-9]+
   *   dbname/MANIFEST-[0-9]+
   *   dbname/OPTIONS-[0-9]+
   *   dbname/[0-9]+.(log|sst|ldb|dbtmp)
   * </pre>
   *
   * @param fname a bare file name, optionally with a leading {@code /}.
   *
   * @return the parsed name, or null if {@code fname} is not a database
   *     file name.
   */
  public static /* @Nullable */ FileName parse(final String fname) {
    final String name = fname.startsWith("/") ? fname.substring(1) : fname;
    switch (name) {
      case "IDENTITY":
        return new FileName(FileType.kIdentityFile, 0);
      case "CURRENT":
        return new FileName(FileType.kCurrentFile, 0);
      case "LOCK":
        return new FileName(FileType.kDBLockFile, 0);
      case "LOG":
        return new FileName(FileType.kInfoLogFile, 0);
      default:
        break;
    }

    if (name.startsWith("LOG.old.")) {
      final long ts = parseNumber(name.substring("LOG.old.".length()));
      return ts < 0 ? null : new FileName(FileType.kInfoLogFile, 0);
    }
    if (name.startsWith("MANIFEST-")) {
      return numbered(FileType.kDescriptorFile,
          name.substring("MANIFEST-".length()));
    }
    if (name.startsWith("OPTIONS-")) {
      return numbered(FileType.kOptionsFile,
          name.substring("OPTIONS-".length()));
    }

    final int dot = name.indexOf('.');
    if (dot <= 0) {
      return null;
    }
    final long num = parseNumber(name.substring(0, dot));
    if (num < 0) {
      return null;
    }
    switch (name.substring(dot + 1)) {
      case "log":
        return new FileName(FileType.kLogFile, num);
      case "sst":
      case "ldb":
        return new FileName(FileType.kTableFile, num);
      case "dbtmp":
        return new FileName(FileType.kTempFile, num);
      default:
        return null;
    }
  }

  private static FileName numbered(final FileType type, final String digits) {
    final long num = parseNumber(digits);
    return num < 0 ? null : new FileName(type, num);
  }

  /**
   * @return the decimal value of {@code digits}, or -1 if it is empty,
   *     holds a non-digit or overflows.
   */
  private static long parseNumber(final String digits) {
    if (digits.isEmpty()) {
      return -1;
    }
    long value = 0;
    for (int i = 0; i < digits.length(); i++) {
      final char c = digits.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
      final int d = c - '0';
      if (value > (Long.MAX_VALUE - d) / 10) {
        return -1;
      }
      value = value * 10 + d;
    }
    return value;
  }
}
