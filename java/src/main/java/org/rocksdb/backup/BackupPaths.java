// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * Names of the files and directories inside a backup directory. Methods
 * ending in {@code Rel} return paths relative to the backup directory.
 */
final class BackupPaths {
  static final String PRIVATE_DIR = "private";
  static final String SHARED_DIR = "shared";
  static final String SHARED_CHECKSUM_DIR = "shared_checksum";
  static final String META_DIR = "meta";
  static final String LATEST_BACKUP = "LATEST_BACKUP";
  static final String TMP_SUFFIX = ".tmp";

  private final String backupDir;

  BackupPaths(final String backupDir) {
    this.backupDir = backupDir.endsWith("/") && backupDir.length() > 1
        ? backupDir.substring(0, backupDir.length() - 1) : backupDir;
  }

  String backupDir() {
    return backupDir;
  }

  String absolute(final String relativePath) {
    return backupDir + "/" + relativePath;
  }

  static String privateDirRel(final int backupId, final boolean tmp) {
    return PRIVATE_DIR + "/" + backupId + (tmp ? TMP_SUFFIX : "");
  }

  static String privateFileRel(final int backupId, final boolean tmp,
      final String file) {
    return privateDirRel(backupId, tmp) + "/" + file;
  }

  static String sharedFileRel(final String file, final boolean tmp) {
    return SHARED_DIR + "/" + file + (tmp ? TMP_SUFFIX : "");
  }

  static String sharedFileWithChecksumRel(final String file,
      final boolean tmp) {
    return SHARED_CHECKSUM_DIR + "/" + file + (tmp ? TMP_SUFFIX : "");
  }

  static boolean isSharedChecksumFile(final String relativePath) {
    return relativePath.startsWith(SHARED_CHECKSUM_DIR + "/");
  }

  /**
   * {@code 000010.sst} becomes {@code 000010_<checksum>_<size>.sst}.
   */
  static String sharedFileWithChecksum(final String file, final int checksum,
      final long size) {
    final String suffix = "_" + Integer.toUnsignedString(checksum) + "_" + size;
    final int dot = file.lastIndexOf('.');
    if (dot < 0) {
      return file + suffix;
    }
    return file.substring(0, dot) + suffix + file.substring(dot);
  }

  /**
   * Reverses {@link #sharedFileWithChecksum(String, int, long)}.
   *
   * @return the original file name, or null if {@code file} does not carry
   *     a checksum and size.
   */
  static /* @Nullable */ String fileFromChecksumFile(final String file) {
    final int underscore = file.indexOf('_');
    if (underscore < 0) {
      return null;
    }
    final int dot = file.lastIndexOf('.');
    if (dot < underscore) {
      return file.substring(0, underscore);
    }
    return file.substring(0, underscore) + file.substring(dot);
  }

  static String metaFileRel(final int backupId) {
    return META_DIR + "/" + backupId;
  }

  static String latestBackupFileRel(final boolean tmp) {
    return LATEST_BACKUP + (tmp ? TMP_SUFFIX : "");
  }
}
