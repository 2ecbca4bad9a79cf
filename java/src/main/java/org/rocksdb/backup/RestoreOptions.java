// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * RestoreOptions to control the behavior of restore.
 */
public class RestoreOptions {
  private final boolean keepLogFiles;

  /**
   * Constructor
   *
   * @param keepLogFiles If true, restore won't overwrite the existing log files
   *   in wal_dir. It will also move all log files from archive directory to
   *   wal_dir. Use this option in combination with
   *   {@link BackupEngineOptions#setBackupLogFiles(boolean)} = false for
   *   persisting in-memory databases.
   *   Default: false
   */
  public RestoreOptions(final boolean keepLogFiles) {
    this.keepLogFiles = keepLogFiles;
  }

  public RestoreOptions() {
    this(false);
  }

  public boolean keepLogFiles() {
    return keepLogFiles;
  }
}
