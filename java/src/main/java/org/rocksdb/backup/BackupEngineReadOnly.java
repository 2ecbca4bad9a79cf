// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.List;

/**
 * A {@link BackupEngine} that never writes to the backup directory. It can
 * list, verify and restore backups, for example while another process owns
 * the directory.
 */
public class BackupEngineReadOnly implements AutoCloseable {
  private final BackupEngine engine;

  private BackupEngineReadOnly(final BackupEngine engine) {
    this.engine = engine;
  }

  /**
   * Opens a read-only Backup Engine
   *
   * @param env The environment that the backup engine should operate within
   * @param options Any options for the backup engine
   *
   * @return A new BackupEngineReadOnly instance
   * @throws RocksDBException {@link Status.Code#InvalidArgument} if
   *     {@link BackupEngineOptions#destroyOldData()} is set, or any error
   *     reading the backup directory
   */
  public static BackupEngineReadOnly open(final Env env,
      final BackupEngineOptions options) throws RocksDBException {
    if (options.destroyOldData()) {
      throw new RocksDBException(Status.invalidArgument(
          "Can't destroy old data with ReadOnly BackupEngine"));
    }
    return new BackupEngineReadOnly(BackupEngine.open(env, options, true));
  }

  /**
   * @see BackupEngine#getBackupInfo()
   *
   * @return A list of information about each available backup
   */
  public List<BackupInfo> getBackupInfo() {
    return engine.getBackupInfo();
  }

  /**
   * @see BackupEngine#getCorruptedBackups()
   *
   * @return array of backup ids as int ids.
   */
  public int[] getCorruptedBackups() {
    return engine.getCorruptedBackups();
  }

  public void restoreDbFromBackup(final int backupId, final String dbDir,
      final String walDir, final RestoreOptions restoreOptions)
      throws RocksDBException {
    engine.restoreDbFromBackup(backupId, dbDir, walDir, restoreOptions);
  }

  public void restoreDbFromLatestBackup(final String dbDir,
      final String walDir, final RestoreOptions restoreOptions)
      throws RocksDBException {
    engine.restoreDbFromLatestBackup(dbDir, walDir, restoreOptions);
  }

  public void verifyBackup(final int backupId) throws RocksDBException {
    engine.verifyBackup(backupId);
  }

  public void verifyBackup(final int backupId,
      final boolean verifyWithChecksum) throws RocksDBException {
    engine.verifyBackup(backupId, verifyWithChecksum);
  }

  @Override
  public void close() {
    engine.close();
  }
}
