// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * <p>BackupEngineOptions controls the behavior of a
 * {@link BackupEngine}.</p>
 *
 * <p>All setters return the options instance so calls can be chained.</p>
 *
 * @see BackupEngine
 */
public class BackupEngineOptions {
  private final String backupDir;
  /* @Nullable */ private Env backupEnv;
  private boolean shareTableFiles = true;
  /* @Nullable */ private Logger infoLog;
  private boolean sync = true;
  private boolean destroyOldData = false;
  private boolean backupLogFiles = true;
  private long backupRateLimit = 0;
  /* @Nullable */ private RateLimiter backupRateLimiter;
  private long restoreRateLimit = 0;
  /* @Nullable */ private RateLimiter restoreRateLimiter;
  private boolean shareFilesWithChecksum = false;
  private int maxBackgroundOperations = 1;

  /**
   * <p>BackupEngineOptions constructor.</p>
   *
   * @param path Where to keep the backup files. Has to be different than db
   *     name. Best to set this to {@code db name_ + "/backups"}
   *
   * @throws java.lang.IllegalArgumentException if illegal path is used.
   */
  public BackupEngineOptions(final String path) {
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("Illegal path provided.");
    }
    this.backupDir = path;
  }

  /**
   * <p>Returns the path to the BackupEngine directory.</p>
   *
   * @return the path to the BackupEngine directory.
   */
  public String backupDir() {
    return backupDir;
  }

  /**
   * Backup Env object. It will be used for backup file I/O. If it's
   * null, backups will be written out using DBs Env. Otherwise
   * backup's I/O will be performed using this object.
   *
   * If you want to have backups on HDFS, use HDFS Env here!
   *
   * Default: null
   *
   * @param env The environment to use
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setBackupEnv(final Env env) {
    this.backupEnv = env;
    return this;
  }

  /**
   * Backup Env object. It will be used for backup file I/O. If it's
   * null, backups will be written out using DBs Env. Otherwise
   * backup's I/O will be performed using this object.
   *
   * Default: null
   *
   * @return The environment in use
   */
  public Env backupEnv() {
    return backupEnv;
  }

  /**
   * <p>Share table files between backups.</p>
   *
   * @param shareTableFiles If {@code share_table_files == true}, backup will
   *     assume that table files with same name have the same contents. This
   *     enables incremental backups and avoids unnecessary data copies. If
   *     {@code share_table_files == false}, each backup will be on its own and
   *     will not share any data with other backups.
   *
   * <p>Default: true</p>
   *
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setShareTableFiles(final boolean shareTableFiles) {
    this.shareTableFiles = shareTableFiles;
    return this;
  }

  /**
   * <p>Share table files between backups.</p>
   *
   * @return boolean value indicating if SST files will be shared between
   *     backups.
   */
  public boolean shareTableFiles() {
    return shareTableFiles;
  }

  /**
   * Set the logger to use for Backup info and error messages
   *
   * @param logger The logger to use for the backup
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setInfoLog(final Logger logger) {
    this.infoLog = logger;
    return this;
  }

  /**
   * Set the logger to use for Backup info and error messages
   *
   * Default: null
   *
   * @return The logger in use for the backup
   */
  public Logger infoLog() {
    return infoLog;
  }

  /**
   * <p>Set synchronous backups.</p>
   *
   * @param sync If {@code sync == true}, we can guarantee you'll get consistent
   *     backup even on a machine crash/reboot. Backup process is slower with sync
   *     enabled. If {@code sync == false}, we don't guarantee anything on machine
   *     reboot. However, chances are some of the backups are consistent.
   *
   * <p>Default: true</p>
   *
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setSync(final boolean sync) {
    this.sync = sync;
    return this;
  }

  /**
   * <p>Are synchronous backups activated.</p>
   *
   * @return boolean value if synchronous backups are configured.
   */
  public boolean sync() {
    return sync;
  }

  /**
   * <p>Set if old data will be destroyed.</p>
   *
   * @param destroyOldData If true, it will delete whatever backups there are
   *     already.
   *
   * <p>Default: false</p>
   *
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setDestroyOldData(final boolean destroyOldData) {
    this.destroyOldData = destroyOldData;
    return this;
  }

  /**
   * <p>Returns if old data will be destroyed will performing new backups.</p>
   *
   * @return boolean value indicating if old data will be destroyed.
   */
  public boolean destroyOldData() {
    return destroyOldData;
  }

  /**
   * <p>Set if log files shall be persisted.</p>
   *
   * @param backupLogFiles If false, we won't backup log files. This option can
   *     be useful for backing up in-memory databases where log file are
   *     persisted, but table files are in memory.
   *
   * <p>Default: true</p>
   *
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setBackupLogFiles(final boolean backupLogFiles) {
    this.backupLogFiles = backupLogFiles;
    return this;
  }

  /**
   * <p>Return information if log files shall be persisted.</p>
   *
   * @return boolean value indicating if log files will be persisted.
   */
  public boolean backupLogFiles() {
    return backupLogFiles;
  }

  /**
   * <p>Set backup rate limit.</p>
   *
   * @param backupRateLimit Max bytes that can be transferred in a second during
   *     backup. If 0 or negative, then go as fast as you can.
   *
   * <p>Default: 0</p>
   *
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setBackupRateLimit(final long backupRateLimit) {
    this.backupRateLimit = (backupRateLimit <= 0) ? 0 : backupRateLimit;
    return this;
  }

  /**
   * <p>Return backup rate limit which described the max bytes that can be
   * transferred in a second during backup.</p>
   *
   * @return numerical value describing the backup transfer limit in bytes per
   *     second.
   */
  public long backupRateLimit() {
    return backupRateLimit;
  }

  /**
   * Backup rate limiter. Used to control transfer speed for backup. If this is
   * not null, {@link #backupRateLimit()} is ignored.
   *
   * Default: null
   *
   * @param backupRateLimiter The rate limiter to use for the backup
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setBackupRateLimiter(
      final RateLimiter backupRateLimiter) {
    this.backupRateLimiter = backupRateLimiter;
    return this;
  }

  /**
   * Backup rate limiter. Used to control transfer speed for backup. If this is
   * not null, {@link #backupRateLimit()} is ignored.
   *
   * Default: null
   *
   * @return The rate limiter in use for the backup
   */
  public RateLimiter backupRateLimiter() {
    return backupRateLimiter;
  }

  /**
   * <p>Set restore rate limit.</p>
   *
   * @param restoreRateLimit Max bytes that can be transferred in a second
   *     during restore. If 0 or negative, then go as fast as you can.
   *
   * <p>Default: 0</p>
   *
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setRestoreRateLimit(final long restoreRateLimit) {
    this.restoreRateLimit = (restoreRateLimit <= 0) ? 0 : restoreRateLimit;
    return this;
  }

  /**
   * <p>Return restore rate limit which described the max bytes that can be
   * transferred in a second during restore.</p>
   *
   * @return numerical value describing the restore transfer limit in bytes per
   *     second.
   */
  public long restoreRateLimit() {
    return restoreRateLimit;
  }

  /**
   * Restore rate limiter. Used to control transfer speed during restore. If
   * this is not null, {@link #restoreRateLimit()} is ignored.
   *
   * Default: null
   *
   * @param restoreRateLimiter The rate limiter to use during restore
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setRestoreRateLimiter(
      final RateLimiter restoreRateLimiter) {
    this.restoreRateLimiter = restoreRateLimiter;
    return this;
  }

  /**
   * Restore rate limiter. Used to control transfer speed during restore. If
   * this is not null, {@link #restoreRateLimit()} is ignored.
   *
   * Default: null
   *
   * @return The rate limiter in use during restore
   */
  public RateLimiter restoreRateLimiter() {
    return restoreRateLimiter;
  }

  /**
   * <p>Only used if share_table_files is set to true. If true, will consider
   * that backups can come from different databases, hence a sst is not
   * uniquely identified by its name, but by the triple
   * (file name, crc32, file length)</p>
   *
   * @param shareFilesWithChecksum boolean value indicating if SST files are
   *     stored using the triple (file name, crc32, file length) and not its name.
   *
   * <p>Note: this is an experimental option, and you'll need to set it manually
   * turn it on only if you know what you're doing*</p>
   *
   * <p>Default: false</p>
   *
   * @return instance of current BackupEngineOptions.
   */
  public BackupEngineOptions setShareFilesWithChecksum(
      final boolean shareFilesWithChecksum) {
    this.shareFilesWithChecksum = shareFilesWithChecksum;
    return this;
  }

  /**
   * <p>Return of share files with checksum is active.</p>
   *
   * @return boolean value indicating if share files with checksum
   *     is active.
   */
  public boolean shareFilesWithChecksum() {
    return shareFilesWithChecksum;
  }

  /**
   * Up to this many background threads will copy files for
   * {@link BackupEngine#createNewBackup(BackupableDB, boolean)} and
   * {@link BackupEngine#restoreDbFromBackup(int, String, String, RestoreOptions)}
   *
   * Default: 1
   *
   * @param maxBackgroundOperations The maximum number of background threads
   * @return instance of current BackupEngineOptions.
   *
   * @throws IllegalArgumentException if the value is less than 1.
   */
  public BackupEngineOptions setMaxBackgroundOperations(
      final int maxBackgroundOperations) {
    if (maxBackgroundOperations < 1) {
      throw new IllegalArgumentException(
          "maxBackgroundOperations must be at least 1: "
              + maxBackgroundOperations);
    }
    this.maxBackgroundOperations = maxBackgroundOperations;
    return this;
  }

  /**
   * Up to this many background threads will copy files.
   *
   * Default: 1
   *
   * @return The maximum number of background threads
   */
  public int maxBackgroundOperations() {
    return maxBackgroundOperations;
  }

  /**
   * Writes every option to the given logger at
   * {@link InfoLogLevel#INFO_LEVEL}.
   *
   * @param logger the logger to write to, may be null.
   */
  public void dump(/* @Nullable */ final Logger logger) {
    if (logger == null) {
      return;
    }
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "               Options.backup_dir: %s", backupDir);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "               Options.backup_env: %s", backupEnv);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "        Options.share_table_files: %b", shareTableFiles);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "                 Options.info_log: %s", infoLog);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "                     Options.sync: %b", sync);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "         Options.destroy_old_data: %b", destroyOldData);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "         Options.backup_log_files: %b", backupLogFiles);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "        Options.backup_rate_limit: %d", backupRateLimit);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "       Options.restore_rate_limit: %d", restoreRateLimit);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "Options.share_files_with_checksum: %b", shareFilesWithChecksum);
    logger.logf(InfoLogLevel.INFO_LEVEL,
        "Options.max_background_operations: %d", maxBackgroundOperations);
  }
}
