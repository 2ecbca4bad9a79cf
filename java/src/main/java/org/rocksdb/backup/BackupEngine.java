// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BackupEngine allows you to backup
 * and restore the database
 *
 * Be aware, that {@link #open(Env, BackupEngineOptions)} takes time
 * proportional to the amount of backups. So if you have a slow filesystem to
 * backup and you have a lot of backups then opening can take some time.
 * That's why we recommend to limit the number of backups.
 * Also we recommend to keep BackupEngine alive and not to recreate it every
 * time you need to do a backup.
 *
 * <p>All operations are serialized on the engine; only
 * {@link #stopBackup()} may be called while another operation is running.</p>
 */
public class BackupEngine implements AutoCloseable {
  private final Env dbEnv;
  private final Env backupEnv;
  private final BackupEngineOptions options;
  private final BackupPaths paths;
  /* @Nullable */ private final Logger infoLog;
  private final boolean readOnly;

  private final AtomicBoolean stopBackup = new AtomicBoolean(false);
  private final FileCopier copier = new FileCopier(stopBackup);
  private final FileRegistry registry = new FileRegistry();
  private final TreeMap<Integer, BackupMeta> backups = new TreeMap<>();
  private final TreeMap<Integer, CorruptBackup> corruptBackups =
      new TreeMap<>();
  private final BackupStatistics backupStatistics = new BackupStatistics();
  private final List<RateLimiter> ownedRateLimiters = new ArrayList<>();
  /* @Nullable */ private final RateLimiter backupRateLimiter;
  /* @Nullable */ private final RateLimiter restoreRateLimiter;

  private int latestBackupId;
  private CopyWorkerPool workers;
  private boolean closed;

  BackupEngine(final Env env, final BackupEngineOptions options,
      final boolean readOnly) {
    this.dbEnv = env;
    this.backupEnv = options.backupEnv() != null ? options.backupEnv() : env;
    this.options = options;
    this.paths = new BackupPaths(options.backupDir());
    this.infoLog = options.infoLog();
    this.readOnly = readOnly;
    this.backupRateLimiter =
        rateLimiter(options.backupRateLimiter(), options.backupRateLimit());
    this.restoreRateLimiter =
        rateLimiter(options.restoreRateLimiter(), options.restoreRateLimit());
  }

  /**
   * Opens a new Backup Engine
   *
   * @param env The environment that the backup engine should operate within
   * @param options Any options for the backup engine
   *
   * @return A new BackupEngine instance
   * @throws RocksDBException thrown if the backup engine could not be opened
   */
  public static BackupEngine open(final Env env,
      final BackupEngineOptions options) throws RocksDBException {
    return open(env, options, false);
  }

  static BackupEngine open(final Env env, final BackupEngineOptions options,
      final boolean readOnly) throws RocksDBException {
    final BackupEngine engine = new BackupEngine(env, options, readOnly);
    try {
      engine.initialize();
    } catch (final RocksDBException e) {
      engine.close();
      throw e;
    }
    return engine;
  }

  private synchronized void initialize() throws RocksDBException {
    if (readOnly) {
      log(InfoLogLevel.INFO_LEVEL, "Starting read_only backup engine");
    }
    options.dump(infoLog);

    if (!readOnly) {
      backupEnv.createDirIfMissing(paths.backupDir());
      if (options.shareTableFiles()) {
        backupEnv.createDirIfMissing(paths.absolute(sharedDirRel()));
      }
      backupEnv.createDirIfMissing(paths.absolute(BackupPaths.PRIVATE_DIR));
      backupEnv.createDirIfMissing(paths.absolute(BackupPaths.META_DIR));
    }

    final String metaDir = paths.absolute(BackupPaths.META_DIR);
    for (final String file : backupEnv.getChildren(metaDir)) {
      log(InfoLogLevel.INFO_LEVEL, "Detected backup %s", file);
      final int backupId = parseBackupId(file);
      if (backupId == 0) {
        if (!readOnly) {
          // invalid file name, delete that
          log(InfoLogLevel.INFO_LEVEL,
              "Unrecognized meta file %s, deleting -- %s", file,
              deleteQuietly(metaDir + "/" + file));
        }
        continue;
      }
      backups.put(backupId, newBackupMeta(backupId));
    }

    latestBackupId = 0;
    if (options.destroyOldData()) {
      log(InfoLogLevel.INFO_LEVEL, "Backup Engine started with "
          + "destroy_old_data == true, deleting all backups");
      purgeOldBackups(0);
      garbageCollect();
    } else {
      for (final Map.Entry<Integer, BackupMeta> backup
          : new ArrayList<>(backups.entrySet())) {
        try {
          backup.getValue().loadFromFile(paths.backupDir());
          log(InfoLogLevel.INFO_LEVEL, "Loading backup %d OK:%n%s",
              backup.getKey(), backup.getValue().getInfoString());
        } catch (final RocksDBException e) {
          final Status status = statusOf(e);
          log(InfoLogLevel.WARN_LEVEL, "Backup %d corrupted -- %s",
              backup.getKey(), status);
          backups.remove(backup.getKey());
          corruptBackups.put(backup.getKey(),
              new CorruptBackup(status, backup.getValue()));
        }
      }
      latestBackupId = latestValidBackupId();
    }

    log(InfoLogLevel.INFO_LEVEL, "Latest backup is %d", latestBackupId);

    if (!readOnly) {
      putLatestBackupFileContents(latestBackupId);
    }

    workers = new CopyWorkerPool(options.maxBackgroundOperations(), copier);
    log(InfoLogLevel.INFO_LEVEL, "Initialized BackupEngine");
  }

  /**
   * Captures the state of the database in the latest backup
   *
   * Just a convenience for {@link #createNewBackup(BackupableDB, boolean)} with
   * the flushBeforeBackup parameter set to false
   *
   * @param db The database to backup
   *
   * @throws RocksDBException thrown if a new backup could not be created
   */
  public void createNewBackup(final BackupableDB db) throws RocksDBException {
    createNewBackup(db, false);
  }

  /**
   * Captures the state of the database in the latest backup
   *
   * @param db The database to backup
   * @param flushBeforeBackup When true, the Backup Engine will first issue a
   *                          memtable flush and only then copy the DB files to
   *                          the backup directory. Doing so will prevent log
   *                          files from being copied to the backup directory
   *                          (since flush will delete them).
   *                          When false, the Backup Engine will not issue a
   *                          flush before starting the backup. In that case,
   *                          the backup will also include log files
   *                          corresponding to live memtables. The backup will
   *                          always be consistent with the current state of the
   *                          database regardless of the flushBeforeBackup
   *                          parameter.
   *
   * @throws RocksDBException thrown if a new backup could not be created;
   *     {@link Status.Code#Incomplete} if it was stopped by
   *     {@link #stopBackup()}. A failed backup leaves no trace behind.
   */
  public synchronized void createNewBackup(final BackupableDB db,
      final boolean flushBeforeBackup) throws RocksDBException {
    checkWritable();
    final long sequenceNumber = db.getLatestSequenceNumber();
    final LiveFiles liveFiles;
    final List<LogFile> liveWalFiles;
    try {
      db.disableFileDeletions();
      // names are prefixed with "/"
      liveFiles = db.getLiveFiles(flushBeforeBackup);
      // if we didn't flush before backup, we need to also get WAL files
      liveWalFiles = !flushBeforeBackup && options.backupLogFiles()
          ? db.getSortedWalFiles() : new ArrayList<>();
    } catch (final RocksDBException e) {
      db.enableFileDeletions(false);
      throw e;
    }

    final int newBackupId = nextBackupId();
    final BackupMeta newBackup = newBackupMeta(newBackupId);
    backups.put(newBackupId, newBackup);
    newBackup.recordTimestamp();
    newBackup.setSequenceNumber(sequenceNumber);

    final long startBackup = backupEnv.nowMicros();
    log(InfoLogLevel.INFO_LEVEL,
        "Started the backup process -- creating backup %d", newBackupId);

    RocksDBException failure = null;
    final List<BackupAfterCopy> itemsToFinish = new ArrayList<>();
    try {
      removeOrphanedPrivateDirs(newBackupId);
      backupEnv.createDir(
          paths.absolute(BackupPaths.privateDirRel(newBackupId, true)));

      final Set<String> liveDstPaths = new HashSet<>();
      for (final String file : liveFiles.files) {
        final FileName parsed = FileName.parse(file);
        if (parsed == null) {
          throw new RocksDBException(Status.corruption(
              "Can't parse file name. This is very bad: " + file));
        }
        final boolean table = parsed.type() == FileType.kTableFile;
        // table files are shared, the manifest is cut at its valid size
        addBackupFileWorkItem(liveDstPaths, itemsToFinish, newBackupId,
            options.shareTableFiles() && table, db.getName(), file,
            parsed.type() == FileType.kDescriptorFile
                ? liveFiles.manifestFileSize : 0,
            options.shareFilesWithChecksum() && table);
      }
      for (final LogFile walFile : liveWalFiles) {
        // we only care about live log files
        if (walFile.type() == WalFileType.kAliveLogFile) {
          addBackupFileWorkItem(liveDstPaths, itemsToFinish, newBackupId,
              false, db.getWalDir(), walFile.pathName(), 0, false);
        }
      }
    } catch (final RocksDBException e) {
      failure = e;
    }

    // every copy is queued, the db may reclaim space again
    try {
      db.enableFileDeletions(false);
    } catch (final RocksDBException e) {
      if (failure == null) {
        failure = e;
      }
    }

    for (final BackupAfterCopy item : itemsToFinish) {
      final CopyResult result = await(item.result);
      try {
        if (!result.status().isOk()) {
          throw new RocksDBException(result.status());
        }
        if (item.shared && item.neededToCopy) {
          backupEnv.renameFile(item.dstPathTmp, item.dstPath);
        }
        newBackup.addFile(
            new FileInfo(item.dstRelative, result.size(), result.checksum()));
      } catch (final RocksDBException e) {
        if (failure == null) {
          failure = e;
        }
      }
    }

    long backupTime = 0;
    if (failure == null) {
      try {
        final String privateTmp =
            paths.absolute(BackupPaths.privateDirRel(newBackupId, true));
        final String privateDir =
            paths.absolute(BackupPaths.privateDirRel(newBackupId, false));
        log(InfoLogLevel.INFO_LEVEL,
            "Moving tmp backup directory to the real one: %s -> %s",
            privateTmp, privateDir);
        backupEnv.renameFile(privateTmp, privateDir);
        backupTime = backupEnv.nowMicros() - startBackup;
        // persist the backup metadata on the disk
        newBackup.storeToFile(options.sync());
        // install the newly created backup meta! (atomic)
        putLatestBackupFileContents(newBackupId);
        if (options.sync()) {
          fsyncDir(privateDir);
          fsyncDir(paths.absolute(BackupPaths.PRIVATE_DIR));
          fsyncDir(paths.absolute(BackupPaths.META_DIR));
          if (options.shareTableFiles()) {
            fsyncDir(paths.absolute(sharedDirRel()));
          }
          fsyncDir(paths.backupDir());
        }
      } catch (final RocksDBException e) {
        failure = e;
      }
    }

    if (failure != null) {
      backupStatistics.increaseNumberFailBackup();
      log(InfoLogLevel.ERROR_LEVEL, "Backup failed -- %s", statusOf(failure));
      log(InfoLogLevel.INFO_LEVEL, "Backup Statistics %s", backupStatistics);
      // delete files that we might have already written
      try {
        deleteBackup(newBackupId);
        garbageCollect();
      } catch (final RocksDBException cleanup) {
        log(InfoLogLevel.WARN_LEVEL,
            "Cleanup of failed backup %d incomplete -- %s", newBackupId,
            statusOf(cleanup));
        failure.addSuppressed(cleanup);
      }
      throw failure;
    }

    backupStatistics.increaseNumberSuccessBackup();
    latestBackupId = newBackupId;
    log(InfoLogLevel.INFO_LEVEL, "Backup DONE. All is good");

    // bytes per microsecond, in MB/s
    final double backupSpeed =
        newBackup.getSize() / (1.048576 * Math.max(1, backupTime));
    log(InfoLogLevel.INFO_LEVEL, "Backup number of files: %d",
        newBackup.getNumberFiles());
    log(InfoLogLevel.INFO_LEVEL, "Backup size: %s",
        BackupMeta.humanBytes(newBackup.getSize()));
    log(InfoLogLevel.INFO_LEVEL, "Backup time: %d microseconds", backupTime);
    log(InfoLogLevel.INFO_LEVEL, "Backup speed: %.3f MB/s", backupSpeed);
    log(InfoLogLevel.INFO_LEVEL, "Backup Statistics %s", backupStatistics);
  }

  /**
   * Resolves where a live file goes and either queues its copy or, when the
   * destination already holds it, records its checksum without copying.
   *
   * @param srcFname file name relative to {@code srcDir}, starting with
   *     {@code /}.
   */
  private void addBackupFileWorkItem(final Set<String> liveDstPaths,
      final List<BackupAfterCopy> itemsToFinish, final int backupId,
      final boolean shared, final String srcDir, final String srcFname,
      final long sizeLimit, final boolean sharedChecksum)
      throws RocksDBException {
    final String src = srcDir + srcFname;
    final String fname =
        srcFname.startsWith("/") ? srcFname.substring(1) : srcFname;
    String dstRelative;
    final String dstRelativeTmp;
    long size = 0;
    int checksum = 0;

    if (shared && sharedChecksum) {
      // add checksum and file length to the file name
      final CopyResult sum = copier.calculateChecksum(src, dbEnv, sizeLimit);
      size = sum.size();
      checksum = sum.checksum();
      final String withChecksum =
          BackupPaths.sharedFileWithChecksum(fname, checksum, size);
      dstRelativeTmp = BackupPaths.sharedFileWithChecksumRel(withChecksum, true);
      dstRelative = BackupPaths.sharedFileWithChecksumRel(withChecksum, false);
    } else if (shared) {
      dstRelativeTmp = BackupPaths.sharedFileRel(fname, true);
      dstRelative = BackupPaths.sharedFileRel(fname, false);
    } else {
      dstRelativeTmp = BackupPaths.privateFileRel(backupId, true, fname);
      dstRelative = BackupPaths.privateFileRel(backupId, false, fname);
    }
    final String dstPath = paths.absolute(dstRelative);
    final String dstPathTmp = paths.absolute(dstRelativeTmp);

    boolean needToCopy = true;
    // true if dstPath is the same path as another live file
    final boolean samePath = liveDstPaths.contains(dstPath);
    final boolean fileExists =
        shared && !samePath && backupEnv.fileExists(dstPath);

    if (shared && (samePath || fileExists)) {
      needToCopy = false;
      if (!samePath && !registry.contains(dstRelative)) {
        log(InfoLogLevel.INFO_LEVEL, "%s already present, but not "
            + "referenced by any backup. We will overwrite the file.",
            srcFname);
        needToCopy = true;
        backupEnv.deleteFile(dstPath);
      } else if (sharedChecksum) {
        log(InfoLogLevel.INFO_LEVEL,
            "%s already present, with checksum %s and size %d", srcFname,
            Integer.toUnsignedString(checksum), size);
      } else {
        log(InfoLogLevel.INFO_LEVEL, "%s already present, calculate checksum",
            srcFname);
        final CopyResult sum = copier.calculateChecksum(src, dbEnv, sizeLimit);
        size = sum.size();
        checksum = sum.checksum();
      }
    }
    liveDstPaths.add(dstPath);

    if (needToCopy) {
      log(InfoLogLevel.INFO_LEVEL, "Copying %s to %s", srcFname, dstPathTmp);
      final CopyWorkItem copyWorkItem = new CopyWorkItem(src, dstPathTmp,
          dbEnv, backupEnv, options.sync(), backupRateLimiter, sizeLimit);
      workers.submit(copyWorkItem);
      itemsToFinish.add(new BackupAfterCopy(copyWorkItem.result(), shared,
          true, dstPathTmp, dstPath, dstRelative));
    } else {
      itemsToFinish.add(new BackupAfterCopy(
          CompletableFuture.completedFuture(
              new CopyResult(size, checksum, Status.OK)),
          shared, false, dstPathTmp, dstPath, dstRelative));
    }
  }

  /**
   * Deletes old backups, keeping just the latest numBackupsToKeep
   *
   * @param numBackupsToKeep The latest n backups to keep
   *
   * @throws RocksDBException thrown if the old backups could not be deleted
   */
  public synchronized void purgeOldBackups(final int numBackupsToKeep)
      throws RocksDBException {
    checkWritable();
    log(InfoLogLevel.INFO_LEVEL, "Purging old backups, keeping %d",
        numBackupsToKeep);
    final List<Integer> toDelete = new ArrayList<>();
    for (final Integer backupId : backups.keySet()) {
      if (backups.size() - toDelete.size() <= numBackupsToKeep) {
        break;
      }
      toDelete.add(backupId);
    }
    for (final Integer backupId : toDelete) {
      deleteBackup(backupId);
    }
  }

  /**
   * Deletes a backup, valid or corrupt, together with every file no other
   * backup refers to.
   *
   * @param backupId The id of the backup to delete
   *
   * @throws RocksDBException thrown if the backup could not be deleted,
   *     {@link Status.Code#NotFound} if there is no such backup.
   */
  public synchronized void deleteBackup(final int backupId)
      throws RocksDBException {
    checkWritable();
    log(InfoLogLevel.INFO_LEVEL, "Deleting backup %d", backupId);
    final BackupMeta backup = backups.get(backupId);
    if (backup != null) {
      backup.delete(true);
      backups.remove(backupId);
    } else {
      final CorruptBackup corrupt = corruptBackups.get(backupId);
      if (corrupt == null) {
        throw new RocksDBException(Status.notFound("Backup not found"));
      }
      corrupt.meta.delete(true);
      corruptBackups.remove(backupId);
    }

    for (final FileInfo fileInfo : registry.entries()) {
      if (fileInfo.refs() == 0) {
        log(InfoLogLevel.INFO_LEVEL, "Deleting %s -- %s",
            fileInfo.filename(),
            deleteQuietly(paths.absolute(fileInfo.filename())));
        registry.remove(fileInfo.filename());
      }
    }

    deletePrivateDir(BackupPaths.privateDirRel(backupId, false));
    updateLatestBackup();
  }

  /**
   * Gets information about the available
   * backups
   *
   * @return A list of information about each available backup, oldest
   *     first
   */
  public synchronized List<BackupInfo> getBackupInfo() {
    final List<BackupInfo> backupInfo = new ArrayList<>(backups.size());
    for (final Map.Entry<Integer, BackupMeta> backup : backups.entrySet()) {
      final BackupMeta meta = backup.getValue();
      if (!meta.isEmpty()) {
        backupInfo.add(new BackupInfo(backup.getKey(), meta.getTimestamp(),
            meta.getSize(), meta.getNumberFiles()));
      }
    }
    return backupInfo;
  }

  /**
   * <p>Returns a list of corrupted backup ids. If there
   * is no corrupted backup the method will return an
   * empty list.</p>
   *
   * @return array of backup ids as int ids.
   */
  public synchronized int[] getCorruptedBackups() {
    final int[] ids = new int[corruptBackups.size()];
    int i = 0;
    for (final Integer backupId : corruptBackups.keySet()) {
      ids[i++] = backupId;
    }
    return ids;
  }

  /**
   * Restore the database from a backup
   *
   * IMPORTANT: if options.share_table_files == true and you restore the DB
   * from some backup that is not the latest, and you start creating new
   * backups from the new DB, they will probably fail!
   *
   * Example: Let's say you have backups 1, 2, 3, 4, 5 and you restore 3.
   * If you add new data to the DB and try creating a new backup now, the
   * database will diverge from backups 4 and 5 and the new backup will fail.
   * If you want to create new backup, you will first have to delete backups 4
   * and 5.
   *
   * A failed restore may leave {@code dbDir} partially populated.
   *
   * @param backupId The id of the backup to restore
   * @param dbDir The directory to restore the backup to, i.e. where your
   *              database is
   * @param walDir The location of the log files for your database,
   *               often the same as dbDir
   * @param restoreOptions Options for controlling the restore
   *
   * @throws RocksDBException thrown if the database could not be restored
   */
  public synchronized void restoreDbFromBackup(final int backupId,
      final String dbDir, final String walDir,
      final RestoreOptions restoreOptions) throws RocksDBException {
    checkOpen();
    final BackupMeta backup = validBackup(backupId);

    log(InfoLogLevel.INFO_LEVEL, "Restoring backup id %d", backupId);
    log(InfoLogLevel.INFO_LEVEL, "keep_log_files: %b",
        restoreOptions.keepLogFiles());

    dbEnv.createDirIfMissing(dbDir);
    dbEnv.createDirIfMissing(walDir);

    final String archiveDir = walDir + "/archive";
    if (restoreOptions.keepLogFiles()) {
      // delete files in db_dir, but keep all the log files
      deleteChildren(dbDir, true);
      // move all the files from archive dir to wal_dir
      if (dbEnv.fileExists(archiveDir)) {
        for (final String f : dbEnv.getChildren(archiveDir)) {
          final FileName parsed = FileName.parse(f);
          if (parsed != null && parsed.type() == FileType.kLogFile) {
            log(InfoLogLevel.INFO_LEVEL,
                "Moving log file from archive/ to wal_dir: %s", f);
            // failing here might mean data loss
            dbEnv.renameFile(archiveDir + "/" + f, walDir + "/" + f);
          }
        }
      }
    } else {
      deleteChildren(walDir, false);
      deleteChildren(archiveDir, false);
      deleteChildren(dbDir, false);
    }

    final List<String> destinations = new ArrayList<>();
    for (final FileInfo fileInfo : backup.getFiles()) {
      final String file = fileInfo.filename();
      // file is shared/<file>, shared_checksum/<file_crc32_size>
      // or private/<number>/<file>
      final int slash = file.lastIndexOf('/');
      String dst = file.substring(slash + 1);
      if (slash > 0 && file.substring(0, slash)
          .equals(BackupPaths.SHARED_CHECKSUM_DIR)) {
        dst = BackupPaths.fileFromChecksumFile(dst);
      }
      final FileName parsed = dst == null ? null : FileName.parse(dst);
      if (parsed == null) {
        throw new RocksDBException(Status.corruption("Backup corrupted"));
      }
      // log files live in wal_dir and all the rest live in db_dir
      destinations.add(
          (parsed.type() == FileType.kLogFile ? walDir : dbDir) + "/" + dst);
    }

    final List<RestoreAfterCopy> itemsToFinish = new ArrayList<>();
    for (int i = 0; i < destinations.size(); i++) {
      final FileInfo fileInfo = backup.getFiles().get(i);
      log(InfoLogLevel.INFO_LEVEL, "Restoring %s to %s",
          fileInfo.filename(), destinations.get(i));
      final CopyWorkItem copyWorkItem = new CopyWorkItem(
          paths.absolute(fileInfo.filename()), destinations.get(i),
          backupEnv, dbEnv, false, restoreRateLimiter, 0);
      workers.submit(copyWorkItem);
      itemsToFinish.add(
          new RestoreAfterCopy(copyWorkItem.result(), fileInfo.checksum()));
    }

    RocksDBException failure = null;
    for (final RestoreAfterCopy item : itemsToFinish) {
      final CopyResult result = await(item.result);
      if (failure != null) {
        continue;
      }
      if (!result.status().isOk()) {
        failure = new RocksDBException(result.status());
      } else if (item.checksum != result.checksum()) {
        failure = new RocksDBException(
            Status.corruption("Checksum check failed"));
      }
    }

    log(InfoLogLevel.INFO_LEVEL, "Restoring done -- %s",
        failure == null ? Status.OK : statusOf(failure));
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Restore the database from the latest backup
   *
   * @param dbDir The directory to restore the backup to, i.e. where your
   *              database is
   * @param walDir The location of the log files for your database, often the
   *               same as dbDir
   * @param restoreOptions Options for controlling the restore
   *
   * @throws RocksDBException thrown if the database could not be restored
   */
  public synchronized void restoreDbFromLatestBackup(final String dbDir,
      final String walDir, final RestoreOptions restoreOptions)
      throws RocksDBException {
    restoreDbFromBackup(latestBackupId, dbDir, walDir, restoreOptions);
  }

  /**
   * Checks that every file of a backup is present with its recorded size.
   *
   * @param backupId the backup to verify.
   *
   * @throws RocksDBException {@link Status.Code#NotFound} if the backup or
   *     one of its files is missing, {@link Status.Code#Corruption} if a
   *     file has the wrong size or the backup is corrupt.
   */
  public void verifyBackup(final int backupId) throws RocksDBException {
    verifyBackup(backupId, false);
  }

  /**
   * Checks that every file of a backup is present with its recorded size
   * and, optionally, its recorded checksum.
   *
   * @param backupId the backup to verify.
   * @param verifyWithChecksum also read every file and compare its CRC32C.
   *
   * @throws RocksDBException {@link Status.Code#NotFound} if the backup or
   *     one of its files is missing, {@link Status.Code#Corruption} if a
   *     file does not match or the backup is corrupt.
   */
  public synchronized void verifyBackup(final int backupId,
      final boolean verifyWithChecksum) throws RocksDBException {
    checkOpen();
    final BackupMeta backup = validBackup(backupId);

    log(InfoLogLevel.INFO_LEVEL, "Verifying backup id %d", backupId);
    for (final FileInfo fileInfo : backup.getFiles()) {
      final String file = fileInfo.filename();
      final String filePath = paths.absolute(file);
      if (!backupEnv.fileExists(filePath)) {
        throw new RocksDBException(Status.notFound("File missing: " + file));
      }
      if (backupEnv.getFileSize(filePath) != fileInfo.size()) {
        throw new RocksDBException(
            Status.corruption("File corrupted: " + file));
      }
      if (verifyWithChecksum && copier.calculateChecksum(
          filePath, backupEnv, 0).checksum() != fileInfo.checksum()) {
        throw new RocksDBException(
            Status.corruption("File corrupted: " + file));
      }
    }
  }

  /**
   * Call this from another thread if you want to stop the backup
   * that is currently happening. It will return immediately, will
   * not wait for the backup to stop.
   * The backup will stop ASAP and the call to createNewBackup will
   * return {@link Status.Code#Incomplete}. It will clean up after itself
   * and the state will remain consistent.
   * Every later backup and restore of this engine fails the same way.
   */
  public void stopBackup() {
    stopBackup.set(true);
  }

  /**
   * <p>Will delete all the files we don't need anymore. It will
   * do the full scan of the files/ directory and delete all the
   * files that are not referenced.</p>
   *
   * @throws RocksDBException thrown if a backup directory cannot be
   *     listed.
   */
  public synchronized void garbageCollect() throws RocksDBException {
    checkWritable();
    log(InfoLogLevel.INFO_LEVEL, "Starting garbage collection");

    // delete obsolete shared files
    for (final String sharedDir : new String[] {BackupPaths.SHARED_DIR,
        BackupPaths.SHARED_CHECKSUM_DIR}) {
      if (!backupEnv.fileExists(paths.absolute(sharedDir))) {
        continue;
      }
      for (final String child
          : backupEnv.getChildren(paths.absolute(sharedDir))) {
        final String relFname = sharedDir + "/" + child;
        final FileInfo fileInfo = registry.get(relFname);
        // if it's not refcounted, delete it
        if (fileInfo == null || fileInfo.refs() == 0) {
          log(InfoLogLevel.INFO_LEVEL, "Deleting %s -- %s", relFname,
              deleteQuietly(paths.absolute(relFname)));
          registry.remove(relFname);
        }
      }
    }

    // delete obsolete private dirs
    for (final String child
        : backupEnv.getChildren(paths.absolute(BackupPaths.PRIVATE_DIR))) {
      final boolean tmpDir = child.endsWith(BackupPaths.TMP_SUFFIX);
      final int backupId = parseBackupId(tmpDir
          ? child.substring(0, child.length() - BackupPaths.TMP_SUFFIX.length())
          : child);
      if (backupId == 0 || (!tmpDir && (backups.containsKey(backupId)
          || corruptBackups.containsKey(backupId)))) {
        // it's either not a number or it's still alive
        continue;
      }
      deletePrivateDir(BackupPaths.privateDirRel(backupId, tmpDir));
    }

    // leftovers of interrupted meta and LATEST_BACKUP writes
    final String metaDir = paths.absolute(BackupPaths.META_DIR);
    for (final String child : backupEnv.getChildren(metaDir)) {
      if (child.endsWith(BackupPaths.TMP_SUFFIX)) {
        log(InfoLogLevel.INFO_LEVEL, "Deleting %s -- %s", child,
            deleteQuietly(metaDir + "/" + child));
      }
    }
    final String latestTmp =
        paths.absolute(BackupPaths.latestBackupFileRel(true));
    if (backupEnv.fileExists(latestTmp)) {
      log(InfoLogLevel.INFO_LEVEL, "Deleting %s -- %s", latestTmp,
          deleteQuietly(latestTmp));
    }
  }

  /**
   * @return the number of successful and failed backups since this engine
   *     was opened.
   */
  public synchronized BackupStatistics getBackupStatistics() {
    return backupStatistics.copy();
  }

  /**
   * Waits for queued copies to finish, stops the copy threads and closes
   * the rate limiters the engine created itself.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (workers != null) {
      workers.close();
    }
    for (final RateLimiter rateLimiter : ownedRateLimiters) {
      rateLimiter.close();
    }
  }

  // this operation HAS to be atomic: write a tmp file and rename it
  private void putLatestBackupFileContents(final int latestBackup)
      throws RocksDBException {
    final String tmp = paths.absolute(BackupPaths.latestBackupFileRel(true));
    final byte[] contents =
        (latestBackup + "\n").getBytes(StandardCharsets.UTF_8);
    try (final WritableFile file = backupEnv.newWritableFile(tmp)) {
      file.append(contents, 0, contents.length);
      if (options.sync()) {
        file.sync();
      }
    }
    backupEnv.renameFile(tmp,
        paths.absolute(BackupPaths.latestBackupFileRel(false)));
  }

  private void updateLatestBackup() throws RocksDBException {
    final int latest = latestValidBackupId();
    if (latest != latestBackupId) {
      latestBackupId = latest;
      putLatestBackupFileContents(latest);
    }
  }

  private int latestValidBackupId() {
    return backups.isEmpty() ? 0 : backups.lastKey();
  }

  private int nextBackupId() {
    int latest = latestValidBackupId();
    if (!corruptBackups.isEmpty()) {
      latest = Math.max(latest, corruptBackups.lastKey());
    }
    return latest + 1;
  }

  private BackupMeta validBackup(final int backupId) throws RocksDBException {
    final CorruptBackup corrupt = corruptBackups.get(backupId);
    if (corrupt != null) {
      throw new RocksDBException(corrupt.status);
    }
    final BackupMeta backup = backups.get(backupId);
    if (backup == null || backup.isEmpty()) {
      throw new RocksDBException(Status.notFound("Backup not found"));
    }
    return backup;
  }

  private BackupMeta newBackupMeta(final int backupId) {
    return new BackupMeta(paths.absolute(BackupPaths.metaFileRel(backupId)),
        registry, backupEnv);
  }

  private String sharedDirRel() {
    return options.shareFilesWithChecksum()
        ? BackupPaths.SHARED_CHECKSUM_DIR : BackupPaths.SHARED_DIR;
  }

  private void removeOrphanedPrivateDirs(final int backupId)
      throws RocksDBException {
    for (final boolean tmp : new boolean[] {false, true}) {
      final String dir = paths.absolute(BackupPaths.privateDirRel(backupId, tmp));
      if (backupEnv.fileExists(dir)) {
        log(InfoLogLevel.INFO_LEVEL,
            "Removing orphaned private dir %s", dir);
        deletePrivateDir(BackupPaths.privateDirRel(backupId, tmp));
      }
    }
  }

  /**
   * Deletes a private backup dir and the files in it. Failures are logged;
   * whatever is left is picked up by the next garbage collection.
   */
  private void deletePrivateDir(final String privateDirRel) {
    final String fullPrivatePath = paths.absolute(privateDirRel);
    try {
      for (final String subchild : backupEnv.getChildren(fullPrivatePath)) {
        log(InfoLogLevel.INFO_LEVEL, "Deleting %s -- %s",
            fullPrivatePath + "/" + subchild,
            deleteQuietly(fullPrivatePath + "/" + subchild));
      }
      backupEnv.deleteDir(fullPrivatePath);
      log(InfoLogLevel.INFO_LEVEL, "Deleting private dir %s -- %s",
          privateDirRel, Status.OK);
    } catch (final RocksDBException e) {
      log(InfoLogLevel.INFO_LEVEL, "Deleting private dir %s -- %s",
          privateDirRel, statusOf(e));
    }
  }

  /**
   * Deletes the children of a restore target dir, keeping log files if
   * asked to.
   */
  private void deleteChildren(final String dir, final boolean keepLogFiles)
      throws RocksDBException {
    if (!dbEnv.fileExists(dir)) {
      return;
    }
    for (final String f : dbEnv.getChildren(dir)) {
      final FileName parsed = FileName.parse(f);
      if (keepLogFiles && parsed != null
          && parsed.type() == FileType.kLogFile) {
        // don't delete this file
        continue;
      }
      try {
        dbEnv.deleteFile(dir + "/" + f);
      } catch (final RocksDBException e) {
        log(InfoLogLevel.DEBUG_LEVEL, "Not deleting %s/%s -- %s", dir, f,
            statusOf(e));
      }
    }
  }

  /**
   * @return the outcome of the deletion, for logging.
   */
  private Status deleteQuietly(final String path) {
    try {
      backupEnv.deleteFile(path);
      return Status.OK;
    } catch (final RocksDBException e) {
      return statusOf(e);
    }
  }

  private void fsyncDir(final String dir) {
    try {
      backupEnv.fsyncDir(dir);
    } catch (final RocksDBException e) {
      log(InfoLogLevel.WARN_LEVEL, "Failed to fsync %s -- %s", dir,
          statusOf(e));
    }
  }

  private CopyResult await(final CompletableFuture<CopyResult> result) {
    try {
      return result.join();
    } catch (final CompletionException e) {
      log(InfoLogLevel.ERROR_LEVEL, "Copy failed unexpectedly -- %s",
          e.getCause());
      return CopyResult.failed(
          Status.ioError("Copy failed: " + e.getCause()));
    }
  }

  /* @Nullable */ private RateLimiter rateLimiter(
      /* @Nullable */ final RateLimiter configured, final long rateLimit) {
    if (configured != null) {
      return configured;
    }
    if (rateLimit > 0) {
      final RateLimiter rateLimiter = new RateLimiter(rateLimit);
      ownedRateLimiters.add(rateLimiter);
      return rateLimiter;
    }
    return null;
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("BackupEngine is closed");
    }
  }

  private void checkWritable() {
    checkOpen();
    if (readOnly) {
      throw new IllegalStateException("BackupEngine is read-only");
    }
  }

  private void log(final InfoLogLevel level, final String format,
      final Object... args) {
    if (infoLog != null) {
      infoLog.logf(level, format, args);
    }
  }

  /**
   * @return the id named by {@code name}, or 0 if it is not a canonical
   *     positive decimal number.
   */
  static int parseBackupId(final String name) {
    if (name.isEmpty() || name.length() > 10 || name.charAt(0) == '0') {
      return 0;
    }
    long id = 0;
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (c < '0' || c > '9') {
        return 0;
      }
      id = id * 10 + (c - '0');
    }
    return id > Integer.MAX_VALUE ? 0 : (int) id;
  }

  static Status statusOf(final RocksDBException e) {
    return e.getStatus() != null ? e.getStatus()
        : Status.ioError(e.getMessage());
  }

  private static final class CorruptBackup {
    private final Status status;
    private final BackupMeta meta;

    private CorruptBackup(final Status status, final BackupMeta meta) {
      this.status = status;
      this.meta = meta;
    }
  }

  private static final class BackupAfterCopy {
    private final CompletableFuture<CopyResult> result;
    private final boolean shared;
    private final boolean neededToCopy;
    private final String dstPathTmp;
    private final String dstPath;
    private final String dstRelative;

    private BackupAfterCopy(final CompletableFuture<CopyResult> result,
        final boolean shared, final boolean neededToCopy,
        final String dstPathTmp, final String dstPath,
        final String dstRelative) {
      this.result = result;
      this.shared = shared;
      this.neededToCopy = neededToCopy;
      this.dstPathTmp = dstPathTmp;
      this.dstPath = dstPath;
      this.dstRelative = dstRelative;
    }
  }

  private static final class RestoreAfterCopy {
    private final CompletableFuture<CopyResult> result;
    private final int checksum;

    private RestoreAfterCopy(final CompletableFuture<CopyResult> result,
        final int checksum) {
      this.result = result;
      this.checksum = checksum;
    }
  }
}
