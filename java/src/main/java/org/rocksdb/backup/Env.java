// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.List;

/**
 * <p>An Env is the interface used by the backup engine to access
 * operating system functionality like the filesystem.</p>
 *
 * <p>All Env implementations are safe for concurrent access from
 * multiple threads without any external synchronization.</p>
 *
 * <p>Paths are plain strings using {@code /} as separator. Failures are
 * reported as {@link RocksDBException}s carrying
 * {@link Status.Code#NotFound} for missing files and directories and
 * {@link Status.Code#IOError} for everything else.</p>
 */
public abstract class Env {

  /**
   * <p>Returns the default environment suitable for the current operating
   * system.</p>
   *
   * @return the default {@link RocksEnv} instance.
   */
  public static Env getDefault() {
    return RocksEnv.getDefault();
  }

  public abstract SequentialFile newSequentialFile(String fname)
      throws RocksDBException;

  public abstract WritableFile newWritableFile(String fname)
      throws RocksDBException;

  public abstract boolean fileExists(String fname) throws RocksDBException;

  public abstract long getFileSize(String fname) throws RocksDBException;

  /**
   * Lists the names (not paths) of the entries of a directory.
   *
   * @param dir the directory to list.
   *
   * @return the child names in no particular order.
   *
   * @throws RocksDBException {@link Status.Code#NotFound} if the directory
   *     does not exist.
   */
  public abstract List<String> getChildren(String dir) throws RocksDBException;

  /**
   * Creates a directory; fails if it already exists.
   *
   * @param dir the directory to create.
   *
   * @throws RocksDBException if the directory exists or cannot be created.
   */
  public abstract void createDir(String dir) throws RocksDBException;

  public abstract void createDirIfMissing(String dir) throws RocksDBException;

  public abstract void deleteFile(String fname) throws RocksDBException;

  /**
   * Deletes an empty directory.
   *
   * @param dir the directory to delete.
   *
   * @throws RocksDBException if the directory is missing or not empty.
   */
  public abstract void deleteDir(String dir) throws RocksDBException;

  /**
   * Atomically renames a file or directory, replacing an existing target
   * file.
   *
   * @param src the current name.
   * @param target the new name.
   *
   * @throws RocksDBException if the rename fails.
   */
  public abstract void renameFile(String src, String target)
      throws RocksDBException;

  /**
   * Persists the entries of a directory, so that files created or renamed
   * inside it survive a crash.
   *
   * @param dir the directory to sync.
   *
   * @throws RocksDBException if the directory cannot be synced.
   */
  public abstract void fsyncDir(String dir) throws RocksDBException;

  public long nowMicros() {
    return System.currentTimeMillis() * 1000L;
  }

  /**
   * @return the number of seconds since the epoch.
   */
  public long getCurrentTime() {
    return System.currentTimeMillis() / 1000L;
  }
}
