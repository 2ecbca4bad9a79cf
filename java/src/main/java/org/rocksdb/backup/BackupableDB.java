// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.List;

/**
 * <p>The view of a live database that {@link BackupEngine} needs in order
 * to take a consistent snapshot of its files while it keeps running.</p>
 *
 * <p>Between {@link #disableFileDeletions()} and
 * {@link #enableFileDeletions(boolean)} the database must not delete any
 * of the files it reported through {@link #getLiveFiles(boolean)} or
 * {@link #getSortedWalFiles()}.</p>
 */
public interface BackupableDB {

  /**
   * @return the directory holding the database files.
   */
  String getName();

  /**
   * @return the directory holding the write-ahead log files; may equal
   *     {@link #getName()}.
   */
  String getWalDir();

  /**
   * @return sequence number of the most recent transaction.
   */
  long getLatestSequenceNumber();

  /**
   * <p>Prevent file deletions. Compactions will continue to occur,
   * but no obsolete files will be deleted. Calling this multiple
   * times have the same effect as calling it once.</p>
   *
   * @throws RocksDBException thrown if operation was not performed
   *     successfully.
   */
  void disableFileDeletions() throws RocksDBException;

  /**
   * <p>Allow compactions to delete obsolete files.
   * If force == true, file deletions are enabled after the call even if
   * {@link #disableFileDeletions()} was called multiple times before.</p>
   *
   * @param force boolean value described above.
   *
   * @throws RocksDBException thrown if operation was not performed
   *     successfully.
   */
  void enableFileDeletions(boolean force) throws RocksDBException;

  /**
   * <p>Retrieve the list of all files in the database after flushing the
   * memtable.</p>
   *
   * @param flushMemtable set to true to flush before recoding the live
   *     files. Setting to false is useful when we don't want to wait for
   *     flush which may have to wait for compaction to complete taking an
   *     indeterminate time.
   *
   * @return the live files, named relative to {@link #getName()} with a
   *     leading {@code /}.
   *
   * @throws RocksDBException thrown if the files cannot be listed.
   */
  LiveFiles getLiveFiles(boolean flushMemtable) throws RocksDBException;

  /**
   * <p>Retrieve the sorted list of all wal files with earliest file
   * first.</p>
   *
   * @return the log files
   *
   * @throws RocksDBException if an error occurs whilst retrieving the list
   *     of sorted WAL files
   */
  List<LogFile> getSortedWalFiles() throws RocksDBException;
}
