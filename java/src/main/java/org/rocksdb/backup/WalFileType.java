// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

public enum WalFileType {
  /**
   * Indicates that WAL file is in archive directory. WAL files are moved
   * from the main db directory to archive directory once they are not live
   * and stay there until cleaned up.
   */
  kArchivedLogFile,

  /**
   * Indicates that WAL file is live and resides in the main db directory
   */
  kAliveLogFile
}
