// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.Locale;

/**
 * Counts the successful and failed backups made by a {@link BackupEngine}
 * since it was opened.
 */
public class BackupStatistics {
  private int numberSuccessBackup;
  private int numberFailBackup;

  void increaseNumberSuccessBackup() {
    numberSuccessBackup++;
  }

  void increaseNumberFailBackup() {
    numberFailBackup++;
  }

  public int numberSuccessBackup() {
    return numberSuccessBackup;
  }

  public int numberFailBackup() {
    return numberFailBackup;
  }

  BackupStatistics copy() {
    final BackupStatistics copy = new BackupStatistics();
    copy.numberSuccessBackup = numberSuccessBackup;
    copy.numberFailBackup = numberFailBackup;
    return copy;
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT,
        "# success backup: %d, # fail backup: %d", numberSuccessBackup,
        numberFailBackup);
  }
}
