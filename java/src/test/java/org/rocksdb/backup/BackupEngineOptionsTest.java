// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.Test;

public class BackupEngineOptionsTest {
  private static final String ARBITRARY_PATH = System.getProperty("java.io.tmpdir");

  public static final Random rand = new Random();

  @Test
  public void backupDir() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.backupDir()).isEqualTo(ARBITRARY_PATH);
  }

  @Test
  public void env() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.backupEnv()).isNull();

    final Env env = new RocksMemEnv();
    backupEngineOptions.setBackupEnv(env);
    assertThat(backupEngineOptions.backupEnv()).isEqualTo(env);
  }

  @Test
  public void shareTableFiles() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.shareTableFiles()).isTrue();
    final boolean value = rand.nextBoolean();
    backupEngineOptions.setShareTableFiles(value);
    assertThat(backupEngineOptions.shareTableFiles()).isEqualTo(value);
  }

  @Test
  public void infoLog() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.infoLog()).isNull();

    final Logger logger = new Logger(InfoLogLevel.INFO_LEVEL) {
      @Override
      protected void log(final InfoLogLevel infoLogLevel, final String logMsg) {}
    };
    backupEngineOptions.setInfoLog(logger);
    assertThat(backupEngineOptions.infoLog()).isEqualTo(logger);
  }

  @Test
  public void sync() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.sync()).isTrue();
    final boolean value = rand.nextBoolean();
    backupEngineOptions.setSync(value);
    assertThat(backupEngineOptions.sync()).isEqualTo(value);
  }

  @Test
  public void destroyOldData() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.destroyOldData()).isFalse();
    final boolean value = rand.nextBoolean();
    backupEngineOptions.setDestroyOldData(value);
    assertThat(backupEngineOptions.destroyOldData()).isEqualTo(value);
  }

  @Test
  public void backupLogFiles() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.backupLogFiles()).isTrue();
    final boolean value = rand.nextBoolean();
    backupEngineOptions.setBackupLogFiles(value);
    assertThat(backupEngineOptions.backupLogFiles()).isEqualTo(value);
  }

  @Test
  public void backupRateLimit() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    final long value = Math.abs(rand.nextLong());
    backupEngineOptions.setBackupRateLimit(value);
    assertThat(backupEngineOptions.backupRateLimit()).isEqualTo(value);
    // negative will be mapped to 0
    backupEngineOptions.setBackupRateLimit(-1);
    assertThat(backupEngineOptions.backupRateLimit()).isEqualTo(0);
  }

  @Test
  public void backupRateLimiter() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.backupRateLimiter()).isNull();

    try(final RateLimiter backupRateLimiter =
            new RateLimiter(999)) {
      backupEngineOptions.setBackupRateLimiter(backupRateLimiter);
      assertThat(backupEngineOptions.backupRateLimiter()).isEqualTo(backupRateLimiter);
    }
  }

  @Test
  public void restoreRateLimit() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    final long value = Math.abs(rand.nextLong());
    backupEngineOptions.setRestoreRateLimit(value);
    assertThat(backupEngineOptions.restoreRateLimit()).isEqualTo(value);
    // negative will be mapped to 0
    backupEngineOptions.setRestoreRateLimit(-1);
    assertThat(backupEngineOptions.restoreRateLimit()).isEqualTo(0);
  }

  @Test
  public void restoreRateLimiter() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.restoreRateLimiter()).isNull();

    try(final RateLimiter restoreRateLimiter =
            new RateLimiter(911)) {
      backupEngineOptions.setRestoreRateLimiter(restoreRateLimiter);
      assertThat(backupEngineOptions.restoreRateLimiter()).isEqualTo(restoreRateLimiter);
    }
  }

  @Test
  public void shareFilesWithChecksum() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.shareFilesWithChecksum()).isFalse();
    final boolean value = rand.nextBoolean();
    backupEngineOptions.setShareFilesWithChecksum(value);
    assertThat(backupEngineOptions.shareFilesWithChecksum()).isEqualTo(value);
  }

  @Test
  public void maxBackgroundOperations() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThat(backupEngineOptions.maxBackgroundOperations()).isEqualTo(1);
    final int value = 1 + rand.nextInt(64);
    backupEngineOptions.setMaxBackgroundOperations(value);
    assertThat(backupEngineOptions.maxBackgroundOperations()).isEqualTo(value);
  }

  @Test
  public void failMaxBackgroundOperationsBelowOne() {
    final BackupEngineOptions backupEngineOptions = new BackupEngineOptions(ARBITRARY_PATH);
    assertThatThrownBy(() -> backupEngineOptions.setMaxBackgroundOperations(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void failBackupDirIsNull() {
    assertThatThrownBy(() -> new BackupEngineOptions(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void failBackupDirIsEmpty() {
    assertThatThrownBy(() -> new BackupEngineOptions(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void dumpLogsEveryOption() {
    final List<String> messages = new ArrayList<>();
    final Logger logger = new Logger(InfoLogLevel.INFO_LEVEL) {
      @Override
      protected void log(final InfoLogLevel infoLogLevel, final String logMsg) {
        messages.add(logMsg);
      }
    };
    new BackupEngineOptions("/backups").setMaxBackgroundOperations(4)
        .dump(logger);

    assertThat(messages).hasSize(11);
    assertThat(messages).anyMatch(m -> m.endsWith("Options.backup_dir: /backups"));
    assertThat(messages)
        .anyMatch(m -> m.endsWith("Options.max_background_operations: 4"));

    // a missing logger is ignored
    new BackupEngineOptions("/backups").dump(null);
  }
}
