// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Before;
import org.junit.Test;

public class BackupMetaTest {
  private static final String BACKUP_DIR = "/backup";
  private static final String META_FILE = BACKUP_DIR + "/meta/1";

  private RocksMemEnv env;
  private FileRegistry registry;

  @Before
  public void setUp() throws RocksDBException {
    env = new RocksMemEnv();
    registry = new FileRegistry();
    env.createDirIfMissing(BACKUP_DIR + "/meta");
    env.createDirIfMissing(BACKUP_DIR + "/shared");
    env.createDirIfMissing(BACKUP_DIR + "/private/1");
    FakeBackupableDB.write(env, BACKUP_DIR + "/shared/000010.sst", "0123456789");
    FakeBackupableDB.write(env, BACKUP_DIR + "/private/1/CURRENT", "MANIFEST-1\n");
  }

  @Test
  public void storeAndLoad() throws RocksDBException {
    final BackupMeta stored = new BackupMeta(META_FILE, registry, env);
    stored.recordTimestamp();
    stored.setSequenceNumber(42);
    stored.addFile(new FileInfo("shared/000010.sst", 10, -5));
    stored.addFile(new FileInfo("private/1/CURRENT", 11, 77));
    stored.storeToFile(true);

    assertThat(env.fileExists(META_FILE + ".tmp")).isFalse();
    assertThat(FakeBackupableDB.read(env, META_FILE)).isEqualTo(
        stored.getTimestamp() + "\n42\n2\n"
            + "shared/000010.sst crc32 4294967291\n"
            + "private/1/CURRENT crc32 77\n");

    final FileRegistry loadedRegistry = new FileRegistry();
    final BackupMeta loaded = new BackupMeta(META_FILE, loadedRegistry, env);
    loaded.loadFromFile(BACKUP_DIR);

    assertThat(loaded.getTimestamp()).isEqualTo(stored.getTimestamp());
    assertThat(loaded.getSequenceNumber()).isEqualTo(42);
    assertThat(loaded.getNumberFiles()).isEqualTo(2);
    // sizes come from the files on disk
    assertThat(loaded.getSize()).isEqualTo(21);
    assertThat(loaded.getFile("shared/000010.sst").checksum()).isEqualTo(-5);
    assertThat(loaded.getFile("shared/000010.sst").refs()).isEqualTo(1);
  }

  @Test
  public void addFileSharesReferences() throws RocksDBException {
    final BackupMeta first = new BackupMeta(META_FILE, registry, env);
    final BackupMeta second = new BackupMeta(BACKUP_DIR + "/meta/2", registry, env);
    first.addFile(new FileInfo("shared/000010.sst", 10, 1));
    second.addFile(new FileInfo("shared/000010.sst", 10, 1));

    assertThat(registry.size()).isEqualTo(1);
    assertThat(registry.get("shared/000010.sst").refs()).isEqualTo(2);
    assertThat(second.getSize()).isEqualTo(10);

    first.delete(false);
    assertThat(first.isEmpty()).isTrue();
    assertThat(first.getSize()).isEqualTo(0);
    assertThat(registry.get("shared/000010.sst").refs()).isEqualTo(1);
    second.delete(false);
    // unreferenced files stay registered until their owner deletes them
    assertThat(registry.get("shared/000010.sst").refs()).isEqualTo(0);
  }

  @Test
  public void addFileWithDifferentChecksum() throws RocksDBException {
    final BackupMeta first = new BackupMeta(META_FILE, registry, env);
    first.addFile(new FileInfo("shared/000010.sst", 10, 1));
    final BackupMeta second = new BackupMeta(BACKUP_DIR + "/meta/2", registry, env);

    assertThatThrownBy(() -> second.addFile(new FileInfo("shared/000010.sst", 10, 2)))
        .isInstanceOf(RocksDBException.class)
        .satisfies(e -> assertThat(((RocksDBException) e).getStatus().getCode())
            .isEqualTo(Status.Code.Corruption));
    assertThat(second.isEmpty()).isTrue();
  }

  @Test
  public void addSharedChecksumFileWithDifferentSize() throws RocksDBException {
    final BackupMeta first = new BackupMeta(META_FILE, registry, env);
    first.addFile(new FileInfo("shared_checksum/000010_1_10.sst", 10, 1));

    assertThatThrownBy(() -> first.addFile(
        new FileInfo("shared_checksum/000010_1_10.sst", 11, 1)))
        .isInstanceOf(RocksDBException.class)
        .hasMessageContaining("Checksum mismatch for existing backup file");
  }

  @Test
  public void deleteRemovesMetaFile() throws RocksDBException {
    final BackupMeta meta = new BackupMeta(META_FILE, registry, env);
    meta.addFile(new FileInfo("shared/000010.sst", 10, 1));
    meta.storeToFile(false);
    assertThat(env.fileExists(META_FILE)).isTrue();

    meta.delete(true);
    assertThat(env.fileExists(META_FILE)).isFalse();
    // a missing meta file is fine
    meta.delete(true);
  }

  @Test
  public void loadChecksumMissing() throws RocksDBException {
    assertCorruption("1\n2\n1\nshared/000010.sst\n", "File checksum is missing");
  }

  @Test
  public void loadUnknownChecksumType() throws RocksDBException {
    assertCorruption("1\n2\n1\nshared/000010.sst md5 12\n", "Unknown checksum type");
  }

  @Test
  public void loadInvalidChecksumValue() throws RocksDBException {
    assertCorruption("1\n2\n1\nshared/000010.sst crc32 0012\n",
        "Invalid checksum value");
    assertCorruption("1\n2\n1\nshared/000010.sst crc32 4294967296\n",
        "Invalid checksum value");
    assertCorruption("1\n2\n1\nshared/000010.sst crc32 \n",
        "Invalid checksum value");
  }

  @Test
  public void loadTrailingData() throws RocksDBException {
    assertCorruption("1\n2\n1\nshared/000010.sst crc32 12\nextra\n",
        "Tailing data in backup meta file");
    assertCorruption("1\n2\n0\nshared/000010.sst crc32 12\n",
        "Tailing data in backup meta file");
  }

  @Test
  public void loadMissingEntries() throws RocksDBException {
    assertCorruption("1\n2\n2\nshared/000010.sst crc32 12\n",
        "Missing file entries");
    assertCorruption("1\n2\n", "Missing number of files");
    assertCorruption("", "Missing timestamp");
  }

  @Test
  public void loadInvalidHeader() throws RocksDBException {
    assertCorruption("abc\n2\n0\n", "Invalid timestamp");
    assertCorruption("1\n-2\n0\n", "Invalid sequence number");
  }

  @Test
  public void loadMissingFile() throws RocksDBException {
    FakeBackupableDB.write(env, META_FILE, "1\n2\n1\nshared/000099.sst crc32 12\n");
    final BackupMeta meta = new BackupMeta(META_FILE, registry, env);

    assertThatThrownBy(() -> meta.loadFromFile(BACKUP_DIR))
        .isInstanceOf(RocksDBException.class)
        .satisfies(e -> assertThat(((RocksDBException) e).getStatus().getCode())
            .isEqualTo(Status.Code.NotFound));
  }

  @Test
  public void loadTooBig() throws RocksDBException {
    final byte[] data = new byte[BackupMeta.MAX_META_FILE_SIZE];
    try (final WritableFile file = env.newWritableFile(META_FILE)) {
      file.append(data, 0, data.length);
    }
    final BackupMeta meta = new BackupMeta(META_FILE, registry, env);

    assertThatThrownBy(() -> meta.loadFromFile(BACKUP_DIR))
        .isInstanceOf(RocksDBException.class)
        .hasMessageContaining("File size too big");
  }

  @Test
  public void humanBytes() {
    assertThat(BackupMeta.humanBytes(512)).isEqualTo("512B");
    assertThat(BackupMeta.humanBytes(1536)).isEqualTo("1.50KB");
    assertThat(BackupMeta.humanBytes(3L << 20)).isEqualTo("3.00MB");
    assertThat(BackupMeta.humanBytes(5L << 30)).isEqualTo("5.00GB");
  }

  private void assertCorruption(final String contents, final String message)
      throws RocksDBException {
    FakeBackupableDB.write(env, META_FILE, contents);
    final BackupMeta meta = new BackupMeta(META_FILE, registry, env);

    assertThatThrownBy(() -> meta.loadFromFile(BACKUP_DIR))
        .isInstanceOf(RocksDBException.class)
        .hasMessageContaining(message)
        .satisfies(e -> assertThat(((RocksDBException) e).getStatus().getCode())
            .isEqualTo(Status.Code.Corruption));
    assertThat(meta.isEmpty()).isTrue();
    assertThat(registry.size()).isEqualTo(0);
  }
}
