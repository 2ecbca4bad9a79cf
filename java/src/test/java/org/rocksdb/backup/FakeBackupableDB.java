// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link BackupableDB} whose files are whatever the test puts into its
 * directory.
 */
class FakeBackupableDB implements BackupableDB {
  private final Env env;
  private final String name;
  private final String walDir;
  private final List<String> liveFiles = new ArrayList<>();
  private final List<LogFile> walFiles = new ArrayList<>();
  private long manifestFileSize = -1;
  private long sequenceNumber;

  int disableFileDeletionsCalls;
  int enableFileDeletionsCalls;
  /* @Nullable */ Runnable onEnableFileDeletions;

  FakeBackupableDB(final Env env, final String name) throws RocksDBException {
    this(env, name, name);
  }

  FakeBackupableDB(final Env env, final String name, final String walDir)
      throws RocksDBException {
    this.env = env;
    this.name = name;
    this.walDir = walDir;
    env.createDirIfMissing(name);
    env.createDirIfMissing(walDir);
  }

  /**
   * Writes a file into the db dir and reports it as live.
   */
  FakeBackupableDB putLiveFile(final String fname, final String content)
      throws RocksDBException {
    writeFile(name + "/" + fname, content);
    if (!liveFiles.contains("/" + fname)) {
      liveFiles.add("/" + fname);
    }
    sequenceNumber++;
    return this;
  }

  FakeBackupableDB removeLiveFile(final String fname) throws RocksDBException {
    liveFiles.remove("/" + fname);
    env.deleteFile(name + "/" + fname);
    return this;
  }

  FakeBackupableDB putWalFile(final String fname, final String content,
      final WalFileType type) throws RocksDBException {
    writeFile(walDir + "/" + fname, content);
    walFiles.add(new LogFile("/" + fname, walFiles.size() + 1, type,
        sequenceNumber, content.length()));
    return this;
  }

  FakeBackupableDB setManifestFileSize(final long manifestFileSize) {
    this.manifestFileSize = manifestFileSize;
    return this;
  }

  String readFile(final String fname) throws RocksDBException {
    return read(env, name + "/" + fname);
  }

  void writeFile(final String path, final String content)
      throws RocksDBException {
    write(env, path, content);
  }

  static void write(final Env env, final String path, final String content)
      throws RocksDBException {
    final byte[] data = content.getBytes(StandardCharsets.UTF_8);
    try (final WritableFile file = env.newWritableFile(path)) {
      file.append(data, 0, data.length);
    }
  }

  static String read(final Env env, final String path)
      throws RocksDBException {
    final byte[] buf = new byte[(int) env.getFileSize(path)];
    int len = 0;
    try (final SequentialFile file = env.newSequentialFile(path)) {
      int n;
      while (len < buf.length && (n = file.read(buf, len, buf.length - len)) > 0) {
        len += n;
      }
    }
    return new String(buf, 0, len, StandardCharsets.UTF_8);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getWalDir() {
    return walDir;
  }

  @Override
  public long getLatestSequenceNumber() {
    return sequenceNumber;
  }

  @Override
  public void disableFileDeletions() {
    disableFileDeletionsCalls++;
  }

  @Override
  public void enableFileDeletions(final boolean force) {
    enableFileDeletionsCalls++;
    if (onEnableFileDeletions != null) {
      onEnableFileDeletions.run();
    }
  }

  @Override
  public LiveFiles getLiveFiles(final boolean flushMemtable)
      throws RocksDBException {
    long manifestSize = manifestFileSize;
    if (manifestSize < 0) {
      manifestSize = 0;
      for (final String file : liveFiles) {
        if (file.startsWith("/MANIFEST-")) {
          manifestSize = env.getFileSize(name + file);
        }
      }
    }
    return new LiveFiles(manifestSize, new ArrayList<>(liveFiles));
  }

  @Override
  public List<LogFile> getSortedWalFiles() {
    return new ArrayList<>(walFiles);
  }
}
