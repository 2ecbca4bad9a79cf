// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The description of one backup: when it was taken, the sequence number it
 * covers and the backup directory files it consists of.
 *
 * <p>Each backup meta file is of the format:</p>
 * <pre>
 * &lt;timestamp&gt;
 * &lt;seq number&gt;
 * &lt;number of files&gt;
 * &lt;file1&gt; crc32 &lt;crc32_value&gt;
 * &lt;file2&gt; crc32 &lt;crc32_value&gt;
 * ...
 * </pre>
 */
class BackupMeta {
  static final int MAX_META_FILE_SIZE = 10 * 1024 * 1024;
  private static final String CHECKSUM_PREFIX = "crc32 ";

  private final String metaFilename;
  private final FileRegistry registry;
  private final Env env;

  private long timestamp;
  // only approximate, not to be relied on by clients
  private long sequenceNumber;
  private long size;
  // relative paths, without a leading "/"
  private final List<FileInfo> files = new ArrayList<>();

  BackupMeta(final String metaFilename, final FileRegistry registry,
      final Env env) {
    this.metaFilename = metaFilename;
    this.registry = registry;
    this.env = env;
  }

  void recordTimestamp() {
    timestamp = env.getCurrentTime();
  }

  long getTimestamp() {
    return timestamp;
  }

  long getSize() {
    return size;
  }

  int getNumberFiles() {
    return files.size();
  }

  void setSequenceNumber(final long sequenceNumber) {
    this.sequenceNumber = sequenceNumber;
  }

  long getSequenceNumber() {
    return sequenceNumber;
  }

  boolean isEmpty() {
    return files.isEmpty();
  }

  List<FileInfo> getFiles() {
    return Collections.unmodifiableList(files);
  }

  /* @Nullable */ FileInfo getFile(final String filename) {
    return registry.get(filename);
  }

  /**
   * Adds a file to this backup, registering it on first use and taking a
   * reference otherwise.
   *
   * @param fileInfo the file as it was copied or found.
   *
   * @throws RocksDBException with {@link Status.Code#Corruption} if the
   *     registry already tracks the file with different content.
   */
  void addFile(final FileInfo fileInfo) throws RocksDBException {
    FileInfo tracked = registry.get(fileInfo.filename());
    if (tracked == null) {
      tracked = fileInfo;
      registry.put(tracked);
    } else if (tracked.checksum() != fileInfo.checksum()
        || (BackupPaths.isSharedChecksumFile(fileInfo.filename())
            && tracked.size() != fileInfo.size())) {
      throw new RocksDBException(Status.corruption(
          "Checksum mismatch for existing backup file. Delete old backups "
              + "and try again."));
    }
    tracked.incrementRefs();

    size += tracked.size();
    files.add(tracked);
  }

  /**
   * Drops this backup's references to its files and optionally its meta
   * file. Files whose reference count drops to 0 stay in the registry.
   *
   * @param deleteMeta whether to delete the meta file.
   *
   * @throws RocksDBException if the meta file exists but cannot be deleted.
   */
  void delete(final boolean deleteMeta) throws RocksDBException {
    for (final FileInfo file : files) {
      file.decrementRefs();
    }
    files.clear();
    size = 0;
    timestamp = 0;
    if (deleteMeta && env.fileExists(metaFilename)) {
      env.deleteFile(metaFilename);
    }
  }

  /**
   * Reads and registers the files listed in the meta file.
   *
   * @param backupDir the backup directory the relative file names are
   *     resolved against.
   *
   * @throws RocksDBException {@link Status.Code#Corruption} if the meta file
   *     is malformed or conflicts with the registry, or the error of the
   *     {@link Env} if a file cannot be read.
   */
  void loadFromFile(final String backupDir) throws RocksDBException {
    final String data = readMetaFile();
    final String[] lines = data.split("\n", -1);
    int line = 0;

    final long loadedTimestamp = parseHeader(lines, line++, "timestamp");
    final long loadedSequenceNumber =
        parseHeader(lines, line++, "sequence number");
    final long numFiles = parseHeader(lines, line++, "number of files");

    final List<FileInfo> loaded = new ArrayList<>();
    for (long i = 0; i < numFiles; i++) {
      if (line >= lines.length - 1) {
        throw corruption("Missing file entries in " + metaFilename);
      }
      final String entry = lines[line++];
      final int space = entry.indexOf(' ');
      final String filename = space < 0 ? entry : entry.substring(0, space);

      final FileInfo tracked = registry.get(filename);
      final long fileSize = tracked != null ? tracked.size()
          : env.getFileSize(backupDir + "/" + filename);

      if (space < 0) {
        throw corruption("File checksum is missing for " + filename
            + " in " + metaFilename);
      }
      final String checksum = entry.substring(space + 1);
      if (!checksum.startsWith(CHECKSUM_PREFIX)) {
        throw corruption("Unknown checksum type for " + filename + " in "
            + metaFilename);
      }
      final String value = checksum.substring(CHECKSUM_PREFIX.length());
      final int checksumValue;
      try {
        checksumValue = Integer.parseUnsignedInt(value);
      } catch (final NumberFormatException e) {
        throw corruption("Invalid checksum value for " + filename + " in "
            + metaFilename);
      }
      if (!value.equals(Integer.toUnsignedString(checksumValue))) {
        throw corruption("Invalid checksum value for " + filename + " in "
            + metaFilename);
      }
      loaded.add(new FileInfo(filename, fileSize, checksumValue));
    }

    // everything up to the final newline has to be consumed
    if (line != lines.length - 1 || !lines[line].isEmpty()) {
      throw corruption("Tailing data in backup meta file in "
          + metaFilename);
    }

    timestamp = loadedTimestamp;
    sequenceNumber = loadedSequenceNumber;
    for (final FileInfo fileInfo : loaded) {
      addFile(fileInfo);
    }
  }

  /**
   * Writes the meta file to {@code <meta>.tmp} and renames it into place.
   *
   * @param sync whether to sync the file before the rename.
   *
   * @throws RocksDBException if the file cannot be written or renamed.
   */
  void storeToFile(final boolean sync) throws RocksDBException {
    final StringBuilder buf = new StringBuilder();
    buf.append(timestamp).append('\n');
    buf.append(sequenceNumber).append('\n');
    buf.append(files.size()).append('\n');
    for (final FileInfo file : files) {
      buf.append(file.filename()).append(' ').append(CHECKSUM_PREFIX)
          .append(Integer.toUnsignedString(file.checksum())).append('\n');
    }
    final byte[] bytes = buf.toString().getBytes(StandardCharsets.UTF_8);
    if (bytes.length >= MAX_META_FILE_SIZE) {
      throw new RocksDBException(
          Status.invalidArgument("Backup meta file too big: " + metaFilename));
    }

    final String tmp = metaFilename + ".tmp";
    try (final WritableFile out = env.newWritableFile(tmp)) {
      out.append(bytes, 0, bytes.length);
      if (sync) {
        out.sync();
      }
    }
    env.renameFile(tmp, metaFilename);
  }

  String getInfoString() {
    final StringBuilder ss = new StringBuilder();
    ss.append("Timestamp: ").append(timestamp).append('\n');
    ss.append("Size: ").append(humanBytes(size)).append('\n');
    ss.append("Files:").append('\n');
    for (final FileInfo file : files) {
      ss.append(file.filename()).append(", size ")
          .append(humanBytes(file.size())).append(", refs ")
          .append(file.refs()).append('\n');
    }
    return ss.toString();
  }

  private String readMetaFile() throws RocksDBException {
    final byte[] buf = new byte[MAX_META_FILE_SIZE];
    int len = 0;
    try (final SequentialFile in = env.newSequentialFile(metaFilename)) {
      int n;
      while (len < buf.length
          && (n = in.read(buf, len, buf.length - len)) > 0) {
        len += n;
      }
    }
    if (len == MAX_META_FILE_SIZE) {
      throw corruption("File size too big");
    }
    return new String(buf, 0, len, StandardCharsets.UTF_8);
  }

  private long parseHeader(final String[] lines, final int line,
      final String field) throws RocksDBException {
    if (line >= lines.length - 1) {
      throw corruption("Missing " + field + " in " + metaFilename);
    }
    try {
      final long value = Long.parseLong(lines[line]);
      if (value < 0) {
        throw corruption("Invalid " + field + " in " + metaFilename);
      }
      return value;
    } catch (final NumberFormatException e) {
      throw corruption("Invalid " + field + " in " + metaFilename);
    }
  }

  private static RocksDBException corruption(final String msg) {
    return new RocksDBException(Status.corruption(msg));
  }

  static String humanBytes(final long bytes) {
    if (bytes >= (1L << 40)) {
      return String.format(Locale.ROOT, "%.2fTB", bytes / (double) (1L << 40));
    } else if (bytes >= (1L << 30)) {
      return String.format(Locale.ROOT, "%.2fGB", bytes / (double) (1L << 30));
    } else if (bytes >= (1L << 20)) {
      return String.format(Locale.ROOT, "%.2fMB", bytes / (double) (1L << 20));
    } else if (bytes >= (1L << 10)) {
      return String.format(Locale.ROOT, "%.2fKB", bytes / (double) (1L << 10));
    }
    return bytes + "B";
  }
}
