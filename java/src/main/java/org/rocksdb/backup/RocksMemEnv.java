// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An {@link Env} that keeps every file and directory in memory. Useful for
 * backing up in-memory databases and for tests. The root directory
 * {@code /} always exists.
 */
public class RocksMemEnv extends Env {
  private final Object lock = new Object();
  private final Map<String, MemFile> files = new HashMap<>();
  private final Set<String> dirs = new HashSet<>();

  public RocksMemEnv() {
    dirs.add("/");
  }

  @Override
  public SequentialFile newSequentialFile(final String fname)
      throws RocksDBException {
    final String path = normalize(fname);
    synchronized (lock) {
      final MemFile file = files.get(path);
      if (file == null) {
        throw notFound(path);
      }
      return new MemSequentialFile(file);
    }
  }

  @Override
  public WritableFile newWritableFile(final String fname)
      throws RocksDBException {
    final String path = normalize(fname);
    synchronized (lock) {
      if (dirs.contains(path)) {
        throw new RocksDBException(Status.ioError("Is a directory: " + path));
      }
      requireParent(path);
      final MemFile file = new MemFile();
      files.put(path, file);
      return new MemWritableFile(file);
    }
  }

  @Override
  public boolean fileExists(final String fname) {
    final String path = normalize(fname);
    synchronized (lock) {
      return files.containsKey(path) || dirs.contains(path);
    }
  }

  @Override
  public long getFileSize(final String fname) throws RocksDBException {
    final String path = normalize(fname);
    synchronized (lock) {
      final MemFile file = files.get(path);
      if (file == null) {
        throw notFound(path);
      }
      return file.size();
    }
  }

  @Override
  public List<String> getChildren(final String dir) throws RocksDBException {
    final String path = normalize(dir);
    synchronized (lock) {
      if (!dirs.contains(path)) {
        throw notFound(path);
      }
      final String prefix = path.equals("/") ? "/" : path + "/";
      final List<String> children = new ArrayList<>();
      for (final String name : files.keySet()) {
        addChild(children, prefix, name);
      }
      for (final String name : dirs) {
        addChild(children, prefix, name);
      }
      return children;
    }
  }

  @Override
  public void createDir(final String dir) throws RocksDBException {
    final String path = normalize(dir);
    synchronized (lock) {
      if (dirs.contains(path) || files.containsKey(path)) {
        throw new RocksDBException(Status.ioError(path + ": File exists"));
      }
      requireParent(path);
      dirs.add(path);
    }
  }

  @Override
  public void createDirIfMissing(final String dir) throws RocksDBException {
    final String path = normalize(dir);
    synchronized (lock) {
      if (files.containsKey(path)) {
        throw new RocksDBException(Status.ioError(path + ": Not a directory"));
      }
      String current = path;
      while (!dirs.contains(current)) {
        dirs.add(current);
        current = parent(current);
      }
    }
  }

  @Override
  public void deleteFile(final String fname) throws RocksDBException {
    final String path = normalize(fname);
    synchronized (lock) {
      if (files.remove(path) == null) {
        throw notFound(path);
      }
    }
  }

  @Override
  public void deleteDir(final String dir) throws RocksDBException {
    final String path = normalize(dir);
    synchronized (lock) {
      if (!dirs.contains(path)) {
        throw notFound(path);
      }
      if (!getChildren(path).isEmpty()) {
        throw new RocksDBException(
            Status.ioError(path + ": Directory not empty"));
      }
      dirs.remove(path);
    }
  }

  @Override
  public void renameFile(final String src, final String target)
      throws RocksDBException {
    final String from = normalize(src);
    final String to = normalize(target);
    synchronized (lock) {
      requireParent(to);
      final MemFile file = files.get(from);
      if (file != null) {
        if (dirs.contains(to)) {
          throw new RocksDBException(Status.ioError(to + ": Is a directory"));
        }
        files.remove(from);
        files.put(to, file);
        return;
      }
      if (!dirs.contains(from)) {
        throw notFound(from);
      }
      if (files.containsKey(to)
          || (dirs.contains(to) && !getChildren(to).isEmpty())) {
        throw new RocksDBException(
            Status.ioError(to + ": Directory not empty"));
      }
      final String prefix = from + "/";
      for (final String name : new ArrayList<>(files.keySet())) {
        if (name.startsWith(prefix)) {
          files.put(to + name.substring(from.length()), files.remove(name));
        }
      }
      for (final String name : new ArrayList<>(dirs)) {
        if (name.startsWith(prefix)) {
          dirs.remove(name);
          dirs.add(to + name.substring(from.length()));
        }
      }
      dirs.remove(from);
      dirs.add(to);
    }
  }

  @Override
  public void fsyncDir(final String dir) throws RocksDBException {
    final String path = normalize(dir);
    synchronized (lock) {
      if (!dirs.contains(path)) {
        throw notFound(path);
      }
    }
  }

  private void requireParent(final String path) throws RocksDBException {
    final String parent = parent(path);
    if (!dirs.contains(parent)) {
      throw notFound(parent);
    }
  }

  private static void addChild(final List<String> children,
      final String prefix, final String name) {
    if (name.length() > prefix.length() && name.startsWith(prefix)
        && name.indexOf('/', prefix.length()) < 0) {
      children.add(name.substring(prefix.length()));
    }
  }

  private static String parent(final String path) {
    final int slash = path.lastIndexOf('/');
    return slash <= 0 ? "/" : path.substring(0, slash);
  }

  static String normalize(final String fname) {
    final StringBuilder normalized = new StringBuilder();
    for (final String part : fname.split("/")) {
      if (part.isEmpty() || part.equals(".")) {
        continue;
      }
      normalized.append('/').append(part);
    }
    return normalized.length() == 0 ? "/" : normalized.toString();
  }

  private static RocksDBException notFound(final String path) {
    return new RocksDBException(
        Status.notFound(path + ": No such file or directory"));
  }

  private final class MemFile {
    private byte[] data = new byte[0];
    private int size;

    int size() {
      return size;
    }
  }

  private final class MemSequentialFile implements SequentialFile {
    private final MemFile file;
    private int position;

    MemSequentialFile(final MemFile file) {
      this.file = file;
    }

    @Override
    public int read(final byte[] buffer, final int offset, final int length) {
      synchronized (lock) {
        final int n = Math.min(length, file.size - position);
        if (n <= 0) {
          return 0;
        }
        System.arraycopy(file.data, position, buffer, offset, n);
        position += n;
        return n;
      }
    }

    @Override
    public void close() {
    }
  }

  private final class MemWritableFile implements WritableFile {
    private final MemFile file;
    private boolean closed;

    MemWritableFile(final MemFile file) {
      this.file = file;
    }

    @Override
    public void append(final byte[] data, final int offset, final int length)
        throws RocksDBException {
      synchronized (lock) {
        if (closed) {
          throw new RocksDBException(Status.ioError("File already closed"));
        }
        if (file.size + length > file.data.length) {
          file.data = Arrays.copyOf(file.data,
              Math.max(file.size + length, file.data.length * 2));
        }
        System.arraycopy(data, offset, file.data, file.size, length);
        file.size += length;
      }
    }

    @Override
    public void sync() {
    }

    @Override
    public void close() {
      synchronized (lock) {
        closed = true;
      }
    }
  }
}
