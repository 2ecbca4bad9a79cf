// Copyright (c) 2014, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * <p>The default {@link Env}, backed by the local filesystem through
 * {@code java.nio.file}.</p>
 */
public class RocksEnv extends Env {
  private static final RocksEnv DEFAULT_ENV = new RocksEnv();

  /**
   * <p>Returns the default environment suitable for the current operating
   * system.</p>
   *
   * @return the default {@link RocksEnv} instance.
   */
  public static RocksEnv getDefault() {
    return DEFAULT_ENV;
  }

  protected RocksEnv() {
  }

  @Override
  public SequentialFile newSequentialFile(final String fname)
      throws RocksDBException {
    try {
      return new PosixSequentialFile(fname,
          Files.newInputStream(path(fname), StandardOpenOption.READ));
    } catch (final IOException e) {
      throw ioError(fname, e);
    }
  }

  @Override
  public WritableFile newWritableFile(final String fname)
      throws RocksDBException {
    try {
      return new PosixWritableFile(fname, FileChannel.open(path(fname),
          StandardOpenOption.CREATE, StandardOpenOption.WRITE,
          StandardOpenOption.TRUNCATE_EXISTING));
    } catch (final IOException e) {
      throw ioError(fname, e);
    }
  }

  @Override
  public boolean fileExists(final String fname) {
    return Files.exists(path(fname));
  }

  @Override
  public long getFileSize(final String fname) throws RocksDBException {
    try {
      return Files.size(path(fname));
    } catch (final IOException e) {
      throw ioError(fname, e);
    }
  }

  @Override
  public List<String> getChildren(final String dir) throws RocksDBException {
    final List<String> children = new ArrayList<>();
    try (final DirectoryStream<Path> stream =
             Files.newDirectoryStream(path(dir))) {
      for (final Path child : stream) {
        children.add(child.getFileName().toString());
      }
    } catch (final IOException e) {
      throw ioError(dir, e);
    }
    return children;
  }

  @Override
  public void createDir(final String dir) throws RocksDBException {
    try {
      Files.createDirectory(path(dir));
    } catch (final IOException e) {
      throw ioError(dir, e);
    }
  }

  @Override
  public void createDirIfMissing(final String dir) throws RocksDBException {
    try {
      Files.createDirectories(path(dir));
    } catch (final IOException e) {
      throw ioError(dir, e);
    }
  }

  @Override
  public void deleteFile(final String fname) throws RocksDBException {
    final Path path = path(fname);
    if (Files.isDirectory(path)) {
      throw new RocksDBException(
          Status.ioError("Is a directory: " + fname));
    }
    try {
      Files.delete(path);
    } catch (final IOException e) {
      throw ioError(fname, e);
    }
  }

  @Override
  public void deleteDir(final String dir) throws RocksDBException {
    final Path path = path(dir);
    if (Files.exists(path) && !Files.isDirectory(path)) {
      throw new RocksDBException(Status.ioError("Not a directory: " + dir));
    }
    try {
      Files.delete(path);
    } catch (final IOException e) {
      throw ioError(dir, e);
    }
  }

  @Override
  public void renameFile(final String src, final String target)
      throws RocksDBException {
    try {
      Files.move(path(src), path(target), StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw ioError(src, e);
    }
  }

  @Override
  public void fsyncDir(final String dir) throws RocksDBException {
    try (final FileChannel channel =
             FileChannel.open(path(dir), StandardOpenOption.READ)) {
      channel.force(true);
    } catch (final IOException e) {
      throw ioError(dir, e);
    }
  }

  private static Path path(final String fname) {
    return Paths.get(fname);
  }

  static RocksDBException ioError(final String fname, final IOException e) {
    if (e instanceof NoSuchFileException) {
      return new RocksDBException(Status.notFound(fname + ": No such file or directory"), e);
    } else if (e instanceof FileAlreadyExistsException) {
      return new RocksDBException(Status.ioError(fname + ": File exists"), e);
    } else if (e instanceof DirectoryNotEmptyException) {
      return new RocksDBException(Status.ioError(fname + ": Directory not empty"), e);
    }
    return new RocksDBException(Status.ioError(fname + ": " + e.getMessage()), e);
  }

  private static final class PosixSequentialFile implements SequentialFile {
    private final String fname;
    private final InputStream in;

    PosixSequentialFile(final String fname, final InputStream in) {
      this.fname = fname;
      this.in = in;
    }

    @Override
    public int read(final byte[] buffer, final int offset, final int length)
        throws RocksDBException {
      if (length == 0) {
        return 0;
      }
      try {
        final int read = in.readNBytes(buffer, offset, length);
        return Math.max(read, 0);
      } catch (final IOException e) {
        throw ioError(fname, e);
      }
    }

    @Override
    public void close() throws RocksDBException {
      try {
        in.close();
      } catch (final IOException e) {
        throw ioError(fname, e);
      }
    }
  }

  private static final class PosixWritableFile implements WritableFile {
    private final String fname;
    private final FileChannel channel;

    PosixWritableFile(final String fname, final FileChannel channel) {
      this.fname = fname;
      this.channel = channel;
    }

    @Override
    public void append(final byte[] data, final int offset, final int length)
        throws RocksDBException {
      final ByteBuffer buffer = ByteBuffer.wrap(data, offset, length);
      try {
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
      } catch (final IOException e) {
        throw ioError(fname, e);
      }
    }

    @Override
    public void sync() throws RocksDBException {
      try {
        channel.force(true);
      } catch (final IOException e) {
        throw ioError(fname, e);
      }
    }

    @Override
    public void close() throws RocksDBException {
      try {
        channel.close();
      } catch (final IOException e) {
        throw ioError(fname, e);
      }
    }
  }
}
