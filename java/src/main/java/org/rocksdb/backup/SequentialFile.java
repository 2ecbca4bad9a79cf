// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * A file abstraction for reading sequentially through a file, obtained from
 * {@link Env#newSequentialFile(String)}.
 */
public interface SequentialFile extends AutoCloseable {
  /**
   * Reads up to {@code length} bytes into {@code buffer}.
   *
   * @param buffer the destination buffer.
   * @param offset offset in {@code buffer} to start writing at.
   * @param length maximum number of bytes to read.
   *
   * @return the number of bytes read, 0 once the end of the file is reached.
   *
   * @throws RocksDBException with {@link Status.Code#IOError} if the read
   *     fails.
   */
  int read(byte[] buffer, int offset, int length) throws RocksDBException;

  @Override
  void close() throws RocksDBException;
}
