// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * A file abstraction for sequential writing, obtained from
 * {@link Env#newWritableFile(String)}. Creating one truncates any existing
 * file of the same name.
 */
public interface WritableFile extends AutoCloseable {
  void append(byte[] data, int offset, int length) throws RocksDBException;

  /**
   * Forces the written data to stable storage.
   *
   * @throws RocksDBException with {@link Status.Code#IOError} on failure.
   */
  void sync() throws RocksDBException;

  @Override
  void close() throws RocksDBException;
}
