// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The files of one backup directory, keyed by their relative path. Owned
 * by a single {@link BackupEngine} and only touched under its lock.
 */
class FileRegistry {
  private final Map<String, FileInfo> files = new HashMap<>();

  /* @Nullable */ FileInfo get(final String filename) {
    return files.get(filename);
  }

  boolean contains(final String filename) {
    return files.containsKey(filename);
  }

  void put(final FileInfo fileInfo) {
    files.put(fileInfo.filename(), fileInfo);
  }

  void remove(final String filename) {
    files.remove(filename);
  }

  /**
   * @return a snapshot of the entries, safe to iterate while removing.
   */
  List<FileInfo> entries() {
    return new ArrayList<>(files.values());
  }

  int size() {
    return files.size();
  }
}
