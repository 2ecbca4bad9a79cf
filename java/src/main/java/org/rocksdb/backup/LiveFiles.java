// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.List;

/**
 * Objects of this class hold the details of the live files of a
 * {@link BackupableDB}.
 */
public class LiveFiles {

  /**
   * The valid size of the manifest file. The manifest file is an
   * ever-growing file, but only the portion specified here is valid for
   * this snapshot.
   */
  public final long manifestFileSize;

  /**
   * The files are relative to the dbname, and are not absolute paths.
   * Each name starts with {@code /}.
   */
  public final List<String> files;

  public LiveFiles(final long manifestFileSize, final List<String> files) {
    this.manifestFileSize = manifestFileSize;
    this.files = files;
  }
}
