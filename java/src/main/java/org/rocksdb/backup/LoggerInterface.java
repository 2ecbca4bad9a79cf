// Copyright (c) 2016, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * LoggerInterface is a thin interface that specifies the most basic
 * functionality of a backup engine info log.
 */
public interface LoggerInterface {
  /**
   * Set the log level.
   *
   * @param logLevel the level at which to log.
   */
  void setInfoLogLevel(final InfoLogLevel logLevel);

  /**
   * Get the log level
   *
   * @return the level at which to log.
   */
  InfoLogLevel infoLogLevel();

  /**
   * Check whether a message of the given level would be emitted.
   *
   * @param logLevel the level of the message.
   *
   * @return true if the message passes the configured level.
   */
  boolean isEnabled(final InfoLogLevel logLevel);
}
