// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).
package org.rocksdb.backup.util;

import java.io.PrintStream;
import org.rocksdb.backup.InfoLogLevel;
import org.rocksdb.backup.Logger;

/**
 * Simply redirects all log messages to StdErr.
 */
public class StdErrLogger extends Logger {
  /* @Nullable */ private final String logPrefix;
  private final PrintStream out;

  /**
   * Constructs a new StdErrLogger.
   *
   * @param logLevel the level at which to log.
   */
  public StdErrLogger(final InfoLogLevel logLevel) {
    this(logLevel, null);
  }

  /**
   * Constructs a new StdErrLogger.
   *
   * @param logLevel the level at which to log.
   * @param logPrefix the string with which to prefix all log messages.
   */
  public StdErrLogger(final InfoLogLevel logLevel, /* @Nullable */ final String logPrefix) {
    this(logLevel, logPrefix, System.err);
  }

  StdErrLogger(final InfoLogLevel logLevel, final String logPrefix,
      final PrintStream out) {
    super(logLevel);
    this.logPrefix = logPrefix;
    this.out = out;
  }

  @Override
  protected void log(final InfoLogLevel logLevel, final String logMsg) {
    final StringBuilder line = new StringBuilder();
    if (logPrefix != null) {
      line.append(logPrefix).append(' ');
    }
    line.append('[').append(logLevel.name()).append("] ").append(logMsg);
    out.println(line);
  }
}
