// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.Locale;

/**
 * <p>This class provides the info log of a {@link BackupEngine}.</p>
 *
 * <p>Subclass it to route backup engine messages to common
 * Java logging APIs like Log4j or Slf4j, or use
 * {@link org.rocksdb.backup.util.StdErrLogger}.</p>
 *
 * <p>Messages below the configured {@link InfoLogLevel} are discarded
 * before they are formatted, so leaving the level at
 * {@link InfoLogLevel#INFO_LEVEL} or higher keeps the overhead of a busy
 * backup low.</p>
 */
public abstract class Logger implements LoggerInterface {
  private volatile InfoLogLevel infoLogLevel;

  /**
   * <p>Logger constructor.</p>
   *
   * @param logLevel the log level.
   */
  public Logger(final InfoLogLevel logLevel) {
    this.infoLogLevel = logLevel;
  }

  @Override
  public void setInfoLogLevel(final InfoLogLevel logLevel) {
    this.infoLogLevel = logLevel;
  }

  @Override
  public InfoLogLevel infoLogLevel() {
    return infoLogLevel;
  }

  @Override
  public boolean isEnabled(final InfoLogLevel logLevel) {
    return logLevel.getValue() >= infoLogLevel.getValue();
  }

  /**
   * Formats and emits a message if its level is enabled.
   *
   * @param logLevel level of the message.
   * @param format a {@link String#format(String, Object...)} format string,
   *     applied with {@link Locale#ROOT}.
   * @param args the format arguments.
   */
  final void logf(final InfoLogLevel logLevel, final String format,
      final Object... args) {
    if (!isEnabled(logLevel)) {
      return;
    }
    log(logLevel, args.length == 0
        ? format : String.format(Locale.ROOT, format, args));
  }

  protected abstract void log(final InfoLogLevel logLevel, final String logMsg);
}
