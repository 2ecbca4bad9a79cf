// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

/**
 * Represents the outcome of a backup engine operation.
 *
 * A failed operation surfaces its status through a {@link RocksDBException};
 * copy workers hand their status back inside a {@link CopyResult} instead.
 */
public class Status {
  public static final Status OK = new Status(Code.Ok, SubCode.None, null);

  private final Code code;
  /* @Nullable */ private final SubCode subCode;
  /* @Nullable */ private final String state;

  public Status(final Code code, final SubCode subCode, final String state) {
    this.code = code;
    this.subCode = subCode;
    this.state = state;
  }

  public static Status notFound(final String state) {
    return new Status(Code.NotFound, SubCode.None, state);
  }

  public static Status corruption(final String state) {
    return new Status(Code.Corruption, SubCode.None, state);
  }

  public static Status invalidArgument(final String state) {
    return new Status(Code.InvalidArgument, SubCode.None, state);
  }

  public static Status ioError(final String state) {
    return new Status(Code.IOError, SubCode.None, state);
  }

  public static Status incomplete(final String state) {
    return new Status(Code.Incomplete, SubCode.None, state);
  }

  public boolean isOk() {
    return code == Code.Ok;
  }

  public Code getCode() {
    return code;
  }

  public SubCode getSubCode() {
    return subCode;
  }

  public String getState() {
    return state;
  }

  public String getCodeString() {
    final StringBuilder builder = new StringBuilder()
        .append(code.name());
    if(subCode != null && subCode != SubCode.None) {
      builder.append("(")
          .append(subCode.name())
          .append(")");
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    if (state == null) {
      return getCodeString();
    }
    return getCodeString() + ": " + state;
  }

  public enum Code {
    Ok(                 (byte)0x0),
    NotFound(           (byte)0x1),
    Corruption(         (byte)0x2),
    NotSupported(       (byte)0x3),
    InvalidArgument(    (byte)0x4),
    IOError(            (byte)0x5),
    MergeInProgress(    (byte)0x6),
    Incomplete(         (byte)0x7),
    ShutdownInProgress( (byte)0x8),
    TimedOut(           (byte)0x9),
    Aborted(            (byte)0xA),
    Busy(               (byte)0xB),
    Expired(            (byte)0xC),
    TryAgain(           (byte)0xD);

    private final byte value;

    Code(final byte value) {
      this.value = value;
    }

    public byte getValue() {
      return value;
    }
  }

  public enum SubCode {
    None(         (byte)0x0);

    private final byte value;

    SubCode(final byte value) {
      this.value = value;
    }

    public byte getValue() {
      return value;
    }
  }
}
