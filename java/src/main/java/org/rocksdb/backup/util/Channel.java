// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An unbounded multi-producer, multi-consumer queue with an explicit
 * end-of-stream marker.
 *
 * <p>Once {@link #sendEof()} has been called no more items are accepted;
 * readers drain what is left and then see end-of-stream.</p>
 *
 * @param <T> the type of the items, never null.
 */
public class Channel<T> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<T> buffer = new ArrayDeque<>();
  private boolean eof;

  public void sendEof() {
    lock.lock();
    try {
      eof = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEof() {
    lock.lock();
    try {
      return eof;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @param elem the item to enqueue.
   *
   * @return false if the channel already reached end-of-stream and the item
   *     was dropped.
   */
  public boolean write(final T elem) {
    if (elem == null) {
      throw new NullPointerException("elem");
    }
    lock.lock();
    try {
      if (eof) {
        return false;
      }
      buffer.addLast(elem);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until an item is available or the channel is drained after
   * end-of-stream.
   *
   * @return the next item, or null once the channel is at end-of-stream and
   *     empty.
   */
  public /* @Nullable */ T read() {
    lock.lock();
    try {
      while (buffer.isEmpty() && !eof) {
        notEmpty.awaitUninterruptibly();
      }
      return buffer.pollFirst();
    } finally {
      lock.unlock();
    }
  }
}
