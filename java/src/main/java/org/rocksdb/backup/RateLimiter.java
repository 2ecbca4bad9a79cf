// Copyright (c) 2015, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RateLimiter, which is used to control the copy rate of backups and
 * restores.
 *
 * <p>Tokens are refilled once per refill period. A request that cannot be
 * served from the tokens at hand joins the FIFO queue of its priority. The
 * head of a queue becomes the leader when no leader exists; only the leader
 * waits for the next refill instant, everybody else waits until the leader
 * either grants them quota or hands leadership over to them.</p>
 *
 * <p>Closing the limiter releases every blocked caller.</p>
 */
public class RateLimiter implements AutoCloseable {
  private static final long DEFAULT_REFILL_PERIOD_MICROS = (100 * 1000);
  private static final int DEFAULT_FAIRNESS = 10;
  private static final long MICROS_PER_SECOND = 1000 * 1000;

  private final ReentrantLock requestLock = new ReentrantLock();
  private final Condition exitCondition = requestLock.newCondition();

  private final long refillPeriodMicros;
  private final int fairness;
  private final Random random;
  private volatile long refillBytesPerPeriod;

  // guarded by requestLock
  private boolean stop;
  private int requestsToWait;
  private long availableBytes;
  private long nextRefillMicros;
  private Request leader;
  private final Deque<Request> lowQueue = new ArrayDeque<>();
  private final Deque<Request> highQueue = new ArrayDeque<>();
  private final long[] totalBytesThrough = new long[2];
  private final long[] totalRequests = new long[2];

  /**
   * RateLimiter constructor
   *
   * @param rateBytesPerSecond this is the only parameter you want to set
   *     most of the time. It controls the total copy rate of the backup
   *     engine in bytes per second.
   * @param refillPeriodMicros this controls how often tokens are refilled. For example,
   *     when rateBytesPerSecond is set to 10MB/s and refillPeriodMicros is set to
   *     100ms, then 1MB is refilled every 100ms internally. Larger value can lead to
   *     burstier copies while smaller value introduces more CPU overhead.
   *     The default should work for most cases.
   * @param fairness RateLimiter accepts high-pri requests and low-pri requests.
   *     A low-pri request is usually blocked in favor of hi-pri request.
   *     Low-pri requests can get blocked if high-pri requests come in
   *     continuously. This fairness parameter grants low-pri requests permission by
   *     1/fairness chance even though high-pri requests exist to avoid starvation.
   *     You should be good by leaving it at default 10.
   */
  public RateLimiter(final long rateBytesPerSecond,
      final long refillPeriodMicros, final int fairness) {
    this(rateBytesPerSecond, refillPeriodMicros, fairness, new Random());
  }

  /**
   * RateLimiter constructor
   *
   * @param rateBytesPerSecond this is the only parameter you want to set
   *     most of the time. It controls the total copy rate of the backup
   *     engine in bytes per second.
   */
  public RateLimiter(final long rateBytesPerSecond) {
    this(rateBytesPerSecond, DEFAULT_REFILL_PERIOD_MICROS, DEFAULT_FAIRNESS);
  }

  RateLimiter(final long rateBytesPerSecond, final long refillPeriodMicros,
      final int fairness, final Random random) {
    if (refillPeriodMicros <= 0) {
      throw new IllegalArgumentException(
          "refillPeriodMicros must be positive: " + refillPeriodMicros);
    }
    if (fairness <= 0) {
      throw new IllegalArgumentException(
          "fairness must be positive: " + fairness);
    }
    this.refillPeriodMicros = refillPeriodMicros;
    this.fairness = fairness;
    this.random = random;
    setBytesPerSecond(rateBytesPerSecond);
    this.availableBytes = 0;
    this.nextRefillMicros = nowMicros();
  }

  /**
   * <p>This API allows user to dynamically change rate limiter's bytes per second.
   * REQUIRED: bytes_per_second &gt; 0</p>
   *
   * @param bytesPerSecond bytes per second.
   */
  public void setBytesPerSecond(final long bytesPerSecond) {
    if (bytesPerSecond <= 0) {
      throw new IllegalArgumentException(
          "bytesPerSecond must be positive: " + bytesPerSecond);
    }
    refillBytesPerPeriod = calculateRefillBytesPerPeriod(bytesPerSecond);
  }

  /**
   * <p>Request for token to copy bytes with {@link IOPriority#IO_LOW}.</p>
   *
   * @param bytes requested bytes.
   *
   * @see #request(long, IOPriority)
   */
  public void request(final long bytes) {
    request(bytes, IOPriority.IO_LOW);
  }

  /**
   * <p>Request for token to copy bytes. If this request can not be satisfied,
   * the call is blocked. Caller is responsible to make sure
   * {@code bytes <= getSingleBurstBytes()}.</p>
   *
   * @param bytes requested bytes.
   * @param priority {@link IOPriority#IO_LOW} or {@link IOPriority#IO_HIGH}.
   */
  public void request(final long bytes, final IOPriority priority) {
    if (priority == IOPriority.IO_TOTAL) {
      throw new IllegalArgumentException("IO_TOTAL is not a request priority");
    }
    if (bytes < 0 || bytes > refillBytesPerPeriod) {
      throw new IllegalArgumentException("Request of " + bytes
          + " bytes exceeds the single burst of " + refillBytesPerPeriod);
    }
    final int pri = priority.getValue();
    boolean interrupted = false;
    requestLock.lock();
    try {
      if (stop) {
        return;
      }
      ++totalRequests[pri];
      if (availableBytes >= bytes) {
        availableBytes -= bytes;
        totalBytesThrough[pri] += bytes;
        return;
      }

      final Request r = new Request(bytes);
      queue(priority).addLast(r);
      do {
        boolean timedOut = false;
        // Leader election, candidates can be a new incoming request, a
        // previous leader whose quota was not assigned yet, or a queue head
        // that got notified by the previous leader.
        if (leader == null && isQueueHead(r)) {
          leader = r;
          final long delta = nextRefillMicros - nowMicros();
          if (delta > 0) {
            try {
              r.cv.awaitNanos(TimeUnit.MICROSECONDS.toNanos(delta));
            } catch (final InterruptedException e) {
              interrupted = true;
            }
          }
          timedOut = nowMicros() >= nextRefillMicros;
        } else {
          r.cv.awaitUninterruptibly();
        }

        if (r.released) {
          --requestsToWait;
          exitCondition.signalAll();
          return;
        }

        if (leader == r) {
          leader = null;
          if (timedOut) {
            refill();
            if (r.granted) {
              // the leader is leaving, the next queue head has to run
              // the election
              final Request next = !highQueue.isEmpty()
                  ? highQueue.peekFirst() : lowQueue.peekFirst();
              if (next != null) {
                next.cv.signal();
              }
            }
          }
        }
        // otherwise woken up by the previous leader: either granted, or
        // picked as the next leader candidate
      } while (!r.granted);
    } finally {
      requestLock.unlock();
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * <p>Max bytes can be granted in a single burst.</p>
   *
   * @return max bytes can be granted in a single burst.
   */
  public long getSingleBurstBytes() {
    return refillBytesPerPeriod;
  }

  /**
   * <p>Total bytes that go though rate limiter.</p>
   *
   * @return total bytes that go though rate limiter.
   */
  public long getTotalBytesThrough() {
    return getTotalBytesThrough(IOPriority.IO_TOTAL);
  }

  /**
   * <p>Total bytes of the given priority that go though rate limiter.</p>
   *
   * @param priority the priority class, or {@link IOPriority#IO_TOTAL}.
   *
   * @return total bytes that go though rate limiter.
   */
  public long getTotalBytesThrough(final IOPriority priority) {
    requestLock.lock();
    try {
      if (priority == IOPriority.IO_TOTAL) {
        return totalBytesThrough[0] + totalBytesThrough[1];
      }
      return totalBytesThrough[priority.getValue()];
    } finally {
      requestLock.unlock();
    }
  }

  /**
   * <p>Total # of requests that go though rate limiter.</p>
   *
   * @return total # of requests that go though rate limiter.
   */
  public long getTotalRequests() {
    return getTotalRequests(IOPriority.IO_TOTAL);
  }

  /**
   * <p>Total # of requests of the given priority that go though rate
   * limiter.</p>
   *
   * @param priority the priority class, or {@link IOPriority#IO_TOTAL}.
   *
   * @return total # of requests that go though rate limiter.
   */
  public long getTotalRequests(final IOPriority priority) {
    requestLock.lock();
    try {
      if (priority == IOPriority.IO_TOTAL) {
        return totalRequests[0] + totalRequests[1];
      }
      return totalRequests[priority.getValue()];
    } finally {
      requestLock.unlock();
    }
  }

  /**
   * Releases every blocked caller and waits until all of them have left
   * {@link #request(long, IOPriority)}. Later requests return immediately.
   */
  @Override
  public void close() {
    requestLock.lock();
    try {
      if (stop) {
        return;
      }
      stop = true;
      requestsToWait = highQueue.size() + lowQueue.size();
      release(highQueue);
      release(lowQueue);
      while (requestsToWait > 0) {
        exitCondition.awaitUninterruptibly();
      }
    } finally {
      requestLock.unlock();
    }
  }

  private void release(final Deque<Request> queue) {
    Request r;
    while ((r = queue.pollFirst()) != null) {
      r.released = true;
      r.cv.signal();
    }
  }

  private void refill() {
    nextRefillMicros = nowMicros() + refillPeriodMicros;
    // carry over the left over quota from the last period
    final long refillBytes = refillBytesPerPeriod;
    if (availableBytes < refillBytes) {
      availableBytes += refillBytes;
    }

    final boolean lowFirst = random.nextInt(fairness) == 0;
    serve(lowFirst ? IOPriority.IO_LOW : IOPriority.IO_HIGH);
    serve(lowFirst ? IOPriority.IO_HIGH : IOPriority.IO_LOW);
  }

  private void serve(final IOPriority priority) {
    final Deque<Request> queue = queue(priority);
    while (!queue.isEmpty()) {
      final Request next = queue.peekFirst();
      if (availableBytes < next.requestBytes) {
        // pay down part of the head request so that it cannot starve
        next.requestBytes -= availableBytes;
        availableBytes = 0;
        break;
      }
      availableBytes -= next.requestBytes;
      next.requestBytes = 0;
      totalBytesThrough[priority.getValue()] += next.bytes;
      queue.pollFirst();

      next.granted = true;
      if (next != leader) {
        next.cv.signal();
      }
    }
  }

  private boolean isQueueHead(final Request r) {
    return r == highQueue.peekFirst() || r == lowQueue.peekFirst();
  }

  private Deque<Request> queue(final IOPriority priority) {
    return priority == IOPriority.IO_HIGH ? highQueue : lowQueue;
  }

  private long calculateRefillBytesPerPeriod(final long rateBytesPerSecond) {
    if (Long.MAX_VALUE / rateBytesPerSecond < refillPeriodMicros) {
      // avoid overflow
      return Long.MAX_VALUE / MICROS_PER_SECOND;
    }
    return Math.max(1,
        rateBytesPerSecond * refillPeriodMicros / MICROS_PER_SECOND);
  }

  private static long nowMicros() {
    return TimeUnit.NANOSECONDS.toMicros(System.nanoTime());
  }

  private final class Request {
    private final long bytes;
    private final Condition cv = requestLock.newCondition();
    private long requestBytes;
    private boolean granted;
    private boolean released;

    private Request(final long bytes) {
      this.bytes = bytes;
      this.requestBytes = bytes;
    }
  }
}
