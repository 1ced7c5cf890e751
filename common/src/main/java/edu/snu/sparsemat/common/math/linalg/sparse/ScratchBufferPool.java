/*
 * Copyright (C) 2017 Seoul National University
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.snu.sparsemat.common.math.linalg.sparse;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A fixed number of pre-allocated {@link SparseRow}s used as scratch space by {@link SparseMatrix#mmul}.
 * {@link #borrow()} blocks while every buffer is lent out, so the pool also bounds the number of
 * products running at the same time.
 *
 * The process-wide pool is set up with {@link #initialize(int, int)} and dropped with {@link #shutdown()}.
 * {@link DefaultMatrixFactory} initializes it from its Tang parameters.
 */
public final class ScratchBufferPool {
  private static final Logger LOG = Logger.getLogger(ScratchBufferPool.class.getName());

  private static volatile ScratchBufferPool instance;

  private final BlockingQueue<SparseRow> buffers;
  private final int capacity;
  private final int bufferLength;

  /**
   * Creates a pool and allocates all of its buffers.
   * @param numBuffers the number of buffers
   * @param bufferLength the initial capacity of each buffer
   */
  public ScratchBufferPool(final int numBuffers, final int bufferLength) {
    if (numBuffers < 1 || bufferLength < 1) {
      throw new IllegalArgumentException(
          String.format("Invalid scratch buffer pool: %d buffers of length %d", numBuffers, bufferLength));
    }
    this.capacity = numBuffers;
    this.bufferLength = bufferLength;
    this.buffers = new ArrayBlockingQueue<>(numBuffers);
    for (int i = 0; i < numBuffers; i++) {
      buffers.add(new SparseRow(bufferLength));
    }
  }

  /**
   * Replaces the process-wide pool. Leases taken from a replaced pool are still returned to it.
   * @param numBuffers the number of buffers
   * @param bufferLength the initial capacity of each buffer
   * @return the new process-wide pool
   */
  public static synchronized ScratchBufferPool initialize(final int numBuffers, final int bufferLength) {
    instance = new ScratchBufferPool(numBuffers, bufferLength);
    LOG.log(Level.INFO, "Initialized scratch buffer pool with {0} buffers of length {1}",
        new Object[]{numBuffers, bufferLength});
    return instance;
  }

  /**
   * Initializes the process-wide pool unless it is already set up with the same configuration.
   * @param numBuffers the number of buffers
   * @param bufferLength the initial capacity of each buffer
   * @return the process-wide pool
   */
  static synchronized ScratchBufferPool ensureInitialized(final int numBuffers, final int bufferLength) {
    final ScratchBufferPool current = instance;
    if (current != null && current.capacity == numBuffers && current.bufferLength == bufferLength) {
      return current;
    }
    return initialize(numBuffers, bufferLength);
  }

  /**
   * @return the process-wide pool
   * @throws IllegalStateException if the pool has not been initialized
   */
  public static ScratchBufferPool get() {
    final ScratchBufferPool current = instance;
    if (current == null) {
      throw new IllegalStateException("Scratch buffer pool is not initialized");
    }
    return current;
  }

  /**
   * Drops the process-wide pool. Outstanding leases are still returned to it.
   */
  public static synchronized void shutdown() {
    if (instance != null) {
      LOG.log(Level.INFO, "Shutting down scratch buffer pool, {0} of {1} buffers outstanding",
          new Object[]{instance.capacity - instance.available(), instance.capacity});
      instance = null;
    }
  }

  /**
   * Takes a buffer, waiting until one is returned if the pool is empty.
   * The buffer is returned by closing the lease, preferably with try-with-resources.
   * @return a lease on an empty buffer
   */
  public Lease borrow() {
    SparseRow buffer = buffers.poll();
    if (buffer == null) {
      LOG.log(Level.FINE, "All {0} scratch buffers are lent out, waiting for one", capacity);
      try {
        buffer = buffers.take();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for a scratch buffer", e);
      }
    }
    return new Lease(buffer);
  }

  private void release(final SparseRow buffer) {
    buffer.truncate();
    if (!buffers.offer(buffer)) {
      throw new IllegalStateException("Scratch buffer pool is already full");
    }
  }

  /**
   * @return the number of buffers resting in the pool
   */
  public int available() {
    return buffers.size();
  }

  /**
   * @return the total number of buffers, lent out or not
   */
  public int capacity() {
    return capacity;
  }

  public int getBufferLength() {
    return bufferLength;
  }

  /**
   * A borrowed buffer. Closing the lease empties the buffer and returns it to its pool;
   * closing it again has no effect.
   */
  public final class Lease implements AutoCloseable {
    private final SparseRow buffer;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Lease(final SparseRow buffer) {
      this.buffer = buffer;
    }

    public SparseRow buffer() {
      if (released.get()) {
        throw new IllegalStateException("Scratch buffer has already been released");
      }
      return buffer;
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        release(buffer);
      }
    }
  }
}
