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

import edu.snu.sparsemat.common.math.linalg.Matrix;
import edu.snu.sparsemat.common.math.linalg.MatrixCreationException;
import edu.snu.sparsemat.common.math.linalg.MatrixFactory;
import edu.snu.sparsemat.common.param.Parameters.NumScratchBuffers;
import edu.snu.sparsemat.common.param.Parameters.ScratchBufferLength;
import org.apache.reef.tang.Configuration;
import org.apache.reef.tang.Tang;
import org.apache.reef.tang.exceptions.InjectionException;
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * This tests lending of scratch buffers by {@link ScratchBufferPool}, alone and under concurrent products.
 */
public final class ScratchBufferPoolTest {
  private static final long WAIT_TIME_MS = 500;
  private static final String MSG_SHOULD_WAIT = "borrow should wait while every buffer is lent out";
  private static final String MSG_SHOULD_RELEASE = "borrow should proceed once a buffer is returned";

  @After
  public void tearDown() {
    ScratchBufferPool.shutdown();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidPool() {
    new ScratchBufferPool(0, 4);
  }

  /**
   * Tests that a returned buffer is emptied, and that closing a lease twice returns it once.
   */
  @Test
  public void testBorrowAndRelease() {
    final ScratchBufferPool pool = new ScratchBufferPool(2, 4);
    final ScratchBufferPool.Lease lease = pool.borrow();
    assertEquals(1, pool.available());
    final SparseRow buffer = lease.buffer();
    assertEquals(4, buffer.capacity());
    buffer.set(1, 2.0);
    buffer.set(3, 4.0);

    lease.close();
    lease.close();
    assertEquals(2, pool.available());
    assertTrue(buffer.isEmpty());

    try (ScratchBufferPool.Lease first = pool.borrow(); ScratchBufferPool.Lease second = pool.borrow()) {
      assertTrue(first.buffer().isEmpty());
      assertTrue(second.buffer().isEmpty());
      assertEquals(0, pool.available());
    }
    assertEquals(2, pool.available());
  }

  @Test(expected = IllegalStateException.class)
  public void testBufferAfterRelease() {
    final ScratchBufferPool pool = new ScratchBufferPool(1, 4);
    final ScratchBufferPool.Lease lease = pool.borrow();
    lease.close();
    lease.buffer();
  }

  /**
   * Tests that a lease used with try-with-resources is returned when its body fails.
   */
  @Test
  public void testReleaseOnFailure() {
    final ScratchBufferPool pool = new ScratchBufferPool(1, 4);
    try (ScratchBufferPool.Lease lease = pool.borrow()) {
      lease.buffer().set(0, 1.0);
      throw new IllegalStateException("failure while holding a buffer");
    } catch (final IllegalStateException e) {
      assertEquals(1, pool.available());
    }
    assertEquals(1, pool.available());
  }

  /**
   * Tests that borrow waits for a buffer to be returned when the pool is exhausted.
   */
  @Test
  public void testBorrowBlocksWhenExhausted() throws InterruptedException, ExecutionException, TimeoutException {
    final ScratchBufferPool pool = new ScratchBufferPool(1, 4);
    final ScratchBufferPool.Lease held = pool.borrow();
    final CountDownLatch borrowed = new CountDownLatch(1);
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<?> future = executor.submit(() -> {
          try (ScratchBufferPool.Lease lease = pool.borrow()) {
            borrowed.countDown();
          }
        });

      assertFalse(MSG_SHOULD_WAIT, borrowed.await(WAIT_TIME_MS, TimeUnit.MILLISECONDS));
      held.close();
      assertTrue(MSG_SHOULD_RELEASE, borrowed.await(WAIT_TIME_MS, TimeUnit.MILLISECONDS));
      future.get(WAIT_TIME_MS, TimeUnit.MILLISECONDS);
    } finally {
      executor.shutdownNow();
    }
    assertEquals(1, pool.available());
  }

  /**
   * Tests that an interrupted borrow fails and keeps the interrupt status.
   */
  @Test
  public void testInterruptedBorrow() {
    final ScratchBufferPool pool = new ScratchBufferPool(1, 4);
    final ScratchBufferPool.Lease held = pool.borrow();
    Thread.currentThread().interrupt();
    try {
      pool.borrow();
      fail();
    } catch (final IllegalStateException e) {
      assertTrue(e.getCause() instanceof InterruptedException);
      assertTrue(Thread.interrupted());
    } finally {
      held.close();
    }
  }

  @Test
  public void testProcessWidePool() {
    ScratchBufferPool.shutdown();
    try {
      ScratchBufferPool.get();
      fail();
    } catch (final IllegalStateException e) {
      assertTrue(e.getMessage().contains("not initialized"));
    }

    final ScratchBufferPool pool = ScratchBufferPool.initialize(3, 8);
    assertEquals(pool, ScratchBufferPool.get());
    assertEquals(3, pool.capacity());
    assertEquals(8, pool.getBufferLength());
  }

  /**
   * Tests that a lease taken before the pool is replaced goes back to the pool it came from.
   */
  @Test
  public void testLeaseOutlivesReinitialization() {
    final ScratchBufferPool oldPool = ScratchBufferPool.initialize(1, 4);
    final ScratchBufferPool.Lease lease = oldPool.borrow();
    final ScratchBufferPool newPool = ScratchBufferPool.initialize(2, 4);

    lease.close();
    assertEquals(1, oldPool.available());
    assertEquals(2, newPool.available());
  }

  /**
   * Tests that products running on more threads than there are buffers all finish correctly,
   * and that every buffer is back in the pool afterwards.
   */
  @Test
  public void testConcurrentProducts()
      throws InjectionException, MatrixCreationException, InterruptedException, ExecutionException {
    final int numBuffers = 2;
    final int numThreads = 8;
    final int numProductsPerThread = 20;

    final Configuration conf = Tang.Factory.getTang().newConfigurationBuilder()
        .bindNamedParameter(NumScratchBuffers.class, Integer.toString(numBuffers))
        .bindNamedParameter(ScratchBufferLength.class, Integer.toString(16))
        .build();
    final MatrixFactory matrixFactory = Tang.Factory.getTang().newInjector(conf).getInstance(MatrixFactory.class);
    matrixFactory.setRandomSeed(5L);
    final Random random = new Random(5L);
    final Matrix left = matrixFactory.createSparseRandom(12, 16, 0.3, random::nextDouble);
    final Matrix right = matrixFactory.createSparseRandom(16, 10, 0.3, random::nextDouble);
    final Matrix expected = left.mmul(right);

    final ExecutorService executor = Executors.newFixedThreadPool(numThreads);
    try {
      final List<Future<Boolean>> futures = new ArrayList<>(numThreads);
      for (int i = 0; i < numThreads; i++) {
        futures.add(executor.submit(() -> {
            boolean allEqual = true;
            for (int j = 0; j < numProductsPerThread; j++) {
              allEqual &= left.mmul(right).equalTo(expected);
            }
            return allEqual;
          }));
      }
      for (final Future<Boolean> future : futures) {
        assertTrue(future.get());
      }
    } finally {
      executor.shutdown();
    }
    assertEquals(numBuffers, ScratchBufferPool.get().available());
  }
}
