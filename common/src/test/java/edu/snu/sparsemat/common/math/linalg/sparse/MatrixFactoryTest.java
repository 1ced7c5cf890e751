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
import edu.snu.sparsemat.common.math.linalg.MatrixError;
import edu.snu.sparsemat.common.math.linalg.MatrixFactory;
import edu.snu.sparsemat.common.param.Parameters.NumScratchBuffers;
import edu.snu.sparsemat.common.param.Parameters.ScratchBufferLength;
import org.apache.commons.lang3.NotImplementedException;
import org.apache.reef.tang.Configuration;
import org.apache.reef.tang.Tang;
import org.apache.reef.tang.exceptions.InjectionException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static edu.snu.sparsemat.common.math.linalg.sparse.SparseAsserts.assertMatrixEquals;
import static edu.snu.sparsemat.common.math.linalg.sparse.SparseAsserts.assertWellFormed;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;

/**
 * This tests {@link DefaultMatrixFactory} and its configuration through Tang.
 */
public final class MatrixFactoryTest {

  private MatrixFactory matrixFactory;

  @Before
  public void setUp() throws InjectionException {
    matrixFactory = Tang.Factory.getTang().newInjector().getInstance(MatrixFactory.class);
  }

  @After
  public void tearDown() {
    ScratchBufferPool.shutdown();
  }

  /**
   * Tests that the scratch buffer pool is sized by the named parameters,
   * and that another factory with the same configuration keeps the pool.
   */
  @Test
  public void testScratchBufferConfiguration() throws InjectionException {
    final Configuration conf = Tang.Factory.getTang().newConfigurationBuilder()
        .bindNamedParameter(NumScratchBuffers.class, Integer.toString(3))
        .bindNamedParameter(ScratchBufferLength.class, Integer.toString(7))
        .build();
    Tang.Factory.getTang().newInjector(conf).getInstance(MatrixFactory.class);
    final ScratchBufferPool pool = ScratchBufferPool.get();
    assertEquals(3, pool.capacity());
    assertEquals(3, pool.available());
    assertEquals(7, pool.getBufferLength());

    Tang.Factory.getTang().newInjector(conf).getInstance(MatrixFactory.class);
    assertSame(pool, ScratchBufferPool.get());
  }

  @Test
  public void testDefaultScratchBufferConfiguration() {
    final ScratchBufferPool pool = ScratchBufferPool.get();
    assertEquals(10, pool.capacity());
    assertEquals(100, pool.getBufferLength());
  }

  @Test
  public void testIdentity() throws MatrixCreationException {
    final Matrix identity = matrixFactory.createSparseIdentity(4);
    assertEquals(4, identity.activeSize());
    for (int i = 0; i < 4; i++) {
      for (int j = 0; j < 4; j++) {
        assertEquals(i == j ? 1.0 : 0.0, identity.get(i, j), 0.0);
      }
    }
    assertWellFormed(identity);
  }

  @Test
  public void testZeros() throws MatrixCreationException {
    final Matrix zeros = matrixFactory.createSparseZeros(3, 5);
    assertEquals(3, zeros.getRows());
    assertEquals(5, zeros.getColumns());
    assertEquals(0, zeros.activeSize());
    assertEquals(0.0, zeros.norm(Matrix.NORM_FRO), 0.0);
  }

  /**
   * Tests the density bounds and that the seed fixes the placement of the elements.
   */
  @Test
  public void testRandom() throws MatrixCreationException {
    assertEquals(0, matrixFactory.createSparseRandom(10, 10, 0.0, () -> 1.0).activeSize());

    final Matrix full = matrixFactory.createSparseRandom(3, 4, 1.0, () -> 2.5);
    assertEquals(12, full.activeSize());
    assertEquals(30.0, full.sum(), 0.0);

    final Random values = new Random(0L);
    matrixFactory.setRandomSeed(2017L);
    final Matrix first = matrixFactory.createSparseRandom(20, 20, 0.3, values::nextDouble);
    matrixFactory.setRandomSeed(2017L);
    final Matrix second = matrixFactory.createSparseRandom(20, 20, 0.3, values::nextDouble);
    assertEquals(first.activeSize(), second.activeSize());
    for (int i = 0; i < 20; i++) {
      for (int j = 0; j < 20; j++) {
        assertEquals(first.get(i, j) == 0, second.get(i, j) == 0);
      }
    }
    assertTrue(first.activeSize() > 0);
    assertTrue(first.activeSize() < 400);
    assertWellFormed(first);
  }

  @Test
  public void testRandomWithZeroDimension() {
    try {
      matrixFactory.createSparseRandom(0, 3, 0.5, () -> 1.0);
      fail();
    } catch (final MatrixCreationException e) {
      assertEquals(MatrixError.ZERO_LENGTH, e.getError());
    }
  }

  /**
   * Tests that the non-zero values of several matrices are gathered into one row vector.
   */
  @Test
  public void testElements() throws MatrixCreationException {
    final Matrix mat1 = matrixFactory.createSparse(new double[][]{{0.0, 1.0}, {2.0, 0.0}});
    final Matrix mat2 = matrixFactory.createSparse(new double[][]{{3.0}});
    final Matrix zeros = matrixFactory.createSparseZeros(2, 2);

    final Matrix elements = matrixFactory.createSparseElements(Arrays.asList(mat1, zeros, mat2));
    assertMatrixEquals(new double[][]{{1.0, 2.0, 3.0}}, elements);
  }

  @Test
  public void testElementsOfZeros() throws MatrixCreationException {
    final List<Matrix> matrices = new ArrayList<>();
    matrices.add(matrixFactory.createSparseZeros(2, 2));
    try {
      matrixFactory.createSparseElements(matrices);
      fail();
    } catch (final MatrixCreationException e) {
      assertEquals(MatrixError.ZERO_LENGTH, e.getError());
    }
    try {
      matrixFactory.createSparseElements(Collections.emptyList());
      fail();
    } catch (final MatrixCreationException e) {
      assertEquals(MatrixError.ZERO_LENGTH, e.getError());
    }
  }

  @Test(expected = NotImplementedException.class)
  public void testElementsOfForeignMatrix() throws MatrixCreationException {
    matrixFactory.createSparseElements(Collections.singletonList(mock(Matrix.class)));
  }
}
