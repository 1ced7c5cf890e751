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
package edu.snu.sparsemat.common.math.linalg;

import org.apache.commons.lang3.NotImplementedException;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.reef.tang.Tang;
import org.apache.reef.tang.exceptions.InjectionException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * This tests the error handling helpers in {@link MatrixUtils}.
 */
public final class MatrixUtilsTest {

  private MatrixFactory matrixFactory;

  @Before
  public void setUp() throws InjectionException {
    matrixFactory = Tang.Factory.getTang().newInjector().getInstance(MatrixFactory.class);
  }

  @Test
  public void testMust() {
    final Matrix matrix = MatrixUtils.must(() -> matrixFactory.createSparseIdentity(2));
    assertEquals(2.0, matrix.trace(), 0.0);
  }

  /**
   * Tests that a failed creation surfaces as an unchecked error caused by the creation error.
   */
  @Test
  public void testMustFailure() {
    try {
      MatrixUtils.must(() -> matrixFactory.createSparseZeros(0, 2));
      fail();
    } catch (final MatrixException e) {
      assertEquals(MatrixError.ZERO_LENGTH, e.getError());
      assertTrue(e.getCause() instanceof MatrixCreationException);
    }
  }

  @Test
  public void testMaybe() {
    final Matrix identity = MatrixUtils.must(() -> matrixFactory.createSparseIdentity(3));
    final Pair<Matrix, MatrixException> result = MatrixUtils.maybe(() -> identity.mmul(identity));
    assertTrue(result.getLeft().equalTo(identity));
    assertNull(result.getRight());
  }

  /**
   * Tests that a dimension mismatch is returned instead of thrown.
   */
  @Test
  public void testMaybeFailure() {
    final Matrix matrix = MatrixUtils.must(() -> matrixFactory.createSparseZeros(2, 3));
    final Pair<Matrix, MatrixException> result = MatrixUtils.maybe(() -> matrix.mmul(matrix));
    assertNull(result.getLeft());
    assertEquals(MatrixError.SHAPE, result.getRight().getError());
  }

  @Test(expected = NotImplementedException.class)
  public void testMaybePropagatesOtherErrors() {
    final Matrix matrix = MatrixUtils.must(() -> matrixFactory.createSparseZeros(2, 3));
    MatrixUtils.maybe(() -> matrix.reshape(3, 2));
  }
}
