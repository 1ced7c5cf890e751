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

import org.apache.commons.lang3.tuple.Pair;

import java.util.function.Supplier;

/**
 * Utility class for {@link Matrix}.
 */
public final class MatrixUtils {

  /**
   * Should not be instantiated.
   */
  private MatrixUtils() {
  }

  /**
   * A matrix creation that may fail with a {@link MatrixCreationException}.
   * @param <T> type of the created matrix
   */
  public interface MatrixCreator<T extends Matrix> {
    T create() throws MatrixCreationException;
  }

  /**
   * Runs a creation whose failure is a programming error.
   * @param creator the creation to run
   * @param <T> type of the created matrix
   * @return the created matrix
   * @throws MatrixException wrapping the {@link MatrixCreationException}, if the creation fails
   */
  public static <T extends Matrix> T must(final MatrixCreator<T> creator) {
    try {
      return creator.create();
    } catch (final MatrixCreationException e) {
      throw new MatrixException(e.getError(), e);
    }
  }

  /**
   * Runs a computation, turning a {@link MatrixException} into a result the caller can branch on.
   * Other exceptions are propagated.
   * @param supplier the computation to run
   * @param <T> type of the computed matrix
   * @return the matrix with a {@code null} error, or a {@code null} matrix with the error
   */
  public static <T extends Matrix> Pair<T, MatrixException> maybe(final Supplier<T> supplier) {
    final T matrix;
    try {
      matrix = supplier.get();
    } catch (final MatrixException e) {
      return Pair.of(null, e);
    }
    return Pair.of(matrix, null);
  }
}
