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
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.apache.reef.tang.annotations.Parameter;

import javax.inject.Inject;
import java.util.List;
import java.util.function.DoubleSupplier;

/**
 * Factory class for {@link SparseMatrix}.
 * Creating the factory also initializes the process-wide {@link ScratchBufferPool}
 * with the configured number and length of buffers.
 */
public final class DefaultMatrixFactory implements MatrixFactory {

  private final SynchronizedRandomGenerator randomGenerator;

  @Inject
  private DefaultMatrixFactory(@Parameter(NumScratchBuffers.class) final int numScratchBuffers,
                               @Parameter(ScratchBufferLength.class) final int scratchBufferLength) {
    ScratchBufferPool.ensureInitialized(numScratchBuffers, scratchBufferLength);
    this.randomGenerator = new SynchronizedRandomGenerator(new MersenneTwister());
  }

  /**
   * Creates a sparse matrix with the given values.
   * The values are copied; changes in {@code data} do not affect the returned matrix.
   * @param data elements of a matrix in row-major order, one array per row
   * @return a generated matrix
   */
  @Override
  public SparseMatrix createSparse(final double[][] data) throws MatrixCreationException {
    if (data.length == 0 || data[0].length == 0) {
      throw new MatrixCreationException(MatrixError.ZERO_LENGTH);
    }
    final int columns = data[0].length;
    final SparseRow[] rows = new SparseRow[data.length];
    for (int i = 0; i < data.length; i++) {
      if (data[i].length != columns) {
        throw new MatrixCreationException(MatrixError.ROW_LENGTH);
      }
      rows[i] = SparseRow.fromDense(data[i]);
    }
    return new SparseMatrix(data.length, columns, rows);
  }

  @Override
  public SparseMatrix createSparseZeros(final int rows, final int columns) throws MatrixCreationException {
    if (rows < 1 || columns < 1) {
      throw new MatrixCreationException(MatrixError.ZERO_LENGTH);
    }
    return new SparseMatrix(rows, columns);
  }

  @Override
  public SparseMatrix createSparseIdentity(final int size) throws MatrixCreationException {
    if (size < 1) {
      throw new MatrixCreationException(MatrixError.ZERO_LENGTH);
    }
    final SparseRow[] rows = new SparseRow[size];
    for (int i = 0; i < size; i++) {
      rows[i] = new SparseRow(1);
      rows[i].append(i, 1.0);
    }
    return new SparseMatrix(size, size, rows);
  }

  /**
   * Creates a sparse matrix with randomly placed elements.
   * The placement is drawn from the generator seeded by {@link #setRandomSeed(long)}.
   */
  @Override
  public SparseMatrix createSparseRandom(final int rows, final int columns, final double density,
                                        final DoubleSupplier generator) throws MatrixCreationException {
    final SparseMatrix matrix = createSparseZeros(rows, columns);
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < columns; j++) {
        if (randomGenerator.nextDouble() < density) {
          matrix.set(i, j, generator.getAsDouble());
        }
      }
    }
    return matrix;
  }

  @Override
  public void setRandomSeed(final long seed) {
    randomGenerator.setSeed(seed);
  }

  /**
   * Creates a row vector holding the non-zero values of the given matrices, row by row.
   * All matrices should be instances of {@link SparseMatrix}.
   */
  @Override
  public SparseMatrix createSparseElements(final List<Matrix> matrices) throws MatrixCreationException {
    int length = 0;
    for (final Matrix matrix : matrices) {
      if (!(matrix instanceof SparseMatrix)) {
        throw new NotImplementedException("Elements of " + matrix.getClass().getName() + " are not supported");
      }
      length += matrix.elements().length;
    }
    if (length == 0) {
      throw new MatrixCreationException(MatrixError.ZERO_LENGTH);
    }

    final SparseRow row = new SparseRow(length);
    for (final Matrix matrix : matrices) {
      for (final double value : matrix.elements()) {
        row.append(row.size(), value);
      }
    }
    return new SparseMatrix(1, length, new SparseRow[]{row});
  }
}
