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

import edu.snu.sparsemat.common.math.linalg.ApplyFunction;
import edu.snu.sparsemat.common.math.linalg.FilterFunction;
import edu.snu.sparsemat.common.math.linalg.Matrix;
import edu.snu.sparsemat.common.math.linalg.MatrixError;
import edu.snu.sparsemat.common.math.linalg.MatrixException;
import org.apache.commons.lang3.NotImplementedException;

import java.util.function.DoublePredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Row-sparse matrix. Each row keeps only its stored elements, sorted by column index.
 * Operations work on the stored elements directly; nothing is expanded to a dense grid
 * except by {@link #toArray()}.
 *
 * Arithmetic may leave stored zeros behind (e.g. {@code a - a}). They do not change any result,
 * and are removed only by {@link #clean()}.
 * This class should be initialized by {@link edu.snu.sparsemat.common.math.linalg.MatrixFactory}.
 */
public final class SparseMatrix implements Matrix {
  private static final Logger LOG = Logger.getLogger(SparseMatrix.class.getName());

  private final int rows;
  private final int columns;
  private final SparseRow[] data;

  /**
   * Creates a matrix with no stored elements.
   */
  SparseMatrix(final int rows, final int columns) {
    this(rows, columns, new SparseRow[rows]);
    for (int i = 0; i < rows; i++) {
      data[i] = new SparseRow();
    }
  }

  /**
   * Creates a matrix owning the given rows. The rows must not be shared with another matrix.
   */
  SparseMatrix(final int rows, final int columns, final SparseRow[] data) {
    this.rows = rows;
    this.columns = columns;
    this.data = data;
  }

  /**
   * Returns the number of elements.
   * @return number of elements
   */
  @Override
  public long size() {
    return (long) rows * columns;
  }

  /**
   * Returns the number of stored elements.
   * @return number of stored elements, stored zeros included
   */
  @Override
  public int activeSize() {
    int activeSize = 0;
    for (final SparseRow row : data) {
      activeSize += row.size();
    }
    return activeSize;
  }

  @Override
  public int getRows() {
    return rows;
  }

  @Override
  public int getColumns() {
    return columns;
  }

  /**
   * Returns a copy of a row, e.g. to iterate over its stored elements.
   * @param index an index in range [0, rows)
   * @return a copy of the row
   */
  public SparseRow getRow(final int index) {
    if (index < 0 || index >= rows) {
      throw new MatrixException(MatrixError.INDEX_OUT_OF_RANGE);
    }
    return data[index].copy();
  }

  @Override
  public double get(final int rowIndex, final int columnIndex) {
    checkIndices(rowIndex, columnIndex);
    return data[rowIndex].at(columnIndex);
  }

  @Override
  public void set(final int rowIndex, final int columnIndex, final double value) {
    checkIndices(rowIndex, columnIndex);
    data[rowIndex].set(columnIndex, value);
  }

  @Override
  public SparseMatrix copy() {
    final SparseRow[] copied = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      copied[i] = data[i].copy();
    }
    return new SparseMatrix(rows, columns, copied);
  }

  @Override
  public double[][] toArray() {
    final double[][] dense = new double[rows][columns];
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      for (int k = 0; k < row.size(); k++) {
        dense[i][row.indexAt(k)] = row.valueAt(k);
      }
    }
    return dense;
  }

  @Override
  public double[] elements() {
    int nonZeros = 0;
    for (final SparseRow row : data) {
      for (int k = 0; k < row.size(); k++) {
        if (row.valueAt(k) != 0) {
          nonZeros++;
        }
      }
    }
    final double[] elements = new double[nonZeros];
    int next = 0;
    for (final SparseRow row : data) {
      for (int k = 0; k < row.size(); k++) {
        if (row.valueAt(k) != 0) {
          elements[next++] = row.valueAt(k);
        }
      }
    }
    return elements;
  }

  @Override
  public double trace() {
    checkSquare();
    double trace = 0;
    for (int i = 0; i < rows; i++) {
      trace += data[i].at(i);
    }
    return trace;
  }

  @Override
  public double min() {
    double min = Double.MAX_VALUE;
    for (final SparseRow row : data) {
      min = Math.min(row.min(), min);
      if (row.size() < columns) {
        min = Math.min(min, 0);
      }
    }
    return min;
  }

  @Override
  public double max() {
    double max = -Double.MAX_VALUE;
    for (final SparseRow row : data) {
      max = Math.max(row.max(), max);
      if (row.size() < columns) {
        max = Math.max(max, 0);
      }
    }
    return max;
  }

  @Override
  public double minNonZero() {
    double min = Double.MAX_VALUE;
    boolean found = false;
    for (final SparseRow row : data) {
      if (row.hasNonZero()) {
        min = Math.min(row.minNonZero(), min);
        found = true;
      }
    }
    return found ? min : 0;
  }

  @Override
  public double maxNonZero() {
    double max = -Double.MAX_VALUE;
    boolean found = false;
    for (final SparseRow row : data) {
      if (row.hasNonZero()) {
        max = Math.max(row.maxNonZero(), max);
        found = true;
      }
    }
    return found ? max : 0;
  }

  @Override
  public double sum() {
    double sum = 0;
    for (final SparseRow row : data) {
      sum += row.sum();
    }
    return sum;
  }

  /**
   * {@inheritDoc}
   * The 2-norm (largest singular value) is not implemented.
   */
  @Override
  public double norm(final int order) {
    final int effectiveOrder = order == 0 ? NORM_FRO : order;
    switch (effectiveOrder) {
    case 2:
    case -2:
      throw new NotImplementedException("2-norm needs a singular value decomposition");
    case 1:
      return max(absoluteColumnSums());
    case -1:
      return min(absoluteColumnSums());
    case NORM_INF:
      return max(absoluteRowSums());
    case -NORM_INF:
      return min(absoluteRowSums());
    case NORM_FRO:
      double squares = 0;
      for (final SparseRow row : data) {
        for (int k = 0; k < row.size(); k++) {
          squares += row.valueAt(k) * row.valueAt(k);
        }
      }
      return Math.sqrt(squares);
    default:
      throw new MatrixException(MatrixError.NORM_ORDER);
    }
  }

  private double[] absoluteColumnSums() {
    final double[] sums = new double[columns];
    for (final SparseRow row : data) {
      for (int k = 0; k < row.size(); k++) {
        sums[row.indexAt(k)] += Math.abs(row.valueAt(k));
      }
    }
    return sums;
  }

  private double[] absoluteRowSums() {
    final double[] sums = new double[rows];
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      for (int k = 0; k < row.size(); k++) {
        sums[i] += Math.abs(row.valueAt(k));
      }
    }
    return sums;
  }

  private static double max(final double[] values) {
    double max = -Double.MAX_VALUE;
    for (final double value : values) {
      max = Math.max(value, max);
    }
    return max;
  }

  private static double min(final double[] values) {
    double min = Double.MAX_VALUE;
    for (final double value : values) {
      min = Math.min(value, min);
    }
    return min;
  }

  @Override
  public SparseMatrix sumAxis(final boolean alongColumns) {
    if (!alongColumns) {
      final double[] sums = new double[rows];
      for (int i = 0; i < rows; i++) {
        sums[i] = data[i].sum();
      }
      return columnVector(sums);
    }
    final double[] sums = new double[columns];
    for (int c = 0; c < columns; c++) {
      for (final SparseRow row : data) {
        sums[c] += row.at(c);
      }
    }
    return rowVector(sums);
  }

  /**
   * {@inheritDoc}
   * Rows with fewer stored elements than columns also take their implicit zeros into account.
   */
  @Override
  public SparseMatrix minAxis(final boolean alongColumns) {
    if (!alongColumns) {
      final double[] mins = new double[rows];
      for (int i = 0; i < rows; i++) {
        mins[i] = data[i].size() < columns ? Math.min(data[i].min(), 0) : data[i].min();
      }
      return columnVector(mins);
    }
    final double[] mins = new double[columns];
    for (int c = 0; c < columns; c++) {
      double min = Double.MAX_VALUE;
      for (final SparseRow row : data) {
        min = Math.min(row.at(c), min);
      }
      mins[c] = min;
    }
    return rowVector(mins);
  }

  /**
   * {@inheritDoc}
   * Rows with fewer stored elements than columns also take their implicit zeros into account.
   */
  @Override
  public SparseMatrix maxAxis(final boolean alongColumns) {
    if (!alongColumns) {
      final double[] maxs = new double[rows];
      for (int i = 0; i < rows; i++) {
        maxs[i] = data[i].size() < columns ? Math.max(data[i].max(), 0) : data[i].max();
      }
      return columnVector(maxs);
    }
    final double[] maxs = new double[columns];
    for (int c = 0; c < columns; c++) {
      double max = -Double.MAX_VALUE;
      for (final SparseRow row : data) {
        max = Math.max(row.at(c), max);
      }
      maxs[c] = max;
    }
    return rowVector(maxs);
  }

  private static SparseMatrix rowVector(final double[] values) {
    return new SparseMatrix(1, values.length, new SparseRow[]{SparseRow.fromDense(values)});
  }

  private static SparseMatrix columnVector(final double[] values) {
    final SparseRow[] vector = new SparseRow[values.length];
    for (int i = 0; i < values.length; i++) {
      vector[i] = SparseRow.fromDense(new double[]{values[i]});
    }
    return new SparseMatrix(values.length, 1, vector);
  }

  /**
   * {@inheritDoc}
   * Source rows are visited in ascending order, so every target row is filled in ascending order
   * and needs no sorting.
   */
  @Override
  public SparseMatrix transpose() {
    final int[] counts = new int[columns];
    for (final SparseRow row : data) {
      for (int k = 0; k < row.size(); k++) {
        counts[row.indexAt(k)]++;
      }
    }
    final SparseRow[] transposed = new SparseRow[columns];
    for (int c = 0; c < columns; c++) {
      transposed[c] = new SparseRow(counts[c]);
    }
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      for (int k = 0; k < row.size(); k++) {
        transposed[row.indexAt(k)].append(i, row.valueAt(k));
      }
    }
    return new SparseMatrix(columns, rows, transposed);
  }

  @Override
  public SparseMatrix upperTriangular() {
    checkSquare();
    final SparseRow[] upper = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      int from = 0;
      while (from < row.size() && row.indexAt(from) < i) {
        from++;
      }
      upper[i] = row.slice(from, row.size());
    }
    return new SparseMatrix(rows, columns, upper);
  }

  @Override
  public SparseMatrix lowerTriangular() {
    checkSquare();
    final SparseRow[] lower = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      int to = row.size();
      while (to > 0 && row.indexAt(to - 1) > i) {
        to--;
      }
      lower[i] = row.slice(0, to);
    }
    return new SparseMatrix(rows, columns, lower);
  }

  @Override
  public SparseMatrix augment(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    if (rows != other.rows) {
      throw new MatrixException(MatrixError.COLUMN_LENGTH);
    }
    final SparseRow[] augmented = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      final SparseRow left = data[i];
      final SparseRow right = other.data[i];
      final SparseRow row = new SparseRow(Math.max(left.size() + right.size(), 1));
      for (int k = 0; k < left.size(); k++) {
        row.append(left.indexAt(k), left.valueAt(k));
      }
      for (int k = 0; k < right.size(); k++) {
        row.append(right.indexAt(k) + columns, right.valueAt(k));
      }
      augmented[i] = row;
    }
    return new SparseMatrix(rows, columns + other.columns, augmented);
  }

  @Override
  public SparseMatrix stack(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    if (columns != other.columns) {
      throw new MatrixException(MatrixError.ROW_LENGTH);
    }
    final SparseRow[] stacked = new SparseRow[rows + other.rows];
    for (int i = 0; i < rows; i++) {
      stacked[i] = data[i].copy();
    }
    for (int i = 0; i < other.rows; i++) {
      stacked[rows + i] = other.data[i].copy();
    }
    return new SparseMatrix(rows + other.rows, columns, stacked);
  }

  @Override
  public SparseMatrix filter(final FilterFunction function) {
    final SparseRow[] filtered = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      final SparseRow kept = new SparseRow(Math.max(row.size(), 1));
      for (int k = 0; k < row.size(); k++) {
        if (function.accept(i, row.indexAt(k), row.valueAt(k))) {
          kept.append(row.indexAt(k), row.valueAt(k));
        }
      }
      filtered[i] = kept;
    }
    return new SparseMatrix(rows, columns, filtered);
  }

  @Override
  public SparseMatrix apply(final ApplyFunction function) {
    final SparseMatrix applied = copy();
    for (int i = 0; i < rows; i++) {
      final SparseRow row = applied.data[i];
      for (int k = 0; k < row.size(); k++) {
        final double value = row.valueAt(k);
        final double result = function.apply(i, row.indexAt(k), value);
        if (result != value) {
          row.setValueAt(k, result);
        }
      }
    }
    return applied;
  }

  @Override
  public SparseMatrix applyAll(final ApplyFunction function) {
    final SparseMatrix applied = copy();
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      for (int c = 0; c < columns; c++) {
        final double value = row.at(c);
        final double result = function.apply(i, c, value);
        if (result != value) {
          applied.data[i].set(c, result);
        }
      }
    }
    return applied;
  }

  /**
   * {@inheritDoc}
   * Every value other than zero is kept, {@code NaN} included.
   */
  @Override
  public SparseMatrix clean() {
    return compact(value -> value != 0, 0);
  }

  @Override
  public SparseMatrix clean(final double epsilon) {
    return compact(value -> Math.abs(value) > epsilon, epsilon);
  }

  private SparseMatrix compact(final DoublePredicate keep, final double epsilon) {
    final SparseRow[] cleaned = new SparseRow[rows];
    int removed = 0;
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      int kept = 0;
      for (int k = 0; k < row.size(); k++) {
        if (keep.test(row.valueAt(k))) {
          kept++;
        }
      }
      cleaned[i] = new SparseRow(kept);
      for (int k = 0; k < row.size(); k++) {
        if (keep.test(row.valueAt(k))) {
          cleaned[i].append(row.indexAt(k), row.valueAt(k));
        }
      }
      removed += row.size() - kept;
    }
    LOG.log(Level.FINE, "Removed {0} stored elements within {1} of zero", new Object[]{removed, epsilon});
    return new SparseMatrix(rows, columns, cleaned);
  }

  @Override
  public SparseMatrix add(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    checkSameShape(other);
    final SparseRow[] sum = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      sum[i] = data[i].foldAdd(other.data[i]);
    }
    return new SparseMatrix(rows, columns, sum);
  }

  @Override
  public SparseMatrix sub(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    checkSameShape(other);
    final SparseRow[] difference = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      difference[i] = data[i].foldSub(other.data[i]);
    }
    return new SparseMatrix(rows, columns, difference);
  }

  @Override
  public SparseMatrix mulElementwise(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    checkSameShape(other);
    final SparseRow[] product = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      product[i] = data[i].foldMul(other.data[i]);
    }
    return new SparseMatrix(rows, columns, product);
  }

  @Override
  public SparseMatrix scale(final double value) {
    final SparseRow[] scaled = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      scaled[i] = data[i].scale(value);
    }
    return new SparseMatrix(rows, columns, scaled);
  }

  @Override
  public double innerProduct(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    checkSameShape(other);
    double product = 0;
    for (int i = 0; i < rows; i++) {
      product += data[i].foldMulSum(other.data[i]);
    }
    return product;
  }

  /**
   * {@inheritDoc}
   * Each column of the operand is gathered into a buffer borrowed from the process-wide
   * {@link ScratchBufferPool}, then multiplied with every row of this matrix.
   * Only non-zero results are stored.
   */
  @Override
  public SparseMatrix mmul(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    if (columns != other.rows) {
      throw new MatrixException(MatrixError.SHAPE);
    }
    LOG.log(Level.FINEST, "Multiplying {0}x{1} by {2}x{3}", new Object[]{rows, columns, other.rows, other.columns});

    final SparseRow[] product = new SparseRow[rows];
    for (int i = 0; i < rows; i++) {
      product[i] = new SparseRow();
    }
    try (ScratchBufferPool.Lease lease = ScratchBufferPool.get().borrow()) {
      final SparseRow column = lease.buffer();
      for (int c = 0; c < other.columns; c++) {
        for (int r = 0; r < other.rows; r++) {
          final double value = other.data[r].at(c);
          if (value != 0) {
            column.append(r, value);
          }
        }
        for (int i = 0; i < rows; i++) {
          final double value = data[i].foldMulSum(column);
          if (value != 0) {
            product[i].append(c, value);
          }
        }
        column.truncate();
      }
    }
    return new SparseMatrix(rows, other.columns, product);
  }

  @Override
  public boolean equalTo(final Matrix matrix) {
    final SparseMatrix other = toSparse(matrix);
    if (rows != other.rows || columns != other.columns) {
      return false;
    }
    for (int i = 0; i < rows; i++) {
      if (!data[i].foldEqual(other.data[i])) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean approxEqualTo(final Matrix matrix, final double epsilon) {
    final SparseMatrix other = toSparse(matrix);
    if (rows != other.rows || columns != other.columns) {
      return false;
    }
    for (int i = 0; i < rows; i++) {
      if (!data[i].foldApprox(other.data[i], epsilon)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Not implemented yet. Only the element count is checked.
   */
  @Override
  public Matrix reshape(final int newRows, final int newColumns) {
    if ((long) newRows * newColumns != size()) {
      throw new MatrixException(MatrixError.SHAPE);
    }
    throw new NotImplementedException("reshape is not supported for sparse matrix");
  }

  /**
   * Not implemented yet.
   */
  @Override
  public double determinant() {
    throw new NotImplementedException("determinant is not supported for sparse matrix");
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof SparseMatrix) {
      return equalTo((SparseMatrix) o);
    } else {
      return false;
    }
  }

  /**
   * Hashes the non-zero elements only, so that stored zeros do not break the contract with
   * {@link #equals(Object)}.
   */
  @Override
  public int hashCode() {
    int hash = 31 * rows + columns;
    for (int i = 0; i < rows; i++) {
      final SparseRow row = data[i];
      for (int k = 0; k < row.size(); k++) {
        if (row.valueAt(k) != 0) {
          hash = 31 * hash + Long.hashCode((long) i * columns + row.indexAt(k));
          hash = 31 * hash + Double.hashCode(row.valueAt(k));
        }
      }
    }
    return hash;
  }

  @Override
  public String toString() {
    return "SparseMatrix(" + rows + "x" + columns + ", " + activeSize() + " stored)";
  }

  private static SparseMatrix toSparse(final Matrix matrix) {
    if (matrix instanceof SparseMatrix) {
      return (SparseMatrix) matrix;
    }
    throw new NotImplementedException("Operations between SparseMatrix and "
        + matrix.getClass().getName() + " are not implemented");
  }

  private void checkIndices(final int rowIndex, final int columnIndex) {
    if (rowIndex < 0 || rowIndex >= rows || columnIndex < 0 || columnIndex >= columns) {
      throw new MatrixException(MatrixError.INDEX_OUT_OF_RANGE);
    }
  }

  private void checkSquare() {
    if (rows != columns) {
      throw new MatrixException(MatrixError.SQUARE);
    }
  }

  private void checkSameShape(final SparseMatrix other) {
    if (rows != other.rows || columns != other.columns) {
      throw new MatrixException(MatrixError.SHAPE);
    }
  }
}
