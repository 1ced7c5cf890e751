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

/**
 * Interface for matrix whose elements are {@code double} values.
 * Binary operations accept any {@link Matrix}, but an implementation only supports
 * operands of its own representation and throws
 * {@link org.apache.commons.lang3.NotImplementedException} for the others.
 * Apart from {@link #set(int, int, double)}, no operation modifies this matrix.
 */
public interface Matrix {

  /**
   * Norm order for the maximum absolute row sum. Its negation selects the minimum.
   */
  int NORM_INF = Integer.MAX_VALUE;

  /**
   * Norm order for the Frobenius norm. {@code 0} is an alias.
   */
  int NORM_FRO = Integer.MIN_VALUE;

  /**
   * Returns the number of elements, which may exceed {@code Integer.MAX_VALUE} for a sparse matrix.
   * @return number of elements
   */
  long size();

  /**
   * Returns the number of stored elements, including stored zeros.
   * @return number of stored elements
   */
  int activeSize();

  /**
   * Returns the number of rows.
   * @return number of rows
   */
  int getRows();

  /**
   * Returns the number of columns.
   * @return number of columns
   */
  int getColumns();

  /**
   * Returns the element specified by the row and column indices.
   * @param rowIndex an index in range [0, rows)
   * @param columnIndex an index in range [0, columns)
   * @return element specified by given indices
   */
  double get(int rowIndex, int columnIndex);

  /**
   * Sets a matrix element. Setting zero keeps a stored zero in place.
   * @param rowIndex an index in range [0, rows)
   * @param columnIndex an index in range [0, columns)
   * @param value given value
   */
  void set(int rowIndex, int columnIndex, double value);

  /**
   * Returns a new matrix same as this one.
   * @return a new copy of this matrix
   */
  Matrix copy();

  /**
   * Materializes every element of this matrix, implicit zeros included.
   * @return a new {@code rows x columns} array
   */
  double[][] toArray();

  /**
   * Returns the stored non-zero values, concatenated row by row.
   * @return stored non-zero values
   */
  double[] elements();

  /**
   * Returns the sum of the diagonal elements of a square matrix.
   * @return trace of this matrix
   */
  double trace();

  /**
   * Returns the minimum element, implicit zeros included.
   * @return minimum element
   */
  double min();

  /**
   * Returns the maximum element, implicit zeros included.
   * @return maximum element
   */
  double max();

  /**
   * Returns the minimum non-zero element.
   * @return minimum non-zero element, or {@code 0} if every element is zero
   */
  double minNonZero();

  /**
   * Returns the maximum non-zero element.
   * @return maximum non-zero element, or {@code 0} if every element is zero
   */
  double maxNonZero();

  /**
   * Returns the sum of all elements.
   * @return sum of all elements
   */
  double sum();

  /**
   * Computes a norm of this matrix.
   * Valid orders are {@code 1} and {@code -1} (max and min of the absolute column sums),
   * {@link #NORM_INF} and {@code -NORM_INF} (max and min of the absolute row sums)
   * and {@link #NORM_FRO} or {@code 0} (Frobenius norm).
   * @param order norm order
   * @return the norm
   */
  double norm(int order);

  /**
   * Sums the elements along an axis.
   * @param alongColumns true for a {@code 1 x columns} vector of column sums,
   *                     false for a {@code rows x 1} vector of row sums
   * @return a vector matrix with the sums
   */
  Matrix sumAxis(boolean alongColumns);

  /**
   * Takes the minimum along an axis.
   * @param alongColumns true for column minimums, false for row minimums
   * @return a vector matrix with the minimums
   */
  Matrix minAxis(boolean alongColumns);

  /**
   * Takes the maximum along an axis.
   * @param alongColumns true for column maximums, false for row maximums
   * @return a vector matrix with the maximums
   */
  Matrix maxAxis(boolean alongColumns);

  /**
   * Transpose this matrix.
   * @return transposed copy of this matrix
   */
  Matrix transpose();

  /**
   * Returns the upper triangular part (diagonal included) of a square matrix.
   * @return a new upper triangular matrix
   */
  Matrix upperTriangular();

  /**
   * Returns the lower triangular part (diagonal included) of a square matrix.
   * @return a new lower triangular matrix
   */
  Matrix lowerTriangular();

  /**
   * Concatenates a matrix with the same number of rows to the right of this matrix.
   * @param matrix operand matrix
   * @return a new {@code rows x (columns + matrix.columns)} matrix
   */
  Matrix augment(Matrix matrix);

  /**
   * Concatenates a matrix with the same number of columns below this matrix.
   * @param matrix operand matrix
   * @return a new {@code (rows + matrix.rows) x columns} matrix
   */
  Matrix stack(Matrix matrix);

  /**
   * Keeps the stored elements accepted by the given function.
   * @param function filter function
   * @return a new matrix with the accepted elements
   */
  Matrix filter(FilterFunction function);

  /**
   * Applies a function to the stored elements. Implicit zeros are not visited.
   * @param function function to apply
   * @return a new matrix with the results
   */
  Matrix apply(ApplyFunction function);

  /**
   * Applies a function to every element, implicit zeros included.
   * @param function function to apply
   * @return a new matrix with the results
   */
  Matrix applyAll(ApplyFunction function);

  /**
   * Removes stored zeros.
   * @return a new matrix without stored zeros
   */
  Matrix clean();

  /**
   * Removes stored elements whose absolute value does not exceed {@code epsilon}.
   * @param epsilon tolerance
   * @return a new compacted matrix
   */
  Matrix clean(double epsilon);

  /**
   * Adds a matrix, element-wise.
   * @param matrix operand matrix
   * @return operation result
   */
  Matrix add(Matrix matrix);

  /**
   * Subtracts a matrix from this matrix, element-wise.
   * @param matrix operand matrix
   * @return operation result
   */
  Matrix sub(Matrix matrix);

  /**
   * Multiplies this matrix by another matrix, element-wise.
   * @param matrix operand matrix
   * @return operation result
   */
  Matrix mulElementwise(Matrix matrix);

  /**
   * Multiplies all elements by a scalar.
   * @param value operand scalar
   * @return operation result
   */
  Matrix scale(double value);

  /**
   * Returns the sum of the element-wise product of this matrix and the operand.
   * @param matrix operand matrix
   * @return inner product
   */
  double innerProduct(Matrix matrix);

  /**
   * Matrix-Matrix multiplication.
   * @param matrix operand matrix
   * @return operation result
   */
  Matrix mmul(Matrix matrix);

  /**
   * Checks element-wise equality. Matrices of different dimensions are not equal.
   * @param matrix operand matrix
   * @return true if every element is equal
   */
  boolean equalTo(Matrix matrix);

  /**
   * Checks element-wise equality within tolerance.
   * @param matrix operand matrix
   * @param epsilon the maximum difference for which two elements are still considered equal
   * @return true if every element is equal within {@code epsilon}
   */
  boolean approxEqualTo(Matrix matrix, double epsilon);

  /**
   * Reshapes the matrix. The number of elements must not change.
   * @param newRows number of rows
   * @param newColumns number of columns
   * @return reshaped matrix
   */
  Matrix reshape(int newRows, int newColumns);

  /**
   * Returns the determinant of the matrix.
   * @return determinant
   */
  double determinant();
}
