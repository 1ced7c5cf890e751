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

import edu.snu.sparsemat.common.math.linalg.sparse.DefaultMatrixFactory;
import org.apache.reef.tang.annotations.DefaultImplementation;

import java.util.List;
import java.util.function.DoubleSupplier;

/**
 * Factory interface for {@link Matrix}.
 * Invalid input is reported with a {@link MatrixCreationException};
 * see {@link MatrixUtils#must(MatrixUtils.MatrixCreator)} for callers that treat it as a programming error.
 */
@DefaultImplementation(DefaultMatrixFactory.class)
public interface MatrixFactory {

  /**
   * Creates a sparse matrix with the given values. Only non-zero values are stored.
   * @param data elements of a matrix in row-major order, one array per row
   * @return a generated matrix
   * @throws MatrixCreationException if either dimension is zero or the rows differ in length
   */
  Matrix createSparse(double[][] data) throws MatrixCreationException;

  /**
   * Creates a sparse matrix in which all elements are equal to {@code 0}.
   * @param rows number of rows
   * @param columns number of columns
   * @return a generated matrix
   * @throws MatrixCreationException if either dimension is less than one
   */
  Matrix createSparseZeros(int rows, int columns) throws MatrixCreationException;

  /**
   * Creates a sparse identity matrix.
   * @param size number of rows and columns
   * @return a generated matrix
   * @throws MatrixCreationException if {@code size} is less than one
   */
  Matrix createSparseIdentity(int size) throws MatrixCreationException;

  /**
   * Creates a sparse matrix in which each element is independently populated
   * with probability {@code density}, taking its value from {@code generator}.
   * @param rows number of rows
   * @param columns number of columns
   * @param density probability that an element is populated
   * @param generator source of the populated values
   * @return a generated matrix
   * @throws MatrixCreationException if either dimension is less than one
   */
  Matrix createSparseRandom(int rows, int columns, double density, DoubleSupplier generator)
      throws MatrixCreationException;

  /**
   * Sets the seed of the random generator used by {@link #createSparseRandom}.
   * @param seed random seed
   */
  void setRandomSeed(long seed);

  /**
   * Creates a row vector holding the non-zero values of the given matrices, row by row.
   * @param matrices matrices whose values are concatenated
   * @return a generated {@code 1 x n} matrix, {@code n} being the number of non-zero values
   * @throws MatrixCreationException if the matrices hold no non-zero value
   */
  Matrix createSparseElements(List<Matrix> matrices) throws MatrixCreationException;
}
