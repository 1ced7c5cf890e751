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
 * Kinds of matrix misuse, shared by {@link MatrixException} and {@link MatrixCreationException}.
 */
public enum MatrixError {
  ZERO_LENGTH("matrix: zero length in matrix definition"),
  ROW_LENGTH("matrix: row length mismatch"),
  COLUMN_LENGTH("matrix: column length mismatch"),
  SHAPE("matrix: dimension mismatch"),
  SQUARE("matrix: expect square matrix"),
  INDEX_OUT_OF_RANGE("matrix: index out of range"),
  NORM_ORDER("matrix: invalid norm order for matrix");

  private final String message;

  MatrixError(final String message) {
    this.message = message;
  }

  public String getMessage() {
    return message;
  }
}
