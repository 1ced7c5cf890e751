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
 * Function applied to matrix elements by {@link Matrix#apply(ApplyFunction)}
 * and {@link Matrix#applyAll(ApplyFunction)}.
 */
public interface ApplyFunction {

  /**
   * Computes the new value of an element.
   * @param rowIndex row index of the element
   * @param columnIndex column index of the element
   * @param value current value of the element
   * @return new value of the element
   */
  double apply(int rowIndex, int columnIndex, double value);
}
