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

/**
 * A stored element of a {@link SparseRow}: a column index and its value.
 */
public final class SparseElement {
  private final int index;
  private final double value;

  SparseElement(final int index, final double value) {
    this.index = index;
    this.value = value;
  }

  public int getIndex() {
    return index;
  }

  public double getValue() {
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SparseElement)) {
      return false;
    }
    final SparseElement that = (SparseElement) o;
    return index == that.index && Double.compare(value, that.value) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * index + Double.hashCode(value);
  }

  @Override
  public String toString() {
    return "(" + index + ", " + value + ")";
  }
}
