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

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * One row of a {@link SparseMatrix}: the stored elements, kept in strictly ascending order of column index.
 * A column without a stored element holds zero. Stored zeros are allowed and are only
 * removed by {@link SparseMatrix#clean()}.
 *
 * The row does not know its logical width. Bounds are checked by the owning matrix, and the binary
 * operations assume both rows have the same width.
 */
public final class SparseRow implements Iterable<SparseElement> {
  private static final int DEFAULT_CAPACITY = 4;

  private int[] indices;
  private double[] values;
  private int size;

  /**
   * Creates an empty row.
   */
  public SparseRow() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates an empty row with room for {@code initialCapacity} elements.
   * @param initialCapacity the number of elements that can be stored without reallocation
   */
  public SparseRow(final int initialCapacity) {
    this.indices = new int[initialCapacity];
    this.values = new double[initialCapacity];
    this.size = 0;
  }

  private SparseRow(final int[] indices, final double[] values, final int size) {
    this.indices = indices;
    this.values = values;
    this.size = size;
  }

  /**
   * Creates a row storing the non-zero values of a dense row.
   * @param dense values of the row
   * @return a new row
   */
  public static SparseRow fromDense(final double[] dense) {
    int nonZeros = 0;
    for (final double value : dense) {
      if (value != 0) {
        nonZeros++;
      }
    }
    final SparseRow row = new SparseRow(nonZeros);
    for (int i = 0; i < dense.length; i++) {
      if (dense[i] != 0) {
        row.append(i, dense[i]);
      }
    }
    return row;
  }

  /**
   * @return the number of stored elements
   */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * @param position a position in range [0, size)
   * @return the column index of the element stored at {@code position}
   */
  public int indexAt(final int position) {
    checkPosition(position);
    return indices[position];
  }

  /**
   * @param position a position in range [0, size)
   * @return the value of the element stored at {@code position}
   */
  public double valueAt(final int position) {
    checkPosition(position);
    return values[position];
  }

  /**
   * Returns the value at a column.
   * @param index a column index
   * @return the stored value, or {@code 0} if nothing is stored at {@code index}
   */
  public double at(final int index) {
    final int position = Arrays.binarySearch(indices, 0, size, index);
    return position >= 0 ? values[position] : 0;
  }

  /**
   * Sets the value at a column. An existing element is overwritten, even with zero.
   * @param index a column index
   * @param value value to be set
   */
  public void set(final int index, final double value) {
    // rows are mostly filled in ascending order
    if (size == 0 || indices[size - 1] < index) {
      append(index, value);
      return;
    }
    final int position = Arrays.binarySearch(indices, 0, size, index);
    if (position >= 0) {
      values[position] = value;
    } else {
      insert(-position - 1, index, value);
    }
  }

  /**
   * Appends an element after the last stored one.
   * @param index a column index greater than every stored index
   * @param value value of the element
   */
  void append(final int index, final double value) {
    if (size > 0 && indices[size - 1] >= index) {
      throw new IllegalArgumentException("Index " + index + " does not follow the last index " + indices[size - 1]);
    }
    ensureCapacity(size + 1);
    indices[size] = index;
    values[size] = value;
    size++;
  }

  /**
   * Replaces the value stored at a position, keeping its column index.
   */
  void setValueAt(final int position, final double value) {
    checkPosition(position);
    values[position] = value;
  }

  /**
   * Drops every element, keeping the allocated capacity.
   */
  void truncate() {
    size = 0;
  }

  /**
   * @return the number of elements that can be stored without reallocation
   */
  int capacity() {
    return indices.length;
  }

  /**
   * Returns a copy of the elements stored in positions [from, to).
   */
  SparseRow slice(final int from, final int to) {
    return new SparseRow(Arrays.copyOfRange(indices, from, to), Arrays.copyOfRange(values, from, to), to - from);
  }

  /**
   * @return a deep copy of this row, trimmed to its size
   */
  public SparseRow copy() {
    return slice(0, size);
  }

  /**
   * @return the minimum stored value, or {@link Double#MAX_VALUE} if the row is empty
   */
  public double min() {
    double min = Double.MAX_VALUE;
    for (int i = 0; i < size; i++) {
      min = Math.min(values[i], min);
    }
    return min;
  }

  /**
   * @return the maximum stored value, or {@code -Double.MAX_VALUE} if the row is empty
   */
  public double max() {
    double max = -Double.MAX_VALUE;
    for (int i = 0; i < size; i++) {
      max = Math.max(values[i], max);
    }
    return max;
  }

  /**
   * @return true if a non-zero value is stored
   */
  public boolean hasNonZero() {
    for (int i = 0; i < size; i++) {
      if (values[i] != 0) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the minimum stored non-zero value, or {@link Double#MAX_VALUE} if there is none
   */
  public double minNonZero() {
    double min = Double.MAX_VALUE;
    for (int i = 0; i < size; i++) {
      if (values[i] != 0) {
        min = Math.min(values[i], min);
      }
    }
    return min;
  }

  /**
   * @return the maximum stored non-zero value, or {@code -Double.MAX_VALUE} if there is none
   */
  public double maxNonZero() {
    double max = -Double.MAX_VALUE;
    for (int i = 0; i < size; i++) {
      if (values[i] != 0) {
        max = Math.max(values[i], max);
      }
    }
    return max;
  }

  /**
   * @return the sum of the stored values
   */
  public double sum() {
    double sum = 0;
    for (int i = 0; i < size; i++) {
      sum += values[i];
    }
    return sum;
  }

  /**
   * Element-wise addition. Every index stored in either row is stored in the result,
   * even when the sum is zero.
   * @param other a row of the same width
   * @return a new row
   */
  public SparseRow foldAdd(final SparseRow other) {
    return foldUnion(other, false);
  }

  /**
   * Element-wise subtraction of {@code other} from this row. Every index stored in either row
   * is stored in the result, even when the difference is zero.
   * @param other a row of the same width
   * @return a new row
   */
  public SparseRow foldSub(final SparseRow other) {
    return foldUnion(other, true);
  }

  private SparseRow foldUnion(final SparseRow other, final boolean negateOther) {
    final SparseRow result = new SparseRow(Math.max(size + other.size, 1));
    int i = 0;
    int j = 0;
    while (i < size && j < other.size) {
      final int a = indices[i];
      final int b = other.indices[j];
      if (a < b) {
        result.append(a, values[i++]);
      } else if (a > b) {
        result.append(b, negateOther ? -other.values[j++] : other.values[j++]);
      } else {
        result.append(a, negateOther ? values[i++] - other.values[j++] : values[i++] + other.values[j++]);
      }
    }
    for (; i < size; i++) {
      result.append(indices[i], values[i]);
    }
    for (; j < other.size; j++) {
      result.append(other.indices[j], negateOther ? -other.values[j] : other.values[j]);
    }
    return result;
  }

  /**
   * Element-wise multiplication. Only indices stored in both rows are stored in the result.
   * @param other a row of the same width
   * @return a new row
   */
  public SparseRow foldMul(final SparseRow other) {
    final SparseRow result = new SparseRow(Math.max(Math.min(size, other.size), 1));
    int i = 0;
    int j = 0;
    while (i < size && j < other.size) {
      final int a = indices[i];
      final int b = other.indices[j];
      if (a < b) {
        i++;
      } else if (a > b) {
        j++;
      } else {
        result.append(a, values[i++] * other.values[j++]);
      }
    }
    return result;
  }

  /**
   * Sparse dot product.
   * @param other a row of the same width
   * @return the sum of the element-wise product of the two rows
   */
  public double foldMulSum(final SparseRow other) {
    double sum = 0;
    int i = 0;
    int j = 0;
    while (i < size && j < other.size) {
      final int a = indices[i];
      final int b = other.indices[j];
      if (a < b) {
        i++;
      } else if (a > b) {
        j++;
      } else {
        sum += values[i++] * other.values[j++];
      }
    }
    return sum;
  }

  /**
   * Checks element-wise equality. A missing element equals a stored zero.
   * @param other a row of the same width
   * @return true if every element of the two rows is equal
   */
  public boolean foldEqual(final SparseRow other) {
    return foldCompare(other, 0, true);
  }

  /**
   * Checks element-wise equality within tolerance. A missing element counts as zero.
   * @param other a row of the same width
   * @param epsilon the maximum difference for which two values are still considered equal
   * @return true if every element of the two rows is equal within {@code epsilon}
   */
  public boolean foldApprox(final SparseRow other, final double epsilon) {
    return foldCompare(other, epsilon, false);
  }

  private boolean foldCompare(final SparseRow other, final double epsilon, final boolean exact) {
    int i = 0;
    int j = 0;
    while (i < size || j < other.size) {
      final double a;
      final double b;
      if (j >= other.size || (i < size && indices[i] < other.indices[j])) {
        a = values[i++];
        b = 0;
      } else if (i >= size || indices[i] > other.indices[j]) {
        a = 0;
        b = other.values[j++];
      } else {
        a = values[i++];
        b = other.values[j++];
      }
      if (exact ? a != b : !(Math.abs(a - b) <= epsilon)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Multiplies every stored value. Scaling by zero leaves stored zeros.
   * @param factor operand scalar
   * @return a new row
   */
  public SparseRow scale(final double factor) {
    final SparseRow result = copy();
    for (int i = 0; i < result.size; i++) {
      result.values[i] *= factor;
    }
    return result;
  }

  @Override
  public Iterator<SparseElement> iterator() {
    return new Iterator<SparseElement>() {
      private int position = 0;

      @Override
      public boolean hasNext() {
        return position < size;
      }

      @Override
      public SparseElement next() {
        if (position >= size) {
          throw new NoSuchElementException();
        }
        final SparseElement element = new SparseElement(indices[position], values[position]);
        position++;
        return element;
      }
    };
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < size; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(indices[i]).append(':').append(values[i]);
    }
    return sb.append(']').toString();
  }

  private void insert(final int position, final int index, final double value) {
    ensureCapacity(size + 1);
    System.arraycopy(indices, position, indices, position + 1, size - position);
    System.arraycopy(values, position, values, position + 1, size - position);
    indices[position] = index;
    values[position] = value;
    size++;
  }

  private void ensureCapacity(final int minCapacity) {
    if (minCapacity > indices.length) {
      final int newCapacity = Math.max(minCapacity, indices.length << 1);
      indices = Arrays.copyOf(indices, newCapacity);
      values = Arrays.copyOf(values, newCapacity);
    }
  }

  private void checkPosition(final int position) {
    if (position < 0 || position >= size) {
      throw new IndexOutOfBoundsException("Position " + position + " is out of [0, " + size + ")");
    }
  }
}
