/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.nrt.helper;

import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;

/**
 * Column-wise helpers for (time x pixel) matrices where missing observations are NaN.
 */
public class ArrayHelper {
  private ArrayHelper() {}

  /**
   * Count the non-NaN values of column col between rowStart (incl) and rowEnd (excl).
   */
  public static int countValid(DenseMatrix64F matrix, int col, int rowStart, int rowEnd) {
    int count = 0;
    for (int i = rowStart; i < rowEnd; i++) {
      if (!Double.isNaN(matrix.unsafe_get(i, col))) {
        count++;
      }
    }
    return count;
  }

  /**
   * Find the first row of column col holding a value.  Returns -1 if the column is all NaN.
   */
  public static int firstValid(DenseMatrix64F matrix, int col) {
    for (int i = 0; i < matrix.numRows; i++) {
      if (!Double.isNaN(matrix.unsafe_get(i, col))) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Find the last row of column col holding a value.  Returns -1 if the column is all NaN.
   */
  public static int lastValid(DenseMatrix64F matrix, int col) {
    for (int i = matrix.numRows - 1; i >= 0; i--) {
      if (!Double.isNaN(matrix.unsafe_get(i, col))) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Copy rows rowStart (incl) to rowEnd (excl) of the given columns into a new matrix.
   */
  public static DenseMatrix64F extract(DenseMatrix64F matrix, int rowStart, int rowEnd,
      int[] cols) {
    DenseMatrix64F result = new DenseMatrix64F(rowEnd - rowStart, cols.length);
    for (int i = rowStart; i < rowEnd; i++) {
      for (int j = 0; j < cols.length; j++) {
        result.unsafe_set(i - rowStart, j, matrix.unsafe_get(i, cols[j]));
      }
    }
    return result;
  }

  /**
   * Create a matrix with every element set to value.
   */
  public static DenseMatrix64F filled(int numRows, int numCols, double value) {
    DenseMatrix64F result = new DenseMatrix64F(numRows, numCols);
    CommonOps.fill(result, value);
    return result;
  }
}
