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
package net.larse.nrt.algorithms;

import com.google.common.base.Preconditions;

import net.larse.nrt.helper.ArrayHelper;
import org.ejml.data.DenseMatrix64F;

/**
 * Stability test of fitted models, after Zhu & Woodcock (2014).
 *
 * <p>A model is stable if all of
 * <pre>
 *   |slope| / RMSE             &lt; threshold
 *   |first residual| / RMSE    &lt; threshold
 *   |last residual| / RMSE     &lt; threshold
 * </pre>
 * hold, where the first and last residuals are those of the first and last valid observations.
 * Bands are tested independently; combining them is up to the caller.
 */
public class CcdcStability {
  private CcdcStability() {}

  /**
   * @param slope trend coefficient of each column
   * @param residuals [NUM_OBSERVATIONS][NUM_PIXELS] residuals, NaN when missing
   * @param threshold number of RMSEs a value may reach
   * @return true for every stable column
   */
  public static boolean[] isStable(double[] slope, DenseMatrix64F residuals, double threshold) {
    Preconditions.checkArgument(slope.length == residuals.numCols,
        "%s slopes for %s columns", slope.length, residuals.numCols);
    boolean[] stable = new boolean[slope.length];
    for (int col = 0; col < slope.length; col++) {
      int first = ArrayHelper.firstValid(residuals, col);
      if (first < 0) {
        continue;
      }
      int last = ArrayHelper.lastValid(residuals, col);
      double rmse = rmse(residuals, col);
      stable[col] = Math.abs(slope[col]) / rmse < threshold
          && Math.abs(residuals.get(first, col)) / rmse < threshold
          && Math.abs(residuals.get(last, col)) / rmse < threshold;
    }
    return stable;
  }

  /** Root mean square of the non-NaN values of a column. */
  static double rmse(DenseMatrix64F residuals, int col) {
    double sumSquare = 0;
    int count = 0;
    for (int i = 0; i < residuals.numRows; i++) {
      double r = residuals.unsafe_get(i, col);
      if (!Double.isNaN(r)) {
        sumSquare += r * r;
        count++;
      }
    }
    return Math.sqrt(sumSquare / count);
  }
}
