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

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.ejml.data.DenseMatrix64F;

/**
 * Column-wise ordinary least squares with missing values.
 *
 * <p>Columns without any missing value share one set of normal equations and are solved in a
 * single pass.  Every other column is solved on its own valid rows.  Columns with fewer valid
 * rows than coefficients are left as NaN.
 */
public class OrdinaryLeastSquares implements RegressionProvider {

  @Override
  public RegressionFit fit(DenseMatrix64F x, DenseMatrix64F y) throws SingularMatrixException {
    Preconditions.checkArgument(x.numRows == y.numRows,
        "x has %s rows but y has %s", x.numRows, y.numRows);
    int numObs = x.numRows;

    DenseMatrix64F coefs = ArrayHelper.filled(x.numCols, y.numCols, Double.NaN);
    DenseMatrix64F residuals = ArrayHelper.filled(numObs, y.numCols, Double.NaN);

    IntArrayList complete = new IntArrayList();
    for (int col = 0; col < y.numCols; col++) {
      int count = ArrayHelper.countValid(y, col, 0, numObs);
      if (count == numObs) {
        complete.add(col);
      } else if (count >= x.numCols) {
        solve(x, y, new int[] {col}, coefs, residuals);
      }
    }
    if (!complete.isEmpty() && numObs >= x.numCols) {
      solve(x, y, complete.toIntArray(), coefs, residuals);
    }
    return new RegressionFit(coefs, residuals);
  }

  /**
   * Solve the given columns on the rows where all of them hold a value, and store coefficients
   * and residuals at the original column positions.
   */
  private static void solve(DenseMatrix64F x, DenseMatrix64F y, int[] cols,
      DenseMatrix64F coefs, DenseMatrix64F residuals) throws SingularMatrixException {
    int numX = x.numCols;
    LinearLeastSquares lls = new LinearLeastSquares(numX, cols.length);
    double[] yRow = new double[cols.length];
    for (int i = 0; i < x.numRows; i++) {
      if (loadRow(y, i, cols, yRow)) {
        lls.addInput(x.data, i * numX, yRow, 0);
      }
    }

    DenseMatrix64F solution = new DenseMatrix64F(numX, cols.length);
    if (!lls.getSolution(solution)) {
      throw new SingularMatrixException(String.format(
          "Normal equations of %d observations and %d coefficients are not solvable",
          lls.getNumInputs(), numX));
    }

    for (int j = 0; j < cols.length; j++) {
      for (int p = 0; p < numX; p++) {
        coefs.unsafe_set(p, cols[j], solution.unsafe_get(p, j));
      }
      for (int i = 0; i < x.numRows; i++) {
        double value = y.unsafe_get(i, cols[j]);
        if (!Double.isNaN(value)) {
          residuals.unsafe_set(i, cols[j], value - predict(x, i, solution, j));
        }
      }
    }
  }

  /** Copy row i of the given columns into yRow; returns false if any of them is NaN. */
  private static boolean loadRow(DenseMatrix64F y, int i, int[] cols, double[] yRow) {
    for (int j = 0; j < cols.length; j++) {
      yRow[j] = y.unsafe_get(i, cols[j]);
      if (Double.isNaN(yRow[j])) {
        return false;
      }
    }
    return true;
  }

  /** Prediction for row i of x using column col of coefs. */
  static double predict(DenseMatrix64F x, int i, DenseMatrix64F coefs, int col) {
    double v = 0;
    for (int p = 0; p < x.numCols; p++) {
      v += x.unsafe_get(i, p) * coefs.unsafe_get(p, col);
    }
    return v;
  }
}
