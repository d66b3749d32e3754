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

import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.MatrixFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Robust iteratively reweighted least squares with the Tukey bisquare weight function.
 *
 * <p>Each column is seeded with its ordinary least squares solution and then refit with weights
 * computed from the residuals scaled by their median absolute deviation.  Missing values are
 * ignored per column.
 */
public class RobustLeastSquares implements RegressionProvider {
  private static final Logger log = LoggerFactory.getLogger(RobustLeastSquares.class);

  public static class Args extends ArgsBase {
    @Doc(help = "Maximum number of reweighting iterations.")
    @Optional
    public int maxIterations = 50;

    @Doc(help = "Iterations stop once no coefficient changes by more than this.")
    @Optional
    public double tolerance = 1e-8;

    @Doc(help = "Tuning constant of the bisquare function, in units of the residual scale.")
    @Optional
    public double tuningConstant = 4.685;

    @Doc(help = "Normalizing constant turning the median absolute residual into a scale.")
    @Optional
    public double scaleConstant = 0.6745;
  }

  private final Args args;

  public RobustLeastSquares() {
    this(new Args());
  }

  public RobustLeastSquares(Args args) {
    Preconditions.checkArgument(args.maxIterations >= 0, "maxIterations must not be negative");
    Preconditions.checkArgument(args.tuningConstant > 0, "tuningConstant must be positive");
    Preconditions.checkArgument(args.scaleConstant > 0, "scaleConstant must be positive");
    this.args = args;
  }

  @Override
  public RegressionFit fit(DenseMatrix64F x, DenseMatrix64F y) throws SingularMatrixException {
    Preconditions.checkArgument(x.numRows == y.numRows,
        "x has %s rows but y has %s", x.numRows, y.numRows);
    int numX = x.numCols;
    DenseMatrix64F coefs = ArrayHelper.filled(numX, y.numCols, Double.NaN);
    DenseMatrix64F residuals = ArrayHelper.filled(x.numRows, y.numCols, Double.NaN);

    for (int col = 0; col < y.numCols; col++) {
      int count = ArrayHelper.countValid(y, col, 0, y.numRows);
      if (count < numX) {
        continue;
      }
      // Keep only the rows where this column has a value.
      int[] rows = new int[count];
      DenseMatrix64F a = new DenseMatrix64F(count, numX);
      double[] b = new double[count];
      int pos = 0;
      for (int i = 0; i < y.numRows; i++) {
        double value = y.unsafe_get(i, col);
        if (!Double.isNaN(value)) {
          rows[pos] = i;
          System.arraycopy(x.data, i * numX, a.data, pos * numX, numX);
          b[pos++] = value;
        }
      }

      double[] beta = getSolution(a, b);
      for (int p = 0; p < numX; p++) {
        coefs.unsafe_set(p, col, beta[p]);
      }
      for (int k = 0; k < count; k++) {
        residuals.unsafe_set(rows[k], col, b[k] - predict(a, k, beta));
      }
    }
    return new RegressionFit(coefs, residuals);
  }

  /**
   * Robust coefficients of a single column.
   *
   * @param a [NUM_VALID][NUM_COEFFS] design rows of the valid observations
   * @param b the valid observations
   */
  double[] getSolution(DenseMatrix64F a, double[] b) throws SingularMatrixException {
    int numX = a.numCols;
    LinearLeastSquares lls = new LinearLeastSquares(numX, 1);

    // Seed the search with the ordinary least squares solution.
    DenseMatrix64F x = new DenseMatrix64F(numX, 1);
    for (int i = 0; i < a.numRows; i++) {
      lls.addInput(a.data, i * numX, b, i);
    }
    if (!lls.getSolution(x)) {
      throw new SingularMatrixException(String.format(
          "Normal equations of %d observations and %d coefficients are not solvable",
          a.numRows, numX));
    }

    // With a perfect or near perfect fit the residual scale collapses; never let it drop below
    // a small fraction of the spread of the raw response values.
    double tinyS = 1e-6 * new StandardDeviation().evaluate(b);
    if (tinyS == 0) {
      tinyS = 1.0;
    }

    double[] r = new double[b.length];
    double[] w = new double[b.length];
    DenseMatrix64F x0 = new DenseMatrix64F(numX, 1);

    for (int iter = 1; iter <= args.maxIterations; iter++) {
      for (int i = 0; i < b.length; i++) {
        r[i] = b[i] - predict(a, i, x.data);
      }
      double scale = Math.max(madsigma(r, numX), tinyS);
      bisquare(r, scale * args.tuningConstant, w);

      lls.reset();
      for (int i = 0; i < a.numRows; i++) {
        lls.addWeightedInput(a.data, i * numX, b, i, w[i]);
      }

      // Swap x and x0 so we can check for convergence after the solve.
      DenseMatrix64F tmp = x0;
      x0 = x;
      x = tmp;
      if (!lls.getSolution(x)) {
        // Too many observations were weighted out; the previous estimate stands.
        log.debug("Weighted fit degenerate at iteration {}, keeping previous estimate", iter);
        x = x0;
        break;
      }
      if (MatrixFeatures.isEquals(x, x0, args.tolerance)) {
        break;
      }
    }
    return x.getData().clone();
  }

  /**
   * Square roots of the bisquare weights, (1 - u^2) for |u| <= 1 and 0 otherwise, with
   * u = r / s.  Rows of the weighted system are multiplied by these.
   */
  private static void bisquare(double[] r, double s, double[] w) {
    for (int i = 0; i < r.length; i++) {
      double v = Math.abs(r[i] / s);
      w[i] = v > 1 ? 0 : 1 - v * v;
    }
  }

  /**
   * Median of the absolute residuals after dropping the p - 1 closest to 0, normalized to a
   * standard deviation.
   */
  private double madsigma(double[] r, int p) {
    double[] absR = new double[r.length];
    for (int i = 0; i < absR.length; i++) {
      absR[i] = Math.abs(r[i]);
    }
    Arrays.sort(absR);

    DescriptiveStatistics ds = new DescriptiveStatistics();
    for (int i = Math.max(0, p - 1); i < absR.length; i++) {
      ds.addValue(absR[i]);
    }
    return ds.getPercentile(50.0) / args.scaleConstant;
  }

  private static double predict(DenseMatrix64F a, int row, double[] beta) {
    double v = 0;
    for (int p = 0; p < a.numCols; p++) {
      v += a.unsafe_get(row, p) * beta[p];
    }
    return v;
  }
}
