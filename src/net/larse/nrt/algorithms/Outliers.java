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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import net.larse.nrt.helper.OrdinaryLeastSquares;
import net.larse.nrt.helper.RegressionFit;
import net.larse.nrt.helper.RobustLeastSquares;
import net.larse.nrt.helper.SingularMatrixException;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outlier screening of (time x pixel) observations ahead of a stable fit.  Outliers are set to
 * NaN in a copy of the observations.
 *
 * <p>References:
 * <ul>
 *   <li>Brooks, E.B., Wynne, R.H., Thomas, V.A., Blinn, C.E. and Coulston, J.W., 2014.
 *   On-the-fly massively multitemporal change detection using statistical quality control
 *   charts and Landsat data. IEEE TGRS, 52(6), pp.3316-3332.</li>
 *   <li>Zhu, Z. and Woodcock, C.E., 2014. Continuous change detection and classification of
 *   land cover using all available Landsat data. RSE 144, pp.152-171.</li>
 * </ul>
 */
public class Outliers {
  private static final Logger log = LoggerFactory.getLogger(Outliers.class);

  // Residual threshold of the green/SWIR screening, in reflectance.
  private static final double REFLECTANCE_THRESHOLD = 0.04;

  private Outliers() {}

  /**
   * Shewhart control chart: after an OLS fit, observations whose residual exceeds
   * controlLimit standard deviations of that pixel's residuals are removed.
   *
   * @param x [NUM_OBSERVATIONS][NUM_COEFFS] design matrix
   * @param y [NUM_OBSERVATIONS][NUM_PIXELS] observations, NaN when missing; not modified
   * @param controlLimit positive; lower values filter more
   */
  public static DenseMatrix64F shewhart(DenseMatrix64F x, DenseMatrix64F y, double controlLimit)
      throws SingularMatrixException {
    Preconditions.checkArgument(controlLimit > 0, "controlLimit must be positive");
    RegressionFit fit = new OrdinaryLeastSquares().fit(x, y);

    DenseMatrix64F result = y.copy();
    StandardDeviation sd = new StandardDeviation(false);
    DoubleArrayList values = new DoubleArrayList();
    for (int col = 0; col < y.numCols; col++) {
      values.clear();
      for (int i = 0; i < y.numRows; i++) {
        double r = fit.residuals.unsafe_get(i, col);
        if (!Double.isNaN(r)) {
          values.add(r);
        }
      }
      if (values.isEmpty()) {
        continue;
      }
      double limit = controlLimit * sd.evaluate(values.toDoubleArray());
      for (int i = 0; i < y.numRows; i++) {
        if (Math.abs(fit.residuals.unsafe_get(i, col)) > limit) {
          result.unsafe_set(i, col, Double.NaN);
        }
      }
    }
    return result;
  }

  /**
   * Screen for missed clouds and shadows with robust fits of the green and SWIR bands.  An
   * observation is an outlier if its green residual is above 0.04 or its SWIR residual is below
   * -0.04 (in reflectance, times scalingFactor).
   *
   * @param x [NUM_OBSERVATIONS][NUM_COEFFS] design matrix
   * @param y [NUM_OBSERVATIONS][ROWS * COLS] observations, NaN when missing; not modified
   * @param green [NUM_OBSERVATIONS][ROWS][COLS] green reflectance
   * @param swir [NUM_OBSERVATIONS][ROWS][COLS] SWIR (~1.55-1.75um) reflectance
   * @param scalingFactor factor bringing green and swir to reflectances in [0, 1]
   */
  public static ScreeningResult ccdcRirls(DenseMatrix64F x, DenseMatrix64F y,
      double[][][] green, double[][][] swir, double scalingFactor, RobustLeastSquares.Args args)
      throws SingularMatrixException {
    DenseMatrix64F greenFlat = flatten(green);
    DenseMatrix64F swirFlat = flatten(swir);
    Preconditions.checkArgument(greenFlat.numRows == swirFlat.numRows
        && greenFlat.numCols == swirFlat.numCols, "green and swir must have the same shape");
    Preconditions.checkArgument(y.numRows == greenFlat.numRows && y.numCols == greenFlat.numCols,
        "y must be [%s][%s]", greenFlat.numRows, greenFlat.numCols);

    RobustLeastSquares rirls = new RobustLeastSquares(args);
    DenseMatrix64F greenResiduals = rirls.fit(x, greenFlat).residuals;
    DenseMatrix64F swirResiduals = rirls.fit(x, swirFlat).residuals;

    double threshold = REFLECTANCE_THRESHOLD * scalingFactor;
    boolean[][] clear = new boolean[y.numRows][y.numCols];
    DenseMatrix64F result = y.copy();
    int removed = 0;
    int valid = 0;
    for (int i = 0; i < y.numRows; i++) {
      for (int col = 0; col < y.numCols; col++) {
        boolean outlier = greenResiduals.unsafe_get(i, col) > threshold
            || swirResiduals.unsafe_get(i, col) < -threshold;
        clear[i][col] = !outlier;
        if (outlier) {
          result.unsafe_set(i, col, Double.NaN);
          removed++;
        }
        if (!Double.isNaN(greenFlat.unsafe_get(i, col))) {
          valid++;
        }
      }
    }
    if (log.isDebugEnabled()) {
      log.debug(String.format("%.2f%% of (non nan) pixels removed.",
          valid == 0 ? 0.0 : 100.0 * removed / valid));
    }
    return new ScreeningResult(clear, result);
  }

  /** [time][row][col] to [time][row * COLS + col]. */
  static DenseMatrix64F flatten(double[][][] cube) {
    Preconditions.checkArgument(cube.length > 0 && cube[0].length > 0, "empty array");
    int rows = cube[0].length;
    int cols = cube[0][0].length;
    DenseMatrix64F flat = new DenseMatrix64F(cube.length, rows * cols);
    for (int t = 0; t < cube.length; t++) {
      Preconditions.checkArgument(cube[t].length == rows, "ragged array at time %s", t);
      for (int r = 0; r < rows; r++) {
        Preconditions.checkArgument(cube[t][r].length == cols, "ragged array at time %s", t);
        for (int c = 0; c < cols; c++) {
          flat.unsafe_set(t, r * cols + c, cube[t][r][c]);
        }
      }
    }
    return flat;
  }
}
