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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import net.larse.nrt.helper.ArgsBase;
import net.larse.nrt.helper.ArrayHelper;
import net.larse.nrt.helper.FitException;
import net.larse.nrt.helper.InsufficientCoverageException;
import net.larse.nrt.helper.OrdinaryLeastSquares;
import net.larse.nrt.helper.RegressionFit;
import net.larse.nrt.helper.RegressionProvider;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits stable regressions with an adapted CCDC method (Zhu & Woodcock, 2014).
 *
 * <p>All pixels are first fit by OLS on the whole time series and tested with
 * {@link CcdcStability}.  The oldest observations of the unstable pixels are then dropped and
 * those pixels refit on the shorter window.  This goes on while
 * <ol>
 *   <li>there are unstable pixels left,</li>
 *   <li>they have more than {@code minObservationFactor} times the number of coefficients of
 *       valid observations in the window, and</li>
 *   <li>the window still covers at least one year.</li>
 * </ol>
 */
public class CcdcStableFit {
  private static final Logger log = LoggerFactory.getLogger(CcdcStableFit.class);

  // Row of the trend coefficient in the design matrix.
  public static final int SLOPE_INDEX = 1;

  // Mean length of a Gregorian year, in days.
  private static final double DAYS_PER_YEAR = 365.2425;

  public static class Args extends ArgsBase {
    @Doc(help = "Stability threshold, in RMSEs, for the slope and the first and last residuals.")
    @Optional
    public double threshold = 3;

    @Doc(help = "Number of oldest observations dropped from the window at each iteration.")
    @Optional
    public int windowStep = 2;

    @Doc(help = "A pixel needs more than this many times the number of coefficients of valid "
        + "observations to be fit.")
    @Optional
    public double minObservationFactor = 1.5;
  }

  private final Args args;
  private final RegressionProvider regression;
  private StableFitListener listener;

  public CcdcStableFit() {
    this(new Args());
  }

  public CcdcStableFit(Args args) {
    this(args, new OrdinaryLeastSquares());
  }

  public CcdcStableFit(Args args, RegressionProvider regression) {
    Preconditions.checkArgument(args.threshold > 0, "threshold must be positive");
    Preconditions.checkArgument(args.windowStep >= 1, "windowStep must be at least 1");
    Preconditions.checkArgument(args.minObservationFactor > 0,
        "minObservationFactor must be positive");
    this.args = args;
    this.regression = Preconditions.checkNotNull(regression);
  }

  /** Set the listener notified after every window shrink, or null for none. */
  public CcdcStableFit setListener(StableFitListener listener) {
    this.listener = listener;
    return this;
  }

  /**
   * Run the stable fit on a batch of pixels.
   *
   * @param x [NUM_OBSERVATIONS][NUM_COEFFS] design matrix, trend at column {@link #SLOPE_INDEX}
   * @param y [NUM_OBSERVATIONS][NUM_PIXELS] observations, NaN when missing
   * @param dates date of each observation, in increasing order
   * @throws InsufficientCoverageException if the dates span less than a year
   * @throws net.larse.nrt.helper.SingularMatrixException if a fit cannot be solved
   */
  public StableFitResult getResult(DenseMatrix64F x, DenseMatrix64F y, LocalDate[] dates)
      throws FitException {
    int numObs = x.numRows;
    int numVars = x.numCols;
    int numPixels = y.numCols;
    Preconditions.checkArgument(numObs > 0, "x has no rows");
    Preconditions.checkArgument(y.numRows == numObs && dates.length == numObs,
        "x, y and dates must have the same number of rows: %s, %s, %s",
        numObs, y.numRows, dates.length);
    Preconditions.checkArgument(numVars > SLOPE_INDEX, "x needs a trend column");

    if (!coversOneYear(dates, 0)) {
      throw new InsufficientCoverageException(String.format(
          "Dates from %s to %s cover less than a year", dates[0], dates[numObs - 1]));
    }
    log.debug("Stable fit of {} pixels over {} observations with {}", numPixels, numObs, args);

    double minCount = numVars * args.minObservationFactor;
    ColumnState[] states = new ColumnState[numPixels];
    IntArrayList active = new IntArrayList();
    for (int col = 0; col < numPixels; col++) {
      if (ArrayHelper.countValid(y, col, 0, numObs) > minCount) {
        states[col] = ColumnState.ITERATING;
        active.add(col);
      } else {
        states[col] = ColumnState.INSUFFICIENT_DATA;
      }
    }

    DenseMatrix64F beta = ArrayHelper.filled(numVars, numPixels, Double.NaN);
    DenseMatrix64F residuals = ArrayHelper.filled(numObs, numPixels, Double.NaN);

    int start = 0;
    int iteration = 0;
    while (!active.isEmpty()) {
      iteration++;
      int[] cols = active.toIntArray();
      DenseMatrix64F xSub = CommonOps.extract(x, start, numObs, 0, numVars);
      DenseMatrix64F ySub = ArrayHelper.extract(y, start, numObs, cols);

      // 1. Fit
      RegressionFit fit = regression.fit(xSub, ySub);
      double[] slope = new double[cols.length];
      for (int j = 0; j < cols.length; j++) {
        int col = cols[j];
        for (int p = 0; p < numVars; p++) {
          beta.unsafe_set(p, col, fit.coefficients.unsafe_get(p, j));
        }
        for (int i = 0; i < start; i++) {
          residuals.unsafe_set(i, col, Double.NaN);
        }
        for (int i = start; i < numObs; i++) {
          residuals.unsafe_set(i, col, fit.residuals.unsafe_get(i - start, j));
        }
        slope[j] = fit.coefficients.unsafe_get(SLOPE_INDEX, j);
      }

      // 2. Check stability and retire the stable pixels
      boolean[] stable = CcdcStability.isStable(slope, fit.residuals, args.threshold);
      IntArrayList unstable = new IntArrayList();
      for (int j = 0; j < cols.length; j++) {
        if (stable[j]) {
          states[cols[j]] = ColumnState.STABLE;
        } else {
          unstable.add(cols[j]);
        }
      }
      int newlyStable = cols.length - unstable.size();
      log.debug("Fitted {} stable pixels.", newlyStable);

      // 3. Shrink the window
      start += args.windowStep;
      if (start >= numObs || !coversOneYear(dates, start)) {
        notifyShrink(iteration, start, newlyStable, unstable.size(), states);
        break;
      }

      // 4. Drop the pixels without enough data left
      active = new IntArrayList();
      for (int k = 0; k < unstable.size(); k++) {
        int col = unstable.getInt(k);
        if (ArrayHelper.countValid(y, col, start, numObs) > minCount) {
          active.add(col);
        } else {
          states[col] = ColumnState.INSUFFICIENT_DATA;
        }
      }
      notifyShrink(iteration, start, newlyStable, active.size(), states);
    }

    return new StableFitResult(beta, residuals, states);
  }

  private void notifyShrink(int iteration, int start, int newlyStable, int activeCount,
      ColumnState[] states) {
    if (listener != null) {
      listener.onWindowShrink(
          new WindowShrinkEvent(iteration, start, newlyStable, activeCount, states.clone()));
    }
  }

  /** True if dates[start] to the last date is at least one year. */
  static boolean coversOneYear(LocalDate[] dates, int start) {
    return ChronoUnit.DAYS.between(dates[start], dates[dates.length - 1]) >= DAYS_PER_YEAR;
  }
}
