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

import java.util.Arrays;
import net.larse.nrt.helper.SingularMatrixException;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;
import org.ejml.ops.CommonOps;

/**
 * Standardized recursive residuals of a single time series.
 *
 * <p>An initial least squares fit is computed on the first {@code span} observations.  Every
 * following observation is predicted with the coefficients fit on all the observations before
 * it, and then folded into the fit with a rank-one (Sherman-Morrison) update of the inverse of
 * X'X instead of a refit:
 *
 * <pre>
 *   r = y_j - x_j * beta
 *   g = M * x_j'
 *   f = 1 + x_j * g
 *   M = M - g * g' / f
 *   beta = beta + g * r / f
 * </pre>
 *
 * The residual at row j is r / sqrt(f).  Rows before {@code span - 1} are NaN.
 */
public class RecursiveResiduals {
  private final DenseMatrix64F x;
  private final double[] y;
  private final int span;
  private final int numObservations;
  private final int numVars;

  private final double[] residuals;
  private final double[] variances;

  // State of the online fit.  inverseGram is (X'X)^-1 over the rows processed so far.
  private final DenseMatrix64F inverseGram;
  private final DenseMatrix64F beta;
  private final DenseMatrix64F xRow;
  private final DenseMatrix64F gain;
  private int nextRow;

  /**
   * @param x [NUM_OBSERVATIONS][NUM_COEFFS] design matrix
   * @param y observations, no missing values
   * @param span number of observations of the initial fit, numVars <= span < numObservations
   */
  public RecursiveResiduals(DenseMatrix64F x, double[] y, int span) {
    Preconditions.checkArgument(x.numRows == y.length,
        "x has %s rows but y has %s values", x.numRows, y.length);
    Preconditions.checkArgument(span >= x.numCols && span < x.numRows,
        "span must be in [%s, %s), got %s", x.numCols, x.numRows, span);
    for (double v : y) {
      Preconditions.checkArgument(!Double.isNaN(v), "y must not contain missing values");
    }
    this.x = x;
    this.y = y;
    this.span = span;
    this.numObservations = x.numRows;
    this.numVars = x.numCols;

    this.residuals = new double[numObservations];
    this.variances = new double[numObservations];
    Arrays.fill(residuals, Double.NaN);
    Arrays.fill(variances, Double.NaN);

    this.inverseGram = new DenseMatrix64F(numVars, numVars);
    this.beta = new DenseMatrix64F(numVars, 1);
    this.xRow = new DenseMatrix64F(1, numVars);
    this.gain = new DenseMatrix64F(numVars, 1);
  }

  /** Recursive residuals of y against x. */
  public static double[] recresid(DenseMatrix64F x, double[] y, int span)
      throws SingularMatrixException {
    return new RecursiveResiduals(x, y, span).getResult();
  }

  /**
   * Run the remaining updates and return the standardized residuals.
   *
   * @throws SingularMatrixException if X'X of the initial span is not invertible
   */
  public double[] getResult() throws SingularMatrixException {
    if (nextRow == 0) {
      initialize();
    }
    while (nextRow < numObservations) {
      update();
    }
    double[] result = new double[numObservations];
    for (int i = 0; i < numObservations; i++) {
      result[i] = residuals[i] / Math.sqrt(variances[i]);
    }
    return result;
  }

  /** Initial fit on rows [0, span) and the residual of its last row. */
  void initialize() throws SingularMatrixException {
    Preconditions.checkState(nextRow == 0, "already initialized");
    DenseMatrix64F x0 = CommonOps.extract(x, 0, span, 0, numVars);
    DenseMatrix64F y0 = new DenseMatrix64F(span, 1, true, Arrays.copyOf(y, span));

    DenseMatrix64F gram = new DenseMatrix64F(numVars, numVars);
    CommonOps.multTransA(x0, x0, gram);
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.symmPosDef(numVars);
    if (!solver.setA(gram) || !(solver.quality() > 0)) {
      throw new SingularMatrixException(String.format(
          "X'X of the first %d observations is not invertible", span));
    }
    solver.invert(inverseGram);

    DenseMatrix64F xty = new DenseMatrix64F(numVars, 1);
    CommonOps.multTransA(x0, y0, xty);
    CommonOps.mult(inverseGram, xty, beta);

    int j = span - 1;
    loadRow(j);
    CommonOps.multTransB(inverseGram, xRow, gain);
    residuals[j] = y[j] - dot(xRow, beta);
    variances[j] = 1 + dot(xRow, gain);
    nextRow = span;
  }

  /** Predict the next row with the current fit, then add it to the fit. */
  void update() {
    Preconditions.checkState(nextRow >= span && nextRow < numObservations);
    int j = nextRow++;
    loadRow(j);
    double resid = y[j] - dot(xRow, beta);

    CommonOps.multTransB(inverseGram, xRow, gain);
    double f = 1 + dot(xRow, gain);
    CommonOps.multAddTransB(-1.0 / f, gain, gain, inverseGram);
    CommonOps.addEquals(beta, resid / f, gain);

    residuals[j] = resid;
    variances[j] = f;
  }

  /** Coefficients fit on every row processed so far. */
  DenseMatrix64F getBeta() {
    return beta.copy();
  }

  int getNextRow() {
    return nextRow;
  }

  private void loadRow(int j) {
    System.arraycopy(x.data, j * numVars, xRow.data, 0, numVars);
  }

  private static double dot(DenseMatrix64F a, DenseMatrix64F b) {
    double sum = 0;
    for (int i = 0; i < a.getNumElements(); i++) {
      sum += a.get(i) * b.get(i);
    }
    return sum;
  }
}
