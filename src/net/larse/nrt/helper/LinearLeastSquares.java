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

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

import java.util.Arrays;

/**
 * Accumulates the normal equations of a multivariate linear regression one observation at a
 * time and solves them by Cholesky decomposition.
 */
public class LinearLeastSquares {
  public final int numX;
  public final int numY;

  private int numInputs;
  // the lower-left triangle of xMat, row by row
  private final double[] xSums;
  // the elements of yMat
  private final double[] ySums;

  private DenseMatrix64F xMat;
  private DenseMatrix64F yMat;
  private LinearSolver<DenseMatrix64F> solver;

  /**
   * Creates a solver for a regression with numX independent variables shared by numY dependent
   * variables.
   *
   * <p>Call addInput() at least numX times, then getSolution().  More inputs may be added after
   * getSolution() to get an updated solution.
   */
  public LinearLeastSquares(int numX, int numY) {
    Preconditions.checkArgument(numX >= 1 && numY >= 1);
    this.numX = numX;
    this.numY = numY;
    this.xSums = new double[numX * (numX + 1) / 2];
    this.ySums = new double[numX * numY];
  }

  // With one observation per row of X and Y we solve
  //    xMat * R = yMat,  xMat = transpose(X) * X,  yMat = transpose(X) * Y
  // where xMat is (numX, numX) and yMat is (numX, numY).  Both are sums over the observations:
  //    xMat[i, j] = sum(x_i * x_j)
  //    yMat[i, j] = sum(x_i * y_j)
  // so they are built incrementally without storing X and Y.  xMat is symmetric and only its
  // lower triangle is accumulated.

  /**
   * Add one observation, using numX values from x starting at xStart and numY values from y
   * starting at yStart.
   */
  public void addInput(double[] x, int xStart, double[] y, int yStart) {
    addWeightedInput(x, xStart, y, yStart, 1.0);
  }

  /**
   * Add one observation with both its x and y values multiplied by weight.  The squared residual
   * of the observation is then scaled by weight^2.
   */
  public void addWeightedInput(double[] x, int xStart, double[] y, int yStart, double weight) {
    ++numInputs;
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = weight * x[xStart + i];
      for (int i2 = 0; i2 <= i; ++i2) {
        xSums[pos++] += xi * weight * x[xStart + i2];
      }
    }
    assert pos == xSums.length;
    pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = weight * x[xStart + i];
      for (int j = 0; j < numY; ++j) {
        ySums[pos++] += xi * weight * y[yStart + j];
      }
    }
    assert pos == ySums.length;
  }

  public int getNumInputs() {
    return numInputs;
  }

  /**
   * Compute results from the accumulated state.  Returns false if there were not enough inputs
   * or the normal equations are not positive definite.  On success results has numX rows and
   * numY columns, each column holding the coefficients of one dependent variable.
   */
  public boolean getSolution(DenseMatrix64F results) {
    if (numInputs < numX) {
      // not enough inputs, no point in trying
      return false;
    }
    if (xMat == null) {
      xMat = new DenseMatrix64F(numX, numX);
      // yMat can just point at the ySums array without copying
      yMat = DenseMatrix64F.wrap(numX, numY, ySums);
      solver = LinearSolverFactory.symmPosDef(numX);
    }
    // populate xMat from xSums; the solver decomposes it in place
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      for (int i2 = 0; i2 <= i; ++i2) {
        double sum = xSums[pos++];
        xMat.unsafe_set(i, i2, sum);
        if (i != i2) {
          xMat.unsafe_set(i2, i, sum);
        }
      }
    }
    assert pos == xSums.length;
    if (!solver.setA(xMat) || !(solver.quality() > 0)) {
      return false;
    }
    results.reshape(numX, numY, false);
    solver.solve(yMat, results);
    return true;
  }

  /**
   * Reset the solver to its no-inputs state.
   */
  public void reset() {
    numInputs = 0;
    Arrays.fill(xSums, 0);
    Arrays.fill(ySums, 0);
  }
}
