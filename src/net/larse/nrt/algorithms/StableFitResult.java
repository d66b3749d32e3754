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

import org.ejml.data.DenseMatrix64F;

/** Outcome of a stable fit over a batch of pixels. */
public class StableFitResult {
  /** [NUM_COEFFS][NUM_PIXELS], NaN for pixels that were never fit. */
  public final DenseMatrix64F coefficients;

  /**
   * [NUM_OBSERVATIONS][NUM_PIXELS] on the original time axis.  NaN outside the window of each
   * pixel's last fit.
   */
  public final DenseMatrix64F residuals;

  private final ColumnState[] states;

  StableFitResult(DenseMatrix64F coefficients, DenseMatrix64F residuals, ColumnState[] states) {
    this.coefficients = coefficients;
    this.residuals = residuals;
    this.states = states;
  }

  /** True for each pixel whose last fit passed the stability test. */
  public boolean[] isStable() {
    boolean[] stable = new boolean[states.length];
    for (int i = 0; i < states.length; i++) {
      stable[i] = states[i] == ColumnState.STABLE;
    }
    return stable;
  }

  /**
   * Final state of each pixel.  ITERATING means the time span ran out before the pixel was
   * either found stable or ran out of observations.
   */
  public ColumnState[] getColumnStates() {
    return states.clone();
  }
}
