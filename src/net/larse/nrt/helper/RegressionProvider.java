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

/**
 * Fits the columns of a (time x pixel) matrix against a shared design matrix.
 */
public interface RegressionProvider {
  /**
   * Fit every column of y against x independently, ignoring the rows where that column is NaN.
   *
   * @param x [NUM_OBSERVATIONS][NUM_COEFFS] design matrix
   * @param y [NUM_OBSERVATIONS][NUM_PIXELS] dependent values, NaN when missing
   * @throws SingularMatrixException if the normal equations of a column cannot be solved
   */
  RegressionFit fit(DenseMatrix64F x, DenseMatrix64F y) throws SingularMatrixException;
}
