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

import java.time.LocalDate;

/**
 * Builds temporal design matrices: an intercept, an optional linear trend and harmonic pairs.
 *
 * <p>Time is expressed in decimal years, so the harmonic of order k is cos(2 pi k t) and
 * sin(2 pi k t).  With a trend the columns are [1, t, cos(wt), sin(wt), cos(2wt), ...] and the
 * trend coefficient sits at index 1.
 */
public class DesignMatrix {
  private static final double OMEGA = 2.0 * Math.PI;

  private DesignMatrix() {}

  /** Number of columns of a design matrix built with the given options. */
  public static int numCoefficients(boolean trend, int harmonicOrder) {
    return 1 + (trend ? 1 : 0) + 2 * harmonicOrder;
  }

  public static DenseMatrix64F build(LocalDate[] dates, boolean trend, int harmonicOrder) {
    Preconditions.checkArgument(harmonicOrder >= 0, "harmonicOrder must not be negative");
    DenseMatrix64F x = new DenseMatrix64F(dates.length, numCoefficients(trend, harmonicOrder));
    for (int i = 0; i < dates.length; i++) {
      double t = decimalYear(dates[i]);
      int idx = 0;
      x.set(i, idx++, 1.0); // for intercept
      if (trend) {
        x.set(i, idx++, t);
      }
      for (int k = 1; k <= harmonicOrder; k++) {
        x.set(i, idx++, Math.cos(k * OMEGA * t));
        x.set(i, idx++, Math.sin(k * OMEGA * t));
      }
    }
    return x;
  }

  /** Year plus the elapsed fraction of that year, e.g. 2020-07-02 is 2020.5. */
  public static double decimalYear(LocalDate date) {
    return date.getYear() + (date.getDayOfYear() - 1) / (double) date.lengthOfYear();
  }
}
