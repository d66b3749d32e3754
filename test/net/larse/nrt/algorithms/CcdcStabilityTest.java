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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Random;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CcdcStabilityTest {
  private static final double NAN = Double.NaN;

  @Test
  public void testEachRuleCanFail() {
    DenseMatrix64F residuals = new DenseMatrix64F(4, 4, true,
        1, 1, -1.5, 0.5,
        -1, 1, 0.5, 0.5,
        1, -1, 0.5, 0.5,
        -1, -1, 0.5, -1.5);
    double[] slope = {0.5, 2.5, 0.5, 0.5};

    boolean[] stable = CcdcStability.isStable(slope, residuals, 1.2);
    // column 1 fails on the slope, 2 on the first residual, 3 on the last
    assertArrayEquals(new boolean[] {true, false, false, false}, stable);
  }

  @Test
  public void testNegativeValuesUseMagnitude() {
    DenseMatrix64F residuals = new DenseMatrix64F(2, 1, true, -3, 1);
    double rmse = Math.sqrt(5);
    assertEquals(rmse, CcdcStability.rmse(residuals, 0), 1e-12);
    assertFalse(CcdcStability.isStable(new double[] {0}, residuals, 1.2)[0]);
    assertFalse(CcdcStability.isStable(new double[] {-10}, residuals, 2)[0]);
    assertTrue(CcdcStability.isStable(new double[] {-1}, residuals, 2)[0]);
  }

  @Test
  public void testMissingResidualsAreSkipped() {
    DenseMatrix64F residuals = new DenseMatrix64F(5, 2, true,
        NAN, NAN,
        1, NAN,
        -1, NAN,
        1, NAN,
        NAN, NAN);
    boolean[] stable = CcdcStability.isStable(new double[] {0, 0}, residuals, 1.5);
    // first and last valid residuals are rows 1 and 3
    assertTrue(stable[0]);
    // an all missing column is never stable
    assertFalse(stable[1]);
  }

  @Test
  public void testPerfectFitIsNotStable() {
    DenseMatrix64F residuals = new DenseMatrix64F(3, 1, true, 0, 0, 0);
    assertFalse(CcdcStability.isStable(new double[] {0}, residuals, 3)[0]);
  }

  @Test
  public void testMonotonicInThreshold() {
    Random random = new Random(7);
    int numCols = 50;
    DenseMatrix64F residuals = new DenseMatrix64F(20, numCols);
    double[] slope = new double[numCols];
    for (int col = 0; col < numCols; col++) {
      slope[col] = random.nextGaussian();
      for (int i = 0; i < 20; i++) {
        residuals.set(i, col, random.nextDouble() < 0.1 ? NAN : random.nextGaussian());
      }
    }
    boolean[] previous = CcdcStability.isStable(slope, residuals, 0.1);
    for (double threshold = 0.2; threshold < 5; threshold += 0.1) {
      boolean[] current = CcdcStability.isStable(slope, residuals, threshold);
      for (int col = 0; col < numCols; col++) {
        assertTrue("column " + col + " at " + threshold, !previous[col] || current[col]);
      }
      previous = current;
    }
  }
}
