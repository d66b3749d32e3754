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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import net.larse.nrt.helper.RobustLeastSquares;
import org.ejml.data.DenseMatrix64F;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OutliersTest {
  private static final int NUM_OBS = 12;

  private DenseMatrix64F x;

  @Before
  public void setUp() {
    x = new DenseMatrix64F(NUM_OBS, 2);
    for (int t = 0; t < NUM_OBS; t++) {
      x.set(t, 0, 1);
      x.set(t, 1, t);
    }
  }

  private static double noise(int t, double amplitude) {
    return t % 2 == 0 ? amplitude : -amplitude;
  }

  @Test
  public void testShewhartRemovesSpike() throws Exception {
    DenseMatrix64F y = new DenseMatrix64F(NUM_OBS, 2);
    for (int t = 0; t < NUM_OBS; t++) {
      y.set(t, 0, 0.5 + noise(t, 0.01) + (t == 5 ? 1.0 : 0));
      y.set(t, 1, 0.3 + noise(t, 0.01));
    }
    y.set(2, 1, Double.NaN);
    DenseMatrix64F original = y.copy();

    DenseMatrix64F result = Outliers.shewhart(x, y, 2);

    for (int t = 0; t < NUM_OBS; t++) {
      if (t == 5) {
        assertTrue(Double.isNaN(result.get(t, 0)));
      } else {
        assertEquals(y.get(t, 0), result.get(t, 0), 0);
      }
      if (t == 2) {
        assertTrue(Double.isNaN(result.get(t, 1)));
      } else {
        assertEquals("row " + t, y.get(t, 1), result.get(t, 1), 0);
      }
    }
    // the input is left alone
    assertEquals(original.get(5, 0), y.get(5, 0), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testShewhartNeedsPositiveLimit() throws Exception {
    Outliers.shewhart(x, new DenseMatrix64F(NUM_OBS, 1), 0);
  }

  @Test
  public void testCcdcRirls() throws Exception {
    // one row of two pixels
    double[][][] green = new double[NUM_OBS][1][2];
    double[][][] swir = new double[NUM_OBS][1][2];
    DenseMatrix64F y = new DenseMatrix64F(NUM_OBS, 2);
    for (int t = 0; t < NUM_OBS; t++) {
      // pixel 0: bright green at t = 4 (cloud)
      green[t][0][0] = 0.1 + noise(t, 0.005) + (t == 4 ? 0.2 : 0);
      swir[t][0][0] = 0.2 + noise(t, 0.005);
      // pixel 1: dark green at t = 9 is kept, dark swir at t = 7 (shadow) is not
      green[t][0][1] = 0.1 + noise(t, 0.005) - (t == 9 ? 0.2 : 0);
      swir[t][0][1] = 0.2 + noise(t, 0.005) - (t == 7 ? 0.2 : 0);
      y.set(t, 0, 0.7);
      y.set(t, 1, 0.6);
    }

    ScreeningResult result =
        Outliers.ccdcRirls(x, y, green, swir, 1, new RobustLeastSquares.Args());

    for (int t = 0; t < NUM_OBS; t++) {
      assertEquals("row " + t, t != 4, result.clear[t][0]);
      assertEquals("row " + t, t != 7, result.clear[t][1]);
      assertEquals(t == 4, Double.isNaN(result.y.get(t, 0)));
      assertEquals(t == 7, Double.isNaN(result.y.get(t, 1)));
    }
    assertFalse(Double.isNaN(y.get(4, 0)));
  }

  @Test
  public void testCcdcRirlsScalingFactor() throws Exception {
    // Same cloud in reflectance scaled by 10000: only flagged with the matching factor.
    double[][][] green = new double[NUM_OBS][1][1];
    double[][][] swir = new double[NUM_OBS][1][1];
    DenseMatrix64F y = new DenseMatrix64F(NUM_OBS, 1);
    for (int t = 0; t < NUM_OBS; t++) {
      green[t][0][0] = 10000 * (0.1 + noise(t, 0.005) + (t == 4 ? 0.2 : 0));
      swir[t][0][0] = 10000 * (0.2 + noise(t, 0.005));
    }

    ScreeningResult scaled =
        Outliers.ccdcRirls(x, y, green, swir, 10000, new RobustLeastSquares.Args());
    ScreeningResult unscaled =
        Outliers.ccdcRirls(x, y, green, swir, 1, new RobustLeastSquares.Args());

    int scaledOutliers = 0;
    for (int t = 0; t < NUM_OBS; t++) {
      if (!scaled.clear[t][0]) {
        scaledOutliers++;
      }
    }
    assertEquals(1, scaledOutliers);
    assertFalse(scaled.clear[4][0]);
    // residuals of 50 in scaled units are far above an unscaled threshold of 0.04
    assertFalse(unscaled.clear[0][0]);
  }

  @Test
  public void testFlatten() {
    double[][][] cube = {{{1, 2, 3}, {4, 5, 6}}, {{7, 8, 9}, {10, 11, 12}}};
    DenseMatrix64F flat = Outliers.flatten(cube);
    assertEquals(2, flat.numRows);
    assertEquals(6, flat.numCols);
    assertEquals(6, flat.get(0, 5), 0);
    assertEquals(10, flat.get(1, 3), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedBands() throws Exception {
    Outliers.ccdcRirls(x, new DenseMatrix64F(NUM_OBS, 2), new double[NUM_OBS][1][2],
        new double[NUM_OBS][1][3], 1, new RobustLeastSquares.Args());
  }
}
