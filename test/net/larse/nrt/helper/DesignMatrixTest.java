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

import static org.junit.Assert.assertEquals;

import java.time.LocalDate;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DesignMatrixTest {

  @Test
  public void testDecimalYear() {
    assertEquals(2020.0, DesignMatrix.decimalYear(LocalDate.of(2020, 1, 1)), 0);
    // 2020 is a leap year; July 2nd is day 184
    assertEquals(2020.5, DesignMatrix.decimalYear(LocalDate.of(2020, 7, 2)), 1e-12);
    assertEquals(2019 + 364 / 365.0, DesignMatrix.decimalYear(LocalDate.of(2019, 12, 31)), 1e-12);
  }

  @Test
  public void testHarmonicColumns() {
    LocalDate[] dates = {LocalDate.of(2020, 1, 1), LocalDate.of(2020, 7, 2)};
    DenseMatrix64F x = DesignMatrix.build(dates, true, 2);
    assertEquals(2, x.numRows);
    assertEquals(6, x.numCols);
    assertEquals(DesignMatrix.numCoefficients(true, 2), x.numCols);

    assertEquals(1, x.get(0, 0), 0);
    assertEquals(2020.0, x.get(0, 1), 0);
    assertEquals(1, x.get(0, 2), 1e-9);
    assertEquals(0, x.get(0, 3), 1e-9);

    // half a year in: cos(pi) and cos(2 pi)
    assertEquals(2020.5, x.get(1, 1), 1e-12);
    assertEquals(-1, x.get(1, 2), 1e-9);
    assertEquals(0, x.get(1, 3), 1e-9);
    assertEquals(1, x.get(1, 4), 1e-9);
    assertEquals(0, x.get(1, 5), 1e-9);
  }

  @Test
  public void testWithoutTrend() {
    LocalDate[] dates = {LocalDate.of(2021, 4, 1)};
    DenseMatrix64F x = DesignMatrix.build(dates, false, 1);
    assertEquals(3, x.numCols);
    assertEquals(1, x.get(0, 0), 0);
    double t = DesignMatrix.decimalYear(dates[0]);
    assertEquals(Math.cos(2 * Math.PI * t), x.get(0, 1), 1e-12);
    assertEquals(Math.sin(2 * Math.PI * t), x.get(0, 2), 1e-12);
  }
}
