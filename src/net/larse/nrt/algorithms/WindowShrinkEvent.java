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

/** Progress of a stable fit, reported once per iteration after the window is shrunk. */
public class WindowShrinkEvent {
  private final int iteration;
  private final int windowStart;
  private final int newlyStable;
  private final int activeCount;
  private final ColumnState[] states;

  WindowShrinkEvent(int iteration, int windowStart, int newlyStable, int activeCount,
      ColumnState[] states) {
    this.iteration = iteration;
    this.windowStart = windowStart;
    this.newlyStable = newlyStable;
    this.activeCount = activeCount;
    this.states = states;
  }

  /** 1 for the fit on the full time series. */
  public int getIteration() {
    return iteration;
  }

  /** First row of the window the next iteration would fit. */
  public int getWindowStart() {
    return windowStart;
  }

  /** Columns found stable by this iteration's fit. */
  public int getNewlyStable() {
    return newlyStable;
  }

  /** Columns left for the next iteration. */
  public int getActiveCount() {
    return activeCount;
  }

  /** Snapshot of every column's state at the end of the iteration. */
  public ColumnState[] getStates() {
    return states.clone();
  }

  @Override
  public String toString() {
    return String.format("iteration %d: window starts at %d, %d newly stable, %d active",
        iteration, windowStart, newlyStable, activeCount);
  }
}
