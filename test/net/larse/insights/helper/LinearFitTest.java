package net.larse.insights.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class LinearFitTest {
  private static final double EPS = 1e-9;

  @Test
  public void testExactLine() {
    double[] x = {0, 1, 2, 3, 4};
    double[] y = {1, 3, 5, 7, 9};
    LinearFit fit = LinearFit.fit(x, y);
    assertEquals(2.0, fit.getSlope(), EPS);
    assertEquals(1.0, fit.getIntercept(), EPS);
    assertEquals(1.0, fit.getRSquared(), EPS);
    assertEquals(5, fit.getNumInputs());
    assertEquals(21.0, fit.predict(10), EPS);
  }

  @Test
  public void testNoisyLine() {
    double[] x = {0, 1, 2, 3};
    double[] y = {0, 2, 1, 3};
    LinearFit fit = LinearFit.fit(x, y);
    // sxy = 4, sxx = 5
    assertEquals(0.8, fit.getSlope(), EPS);
    assertEquals(0.3, fit.getIntercept(), EPS);
    // ssRes = 1.8, ssTot = 5
    assertEquals(0.64, fit.getRSquared(), EPS);
  }

  @Test
  public void testSubRange() {
    double[] x = {0, 1, 2, 3, 4, 5};
    double[] y = {100, -50, 4, 6, 8, 0};
    LinearFit fit = LinearFit.fit(x, y, 2, 5);
    assertEquals(2.0, fit.getSlope(), EPS);
    assertEquals(0.0, fit.getIntercept(), EPS);
    assertEquals(3, fit.getNumInputs());
  }

  @Test
  public void testIdenticalXFallsBackToMean() {
    LinearFit fit = LinearFit.fit(new double[] {2, 2, 2}, new double[] {1, 2, 6});
    assertEquals(0.0, fit.getSlope(), EPS);
    assertEquals(3.0, fit.getIntercept(), EPS);
    assertEquals(0.0, fit.getRSquared(), EPS);
  }

  @Test
  public void testSinglePoint() {
    LinearFit fit = LinearFit.fit(new double[] {5}, new double[] {7});
    assertEquals(0.0, fit.getSlope(), EPS);
    assertEquals(7.0, fit.getIntercept(), EPS);
    assertEquals(1, fit.getNumInputs());
  }

  @Test
  public void testConstantYHasZeroRSquared() {
    LinearFit fit = LinearFit.fit(new double[] {0, 1, 2}, new double[] {4, 4, 4});
    assertEquals(0.0, fit.getSlope(), EPS);
    assertEquals(4.0, fit.getIntercept(), EPS);
    assertEquals(0.0, fit.getRSquared(), EPS);
  }

  @Test
  public void testEmptyRange() {
    LinearFit fit = LinearFit.fit(new double[] {1, 2}, new double[] {3, 4}, 1, 1);
    assertEquals(0, fit.getNumInputs());
    assertEquals(0.0, fit.getSlope(), EPS);
    assertEquals(0.0, fit.getIntercept(), EPS);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLengthMismatch() {
    LinearFit.fit(new double[] {1, 2}, new double[] {1});
  }
}
