package com.elphel.dempiv.tileprocessor;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class SubpixelPeakTest {

	static double [][] quadratic(double x0, double y0, double a, double b, double c) {
		double [][] ncc = new double [3][3];
		for (int row = 0; row < 3; row++) {
			for (int col = 0; col < 3; col++) {
				double x = col - 1 - x0;
				double y = row - 1 - y0;
				ncc[row][col] = 0.9 - a * x * x - b * y * y - c * x * y;
			}
		}
		return ncc;
	}

	@Test
	public void testQuadraticPeakRecovered() {
		double [] delta = SubpixelPeak.getSubpixelPeak(quadratic(0.3, -0.2, 0.20, 0.10, 0.0));
		assertArrayEquals(new double [] {0.3, -0.2}, delta, 1e-12);
		// cross term
		delta = SubpixelPeak.getSubpixelPeak(quadratic(-0.4, 0.25, 0.20, 0.15, 0.05));
		assertArrayEquals(new double [] {-0.4, 0.25}, delta, 1e-12);
	}

	@Test
	public void testDegenerate() {
		double [][] flat = {{0.5, 0.5, 0.5}, {0.5, 0.5, 0.5}, {0.5, 0.5, 0.5}};
		assertNull(SubpixelPeak.getSubpixelPeak(flat));
		// ridge along the rows, no curvature across them
		double [][] ridge = {{0.4, 0.5, 0.4}, {0.4, 0.5, 0.4}, {0.4, 0.5, 0.4}};
		assertNull(SubpixelPeak.getSubpixelPeak(ridge));
	}

	@Test
	public void testDisplacement() {
		double [] vector = SubpixelPeak.getDisplacement(new int [] {6, 4}, new double [] {0.3, -0.25}, 5);
		assertArrayEquals(new double [] {1.3, -1.25}, vector, 1e-12);
	}
}
