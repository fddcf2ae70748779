package com.elphel.dempiv.tileprocessor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.awt.Rectangle;
import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import Jama.Matrix;

public class CorrelationUncertaintyTest {
	private double []   template;
	private double []   search_sub;
	private double [][] ncc;
	private double []   delta;

	@Before
	public void setUp() {
		SyntheticSurface surface = new SyntheticSurface();
		HeightGrid before = surface.getGrid(64, 64, 0.0, 0.0);
		HeightGrid after =  surface.getGrid(64, 64, 1.3, -0.7);
		TileScanner scanner = new TileScanner(64, 64, 9, 5);
		PivTile tile = scanner.getTile(4, 4);
		template = before.getWindow(tile.template);
		double [] corr = new NormalizedCorrelation().correlate(after.getWindow(tile.search), tile.search.width, template, 9);
		int [] peak_xy = NormalizedCorrelation.getMaxXYInt(corr, 11);
		assertFalse(NormalizedCorrelation.isBorder(peak_xy, 11, 11));
		ncc =   NormalizedCorrelation.getNeighborhood3x3(corr, 11, peak_xy);
		delta = SubpixelPeak.getSubpixelPeak(ncc);
		assertNotNull(delta);
		search_sub = after.getWindow(new Rectangle(tile.search.x + peak_xy[0] - 1, tile.search.y + peak_xy[1] - 1, 11, 11));
	}

	private static double [] uniform(int n, double sigma) {
		double [] data = new double [n];
		Arrays.fill(data, sigma);
		return data;
	}

	@Test
	public void testJacobianShape() {
		double [][] jacobian = new CorrelationUncertainty().getCorrelationJacobian(template, 9, search_sub, ncc);
		assertEquals(9, jacobian.length);
		for (double [] row : jacobian) {
			assertEquals(81 + 121, row.length);
		}
	}

	@Test
	public void testUncoveredSearchPixelsHaveZeroDerivatives() {
		double [][] jacobian = new CorrelationUncertainty().getCorrelationJacobian(template, 9, search_sub, ncc);
		for (int row_corr = 0; row_corr < 3; row_corr++) {
			for (int col_corr = 0; col_corr < 3; col_corr++) {
				double [] jacobian_row = jacobian[row_corr * 3 + col_corr];
				int num_nonzero = 0;
				for (int row = 0; row < 11; row++) {
					for (int col = 0; col < 11; col++) {
						boolean covered = (row >= row_corr) && (row < row_corr + 9) && (col >= col_corr) && (col < col_corr + 9);
						double d = jacobian_row[81 + row * 11 + col];
						if (!covered) {
							assertEquals(0.0, d, 0.0);
						} else if (d != 0.0) {
							num_nonzero++;
						}
					}
				}
				assertTrue(num_nonzero > 40);
			}
		}
	}

	@Test
	public void testTemplateDerivativesInvariantToOffsetAndGain() {
		// correlation does not change when a constant is added to the template or it is scaled
		double [][] jacobian = new CorrelationUncertainty().getCorrelationJacobian(template, 9, search_sub, ncc);
		double mean = 0;
		for (double d : template) mean += d;
		mean /= template.length;
		for (double [] jacobian_row : jacobian) {
			double s_offset = 0.0, s_gain = 0.0, s_abs = 0.0;
			for (int i = 0; i < template.length; i++) {
				s_offset += jacobian_row[i];
				s_gain +=   jacobian_row[i] * (template[i] - mean);
				s_abs +=    Math.abs(jacobian_row[i]);
			}
			assertTrue(s_abs > 0.0);
			assertEquals(0.0, s_offset / s_abs, 1e-3);
			assertEquals(0.0, s_gain / s_abs,   1e-3);
		}
	}

	@Test
	public void testPropagateMatchesExplicitProduct() {
		double [][] jacobian = {
				{1.0, -2.0, 0.5,  0.0, 3.0},
				{0.0,  1.5, 2.0, -1.0, 0.5},
				{2.5,  0.0, 1.0,  1.0, 1.0}};
		double [] variances = {0.1, 0.2, 0.3, 0.4, 0.5};
		double [][] diag = new double [5][5];
		for (int i = 0; i < 5; i++) diag[i][i] = variances[i];
		Matrix mj = new Matrix(jacobian);
		double [][] expected = mj.times(new Matrix(diag)).times(mj.transpose()).getArray();
		double [][] actual = CorrelationUncertainty.propagate(jacobian, variances);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				assertEquals(expected[i][j], actual[i][j], 1e-12);
			}
		}
	}

	@Test
	public void testDisplacementCovariance() {
		CorrelationUncertainty uncertainty = new CorrelationUncertainty();
		double [][] cov = uncertainty.getDisplacementCovariance(
				template,
				uniform(81, 0.05),
				9,
				search_sub,
				uniform(121, 0.05),
				ncc,
				delta);
		assertNotNull(cov);
		assertEquals(2, cov.length);
		assertTrue(cov[0][0] > 0.0);
		assertTrue(cov[1][1] > 0.0);
		assertEquals(cov[0][1], cov[1][0], 1e-12 * (cov[0][0] + cov[1][1]));
		// Cauchy-Schwarz for a valid covariance
		assertTrue(cov[0][1] * cov[1][0] <= cov[0][0] * cov[1][1] * (1 + 1e-9));
	}

	@Test
	public void testCovarianceGrowsWithSigma() {
		CorrelationUncertainty uncertainty = new CorrelationUncertainty();
		double [][] cov1 = uncertainty.getDisplacementCovariance(template, uniform(81, 0.05), 9, search_sub, uniform(121, 0.05), ncc, delta);
		double [][] cov2 = uncertainty.getDisplacementCovariance(template, uniform(81, 0.10), 9, search_sub, uniform(121, 0.10), ncc, delta);
		for (int i = 0; i < 2; i++) {
			assertTrue(cov2[i][i] >= cov1[i][i]);
			assertEquals(4.0 * cov1[i][i], cov2[i][i], 1e-9 * cov2[i][i]);
		}
	}

	@Test
	public void testFlatSearchSubAreaIsUndefined() {
		double [] flat = new double [121];
		Arrays.fill(flat, 7.0);
		CorrelationUncertainty uncertainty = new CorrelationUncertainty();
		assertNull(uncertainty.getCorrelationJacobian(template, 9, flat, ncc));
		assertNull(uncertainty.getDisplacementCovariance(template, uniform(81, 0.1), 9, flat, uniform(121, 0.1), ncc, delta));
	}

	@Test
	public void testSubpixelJacobianShape() {
		double [][] jacobian = new CorrelationUncertainty().getSubpixelJacobian(ncc, delta);
		assertEquals(2, jacobian.length);
		assertEquals(9, jacobian[0].length);
		// raising the right neighbor moves the peak right
		assertTrue(jacobian[0][5] > 0.0);
		// raising the lower neighbor moves the peak down
		assertTrue(jacobian[1][7] > 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongSubWindowSize() {
		new CorrelationUncertainty().getCorrelationJacobian(template, 9, new double [100], ncc);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testZeroIncrement() {
		new CorrelationUncertainty(0.0);
	}
}
