package com.elphel.dempiv.tileprocessor;
/**
 **
 ** CorrelationUncertainty - propagation of per-pixel height uncertainty into
 ** the correlation peak and then into the sub-pixel displacement
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrelationUncertainty.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import Jama.Matrix;

/**
 * First-order (Jacobian) error propagation in two stages:
 * <ol>
 * <li>template and search pixel heights -&gt; 3x3 correlation values around the peak,</li>
 * <li>3x3 correlation values -&gt; sub-pixel peak offset {hz_delta, vt_delta}.</li>
 * </ol>
 * Partial derivatives are estimated by forward differences with a fixed increment.
 * Input vector order is all template pixels (linescan) followed by all pixels of
 * the (template_size+2) x (template_size+2) search sub-window (linescan), correlation
 * values are ordered ncc[0][0], ncc[0][1], ncc[0][2], ncc[1][0], ...
 */
public class CorrelationUncertainty {
	public static final double DEFAULT_PARTIAL_INCREMENT = 1.0e-6;

	private final double partial_increment;

	public CorrelationUncertainty() {
		this(DEFAULT_PARTIAL_INCREMENT);
	}

	public CorrelationUncertainty(double partial_increment) {
		if (!(partial_increment > 0.0) || Double.isInfinite(partial_increment)) {
			throw new IllegalArgumentException("Partial derivative increment should be positive, got "+partial_increment);
		}
		this.partial_increment = partial_increment;
	}

	public double getPartialIncrement() {
		return partial_increment;
	}

	/**
	 * Propagate pixel height standard deviations to the displacement covariance
	 * @param template template heights
	 * @param template_sigma template height standard deviations
	 * @param template_width template width (height is template.length/template_width)
	 * @param search_sub (template_width+2) x (template_height+2) search heights, centered on the peak
	 * @param search_sub_sigma matching search height standard deviations
	 * @param ncc 3x3 correlation values centered on the peak
	 * @param delta sub-pixel offset {hz_delta, vt_delta} calculated from ncc
	 * @return 2x2 displacement covariance in pixels^2 or null if it is undefined
	 */
	public double [][] getDisplacementCovariance(
			final double []   template,
			final double []   template_sigma,
			final int         template_width,
			final double []   search_sub,
			final double []   search_sub_sigma,
			final double [][] ncc,
			final double []   delta)
	{
		double [][] correlation_covariance = propagatePixelIntoCorrelation(
				template,         // final double []   template,
				template_sigma,   // final double []   template_sigma,
				template_width,   // final int         template_width,
				search_sub,       // final double []   search_sub,
				search_sub_sigma, // final double []   search_sub_sigma,
				ncc);             // final double [][] ncc)
		if (correlation_covariance == null) {
			return null;
		}
		double [][] peak_covariance = propagateCorrelationIntoSubpixelPeak(
				ncc,                    // final double [][] ncc,
				correlation_covariance, // final double [][] correlation_covariance,
				delta);                 // final double []   delta)
		if (peak_covariance == null) {
			return null;
		}
		for (double [] row : peak_covariance) {
			for (double d : row) {
				if (Double.isNaN(d) || Double.isInfinite(d)) {
					return null;
				}
			}
		}
		return peak_covariance;
	}

	/**
	 * Stage 1: 9x9 covariance of the 3x3 correlation values
	 * @return J * diag(sigma^2) * J^T or null if any of the normalizations is undefined
	 */
	public double [][] propagatePixelIntoCorrelation(
			final double []   template,
			final double []   template_sigma,
			final int         template_width,
			final double []   search_sub,
			final double []   search_sub_sigma,
			final double [][] ncc)
	{
		if ((template_sigma.length != template.length) || (search_sub_sigma.length != search_sub.length)) {
			throw new IllegalArgumentException("Uncertainty windows do not match height windows");
		}
		double [][] jacobian = getCorrelationJacobian(
				template,
				template_width,
				search_sub,
				ncc);
		if (jacobian == null) {
			return null;
		}
		int nt = template.length;
		double [] variances = new double [nt + search_sub.length];
		for (int i = 0; i < nt; i++) {
			variances[i] = template_sigma[i] * template_sigma[i];
		}
		for (int i = 0; i < search_sub.length; i++) {
			variances[nt + i] = search_sub_sigma[i] * search_sub_sigma[i];
		}
		return propagate(jacobian, variances);
	}

	/**
	 * Jacobian of the 3x3 correlation values over the template and search sub-window heights
	 * @param template template heights, linescan
	 * @param template_width template width
	 * @param search_sub search sub-window, 2 pixels wider and higher than the template
	 * @param ncc unperturbed 3x3 correlation values
	 * @return [9][template.length + search_sub.length] partial derivatives or null if a
	 *         search sub-area (or the template) has zero standard deviation
	 */
	public double [][] getCorrelationJacobian(
			final double []   template,
			final int         template_width,
			final double []   search_sub,
			final double [][] ncc)
	{
		final int template_height = template.length / template_width;
		final int search_width =    template_width + 2;
		final int search_height =   template_height + 2;
		if (search_sub.length != search_width * search_height) {
			throw new IllegalArgumentException("Search sub-window should be "+search_width+"x"+search_height+
					" for "+template_width+"x"+template_height+" template, got "+search_sub.length+" pixels");
		}
		final int nt = template.length;
		final double [][] jacobian = new double [9][nt + search_sub.length];
		final double [] normalized_template = normalize(template);
		if (normalized_template == null) {
			return null;
		}
		final double [] sub_area = new double [nt];
		for (int row_corr = 0; row_corr < 3; row_corr++) {
			for (int col_corr = 0; col_corr < 3; col_corr++) {
				for (int row = 0; row < template_height; row++) {
					System.arraycopy(search_sub, (row_corr + row) * search_width + col_corr, sub_area, row * template_width, template_width);
				}
				double [] normalized_sub_area = normalize(sub_area);
				if (normalized_sub_area == null) {
					return null;
				}
				double [] jacobian_row = jacobian[row_corr * 3 + col_corr];
				double ncc0 = ncc[row_corr][col_corr];
				for (int row = 0; row < template_height; row++) {
					for (int col = 0; col < template_width; col++) {
						int indx = row * template_width + col;
						double template_perturbed = perturbedCorrelation(template, indx, normalized_sub_area);
						double search_perturbed =   perturbedCorrelation(sub_area, indx, normalized_template);
						jacobian_row[indx] = (template_perturbed - ncc0) / partial_increment;
						// sub-area pixel maps to the shifted location in the larger search sub-window
						jacobian_row[nt + (row_corr + row) * search_width + col_corr + col] =
								(search_perturbed - ncc0) / partial_increment;
					}
				}
			}
		}
		return jacobian;
	}

	/**
	 * Stage 2: 2x2 covariance of the sub-pixel peak offset
	 * @param ncc 3x3 correlation values
	 * @param correlation_covariance 9x9 covariance of ncc (linescan order)
	 * @param delta unperturbed sub-pixel offset {hz_delta, vt_delta}
	 * @return J2 * correlation_covariance * J2^T or null if the perturbed peak is degenerate
	 */
	public double [][] propagateCorrelationIntoSubpixelPeak(
			final double [][] ncc,
			final double [][] correlation_covariance,
			final double []   delta)
	{
		double [][] jacobian = getSubpixelJacobian(ncc, delta);
		if (jacobian == null) {
			return null;
		}
		Matrix mj = new Matrix(jacobian);
		return mj.times(new Matrix(correlation_covariance)).times(mj.transpose()).getArray();
	}

	/**
	 * Jacobian of {hz_delta, vt_delta} over the 9 correlation values
	 * @param ncc 3x3 correlation values
	 * @param delta unperturbed sub-pixel offset
	 * @return [2][9] partial derivatives or null
	 */
	public double [][] getSubpixelJacobian(
			final double [][] ncc,
			final double []   delta)
	{
		double [][] jacobian = new double [2][9];
		double [][] perturbed = new double [3][];
		for (int row_corr = 0; row_corr < 3; row_corr++) {
			for (int col_corr = 0; col_corr < 3; col_corr++) {
				for (int i = 0; i < 3; i++) {
					perturbed[i] = ncc[i].clone();
				}
				perturbed[row_corr][col_corr] += partial_increment;
				double [] perturbed_delta = SubpixelPeak.getSubpixelPeak(perturbed);
				if (perturbed_delta == null) {
					return null;
				}
				jacobian[0][row_corr * 3 + col_corr] = (perturbed_delta[0] - delta[0]) / partial_increment;
				jacobian[1][row_corr * 3 + col_corr] = (perturbed_delta[1] - delta[1]) / partial_increment;
			}
		}
		return jacobian;
	}

	/**
	 * J * diag(variances) * J^T, diagonal input covariance is applied as column scaling
	 * @param jacobian [m][n] Jacobian
	 * @param variances [n] input variances
	 * @return [m][m] output covariance
	 */
	static double [][] propagate(double [][] jacobian, double [] variances) {
		Matrix mj = new Matrix(jacobian);
		Matrix weighted = mj.copy();
		double [][] w = weighted.getArray();
		for (int i = 0; i < w.length; i++) {
			for (int j = 0; j < variances.length; j++) {
				w[i][j] *= variances[j];
			}
		}
		return weighted.times(mj.transpose()).getArray();
	}

	/**
	 * Zero mean, unit (population) standard deviation copy of the data
	 * @param data input values
	 * @return normalized copy or null if standard deviation is zero
	 */
	static double [] normalize(double [] data) {
		int n = data.length;
		double mean = 0.0;
		for (int i = 0; i < n; i++) mean += data[i];
		mean /= n;
		double var = 0.0;
		for (int i = 0; i < n; i++) {
			double d = data[i] - mean;
			var += d * d;
		}
		double std = Math.sqrt(var / n);
		if (!(std > 0.0)) {
			return null;
		}
		double [] normalized = new double [n];
		for (int i = 0; i < n; i++) {
			normalized[i] = (data[i] - mean) / std;
		}
		return normalized;
	}

	/**
	 * Spatial domain correlation of the data with one element increased by
	 * partial_increment against already normalized other data. Mean and standard
	 * deviation are recalculated for the perturbed data without copying it.
	 * @param data unperturbed data
	 * @param indx index of the perturbed element
	 * @param normalized_other zero mean, unit deviation data of the same length
	 * @return correlation coefficient, NaN if the perturbed data is flat
	 */
	double perturbedCorrelation(double [] data, int indx, double [] normalized_other) {
		int n = data.length;
		double mean = partial_increment;
		for (int i = 0; i < n; i++) mean += data[i];
		mean /= n;
		double var = 0.0;
		for (int i = 0; i < n; i++) {
			double d = ((i == indx) ? (data[i] + partial_increment) : data[i]) - mean;
			var += d * d;
		}
		double std = Math.sqrt(var / n);
		if (!(std > 0.0)) {
			return Double.NaN;
		}
		double s = 0.0;
		for (int i = 0; i < n; i++) {
			double d = ((i == indx) ? (data[i] + partial_increment) : data[i]) - mean;
			s += d / std * normalized_other[i];
		}
		return s / n;
	}
}
