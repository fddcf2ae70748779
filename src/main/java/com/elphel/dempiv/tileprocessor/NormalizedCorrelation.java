package com.elphel.dempiv.tileprocessor;
/**
 **
 ** NormalizedCorrelation - FFT-based normalized cross-correlation of a template
 ** over a larger search window
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  NormalizedCorrelation.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

import com.elphel.dempiv.common.DoubleFFT2D;

/**
 * Pearson correlation coefficient of the template with every fully overlapping
 * position of the search window ("valid" mode), calculated in the frequency
 * domain. Window sums for normalization come from integral images.
 * Instances cache FFT buffers and should not be shared between threads.
 */
public class NormalizedCorrelation {
	/** Denominators not above this value produce zero correlation (flat search area) */
	public static final double EPSILON = Math.ulp(1.0);

	private DoubleFFT2D fft = null;
	private double [] search_re;
	private double [] search_im;
	private double [] template_re;
	private double [] template_im;

	/**
	 * A template with all-equal values has no defined correlation
	 * @param template template data
	 * @return true if max(template) == min(template)
	 */
	public static boolean isFlat(double [] template) {
		double mn = template[0], mx = template[0];
		for (int i = 1; i < template.length; i++) {
			if      (template[i] < mn) mn = template[i];
			else if (template[i] > mx) mx = template[i];
		}
		return (mx - mn) == 0;
	}

	/**
	 * Calculate correlation surface
	 * @param search search window data, row-major
	 * @param search_width search window width
	 * @param template template data, row-major
	 * @param template_width template width
	 * @return correlation surface of (search_width - template_width + 1) columns and
	 *         (search_height - template_height + 1) rows, values in [-1, 1]
	 */
	public double [] correlate(
			final double [] search,
			final int       search_width,
			final double [] template,
			final int       template_width)
	{
		final int search_height =   search.length / search_width;
		final int template_height = template.length / template_width;
		if ((search_width <= template_width) || (search_height <= template_height)) {
			throw new IllegalArgumentException("Search window "+search_width+"x"+search_height+
					" should be larger than the template "+template_width+"x"+template_height);
		}
		final int out_width =  search_width -  template_width + 1;
		final int out_height = search_height - template_height + 1;
		final int n =          template.length;
		prepareBuffers(
				DoubleFFT2D.ceilPowerOf2(search_width),
				DoubleFFT2D.ceilPowerOf2(search_height));
		final int fft_width = fft.getWidth();

		double template_mean = 0.0;
		for (int i = 0; i < n; i++) template_mean += template[i];
		template_mean /= n;
		double template_ssd = 0.0;
		for (int row = 0; row < template_height; row++) {
			for (int col = 0; col < template_width; col++) {
				double d = template[row * template_width + col] - template_mean;
				template_re[row * fft_width + col] = d;
				template_ssd += d * d;
			}
		}
		// search data shifted by its mean suffers less from cancellation, zero-mean template
		// makes the numerator independent of the shift
		double search_mean = 0.0;
		for (int i = 0; i < search.length; i++) search_mean += search[i];
		search_mean /= search.length;
		for (int row = 0; row < search_height; row++) {
			for (int col = 0; col < search_width; col++) {
				search_re[row * fft_width + col] = search[row * search_width + col] - search_mean;
			}
		}
		fft.transform(search_re, search_im);
		fft.transform(template_re, template_im);
		// search * conj(template)
		for (int i = 0; i < search_re.length; i++) {
			double re = search_re[i] * template_re[i] + search_im[i] * template_im[i];
			double im = search_im[i] * template_re[i] - search_re[i] * template_im[i];
			search_re[i] = re;
			search_im[i] = im;
		}
		fft.inverseTransform(search_re, search_im);

		double [] sum1 = integralImage(search, search_width, search_mean, false);
		double [] sum2 = integralImage(search, search_width, search_mean, true);
		double [] corr = new double [out_width * out_height];
		for (int row = 0; row < out_height; row++) {
			for (int col = 0; col < out_width; col++) {
				double s1 = windowSum(sum1, search_width, col, row, template_width, template_height);
				double s2 = windowSum(sum2, search_width, col, row, template_width, template_height);
				double denominator = (s2 - s1 * s1 / n) * template_ssd;
				denominator = Math.sqrt(Math.max(denominator, 0.0));
				if (denominator > EPSILON) {
					corr[row * out_width + col] = search_re[row * fft_width + col] / denominator;
				}
			}
		}
		return corr;
	}

	private void prepareBuffers(int fft_width, int fft_height) {
		if ((fft == null) || (fft.getWidth() != fft_width) || (fft.getHeight() != fft_height)) {
			fft =         new DoubleFFT2D(fft_width, fft_height);
			search_re =   new double [fft_width * fft_height];
			search_im =   new double [fft_width * fft_height];
			template_re = new double [fft_width * fft_height];
			template_im = new double [fft_width * fft_height];
		} else {
			Arrays.fill(search_re,   0.0);
			Arrays.fill(search_im,   0.0);
			Arrays.fill(template_re, 0.0);
			Arrays.fill(template_im, 0.0);
		}
	}

	/**
	 * Integral image with an extra zero row and column: (width+1)*(height+1)
	 * @param data row-major data
	 * @param width data width
	 * @param offset subtracted from each value
	 * @param squared accumulate squares of (value - offset)
	 * @return integral image
	 */
	static double [] integralImage(double [] data, int width, double offset, boolean squared) {
		int height = data.length / width;
		int iwidth = width + 1;
		double [] integral = new double [iwidth * (height + 1)];
		for (int row = 0; row < height; row++) {
			double row_sum = 0.0;
			for (int col = 0; col < width; col++) {
				double d = data[row * width + col] - offset;
				row_sum += squared ? (d * d) : d;
				integral[(row + 1) * iwidth + col + 1] = integral[row * iwidth + col + 1] + row_sum;
			}
		}
		return integral;
	}

	static double windowSum(double [] integral, int width, int x0, int y0, int w, int h) {
		int iwidth = width + 1;
		return integral[(y0 + h) * iwidth + x0 + w] - integral[y0 * iwidth + x0 + w]
				- integral[(y0 + h) * iwidth + x0] + integral[y0 * iwidth + x0];
	}

	/**
	 * Find integer maximum of the correlation surface. Of the equal maximal values
	 * the first in linescan order (smallest row, then smallest column) wins.
	 * @param corr correlation surface
	 * @param width surface width
	 * @return {x, y} of the maximum
	 */
	public static int [] getMaxXYInt(double [] corr, int width) {
		int imx = 0;
		for (int i = 1; i < corr.length; i++) {
			if (Double.isNaN(corr[imx]) || (corr[i] > corr[imx])) imx = i;
		}
		return new int [] {imx % width, imx / width};
	}

	/**
	 * Maximum on the surface border can not be refined with a 3x3 neighborhood
	 * @param xy maximum location
	 * @param width surface width
	 * @param height surface height
	 * @return true if xy is on the first/last row or column
	 */
	public static boolean isBorder(int [] xy, int width, int height) {
		return (xy[0] == 0) || (xy[1] == 0) || (xy[0] == (width - 1)) || (xy[1] == (height - 1));
	}

	/**
	 * Extract 3x3 neighborhood [row][column] centered at xy
	 * @param corr correlation surface
	 * @param width surface width
	 * @param xy center, should not be on the border
	 * @return 3x3 correlation values
	 */
	public static double [][] getNeighborhood3x3(double [] corr, int width, int [] xy) {
		double [][] c = new double [3][3];
		for (int dy = 0; dy < 3; dy++) {
			for (int dx = 0; dx < 3; dx++) {
				c[dy][dx] = corr[(xy[1] + dy - 1) * width + xy[0] + dx - 1];
			}
		}
		return c;
	}
}
