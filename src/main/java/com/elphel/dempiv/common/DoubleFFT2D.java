package com.elphel.dempiv.common;
/**
 **
 ** DoubleFFT2D - two-dimensional complex FFT on row-major double arrays
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DoubleFFT2D.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Separable 2D FFT of a width*height complex array (real and imaginary parts
 * in separate row-major arrays). Both dimensions must be powers of 2.
 * Instances keep row/column scratch buffers and are not thread safe - use one
 * instance per thread.
 */
public class DoubleFFT2D {
	private final int width;
	private final int height;
	private final double [][] row_buf;
	private final double [][] col_buf;

	public DoubleFFT2D(int width, int height) {
		if (!ArithmeticUtils.isPowerOfTwo(width) || !ArithmeticUtils.isPowerOfTwo(height)) {
			throw new IllegalArgumentException("FFT dimensions should be powers of 2, got "+width+"x"+height);
		}
		this.width =   width;
		this.height =  height;
		this.row_buf = new double [2][width];
		this.col_buf = new double [2][height];
	}

	public int getWidth()  {return width;}
	public int getHeight() {return height;}

	/**
	 * Smallest power of 2 that is not less than n
	 * @param n required length (>0)
	 * @return power of 2 >= n
	 */
	public static int ceilPowerOf2(int n) {
		int p = 1;
		while (p < n) p <<= 1;
		return p;
	}

	public void transform(double [] re, double [] im) {
		transform(re, im, false);
	}

	public void inverseTransform(double [] re, double [] im) {
		transform(re, im, true);
	}

	/**
	 * In-place 2D transform. Inverse transform is scaled by 1/(width*height)
	 * @param re real part, row-major width*height
	 * @param im imaginary part, row-major width*height
	 * @param inverse direction
	 */
	public void transform(double [] re, double [] im, boolean inverse) {
		TransformType type = inverse ? TransformType.INVERSE : TransformType.FORWARD;
		for (int row = 0; row < height; row++) {
			int indx = row * width;
			System.arraycopy(re, indx, row_buf[0], 0, width);
			System.arraycopy(im, indx, row_buf[1], 0, width);
			FastFourierTransformer.transformInPlace(row_buf, DftNormalization.STANDARD, type);
			System.arraycopy(row_buf[0], 0, re, indx, width);
			System.arraycopy(row_buf[1], 0, im, indx, width);
		}
		for (int col = 0; col < width; col++) {
			for (int row = 0; row < height; row++) {
				col_buf[0][row] = re[row * width + col];
				col_buf[1][row] = im[row * width + col];
			}
			FastFourierTransformer.transformInPlace(col_buf, DftNormalization.STANDARD, type);
			for (int row = 0; row < height; row++) {
				re[row * width + col] = col_buf[0][row];
				im[row * width + col] = col_buf[1][row];
			}
		}
	}
}
