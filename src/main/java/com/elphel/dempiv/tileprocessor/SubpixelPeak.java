package com.elphel.dempiv.tileprocessor;
/**
 **
 ** SubpixelPeak - fractional correlation maximum from a 3x3 neighborhood
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SubpixelPeak.java is free software: you can redistribute it and/or modify
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

public class SubpixelPeak {

	private SubpixelPeak() {}

	/**
	 * Get fractional offset of the maximum of the quadratic polynomial approximating
	 * 3x3 correlation values (single Newton step from the center using central
	 * differences).
	 * @param c 3x3 correlation values [row][column] centered on the integer maximum
	 * @return {hz_delta, vt_delta} (positive right and down) or null if the
	 *         quadratic is degenerate (zero determinant or non-finite result)
	 */
	public static double [] getSubpixelPeak(double [][] c) {
		double dx =  (c[1][2] - c[1][0]) / 2;
		double dxx =  c[1][2] + c[1][0] - 2 * c[1][1];
		double dy =  (c[2][1] - c[0][1]) / 2;
		double dyy =  c[2][1] + c[0][1] - 2 * c[1][1];
		double dxy = (c[2][2] - c[2][0] - c[0][2] + c[0][0]) / 4;
		double denom = dxx * dyy - dxy * dxy;
		if (denom == 0.0) {
			return null;
		}
		double hz_delta = -(dyy * dx - dxy * dy) / denom;
		double vt_delta = -(dxx * dy - dxy * dx) / denom;
		if (Double.isNaN(hz_delta) || Double.isInfinite(hz_delta) || Double.isNaN(vt_delta) || Double.isInfinite(vt_delta)) {
			return null;
		}
		return new double [] {hz_delta, vt_delta};
	}

	/**
	 * Displacement of the template in pixels
	 * @param peak_xy integer maximum {column, row} on the correlation surface
	 * @param delta fractional offset from getSubpixelPeak()
	 * @param template_offset ceil(template_size/2) - position of the zero-displacement peak
	 * @return {du, dv}, du positive right, dv positive down
	 */
	public static double [] getDisplacement(int [] peak_xy, double [] delta, int template_offset) {
		return new double [] {
				peak_xy[0] - template_offset + delta[0],
				peak_xy[1] - template_offset + delta[1]};
	}
}
