package com.elphel.dempiv.tileprocessor;
/**
 **
 ** GeoTransform - affine pixel (column, row) to ground (x, y) transformation
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GeoTransform.java is free software: you can redistribute it and/or modify
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
import java.util.List;

/**
 * 3x3 affine matrix {{a, b, c}, {d, e, f}, {0, 0, 1}} mapping pixel corner
 * coordinates (col, row) to ground (x, y): x = a*col + b*row + c,
 * y = d*col + e*row + f. For north-up rasters a is the pixel ground size and
 * e = -a.
 */
public class GeoTransform {
	public static final int RASTER_PIXEL_IS_AREA =  1;
	public static final int RASTER_PIXEL_IS_POINT = 2;

	private final double [][] matrix;

	public GeoTransform(double [][] matrix) {
		if ((matrix.length != 3) || (matrix[0].length != 3) || (matrix[1].length != 3) || (matrix[2].length != 3)) {
			throw new IllegalArgumentException("Geotransform should be a 3x3 matrix");
		}
		this.matrix = new double [3][];
		for (int i = 0; i < 3; i++) {
			this.matrix[i] = matrix[i].clone();
		}
	}

	/**
	 * Create from GDAL-ordered six coefficients
	 * @param c x of the upper-left corner
	 * @param a pixel width
	 * @param b row rotation
	 * @param f y of the upper-left corner
	 * @param d column rotation
	 * @param e pixel height (negative for north-up)
	 * @return new transform
	 */
	public static GeoTransform fromCoefficients(double c, double a, double b, double f, double d, double e) {
		return new GeoTransform(new double [][] {{a, b, c}, {d, e, f}, {0.0, 0.0, 1.0}});
	}

	public static GeoTransform identity() {
		return fromCoefficients(0.0, 1.0, 0.0, 0.0, 0.0, 1.0);
	}

	public static GeoTransform northUp(double x_upper_left, double y_upper_left, double pixel_size) {
		return fromCoefficients(x_upper_left, pixel_size, 0.0, y_upper_left, 0.0, -pixel_size);
	}

	/**
	 * Build transform from the GeoTIFF georeferencing tags. ModelTransformation
	 * has priority over the pixel scale/tie point pair.
	 * @param model_transformation ModelTransformationTag (16 values) or null
	 * @param pixel_scale ModelPixelScaleTag (sx, sy, sz) or null
	 * @param tie_point ModelTiepointTag (i, j, k, x, y, z, ...) or null
	 * @param raster_type GTRasterTypeGeoKey value, RASTER_PIXEL_IS_POINT shifts by half pixel
	 * @return transform or null if there is not enough georeferencing information
	 */
	public static GeoTransform fromGeoTiffTags(
			List<Double> model_transformation,
			List<Double> pixel_scale,
			List<Double> tie_point,
			int          raster_type)
	{
		double a, b, c, d, e, f;
		if ((model_transformation != null) && (model_transformation.size() >= 16)) {
			a = model_transformation.get(0);
			b = model_transformation.get(1);
			c = model_transformation.get(3);
			d = model_transformation.get(4);
			e = model_transformation.get(5);
			f = model_transformation.get(7);
		} else if ((pixel_scale != null) && (pixel_scale.size() >= 2) && (tie_point != null) && (tie_point.size() >= 6)) {
			a = pixel_scale.get(0);
			b = 0.0;
			d = 0.0;
			e = -pixel_scale.get(1);
			c = tie_point.get(3) - tie_point.get(0) * a;
			f = tie_point.get(4) - tie_point.get(1) * e;
		} else {
			return null;
		}
		if (raster_type == RASTER_PIXEL_IS_POINT) { // tie point refers to the pixel center
			c -= 0.5 * (a + b);
			f -= 0.5 * (d + e);
		}
		return fromCoefficients(c, a, b, f, d, e);
	}

	/**
	 * @return copy of the 3x3 matrix
	 */
	public double [][] getMatrix() {
		double [][] m = new double [3][];
		for (int i = 0; i < 3; i++) {
			m[i] = matrix[i].clone();
		}
		return m;
	}

	public double get(int row, int col) {
		return matrix[row][col];
	}

	/** Pixel ground size, the only scale term used for export */
	public double getPixelSize() {return matrix[0][0];}

	/** Ground x of the left edge of column 0 */
	public double getOffsetX()   {return matrix[0][2];}

	/** Ground y of the top edge of row 0 */
	public double getOffsetY()   {return matrix[1][2];}

	/**
	 * Bitwise comparison of all 9 elements (NaN equals NaN, 0.0 differs from -0.0)
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof GeoTransform)) return false;
		return Arrays.deepEquals(matrix, ((GeoTransform) o).matrix);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(matrix);
	}

	@Override
	public String toString() {
		return Arrays.deepToString(matrix);
	}
}
