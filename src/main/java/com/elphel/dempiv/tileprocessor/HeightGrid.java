package com.elphel.dempiv.tileprocessor;
/**
 **
 ** HeightGrid - row-major grid of elevations (or of their standard deviations)
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  HeightGrid.java is free software: you can redistribute it and/or modify
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

import java.awt.Rectangle;

/**
 * Rectangular raster of doubles, row 0 at the top, column 0 at the left.
 * The same class holds the height (DEM) grids and the per-pixel height
 * uncertainty (standard deviation) grids.
 */
public class HeightGrid {
	private final int       width;
	private final int       height;
	private final double [] data; // [height * width]

	public HeightGrid(int width, int height) {
		this(width, height, new double [width * height]);
	}

	public HeightGrid(int width, int height, double [] data) {
		if ((width < 0) || (height < 0)) {
			throw new IllegalArgumentException("Negative grid dimensions: "+width+"x"+height);
		}
		if (data.length != width * height) {
			throw new IllegalArgumentException("Data length "+data.length+" does not match "+width+"x"+height);
		}
		this.width =  width;
		this.height = height;
		this.data =   data;
	}

	/**
	 * Create grid from [row][column] array
	 * @param rows array of equal-length rows
	 * @return new grid (data is copied)
	 */
	public static HeightGrid fromRows(double [][] rows) {
		int h = rows.length;
		int w = (h > 0) ? rows[0].length : 0;
		double [] data = new double [w * h];
		for (int row = 0; row < h; row++) {
			if (rows[row].length != w) {
				throw new IllegalArgumentException("Row "+row+" has length "+rows[row].length+", expected "+w);
			}
			System.arraycopy(rows[row], 0, data, row * w, w);
		}
		return new HeightGrid(w, h, data);
	}

	public int getWidth()  {return width;}
	public int getHeight() {return height;}

	/**
	 * Direct access to the backing row-major array
	 * @return grid data, not a copy
	 */
	public double [] getData() {return data;}

	public double get(int x, int y) {
		return data[y * width + x];
	}

	public void set(int x, int y, double d) {
		data[y * width + x] = d;
	}

	public boolean sameShape(HeightGrid other) {
		return (other != null) && (other.width == width) && (other.height == height);
	}

	/**
	 * Copy a rectangular window into a new row-major array
	 * @param window area to copy, should be fully inside the grid
	 * @return window.width * window.height values
	 */
	public double [] getWindow(Rectangle window) {
		return getWindow(window.x, window.y, window.width, window.height);
	}

	public double [] getWindow(int x0, int y0, int w, int h) {
		if ((x0 < 0) || (y0 < 0) || ((x0 + w) > width) || ((y0 + h) > height)) {
			throw new IllegalArgumentException("Window "+w+"x"+h+"@"+x0+":"+y0+" is outside of "+width+"x"+height+" grid");
		}
		double [] window = new double [w * h];
		for (int row = 0; row < h; row++) {
			System.arraycopy(data, (y0 + row) * width + x0, window, row * w, w);
		}
		return window;
	}
}
