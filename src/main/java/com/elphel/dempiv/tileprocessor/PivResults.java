package com.elphel.dempiv.tileprocessor;
/**
 **
 ** PivResults - accepted tiles of a PIV scan in pixel units
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PivResults.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Index-aligned, append-only lists of tile origins {x, y}, displacement vectors
 * {du, dv} and (when propagating) 2x2 displacement covariances, all in pixels,
 * in lattice linescan order.
 */
public class PivResults {
	private final List<double []>   origins =     new ArrayList<double []>();
	private final List<double []>   vectors =     new ArrayList<double []>();
	private final List<double [][]> covariances = new ArrayList<double [][]>();
	private final List<Integer>     tiles =       new ArrayList<Integer>();
	private final boolean           propagated;

	public PivResults(boolean propagated) {
		this.propagated = propagated;
	}

	public boolean isPropagated() {
		return propagated;
	}

	/**
	 * Append accepted tile
	 * @param tile_index lattice index of the tile
	 * @param origin {x, y} in pixels
	 * @param vector {du, dv} in pixels
	 * @param covariance 2x2 covariance in pixels^2, required if propagated, ignored otherwise
	 */
	public void add(int tile_index, double [] origin, double [] vector, double [][] covariance) {
		if (propagated && (covariance == null)) {
			throw new IllegalArgumentException("Missing covariance for tile "+tile_index);
		}
		tiles.add(tile_index);
		origins.add(origin);
		vectors.add(vector);
		if (propagated) {
			covariances.add(covariance);
		}
	}

	public int size() {
		return vectors.size();
	}

	public List<double []> getOrigins() {
		return Collections.unmodifiableList(origins);
	}

	public List<double []> getVectors() {
		return Collections.unmodifiableList(vectors);
	}

	/** Empty list if not propagated */
	public List<double [][]> getCovariances() {
		return Collections.unmodifiableList(covariances);
	}

	public List<Integer> getTileIndices() {
		return Collections.unmodifiableList(tiles);
	}
}
