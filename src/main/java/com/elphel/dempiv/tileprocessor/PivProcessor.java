package com.elphel.dempiv.tileprocessor;
/**
 **
 ** PivProcessor - particle image velocimetry between "before" and "after" DEMs
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PivProcessor.java is free software: you can redistribute it and/or modify
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
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.dempiv.common.MultiThreading;

/**
 * Scans the lattice of tiles, correlates each "before" template with the
 * matching "after" search window, refines the correlation maximum to sub-pixel
 * and optionally propagates height uncertainties to the displacement covariance.
 * Tiles are processed in parallel, results are merged in linescan order.
 */
public class PivProcessor {
	private static final Logger LOGGER = LoggerFactory.getLogger(PivProcessor.class);

	public static final String MISMATCH_MESSAGE =
			"The extent and/or datum of the 'before' and 'after' DEMs is not equivalent.";

	private final PivParameters pivParameters;

	/** Per-tile result, null slots are skipped tiles */
	static class TileResult {
		final double []   origin;
		final double []   vector;
		final double [][] covariance;
		TileResult(double [] origin, double [] vector, double [][] covariance) {
			this.origin =     origin;
			this.vector =     vector;
			this.covariance = covariance;
		}
	}

	public PivProcessor(PivParameters pivParameters) {
		pivParameters.validate();
		this.pivParameters = pivParameters.clone();
	}

	public PivParameters getParameters() {
		return pivParameters.clone();
	}

	/**
	 * Verify that the DEM pair (and the uncertainty pair if present) can be processed
	 * together. Throws IllegalArgumentException otherwise.
	 * @param before "before" heights
	 * @param before_transform "before" pixel to ground transform
	 * @param after "after" heights
	 * @param after_transform "after" pixel to ground transform
	 * @param before_sigma "before" height uncertainties or null
	 * @param after_sigma "after" height uncertainties or null
	 */
	public static void validateInputs(
			HeightGrid   before,
			GeoTransform before_transform,
			HeightGrid   after,
			GeoTransform after_transform,
			HeightGrid   before_sigma,
			HeightGrid   after_sigma)
	{
		if (!before.sameShape(after) || (before_transform == null) || !before_transform.equals(after_transform)) {
			throw new IllegalArgumentException(MISMATCH_MESSAGE+" before: "+before.getWidth()+"x"+before.getHeight()+" "+before_transform+
					", after: "+after.getWidth()+"x"+after.getHeight()+" "+after_transform);
		}
		if ((before_sigma != null) && !before.sameShape(before_sigma)) {
			throw new IllegalArgumentException("'before' uncertainty grid "+before_sigma.getWidth()+"x"+before_sigma.getHeight()+
					" does not match 'before' DEM "+before.getWidth()+"x"+before.getHeight());
		}
		if ((after_sigma != null) && !after.sameShape(after_sigma)) {
			throw new IllegalArgumentException("'after' uncertainty grid "+after_sigma.getWidth()+"x"+after_sigma.getHeight()+
					" does not match 'after' DEM "+after.getWidth()+"x"+after.getHeight());
		}
	}

	/**
	 * Run PIV over all tiles
	 * @param before "before" heights
	 * @param after "after" heights, same shape
	 * @param before_sigma "before" height standard deviations, required when propagating
	 * @param after_sigma "after" height standard deviations, required when propagating
	 * @return accepted tiles in linescan order, pixel units
	 */
	public PivResults process(
			final HeightGrid before,
			final HeightGrid after,
			final HeightGrid before_sigma,
			final HeightGrid after_sigma)
	{
		final boolean propagate = pivParameters.propagate;
		if (!before.sameShape(after)) {
			throw new IllegalArgumentException(MISMATCH_MESSAGE);
		}
		if (propagate) {
			if ((before_sigma == null) || (after_sigma == null)) {
				throw new IllegalArgumentException("Uncertainty propagation requires both 'before' and 'after' uncertainty grids");
			}
			if (!before.sameShape(before_sigma) || !after.sameShape(after_sigma)) {
				throw new IllegalArgumentException("Uncertainty grids should have the same shape as the DEMs");
			}
		}
		final int debug_level = pivParameters.debug_level;
		final TileScanner scanner = new TileScanner(
				before.getWidth(),
				before.getHeight(),
				pivParameters.template_size,
				pivParameters.step_size);
		final int num_tiles = scanner.getNumTiles();
		final TileResult [] tile_results = new TileResult [num_tiles];
		final AtomicInteger num_flat =       new AtomicInteger(0);
		final AtomicInteger num_border =     new AtomicInteger(0);
		final AtomicInteger num_degenerate = new AtomicInteger(0);
		if (debug_level > 0) {
			LOGGER.info("process(): "+before.getWidth()+"x"+before.getHeight()+" grid, template "+scanner.getTemplateSize()+
					", step "+scanner.getStepSize()+", "+scanner.getTilesX()+"x"+scanner.getTilesY()+" tiles, propagate="+propagate);
		}
		final Thread[] threads = MultiThreading.newThreadArray(pivParameters.threads_max);
		final AtomicInteger ai = new AtomicInteger(0);
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				@Override
				public void run() {
					NormalizedCorrelation  correlation = new NormalizedCorrelation();
					CorrelationUncertainty uncertainty = propagate ? new CorrelationUncertainty(pivParameters.partial_increment) : null;
					for (int nTile = ai.getAndIncrement(); nTile < num_tiles; nTile = ai.getAndIncrement()) {
						tile_results[nTile] = processTile(
								scanner.getTile(nTile), // PivTile                tile,
								scanner,                // TileScanner            scanner,
								before,                 // HeightGrid             before,
								after,                  // HeightGrid             after,
								before_sigma,           // HeightGrid             before_sigma,
								after_sigma,            // HeightGrid             after_sigma,
								correlation,            // NormalizedCorrelation  correlation,
								uncertainty,            // CorrelationUncertainty uncertainty,
								num_flat,               // AtomicInteger          num_flat,
								num_border,             // AtomicInteger          num_border,
								num_degenerate,         // AtomicInteger          num_degenerate,
								debug_level);           // int                    debug_level)
					}
				}
			};
		}
		MultiThreading.startAndJoin(threads);

		PivResults results = new PivResults(propagate);
		for (int nTile = 0; nTile < num_tiles; nTile++) if (tile_results[nTile] != null) {
			results.add(
					nTile,
					tile_results[nTile].origin,
					tile_results[nTile].vector,
					tile_results[nTile].covariance);
		}
		if (debug_level > 0) {
			LOGGER.info("process(): accepted "+results.size()+" of "+num_tiles+" tiles, skipped: flat template - "+num_flat.get()+
					", peak on border - "+num_border.get()+", degenerate peak - "+num_degenerate.get());
		}
		return results;
	}

	/**
	 * Process a single tile
	 * @return tile result or null if the tile is skipped
	 */
	TileResult processTile(
			final PivTile                tile,
			final TileScanner            scanner,
			final HeightGrid             before,
			final HeightGrid             after,
			final HeightGrid             before_sigma,
			final HeightGrid             after_sigma,
			final NormalizedCorrelation  correlation,
			final CorrelationUncertainty uncertainty,
			final AtomicInteger          num_flat,
			final AtomicInteger          num_border,
			final AtomicInteger          num_degenerate,
			final int                    debug_level)
	{
		final int template_size = scanner.getTemplateSize();
		double [] template = before.getWindow(tile.template);
		// flat template produces division by zero in normalized cross correlation
		if (NormalizedCorrelation.isFlat(template)) {
			num_flat.getAndIncrement();
			if (debug_level > 1) {
				LOGGER.info("processTile(): "+tile+" - flat template, skipping");
			}
			return null;
		}
		double [] search = after.getWindow(tile.search);
		double [] corr = correlation.correlate(
				search,               // final double [] search,
				tile.search.width,    // final int       search_width,
				template,             // final double [] template,
				tile.template.width); // final int       template_width)
		int corr_width =  tile.search.width -  tile.template.width + 1;
		int corr_height = tile.search.height - tile.template.height + 1;
		int [] peak_xy = NormalizedCorrelation.getMaxXYInt(corr, corr_width);
		// quadratic interpolation needs all 8 neighbors of the maximum
		if (NormalizedCorrelation.isBorder(peak_xy, corr_width, corr_height)) {
			num_border.getAndIncrement();
			if (debug_level > 1) {
				LOGGER.info("processTile(): "+tile+" - correlation maximum on the border ("+peak_xy[0]+":"+peak_xy[1]+"), skipping");
			}
			return null;
		}
		double [][] ncc = NormalizedCorrelation.getNeighborhood3x3(corr, corr_width, peak_xy);
		double [] delta = SubpixelPeak.getSubpixelPeak(ncc);
		if (delta == null) {
			num_degenerate.getAndIncrement();
			if (debug_level > 1) {
				LOGGER.info("processTile(): "+tile+" - degenerate quadratic around "+peak_xy[0]+":"+peak_xy[1]+", skipping");
			}
			return null;
		}
		double [][] covariance = null;
		if (uncertainty != null) {
			Rectangle sub_window = new Rectangle(
					tile.search.x + peak_xy[0] - 1,
					tile.search.y + peak_xy[1] - 1,
					template_size + 2,
					template_size + 2);
			covariance = uncertainty.getDisplacementCovariance(
					template,                              // final double []   template,
					before_sigma.getWindow(tile.template), // final double []   template_sigma,
					template_size,                         // final int         template_width,
					after.getWindow(sub_window),           // final double []   search_sub,
					after_sigma.getWindow(sub_window),     // final double []   search_sub_sigma,
					ncc,                                   // final double [][] ncc,
					delta);                                // final double []   delta)
			if (covariance == null) {
				num_degenerate.getAndIncrement();
				if (debug_level > 1) {
					LOGGER.info("processTile(): "+tile+" - undefined displacement covariance, skipping");
				}
				return null;
			}
		}
		double [] vector = SubpixelPeak.getDisplacement(peak_xy, delta, scanner.getTemplateOffset());
		if (debug_level > 2) {
			LOGGER.info("processTile(): "+tile+" - displacement "+vector[0]+":"+vector[1]+
					((covariance != null) ? (", variances "+covariance[0][0]+":"+covariance[1][1]) : ""));
		}
		return new TileResult(
				new double [] {tile.originX, tile.originY},
				vector,
				covariance);
	}
}
