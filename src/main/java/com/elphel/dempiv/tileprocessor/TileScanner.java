package com.elphel.dempiv.tileprocessor;
/**
 **
 ** TileScanner - regular lattice of template/search window pairs
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TileScanner.java is free software: you can redistribute it and/or modify
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
 * Enumerates tiles in linescan order (vertical index outer, horizontal inner).
 * Search window is twice the template size (plus one for odd templates, so it
 * stays symmetrical around the template), the template is offset by
 * ceil(template_size/2) inside it.
 */
public class TileScanner {
	public static final int MIN_TEMPLATE_SIZE = 3;

	private final int gridWidth;
	private final int gridHeight;
	private final int templateSize;
	private final int stepSize;
	private final int searchSize;
	private final int tilesX;
	private final int tilesY;

	public TileScanner(
			int gridWidth,
			int gridHeight,
			int templateSize,
			int stepSize)
	{
		if (templateSize < MIN_TEMPLATE_SIZE) {
			throw new IllegalArgumentException("Template size should be >= "+MIN_TEMPLATE_SIZE+", got "+templateSize);
		}
		if (stepSize < 1) {
			throw new IllegalArgumentException("Step size should be >= 1, got "+stepSize);
		}
		this.gridWidth =    gridWidth;
		this.gridHeight =   gridHeight;
		this.templateSize = templateSize;
		this.stepSize =     stepSize;
		this.searchSize =   2 * templateSize;
		this.tilesX =       Math.max(0, Math.floorDiv(gridWidth -  searchSize, stepSize));
		this.tilesY =       Math.max(0, Math.floorDiv(gridHeight - searchSize, stepSize));
	}

	public int getTilesX()       {return tilesX;}
	public int getTilesY()       {return tilesY;}
	public int getNumTiles()     {return tilesX * tilesY;}
	public int getTemplateSize() {return templateSize;}
	public int getStepSize()     {return stepSize;}
	public int getGridWidth()    {return gridWidth;}
	public int getGridHeight()   {return gridHeight;}

	/**
	 * @return ceil(template_size/2), template offset in the search window and the zero-displacement peak position
	 */
	public int getTemplateOffset() {
		return (templateSize + 1) / 2;
	}

	/**
	 * @return search window side, including the odd-size correction
	 */
	public int getSearchWindowSize() {
		return searchSize + (templateSize % 2);
	}

	public PivTile getTile(int index) {
		if ((index < 0) || (index >= getNumTiles())) {
			throw new IllegalArgumentException("Tile index "+index+" is outside of 0.."+(getNumTiles()-1));
		}
		return getTile(index % tilesX, index / tilesX);
	}

	public PivTile getTile(int tileX, int tileY) {
		int template_offset = getTemplateOffset();
		int search_side =     getSearchWindowSize();
		Rectangle template = new Rectangle(
				tileX * stepSize + template_offset,
				tileY * stepSize + template_offset,
				templateSize,
				templateSize);
		Rectangle search = new Rectangle(
				tileX * stepSize,
				tileY * stepSize,
				search_side,
				search_side);
		double even_shift = (1 - templateSize % 2) * 0.5; // even templates - between pixel centers
		return new PivTile(
				tileY * tilesX + tileX,
				tileX,
				tileY,
				template,
				search,
				tileX * stepSize + templateSize - even_shift,
				tileY * stepSize + templateSize - even_shift);
	}
}
