package com.elphel.dempiv.tileprocessor;
/**
 **
 ** PivTile - one lattice position of the PIV scan
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PivTile.java is free software: you can redistribute it and/or modify
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

public class PivTile {
	public final int       index;    // linescan index in the lattice (tileY * tilesX + tileX)
	public final int       tileX;    // horizontal tile index
	public final int       tileY;    // vertical tile index
	public final Rectangle template; // in the "before" grid
	public final Rectangle search;   // in the "after" grid
	public final double    originX;  // pixels, even templates have origins between pixel centers
	public final double    originY;

	public PivTile(
			int       index,
			int       tileX,
			int       tileY,
			Rectangle template,
			Rectangle search,
			double    originX,
			double    originY)
	{
		this.index =    index;
		this.tileX =    tileX;
		this.tileY =    tileY;
		this.template = template;
		this.search =   search;
		this.originX =  originX;
		this.originY =  originY;
	}

	@Override
	public String toString() {
		return "tile "+tileX+":"+tileY+" template "+template.width+"x"+template.height+"@"+template.x+":"+template.y+
				", search "+search.width+"x"+search.height+"@"+search.x+":"+search.y;
	}
}
