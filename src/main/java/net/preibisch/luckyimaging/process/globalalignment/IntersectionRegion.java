/*-
 * #%L
 * Registration core of a lucky-imaging stacker: global frame alignment,
 * alignment point grids, local de-warping shifts and frame ranking.
 * %%
 * Copyright (C) 2018 - 2025 Lucky Imaging Registration developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.luckyimaging.process.globalalignment;

import net.imglib2.FinalInterval;
import net.preibisch.luckyimaging.frames.ShiftVector;
import util.ImgLib2Tools;

/**
 * The region {@code [yLow, yHigh) x [xLow, xHigh)} common to all frames after compensating
 * each by its global shift. Cropping a frame with shift {@code (dy, dx)} at
 * {@code [yLow - dy, yHigh - dy) x [xLow - dx, xHigh - dx)} is in bounds for every frame.
 */
public class IntersectionRegion
{
	private final int yLow, yHigh, xLow, xHigh;

	public IntersectionRegion( final int yLow, final int yHigh, final int xLow, final int xHigh )
	{
		this.yLow = yLow;
		this.yHigh = yHigh;
		this.xLow = xLow;
		this.xHigh = xHigh;
	}

	public int getYLow() { return yLow; }
	public int getYHigh() { return yHigh; }
	public int getXLow() { return xLow; }
	public int getXHigh() { return xHigh; }

	public int getHeight() { return yHigh - yLow; }
	public int getWidth() { return xHigh - xLow; }

	public boolean isEmpty() { return yHigh <= yLow || xHigh <= xLow; }

	/**
	 * @return the crop of a frame with the given (integer) global shift, in frame coordinates
	 */
	public FinalInterval cropInterval( final ShiftVector shift )
	{
		final int dy = shift.getRoundedDy();
		final int dx = shift.getRoundedDx();

		return ImgLib2Tools.interval2d( yLow - dy, yHigh - dy, xLow - dx, xHigh - dx );
	}

	@Override
	public String toString()
	{
		return "y=[" + yLow + ", " + yHigh + "), x=[" + xLow + ", " + xHigh + ")";
	}
}
