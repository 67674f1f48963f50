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
import util.ImgLib2Tools;

/**
 * The window {@code [yLow, yHigh) x [xLow, xHigh)} of the reference frame used for the global alignment,
 * together with the quality it was selected with.
 */
public class AlignmentRectangle
{
	private final int yLow, yHigh, xLow, xHigh;
	private final double quality;

	public AlignmentRectangle( final int yLow, final int yHigh, final int xLow, final int xHigh, final double quality )
	{
		this.yLow = yLow;
		this.yHigh = yHigh;
		this.xLow = xLow;
		this.xHigh = xHigh;
		this.quality = quality;
	}

	public int getYLow() { return yLow; }
	public int getYHigh() { return yHigh; }
	public int getXLow() { return xLow; }
	public int getXHigh() { return xHigh; }
	public double getQuality() { return quality; }

	public int getHeight() { return yHigh - yLow; }
	public int getWidth() { return xHigh - xLow; }

	public FinalInterval toInterval()
	{
		return ImgLib2Tools.interval2d( yLow, yHigh, xLow, xHigh );
	}

	@Override
	public String toString()
	{
		return "y=[" + yLow + ", " + yHigh + "), x=[" + xLow + ", " + xHigh + "), quality=" + quality;
	}
}
