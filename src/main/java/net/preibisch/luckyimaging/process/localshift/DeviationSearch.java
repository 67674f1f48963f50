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
package net.preibisch.luckyimaging.process.localshift;

import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import util.ImgLib2Tools;

/**
 * Common part of the local searches: the deviation (sum of absolute differences) between the
 * reference box and the frame box displaced by an integer offset. The searches scan offsets
 * of the frame window, the reported shift is the negated best offset.
 */
public abstract class DeviationSearch implements LocalShiftMethod
{
	protected final int searchWidth;

	public DeviationSearch( final int searchWidth )
	{
		if ( searchWidth < 0 )
			throw new IllegalArgumentException( "Search width must be >= 0, but is " + searchWidth );

		this.searchWidth = searchWidth;
	}

	public int getSearchWidth() { return searchWidth; }

	/**
	 * @return if the box displaced by (dy, dx) lies within the frame
	 */
	protected static boolean inBounds( final RandomAccessibleInterval< FloatType > frame, final Interval box, final int dy, final int dx )
	{
		return box.min( 1 ) + dy >= frame.min( 1 ) && box.max( 1 ) + dy <= frame.max( 1 ) &&
				box.min( 0 ) + dx >= frame.min( 0 ) && box.max( 0 ) + dx <= frame.max( 0 );
	}

	protected static double deviation(
			final RandomAccessibleInterval< FloatType > referenceBox,
			final RandomAccessibleInterval< FloatType > frame,
			final Interval box,
			final int dy, final int dx )
	{
		final Interval displaced = ImgLib2Tools.interval2d(
				box.min( 1 ) + dy, box.max( 1 ) + 1 + dy,
				box.min( 0 ) + dx, box.max( 0 ) + 1 + dx );

		return ImgLib2Tools.sumOfAbsoluteDifferences( referenceBox, Views.interval( frame, displaced ) );
	}
}
