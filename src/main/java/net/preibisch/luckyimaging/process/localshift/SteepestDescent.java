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
import net.preibisch.luckyimaging.frames.ShiftVector;

/**
 * Greedy search starting at offset zero: moves to the 8-connected neighbor with the lowest deviation
 * as long as it is strictly lower than the current one and within the search width. Integer shifts only.
 *
 * @author Lucky Imaging Registration developers
 */
public class SteepestDescent extends DeviationSearch
{
	public SteepestDescent( final int searchWidth )
	{
		super( searchWidth );
	}

	@Override
	public LocalShift computeShift( final RandomAccessibleInterval< FloatType > referenceBox, final RandomAccessibleInterval< FloatType > frame, final Interval box )
	{
		if ( !inBounds( frame, box, 0, 0 ) )
			return LocalShift.FALLBACK;

		int dy = 0, dx = 0;
		double deviation = deviation( referenceBox, frame, box, 0, 0 );

		final int[][] neighbors = SearchRings.ring( 1 );

		while ( true )
		{
			int bestY = dy, bestX = dx;
			double bestDeviation = deviation;

			for ( final int[] step : neighbors )
			{
				final int y = dy + step[ 0 ];
				final int x = dx + step[ 1 ];

				if ( Math.abs( y ) > searchWidth || Math.abs( x ) > searchWidth || !inBounds( frame, box, y, x ) )
					continue;

				final double d = deviation( referenceBox, frame, box, y, x );

				if ( d < bestDeviation )
				{
					bestDeviation = d;
					bestY = y;
					bestX = x;
				}
			}

			if ( bestY == dy && bestX == dx )
				break;

			dy = bestY;
			dx = bestX;
			deviation = bestDeviation;
		}

		return new LocalShift( new ShiftVector( -dy, -dx ) );
	}
}
