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
 * Exhaustive search on square rings of growing radius. The minimal deviation of every ring is
 * compared to the one of the previous ring; as soon as it does not improve, the best offset of the
 * previous ring is the result. If no ring can be evaluated at all, or the deviation still improves
 * at the search width, the zero shift is returned as fallback.
 * <p>
 * With sub-pixel refinement a parabola is fit through the deviations around the best offset, separately in y and x.
 *
 * @author Lucky Imaging Registration developers
 */
public class RadialSearch extends DeviationSearch
{
	private final boolean subpixel;

	public RadialSearch( final int searchWidth )
	{
		this( searchWidth, false );
	}

	public RadialSearch( final int searchWidth, final boolean subpixel )
	{
		super( searchWidth );
		this.subpixel = subpixel;
	}

	@Override
	public LocalShift computeShift( final RandomAccessibleInterval< FloatType > referenceBox, final RandomAccessibleInterval< FloatType > frame, final Interval box )
	{
		double deviationMin = Double.MAX_VALUE;
		int[] best = null;

		for ( int r = 0; r <= searchWidth; ++r )
		{
			double deviationMinR = Double.MAX_VALUE;
			int[] bestR = null;

			for ( final int[] offset : SearchRings.ring( r ) )
			{
				if ( !inBounds( frame, box, offset[ 0 ], offset[ 1 ] ) )
					continue;

				final double deviation = deviation( referenceBox, frame, box, offset[ 0 ], offset[ 1 ] );

				if ( deviation < deviationMinR )
				{
					deviationMinR = deviation;
					bestR = offset;
				}
			}

			// no ring could be evaluated yet, or the previous ring was the best
			if ( bestR == null || deviationMinR >= deviationMin )
				return best == null ? LocalShift.FALLBACK : result( referenceBox, frame, box, best, deviationMin );

			deviationMin = deviationMinR;
			best = bestR;
		}

		return LocalShift.FALLBACK;
	}

	protected LocalShift result(
			final RandomAccessibleInterval< FloatType > referenceBox,
			final RandomAccessibleInterval< FloatType > frame,
			final Interval box,
			final int[] best,
			final double deviation )
	{
		if ( !subpixel )
			return new LocalShift( new ShiftVector( -best[ 0 ], -best[ 1 ] ) );

		final double refineY = refine( referenceBox, frame, box, best, deviation, 1, 0 );
		final double refineX = refine( referenceBox, frame, box, best, deviation, 0, 1 );

		return new LocalShift( new ShiftVector( -( best[ 0 ] + refineY ), -( best[ 1 ] + refineX ) ) );
	}

	/**
	 * Vertex of the parabola through the deviations at best - step, best, best + step, within [-0.5, 0.5].
	 */
	protected static double refine(
			final RandomAccessibleInterval< FloatType > referenceBox,
			final RandomAccessibleInterval< FloatType > frame,
			final Interval box,
			final int[] best,
			final double deviation,
			final int stepY, final int stepX )
	{
		final int yMinus = best[ 0 ] - stepY, xMinus = best[ 1 ] - stepX;
		final int yPlus = best[ 0 ] + stepY, xPlus = best[ 1 ] + stepX;

		if ( !inBounds( frame, box, yMinus, xMinus ) || !inBounds( frame, box, yPlus, xPlus ) )
			return 0;

		final double minus = deviation( referenceBox, frame, box, yMinus, xMinus );
		final double plus = deviation( referenceBox, frame, box, yPlus, xPlus );
		final double curvature = minus - 2 * deviation + plus;

		if ( curvature <= 0 )
			return 0;

		return Math.max( -0.5, Math.min( 0.5, ( minus - plus ) / ( 2 * curvature ) ) );
	}
}
