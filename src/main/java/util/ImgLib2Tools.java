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
package util;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

public class ImgLib2Tools
{
	/**
	 * Creates the 2d interval {@code [yLow, yHigh) x [xLow, xHigh)}, upper bounds exclusive,
	 * in imglib2 axis order (x, y).
	 */
	public static final FinalInterval interval2d( final long yLow, final long yHigh, final long xLow, final long xHigh )
	{
		return Intervals.createMinMax( xLow, yLow, xHigh - 1, yHigh - 1 );
	}

	public static final Img< FloatType > copy( final RandomAccessibleInterval< FloatType > source )
	{
		final Img< FloatType > target = ArrayImgs.floats( Intervals.dimensionsAsLongArray( source ) );

		final Cursor< FloatType > cursorSource = Views.flatIterable( source ).cursor();
		final Cursor< FloatType > cursorTarget = Views.flatIterable( target ).cursor();

		while ( cursorSource.hasNext() )
			cursorTarget.next().set( cursorSource.next() );

		return target;
	}

	/**
	 * @return { min, max } of the interval
	 */
	public static final double[] minMax( final RandomAccessibleInterval< FloatType > img )
	{
		double min = Double.MAX_VALUE;
		double max = -Double.MAX_VALUE;

		for ( final FloatType t : Views.flatIterable( img ) )
		{
			final double v = t.getRealDouble();

			if ( v < min )
				min = v;

			if ( v > max )
				max = v;
		}

		return new double[] { min, max };
	}

	/**
	 * Sum of absolute differences between two intervals of identical size.
	 */
	public static final double sumOfAbsoluteDifferences( final RandomAccessibleInterval< FloatType > a, final RandomAccessibleInterval< FloatType > b )
	{
		final Cursor< FloatType > cursorA = Views.flatIterable( a ).cursor();
		final Cursor< FloatType > cursorB = Views.flatIterable( b ).cursor();

		double sum = 0;

		while ( cursorA.hasNext() )
			sum += Math.abs( cursorA.next().getRealDouble() - cursorB.next().getRealDouble() );

		return sum;
	}

	/**
	 * Reads a 2d interval into a row-major double array {@code [y][x]}.
	 */
	public static final double[][] toArray( final RandomAccessibleInterval< FloatType > img )
	{
		final int w = (int)img.dimension( 0 );
		final int h = (int)img.dimension( 1 );
		final double[][] array = new double[ h ][ w ];

		final Cursor< FloatType > cursor = Views.flatIterable( img ).cursor();

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				array[ y ][ x ] = cursor.next().getRealDouble();

		return array;
	}
}
