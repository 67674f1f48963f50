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
package net.preibisch.luckyimaging.process.quality;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.RealSum;
import net.imglib2.view.Views;
import net.preibisch.luckyimaging.frames.ContrastMap;

/**
 * The default implementations of the three local contrast measures. Each one computes a
 * per-pixel response (border pixels use border extension) and reduces it over the region:
 * <ul>
 * <li>gradient: mean forward-difference gradient magnitude</li>
 * <li>Laplace: variance of the 4-neighbor Laplacian</li>
 * <li>Sobel: mean Sobel gradient magnitude</li>
 * </ul>
 *
 * @author Lucky Imaging Registration developers
 */
public class ContrastMeasures
{
	private ContrastMeasures() {}

	/**
	 * The strategy table from {@link RankMethod} to measure.
	 */
	public static ContrastMeasure forMethod( final RankMethod method )
	{
		switch ( method )
		{
			case GRADIENT:
				return gradient();
			case LAPLACE:
				return laplace();
			case SOBEL:
				return sobel();
			default:
				throw new IllegalArgumentException( "The frame ranking method " + method + " is not implemented." );
		}
	}

	public static ContrastMeasure gradient()
	{
		return new PixelResponseMeasure( RankMethod.GRADIENT, false )
		{
			@Override
			protected double response( final RandomAccess< FloatType > ra )
			{
				final double v = ra.get().getRealDouble();
				final double dx = value( ra, 1, 0 ) - v;
				final double dy = value( ra, 0, 1 ) - v;

				return Math.sqrt( dx * dx + dy * dy );
			}
		};
	}

	public static ContrastMeasure laplace()
	{
		return new PixelResponseMeasure( RankMethod.LAPLACE, true )
		{
			@Override
			protected double response( final RandomAccess< FloatType > ra )
			{
				return value( ra, -1, 0 ) + value( ra, 1, 0 ) + value( ra, 0, -1 ) + value( ra, 0, 1 ) - 4 * ra.get().getRealDouble();
			}
		};
	}

	public static ContrastMeasure sobel()
	{
		return new PixelResponseMeasure( RankMethod.SOBEL, false )
		{
			@Override
			protected double response( final RandomAccess< FloatType > ra )
			{
				final double gx =
						( value( ra, 1, -1 ) + 2 * value( ra, 1, 0 ) + value( ra, 1, 1 ) ) -
						( value( ra, -1, -1 ) + 2 * value( ra, -1, 0 ) + value( ra, -1, 1 ) );
				final double gy =
						( value( ra, -1, 1 ) + 2 * value( ra, 0, 1 ) + value( ra, 1, 1 ) ) -
						( value( ra, -1, -1 ) + 2 * value( ra, 0, -1 ) + value( ra, 1, -1 ) );

				return Math.sqrt( gx * gx + gy * gy );
			}
		};
	}

	protected static abstract class PixelResponseMeasure implements ContrastMeasure
	{
		private final RankMethod method;

		// reduce by variance instead of mean
		private final boolean variance;

		protected PixelResponseMeasure( final RankMethod method, final boolean variance )
		{
			this.method = method;
			this.variance = variance;
		}

		/**
		 * @param ra - positioned at the pixel, must be at the same position on return
		 * @return the response at the current position
		 */
		protected abstract double response( RandomAccess< FloatType > ra );

		@Override
		public RankMethod getRankMethod() { return method; }

		@Override
		public double measure( final RandomAccessibleInterval< FloatType > region )
		{
			return measure( Views.extendBorder( region ), region );
		}

		@Override
		public double measure( final RandomAccessible< FloatType > source, final Interval region )
		{
			final RandomAccess< FloatType > ra = source.randomAccess();
			final Cursor< FloatType > cursor = Views.flatIterable( Views.interval( source, region ) ).localizingCursor();

			final RealSum sum = new RealSum();
			final RealSum sumSq = new RealSum();
			long n = 0;

			while ( cursor.hasNext() )
			{
				cursor.fwd();
				ra.setPosition( cursor );

				final double r = response( ra );
				sum.add( r );
				sumSq.add( r * r );
				++n;
			}

			return reduce( sum.getSum(), sumSq.getSum(), n );
		}

		@Override
		public ContrastMap contrastMap( final RandomAccessibleInterval< FloatType > frame, final int downsampling )
		{
			final int w = (int)frame.dimension( 0 );
			final int h = (int)frame.dimension( 1 );
			final int mw = ( w + downsampling - 1 ) / downsampling;
			final int mh = ( h + downsampling - 1 ) / downsampling;

			final double[] sums = new double[ mw * mh ];
			final double[] sumsOfSquares = new double[ mw * mh ];
			final double[] counts = new double[ mw * mh ];

			final RandomAccess< FloatType > ra = Views.extendBorder( frame ).randomAccess();

			for ( int y = 0; y < h; ++y )
			{
				ra.setPosition( frame.min( 1 ) + y, 1 );

				for ( int x = 0; x < w; ++x )
				{
					ra.setPosition( frame.min( 0 ) + x, 0 );

					final int i = ( y / downsampling ) * mw + x / downsampling;
					final double r = response( ra );
					sums[ i ] += r;
					sumsOfSquares[ i ] += r * r;
					++counts[ i ];
				}
			}

			return new ContrastMap( method, downsampling,
					ArrayImgs.doubles( sums, mw, mh ), ArrayImgs.doubles( sumsOfSquares, mw, mh ), ArrayImgs.doubles( counts, mw, mh ) );
		}

		@Override
		public double measureFromMap( final ContrastMap map, final Interval mapRegion )
		{
			if ( map.getRankMethod() != method )
				throw new IllegalArgumentException( "Contrast map was computed for " + map.getRankMethod() + ", not " + method );

			final Cursor< DoubleType > cursorSum = Views.flatIterable( Views.interval( map.getSums(), mapRegion ) ).cursor();
			final Cursor< DoubleType > cursorSumSq = Views.flatIterable( Views.interval( map.getSumsOfSquares(), mapRegion ) ).cursor();
			final Cursor< DoubleType > cursorCount = Views.flatIterable( Views.interval( map.getCounts(), mapRegion ) ).cursor();

			final RealSum sum = new RealSum();
			final RealSum sumSq = new RealSum();
			long n = 0;

			while ( cursorSum.hasNext() )
			{
				sum.add( cursorSum.next().get() );
				sumSq.add( cursorSumSq.next().get() );
				n += Math.round( cursorCount.next().get() );
			}

			return reduce( sum.getSum(), sumSq.getSum(), n );
		}

		private double reduce( final double sum, final double sumSq, final long n )
		{
			if ( n == 0 )
				return 0;

			final double mean = sum / n;

			if ( variance )
				return Math.max( 0, sumSq / n - mean * mean );
			else
				return mean;
		}

		@Override
		public String toString()
		{
			return method.toString();
		}
	}

	/**
	 * Reads the value at a relative offset and moves back.
	 */
	protected static double value( final RandomAccess< FloatType > ra, final int dx, final int dy )
	{
		ra.move( dx, 0 );
		ra.move( dy, 1 );
		final double v = ra.get().getRealDouble();
		ra.move( -dx, 0 );
		ra.move( -dy, 1 );

		return v;
	}
}
