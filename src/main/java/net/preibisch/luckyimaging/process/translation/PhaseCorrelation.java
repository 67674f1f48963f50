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
package net.preibisch.luckyimaging.process.translation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.complex.ComplexFloatType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.preibisch.luckyimaging.frames.ShiftVector;
import util.ImgLib2Tools;

/**
 * Integer-accuracy translation by phase correlation. Both regions are mean-subtracted,
 * (optionally) Hann-windowed and zero-padded, so the phase correlation matrix is linear. Shifts are
 * limited to half the region size per axis. The highest local maxima of the matrix are candidates,
 * the one with the highest correlation coefficient over the overlap of the unwindowed regions wins.
 * Ties are broken by the higher phase correlation peak.
 *
 * @author Lucky Imaging Registration developers
 */
public class PhaseCorrelation implements TranslationEstimator
{
	public static int defaultNumPeaks = 5;

	private final boolean window;
	private final int numPeaks;

	public PhaseCorrelation()
	{
		this( true );
	}

	public PhaseCorrelation( final boolean window )
	{
		this( window, defaultNumPeaks );
	}

	public PhaseCorrelation( final boolean window, final int numPeaks )
	{
		if ( numPeaks < 1 )
			throw new IllegalArgumentException( "Number of peaks to check must be >= 1, but is " + numPeaks );

		this.window = window;
		this.numPeaks = numPeaks;
	}

	@Override
	public TranslationResult estimate( final RandomAccessibleInterval< FloatType > reference, final RandomAccessibleInterval< FloatType > frame )
	{
		checkSameSize( reference, frame );

		final double[][] a = FourierTools.zeroMean( ImgLib2Tools.toArray( reference ) );
		final double[][] b = FourierTools.zeroMean( ImgLib2Tools.toArray( frame ) );

		final int h = a.length;
		final int w = a[ 0 ].length;
		final long[] fftDimensions = FourierTools.paddedDimensions( h, w );

		final Img< ComplexFloatType > pcm = FourierTools.multiplyConjugate(
				FourierTools.forward( window ? FourierTools.hannWindow( a ) : a, fftDimensions ),
				FourierTools.forward( window ? FourierTools.hannWindow( b ) : b, fftDimensions ),
				true );

		FourierTools.transform( pcm, false );

		final double[][] values = FourierTools.toArrays( pcm )[ 0 ];

		final ArrayList< int[] > peaks = localMaxima( values, h / 2, w / 2 );

		Collections.sort( peaks, new Comparator< int[] >()
		{
			@Override
			public int compare( final int[] o1, final int[] o2 )
			{
				return Double.compare( values[ o2[ 0 ] ][ o2[ 1 ] ], values[ o1[ 0 ] ][ o1[ 1 ] ] );
			}
		} );

		final int hp = values.length;
		final int wp = values[ 0 ].length;

		int bestY = 0, bestX = 0;
		double best = -Double.MAX_VALUE;

		for ( int i = 0; i < Math.min( numPeaks, peaks.size() ); ++i )
		{
			final int ty = FourierTools.wrap( peaks.get( i )[ 0 ], hp );
			final int tx = FourierTools.wrap( peaks.get( i )[ 1 ], wp );
			final double r = correlationCoefficient( a, b, ty, tx );

			if ( r > best )
			{
				best = r;
				bestY = ty;
				bestX = tx;
			}
		}

		return new TranslationResult( new ShiftVector( bestY, bestX ) );
	}

	/**
	 * @return positions { y, x } of the phase correlation matrix that are >= their 8 (circular) neighbors
	 * and whose shift is within maxY, maxX; never empty
	 */
	protected static ArrayList< int[] > localMaxima( final double[][] values, final int maxY, final int maxX )
	{
		final int hp = values.length;
		final int wp = values[ 0 ].length;

		final ArrayList< int[] > peaks = new ArrayList<>();

		int maxPosY = 0, maxPosX = 0;

		for ( int y = 0; y < hp; ++y )
		{
			if ( Math.abs( FourierTools.wrap( y, hp ) ) > maxY )
				continue;

			for ( int x = 0; x < wp; ++x )
			{
				if ( Math.abs( FourierTools.wrap( x, wp ) ) > maxX )
					continue;

				final double v = values[ y ][ x ];

				if ( v > values[ maxPosY ][ maxPosX ] )
				{
					maxPosY = y;
					maxPosX = x;
				}

				boolean isMaximum = true;

				for ( int dy = -1; dy <= 1 && isMaximum; ++dy )
					for ( int dx = -1; dx <= 1 && isMaximum; ++dx )
						if ( values[ ( y + dy + hp ) % hp ][ ( x + dx + wp ) % wp ] > v )
							isMaximum = false;

				if ( isMaximum )
					peaks.add( new int[] { y, x } );
			}
		}

		// the largest value in range can sit next to a larger one out of range
		if ( peaks.isEmpty() )
			peaks.add( new int[] { maxPosY, maxPosX } );

		return peaks;
	}

	/**
	 * @return the correlation coefficient of a( y + ty, x + tx ) and b( y, x ) over their overlap,
	 * 0 if either is constant there
	 */
	protected static double correlationCoefficient( final double[][] a, final double[][] b, final int ty, final int tx )
	{
		final int h = a.length;
		final int w = a[ 0 ].length;

		final int y0 = Math.max( 0, -ty ), y1 = Math.min( h, h - ty );
		final int x0 = Math.max( 0, -tx ), x1 = Math.min( w, w - tx );

		if ( y1 <= y0 || x1 <= x0 )
			return 0;

		final double n = (double)( y1 - y0 ) * ( x1 - x0 );

		double sumA = 0, sumB = 0;

		for ( int y = y0; y < y1; ++y )
			for ( int x = x0; x < x1; ++x )
			{
				sumA += a[ y + ty ][ x + tx ];
				sumB += b[ y ][ x ];
			}

		final double meanA = sumA / n;
		final double meanB = sumB / n;

		double ab = 0, aa = 0, bb = 0;

		for ( int y = y0; y < y1; ++y )
			for ( int x = x0; x < x1; ++x )
			{
				final double da = a[ y + ty ][ x + tx ] - meanA;
				final double db = b[ y ][ x ] - meanB;

				ab += da * db;
				aa += da * da;
				bb += db * db;
			}

		if ( aa <= 0 || bb <= 0 )
			return 0;

		return ab / Math.sqrt( aa * bb );
	}

	protected static void checkSameSize( final RandomAccessibleInterval< FloatType > a, final RandomAccessibleInterval< FloatType > b )
	{
		if ( a.numDimensions() != 2 || !Intervals.equalDimensions( a, b ) )
			throw new IllegalArgumentException(
					"Translation needs two 2d regions of identical size, but got " +
					Util.printInterval( a ) + " and " + Util.printInterval( b ) );
	}
}
