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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.complex.ComplexFloatType;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.luckyimaging.frames.ShiftVector;
import util.ImgLib2Tools;

/**
 * Sub-pixel translation by normalized cross-correlation, refined with an upsampled DFT around the
 * integer peak (Guizar-Sicairos, Thurman &amp; Fienup, "Efficient subpixel image registration algorithms",
 * Opt. Lett. 33, 2008). The accuracy is {@code 1 / upsampleFactor} pixels.
 * <p>
 * Both regions are zero-padded, and every lag is normalized by the means and variances of the
 * overlapping parts (masked normalized cross-correlation, Padfield, IEEE TIP 21, 2012), so the
 * correlation of a region with a translated copy of itself is exactly 1 at the shift, whatever the
 * region borders contain. Shifts are limited to half the region size per axis.
 * <p>
 * Also reports the normalized RMS error {@code sqrt( 1 - r^2 )} for the correlation coefficient r
 * at the peak and the phase of the cross-correlation there.
 *
 * @author Lucky Imaging Registration developers
 */
public class SubpixelRegistration implements TranslationEstimator
{
	public static int defaultUpsampleFactor = 10;

	// indices of the overlap sums, each a correlation of the padded regions
	final static int AB = 0, AA = 1, BB = 2, A = 3, B = 4;

	private final int upsampleFactor;

	public SubpixelRegistration()
	{
		this( defaultUpsampleFactor );
	}

	public SubpixelRegistration( final int upsampleFactor )
	{
		if ( upsampleFactor < 1 )
			throw new IllegalArgumentException( "Upsample factor must be >= 1, but is " + upsampleFactor );

		this.upsampleFactor = upsampleFactor;
	}

	public int getUpsampleFactor() { return upsampleFactor; }

	@Override
	public TranslationResult estimate( final RandomAccessibleInterval< FloatType > reference, final RandomAccessibleInterval< FloatType > frame )
	{
		PhaseCorrelation.checkSameSize( reference, frame );

		final double[][] a = FourierTools.zeroMean( ImgLib2Tools.toArray( reference ) );
		final double[][] b = FourierTools.zeroMean( ImgLib2Tools.toArray( frame ) );

		final int h = a.length;
		final int w = a[ 0 ].length;
		final long[] fftDimensions = FourierTools.paddedDimensions( h, w );

		final Img< ComplexFloatType > fa = FourierTools.forward( a, fftDimensions );
		final Img< ComplexFloatType > fb = FourierTools.forward( b, fftDimensions );
		final Img< ComplexFloatType > fa2 = FourierTools.forward( square( a ), fftDimensions );
		final Img< ComplexFloatType > fb2 = FourierTools.forward( square( b ), fftDimensions );
		final Img< ComplexFloatType > fm = FourierTools.forward( ones( h, w ), fftDimensions );

		// sums over the overlap of a( y + t ) and b( y )
		final Img< ComplexFloatType >[] products = newArray( 5 );
		products[ AB ] = FourierTools.multiplyConjugate( fa, fb, false );
		products[ AA ] = FourierTools.multiplyConjugate( fa2, fm, false );
		products[ BB ] = FourierTools.multiplyConjugate( fm, fb2, false );
		products[ A ] = FourierTools.multiplyConjugate( fa, fm, false );
		products[ B ] = FourierTools.multiplyConjugate( fm, fb, false );

		final double[][][][] spectra = new double[ 5 ][][][];
		final double[][][][] sums = new double[ 5 ][][][];

		for ( int i = 0; i < 5; ++i )
		{
			spectra[ i ] = FourierTools.toArrays( products[ i ] );
			FourierTools.transform( products[ i ], false );
			sums[ i ] = FourierTools.toArrays( products[ i ] );
		}

		final int hp = (int)fftDimensions[ 1 ];
		final int wp = (int)fftDimensions[ 0 ];

		int peakY = 0, peakX = 0;
		double peak = -Double.MAX_VALUE;

		for ( int y = 0; y < hp; ++y )
		{
			final int ty = FourierTools.wrap( y, hp );

			if ( Math.abs( ty ) > h / 2 )
				continue;

			for ( int x = 0; x < wp; ++x )
			{
				final int tx = FourierTools.wrap( x, wp );

				if ( Math.abs( tx ) > w / 2 )
					continue;

				final double r = correlationCoefficient(
						sums[ AB ][ 0 ][ y ][ x ], sums[ AA ][ 0 ][ y ][ x ], sums[ BB ][ 0 ][ y ][ x ],
						sums[ A ][ 0 ][ y ][ x ], sums[ B ][ 0 ][ y ][ x ], overlap( h, w, ty, tx ) );

				if ( r > peak )
				{
					peak = r;
					peakY = y;
					peakX = x;
				}
			}
		}

		double dy = FourierTools.wrap( peakY, hp );
		double dx = FourierTools.wrap( peakX, wp );
		double maxRe = sums[ AB ][ 0 ][ peakY ][ peakX ];
		double maxIm = sums[ AB ][ 1 ][ peakY ][ peakX ];

		if ( upsampleFactor > 1 )
		{
			final int regionSize = (int)Math.ceil( upsampleFactor * 1.5 );
			final int dftShift = regionSize / 2;

			final double[] ty = new double[ regionSize ];
			final double[] tx = new double[ regionSize ];

			for ( int j = 0; j < regionSize; ++j )
			{
				ty[ j ] = dy + (double)( j - dftShift ) / upsampleFactor;
				tx[ j ] = dx + (double)( j - dftShift ) / upsampleFactor;
			}

			final double n = (double)hp * wp;
			final double[][][][] upsampled = new double[ 5 ][][][];

			for ( int i = 0; i < 5; ++i )
				upsampled[ i ] = FourierTools.upsampledInverse( spectra[ i ][ 0 ], spectra[ i ][ 1 ], ty, tx );

			peak = -Double.MAX_VALUE;

			for ( int i = 0; i < regionSize; ++i )
				for ( int j = 0; j < regionSize; ++j )
				{
					final double r = correlationCoefficient(
							upsampled[ AB ][ 0 ][ i ][ j ] / n, upsampled[ AA ][ 0 ][ i ][ j ] / n, upsampled[ BB ][ 0 ][ i ][ j ] / n,
							upsampled[ A ][ 0 ][ i ][ j ] / n, upsampled[ B ][ 0 ][ i ][ j ] / n, overlap( h, w, ty[ i ], tx[ j ] ) );

					if ( r > peak )
					{
						peak = r;
						peakY = i;
						peakX = j;
					}
				}

			maxRe = upsampled[ AB ][ 0 ][ peakY ][ peakX ] / n;
			maxIm = upsampled[ AB ][ 1 ][ peakY ][ peakX ] / n;
			dy = ty[ peakY ];
			dx = tx[ peakX ];
		}

		final double error = Math.sqrt( Math.max( 0, 1.0 - peak * peak ) );

		return new TranslationResult( new ShiftVector( dy, dx ), error, Math.atan2( maxIm, maxRe ) );
	}

	/**
	 * @return the correlation coefficient from the overlap sums, 0 if either part is constant
	 */
	protected static double correlationCoefficient( final double ab, final double aa, final double bb, final double sumA, final double sumB, final double n )
	{
		if ( n <= 0 )
			return 0;

		final double varA = aa - sumA * sumA / n;
		final double varB = bb - sumB * sumB / n;

		if ( varA <= 0 || varB <= 0 )
			return 0;

		return ( ab - sumA * sumB / n ) / Math.sqrt( varA * varB );
	}

	/**
	 * @return the number of pixels two h x w regions share when shifted by ( ty, tx )
	 */
	protected static double overlap( final int h, final int w, final double ty, final double tx )
	{
		return Math.max( 0, h - Math.abs( ty ) ) * Math.max( 0, w - Math.abs( tx ) );
	}

	protected static double[][] square( final double[][] data )
	{
		final double[][] out = new double[ data.length ][ data[ 0 ].length ];

		for ( int y = 0; y < data.length; ++y )
			for ( int x = 0; x < data[ y ].length; ++x )
				out[ y ][ x ] = data[ y ][ x ] * data[ y ][ x ];

		return out;
	}

	protected static double[][] ones( final int h, final int w )
	{
		final double[][] out = new double[ h ][ w ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				out[ y ][ x ] = 1;

		return out;
	}

	@SuppressWarnings( "unchecked" )
	private static Img< ComplexFloatType >[] newArray( final int n )
	{
		return new Img[ n ];
	}
}
