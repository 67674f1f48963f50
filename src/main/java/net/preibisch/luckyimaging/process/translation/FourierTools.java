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

import java.util.concurrent.ExecutorService;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.RandomAccess;
import net.imglib2.algorithm.fft2.FFTConvolution;
import net.imglib2.algorithm.fft2.FFTMethods;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexFloatType;
import net.imglib2.util.Intervals;
import net.preibisch.luckyimaging.Threads;

/**
 * Fourier helpers for the translation estimators. Regions are row-major {@code [y][x]} arrays,
 * transforms are complex {@link Img}s (axis 0 = x) computed by {@link FFTMethods}. Regions are
 * zero-padded to at least {@code 2n - 1} per axis, so correlations are linear and do not wrap.
 * The forward transform is unscaled, the inverse transform is scaled by {@code 1/n}.
 */
public class FourierTools
{
	public static ExecutorService service = FFTConvolution.createExecutorService( Threads.numThreads() );

	private FourierTools() {}

	/**
	 * @return the fast FFT size { x, y } for a linear correlation of two h x w regions
	 */
	public static long[] paddedDimensions( final int h, final int w )
	{
		final long[] paddedDimensions = new long[ 2 ];
		final long[] fftDimensions = new long[ 2 ];

		FFTMethods.dimensionsComplexToComplexFast( new FinalInterval( 2L * w - 1, 2L * h - 1 ), paddedDimensions, fftDimensions );

		return fftDimensions;
	}

	/**
	 * Zero-pads a region to fftDimensions and computes its forward transform.
	 */
	public static Img< ComplexFloatType > forward( final double[][] data, final long[] fftDimensions )
	{
		final Img< ComplexFloatType > fft = ArrayImgs.complexFloats( fftDimensions );
		final RandomAccess< ComplexFloatType > ra = fft.randomAccess();

		for ( int y = 0; y < data.length; ++y )
		{
			ra.setPosition( y, 1 );

			for ( int x = 0; x < data[ y ].length; ++x )
			{
				ra.setPosition( x, 0 );
				ra.get().setComplexNumber( data[ y ][ x ], 0.0 );
			}
		}

		transform( fft, true );

		return fft;
	}

	/**
	 * In-place transform along all axes.
	 */
	public static void transform( final Img< ComplexFloatType > data, final boolean forward )
	{
		for ( int d = 0; d < data.numDimensions(); ++d )
			if ( !FFTMethods.complexToComplex( data, d, forward, !forward, service ) )
				throw new IllegalArgumentException(
						"Cannot transform axis " + d + " of size " + data.dimension( d ) + ", not a supported FFT size." );
	}

	/**
	 * @param normalize - scale every coefficient to unit magnitude (phase correlation)
	 * @return a * conj( b ), its inverse peaks at the shift t with b( y ) = a( y + t )
	 */
	public static Img< ComplexFloatType > multiplyConjugate( final Img< ComplexFloatType > a, final Img< ComplexFloatType > b, final boolean normalize )
	{
		final Img< ComplexFloatType > product = ArrayImgs.complexFloats( Intervals.dimensionsAsLongArray( a ) );

		final Cursor< ComplexFloatType > ca = a.cursor();
		final Cursor< ComplexFloatType > cb = b.cursor();
		final Cursor< ComplexFloatType > cp = product.cursor();

		double maxMagnitude = 0;

		while ( cp.hasNext() )
		{
			final ComplexFloatType ta = ca.next();
			final ComplexFloatType tb = cb.next();
			final ComplexFloatType tp = cp.next();

			final double aRe = ta.getRealDouble(), aIm = ta.getImaginaryDouble();
			final double bRe = tb.getRealDouble(), bIm = tb.getImaginaryDouble();

			tp.setComplexNumber( aRe * bRe + aIm * bIm, aIm * bRe - aRe * bIm );

			if ( normalize )
				maxMagnitude = Math.max( maxMagnitude, Math.hypot( tp.getRealDouble(), tp.getImaginaryDouble() ) );
		}

		if ( normalize )
		{
			// float precision, coefficients below are noise
			final double epsilon = maxMagnitude * 1e-6;

			for ( final ComplexFloatType t : product )
			{
				final double magnitude = Math.hypot( t.getRealDouble(), t.getImaginaryDouble() );

				if ( magnitude > epsilon )
					t.setComplexNumber( t.getRealDouble() / magnitude, t.getImaginaryDouble() / magnitude );
				else
					t.setComplexNumber( 0.0, 0.0 );
			}
		}

		return product;
	}

	/**
	 * @return { re, im }, each indexed [y][x]
	 */
	public static double[][][] toArrays( final Img< ComplexFloatType > img )
	{
		final int w = (int)img.dimension( 0 );
		final int h = (int)img.dimension( 1 );

		final double[][] re = new double[ h ][ w ];
		final double[][] im = new double[ h ][ w ];

		final Cursor< ComplexFloatType > c = img.localizingCursor();

		while ( c.hasNext() )
		{
			final ComplexFloatType t = c.next();
			final int x = c.getIntPosition( 0 );
			final int y = c.getIntPosition( 1 );

			re[ y ][ x ] = t.getRealDouble();
			im[ y ][ x ] = t.getImaginaryDouble();
		}

		return new double[][][] { re, im };
	}

	/**
	 * Evaluates the unscaled inverse DFT of a spectrum at arbitrary positions {@code ty x tx},
	 * separable as a matrix product first along x, then along y.
	 *
	 * @return { re, im }, each indexed [i][j] for ( ty[ i ], tx[ j ] )
	 */
	public static double[][][] upsampledInverse( final double[][] pRe, final double[][] pIm, final double[] ty, final double[] tx )
	{
		final int h = pRe.length;
		final int w = pRe[ 0 ].length;
		final int ry = ty.length;
		final int rx = tx.length;

		final double[][] kxRe = new double[ rx ][ w ];
		final double[][] kxIm = new double[ rx ][ w ];

		for ( int j = 0; j < rx; ++j )
			for ( int kx = 0; kx < w; ++kx )
			{
				final double angle = 2 * Math.PI * signedFrequency( kx, w ) * tx[ j ] / w;
				kxRe[ j ][ kx ] = Math.cos( angle );
				kxIm[ j ][ kx ] = Math.sin( angle );
			}

		// tmp[ ky ][ j ] = sum_kx P[ ky ][ kx ] * e^( i angle )
		final double[][] tmpRe = new double[ h ][ rx ];
		final double[][] tmpIm = new double[ h ][ rx ];

		for ( int ky = 0; ky < h; ++ky )
			for ( int j = 0; j < rx; ++j )
			{
				double sumRe = 0, sumIm = 0;

				for ( int kx = 0; kx < w; ++kx )
				{
					sumRe += pRe[ ky ][ kx ] * kxRe[ j ][ kx ] - pIm[ ky ][ kx ] * kxIm[ j ][ kx ];
					sumIm += pRe[ ky ][ kx ] * kxIm[ j ][ kx ] + pIm[ ky ][ kx ] * kxRe[ j ][ kx ];
				}

				tmpRe[ ky ][ j ] = sumRe;
				tmpIm[ ky ][ j ] = sumIm;
			}

		final double[][] re = new double[ ry ][ rx ];
		final double[][] im = new double[ ry ][ rx ];

		final double[] kyRe = new double[ h ];
		final double[] kyIm = new double[ h ];

		for ( int i = 0; i < ry; ++i )
		{
			for ( int ky = 0; ky < h; ++ky )
			{
				final double angle = 2 * Math.PI * signedFrequency( ky, h ) * ty[ i ] / h;
				kyRe[ ky ] = Math.cos( angle );
				kyIm[ ky ] = Math.sin( angle );
			}

			for ( int j = 0; j < rx; ++j )
			{
				double sumRe = 0, sumIm = 0;

				for ( int ky = 0; ky < h; ++ky )
				{
					sumRe += tmpRe[ ky ][ j ] * kyRe[ ky ] - tmpIm[ ky ][ j ] * kyIm[ ky ];
					sumIm += tmpRe[ ky ][ j ] * kyIm[ ky ] + tmpIm[ ky ][ j ] * kyRe[ ky ];
				}

				re[ i ][ j ] = sumRe;
				im[ i ][ j ] = sumIm;
			}
		}

		return new double[][][] { re, im };
	}

	/**
	 * @return the signed frequency of index k of a transform of length n, i.e. k or k - n
	 */
	public static int signedFrequency( final int k, final int n )
	{
		return k < ( n + 1 ) / 2 ? k : k - n;
	}

	/**
	 * @return the signed peak position, positions beyond n/2 wrap to negative values
	 */
	public static int wrap( final int p, final int n )
	{
		return p > n / 2 ? p - n : p;
	}

	/**
	 * Subtracts the mean and returns a copy.
	 */
	public static double[][] zeroMean( final double[][] data )
	{
		final int h = data.length;
		final int w = data[ 0 ].length;

		double sum = 0;

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				sum += data[ y ][ x ];

		final double mean = sum / ( (double)w * h );
		final double[][] out = new double[ h ][ w ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				out[ y ][ x ] = data[ y ][ x ] - mean;

		return out;
	}

	/**
	 * @return a copy multiplied with a separable Hann window
	 */
	public static double[][] hannWindow( final double[][] data )
	{
		final int h = data.length;
		final int w = data[ 0 ].length;

		final double[] wy = hann( h );
		final double[] wx = hann( w );
		final double[][] out = new double[ h ][ w ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				out[ y ][ x ] = data[ y ][ x ] * wy[ y ] * wx[ x ];

		return out;
	}

	protected static double[] hann( final int n )
	{
		final double[] window = new double[ n ];

		if ( n == 1 )
		{
			window[ 0 ] = 1;
			return window;
		}

		for ( int i = 0; i < n; ++i )
			window[ i ] = 0.5 * ( 1 - Math.cos( 2 * Math.PI * i / ( n - 1 ) ) );

		return window;
	}
}
