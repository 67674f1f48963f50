package net.preibisch.luckyimaging;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.luckyimaging.frames.Frame;

/**
 * Deterministic test images: blurred random textures and crops of them.
 */
public class SyntheticFrames
{
	/**
	 * Random texture, box-blurred {@code passes} times with the given radius and stretched to [20, 230].
	 *
	 * @return [y][x]
	 */
	public static float[][] texture( final int h, final int w, final long seed, final int radius, final int passes )
	{
		final Random rnd = new Random( seed );
		float[][] t = new float[ h ][ w ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				t[ y ][ x ] = rnd.nextFloat();

		for ( int p = 0; p < passes; ++p )
			t = boxBlur( t, radius );

		float min = Float.MAX_VALUE, max = -Float.MAX_VALUE;

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
			{
				min = Math.min( min, t[ y ][ x ] );
				max = Math.max( max, t[ y ][ x ] );
			}

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				t[ y ][ x ] = 20 + 210 * ( t[ y ][ x ] - min ) / ( max - min );

		return t;
	}

	private static float[][] boxBlur( final float[][] in, final int radius )
	{
		final int h = in.length;
		final int w = in[ 0 ].length;

		final float[][] tmp = new float[ h ][ w ];
		final float[][] out = new float[ h ][ w ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
			{
				float sum = 0;

				for ( int d = -radius; d <= radius; ++d )
					sum += in[ y ][ Math.min( w - 1, Math.max( 0, x + d ) ) ];

				tmp[ y ][ x ] = sum / ( 2 * radius + 1 );
			}

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
			{
				float sum = 0;

				for ( int d = -radius; d <= radius; ++d )
					sum += tmp[ Math.min( h - 1, Math.max( 0, y + d ) ) ][ x ];

				out[ y ][ x ] = sum / ( 2 * radius + 1 );
			}

		return out;
	}

	/**
	 * @return the image {@code img(y, x) = base[ y + yOffset ][ x + xOffset ]} of size w x h
	 */
	public static Img< FloatType > crop( final float[][] base, final int yOffset, final int xOffset, final int h, final int w )
	{
		final float[] pixels = new float[ w * h ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				pixels[ y * w + x ] = base[ y + yOffset ][ x + xOffset ];

		return ArrayImgs.floats( pixels, w, h );
	}

	public static Img< FloatType > toImg( final float[][] data )
	{
		return crop( data, 0, 0, data.length, data[ 0 ].length );
	}

	/**
	 * Frame i is {@code frame(y, x) = base[ y + dy_i + pad ][ x + dx_i + pad ]}, i.e. its content is
	 * the reference content ({@code dy = dx = 0}) moved by {@code -d}, so its shift is {@code +d}.
	 *
	 * @param shifts - { dy, dx } per frame, |d| &lt;= pad
	 */
	public static List< Frame > shiftedFrames( final float[][] base, final int pad, final int h, final int w, final int[][] shifts )
	{
		final ArrayList< Frame > frames = new ArrayList<>();

		for ( int i = 0; i < shifts.length; ++i )
			frames.add( new Frame( i, crop( base, pad + shifts[ i ][ 0 ], pad + shifts[ i ][ 1 ], h, w ) ) );

		return frames;
	}

	/**
	 * Checkerboard of 4x4 squares alternating between 100 and 200.
	 */
	public static float[][] checkerboard( final int h, final int w )
	{
		final float[][] data = new float[ h ][ w ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
				data[ y ][ x ] = ( ( x / 4 + y / 4 ) % 2 == 0 ) ? 100 : 200;

		return data;
	}
}
