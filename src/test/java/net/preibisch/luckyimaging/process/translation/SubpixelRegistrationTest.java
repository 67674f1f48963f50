package net.preibisch.luckyimaging.process.translation;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.luckyimaging.SyntheticFrames;

public class SubpixelRegistrationTest
{
	private static Img< FloatType > blob( final int size, final double cy, final double cx, final double sigma )
	{
		final float[] pixels = new float[ size * size ];

		for ( int y = 0; y < size; ++y )
			for ( int x = 0; x < size; ++x )
				pixels[ y * size + x ] = (float)( 200 * Math.exp( -( ( y - cy ) * ( y - cy ) + ( x - cx ) * ( x - cx ) ) / ( 2 * sigma * sigma ) ) );

		return ArrayImgs.floats( pixels, size, size );
	}

	@Test
	public void testSubpixelShift()
	{
		// the frame content sits at the reference position minus the shift
		final Img< FloatType > reference = blob( 32, 16, 16, 4 );
		final Img< FloatType > frame = blob( 32, 16 - 0.4, 16 + 0.3, 4 );

		final TranslationResult result = new SubpixelRegistration( 10 ).estimate( reference, frame );

		assertEquals( 0.4, result.getShift().getDy(), 0.11 );
		assertEquals( -0.3, result.getShift().getDx(), 0.11 );
		assertEquals( 0, result.getError(), 0.2 );
	}

	@Test
	public void testFinerUpsampling()
	{
		final Img< FloatType > reference = blob( 32, 16, 16, 4 );
		final Img< FloatType > frame = blob( 32, 16 - 1.25, 16 + 2.35, 4 );

		final TranslationResult result = new SubpixelRegistration( 20 ).estimate( reference, frame );

		assertEquals( 1.25, result.getShift().getDy(), 0.06 );
		assertEquals( -2.35, result.getShift().getDx(), 0.06 );
	}

	@Test
	public void testNoUpsamplingGivesIntegerShift()
	{
		final float[][] base = SyntheticFrames.texture( 48, 48, 5, 2, 2 );

		final TranslationResult result = new SubpixelRegistration( 1 ).estimate(
				SyntheticFrames.crop( base, 8, 8, 32, 32 ), SyntheticFrames.crop( base, 10, 7, 32, 32 ) );

		assertEquals( 2, result.getShift().getDy(), 0 );
		assertEquals( -1, result.getShift().getDx(), 0 );
	}

	@Test
	public void testIntegerShiftOfBlurredTexture()
	{
		// region borders differ, the correlation must still peak at the exact shift
		final float[][] base = SyntheticFrames.texture( 52, 52, 7, 2, 2 );

		final TranslationResult result = new SubpixelRegistration().estimate(
				SyntheticFrames.crop( base, 10, 10, 32, 32 ), SyntheticFrames.crop( base, 12, 9, 32, 32 ) );

		assertEquals( 2, result.getShift().getDy(), 0.1 );
		assertEquals( -1, result.getShift().getDx(), 0.1 );
		assertEquals( 0, result.getError(), 0.05 );
	}

	@Test
	public void testCorrelationCoefficientFromSums()
	{
		// a = { 1, 2, 3 }, b = { 2, 4, 6 }
		assertEquals( 1, SubpixelRegistration.correlationCoefficient( 28, 14, 56, 6, 12, 3 ), 1e-12 );
		// constant b
		assertEquals( 0, SubpixelRegistration.correlationCoefficient( 12, 14, 12, 6, 6, 3 ), 0 );
		assertEquals( 0, SubpixelRegistration.overlap( 32, 32, 32, 1 ), 0 );
		assertEquals( 30.5 * 31, SubpixelRegistration.overlap( 32, 32, -1.5, 1 ), 1e-12 );
	}

	@Test
	public void testIdenticalRegions()
	{
		final Img< FloatType > reference = blob( 32, 14, 17, 3 );

		final TranslationResult result = new SubpixelRegistration().estimate( reference, reference );

		assertEquals( 0, result.getShift().getDy(), 1e-9 );
		assertEquals( 0, result.getShift().getDx(), 1e-9 );
		assertEquals( 0, result.getError(), 1e-2 );
		assertEquals( 0, result.getPhaseDifference(), 1e-4 );
	}

	@Test
	public void testFlatRegionHasMaximalError()
	{
		final Img< FloatType > flat = ArrayImgs.floats( 16, 16 );

		assertEquals( 1.0, new SubpixelRegistration().estimate( flat, flat ).getError(), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidUpsampleFactor()
	{
		new SubpixelRegistration( 0 );
	}
}
