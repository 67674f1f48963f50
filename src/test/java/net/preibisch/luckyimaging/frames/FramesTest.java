package net.preibisch.luckyimaging.frames;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import net.imglib2.RandomAccess;
import net.imglib2.type.numeric.real.FloatType;

public class FramesTest
{
	@Test
	public void testFloatStack()
	{
		final ImageStack stack = new ImageStack( 4, 3 );

		for ( int s = 0; s < 2; ++s )
		{
			final float[] pixels = new float[ 12 ];

			for ( int i = 0; i < pixels.length; ++i )
				pixels[ i ] = 100 * s + i;

			stack.addSlice( "slice " + s, new FloatProcessor( 4, 3, pixels ) );
		}

		final List< Frame > frames = Frames.fromImagePlus( new ImagePlus( "frames", stack ) );

		assertEquals( 2, frames.size() );
		assertEquals( 1, frames.get( 1 ).getIndex() );
		assertEquals( 4, frames.get( 1 ).getWidth() );
		assertEquals( 3, frames.get( 1 ).getHeight() );
		assertFalse( frames.get( 1 ).isColor() );

		// pixel x = 2, y = 1 is index 6
		final RandomAccess< FloatType > ra = frames.get( 1 ).getMono().randomAccess();
		ra.setPosition( new long[] { 2, 1 } );
		assertEquals( 106, ra.get().get(), 0 );
	}

	@Test
	public void testFramesDoNotShareStackPixels()
	{
		final float[] pixels = new float[] { 1, 2, 3, 4 };
		final ImageStack stack = new ImageStack( 2, 2 );
		stack.addSlice( "float", new FloatProcessor( 2, 2, pixels ) );

		final ImagePlus imp = new ImagePlus( "frames", stack );
		final List< Frame > frames = Frames.fromImagePlus( imp );

		imp.getStack().getProcessor( 1 ).setf( 0, 0, 100 );
		pixels[ 3 ] = -1;

		final RandomAccess< FloatType > ra = frames.get( 0 ).getMono().randomAccess();
		ra.setPosition( new long[] { 0, 0 } );
		assertEquals( 1, ra.get().get(), 0 );
		ra.setPosition( new long[] { 1, 1 } );
		assertEquals( 4, ra.get().get(), 0 );
	}

	@Test
	public void testColorStack()
	{
		final ColorProcessor cp = new ColorProcessor( 2, 2 );
		cp.set( 1, 0, ( 255 << 16 ) | ( 20 << 8 ) | 7 );

		final ImageStack stack = new ImageStack( 2, 2 );
		stack.addSlice( "color", cp );

		final List< Frame > frames = Frames.fromImageStack( stack );

		assertEquals( 1, frames.size() );
		assertTrue( frames.get( 0 ).isColor() );
		assertEquals( 3, frames.get( 0 ).getColor().dimension( 2 ) );

		final RandomAccess< FloatType > ra = frames.get( 0 ).getColor().randomAccess();
		ra.setPosition( new long[] { 1, 0, 0 } );
		assertEquals( 255, ra.get().get(), 0 );
		ra.setPosition( 1, 2 );
		assertEquals( 20, ra.get().get(), 0 );
		ra.setPosition( 2, 2 );
		assertEquals( 7, ra.get().get(), 0 );
	}
}
