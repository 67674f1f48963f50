package net.preibisch.luckyimaging.frames;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;
import net.imglib2.view.Views;

public class FrameTest
{
	@Test
	public void testGlobalShiftIsSetOnce()
	{
		final Frame frame = new Frame( 3, ArrayImgs.floats( 10, 8 ) );

		assertFalse( frame.hasGlobalShift() );

		frame.setGlobalShift( new ShiftVector( 2, -1 ) );
		frame.setGlobalShift( new ShiftVector( 2, -1 ) );

		assertTrue( frame.hasGlobalShift() );
		assertEquals( new ShiftVector( 2, -1 ), frame.getGlobalShift() );
	}

	@Test( expected = IllegalStateException.class )
	public void testChangingTheGlobalShiftFails()
	{
		final Frame frame = new Frame( 0, ArrayImgs.floats( 10, 8 ) );
		frame.setGlobalShift( new ShiftVector( 2, -1 ) );
		frame.setGlobalShift( new ShiftVector( 1, -1 ) );
	}

	@Test( expected = IllegalStateException.class )
	public void testGlobalShiftBeforeAlignment()
	{
		new Frame( 0, ArrayImgs.floats( 10, 8 ) ).getGlobalShift();
	}

	@Test
	public void testDimensions()
	{
		final Frame frame = new Frame( 1, Views.translate( ArrayImgs.floats( 10, 8 ), 5, 7 ) );

		assertEquals( 10, frame.getWidth() );
		assertEquals( 8, frame.getHeight() );
		assertEquals( 0, frame.getMono().min( 0 ) );
		assertEquals( 0, frame.getMono().min( 1 ) );
		assertFalse( frame.isColor() );
		assertTrue( new Frame( 1, ArrayImgs.floats( 10, 8 ), ArrayImgs.floats( 10, 8, 3 ) ).isColor() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testMonoMustBe2d()
	{
		new Frame( 0, ArrayImgs.floats( 10, 8, 3 ) );
	}

	@Test
	public void testNegativeZeroShiftEqualsZero()
	{
		assertEquals( ShiftVector.ZERO, new ShiftVector( -0.0, -0.0 ) );
		assertEquals( ShiftVector.ZERO, new ShiftVector( 0, 0 ).negate() );
		assertTrue( new ShiftVector( 1.5, -2 ).negate().equals( new ShiftVector( -1.5, 2 ) ) );
		assertEquals( 2, new ShiftVector( 1.5, -2 ).getRoundedDy() );
	}
}
