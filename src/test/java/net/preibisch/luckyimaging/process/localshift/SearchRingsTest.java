package net.preibisch.luckyimaging.process.localshift;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;

import org.junit.Test;

public class SearchRingsTest
{
	@Test
	public void testRingZeroIsTheOrigin()
	{
		final int[][] ring = SearchRings.ring( 0 );

		assertEquals( 1, ring.length );
		assertArrayEquals( new int[] { 0, 0 }, ring[ 0 ] );
	}

	@Test
	public void testRingOneIsClockwise()
	{
		final int[][] expected = new int[][] {
			{ -1, -1 }, { -1, 0 }, { -1, 1 }, { 0, 1 }, { 1, 1 }, { 1, 0 }, { 1, -1 }, { 0, -1 } };

		final int[][] ring = SearchRings.ring( 1 );

		assertEquals( expected.length, ring.length );

		for ( int i = 0; i < expected.length; ++i )
			assertArrayEquals( "offset " + i, expected[ i ], ring[ i ] );
	}

	@Test
	public void testRingsCoverChebyshevDistance()
	{
		for ( int r = 1; r <= 6; ++r )
		{
			final int[][] ring = SearchRings.ring( r );
			final HashSet< String > distinct = new HashSet<>();

			assertEquals( 8 * r, ring.length );

			for ( final int[] offset : ring )
			{
				assertEquals( r, Math.max( Math.abs( offset[ 0 ] ), Math.abs( offset[ 1 ] ) ) );
				distinct.add( offset[ 0 ] + "," + offset[ 1 ] );
			}

			assertEquals( 8 * r, distinct.size() );
			assertArrayEquals( new int[] { -r, -r }, ring[ 0 ] );
		}
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNegativeRadius()
	{
		SearchRings.ring( -1 );
	}

	@Test
	public void testRingsAreFreshArrays()
	{
		SearchRings.ring( 2 )[ 0 ][ 0 ] = 100;
		assertTrue( SearchRings.ring( 2 )[ 0 ][ 0 ] == -2 );
	}
}
