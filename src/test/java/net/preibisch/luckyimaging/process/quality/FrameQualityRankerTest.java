package net.preibisch.luckyimaging.process.quality;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.luckyimaging.SyntheticFrames;
import net.preibisch.luckyimaging.Threads;
import net.preibisch.luckyimaging.frames.Frame;
import net.preibisch.luckyimaging.frames.ShiftVector;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPoint;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPointGrid;
import net.preibisch.luckyimaging.process.globalalignment.IntersectionRegion;

public class FrameQualityRankerTest
{
	private static final int SIZE = 80;

	// contrast factor per frame
	private static final double[] FACTORS = new double[] { 0.7, 1.0, 0.4, 0.85, 0.55 };

	private static final IntersectionRegion FULL_FRAME = new IntersectionRegion( 0, SIZE, 0, SIZE );

	private float[][] base;
	private List< AlignmentPoint > points;
	private ExecutorService service;

	@Before
	public void setUp()
	{
		base = SyntheticFrames.texture( SIZE, SIZE, 3, 1, 2 );

		final Img< FloatType > reference = SyntheticFrames.toImg( base );

		points = new ArrayList<>();

		for ( final int c : new int[] { 20, 40, 60 } )
			points.add( AlignmentPointGrid.newAlignmentPoint( reference, false, c, c, 8, 12, SIZE, SIZE, 3, false, false ) );

		service = Threads.createFixedExecutorService( 2 );
	}

	@After
	public void tearDown()
	{
		service.shutdownNow();
	}

	private List< Frame > frames()
	{
		final ArrayList< Frame > frames = new ArrayList<>();

		for ( int i = 0; i < FACTORS.length; ++i )
		{
			final Img< FloatType > img = SyntheticFrames.toImg( base );

			for ( final FloatType t : img )
				t.set( (float)( t.get() * FACTORS[ i ] ) );

			final Frame frame = new Frame( i, img );
			frame.setGlobalShift( ShiftVector.ZERO );
			frames.add( frame );
		}

		return frames;
	}

	@Test
	public void testRankFramesPerPoint()
	{
		final FrameQualityRanker ranker = new FrameQualityRanker( ContrastMeasures.laplace(), 40 );
		final FrameQualityRanking ranking = ranker.computeFrameQualities( frames(), points, FULL_FRAME, service );

		assertEquals( 2, ranking.getStackSize() );

		for ( final AlignmentPoint point : points )
		{
			assertArrayEquals( new int[] { 1, 3 }, point.getBestFrameIndices() );
			assertEquals( FACTORS.length, point.getFrameQualities().length );
			assertArrayEquals( new int[] { 1, 3, 0, 4, 2 }, FrameRanking.sortDescending( point.getFrameQualities() ) );
		}

		assertEquals( Arrays.asList( 0, 1, 2 ), ranking.getPointsForFrame( 1 ) );
		assertEquals( Arrays.asList( 0, 1, 2 ), ranking.getPointsForFrame( 3 ) );
		assertEquals( Collections.emptyList(), ranking.getPointsForFrame( 0 ) );
		assertEquals( Collections.emptyList(), ranking.getPointsForFrame( 2 ) );
		assertEquals( Collections.emptyList(), ranking.getPointsForFrame( 4 ) );
	}

	@Test
	public void testContrastMapsGiveSameRanking()
	{
		for ( final int downsampling : new int[] { 1, 2 } )
		{
			final List< Frame > frames = frames();
			final FrameQualityRanker ranker = new FrameQualityRanker( ContrastMeasures.gradient(), 40 );

			ranker.computeContrastMaps( frames, downsampling, service );

			assertTrue( ranker.haveConsistentContrastMaps( frames ) );

			ranker.computeFrameQualities( frames, points, FULL_FRAME, service );

			for ( final AlignmentPoint point : points )
				assertArrayEquals( "down-sampling " + downsampling, new int[] { 1, 3 }, point.getBestFrameIndices() );
		}
	}

	@Test
	public void testContrastMapsWithoutDownsamplingMatchFullResolution()
	{
		final FrameQualityRanker ranker = new FrameQualityRanker( ContrastMeasures.sobel(), 40 );

		final List< Frame > frames = frames();
		ranker.computeFrameQualities( frames, points, FULL_FRAME, service );
		final double[] fullResolution = points.get( 1 ).getFrameQualities().clone();

		ranker.computeContrastMaps( frames, 1, service );
		ranker.computeFrameQualities( frames, points, FULL_FRAME, service );

		assertArrayEquals( fullResolution, points.get( 1 ).getFrameQualities(), 1e-3 );
	}

	@Test
	public void testInconsistentContrastMapsAreIgnored()
	{
		final FrameQualityRanker ranker = new FrameQualityRanker( ContrastMeasures.gradient(), 40 );
		final List< Frame > frames = frames();

		ranker.computeContrastMaps( frames, 2, service );
		frames.get( 0 ).setContrastMap( ContrastMeasures.gradient().contrastMap( frames.get( 0 ).getMono(), 4 ) );

		assertFalse( ranker.haveConsistentContrastMaps( frames ) );

		ranker.computeContrastMaps( frames, 2, service );
		frames.get( 0 ).setContrastMap( ContrastMeasures.laplace().contrastMap( frames.get( 0 ).getMono(), 2 ) );

		assertFalse( ranker.haveConsistentContrastMaps( frames ) );

		ranker.computeFrameQualities( frames, points, FULL_FRAME, service );

		for ( final AlignmentPoint point : points )
			assertArrayEquals( new int[] { 1, 3 }, point.getBestFrameIndices() );
	}

	@Test
	public void testAllFramesSelected()
	{
		final FrameQualityRanking ranking = new FrameQualityRanker( ContrastMeasures.gradient(), 100 ).computeFrameQualities( frames(), points, FULL_FRAME, service );

		assertEquals( 5, ranking.getStackSize() );

		for ( int f = 0; f < FACTORS.length; ++f )
			assertEquals( 3, ranking.getPointsForFrame( f ).size() );
	}

	@Test
	public void testStackSize()
	{
		assertEquals( 2, FrameQualityRanker.stackSize( 5, 40 ) );
		assertEquals( 1, FrameQualityRanker.stackSize( 5, 1 ) );
		assertEquals( 11, FrameQualityRanker.stackSize( 101, 10 ) );
		assertEquals( 100, FrameQualityRanker.stackSize( 100, 100 ) );
	}

	@Test( expected = IllegalStateException.class )
	public void testFrameWithoutGlobalShift()
	{
		final List< Frame > frames = frames();
		frames.set( 2, new Frame( 2, SyntheticFrames.toImg( base ) ) );

		new FrameQualityRanker( ContrastMeasures.gradient(), 40 ).computeFrameQualities( frames, points, FULL_FRAME, service );
	}

	@Test( expected = IllegalStateException.class )
	public void testWithoutIntersection()
	{
		new FrameQualityRanker( ContrastMeasures.gradient(), 40 ).computeFrameQualities( frames(), points, null, service );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidStackPercent()
	{
		new FrameQualityRanker( ContrastMeasures.gradient(), 0 );
	}
}
