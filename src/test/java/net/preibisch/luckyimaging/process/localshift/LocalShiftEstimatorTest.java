package net.preibisch.luckyimaging.process.localshift;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
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
import net.preibisch.luckyimaging.process.AlignmentParameters;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPoint;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPointGrid;
import net.preibisch.luckyimaging.process.globalalignment.IntersectionRegion;
import util.ImgLib2Tools;

public class LocalShiftEstimatorTest
{
	private static final int PAD = 10;
	private static final int SIZE = 100;
	private static final int SEARCH_WIDTH = 5;

	private static final int[][] LOCAL_SHIFTS = new int[][] { { 2, -1 }, { -1, 2 }, { 0, 0 }, { 1, 1 }, { -2, -2 } };

	private static final IntersectionRegion FULL_FRAME = new IntersectionRegion( 0, SIZE, 0, SIZE );

	private float[][] base;
	private Img< FloatType > reference;
	private AlignmentPoint point;
	private ExecutorService service;

	@Before
	public void setUp()
	{
		base = SyntheticFrames.texture( SIZE + 2 * PAD, SIZE + 2 * PAD, 7, 2, 2 );
		reference = SyntheticFrames.crop( base, PAD, PAD, SIZE, SIZE );

		// box [34, 66) x [34, 66)
		point = AlignmentPointGrid.newAlignmentPoint( reference, false, 50, 50, 16, 20, SIZE, SIZE, SEARCH_WIDTH, false, false );

		service = Threads.createFixedExecutorService( 2 );
	}

	@After
	public void tearDown()
	{
		service.shutdownNow();
	}

	private List< Frame > frames()
	{
		final List< Frame > frames = SyntheticFrames.shiftedFrames( base, PAD, SIZE, SIZE, LOCAL_SHIFTS );

		for ( final Frame frame : frames )
			frame.setGlobalShift( ShiftVector.ZERO );

		return frames;
	}

	private static LocalShiftEstimator estimator( final ShiftMethod method )
	{
		return new LocalShiftEstimator( method, SEARCH_WIDTH, 10, false, FULL_FRAME );
	}

	private void assertRecoversShifts( final ShiftMethod method, final double tolerance )
	{
		final LocalShiftEstimator estimator = estimator( method );
		final List< Frame > frames = frames();

		for ( int i = 0; i < frames.size(); ++i )
		{
			final LocalShift shift = estimator.computeShift( frames.get( i ), point, true );

			assertFalse( method + ", frame " + i, shift.isFallback() );
			assertEquals( method + ", frame " + i + " dy", LOCAL_SHIFTS[ i ][ 0 ], shift.getShift().getDy(), tolerance );
			assertEquals( method + ", frame " + i + " dx", LOCAL_SHIFTS[ i ][ 1 ], shift.getShift().getDx(), tolerance );
		}
	}

	@Test
	public void testRadialSearch()
	{
		assertRecoversShifts( ShiftMethod.RADIAL_SEARCH, 0 );
	}

	@Test
	public void testRadialSearchSubpixel()
	{
		final LocalShiftEstimator estimator = new LocalShiftEstimator( ShiftMethod.RADIAL_SEARCH, SEARCH_WIDTH, 10, true, FULL_FRAME );
		final List< Frame > frames = frames();

		for ( int i = 0; i < frames.size(); ++i )
		{
			final LocalShift shift = estimator.computeShift( frames.get( i ), point, true );
			assertEquals( LOCAL_SHIFTS[ i ][ 0 ], shift.getShift().getDy(), 0.5 );
			assertEquals( LOCAL_SHIFTS[ i ][ 1 ], shift.getShift().getDx(), 0.5 );
		}
	}

	@Test
	public void testSteepestDescent()
	{
		assertRecoversShifts( ShiftMethod.STEEPEST_DESCENT, 0 );
	}

	@Test
	public void testCrossCorrelation()
	{
		assertRecoversShifts( ShiftMethod.CROSS_CORRELATION, 0 );
	}

	@Test
	public void testSubpixel()
	{
		assertRecoversShifts( ShiftMethod.SUBPIXEL, 0.3 );

		final LocalShift shift = estimator( ShiftMethod.SUBPIXEL ).computeShift( frames().get( 2 ), point, true );
		assertEquals( 0, shift.getError(), 1e-2 );
		assertEquals( 0, shift.getPhaseDifference(), 1e-4 );
	}

	@Test
	public void testIdenticalBoxesGiveZeroShift()
	{
		final Frame frame = new Frame( 0, reference );
		frame.setGlobalShift( ShiftVector.ZERO );

		final LocalShift shift = estimator( ShiftMethod.RADIAL_SEARCH ).computeShift( frame, point, true );

		assertEquals( ShiftVector.ZERO, shift.getShift() );
		assertFalse( shift.isFallback() );
	}

	@Test
	public void testRadialSearchFallsBackIfStillImprovingAtSearchWidth()
	{
		final Frame frame = SyntheticFrames.shiftedFrames( base, PAD, SIZE, SIZE, new int[][] { { 4, 0 } } ).get( 0 );
		frame.setGlobalShift( ShiftVector.ZERO );

		final LocalShift shift = new LocalShiftEstimator( ShiftMethod.RADIAL_SEARCH, 1, 10, false, FULL_FRAME ).computeShift( frame, point, true );

		assertTrue( shift.isFallback() );
		assertEquals( ShiftVector.ZERO, shift.getShift() );
	}

	@Test
	public void testBoxOutsideTheFrameFallsBack()
	{
		// box reaches beyond the right frame border
		final LocalShift shift = new RadialSearch( 2 ).computeShift(
				point.getReferenceBox(), reference, ImgLib2Tools.interval2d( 40, 72, 80, 112 ) );

		assertTrue( shift.isFallback() );
	}

	@Test
	public void testGlobalShiftIsHonored()
	{
		// frame content moved by (3, -2) globally and additionally by (1, 1) locally
		final Frame frame = SyntheticFrames.shiftedFrames( base, PAD, SIZE, SIZE, new int[][] { { 4, -1 } } ).get( 0 );
		frame.setGlobalShift( new ShiftVector( 3, -2 ) );

		// the reference is the intersection [3, 100) x [0, 98) of a frame with zero shift
		final IntersectionRegion intersection = new IntersectionRegion( 3, SIZE, 0, SIZE - 2 );
		final Img< FloatType > mean = SyntheticFrames.crop( base, PAD + 3, PAD, SIZE - 3, SIZE - 2 );
		final AlignmentPoint p = AlignmentPointGrid.newAlignmentPoint( mean, false, 45, 45, 16, 20, SIZE - 3, SIZE - 2, SEARCH_WIDTH, false, false );

		final LocalShift shift = new LocalShiftEstimator( ShiftMethod.RADIAL_SEARCH, SEARCH_WIDTH, 10, false, intersection ).computeShift( frame, p, true );

		assertEquals( new ShiftVector( 1, 1 ), shift.getShift() );
	}

	@Test
	public void testNoDeWarp()
	{
		final LocalShift shift = estimator( ShiftMethod.RADIAL_SEARCH ).computeShift( frames().get( 0 ), point, false );

		assertEquals( ShiftVector.ZERO, shift.getShift() );
		assertFalse( shift.isFallback() );
	}

	@Test
	public void testComputeShiftsInParallel()
	{
		final List< Frame > frames = frames();
		final AlignmentPoint other = AlignmentPointGrid.newAlignmentPoint( reference, false, 30, 60, 12, 16, SIZE, SIZE, SEARCH_WIDTH, false, false );
		final List< AlignmentPoint > points = Arrays.asList( point, other );

		final LocalShiftEstimator estimator = estimator( ShiftMethod.STEEPEST_DESCENT );
		final LocalShift[][] shifts = estimator.computeShifts( frames, points, true, service );

		assertEquals( frames.size(), shifts.length );

		for ( int f = 0; f < frames.size(); ++f )
		{
			assertEquals( points.size(), shifts[ f ].length );

			for ( int p = 0; p < points.size(); ++p )
				assertEquals( estimator.computeShift( frames.get( f ), points.get( p ), true ).getShift(), shifts[ f ][ p ].getShift() );
		}
	}

	@Test( expected = IllegalStateException.class )
	public void testFrameWithoutGlobalShift()
	{
		estimator( ShiftMethod.RADIAL_SEARCH ).computeShift( new Frame( 0, reference ), point, true );
	}

	@Test( expected = IllegalStateException.class )
	public void testComputeShiftsBeforeAlignment()
	{
		estimator( ShiftMethod.RADIAL_SEARCH ).computeShifts( Arrays.asList( new Frame( 0, reference ) ), Arrays.asList( point ), true, service );
	}

	@Test( expected = IllegalStateException.class )
	public void testComputeShiftsBeforeGrid()
	{
		final AlignmentPointGrid grid = new AlignmentPointGrid( new AlignmentParameters(), region -> 1.0, false );
		estimator( ShiftMethod.RADIAL_SEARCH ).computeShifts( frames(), grid, true, service );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testUnsupportedMethod()
	{
		ShiftMethod.fromName( "LocalSearch" );
	}

	@Test
	public void testMethodNames()
	{
		for ( final ShiftMethod method : ShiftMethod.values() )
			assertEquals( method, ShiftMethod.fromName( method.toString() ) );
	}
}
