package net.preibisch.luckyimaging.process.alignmentpoints;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import net.preibisch.luckyimaging.SyntheticFrames;

public class AlignmentPointManagerTest
{
	private AlignmentPointGrid grid;
	private AlignmentPointManager manager;

	@Before
	public void setUp()
	{
		grid = AlignmentPointGridTest.grid( AlignmentPointGridTest.parameters() );
		grid.buildGrid( SyntheticFrames.toImg( AlignmentPointGridTest.rampAndCheckerboard() ) );
		manager = new AlignmentPointManager( grid );
	}

	@Test
	public void testRemovalKeepsNeighborsResolved()
	{
		manager.resolveNeighbors();

		final int numStandard = manager.getNumStandardPoints();
		final AlignmentPoint point = manager.getAlignmentPoints().get( 0 );

		assertTrue( manager.removeAlignmentPoint( point ) );
		assertFalse( manager.removeAlignmentPoint( point ) );
		assertEquals( numStandard - 1, manager.getNumStandardPoints() );
		assertTrue( grid.getDimDroppedPoints().contains( point ) );

		// the removed point is covered by its nearest remaining neighbor
		AlignmentPointGridTest.assertDelegatedToNearest( grid );
		assertTrue( point.getDimNeighbors().isEmpty() );
		assertTrue( point.getStructureNeighbors().isEmpty() );
	}

	@Test
	public void testUserPointsFollowStandardPoints()
	{
		final int numStandard = manager.getNumStandardPoints();

		final AlignmentPoint user = manager.addAlignmentPoint( 150, 150 );
		final AlignmentPoint standard = manager.getAlignmentPoints().get( 1 );

		assertTrue( manager.removeAlignmentPoint( standard ) );

		final List< AlignmentPoint > points = manager.getAlignmentPoints();

		assertEquals( numStandard - 1, manager.getNumStandardPoints() );
		assertEquals( 1, manager.getNumUserPoints() );
		assertSame( user, points.get( points.size() - 1 ) );
		assertSame( user, manager.getAlignmentPoint( user.getId() ) );

		// not resolved yet, nothing delegated
		assertFalse( grid.neighborsResolved() );

		for ( final AlignmentPoint point : points )
			assertTrue( point.getDimNeighbors().isEmpty() );
	}

	@Test
	public void testRemoveInBounds()
	{
		manager.resolveNeighbors();

		final int numActive = manager.getAlignmentPoints().size();
		final int numFound = manager.findAlignmentPoints( 100, 140, 100, 140 ).size();

		assertTrue( numFound > 0 );
		assertEquals( numFound, manager.removeAlignmentPoints( 100, 140, 100, 140 ) );
		assertEquals( numActive - numFound, manager.getAlignmentPoints().size() );
		assertTrue( manager.findAlignmentPoints( 100, 140, 100, 140 ).isEmpty() );

		AlignmentPointGridTest.assertDelegatedToNearest( grid );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testUnknownId()
	{
		manager.getAlignmentPoint( 10000 );
	}
}
