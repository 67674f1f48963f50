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
package net.preibisch.luckyimaging.process.alignmentpoints;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds, removes and looks up alignment points of a built {@link AlignmentPointGrid} between the
 * registration passes. If the neighbors of the grid were resolved, they are resolved again
 * after every change, so every dropped point stays delegated to its nearest active point.
 * <p>
 * Not thread-safe, must not be used while shifts or frame qualities are computed.
 *
 * @author Lucky Imaging Registration developers
 */
public class AlignmentPointManager
{
	private static final Logger LOG = LoggerFactory.getLogger( AlignmentPointManager.class );

	private final AlignmentPointGrid grid;

	public AlignmentPointManager( final AlignmentPointGrid grid )
	{
		this.grid = grid;
	}

	public AlignmentPoint addAlignmentPoint( final int y, final int x )
	{
		final AlignmentPoint point = grid.addAlignmentPoint( y, x );
		updateNeighbors();

		return point;
	}

	public boolean removeAlignmentPoint( final AlignmentPoint point )
	{
		final boolean removed = grid.removeAlignmentPoint( point );

		if ( removed )
			updateNeighbors();
		else
			LOG.debug( "{} is not an active alignment point, nothing removed.", point );

		return removed;
	}

	/**
	 * Removes all active points with a center inside the bounds (inclusive).
	 *
	 * @return the number of removed points
	 */
	public int removeAlignmentPoints( final int yLow, final int yHigh, final int xLow, final int xHigh )
	{
		int count = 0;

		for ( final AlignmentPoint point : grid.findAlignmentPoints( yLow, yHigh, xLow, xHigh ) )
			if ( grid.removeAlignmentPoint( point ) )
				++count;

		if ( count > 0 )
			updateNeighbors();

		return count;
	}

	public AlignmentPoint getAlignmentPoint( final int id )
	{
		return grid.getPointById( id );
	}

	public List< AlignmentPoint > findAlignmentPoints( final int yLow, final int yHigh, final int xLow, final int xHigh )
	{
		return grid.findAlignmentPoints( yLow, yHigh, xLow, xHigh );
	}

	public List< AlignmentPoint > getAlignmentPoints() { return grid.getAlignmentPoints(); }
	public int getNumStandardPoints() { return grid.getNumStandardPoints(); }
	public int getNumUserPoints() { return grid.getAlignmentPoints().size() - grid.getNumStandardPoints(); }
	public AlignmentPointGrid getGrid() { return grid; }

	public void resolveNeighbors()
	{
		grid.resolveNeighbors();
	}

	private void updateNeighbors()
	{
		if ( grid.neighborsResolved() )
			grid.resolveNeighbors();
	}
}
