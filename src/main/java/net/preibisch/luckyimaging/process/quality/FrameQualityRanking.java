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
package net.preibisch.luckyimaging.process.quality;

import java.util.List;

/**
 * The result of ranking the frames per alignment point: the stack size and, for every frame,
 * the indices (into the ranked point list) of the alignment points that use this frame.
 */
public class FrameQualityRanking
{
	private final int stackSize;
	private final List< List< Integer > > pointsPerFrame;

	public FrameQualityRanking( final int stackSize, final List< List< Integer > > pointsPerFrame )
	{
		this.stackSize = stackSize;
		this.pointsPerFrame = pointsPerFrame;
	}

	public int getStackSize() { return stackSize; }
	public List< List< Integer > > getPointsPerFrame() { return pointsPerFrame; }
	public List< Integer > getPointsForFrame( final int frameIndex ) { return pointsPerFrame.get( frameIndex ); }
}
