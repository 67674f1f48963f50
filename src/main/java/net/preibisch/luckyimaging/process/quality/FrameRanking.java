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

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.luckyimaging.frames.Frame;

/**
 * Whole-frame quality of all frames: the scores, the frame indices sorted by descending quality
 * and the index of the best frame (the reference for the global alignment).
 */
public class FrameRanking
{
	private static final Logger LOG = LoggerFactory.getLogger( FrameRanking.class );

	private final double[] scores;
	private final int[] qualitySortedIndices;

	public FrameRanking( final double[] scores )
	{
		if ( scores.length == 0 )
			throw new IllegalArgumentException( "Cannot rank an empty list of frames." );

		this.scores = scores;
		this.qualitySortedIndices = sortDescending( scores );
	}

	public static FrameRanking rankFrames( final List< Frame > frames, final QualityMeasure measure )
	{
		final double[] scores = new double[ frames.size() ];

		for ( int i = 0; i < frames.size(); ++i )
			scores[ i ] = measure.measure( frames.get( i ).getMono() );

		final FrameRanking ranking = new FrameRanking( scores );

		LOG.info( "Ranked {} frames, best frame: {}", frames.size(), ranking.getMaxIndex() );
		LOG.debug( "Frame scores: {}", Arrays.toString( scores ) );

		return ranking;
	}

	/**
	 * @return indices of the values sorted by descending value, equal values keep their order
	 */
	public static int[] sortDescending( final double[] values )
	{
		final Integer[] indices = new Integer[ values.length ];

		for ( int i = 0; i < indices.length; ++i )
			indices[ i ] = i;

		// Arrays.sort on objects is stable
		Arrays.sort( indices, ( a, b ) -> Double.compare( values[ b ], values[ a ] ) );

		final int[] sorted = new int[ indices.length ];

		for ( int i = 0; i < sorted.length; ++i )
			sorted[ i ] = indices[ i ];

		return sorted;
	}

	public double[] getScores() { return scores; }
	public int[] getQualitySortedIndices() { return qualitySortedIndices; }
	public int getMaxIndex() { return qualitySortedIndices[ 0 ]; }
}
