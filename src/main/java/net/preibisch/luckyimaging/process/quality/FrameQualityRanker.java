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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.view.Views;
import net.preibisch.luckyimaging.Threads;
import net.preibisch.luckyimaging.frames.ContrastMap;
import net.preibisch.luckyimaging.frames.Frame;
import net.preibisch.luckyimaging.frames.ShiftVector;
import net.preibisch.luckyimaging.process.AlignmentParameters;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPoint;
import net.preibisch.luckyimaging.process.globalalignment.IntersectionRegion;
import util.ImgLib2Tools;

/**
 * Ranks all frames for every alignment point by the local contrast of the point's patch and selects
 * the best {@code stackSize} frames the point is stacked from.
 * <p>
 * If every frame carries a {@link ContrastMap} of the same method and down-sampling factor, the qualities
 * are computed from the maps instead of the full-resolution frames.
 *
 * @author Lucky Imaging Registration developers
 */
public class FrameQualityRanker
{
	private static final Logger LOG = LoggerFactory.getLogger( FrameQualityRanker.class );

	private final ContrastMeasure measure;
	private final double stackPercent;

	public FrameQualityRanker( final AlignmentParameters params )
	{
		this( ContrastMeasures.forMethod( params.rankMethod ), params.stackPercent );
	}

	public FrameQualityRanker( final ContrastMeasure measure, final double stackPercent )
	{
		if ( stackPercent <= 0 || stackPercent > 100 )
			throw new IllegalArgumentException( "Stack percentage must be within (0, 100], but is " + stackPercent );

		this.measure = measure;
		this.stackPercent = stackPercent;
	}

	/**
	 * @return {@code max(1, ceil(numFrames * stackPercent / 100))}
	 */
	public static int stackSize( final int numFrames, final double stackPercent )
	{
		return Math.max( 1, (int)Math.ceil( numFrames * stackPercent / 100.0 ) );
	}

	/**
	 * Computes and attaches a contrast map of this ranker's method to every frame.
	 */
	public void computeContrastMaps( final List< Frame > frames, final int downsampling, final ExecutorService service )
	{
		final ArrayList< Callable< ContrastMap > > tasks = new ArrayList<>();

		for ( final Frame frame : frames )
			tasks.add( () -> measure.contrastMap( frame.getMono(), downsampling ) );

		final List< ContrastMap > maps = Threads.execTasks( tasks, service, "compute contrast maps" );

		for ( int i = 0; i < frames.size(); ++i )
			frames.get( i ).setContrastMap( maps.get( i ) );
	}

	/**
	 * Ranks the frames for every point, publishes the frame qualities and best frame indices on the points.
	 *
	 * @param frames - the globally aligned frames
	 * @param points - the active alignment points
	 * @param intersection - of the global alignment
	 * @param service - points are ranked in parallel
	 * @return stack size and, per frame, the indices of the points that use it
	 */
	public FrameQualityRanking computeFrameQualities(
			final List< Frame > frames,
			final List< AlignmentPoint > points,
			final IntersectionRegion intersection,
			final ExecutorService service )
	{
		if ( intersection == null )
			throw new IllegalStateException( "Frame qualities are computed before the frames were aligned, call alignFrames() first." );

		for ( final Frame frame : frames )
			if ( !frame.hasGlobalShift() )
				throw new IllegalStateException( "Frame qualities are computed before " + frame + " was globally aligned, call alignFrames() first." );

		final int stackSize = stackSize( frames.size(), stackPercent );
		final int numSelected = Math.min( stackSize, frames.size() );
		final boolean useMaps = haveConsistentContrastMaps( frames );

		LOG.info( "Ranking {} frames for {} alignment points by {} ({}), stack size {}",
				frames.size(), points.size(), measure.getRankMethod(), useMaps ? "contrast maps" : "full resolution", stackSize );

		final ArrayList< Callable< int[] > > tasks = new ArrayList<>();

		for ( final AlignmentPoint point : points )
			tasks.add( () ->
			{
				final double[] qualities = new double[ frames.size() ];

				for ( int f = 0; f < frames.size(); ++f )
					qualities[ f ] = quality( frames.get( f ), point, intersection, useMaps );

				final int[] sorted = FrameRanking.sortDescending( qualities );
				final int[] best = new int[ numSelected ];
				System.arraycopy( sorted, 0, best, 0, numSelected );

				point.setFrameQualities( qualities );
				point.setBestFrameIndices( best );

				return best;
			});

		final List< int[] > bestFrames = Threads.execTasks( tasks, service, "rank frames per alignment point" );

		final ArrayList< List< Integer > > pointsPerFrame = new ArrayList<>();

		for ( int f = 0; f < frames.size(); ++f )
			pointsPerFrame.add( new ArrayList<>() );

		for ( int p = 0; p < bestFrames.size(); ++p )
			for ( final int f : bestFrames.get( p ) )
				pointsPerFrame.get( f ).add( p );

		for ( int f = 0; f < frames.size(); ++f )
			pointsPerFrame.set( f, Collections.unmodifiableList( pointsPerFrame.get( f ) ) );

		return new FrameQualityRanking( stackSize, Collections.unmodifiableList( pointsPerFrame ) );
	}

	/**
	 * The quality of the point's patch, shifted by the frame's global shift and clipped to the frame.
	 */
	protected double quality( final Frame frame, final AlignmentPoint point, final IntersectionRegion intersection, final boolean useMap )
	{
		final ShiftVector shift = frame.getGlobalShift();
		final int dy = intersection.getYLow() - shift.getRoundedDy();
		final int dx = intersection.getXLow() - shift.getRoundedDx();

		final int yLow = Math.max( 0, point.getPatchYLow() + dy );
		final int yHigh = Math.min( frame.getHeight(), point.getPatchYHigh() + dy );
		final int xLow = Math.max( 0, point.getPatchXLow() + dx );
		final int xHigh = Math.min( frame.getWidth(), point.getPatchXHigh() + dx );

		if ( yHigh <= yLow || xHigh <= xLow )
			return 0;

		if ( useMap )
		{
			final ContrastMap contrastMap = frame.getContrastMap();
			final int f = contrastMap.getDownsampling();

			final int mapYHigh = Math.min( contrastMap.getHeight(), ( yHigh + f - 1 ) / f );
			final int mapXHigh = Math.min( contrastMap.getWidth(), ( xHigh + f - 1 ) / f );

			return measure.measureFromMap( contrastMap, ImgLib2Tools.interval2d( yLow / f, mapYHigh, xLow / f, mapXHigh ) );
		}

		return measure.measure( Views.extendBorder( frame.getMono() ), ImgLib2Tools.interval2d( yLow, yHigh, xLow, xHigh ) );
	}

	/**
	 * @return true if all frames have a contrast map of this ranker's method with the same down-sampling factor
	 */
	protected boolean haveConsistentContrastMaps( final List< Frame > frames )
	{
		int downsampling = -1;

		for ( final Frame frame : frames )
		{
			final ContrastMap map = frame.getContrastMap();

			if ( map == null || map.getRankMethod() != measure.getRankMethod() )
				return false;

			if ( downsampling < 0 )
				downsampling = map.getDownsampling();
			else if ( downsampling != map.getDownsampling() )
				return false;
		}

		return !frames.isEmpty();
	}

	public ContrastMeasure getMeasure() { return measure; }
	public double getStackPercent() { return stackPercent; }
}
