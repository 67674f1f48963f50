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
package net.preibisch.luckyimaging.process.localshift;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.preibisch.luckyimaging.Threads;
import net.preibisch.luckyimaging.frames.Frame;
import net.preibisch.luckyimaging.frames.ShiftVector;
import net.preibisch.luckyimaging.process.AlignmentParameters;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPoint;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPointGrid;
import net.preibisch.luckyimaging.process.globalalignment.IntersectionRegion;
import net.preibisch.luckyimaging.process.translation.PhaseCorrelation;
import net.preibisch.luckyimaging.process.translation.SubpixelRegistration;
import util.ImgLib2Tools;

/**
 * Computes the local (de-warping) shift of alignment points in frames, on top of the global shift
 * of each frame. The method is resolved once when the estimator is created.
 *
 * @author Lucky Imaging Registration developers
 */
public class LocalShiftEstimator
{
	private static final Logger LOG = LoggerFactory.getLogger( LocalShiftEstimator.class );

	private final ShiftMethod method;
	private final LocalShiftMethod shiftMethod;
	private final IntersectionRegion intersection;

	public LocalShiftEstimator( final AlignmentParameters params, final IntersectionRegion intersection )
	{
		this( params.alignmentMethod, params.searchWidth, params.subpixelUpsampleFactor, params.radialSearchSubpixel, intersection );
	}

	public LocalShiftEstimator(
			final ShiftMethod method,
			final int searchWidth,
			final int subpixelUpsampleFactor,
			final boolean radialSearchSubpixel,
			final IntersectionRegion intersection )
	{
		this( method, createShiftMethod( method, searchWidth, subpixelUpsampleFactor, radialSearchSubpixel ), intersection );
	}

	/**
	 * @param method - which method {@code shiftMethod} implements, for logging
	 * @param shiftMethod - the method
	 * @param intersection - of the globally aligned frames, the alignment point coordinates are relative to it
	 */
	public LocalShiftEstimator( final ShiftMethod method, final LocalShiftMethod shiftMethod, final IntersectionRegion intersection )
	{
		if ( intersection == null )
			throw new IllegalStateException( "Local shifts need the intersection of the globally aligned frames, align the frames first." );

		this.method = method;
		this.shiftMethod = shiftMethod;
		this.intersection = intersection;
	}

	public static LocalShiftMethod createShiftMethod(
			final ShiftMethod method,
			final int searchWidth,
			final int subpixelUpsampleFactor,
			final boolean radialSearchSubpixel )
	{
		switch ( method )
		{
			case SUBPIXEL:
				return new CorrelationShift( new SubpixelRegistration( subpixelUpsampleFactor ) );
			case CROSS_CORRELATION:
				return new CorrelationShift( new PhaseCorrelation() );
			case RADIAL_SEARCH:
				return new RadialSearch( searchWidth, radialSearchSubpixel );
			case STEEPEST_DESCENT:
				return new SteepestDescent( searchWidth );
			default:
				throw new IllegalArgumentException( "The point shift computation method " + method + " is not implemented." );
		}
	}

	/**
	 * @param frame - a globally aligned frame
	 * @param point - the alignment point
	 * @param deWarp - if false, only the global shift is applied and the local shift is zero
	 * @return the local shift
	 * @throws IllegalStateException if the frame has no global shift yet
	 */
	public LocalShift computeShift( final Frame frame, final AlignmentPoint point, final boolean deWarp )
	{
		final ShiftVector globalShift = frame.getGlobalShift();

		if ( !deWarp )
			return LocalShift.NONE;

		final int dy = intersection.getYLow() - globalShift.getRoundedDy();
		final int dx = intersection.getXLow() - globalShift.getRoundedDx();

		final FinalInterval box = ImgLib2Tools.interval2d(
				point.getBoxYLow() + dy, point.getBoxYHigh() + dy,
				point.getBoxXLow() + dx, point.getBoxXHigh() + dx );

		final LocalShift shift = shiftMethod.computeShift( point.getReferenceBox(), frame.getMono(), box );

		if ( LOG.isTraceEnabled() )
			LOG.trace( "Frame {}, {}: {}", frame.getIndex(), point, shift );

		return shift;
	}

	/**
	 * Computes the shifts of all active points of a built grid in all frames.
	 *
	 * @throws IllegalStateException if the grid was not built yet
	 */
	public LocalShift[][] computeShifts( final List< Frame > frames, final AlignmentPointGrid grid, final boolean deWarp, final ExecutorService service )
	{
		if ( !grid.isBuilt() )
			throw new IllegalStateException( "Local shifts are computed before the alignment point grid was built, call buildGrid() first." );

		return computeShifts( frames, grid.getAlignmentPoints(), deWarp, service );
	}

	/**
	 * Computes the shifts of all (frame, point) pairs in parallel, one task per frame.
	 *
	 * @return the shifts indexed [frame][point]
	 */
	public LocalShift[][] computeShifts( final List< Frame > frames, final List< AlignmentPoint > points, final boolean deWarp, final ExecutorService service )
	{
		for ( final Frame frame : frames )
			if ( !frame.hasGlobalShift() )
				throw new IllegalStateException( "Local shifts are computed before " + frame + " was globally aligned, call alignFrames() first." );

		final ArrayList< Callable< LocalShift[] > > tasks = new ArrayList<>();

		for ( final Frame frame : frames )
			tasks.add( () ->
			{
				final LocalShift[] shifts = new LocalShift[ points.size() ];

				for ( int p = 0; p < points.size(); ++p )
					shifts[ p ] = computeShift( frame, points.get( p ), deWarp );

				return shifts;
			});

		final List< LocalShift[] > results = Threads.execTasks( tasks, service, "compute local shifts" );

		int numFallbacks = 0;

		for ( final LocalShift[] shifts : results )
			for ( final LocalShift shift : shifts )
				if ( shift.isFallback() )
					++numFallbacks;

		LOG.info( "Computed {} local shifts ({}) for {} points in {} frames, {} without reliable match.",
				deWarp ? "de-warping" : "global-only", method, points.size(), frames.size(), numFallbacks );

		if ( numFallbacks > 0 )
			LOG.warn( "{} of {} local shifts fell back to zero.", numFallbacks, (long)points.size() * frames.size() );

		return results.toArray( new LocalShift[ results.size() ][] );
	}

	public ShiftMethod getMethod() { return method; }
	public IntersectionRegion getIntersection() { return intersection; }
}
