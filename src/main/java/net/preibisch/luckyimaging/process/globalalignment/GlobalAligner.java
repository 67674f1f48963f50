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
package net.preibisch.luckyimaging.process.globalalignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.luckyimaging.frames.Frame;
import net.preibisch.luckyimaging.frames.ShiftVector;
import net.preibisch.luckyimaging.process.quality.QualityMeasure;
import net.preibisch.luckyimaging.process.translation.TranslationEstimator;
import net.preibisch.luckyimaging.process.translation.TranslationResult;
import util.ImgLib2Tools;

/**
 * Rigid alignment of all frames against the reference (best) frame.
 * <p>
 * Usage: {@link #selectAlignmentRectangle(double)}, then {@link #alignFrames()}, then
 * {@link #averageFrame(List, List)} or {@link #averageBestFrames(int[], double)}.
 * Calling them out of order throws an {@link IllegalStateException}.
 *
 * @author Lucky Imaging Registration developers
 */
public class GlobalAligner
{
	private static final Logger LOG = LoggerFactory.getLogger( GlobalAligner.class );

	private final List< Frame > frames;
	private final int referenceIndex;
	private final QualityMeasure qualityMeasure;
	private final TranslationEstimator translationEstimator;

	private final int height, width;

	private AlignmentRectangle alignmentRectangle = null;
	private List< ShiftVector > frameShifts = null;
	private IntersectionRegion intersection = null;
	private Img< FloatType > meanFrame = null;

	/**
	 * @param frames - all frames, identical dimensions
	 * @param referenceIndex - the best frame, all shifts are relative to it
	 * @param qualityMeasure - used to select the alignment rectangle
	 * @param translationEstimator - computes the shift of every frame window relative to the reference window
	 */
	public GlobalAligner(
			final List< Frame > frames,
			final int referenceIndex,
			final QualityMeasure qualityMeasure,
			final TranslationEstimator translationEstimator )
	{
		if ( frames.isEmpty() )
			throw new IllegalArgumentException( "No frames to align." );

		if ( referenceIndex < 0 || referenceIndex >= frames.size() )
			throw new IllegalArgumentException( "Reference frame index " + referenceIndex + " out of range [0, " + frames.size() + ")" );

		this.frames = frames;
		this.referenceIndex = referenceIndex;
		this.qualityMeasure = qualityMeasure;
		this.translationEstimator = translationEstimator;

		this.height = frames.get( 0 ).getHeight();
		this.width = frames.get( 0 ).getWidth();

		for ( final Frame frame : frames )
			if ( frame.getHeight() != height || frame.getWidth() != width )
				throw new IllegalArgumentException( frame + " does not have the dimensions of the first frame (" + width + "x" + height + ")" );
	}

	/**
	 * Tiles the reference frame into rectangles of {@code (height / scaleFactor) x (width / scaleFactor)}
	 * and keeps the one with the highest quality. Tiles are visited row by row, ties keep the first tile.
	 *
	 * @param scaleFactor - &gt;= 1
	 * @return the selected rectangle
	 */
	public AlignmentRectangle selectAlignmentRectangle( final double scaleFactor )
	{
		if ( scaleFactor < 1 )
			throw new IllegalArgumentException( "Alignment rectangle scale factor must be >= 1, but is " + scaleFactor );

		final int rectY = (int)( height / scaleFactor );
		final int rectX = (int)( width / scaleFactor );

		if ( rectY < 1 || rectX < 1 )
			throw new IllegalArgumentException( "Alignment rectangle for scale factor " + scaleFactor + " is empty for frames of " + width + "x" + height );

		final RandomAccessibleInterval< FloatType > reference = frames.get( referenceIndex ).getMono();

		AlignmentRectangle best = null;

		for ( int yLow = 0; yLow <= height - rectY; yLow += rectY )
			for ( int xLow = 0; xLow <= width - rectX; xLow += rectX )
			{
				final double quality = qualityMeasure.measure(
						Views.interval( reference, ImgLib2Tools.interval2d( yLow, yLow + rectY, xLow, xLow + rectX ) ) );

				if ( best == null || quality > best.getQuality() )
					best = new AlignmentRectangle( yLow, yLow + rectY, xLow, xLow + rectX, quality );
			}

		LOG.info( "Selected alignment rectangle {}", best );

		this.alignmentRectangle = best;

		return best;
	}

	/**
	 * Computes the integer global shift of every frame, publishes it on the frames and computes
	 * the intersection region.
	 *
	 * @return the shifts, one per frame
	 */
	public List< ShiftVector > alignFrames()
	{
		if ( alignmentRectangle == null )
			throw new IllegalStateException( "Frames are aligned before the alignment rectangle was selected, call selectAlignmentRectangle() first." );

		final FinalInterval window = alignmentRectangle.toInterval();
		final RandomAccessibleInterval< FloatType > referenceWindow = Views.interval( frames.get( referenceIndex ).getMono(), window );

		final ArrayList< ShiftVector > shifts = new ArrayList<>();

		for ( int i = 0; i < frames.size(); ++i )
		{
			if ( i == referenceIndex )
			{
				shifts.add( ShiftVector.ZERO );
				continue;
			}

			final TranslationResult result = translationEstimator.estimate( referenceWindow, Views.interval( frames.get( i ).getMono(), window ) );
			final ShiftVector shift = new ShiftVector( result.getShift().getRoundedDy(), result.getShift().getRoundedDx() );

			LOG.debug( "Frame {}: global shift {} (estimated {})", i, shift, result );

			shifts.add( shift );
		}

		int yLow = Integer.MIN_VALUE, xLow = Integer.MIN_VALUE;
		int yHigh = Integer.MAX_VALUE, xHigh = Integer.MAX_VALUE;

		for ( final ShiftVector shift : shifts )
		{
			yLow = Math.max( yLow, shift.getRoundedDy() );
			xLow = Math.max( xLow, shift.getRoundedDx() );
			yHigh = Math.min( yHigh, shift.getRoundedDy() + height );
			xHigh = Math.min( xHigh, shift.getRoundedDx() + width );
		}

		final IntersectionRegion intersection = new IntersectionRegion( yLow, yHigh, xLow, xHigh );

		if ( intersection.isEmpty() )
			throw new IllegalStateException( "The frames do not overlap after global alignment, intersection " + intersection + " is empty." );

		for ( int i = 0; i < frames.size(); ++i )
			frames.get( i ).setGlobalShift( shifts.get( i ) );

		this.frameShifts = Collections.unmodifiableList( shifts );
		this.intersection = intersection;

		LOG.info( "Aligned {} frames, intersection {}", frames.size(), intersection );

		return frameShifts;
	}

	/**
	 * Crops every frame to the intersection (offset by its own shift) and averages them pixel-wise.
	 * The result is also kept as the mean frame.
	 */
	public Img< FloatType > averageFrame( final List< Frame > subset, final List< ShiftVector > shifts )
	{
		if ( intersection == null )
			throw new IllegalStateException( "Frames are averaged before they were aligned, call alignFrames() first." );

		if ( subset.isEmpty() || subset.size() != shifts.size() )
			throw new IllegalArgumentException( "Need a non-empty list of frames and one shift per frame, but got " + subset.size() + " frames and " + shifts.size() + " shifts." );

		final int n = intersection.getHeight() * intersection.getWidth();
		final double[] sum = new double[ n ];

		for ( int f = 0; f < subset.size(); ++f )
		{
			final Cursor< FloatType > cursor = Views.flatIterable(
					Views.interval( subset.get( f ).getMono(), intersection.cropInterval( shifts.get( f ) ) ) ).cursor();

			for ( int i = 0; i < n; ++i )
				sum[ i ] += cursor.next().getRealDouble();
		}

		final float[] mean = new float[ n ];

		for ( int i = 0; i < n; ++i )
			mean[ i ] = (float)( sum[ i ] / subset.size() );

		this.meanFrame = ArrayImgs.floats( mean, intersection.getWidth(), intersection.getHeight() );

		return meanFrame;
	}

	/**
	 * Averages the best {@code max(1, ceil(numFrames * percent / 100))} frames.
	 *
	 * @param qualitySortedIndices - frame indices, best first
	 * @param averageFramePercent - percentage of all frames to average
	 */
	public Img< FloatType > averageBestFrames( final int[] qualitySortedIndices, final double averageFramePercent )
	{
		if ( frameShifts == null )
			throw new IllegalStateException( "Frames are averaged before they were aligned, call alignFrames() first." );

		final int numFrames = Math.min( qualitySortedIndices.length, numberOfFramesToAverage( frames.size(), averageFramePercent ) );

		final ArrayList< Frame > subset = new ArrayList<>();
		final ArrayList< ShiftVector > shifts = new ArrayList<>();

		for ( int i = 0; i < numFrames; ++i )
		{
			subset.add( frames.get( qualitySortedIndices[ i ] ) );
			shifts.add( frameShifts.get( qualitySortedIndices[ i ] ) );
		}

		LOG.info( "Averaging the best {} of {} frames.", numFrames, frames.size() );

		return averageFrame( subset, shifts );
	}

	public static int numberOfFramesToAverage( final int numFrames, final double averageFramePercent )
	{
		return Math.max( 1, (int)Math.ceil( numFrames * averageFramePercent / 100.0 ) );
	}

	public List< Frame > getFrames() { return frames; }
	public int getReferenceIndex() { return referenceIndex; }
	public AlignmentRectangle getAlignmentRectangle() { return alignmentRectangle; }

	/**
	 * @return the shifts or null if {@link #alignFrames()} did not run yet
	 */
	public List< ShiftVector > getFrameShifts() { return frameShifts; }

	/**
	 * @return the intersection or null if {@link #alignFrames()} did not run yet
	 */
	public IntersectionRegion getIntersection() { return intersection; }

	/**
	 * @return the last averaged frame or null
	 */
	public Img< FloatType > getMeanFrame() { return meanFrame; }
}
