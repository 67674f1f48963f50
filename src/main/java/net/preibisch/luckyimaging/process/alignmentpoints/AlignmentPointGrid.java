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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.luckyimaging.process.AlignmentParameters;
import net.preibisch.luckyimaging.process.quality.QualityMeasure;
import util.ImgLib2Tools;

/**
 * The staggered grid of alignment points over the reference (mean) image.
 * <p>
 * Every point ever created is stored in an arena (ids are indices into it). Of those, the
 * active list holds the surviving points, the grid-generated "standard" points first followed
 * by user-added points. Candidates that fail the brightness / contrast admission go to the
 * dim-dropped list, admitted points with too little structure to the structure-dropped list.
 * After {@link #resolveNeighbors()} the coverage of every dropped point is delegated to its
 * nearest surviving point.
 *
 * @author Lucky Imaging Registration developers
 */
public class AlignmentPointGrid
{
	private static final Logger LOG = LoggerFactory.getLogger( AlignmentPointGrid.class );

	private final AlignmentParameters params;
	private final QualityMeasure structureMeasure;
	private final boolean isColor;

	private final ArrayList< AlignmentPoint > arena = new ArrayList<>();
	private final ArrayList< AlignmentPoint > alignmentPoints = new ArrayList<>();
	private final ArrayList< AlignmentPoint > dimDroppedPoints = new ArrayList<>();
	private final ArrayList< AlignmentPoint > structureDroppedPoints = new ArrayList<>();

	private int numStandardPoints = 0;
	private double structureMax = 0;
	private boolean neighborsResolved = false;

	private RandomAccessibleInterval< FloatType > referenceImage = null;

	/**
	 * @param params - box / patch sizes, step size, search width and the admission thresholds
	 * @param structureMeasure - the raw structure of a candidate box
	 * @param isColor - if the stacking buffers need three channels
	 */
	public AlignmentPointGrid( final AlignmentParameters params, final QualityMeasure structureMeasure, final boolean isColor )
	{
		this.params = params;
		this.structureMeasure = structureMeasure;
		this.isColor = isColor;
	}

	/**
	 * Candidate centers along one axis. A margin of {@code halfBoxWidth + searchWidth} is kept at both ends,
	 * the interior is split into {@code ceil(interior / stepSize)} intervals. Even rows get one point per
	 * interval boundary, odd rows one point per interval center, so even rows have one point more.
	 *
	 * @param numPixels - length of the axis
	 * @param isEvenRow - which of the two staggered sets
	 * @return the integer locations
	 */
	public static int[] axisLocations( final int numPixels, final int halfBoxWidth, final int searchWidth, final int stepSize, final boolean isEvenRow )
	{
		final int margin = halfBoxWidth + searchWidth;
		final int interior = numPixels - 2 * margin;

		if ( interior <= 0 )
			throw new IllegalArgumentException(
					"Axis of " + numPixels + " pixels is too small for half box width " + halfBoxWidth + " and search width " + searchWidth );

		if ( stepSize < 1 )
			throw new IllegalArgumentException( "Step size must be >= 1, but is " + stepSize );

		final int numOdd = ( interior + stepSize - 1 ) / stepSize;

		final int[] locations;

		if ( isEvenRow )
		{
			locations = new int[ numOdd + 1 ];

			for ( int i = 0; i <= numOdd; ++i )
				locations[ i ] = margin + (int)( (double)i * interior / numOdd );
		}
		else
		{
			locations = new int[ numOdd ];

			for ( int i = 0; i < numOdd; ++i )
				locations[ i ] = margin + (int)( ( 2.0 * i + 1 ) * interior / ( 2.0 * numOdd ) );
		}

		return locations;
	}

	/**
	 * Creates an alignment point. Box bounds are clamped to {@code [0, numPixels - searchWidth]}, patch bounds
	 * to {@code [0, numPixels]}; {@code extendLeft} / {@code extendRight} move the respective patch bound
	 * to the frame edge.
	 *
	 * @throws IllegalArgumentException if box or patch are empty after clamping
	 */
	public static AlignmentPoint newAlignmentPoint(
			final RandomAccessibleInterval< FloatType > referenceImage,
			final boolean isColor,
			final int y, final int x,
			final int halfBoxWidth, final int halfPatchWidth,
			final int numPixelsY, final int numPixelsX,
			final int searchWidth,
			final boolean extendLeft, final boolean extendRight )
	{
		final int boxYLow = Math.max( 0, y - halfBoxWidth );
		final int boxYHigh = Math.min( numPixelsY - searchWidth, y + halfBoxWidth );
		final int boxXLow = Math.max( 0, x - halfBoxWidth );
		final int boxXHigh = Math.min( numPixelsX - searchWidth, x + halfBoxWidth );

		final int patchYLow = Math.max( 0, y - halfPatchWidth );
		final int patchYHigh = Math.min( numPixelsY, y + halfPatchWidth );
		final int patchXLow = extendLeft ? 0 : Math.max( 0, x - halfPatchWidth );
		final int patchXHigh = extendRight ? numPixelsX : Math.min( numPixelsX, x + halfPatchWidth );

		if ( boxYHigh <= boxYLow || boxXHigh <= boxXLow )
			throw new IllegalArgumentException(
					"Alignment box of point (y=" + y + ", x=" + x + ") is empty: y=[" + boxYLow + ", " + boxYHigh + "), x=[" + boxXLow + ", " + boxXHigh + ")" );

		if ( patchYHigh <= patchYLow || patchXHigh <= patchXLow )
			throw new IllegalArgumentException(
					"Patch of point (y=" + y + ", x=" + x + ") is empty: y=[" + patchYLow + ", " + patchYHigh + "), x=[" + patchXLow + ", " + patchXHigh + ")" );

		final Img< FloatType > referenceBox = ImgLib2Tools.copy(
				Views.interval( Views.zeroMin( referenceImage ), ImgLib2Tools.interval2d( boxYLow, boxYHigh, boxXLow, boxXHigh ) ) );

		final double[] minMax = ImgLib2Tools.minMax( referenceBox );

		final Img< FloatType > stackingBuffer;

		if ( isColor )
			stackingBuffer = ArrayImgs.floats( patchXHigh - patchXLow, patchYHigh - patchYLow, 3 );
		else
			stackingBuffer = ArrayImgs.floats( patchXHigh - patchXLow, patchYHigh - patchYLow );

		return new AlignmentPoint(
				y, x, halfBoxWidth, halfPatchWidth,
				boxYLow, boxYHigh, boxXLow, boxXHigh,
				patchYLow, patchYHigh, patchXLow, patchXHigh,
				referenceBox, minMax[ 0 ], minMax[ 1 ], stackingBuffer );
	}

	/**
	 * Builds the staggered grid over the reference image, replacing any previous grid.
	 *
	 * @param referenceImage - the mean frame, coordinates of all points are relative to it
	 * @return the active alignment points
	 */
	public List< AlignmentPoint > buildGrid( final RandomAccessibleInterval< FloatType > referenceImage )
	{
		final RandomAccessibleInterval< FloatType > reference = Views.zeroMin( referenceImage );

		final int numPixelsY = (int)reference.dimension( 1 );
		final int numPixelsX = (int)reference.dimension( 0 );

		final int[] yLocations = axisLocations( numPixelsY, params.halfBoxWidth, params.searchWidth, params.stepSize, true );
		final int[] xLocationsEven = axisLocations( numPixelsX, params.halfBoxWidth, params.searchWidth, params.stepSize, true );
		final int[] xLocationsOdd = axisLocations( numPixelsX, params.halfBoxWidth, params.searchWidth, params.stepSize, false );

		arena.clear();
		alignmentPoints.clear();
		dimDroppedPoints.clear();
		structureDroppedPoints.clear();
		neighborsResolved = false;

		this.referenceImage = reference;

		final ArrayList< AlignmentPoint > admitted = new ArrayList<>();
		int numRecentred = 0;

		for ( int j = 0; j < yLocations.length; ++j )
		{
			final boolean evenRow = j % 2 == 0;
			final int[] xLocations = evenRow ? xLocationsEven : xLocationsOdd;

			for ( int i = 0; i < xLocations.length; ++i )
			{
				final boolean extendLeft = !evenRow && i == 0;
				final boolean extendRight = !evenRow && i == xLocations.length - 1;

				AlignmentPoint point = newAlignmentPoint(
						reference, isColor, yLocations[ j ], xLocations[ i ],
						params.halfBoxWidth, params.halfPatchWidth, numPixelsY, numPixelsX,
						params.searchWidth, extendLeft, extendRight );

				if ( !( point.getMaxBrightness() > params.brightnessThreshold &&
						point.getMaxBrightness() - point.getMinBrightness() > params.contrastThreshold ) )
				{
					LOG.debug( "Candidate (y={}, x={}) is too dim or has too little contrast.", point.getY(), point.getX() );
					register( point );
					dimDroppedPoints.add( point );
					continue;
				}

				if ( dimFraction( point.getReferenceBox(), params.brightnessThreshold ) > params.dimFractionThreshold )
				{
					final AlignmentPoint recentred = recentre( reference, point, numPixelsY, numPixelsX, extendLeft, extendRight );

					if ( recentred != point )
					{
						LOG.debug( "Recentred candidate (y={}, x={}) to (y={}, x={})", point.getY(), point.getX(), recentred.getY(), recentred.getX() );
						point = recentred;
						++numRecentred;
					}
				}

				point.setStructure( structureMeasure.measure( point.getReferenceBox() ) );
				admitted.add( point );
			}
		}

		structureMax = 0;

		for ( final AlignmentPoint point : admitted )
			structureMax = Math.max( structureMax, point.getStructure() );

		// mark, then compact in one order-preserving pass
		final boolean[] lowStructure = new boolean[ admitted.size() ];

		for ( int i = 0; i < admitted.size(); ++i )
		{
			final AlignmentPoint point = admitted.get( i );
			point.setNormalizedStructure( normalize( point.getStructure() ) );
			lowStructure[ i ] = point.getNormalizedStructure() < params.structureThreshold;
		}

		for ( int i = 0; i < admitted.size(); ++i )
		{
			final AlignmentPoint point = admitted.get( i );
			register( point );

			if ( lowStructure[ i ] )
				structureDroppedPoints.add( point );
			else
				alignmentPoints.add( point );
		}

		numStandardPoints = alignmentPoints.size();

		LOG.info( "Created {} alignment points ({} recentred), dropped {} dim and {} low-structure candidates.",
				alignmentPoints.size(), numRecentred, dimDroppedPoints.size(), structureDroppedPoints.size() );

		return getAlignmentPoints();
	}

	/**
	 * Moves the point to the intensity centroid of its box and enlarges box and patch by the
	 * length of the move, so the dark part of the box does not end up empty after de-warping.
	 *
	 * @return the recentred point or the point itself if the centroid is the current center
	 */
	protected AlignmentPoint recentre(
			final RandomAccessibleInterval< FloatType > reference,
			final AlignmentPoint point,
			final int numPixelsY, final int numPixelsX,
			final boolean extendLeft, final boolean extendRight )
	{
		double sum = 0, sumY = 0, sumX = 0;

		final Cursor< FloatType > cursor = Views.flatIterable( point.getReferenceBox() ).localizingCursor();

		while ( cursor.hasNext() )
		{
			final double v = cursor.next().getRealDouble();
			sum += v;
			sumY += v * ( point.getBoxYLow() + cursor.getLongPosition( 1 ) );
			sumX += v * ( point.getBoxXLow() + cursor.getLongPosition( 0 ) );
		}

		if ( sum <= 0 )
			return point;

		final int y = (int)Math.round( sumY / sum );
		final int x = (int)Math.round( sumX / sum );
		final int enlarge = Math.max( Math.abs( y - point.getY() ), Math.abs( x - point.getX() ) );

		if ( enlarge == 0 )
			return point;

		return newAlignmentPoint(
				reference, isColor, y, x,
				point.getHalfBoxWidth() + enlarge, point.getHalfPatchWidth() + enlarge,
				numPixelsY, numPixelsX, params.searchWidth, extendLeft, extendRight );
	}

	/**
	 * @return the fraction of pixels darker than the threshold
	 */
	protected static double dimFraction( final RandomAccessibleInterval< FloatType > box, final double brightnessThreshold )
	{
		long dim = 0, n = 0;

		for ( final FloatType t : Views.flatIterable( box ) )
		{
			if ( t.getRealDouble() < brightnessThreshold )
				++dim;

			++n;
		}

		return n == 0 ? 0 : (double)dim / n;
	}

	/**
	 * If no admitted point has structure, all of them count as fully structured.
	 */
	protected double normalize( final double structure )
	{
		return structureMax > 0 ? Math.min( 1.0, structure / structureMax ) : 1.0;
	}

	/**
	 * Adds a user-defined point after all other points.
	 */
	public AlignmentPoint addAlignmentPoint( final int y, final int x )
	{
		ensureBuilt( "add an alignment point" );

		final AlignmentPoint point = newAlignmentPoint(
				referenceImage, isColor, y, x, params.halfBoxWidth, params.halfPatchWidth,
				(int)referenceImage.dimension( 1 ), (int)referenceImage.dimension( 0 ),
				params.searchWidth, false, false );

		point.setStructure( structureMeasure.measure( point.getReferenceBox() ) );
		point.setNormalizedStructure( normalize( point.getStructure() ) );

		register( point );
		alignmentPoints.add( point );

		LOG.debug( "Added {}", point );

		return point;
	}

	/**
	 * Removes a point (by identity). A standard point is moved to the dim-dropped list so its area stays
	 * covered by a neighbor, a user-added point is deleted.
	 *
	 * @return false if the point is not an active point of this grid
	 */
	public boolean removeAlignmentPoint( final AlignmentPoint point )
	{
		ensureBuilt( "remove an alignment point" );

		int index = -1;

		for ( int i = 0; i < alignmentPoints.size(); ++i )
			if ( alignmentPoints.get( i ) == point )
			{
				index = i;
				break;
			}

		if ( index < 0 )
			return false;

		alignmentPoints.remove( index );

		if ( index < numStandardPoints )
		{
			dimDroppedPoints.add( point );
			--numStandardPoints;
		}

		LOG.debug( "Removed {}", point );

		return true;
	}

	/**
	 * @return all active points whose center lies within the bounds (inclusive)
	 */
	public List< AlignmentPoint > findAlignmentPoints( final int yLow, final int yHigh, final int xLow, final int xHigh )
	{
		ensureBuilt( "find alignment points" );

		final ArrayList< AlignmentPoint > found = new ArrayList<>();

		for ( final AlignmentPoint point : alignmentPoints )
			if ( point.getY() >= yLow && point.getY() <= yHigh && point.getX() >= xLow && point.getX() <= xHigh )
				found.add( point );

		return found;
	}

	/**
	 * Assigns every dropped point to the nearest active point (squared euclidean distance of the
	 * centers, first one wins on ties). All previous assignments are cleared first.
	 */
	public void resolveNeighbors()
	{
		ensureBuilt( "resolve neighbors" );

		for ( final AlignmentPoint point : arena )
		{
			point.getDimNeighbors().clear();
			point.getStructureNeighbors().clear();
		}

		neighborsResolved = true;

		if ( alignmentPoints.isEmpty() )
		{
			if ( !dimDroppedPoints.isEmpty() || !structureDroppedPoints.isEmpty() )
				LOG.warn( "No alignment point survived, cannot delegate {} dropped points.", dimDroppedPoints.size() + structureDroppedPoints.size() );

			return;
		}

		for ( final AlignmentPoint dropped : dimDroppedPoints )
			nearest( dropped ).getDimNeighbors().add( dropped.getId() );

		for ( final AlignmentPoint dropped : structureDroppedPoints )
			nearest( dropped ).getStructureNeighbors().add( dropped.getId() );
	}

	protected AlignmentPoint nearest( final AlignmentPoint point )
	{
		AlignmentPoint best = null;
		long bestDistance = Long.MAX_VALUE;

		for ( final AlignmentPoint candidate : alignmentPoints )
		{
			final long dy = candidate.getY() - point.getY();
			final long dx = candidate.getX() - point.getX();
			final long distance = dy * dy + dx * dx;

			if ( distance < bestDistance )
			{
				bestDistance = distance;
				best = candidate;
			}
		}

		return best;
	}

	private void register( final AlignmentPoint point )
	{
		point.setId( arena.size() );
		arena.add( point );
	}

	private void ensureBuilt( final String action )
	{
		if ( referenceImage == null )
			throw new IllegalStateException( "Cannot " + action + " before the grid was built, call buildGrid() first." );
	}

	/**
	 * @throws IllegalArgumentException if no point with this id was ever created
	 */
	public AlignmentPoint getPointById( final int id )
	{
		if ( id < 0 || id >= arena.size() )
			throw new IllegalArgumentException( "No alignment point with id " + id + " (" + arena.size() + " points created)." );

		return arena.get( id );
	}

	public boolean isBuilt() { return referenceImage != null; }
	public boolean neighborsResolved() { return neighborsResolved; }
	public boolean isColor() { return isColor; }
	public AlignmentParameters getParameters() { return params; }
	public RandomAccessibleInterval< FloatType > getReferenceImage() { return referenceImage; }

	/**
	 * @return the active points, standard points first
	 */
	public List< AlignmentPoint > getAlignmentPoints() { return Collections.unmodifiableList( alignmentPoints ); }
	public List< AlignmentPoint > getDimDroppedPoints() { return Collections.unmodifiableList( dimDroppedPoints ); }
	public List< AlignmentPoint > getStructureDroppedPoints() { return Collections.unmodifiableList( structureDroppedPoints ); }
	public List< AlignmentPoint > getAllPoints() { return Collections.unmodifiableList( arena ); }
	public int getNumStandardPoints() { return numStandardPoints; }
}
