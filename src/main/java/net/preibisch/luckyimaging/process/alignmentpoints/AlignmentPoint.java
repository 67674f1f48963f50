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
import java.util.List;

import net.imglib2.FinalInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import util.ImgLib2Tools;

/**
 * A local region of the scene that is aligned and stacked independently. All coordinates are
 * relative to the reference (mean) image, i.e. to the intersection region of the aligned frames.
 * <p>
 * The box ({@code [boxYLow, boxYHigh) x [boxXLow, boxXHigh)}) is used to measure the local shift,
 * the patch is the (usually larger) region it contributes to the stacked image. Neighbors whose
 * coverage is delegated to this point are stored as ids of the {@link AlignmentPointGrid} they belong to.
 *
 * @author Lucky Imaging Registration developers
 */
public class AlignmentPoint
{
	// the position in the grid's list of all points ever created, -1 until registered
	private int id = -1;

	private final int y, x;
	private final int halfBoxWidth, halfPatchWidth;

	private final int boxYLow, boxYHigh, boxXLow, boxXHigh;
	private final int patchYLow, patchYHigh, patchXLow, patchXHigh;

	private final Img< FloatType > referenceBox;
	private final double minBrightness, maxBrightness;

	private double structure = Double.NaN;
	private double normalizedStructure = Double.NaN;

	private final List< Integer > dimNeighbors = new ArrayList<>();
	private final List< Integer > structureNeighbors = new ArrayList<>();

	private double[] frameQualities = null;
	private int[] bestFrameIndices = null;

	private final Img< FloatType > stackingBuffer;

	public AlignmentPoint(
			final int y, final int x,
			final int halfBoxWidth, final int halfPatchWidth,
			final int boxYLow, final int boxYHigh, final int boxXLow, final int boxXHigh,
			final int patchYLow, final int patchYHigh, final int patchXLow, final int patchXHigh,
			final Img< FloatType > referenceBox,
			final double minBrightness, final double maxBrightness,
			final Img< FloatType > stackingBuffer )
	{
		this.y = y;
		this.x = x;
		this.halfBoxWidth = halfBoxWidth;
		this.halfPatchWidth = halfPatchWidth;
		this.boxYLow = boxYLow;
		this.boxYHigh = boxYHigh;
		this.boxXLow = boxXLow;
		this.boxXHigh = boxXHigh;
		this.patchYLow = patchYLow;
		this.patchYHigh = patchYHigh;
		this.patchXLow = patchXLow;
		this.patchXHigh = patchXHigh;
		this.referenceBox = referenceBox;
		this.minBrightness = minBrightness;
		this.maxBrightness = maxBrightness;
		this.stackingBuffer = stackingBuffer;
	}

	public int getId() { return id; }
	protected void setId( final int id ) { this.id = id; }

	public int getY() { return y; }
	public int getX() { return x; }
	public int getHalfBoxWidth() { return halfBoxWidth; }
	public int getHalfPatchWidth() { return halfPatchWidth; }

	public int getBoxYLow() { return boxYLow; }
	public int getBoxYHigh() { return boxYHigh; }
	public int getBoxXLow() { return boxXLow; }
	public int getBoxXHigh() { return boxXHigh; }

	public int getPatchYLow() { return patchYLow; }
	public int getPatchYHigh() { return patchYHigh; }
	public int getPatchXLow() { return patchXLow; }
	public int getPatchXHigh() { return patchXHigh; }

	public FinalInterval getBoxInterval() { return ImgLib2Tools.interval2d( boxYLow, boxYHigh, boxXLow, boxXHigh ); }
	public FinalInterval getPatchInterval() { return ImgLib2Tools.interval2d( patchYLow, patchYHigh, patchXLow, patchXHigh ); }

	/**
	 * @return a copy of the reference image pixels inside the box, zero-min
	 */
	public Img< FloatType > getReferenceBox() { return referenceBox; }

	public double getMinBrightness() { return minBrightness; }
	public double getMaxBrightness() { return maxBrightness; }

	public double getStructure() { return structure; }
	public void setStructure( final double structure ) { this.structure = structure; }

	/**
	 * @return the structure relative to the maximum structure of all admitted points, in [0, 1]
	 */
	public double getNormalizedStructure() { return normalizedStructure; }
	public void setNormalizedStructure( final double normalizedStructure ) { this.normalizedStructure = normalizedStructure; }

	/**
	 * @return ids of dropped dim points this point covers
	 */
	public List< Integer > getDimNeighbors() { return dimNeighbors; }

	/**
	 * @return ids of dropped low-structure points this point covers
	 */
	public List< Integer > getStructureNeighbors() { return structureNeighbors; }

	public double[] getFrameQualities() { return frameQualities; }
	public void setFrameQualities( final double[] frameQualities ) { this.frameQualities = frameQualities; }

	public int[] getBestFrameIndices() { return bestFrameIndices; }
	public void setBestFrameIndices( final int[] bestFrameIndices ) { this.bestFrameIndices = bestFrameIndices; }

	/**
	 * @return the zero-initialized buffer of patch size (x, y[, channel]) the stacking accumulates into
	 */
	public Img< FloatType > getStackingBuffer() { return stackingBuffer; }

	@Override
	public String toString()
	{
		return "AP " + id + " (y=" + y + ", x=" + x + ", box y=[" + boxYLow + ", " + boxYHigh + "), x=[" + boxXLow + ", " + boxXHigh + "))";
	}
}
