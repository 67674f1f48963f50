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

import net.imglib2.Interval;
import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.luckyimaging.frames.ContrastMap;

/**
 * A {@link QualityMeasure} that can also be evaluated on a precomputed, down-sampled
 * per-pixel response ({@link ContrastMap}) of the same method.
 */
public interface ContrastMeasure extends QualityMeasure
{
	RankMethod getRankMethod();

	/**
	 * Measures a region of a larger image, pixels outside the region are used as neighbors.
	 */
	double measure( RandomAccessible< FloatType > source, Interval region );

	/**
	 * Computes the per-pixel response over the whole frame and accumulates it in blocks.
	 */
	ContrastMap contrastMap( RandomAccessibleInterval< FloatType > frame, int downsampling );

	/**
	 * Reduces the blocks of a contrast map within mapRegion (map coordinates) to the scalar
	 * {@link #measure(RandomAccessible, Interval)} returns for the frame pixels these blocks cover.
	 */
	double measureFromMap( ContrastMap map, Interval mapRegion );
}
