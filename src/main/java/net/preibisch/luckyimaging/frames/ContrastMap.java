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
package net.preibisch.luckyimaging.frames;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.preibisch.luckyimaging.process.quality.RankMethod;

/**
 * A per-pixel contrast response of a frame, accumulated in blocks of an integer down-sampling factor.
 * Pixel {@code (x, y)} of the map covers frame pixels {@code [x * f, (x+1) * f) x [y * f, (y+1) * f)}
 * and stores the sum, the sum of squares and the number of the responses there, so the mean and
 * variance of any union of blocks are exact.
 */
public class ContrastMap
{
	private final RankMethod rankMethod;
	private final int downsampling;
	private final Img< DoubleType > sums, sumsOfSquares, counts;

	public ContrastMap(
			final RankMethod rankMethod,
			final int downsampling,
			final Img< DoubleType > sums,
			final Img< DoubleType > sumsOfSquares,
			final Img< DoubleType > counts )
	{
		if ( downsampling < 1 )
			throw new IllegalArgumentException( "Down-sampling factor must be >= 1, but is " + downsampling );

		if ( !Intervals.equalDimensions( sums, sumsOfSquares ) || !Intervals.equalDimensions( sums, counts ) )
			throw new IllegalArgumentException(
					"Contrast map layers differ in size: " + Util.printInterval( sums ) + ", " +
					Util.printInterval( sumsOfSquares ) + ", " + Util.printInterval( counts ) );

		this.rankMethod = rankMethod;
		this.downsampling = downsampling;
		this.sums = sums;
		this.sumsOfSquares = sumsOfSquares;
		this.counts = counts;
	}

	public RankMethod getRankMethod() { return rankMethod; }
	public int getDownsampling() { return downsampling; }
	public int getWidth() { return (int)sums.dimension( 0 ); }
	public int getHeight() { return (int)sums.dimension( 1 ); }
	public Img< DoubleType > getSums() { return sums; }
	public Img< DoubleType > getSumsOfSquares() { return sumsOfSquares; }
	public Img< DoubleType > getCounts() { return counts; }
}
