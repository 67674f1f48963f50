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

/**
 * The integer offsets of Chebyshev distance r around the origin ("square rings"). Ring 0 is the
 * origin, ring r &gt; 0 has 8r offsets, listed clockwise starting at the top-left corner {@code (-r, -r)}.
 */
public class SearchRings
{
	private SearchRings() {}

	/**
	 * @return the offsets as { dy, dx }
	 */
	public static int[][] ring( final int r )
	{
		if ( r < 0 )
			throw new IllegalArgumentException( "Ring radius must be >= 0, but is " + r );

		if ( r == 0 )
			return new int[][] { { 0, 0 } };

		final int[][] offsets = new int[ 8 * r ][];
		int i = 0;

		// top edge, left to right
		for ( int dx = -r; dx < r; ++dx )
			offsets[ i++ ] = new int[] { -r, dx };

		// right edge, downwards
		for ( int dy = -r; dy < r; ++dy )
			offsets[ i++ ] = new int[] { dy, r };

		// bottom edge, right to left
		for ( int dx = r; dx > -r; --dx )
			offsets[ i++ ] = new int[] { r, dx };

		// left edge, upwards
		for ( int dy = r; dy > -r; --dy )
			offsets[ i++ ] = new int[] { dy, -r };

		return offsets;
	}
}
