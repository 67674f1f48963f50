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

/**
 * A displacement {@code (dy, dx)} in pixels.
 * <p>
 * A positive component means that the content observed in a frame sits at lower pixel
 * coordinates than in the reference and has to be translated in the positive direction
 * to be aligned.
 */
public final class ShiftVector
{
	public static final ShiftVector ZERO = new ShiftVector( 0, 0 );

	private final double dy, dx;

	public ShiftVector( final double dy, final double dx )
	{
		// + 0.0 turns -0.0 into 0.0
		this.dy = dy + 0.0;
		this.dx = dx + 0.0;
	}

	public double getDy() { return dy; }
	public double getDx() { return dx; }

	public int getRoundedDy() { return (int)Math.round( dy ); }
	public int getRoundedDx() { return (int)Math.round( dx ); }

	public ShiftVector negate() { return new ShiftVector( -dy, -dx ); }

	public boolean isZero() { return dy == 0 && dx == 0; }

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;

		if ( !( o instanceof ShiftVector ) )
			return false;

		final ShiftVector s = (ShiftVector)o;

		return Double.compare( dy, s.dy ) == 0 && Double.compare( dx, s.dx ) == 0;
	}

	@Override
	public int hashCode()
	{
		return 31 * Double.hashCode( dy ) + Double.hashCode( dx );
	}

	@Override
	public String toString()
	{
		return "(dy=" + dy + ", dx=" + dx + ")";
	}
}
