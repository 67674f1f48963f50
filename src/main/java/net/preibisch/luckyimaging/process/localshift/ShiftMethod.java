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
 * The methods a local de-warping shift can be computed with.
 */
public enum ShiftMethod
{
	SUBPIXEL( "Subpixel" ),
	CROSS_CORRELATION( "CrossCorrelation" ),
	RADIAL_SEARCH( "RadialSearch" ),
	STEEPEST_DESCENT( "SteepestDescent" );

	private final String name;

	private ShiftMethod( final String name )
	{
		this.name = name;
	}

	/**
	 * @param name - one of "Subpixel", "CrossCorrelation", "RadialSearch", "SteepestDescent"
	 * @throws IllegalArgumentException if the name is not supported
	 */
	public static ShiftMethod fromName( final String name )
	{
		for ( final ShiftMethod method : values() )
			if ( method.name.equals( name ) )
				return method;

		throw new IllegalArgumentException( "The point shift computation method '" + name + "' is not implemented." );
	}

	@Override
	public String toString()
	{
		return name;
	}
}
