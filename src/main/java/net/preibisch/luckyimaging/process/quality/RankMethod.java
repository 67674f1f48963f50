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

/**
 * The local contrast measures frames can be ranked with.
 */
public enum RankMethod
{
	GRADIENT( "gradient" ), LAPLACE( "Laplace" ), SOBEL( "Sobel" );

	private final String name;

	private RankMethod( final String name )
	{
		this.name = name;
	}

	/**
	 * @param name - one of "gradient", "Laplace", "Sobel"
	 * @throws IllegalArgumentException if the name is not supported
	 */
	public static RankMethod fromName( final String name )
	{
		for ( final RankMethod method : values() )
			if ( method.name.equals( name ) )
				return method;

		throw new IllegalArgumentException( "The frame ranking method '" + name + "' is not supported." );
	}

	@Override
	public String toString()
	{
		return name;
	}
}
