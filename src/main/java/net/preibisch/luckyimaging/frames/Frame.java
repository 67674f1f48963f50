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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * One frame of the sequence. The monochrome buffer is used for every measurement,
 * the optional color buffer (x, y, channel) only determines the channel count of
 * the stacking buffers.
 *
 * @author Lucky Imaging Registration developers
 */
public class Frame
{
	private final int index;
	private final RandomAccessibleInterval< FloatType > mono;
	private final RandomAccessibleInterval< FloatType > color;

	private ContrastMap contrastMap = null;
	private ShiftVector globalShift = null;

	public Frame( final int index, final RandomAccessibleInterval< FloatType > mono )
	{
		this( index, mono, null );
	}

	public Frame( final int index, final RandomAccessibleInterval< FloatType > mono, final RandomAccessibleInterval< FloatType > color )
	{
		if ( mono.numDimensions() != 2 )
			throw new IllegalArgumentException( "Monochrome frame must be 2d, but has " + mono.numDimensions() + " dimensions." );

		if ( color != null && ( color.numDimensions() != 3 || color.dimension( 2 ) != 3 ) )
			throw new IllegalArgumentException( "Color frame must be (x, y, 3)." );

		this.index = index;
		this.mono = Views.zeroMin( mono );
		this.color = color == null ? null : Views.zeroMin( color );
	}

	public int getIndex() { return index; }
	public RandomAccessibleInterval< FloatType > getMono() { return mono; }
	public RandomAccessibleInterval< FloatType > getColor() { return color; }
	public boolean isColor() { return color != null; }

	public int getWidth() { return (int)mono.dimension( 0 ); }
	public int getHeight() { return (int)mono.dimension( 1 ); }

	public ContrastMap getContrastMap() { return contrastMap; }
	public void setContrastMap( final ContrastMap contrastMap ) { this.contrastMap = contrastMap; }

	public boolean hasGlobalShift() { return globalShift != null; }

	/**
	 * @return the global shift computed by the global alignment
	 * @throws IllegalStateException if the global alignment did not run yet
	 */
	public ShiftVector getGlobalShift()
	{
		if ( globalShift == null )
			throw new IllegalStateException( "Global shift of frame " + index + " requested before the frames were aligned." );

		return globalShift;
	}

	/**
	 * The global shift is published once. Publishing the identical value again is allowed,
	 * changing it afterwards is not.
	 */
	public void setGlobalShift( final ShiftVector shift )
	{
		if ( globalShift != null && !globalShift.equals( shift ) )
			throw new IllegalStateException( "Global shift of frame " + index + " is already set to " + globalShift + ", cannot change it to " + shift );

		this.globalShift = shift;
	}

	@Override
	public String toString()
	{
		return "Frame " + index + " (" + getWidth() + "x" + getHeight() + ( isColor() ? ", color" : "" ) + ")";
	}
}
