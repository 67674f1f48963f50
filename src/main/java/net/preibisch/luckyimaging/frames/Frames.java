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

import java.util.ArrayList;
import java.util.List;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Wraps decoded ImageJ stacks as {@link Frame}s, one frame per slice.
 */
public class Frames
{
	private Frames() {}

	public static List< Frame > fromImagePlus( final ImagePlus imp )
	{
		return fromImageStack( imp.getStack() );
	}

	/**
	 * RGB slices become color frames with a luminance monochrome buffer
	 * (ImageJ's weighting of {@link ColorProcessor}), all other types are converted to float.
	 */
	public static List< Frame > fromImageStack( final ImageStack stack )
	{
		final ArrayList< Frame > frames = new ArrayList<>();

		final int w = stack.getWidth();
		final int h = stack.getHeight();

		for ( int i = 0; i < stack.getSize(); ++i )
		{
			final ImageProcessor ip = stack.getProcessor( i + 1 );
			// convertToFloat() returns the processor itself for float stacks
			final float[] pixels = ( (float[])ip.convertToFloat().getPixels() ).clone();
			final Img< FloatType > mono = ArrayImgs.floats( pixels, w, h );

			if ( ip instanceof ColorProcessor )
				frames.add( new Frame( i, mono, color( (ColorProcessor)ip, w, h ) ) );
			else
				frames.add( new Frame( i, mono ) );
		}

		return frames;
	}

	private static Img< FloatType > color( final ColorProcessor cp, final int w, final int h )
	{
		final int n = w * h;
		final float[] pixels = new float[ n * 3 ];
		final int[] rgb = (int[])cp.getPixels();

		for ( int i = 0; i < n; ++i )
		{
			pixels[ i ] = ( rgb[ i ] >> 16 ) & 0xff;
			pixels[ n + i ] = ( rgb[ i ] >> 8 ) & 0xff;
			pixels[ 2 * n + i ] = rgb[ i ] & 0xff;
		}

		return ArrayImgs.floats( pixels, w, h, 3 );
	}
}
