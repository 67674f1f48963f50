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

import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Computes the local shift of an alignment box. The shift is positive if the content in the frame
 * sits at lower pixel coordinates than in the reference box.
 */
public interface LocalShiftMethod
{
	/**
	 * @param referenceBox - the reference pixels of the box, zero-min
	 * @param frame - the whole (monochrome) frame
	 * @param box - where the box is in the frame after compensating the global shift, always in bounds
	 * @return the local shift
	 */
	LocalShift computeShift( RandomAccessibleInterval< FloatType > referenceBox, RandomAccessibleInterval< FloatType > frame, Interval box );
}
