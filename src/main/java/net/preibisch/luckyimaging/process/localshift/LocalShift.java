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

import net.preibisch.luckyimaging.frames.ShiftVector;

/**
 * The local de-warping shift of one alignment point in one frame.
 * Error and phase difference are NaN unless the method computes them. A fallback
 * result is the zero shift returned when no reliable match was found.
 */
public class LocalShift
{
	public static final LocalShift NONE = new LocalShift( ShiftVector.ZERO );
	public static final LocalShift FALLBACK = new LocalShift( ShiftVector.ZERO, Double.NaN, Double.NaN, true );

	private final ShiftVector shift;
	private final double error, phaseDifference;
	private final boolean fallback;

	public LocalShift( final ShiftVector shift )
	{
		this( shift, Double.NaN, Double.NaN, false );
	}

	public LocalShift( final ShiftVector shift, final double error, final double phaseDifference, final boolean fallback )
	{
		this.shift = shift;
		this.error = error;
		this.phaseDifference = phaseDifference;
		this.fallback = fallback;
	}

	public ShiftVector getShift() { return shift; }
	public double getError() { return error; }
	public double getPhaseDifference() { return phaseDifference; }
	public boolean isFallback() { return fallback; }

	@Override
	public String toString()
	{
		return shift + ( fallback ? " (no reliable match)" : "" ) + ( Double.isNaN( error ) ? "" : ", error=" + error + ", phase difference=" + phaseDifference );
	}
}
