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
package net.preibisch.luckyimaging.process.translation;

import net.preibisch.luckyimaging.frames.ShiftVector;

/**
 * The result of a {@link TranslationEstimator}: the shift and, if the estimator computes them,
 * the normalized RMS error and the global phase difference (NaN otherwise).
 */
public class TranslationResult
{
	private final ShiftVector shift;
	private final double error, phaseDifference;

	public TranslationResult( final ShiftVector shift )
	{
		this( shift, Double.NaN, Double.NaN );
	}

	public TranslationResult( final ShiftVector shift, final double error, final double phaseDifference )
	{
		this.shift = shift;
		this.error = error;
		this.phaseDifference = phaseDifference;
	}

	public ShiftVector getShift() { return shift; }
	public double getError() { return error; }
	public double getPhaseDifference() { return phaseDifference; }

	@Override
	public String toString()
	{
		return shift + ( Double.isNaN( error ) ? "" : ", error=" + error + ", phase difference=" + phaseDifference );
	}
}
