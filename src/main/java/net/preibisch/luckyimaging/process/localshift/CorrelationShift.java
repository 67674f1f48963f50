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
import net.imglib2.view.Views;
import net.preibisch.luckyimaging.process.translation.TranslationEstimator;
import net.preibisch.luckyimaging.process.translation.TranslationResult;

/**
 * Local shift by a correlation-based {@link TranslationEstimator} between the reference box
 * and the box in the frame.
 */
public class CorrelationShift implements LocalShiftMethod
{
	private final TranslationEstimator estimator;

	public CorrelationShift( final TranslationEstimator estimator )
	{
		this.estimator = estimator;
	}

	@Override
	public LocalShift computeShift( final RandomAccessibleInterval< FloatType > referenceBox, final RandomAccessibleInterval< FloatType > frame, final Interval box )
	{
		final TranslationResult result = estimator.estimate( referenceBox, Views.interval( frame, box ) );

		return new LocalShift( result.getShift(), result.getError(), result.getPhaseDifference(), false );
	}
}
