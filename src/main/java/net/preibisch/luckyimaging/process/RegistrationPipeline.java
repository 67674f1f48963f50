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
package net.preibisch.luckyimaging.process;

import java.util.List;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.luckyimaging.Threads;
import net.preibisch.luckyimaging.frames.Frame;
import net.preibisch.luckyimaging.frames.ShiftVector;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPoint;
import net.preibisch.luckyimaging.process.alignmentpoints.AlignmentPointGrid;
import net.preibisch.luckyimaging.process.globalalignment.AlignmentRectangle;
import net.preibisch.luckyimaging.process.globalalignment.GlobalAligner;
import net.preibisch.luckyimaging.process.globalalignment.IntersectionRegion;
import net.preibisch.luckyimaging.process.localshift.LocalShift;
import net.preibisch.luckyimaging.process.localshift.LocalShiftEstimator;
import net.preibisch.luckyimaging.process.quality.ContrastMeasure;
import net.preibisch.luckyimaging.process.quality.ContrastMeasures;
import net.preibisch.luckyimaging.process.quality.FrameQualityRanker;
import net.preibisch.luckyimaging.process.quality.FrameQualityRanking;
import net.preibisch.luckyimaging.process.quality.FrameRanking;
import net.preibisch.luckyimaging.process.quality.QualityMeasure;
import net.preibisch.luckyimaging.process.translation.PhaseCorrelation;

/**
 * Runs all registration phases in order: frame ranking, selection of the alignment rectangle,
 * global alignment, averaging of the best frames, alignment point grid, neighbor resolution,
 * local shifts and the per-point frame ranking.
 * <p>
 * The rectangle and the alignment point structure use the gradient measure, frames are ranked
 * with the configured rank method.
 *
 * @author Lucky Imaging Registration developers
 */
public class RegistrationPipeline
{
	private static final Logger LOG = LoggerFactory.getLogger( RegistrationPipeline.class );

	private final AlignmentParameters params;

	public RegistrationPipeline( final AlignmentParameters params )
	{
		params.validate();
		this.params = params;
	}

	public Result run( final List< Frame > frames )
	{
		final ExecutorService service = Threads.createFixedExecutorService();

		try
		{
			return run( frames, service );
		}
		finally
		{
			service.shutdown();
		}
	}

	public Result run( final List< Frame > frames, final ExecutorService service )
	{
		LOG.info( "Registering {} frames with {}", frames.size(), params );

		final ContrastMeasure rankMeasure = ContrastMeasures.forMethod( params.rankMethod );
		final QualityMeasure structureMeasure = ContrastMeasures.gradient();

		final FrameRanking frameRanking = FrameRanking.rankFrames( frames, rankMeasure );

		final GlobalAligner aligner = new GlobalAligner( frames, frameRanking.getMaxIndex(), structureMeasure, new PhaseCorrelation() );
		aligner.selectAlignmentRectangle( params.alignmentRectangleScaleFactor );
		aligner.alignFrames();
		aligner.averageBestFrames( frameRanking.getQualitySortedIndices(), params.averageFramePercent );

		final AlignmentPointGrid grid = new AlignmentPointGrid( params, structureMeasure, frames.get( 0 ).isColor() );
		grid.buildGrid( aligner.getMeanFrame() );
		grid.resolveNeighbors();

		final LocalShiftEstimator shiftEstimator = new LocalShiftEstimator( params, aligner.getIntersection() );
		final LocalShift[][] localShifts = shiftEstimator.computeShifts( frames, grid, params.deWarp, service );

		final FrameQualityRanker ranker = new FrameQualityRanker( rankMeasure, params.stackPercent );
		final FrameQualityRanking frameQualityRanking = ranker.computeFrameQualities( frames, grid.getAlignmentPoints(), aligner.getIntersection(), service );

		return new Result( frameRanking, aligner, grid, localShifts, frameQualityRanking );
	}

	/**
	 * Everything the stacking needs.
	 */
	public static class Result
	{
		private final FrameRanking frameRanking;
		private final GlobalAligner aligner;
		private final AlignmentPointGrid grid;
		private final LocalShift[][] localShifts;
		private final FrameQualityRanking frameQualityRanking;

		public Result(
				final FrameRanking frameRanking,
				final GlobalAligner aligner,
				final AlignmentPointGrid grid,
				final LocalShift[][] localShifts,
				final FrameQualityRanking frameQualityRanking )
		{
			this.frameRanking = frameRanking;
			this.aligner = aligner;
			this.grid = grid;
			this.localShifts = localShifts;
			this.frameQualityRanking = frameQualityRanking;
		}

		public FrameRanking getFrameRanking() { return frameRanking; }
		public AlignmentRectangle getAlignmentRectangle() { return aligner.getAlignmentRectangle(); }
		public List< ShiftVector > getFrameShifts() { return aligner.getFrameShifts(); }
		public IntersectionRegion getIntersection() { return aligner.getIntersection(); }
		public Img< FloatType > getMeanFrame() { return aligner.getMeanFrame(); }
		public AlignmentPointGrid getGrid() { return grid; }
		public List< AlignmentPoint > getAlignmentPoints() { return grid.getAlignmentPoints(); }

		/**
		 * @return indexed [frame][point]
		 */
		public LocalShift[][] getLocalShifts() { return localShifts; }
		public FrameQualityRanking getFrameQualityRanking() { return frameQualityRanking; }
	}
}
