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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import net.preibisch.luckyimaging.process.localshift.ShiftMethod;
import net.preibisch.luckyimaging.process.quality.RankMethod;

/**
 * All parameters of the registration, with defaults. Can be read from a properties file,
 * the keys are listed in {@link #parseProperties(Properties)}.
 */
public class AlignmentParameters
{
	// global alignment
	public double alignmentRectangleScaleFactor = 3.0;
	public double averageFramePercent = 5.0;

	// alignment point grid
	public int halfBoxWidth = 24;
	public int halfPatchWidth = 40;
	public int stepSize = 50;
	public int searchWidth = 10;
	public double structureThreshold = 0.05;
	public int brightnessThreshold = 10;
	public int contrastThreshold = 0;
	public double dimFractionThreshold = 0.6;

	// local shifts
	public ShiftMethod alignmentMethod = ShiftMethod.RADIAL_SEARCH;
	public int subpixelUpsampleFactor = 10;
	public boolean radialSearchSubpixel = false;
	public boolean deWarp = true;

	// frame ranking
	public RankMethod rankMethod = RankMethod.LAPLACE;
	public double stackPercent = 10.0;

	/**
	 * Reads all known keys, keys that are not present keep their current value.
	 *
	 * @throws IllegalArgumentException if a value cannot be parsed or a method name is not supported
	 */
	public void parseProperties( final Properties props )
	{
		alignmentMethod = ShiftMethod.fromName( props.getProperty( "alignment_method", alignmentMethod.toString() ) );

		searchWidth = parseInt( props, "search_width", searchWidth );
		halfBoxWidth = parseInt( props, "half_box_width", halfBoxWidth );
		halfPatchWidth = parseInt( props, "half_patch_width", halfPatchWidth );
		stepSize = parseInt( props, "step_size", stepSize );

		structureThreshold = parseDouble( props, "structure_threshold", structureThreshold );
		brightnessThreshold = parseInt( props, "brightness_threshold", brightnessThreshold );
		contrastThreshold = parseInt( props, "contrast_threshold", contrastThreshold );
		dimFractionThreshold = parseDouble( props, "dim_fraction_threshold", dimFractionThreshold );

		stackPercent = parseDouble( props, "stack_percent", stackPercent );
		rankMethod = RankMethod.fromName( props.getProperty( "rank_method", rankMethod.toString() ) );

		alignmentRectangleScaleFactor = parseDouble( props, "alignment_rectangle_scale_factor", alignmentRectangleScaleFactor );
		averageFramePercent = parseDouble( props, "average_frame_percent", averageFramePercent );

		subpixelUpsampleFactor = parseInt( props, "subpixel_upsample_factor", subpixelUpsampleFactor );
		radialSearchSubpixel = Boolean.parseBoolean( props.getProperty( "radial_search_subpixel", Boolean.toString( radialSearchSubpixel ) ).trim() );
		deWarp = Boolean.parseBoolean( props.getProperty( "de_warp", Boolean.toString( deWarp ) ).trim() );
	}

	/**
	 * Loads the parameters from a properties stream, on top of the defaults, and validates them.
	 */
	public static AlignmentParameters load( final InputStream in ) throws IOException
	{
		final Properties props = new Properties();
		props.load( in );

		final AlignmentParameters params = new AlignmentParameters();
		params.parseProperties( props );
		params.validate();

		return params;
	}

	/**
	 * @throws IllegalArgumentException if a value is out of its range
	 */
	public void validate()
	{
		if ( halfBoxWidth < 1 )
			throw new IllegalArgumentException( "half_box_width must be >= 1, but is " + halfBoxWidth );

		if ( halfPatchWidth < halfBoxWidth )
			throw new IllegalArgumentException( "half_patch_width (" + halfPatchWidth + ") must not be smaller than half_box_width (" + halfBoxWidth + ")" );

		if ( stepSize < 1 )
			throw new IllegalArgumentException( "step_size must be >= 1, but is " + stepSize );

		if ( searchWidth < 0 )
			throw new IllegalArgumentException( "search_width must be >= 0, but is " + searchWidth );

		if ( structureThreshold < 0 || structureThreshold > 1 )
			throw new IllegalArgumentException( "structure_threshold must be within [0, 1], but is " + structureThreshold );

		if ( dimFractionThreshold < 0 || dimFractionThreshold > 1 )
			throw new IllegalArgumentException( "dim_fraction_threshold must be within [0, 1], but is " + dimFractionThreshold );

		if ( stackPercent <= 0 || stackPercent > 100 )
			throw new IllegalArgumentException( "stack_percent must be within (0, 100], but is " + stackPercent );

		if ( averageFramePercent <= 0 || averageFramePercent > 100 )
			throw new IllegalArgumentException( "average_frame_percent must be within (0, 100], but is " + averageFramePercent );

		if ( alignmentRectangleScaleFactor < 1 )
			throw new IllegalArgumentException( "alignment_rectangle_scale_factor must be >= 1, but is " + alignmentRectangleScaleFactor );

		if ( subpixelUpsampleFactor < 1 )
			throw new IllegalArgumentException( "subpixel_upsample_factor must be >= 1, but is " + subpixelUpsampleFactor );
	}

	private static int parseInt( final Properties props, final String key, final int defaultValue )
	{
		final String value = props.getProperty( key );

		if ( value == null )
			return defaultValue;

		try
		{
			return Integer.parseInt( value.trim() );
		}
		catch ( final NumberFormatException e )
		{
			throw new IllegalArgumentException( "Cannot parse '" + value + "' for key " + key + " as integer.", e );
		}
	}

	private static double parseDouble( final Properties props, final String key, final double defaultValue )
	{
		final String value = props.getProperty( key );

		if ( value == null )
			return defaultValue;

		try
		{
			return Double.parseDouble( value.trim() );
		}
		catch ( final NumberFormatException e )
		{
			throw new IllegalArgumentException( "Cannot parse '" + value + "' for key " + key + " as number.", e );
		}
	}

	@Override
	public String toString()
	{
		return "method=" + alignmentMethod + ", halfBoxWidth=" + halfBoxWidth + ", halfPatchWidth=" + halfPatchWidth +
				", stepSize=" + stepSize + ", searchWidth=" + searchWidth + ", structureThreshold=" + structureThreshold +
				", brightnessThreshold=" + brightnessThreshold + ", contrastThreshold=" + contrastThreshold +
				", rankMethod=" + rankMethod + ", stackPercent=" + stackPercent;
	}
}
