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
package net.preibisch.luckyimaging;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.Prefs;

public class Threads
{
	private static final Logger LOG = LoggerFactory.getLogger( Threads.class );

	/**
	 * @return num threads for the executorService, taken from the ImageJ preferences
	 */
	public static int numThreads() { return Math.max( 1, Prefs.getThreads() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * Runs all tasks and gathers their results in submission order. The pass is all-or-nothing:
	 * if one task fails or the calling thread is interrupted, the remaining tasks are cancelled
	 * and a {@link RuntimeException} is thrown, partial results are discarded.
	 *
	 * @param tasks - the independent tasks
	 * @param service - where to run them
	 * @param jobDescription - used for logging and the exception message
	 * @return the results, one per task
	 */
	public static < T > List< T > execTasks( final List< Callable< T > > tasks, final ExecutorService service, final String jobDescription )
	{
		final ArrayList< T > results = new ArrayList<>( tasks.size() );

		if ( tasks.isEmpty() )
			return results;

		final List< Future< T > > futures = new ArrayList<>( tasks.size() );

		for ( final Callable< T > task : tasks )
			futures.add( service.submit( task ) );

		try
		{
			for ( final Future< T > future : futures )
				results.add( future.get() );
		}
		catch ( final InterruptedException e )
		{
			cancelAll( futures );
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Interrupted while trying to " + jobDescription + ".", e );
		}
		catch ( final ExecutionException e )
		{
			cancelAll( futures );
			LOG.error( "Failed to {}: {}", jobDescription, e.getCause().toString() );
			throw new RuntimeException( "Failed to " + jobDescription + ".", e.getCause() );
		}

		LOG.debug( "Finished {} ({} tasks).", jobDescription, tasks.size() );

		return results;
	}

	private static < T > void cancelAll( final List< Future< T > > futures )
	{
		for ( final Future< T > future : futures )
			future.cancel( true );
	}
}
