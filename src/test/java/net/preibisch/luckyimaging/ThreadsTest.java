package net.preibisch.luckyimaging;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ThreadsTest
{
	private ExecutorService service;

	@Before
	public void setUp()
	{
		service = Threads.createFixedExecutorService( 3 );
	}

	@After
	public void tearDown()
	{
		service.shutdownNow();
	}

	@Test
	public void testResultsInSubmissionOrder()
	{
		final ArrayList< Callable< Integer > > tasks = new ArrayList<>();

		for ( int i = 0; i < 20; ++i )
		{
			final int value = i;
			tasks.add( () ->
			{
				Thread.sleep( ( 20 - value ) % 4 );
				return value * value;
			});
		}

		final List< Integer > results = Threads.execTasks( tasks, service, "square numbers" );

		assertEquals( 20, results.size() );

		for ( int i = 0; i < 20; ++i )
			assertEquals( i * i, results.get( i ).intValue() );
	}

	@Test
	public void testFailureAbortsThePass()
	{
		final ArrayList< Callable< Integer > > tasks = new ArrayList<>();
		tasks.add( () -> 1 );
		tasks.add( () -> { throw new IllegalStateException( "broken task" ); } );
		tasks.add( () -> 3 );

		try
		{
			Threads.execTasks( tasks, service, "run a broken task" );
			fail( "a failing task must fail the whole pass" );
		}
		catch ( final RuntimeException e )
		{
			assertTrue( e.getCause() instanceof IllegalStateException );
			assertEquals( "broken task", e.getCause().getMessage() );
		}
	}

	@Test
	public void testNoTasks()
	{
		assertTrue( Threads.execTasks( new ArrayList< Callable< Integer > >(), service, "do nothing" ).isEmpty() );
	}
}
