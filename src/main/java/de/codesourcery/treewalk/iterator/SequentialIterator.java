package de.codesourcery.treewalk.iterator;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Iterates over an {@link IIndexedSource} by position.
 *
 * <p>Every call to {@link #next()} looks up the item at the current index in the
 * source as it is right now. Nothing is copied up front. If items are removed
 * during iteration the iteration ends early. Items inserted before the current
 * position shift the remaining items so one of them is returned twice. Once a
 * lookup comes back empty the iterator is done for good, even if the source grows
 * again later.</p>
 *
 * @param <T>
 */
public final class SequentialIterator<T>
{
	private static final Logger LOG = LoggerFactory.getLogger(SequentialIterator.class);

	private final IIndexedSource<? extends T> source;
	private int index;
	private boolean done;

	public static final class Step<T>
	{
		private static final Step<?> DONE = new Step<>(true,null);

		public final boolean done;
		public final T value;

		private Step(boolean done,T value) {
			this.done = done;
			this.value = value;
		}

		@SuppressWarnings("unchecked")
		public static <T> Step<T> done() {
			return (Step<T>) DONE;
		}

		public static <T> Step<T> of(T value)
		{
			Validate.notNull(value , "value must not be null");
			return new Step<>(false,value);
		}

		public boolean isDone() {
			return done;
		}

		public T getValue() {
			return value;
		}

		@Override
		public String toString() {
			return "{done: "+done+", value: "+value+"}";
		}
	}

	public SequentialIterator(IIndexedSource<? extends T> source)
	{
		Validate.notNull(source , "source must not be null");
		this.source = source;
	}

	public Step<T> next()
	{
		if ( done ) {
			return Step.done();
		}
		final T item = source.itemAt( index );
		if ( item == null )
		{
			LOG.trace("Iteration finished after {} items", index );
			done = true;
			return Step.done();
		}
		index++;
		return Step.of( item );
	}

	public boolean isDone() {
		return done;
	}

	public int getIndex() {
		return index;
	}

	/**
	 * Adapts this iterator to {@link java.util.Iterator}.
	 *
	 * <p>{@link Iterator#hasNext()} has to fetch the next item to answer, so the
	 * item returned by the following {@link Iterator#next()} is the one that was
	 * live at the time of the <code>hasNext()</code> call.</p>
	 *
	 * @return
	 */
	public Iterator<T> asIterator()
	{
		return new Iterator<T>()
		{
			private Step<T> pending;

			@Override
			public boolean hasNext()
			{
				if ( pending == null ) {
					pending = SequentialIterator.this.next();
				}
				return ! pending.done;
			}

			@Override
			public T next()
			{
				if ( ! hasNext() ) {
					throw new NoSuchElementException();
				}
				final T result = pending.value;
				pending = null;
				return result;
			}
		};
	}
}
