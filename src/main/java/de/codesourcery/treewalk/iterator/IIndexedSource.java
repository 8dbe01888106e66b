package de.codesourcery.treewalk.iterator;

/**
 * A collection whose items can be looked up by position.
 *
 * @param <T>
 */
@FunctionalInterface
public interface IIndexedSource<T>
{
	/**
	 * Returns the item at a zero-based position in the source's current order.
	 *
	 * @param index
	 * @return item or <code>null</code> if the index is past the end
	 */
	public T itemAt(int index);
}
