package de.codesourcery.treewalk.dom;

import java.util.Iterator;

import de.codesourcery.treewalk.iterator.IIndexedSource;
import de.codesourcery.treewalk.iterator.SequentialIterator;

/**
 * Live view of a node's children.
 */
public final class NodeList implements IIndexedSource<INode>, Iterable<INode> {

	private final INode parent;

	public NodeList(INode parent) {
		this.parent = parent;
	}

	public int getLength() {
		return parent.getChildCount();
	}

	public INode item(int index)
	{
		if ( index < 0 || index >= parent.getChildCount() ) {
			return null;
		}
		return parent.child( index );
	}

	@Override
	public INode itemAt(int index) {
		return item( index );
	}

	public SequentialIterator<INode> newIterator() {
		return new SequentialIterator<>( this );
	}

	@Override
	public Iterator<INode> iterator() {
		return newIterator().asIterator();
	}
}
