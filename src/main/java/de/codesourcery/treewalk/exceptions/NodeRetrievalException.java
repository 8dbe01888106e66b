package de.codesourcery.treewalk.exceptions;

import de.codesourcery.treewalk.dom.INode;

/**
 * Thrown by a node accessor that failed to look up a related node.
 *
 * <p>Traversal code never catches this exception. A caller seeing it knows the
 * lookup itself failed, as opposed to a <code>null</code> result which always
 * means "no such node".</p>
 */
public class NodeRetrievalException extends RuntimeException {

	public final INode node;
	public final String relation;

	public NodeRetrievalException(INode node,String relation,Throwable cause)
	{
		super("Failed to retrieve "+relation+" of "+node,cause);
		this.node = node;
		this.relation = relation;
	}
}
