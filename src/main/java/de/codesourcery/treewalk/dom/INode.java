package de.codesourcery.treewalk.dom;

import de.codesourcery.treewalk.exceptions.NodeRetrievalException;

/**
 * A node in a mutable document tree.
 *
 * <p>The navigation methods form the accessor contract every traversal in this
 * library is built on. They are total: a missing relative is reported as
 * <code>null</code>, never as an exception. Implementations backed by storage
 * that can fail throw {@link NodeRetrievalException} instead of returning
 * <code>null</code>.</p>
 *
 * <p>Nodes are compared by identity everywhere except in {@link #isEqualNode(INode)}.</p>
 */
public interface INode
{
	public NodeType getNodeType();

	public String getNodeName();

	/**
	 * Returns the parent of this node.
	 *
	 * @return parent or <code>null</code> if this node is a root or has been detached
	 */
	public INode getParent();

	public INode getFirstChild();

	public INode getLastChild();

	/**
	 * Returns the sibling following this node in its parent's child order.
	 *
	 * @return next sibling or <code>null</code> if this is the last child or has no parent
	 */
	public INode getNextSibling();

	public INode getPreviousSibling();

	public boolean hasChildren();

	public boolean hasNoChildren();

	public int getChildCount();

	public INode child(int idx);

	/**
	 * Returns the index of a direct child, compared by identity.
	 *
	 * @param child
	 * @return index or -1
	 */
	public int indexOf(INode child);

	/**
	 * Returns a live view of this node's children.
	 *
	 * @return
	 */
	public NodeList getChildNodes();

	public INode appendChild(INode child);

	public INode insertBefore(INode child,INode refChild);

	public INode removeChild(INode child);

	public void setParent(INode parent);

	/**
	 * Returns the document this node was created by.
	 *
	 * @return owning document, <code>null</code> for documents themselves
	 */
	public Document getOwnerDocument();

	public String getTextContent();

	/**
	 * Checks whether this node is an inclusive ancestor of another node.
	 *
	 * @param other
	 * @return <code>true</code> if <code>other</code> is this node or one of its descendants
	 */
	public boolean contains(INode other);

	public boolean isSameNode(INode other);

	/**
	 * Structural equality.
	 *
	 * <p>Nodes of different types are never equal. Nodes of the same type are equal
	 * when their type-specific values are equal, regardless of identity.</p>
	 *
	 * @param other node to compare with, may be <code>null</code>
	 * @return
	 */
	public boolean isEqualNode(INode other);
}
