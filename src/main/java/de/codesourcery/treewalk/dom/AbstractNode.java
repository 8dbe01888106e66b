package de.codesourcery.treewalk.dom;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.Validate;

import de.codesourcery.treewalk.exceptions.HierarchyRequestException;
import de.codesourcery.treewalk.exceptions.NotFoundException;
import de.codesourcery.treewalk.traversal.Walker;

public abstract class AbstractNode implements INode {

	private final List<INode> children = new ArrayList<>();
	private Document ownerDocument;
	private INode parent;

	protected AbstractNode(Document ownerDocument)
	{
		this.ownerDocument = ownerDocument;
	}

	@Override
	public Document getOwnerDocument() {
		return ownerDocument;
	}

	/**
	 * Returns the document whose mutation count tracks changes to this node.
	 *
	 * @return
	 */
	protected Document getTreeDocument() {
		return ownerDocument;
	}

	/**
	 * Moves this node and its subtree into another document.
	 *
	 * @param doc
	 */
	void adopt(Document doc)
	{
		if ( ownerDocument == doc ) {
			return;
		}
		ownerDocument = doc;
		for ( final INode n : children )
		{
			if ( n instanceof AbstractNode ) {
				((AbstractNode) n).adopt( doc );
			}
		}
	}

	protected final void treeChanged()
	{
		final Document doc = getTreeDocument();
		if ( doc != null ) {
			doc.incrementMutationCount();
		}
	}

	@Override
	public INode getParent() {
		return parent;
	}

	@Override
	public void setParent(INode parent) {
		this.parent = parent;
	}

	@Override
	public INode getFirstChild() {
		return children.isEmpty() ? null : children.get(0);
	}

	@Override
	public INode getLastChild() {
		return children.isEmpty() ? null : children.get( children.size() - 1 );
	}

	@Override
	public INode getNextSibling()
	{
		final INode p = getParent();
		if ( p == null ) {
			return null;
		}
		final int idx = p.indexOf( this );
		if ( idx < 0 || idx+1 >= p.getChildCount() ) {
			return null;
		}
		return p.child( idx+1 );
	}

	@Override
	public INode getPreviousSibling()
	{
		final INode p = getParent();
		if ( p == null ) {
			return null;
		}
		final int idx = p.indexOf( this );
		return idx > 0 ? p.child( idx-1 ) : null;
	}

	@Override
	public boolean hasChildren() {
		return ! children.isEmpty();
	}

	@Override
	public boolean hasNoChildren() {
		return children.isEmpty();
	}

	@Override
	public int getChildCount() {
		return children.size();
	}

	@Override
	public INode child(int idx) {
		return children.get(idx);
	}

	@Override
	public int indexOf(INode child)
	{
		for ( int i = 0 , len = children.size() ; i < len ; i++ )
		{
			if ( children.get(i) == child ) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public NodeList getChildNodes() {
		return new NodeList(this);
	}

	@Override
	public INode appendChild(INode child) {
		return insertBefore( child , null );
	}

	@Override
	public INode insertBefore(INode child,INode refChild)
	{
		Validate.notNull(child , "child must not be null");

		if ( refChild != null && refChild.getParent() != this ) {
			throw NotFoundException.notAChild( this , refChild );
		}
		if ( ! canHaveChildren() ) {
			throw new HierarchyRequestException("Node cannot have children", this , child );
		}
		if ( child == this || child.contains( this ) ) {
			throw new HierarchyRequestException("Node would become its own ancestor", this , child );
		}

		if ( child.getNodeType() == NodeType.DOCUMENT_FRAGMENT )
		{
			final List<INode> toMove = new ArrayList<>();
			for ( INode n = Walker.CHILDREN.getNext( child , null ) ; n != null ; n = Walker.CHILDREN.getNext( child , n ) ) {
				toMove.add( n );
			}
			checkChildrenAllowed( toMove );
			for ( final INode n : toMove ) {
				insertBefore( n , refChild );
			}
			return child;
		}

		if ( child.getNodeType() == NodeType.DOCUMENT || child.getNodeType() == NodeType.ATTRIBUTE ) {
			throw new HierarchyRequestException("Node type "+child.getNodeType()+" cannot be inserted", this , child );
		}
		checkChildAllowed( child );

		if ( child == refChild ) {
			return child;
		}

		final INode oldParent = child.getParent();
		if ( oldParent != null ) {
			oldParent.removeChild( child );
		}

		if ( child instanceof AbstractNode ) {
			((AbstractNode) child).adopt( getTreeDocument() );
		}

		final int index = refChild == null ? children.size() : indexOf( refChild );
		children.add( index , child );
		child.setParent( this );
		treeChanged();
		return child;
	}

	@Override
	public INode removeChild(INode child)
	{
		Validate.notNull(child , "child must not be null");

		final int idx = indexOf( child );
		if ( idx < 0 ) {
			throw NotFoundException.notAChild( this , child );
		}
		children.remove( idx );
		child.setParent( null );
		treeChanged();
		return child;
	}

	protected boolean canHaveChildren() {
		return true;
	}

	/**
	 * Hook for node types that only accept certain children.
	 *
	 * @param child
	 * @throws HierarchyRequestException
	 */
	protected void checkChildAllowed(INode child) throws HierarchyRequestException {
	}

	/**
	 * Checks the children of a fragment before any of them is moved.
	 *
	 * @param newChildren
	 * @throws HierarchyRequestException
	 */
	protected void checkChildrenAllowed(List<INode> newChildren) throws HierarchyRequestException
	{
		for ( final INode n : newChildren ) {
			checkChildAllowed( n );
		}
	}

	@Override
	public boolean contains(INode other)
	{
		for ( INode current = other ; current != null ; current = current.getParent() )
		{
			if ( current == this ) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean isSameNode(INode other) {
		return this == other;
	}

	@Override
	public String getTextContent()
	{
		final StringBuilder buffer = new StringBuilder();
		for ( INode n = Walker.DEPTH_FIRST.getNext( this , null ) ; n != null ; n = Walker.DEPTH_FIRST.getNext( this , n ) )
		{
			if ( n instanceof Text ) {
				buffer.append( ((CharacterData) n).getData() );
			}
		}
		return buffer.toString();
	}

	@Override
	public final boolean isEqualNode(INode other)
	{
		if ( other == this ) {
			return true;
		}
		if ( other == null || other.getNodeType() != getNodeType() ) {
			return false;
		}
		return hasEqualProperties( other );
	}

	/**
	 * Compares the type-specific values of this node with another node of the same type.
	 *
	 * @param other node with the same {@link NodeType} as this one, never <code>null</code>
	 * @return
	 */
	protected abstract boolean hasEqualProperties(INode other);

	protected final boolean hasEqualChildren(INode other)
	{
		INode mine = Walker.CHILDREN.getNext( this , null );
		INode theirs = Walker.CHILDREN.getNext( other , null );
		while ( mine != null && theirs != null )
		{
			if ( ! mine.isEqualNode( theirs ) ) {
				return false;
			}
			mine = Walker.CHILDREN.getNext( this , mine );
			theirs = Walker.CHILDREN.getNext( other , theirs );
		}
		return mine == null && theirs == null;
	}

	@Override
	public String toString() {
		return getNodeName();
	}
}
