package de.codesourcery.treewalk.traversal;

import org.apache.commons.lang.Validate;

import de.codesourcery.treewalk.dom.INode;
import de.codesourcery.treewalk.traversal.NodeFilter.FilterResult;

/**
 * Moves a current node around the filtered view of a subtree.
 *
 * <p>Unlike {@link NodeIterator}, the filter's verdict controls descent:
 * {@link FilterResult#SKIP} hides a node but still exposes its children,
 * {@link FilterResult#REJECT} hides the node together with its subtree.
 * Nodes whose type is not in <code>whatToShow</code> count as skipped.
 * Every move either returns the new current node or returns <code>null</code>
 * and leaves the current node where it was. No move leaves the root's subtree.</p>
 */
public class TreeWalker
{
	private final INode root;
	private final int whatToShow;
	private final INodeFilter filter;

	private INode currentNode;

	public TreeWalker(INode root) {
		this( root , NodeFilter.SHOW_ALL , null );
	}

	public TreeWalker(INode root,int whatToShow,INodeFilter filter)
	{
		Validate.notNull(root , "root must not be null");
		this.root = root;
		this.currentNode = root;
		this.whatToShow = whatToShow;
		this.filter = filter;
	}

	public INode getRoot() {
		return root;
	}

	public int getWhatToShow() {
		return whatToShow;
	}

	public INodeFilter getFilter() {
		return filter;
	}

	public INode getCurrentNode() {
		return currentNode;
	}

	public void setCurrentNode(INode currentNode)
	{
		Validate.notNull(currentNode , "current node must not be null");
		this.currentNode = currentNode;
	}

	private FilterResult filter(INode node)
	{
		if ( ( whatToShow & node.getNodeType().getShowMask() ) == 0 ) {
			return FilterResult.SKIP;
		}
		return NodeFilter.verify( whatToShow , filter , node );
	}

	private INode moveTo(INode node)
	{
		currentNode = node;
		return node;
	}

	public INode parentNode()
	{
		INode node = currentNode;
		while ( node != null && node != root )
		{
			node = node.getParent();
			if ( node != null && filter( node ) == FilterResult.ACCEPT ) {
				return moveTo( node );
			}
		}
		return null;
	}

	public INode firstChild() {
		return traverseChildren( true );
	}

	public INode lastChild() {
		return traverseChildren( false );
	}

	private INode traverseChildren(boolean first)
	{
		INode node = first ? currentNode.getFirstChild() : currentNode.getLastChild();
		while ( node != null )
		{
			final FilterResult result = filter( node );
			if ( result == FilterResult.ACCEPT ) {
				return moveTo( node );
			}
			if ( result == FilterResult.SKIP )
			{
				final INode child = first ? node.getFirstChild() : node.getLastChild();
				if ( child != null ) {
					node = child;
					continue;
				}
			}
			while ( node != null )
			{
				final INode sibling = first ? node.getNextSibling() : node.getPreviousSibling();
				if ( sibling != null ) {
					node = sibling;
					break;
				}
				final INode parent = node.getParent();
				if ( parent == null || parent == root || parent == currentNode ) {
					return null;
				}
				node = parent;
			}
		}
		return null;
	}

	public INode nextSibling() {
		return traverseSiblings( true );
	}

	public INode previousSibling() {
		return traverseSiblings( false );
	}

	private INode traverseSiblings(boolean next)
	{
		INode node = currentNode;
		if ( node == root ) {
			return null;
		}
		while ( true )
		{
			INode sibling = next ? node.getNextSibling() : node.getPreviousSibling();
			while ( sibling != null )
			{
				node = sibling;
				final FilterResult result = filter( node );
				if ( result == FilterResult.ACCEPT ) {
					return moveTo( node );
				}
				sibling = next ? node.getFirstChild() : node.getLastChild();
				if ( result == FilterResult.REJECT || sibling == null ) {
					sibling = next ? node.getNextSibling() : node.getPreviousSibling();
				}
			}
			node = node.getParent();
			if ( node == null || node == root ) {
				return null;
			}
			// an accepted parent ends the search
			if ( filter( node ) == FilterResult.ACCEPT ) {
				return null;
			}
		}
	}

	public INode previousNode()
	{
		INode node = currentNode;
		while ( node != root )
		{
			INode sibling = node.getPreviousSibling();
			while ( sibling != null )
			{
				node = sibling;
				FilterResult result = filter( node );
				while ( result != FilterResult.REJECT && node.getLastChild() != null )
				{
					node = node.getLastChild();
					result = filter( node );
				}
				if ( result == FilterResult.ACCEPT ) {
					return moveTo( node );
				}
				sibling = node.getPreviousSibling();
			}
			final INode parent = node.getParent();
			if ( node == root || parent == null ) {
				return null;
			}
			node = parent;
			if ( filter( node ) == FilterResult.ACCEPT ) {
				return moveTo( node );
			}
		}
		return null;
	}

	public INode nextNode()
	{
		INode node = currentNode;
		FilterResult result = FilterResult.ACCEPT;
		while ( true )
		{
			while ( result != FilterResult.REJECT && node.getFirstChild() != null )
			{
				node = node.getFirstChild();
				result = filter( node );
				if ( result == FilterResult.ACCEPT ) {
					return moveTo( node );
				}
			}
			INode sibling = null;
			for ( INode temp = node ; temp != null && sibling == null ; temp = temp.getParent() )
			{
				if ( temp == root ) {
					return null;
				}
				sibling = temp.getNextSibling();
			}
			if ( sibling == null ) {
				return null;
			}
			node = sibling;
			result = filter( node );
			if ( result == FilterResult.ACCEPT ) {
				return moveTo( node );
			}
		}
	}

	@Override
	public String toString() {
		return "TreeWalker[ root="+root+", current="+currentNode+" ]";
	}
}
