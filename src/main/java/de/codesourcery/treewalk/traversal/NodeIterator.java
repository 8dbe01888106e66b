package de.codesourcery.treewalk.traversal;

import org.apache.commons.lang.Validate;

import de.codesourcery.treewalk.dom.INode;
import de.codesourcery.treewalk.traversal.NodeFilter.FilterResult;

/**
 * Moves forwards and backwards over the nodes below (and including) a root, in
 * tree order.
 *
 * <p>The iterator sits either before or after its reference node. Moving in the
 * opposite direction first returns the reference node itself again. Nodes
 * rejected or skipped by the filter are passed over but their descendants are
 * still visited.</p>
 */
public class NodeIterator
{
	private final INode root;
	private final int whatToShow;
	private final INodeFilter filter;

	private INode referenceNode;
	private boolean pointerBeforeReferenceNode = true;

	public NodeIterator(INode root) {
		this( root , NodeFilter.SHOW_ALL , null );
	}

	public NodeIterator(INode root,int whatToShow,INodeFilter filter)
	{
		Validate.notNull(root , "root must not be null");
		this.root = root;
		this.referenceNode = root;
		this.whatToShow = whatToShow;
		this.filter = filter;
	}

	public INode getRoot() {
		return root;
	}

	public INode getReferenceNode() {
		return referenceNode;
	}

	public boolean isPointerBeforeReferenceNode() {
		return pointerBeforeReferenceNode;
	}

	public int getWhatToShow() {
		return whatToShow;
	}

	public INodeFilter getFilter() {
		return filter;
	}

	public INode nextNode()
	{
		INode node = referenceNode;
		boolean beforeNode = pointerBeforeReferenceNode;
		while ( true )
		{
			if ( beforeNode ) {
				beforeNode = false;
			}
			else
			{
				node = following( node );
				if ( node == null ) {
					return null;
				}
			}
			if ( NodeFilter.verify( whatToShow , filter , node ) == FilterResult.ACCEPT ) {
				break;
			}
		}
		referenceNode = node;
		pointerBeforeReferenceNode = beforeNode;
		return node;
	}

	public INode previousNode()
	{
		INode node = referenceNode;
		boolean beforeNode = pointerBeforeReferenceNode;
		while ( true )
		{
			if ( ! beforeNode ) {
				beforeNode = true;
			}
			else
			{
				node = preceding( node );
				if ( node == null ) {
					return null;
				}
			}
			if ( NodeFilter.verify( whatToShow , filter , node ) == FilterResult.ACCEPT ) {
				break;
			}
		}
		referenceNode = node;
		pointerBeforeReferenceNode = beforeNode;
		return node;
	}

	private INode following(INode node) {
		return Walker.DEPTH_FIRST.getNext( root , node );
	}

	private INode preceding(INode node)
	{
		if ( node == root ) {
			return null;
		}
		INode previous = node.getPreviousSibling();
		if ( previous == null ) {
			return node.getParent();
		}
		for ( INode last = previous.getLastChild() ; last != null ; last = previous.getLastChild() ) {
			previous = last;
		}
		return previous;
	}

	@Override
	public String toString() {
		return "NodeIterator[ root="+root+", reference="+referenceNode+", before="+pointerBeforeReferenceNode+" ]";
	}
}
