package de.codesourcery.treewalk.traversal;

import org.apache.commons.lang.Validate;

import de.codesourcery.treewalk.dom.INode;

/**
 * Traversal policies for walking a live tree one node at a time.
 *
 * <p>A walker holds no state. The caller keeps the cursor, a root plus the node
 * returned by the previous call, and passes it back in:</p>
 *
 * <pre>
 * for ( INode n = walker.getNext( root , null ) ; n != null ; n = walker.getNext( root , n ) ) {
 *     ...
 * }
 * </pre>
 *
 * <p>Passing <code>null</code> as the current node starts a traversal. A
 * <code>null</code> result ends it, and the caller must not restart by passing
 * <code>null</code> again unless it really wants a new traversal.</p>
 *
 * <p>Nothing is copied, each step reads the tree as it is at that moment. A node
 * removed from the tree between two steps reports no parent and no siblings, so
 * handing it back as the current node finishes the walk after its own
 * descendants (if any) have been visited.</p>
 */
public enum Walker
{
	/**
	 * Visits all descendants of the root in tree order (preorder, depth first).
	 * The root itself is never returned.
	 */
	DEPTH_FIRST
	{
		@Override
		public INode getNext(INode root,INode current)
		{
			Validate.notNull(root , "root must not be null");

			INode n = current != null ? current : root;

			final INode firstChild = n.getFirstChild();
			if ( firstChild != null ) {
				return firstChild;
			}
			// a childless root has nothing to offer, its siblings are outside of the walk
			if ( n == root ) {
				return null;
			}

			final INode nextSibling = n.getNextSibling();
			if ( nextSibling != null ) {
				return nextSibling;
			}

			INode parent = n.getParent();
			if ( parent == null ) {
				return null;
			}
			while ( n != root && n == parent.getLastChild() )
			{
				n = parent;
				parent = n.getParent();
				if ( parent == null ) {
					break;
				}
			}

			if ( n == root ) {
				return null;
			}
			return n.getNextSibling();
		}
	},
	/**
	 * Visits the direct children of the root only.
	 */
	CHILDREN
	{
		@Override
		public INode getNext(INode root,INode current)
		{
			Validate.notNull(root , "root must not be null");

			if ( current == null ) {
				return root.getFirstChild();
			}
			// the root is never a member of its own child list
			if ( current == root ) {
				return null;
			}
			return current.getNextSibling();
		}
	},
	/**
	 * Visits nothing.
	 */
	NONE
	{
		@Override
		public INode getNext(INode root,INode current) {
			return null;
		}
	};

	/**
	 * Returns the node following <code>current</code>.
	 *
	 * @param root root of the traversal, must not be <code>null</code> (except for {@link #NONE})
	 * @param current node returned by the previous call or <code>null</code> to start the traversal
	 * @return next node or <code>null</code> if the traversal is finished
	 */
	public abstract INode getNext(INode root,INode current);
}
