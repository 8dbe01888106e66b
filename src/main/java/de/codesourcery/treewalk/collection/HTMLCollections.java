package de.codesourcery.treewalk.collection;

import de.codesourcery.treewalk.TreewalkConfig;
import de.codesourcery.treewalk.dom.Document;
import de.codesourcery.treewalk.dom.INode;
import de.codesourcery.treewalk.traversal.Walker;

public final class HTMLCollections
{
	private HTMLCollections() {
	}

	private static TreewalkConfig configFor(INode root)
	{
		if ( root == null ) {
			return TreewalkConfig.getDefault();
		}
		final Document doc = root instanceof Document ? (Document) root : root.getOwnerDocument();
		return doc != null ? doc.getConfig() : TreewalkConfig.getDefault();
	}

	private static HTMLCollection depthFirst(INode root,IMatcher matcher,boolean includeRoot) {
		return new HTMLCollection( root , Walker.DEPTH_FIRST , matcher , includeRoot , configFor( root ) );
	}

	public static HTMLCollection byTagName(INode root,String tagName,boolean includeRoot) {
		return depthFirst( root , Matchers.byTagName( tagName ) , includeRoot );
	}

	public static HTMLCollection byClassName(INode root,String classNames,boolean includeRoot) {
		return depthFirst( root , Matchers.byClassName( classNames ) , includeRoot );
	}

	public static HTMLCollection byName(INode root,String name,boolean includeRoot) {
		return depthFirst( root , Matchers.byName( name ) , includeRoot );
	}

	public static HTMLCollection all(INode root,boolean includeRoot) {
		return depthFirst( root , Matchers.matchTrue() , includeRoot );
	}

	public static HTMLCollection links(INode root,boolean includeRoot) {
		return depthFirst( root , Matchers.links() , includeRoot );
	}

	public static HTMLCollection anchors(INode root,boolean includeRoot) {
		return depthFirst( root , Matchers.anchors() , includeRoot );
	}

	public static HTMLCollection children(INode root) {
		return new HTMLCollection( root , Walker.CHILDREN , Matchers.matchTrue() , false , configFor( root ) );
	}

	/**
	 * Returns a collection that is empty no matter what.
	 *
	 * @return
	 */
	public static HTMLCollection empty() {
		return new HTMLCollection( null , Walker.NONE , Matchers.matchFalse() , false );
	}
}
