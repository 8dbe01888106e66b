package de.codesourcery.treewalk;

import java.util.ArrayList;
import java.util.List;

import de.codesourcery.treewalk.dom.Document;
import de.codesourcery.treewalk.dom.Element;
import de.codesourcery.treewalk.dom.INode;
import de.codesourcery.treewalk.traversal.Walker;

/**
 * Builds the sample tree <code>root(a(b,c), d)</code>.
 */
public final class TreeFixtures
{
	public final Document doc;
	public final Element root;
	public final Element a;
	public final Element b;
	public final Element c;
	public final Element d;

	public TreeFixtures() {
		this( new Document() );
	}

	public TreeFixtures(Document doc)
	{
		this.doc = doc;
		root = doc.createElement("root");
		a = doc.createElement("a");
		b = doc.createElement("b");
		c = doc.createElement("c");
		d = doc.createElement("d");

		doc.appendChild( root );
		root.appendChild( a );
		a.appendChild( b );
		a.appendChild( c );
		root.appendChild( d );
	}

	public static List<INode> walk(Walker walker,INode root,INode start)
	{
		final List<INode> result = new ArrayList<>();
		for ( INode n = walker.getNext( root , start ) ; n != null ; n = walker.getNext( root , n ) ) {
			result.add( n );
		}
		return result;
	}

	public static List<INode> walk(Walker walker,INode root) {
		return walk( walker , root , null );
	}
}
