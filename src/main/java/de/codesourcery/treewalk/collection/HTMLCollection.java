package de.codesourcery.treewalk.collection;

import java.util.Iterator;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.treewalk.TreewalkConfig;
import de.codesourcery.treewalk.dom.Document;
import de.codesourcery.treewalk.dom.Element;
import de.codesourcery.treewalk.dom.INode;
import de.codesourcery.treewalk.dom.NodeType;
import de.codesourcery.treewalk.iterator.IIndexedSource;
import de.codesourcery.treewalk.iterator.SequentialIterator;
import de.codesourcery.treewalk.traversal.Walker;

/**
 * A live, ordered collection of elements below a root node.
 *
 * <p>The collection stores no elements. Every query walks the tree with its
 * {@link Walker} and keeps the elements accepted by its {@link IMatcher}, so the
 * result always reflects the tree as it is at the time of the call. Only
 * element nodes can be members.</p>
 *
 * <p>By default the root is the starting point of the walk but not a candidate
 * itself. With <code>includeRoot</code> the root is examined first.</p>
 *
 * <p>To make index-ordered access cheap, {@link #item(int)} remembers the
 * position of its last hit and resumes from there when asked for the same or a
 * later index. The remembered position is dropped as soon as the owning
 * document reports any change.</p>
 */
public class HTMLCollection implements IIndexedSource<Element>, Iterable<Element>
{
	private static final Logger LOG = LoggerFactory.getLogger(HTMLCollection.class);

	private final INode root;
	private final Walker walker;
	private final IMatcher matcher;
	private final boolean includeRoot;
	private final boolean cursorCache;

	private int cursorIndex = -1;
	private Element cursorNode;
	private Document cursorDocument;
	private long cursorMutationCount;

	public HTMLCollection(INode root,Walker walker,IMatcher matcher,boolean includeRoot) {
		this( root , walker , matcher , includeRoot , TreewalkConfig.getDefault() );
	}

	public HTMLCollection(INode root,Walker walker,IMatcher matcher,boolean includeRoot,TreewalkConfig config)
	{
		Validate.notNull(walker , "walker must not be null");
		Validate.notNull(matcher , "matcher must not be null");
		Validate.notNull(config , "config must not be null");
		this.root = root;
		this.walker = walker;
		this.matcher = matcher;
		this.includeRoot = includeRoot;
		this.cursorCache = config.isCursorCache() && documentOf( root ) != null;
	}

	public INode getRoot() {
		return root;
	}

	public Walker getWalker() {
		return walker;
	}

	public IMatcher getMatcher() {
		return matcher;
	}

	public boolean isIncludeRoot() {
		return includeRoot;
	}

	private static Document documentOf(INode node)
	{
		if ( node == null ) {
			return null;
		}
		return node instanceof Document ? (Document) node : node.getOwnerDocument();
	}

	private INode start()
	{
		if ( root == null ) {
			return null;
		}
		if ( includeRoot ) {
			return root;
		}
		return walker.getNext( root , null );
	}

	private Element asMember(INode node)
	{
		if ( node.getNodeType() == NodeType.ELEMENT && matcher.matches( (Element) node ) ) {
			return (Element) node;
		}
		return null;
	}

	/**
	 * Counts the members by walking the whole tree.
	 *
	 * @return
	 */
	public int getLength()
	{
		int len = 0;
		for ( INode node = start() ; node != null ; node = walker.getNext( root , node ) )
		{
			if ( asMember( node ) != null ) {
				len++;
			}
		}
		return len;
	}

	public Element item(int index)
	{
		if ( root == null || index < 0 ) {
			return null;
		}

		int i = 0;
		INode node;
		if ( isCursorValid() && index >= cursorIndex ) {
			i = cursorIndex;
			node = cursorNode;
		} else {
			node = start();
		}

		for ( ; node != null ; node = walker.getNext( root , node ) )
		{
			final Element member = asMember( node );
			if ( member != null )
			{
				if ( i == index )
				{
					if ( cursorCache ) {
						cursorIndex = i;
						cursorNode = member;
						cursorDocument = documentOf( root );
						cursorMutationCount = cursorDocument.getMutationCount();
					}
					return member;
				}
				i++;
			}
		}
		return null;
	}

	private boolean isCursorValid()
	{
		if ( cursorNode == null ) {
			return false;
		}
		final Document doc = documentOf( root );
		if ( doc != cursorDocument || doc.getMutationCount() != cursorMutationCount )
		{
			LOG.debug("Tree changed, discarding cached position {} of {}", cursorIndex , this );
			cursorNode = null;
			cursorDocument = null;
			cursorIndex = -1;
			return false;
		}
		return true;
	}

	@Override
	public Element itemAt(int index) {
		return item( index );
	}

	/**
	 * Returns the first member whose <code>id</code> or <code>name</code> attribute equals
	 * the given name.
	 *
	 * @param name
	 * @return member or <code>null</code>
	 */
	public Element namedItem(String name)
	{
		if ( root == null || StringUtils.isEmpty( name ) ) {
			return null;
		}
		for ( INode node = start() ; node != null ; node = walker.getNext( root , node ) )
		{
			final Element member = asMember( node );
			if ( member != null )
			{
				if ( name.equals( member.getAttribute("id") ) || name.equals( member.getAttribute("name") ) ) {
					return member;
				}
			}
		}
		return null;
	}

	public boolean isEmpty() {
		return item( 0 ) == null;
	}

	public SequentialIterator<Element> newIterator() {
		return new SequentialIterator<>( this );
	}

	@Override
	public Iterator<Element> iterator() {
		return newIterator().asIterator();
	}

	@Override
	public String toString() {
		return "HTMLCollection[ root="+root+", walker="+walker+", matcher="+matcher+", includeRoot="+includeRoot+" ]";
	}
}
