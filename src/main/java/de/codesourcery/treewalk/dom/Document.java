package de.codesourcery.treewalk.dom;

import java.util.List;
import java.util.Locale;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.treewalk.TreewalkConfig;
import de.codesourcery.treewalk.collection.HTMLCollection;
import de.codesourcery.treewalk.collection.HTMLCollections;
import de.codesourcery.treewalk.exceptions.HierarchyRequestException;
import de.codesourcery.treewalk.traversal.INodeFilter;
import de.codesourcery.treewalk.traversal.NodeIterator;
import de.codesourcery.treewalk.traversal.TreeWalker;
import de.codesourcery.treewalk.traversal.Walker;

/**
 * Root of a document tree and factory for all other node types.
 *
 * <p>The document counts every structural change (child insertion or removal,
 * attribute changes) made to nodes it owns, see {@link #getMutationCount()}.
 * Live collections use this counter to decide whether cached positions are
 * still valid.</p>
 */
public class Document extends AbstractNode {

	private static final Logger LOG = LoggerFactory.getLogger(Document.class);

	private final TreewalkConfig config;
	private long mutationCount;

	public Document() {
		this( TreewalkConfig.getDefault() );
	}

	public Document(TreewalkConfig config)
	{
		super(null);
		Validate.notNull(config , "config must not be null");
		this.config = config;
	}

	public TreewalkConfig getConfig() {
		return config;
	}

	@Override
	protected Document getTreeDocument() {
		return this;
	}

	public long getMutationCount() {
		return mutationCount;
	}

	void incrementMutationCount() {
		mutationCount++;
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.DOCUMENT;
	}

	@Override
	public String getNodeName() {
		return "#document";
	}

	@Override
	public String getTextContent() {
		return null;
	}

	@Override
	protected void checkChildAllowed(INode child) throws HierarchyRequestException
	{
		switch( child.getNodeType() )
		{
			case TEXT:
			case CDATA_SECTION:
				throw new HierarchyRequestException("Documents cannot contain text", this , child );
			case ELEMENT:
				final Element root = getDocumentElement();
				if ( root != null && root != child ) {
					throw new HierarchyRequestException("Document already has a document element", this , child );
				}
				break;
			case DOCUMENT_TYPE:
				final DocumentType doctype = getDoctype();
				if ( doctype != null && doctype != child ) {
					throw new HierarchyRequestException("Document already has a doctype", this , child );
				}
				break;
			default:
		}
	}

	@Override
	protected void checkChildrenAllowed(List<INode> newChildren) throws HierarchyRequestException
	{
		super.checkChildrenAllowed( newChildren );
		int elements = 0;
		int doctypes = 0;
		for ( final INode n : newChildren )
		{
			if ( n.getNodeType() == NodeType.ELEMENT && ++elements > 1 ) {
				throw new HierarchyRequestException("Document can only have one document element", this , n );
			}
			if ( n.getNodeType() == NodeType.DOCUMENT_TYPE && ++doctypes > 1 ) {
				throw new HierarchyRequestException("Document can only have one doctype", this , n );
			}
		}
	}

	public Element getDocumentElement() {
		return (Element) firstChildOfType( NodeType.ELEMENT );
	}

	public DocumentType getDoctype() {
		return (DocumentType) firstChildOfType( NodeType.DOCUMENT_TYPE );
	}

	private INode firstChildOfType(NodeType type)
	{
		for ( INode n = Walker.CHILDREN.getNext( this , null ) ; n != null ; n = Walker.CHILDREN.getNext( this , n ) )
		{
			if ( n.getNodeType() == type ) {
				return n;
			}
		}
		return null;
	}

	// factory methods

	public Element createElement(String localName) {
		return new Element( this , Element.HTML_NAMESPACE , Names.validate( localName ).toLowerCase( Locale.ROOT ) );
	}

	public Element createElementNS(String namespaceURI,String qualifiedName) {
		return new Element( this , namespaceURI , qualifiedName );
	}

	public Text createTextNode(String data) {
		return new Text( this , data );
	}

	public Comment createComment(String data) {
		return new Comment( this , data );
	}

	public CDataSection createCDATASection(String data) {
		return new CDataSection( this , data );
	}

	public ProcessingInstruction createProcessingInstruction(String target,String data) {
		return new ProcessingInstruction( this , target , data );
	}

	public DocumentFragment createDocumentFragment() {
		return new DocumentFragment( this );
	}

	public DocumentType createDocumentType(String name,String publicId,String systemId) {
		return new DocumentType( this , name , publicId , systemId );
	}

	public Attribute createAttribute(String localName) {
		return new Attribute( this , null , null , Names.validate( localName ).toLowerCase( Locale.ROOT ) , "" );
	}

	public Attribute createAttributeNS(String namespaceURI,String qualifiedName)
	{
		final String[] parts = Names.splitQualifiedName( qualifiedName );
		return new Attribute( this , namespaceURI , parts[0] , parts[1] , "" );
	}

	// traversal

	public NodeIterator createNodeIterator(INode root,int whatToShow,INodeFilter filter) {
		return new NodeIterator( root , whatToShow , filter );
	}

	public TreeWalker createTreeWalker(INode root,int whatToShow,INodeFilter filter) {
		return new TreeWalker( root , whatToShow , filter );
	}

	// live collections

	public HTMLCollection getElementsByTagName(String tagName) {
		return HTMLCollections.byTagName( this , tagName , true );
	}

	public HTMLCollection getElementsByClassName(String classNames) {
		return HTMLCollections.byClassName( this , classNames , true );
	}

	public HTMLCollection getElementsByName(String name) {
		return HTMLCollections.byName( this , name , true );
	}

	public HTMLCollection getLinks() {
		return HTMLCollections.links( this , true );
	}

	public HTMLCollection getAnchors() {
		return HTMLCollections.anchors( this , true );
	}

	public HTMLCollection getChildren() {
		return HTMLCollections.children( this );
	}

	@Override
	protected boolean hasEqualProperties(INode other)
	{
		if ( config.isCompareDocuments() ) {
			return hasEqualChildren( other );
		}
		LOG.warn("isEqualNode(): structural comparison of documents is disabled, treating {} and {} as different", this , other );
		return false;
	}
}
