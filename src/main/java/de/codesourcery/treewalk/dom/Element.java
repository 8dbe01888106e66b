package de.codesourcery.treewalk.dom;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang.ObjectUtils;
import org.apache.commons.lang.StringUtils;

import de.codesourcery.treewalk.collection.HTMLCollection;
import de.codesourcery.treewalk.collection.HTMLCollections;

public class Element extends AbstractNode {

	public static final String HTML_NAMESPACE = "http://www.w3.org/1999/xhtml";

	private final String namespaceURI;
	private final String prefix;
	private final String localName;
	private final NamedNodeMap attributes = new NamedNodeMap(this);

	protected Element(Document ownerDocument,String namespaceURI,String qualifiedName)
	{
		super(ownerDocument);
		final String[] parts = Names.splitQualifiedName( qualifiedName );
		this.namespaceURI = namespaceURI;
		this.prefix = parts[0];
		this.localName = parts[1];
	}

	@Override
	void adopt(Document doc)
	{
		super.adopt( doc );
		for ( final Attribute attr : attributes ) {
			attr.adopt( doc );
		}
	}

	public boolean isHtmlElement() {
		return HTML_NAMESPACE.equals( namespaceURI );
	}

	public String getNamespaceURI() {
		return namespaceURI;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getLocalName() {
		return localName;
	}

	public String getTagName()
	{
		final String name = Names.qualifiedName( prefix , localName );
		return isHtmlElement() ? name.toUpperCase( Locale.ROOT ) : name;
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.ELEMENT;
	}

	@Override
	public String getNodeName() {
		return getTagName();
	}

	String normalizeAttributeName(String name) {
		return isHtmlElement() && name != null ? name.toLowerCase( Locale.ROOT ) : name;
	}

	public NamedNodeMap getAttributes() {
		return attributes;
	}

	public boolean hasAttributes() {
		return ! attributes.isEmpty();
	}

	public Attribute getAttributeNode(String name) {
		return attributes.getNamedItem( name );
	}

	public String getAttribute(String name)
	{
		final Attribute attr = attributes.getNamedItem( name );
		return attr == null ? null : attr.getValue();
	}

	public String getAttributeNS(String namespaceURI,String localName)
	{
		final Attribute attr = attributes.getNamedItemNS( namespaceURI , localName );
		return attr == null ? null : attr.getValue();
	}

	public boolean hasAttribute(String name) {
		return attributes.getNamedItem( name ) != null;
	}

	public void setAttribute(String name,String value)
	{
		final String normalized = normalizeAttributeName( Names.validate( name ) );
		final Attribute existing = attributes.getNamedItem( normalized );
		if ( existing != null ) {
			existing.setValue( value );
			return;
		}
		attributes.setNamedItem( new Attribute( getOwnerDocument() , null , null , normalized , value ) );
	}

	public void setAttributeNS(String namespaceURI,String qualifiedName,String value)
	{
		final String[] parts = Names.splitQualifiedName( qualifiedName );
		final Attribute existing = attributes.getNamedItemNS( namespaceURI , parts[1] );
		if ( existing != null ) {
			existing.setValue( value );
			return;
		}
		attributes.setNamedItem( new Attribute( getOwnerDocument() , namespaceURI , parts[0] , parts[1] , value ) );
	}

	public void removeAttribute(String name)
	{
		if ( hasAttribute( name ) ) {
			attributes.removeNamedItem( name );
		}
	}

	public String getId() {
		return StringUtils.defaultString( getAttribute("id") );
	}

	public String getClassName() {
		return StringUtils.defaultString( getAttribute("class") );
	}

	public List<String> getClassList() {
		return Arrays.asList( StringUtils.split( getClassName() ) );
	}

	public boolean hasClass(String className) {
		return getClassList().contains( className );
	}

	public HTMLCollection getElementsByTagName(String tagName) {
		return HTMLCollections.byTagName( this , tagName , false );
	}

	public HTMLCollection getElementsByClassName(String classNames) {
		return HTMLCollections.byClassName( this , classNames , false );
	}

	public HTMLCollection getChildren() {
		return HTMLCollections.children( this );
	}

	@Override
	protected boolean hasEqualProperties(INode other)
	{
		final Element that = (Element) other;
		if ( ! ObjectUtils.equals( namespaceURI , that.namespaceURI ) ||
			 ! ObjectUtils.equals( prefix , that.prefix ) ||
			 ! localName.equals( that.localName ) ||
			 attributes.getLength() != that.attributes.getLength() )
		{
			return false;
		}
		for ( final Attribute attr : attributes )
		{
			final Attribute match = that.attributes.getNamedItemNS( attr.getNamespaceURI() , attr.getLocalName() );
			if ( ! attr.isEqualNode( match ) ) {
				return false;
			}
		}
		return hasEqualChildren( other );
	}

	@Override
	public String toString()
	{
		final String attrs = attributes.toString();
		return "<"+getTagName()+( attrs.isEmpty() ? "" : " "+attrs )+">";
	}
}
