package de.codesourcery.treewalk.dom;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang.ObjectUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.treewalk.exceptions.InUseAttributeException;
import de.codesourcery.treewalk.exceptions.NotFoundException;
import de.codesourcery.treewalk.iterator.IIndexedSource;
import de.codesourcery.treewalk.iterator.SequentialIterator;

/**
 * The live, insertion-ordered attribute list of an {@link Element}.
 *
 * <p>Iterators obtained from {@link #newIterator()} re-read this map on every step,
 * so attributes added or removed while iterating are seen (or missed) according
 * to their index.</p>
 */
public class NamedNodeMap implements IIndexedSource<Attribute>, Iterable<Attribute> {

	private final Element owner;
	private final List<Attribute> attributes = new ArrayList<>();

	protected NamedNodeMap(Element owner) {
		this.owner = owner;
	}

	public Element getOwnerElement() {
		return owner;
	}

	public int getLength() {
		return attributes.size();
	}

	public boolean isEmpty() {
		return attributes.isEmpty();
	}

	public Attribute item(int index)
	{
		if ( index < 0 || index >= attributes.size() ) {
			return null;
		}
		return attributes.get( index );
	}

	@Override
	public Attribute itemAt(int index) {
		return item( index );
	}

	public Attribute getNamedItem(String qualifiedName)
	{
		final String name = owner.normalizeAttributeName( qualifiedName );
		for ( final Attribute attr : attributes )
		{
			if ( attr.getName().equals( name ) ) {
				return attr;
			}
		}
		return null;
	}

	public Attribute getNamedItemNS(String namespaceURI,String localName)
	{
		for ( final Attribute attr : attributes )
		{
			if ( ObjectUtils.equals( namespaceURI , attr.getNamespaceURI() ) && attr.getLocalName().equals( localName ) ) {
				return attr;
			}
		}
		return null;
	}

	/**
	 * Adds an attribute, replacing any attribute with the same namespace and local name.
	 *
	 * @param attr
	 * @return the replaced attribute or <code>null</code>
	 * @throws InUseAttributeException if the attribute belongs to another element
	 */
	public Attribute setNamedItem(Attribute attr) throws InUseAttributeException
	{
		Validate.notNull(attr , "attribute must not be null");
		return setAttribute( attr , getNamedItemNS( attr.getNamespaceURI() , attr.getLocalName() ) );
	}

	public Attribute setNamedItemNS(Attribute attr) throws InUseAttributeException {
		return setNamedItem( attr );
	}

	private Attribute setAttribute(Attribute attr,Attribute existing)
	{
		if ( attr.getOwnerElement() != null && attr.getOwnerElement() != owner ) {
			throw new InUseAttributeException( attr );
		}
		if ( existing == attr ) {
			return attr;
		}
		if ( existing != null )
		{
			attributes.set( attributes.indexOf( existing ) , attr );
			existing.setOwnerElement( null );
		} else {
			attributes.add( attr );
		}
		attr.setOwnerElement( owner );
		attr.adopt( owner.getOwnerDocument() );
		owner.treeChanged();
		return existing;
	}

	public Attribute removeNamedItem(String qualifiedName) throws NotFoundException
	{
		final Attribute attr = getNamedItem( qualifiedName );
		if ( attr == null ) {
			throw NotFoundException.noSuchAttribute( owner , qualifiedName );
		}
		return remove( attr );
	}

	public Attribute removeNamedItemNS(String namespaceURI,String localName) throws NotFoundException
	{
		final Attribute attr = getNamedItemNS( namespaceURI , localName );
		if ( attr == null ) {
			throw NotFoundException.noSuchAttribute( owner , localName );
		}
		return remove( attr );
	}

	private Attribute remove(Attribute attr)
	{
		attributes.remove( attr );
		attr.setOwnerElement( null );
		owner.treeChanged();
		return attr;
	}

	public SequentialIterator<Attribute> newIterator() {
		return new SequentialIterator<>( this );
	}

	@Override
	public Iterator<Attribute> iterator() {
		return newIterator().asIterator();
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder();
		for ( final Attribute attr : attributes )
		{
			if ( buffer.length() > 0 ) {
				buffer.append(" ");
			}
			buffer.append( attr );
		}
		return buffer.toString();
	}
}
