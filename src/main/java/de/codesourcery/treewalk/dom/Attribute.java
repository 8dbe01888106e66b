package de.codesourcery.treewalk.dom;

import org.apache.commons.lang.ObjectUtils;

public class Attribute extends AbstractNode {

	private final String namespaceURI;
	private final String prefix;
	private final String localName;
	private String value;
	private Element ownerElement;

	protected Attribute(Document ownerDocument,String namespaceURI,String prefix,String localName,String value)
	{
		super(ownerDocument);
		this.namespaceURI = namespaceURI;
		this.prefix = prefix;
		this.localName = Names.validate( localName );
		this.value = value == null ? "" : value;
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

	public String getName() {
		return Names.qualifiedName( prefix , localName );
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value)
	{
		this.value = value == null ? "" : value;
		if ( ownerElement != null ) {
			treeChanged();
		}
	}

	public Element getOwnerElement() {
		return ownerElement;
	}

	void setOwnerElement(Element ownerElement) {
		this.ownerElement = ownerElement;
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.ATTRIBUTE;
	}

	@Override
	public String getNodeName() {
		return getName();
	}

	@Override
	public String getTextContent() {
		return value;
	}

	@Override
	protected boolean canHaveChildren() {
		return false;
	}

	@Override
	protected boolean hasEqualProperties(INode other)
	{
		final Attribute that = (Attribute) other;
		return ObjectUtils.equals( namespaceURI , that.namespaceURI ) &&
				localName.equals( that.localName ) &&
				value.equals( that.value );
	}

	@Override
	public String toString() {
		return getName()+"=\""+value+"\"";
	}
}
