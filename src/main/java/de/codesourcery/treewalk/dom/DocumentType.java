package de.codesourcery.treewalk.dom;

import org.apache.commons.lang.StringUtils;

public class DocumentType extends AbstractNode {

	private final String name;
	private final String publicId;
	private final String systemId;

	protected DocumentType(Document ownerDocument,String name,String publicId,String systemId)
	{
		super(ownerDocument);
		this.name = Names.validate( name );
		this.publicId = StringUtils.defaultString( publicId );
		this.systemId = StringUtils.defaultString( systemId );
	}

	public String getName() {
		return name;
	}

	public String getPublicId() {
		return publicId;
	}

	public String getSystemId() {
		return systemId;
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.DOCUMENT_TYPE;
	}

	@Override
	public String getNodeName() {
		return name;
	}

	@Override
	public String getTextContent() {
		return null;
	}

	@Override
	protected boolean canHaveChildren() {
		return false;
	}

	@Override
	protected boolean hasEqualProperties(INode other)
	{
		final DocumentType that = (DocumentType) other;
		return name.equals( that.name ) && publicId.equals( that.publicId ) && systemId.equals( that.systemId );
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder("<!DOCTYPE ").append( name );
		if ( StringUtils.isNotEmpty( publicId ) ) {
			buffer.append(" PUBLIC \"").append( publicId ).append("\"");
		}
		if ( StringUtils.isNotEmpty( systemId ) ) {
			buffer.append(" \"").append( systemId ).append("\"");
		}
		return buffer.append(">").toString();
	}
}
