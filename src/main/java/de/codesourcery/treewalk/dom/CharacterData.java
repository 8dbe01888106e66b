package de.codesourcery.treewalk.dom;

import org.apache.commons.lang.ObjectUtils;

public abstract class CharacterData extends AbstractNode {

	private String data;

	protected CharacterData(Document ownerDocument,String data)
	{
		super(ownerDocument);
		this.data = data == null ? "" : data;
	}

	public String getData() {
		return data;
	}

	public void setData(String data) {
		this.data = data == null ? "" : data;
	}

	public void appendData(String s) {
		setData( data + (s == null ? "" : s) );
	}

	public int getLength() {
		return data.length();
	}

	@Override
	public String getTextContent() {
		return data;
	}

	@Override
	protected final boolean canHaveChildren() {
		return false;
	}

	@Override
	protected boolean hasEqualProperties(INode other) {
		return ObjectUtils.equals( data , ((CharacterData) other).data );
	}

	@Override
	public String toString() {
		return getNodeName()+" \""+data+"\"";
	}
}
