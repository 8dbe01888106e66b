package de.codesourcery.treewalk.dom;

public class Text extends CharacterData {

	protected Text(Document ownerDocument,String data) {
		super(ownerDocument,data);
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.TEXT;
	}

	@Override
	public String getNodeName() {
		return "#text";
	}
}
