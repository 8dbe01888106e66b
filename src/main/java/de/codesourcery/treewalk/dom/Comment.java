package de.codesourcery.treewalk.dom;

public class Comment extends CharacterData {

	protected Comment(Document ownerDocument,String data) {
		super(ownerDocument,data);
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.COMMENT;
	}

	@Override
	public String getNodeName() {
		return "#comment";
	}

	@Override
	public String toString() {
		return "<!--"+getData()+"-->";
	}
}
