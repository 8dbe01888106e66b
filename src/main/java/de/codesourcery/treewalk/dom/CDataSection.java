package de.codesourcery.treewalk.dom;

public class CDataSection extends Text {

	protected CDataSection(Document ownerDocument,String data) {
		super(ownerDocument,data);
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.CDATA_SECTION;
	}

	@Override
	public String getNodeName() {
		return "#cdata-section";
	}
}
