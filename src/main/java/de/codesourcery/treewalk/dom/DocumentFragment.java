package de.codesourcery.treewalk.dom;

import de.codesourcery.treewalk.collection.HTMLCollection;
import de.codesourcery.treewalk.collection.HTMLCollections;

public class DocumentFragment extends AbstractNode {

	protected DocumentFragment(Document ownerDocument) {
		super(ownerDocument);
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.DOCUMENT_FRAGMENT;
	}

	@Override
	public String getNodeName() {
		return "#document-fragment";
	}

	public HTMLCollection getChildren() {
		return HTMLCollections.children( this );
	}

	@Override
	protected boolean hasEqualProperties(INode other) {
		return hasEqualChildren( other );
	}
}
