package de.codesourcery.treewalk.exceptions;

import de.codesourcery.treewalk.dom.INode;

public class HierarchyRequestException extends DOMException {

	public final INode parent;
	public final INode child;

	public HierarchyRequestException(String message,INode parent,INode child)
	{
		super(message+": "+child+" cannot become a child of "+parent, HIERARCHY_REQUEST_ERR);
		this.parent = parent;
		this.child = child;
	}
}
