package de.codesourcery.treewalk.exceptions;

import de.codesourcery.treewalk.dom.INode;

public class NotFoundException extends DOMException {

	public final INode node;

	public NotFoundException(String message,INode node)
	{
		super(message,NOT_FOUND_ERR);
		this.node = node;
	}

	public static NotFoundException notAChild(INode parent,INode child) {
		return new NotFoundException( child+" is not a child of "+parent , child );
	}

	public static NotFoundException noSuchAttribute(INode owner,String name) {
		return new NotFoundException( "No attribute '"+name+"' on "+owner , owner );
	}
}
