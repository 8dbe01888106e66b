package de.codesourcery.treewalk.exceptions;

import de.codesourcery.treewalk.dom.Attribute;

public class InUseAttributeException extends DOMException {

	public final Attribute attribute;

	public InUseAttributeException(Attribute attribute)
	{
		super("Attribute "+attribute+" is already owned by "+attribute.getOwnerElement(), INUSE_ATTRIBUTE_ERR);
		this.attribute = attribute;
	}
}
