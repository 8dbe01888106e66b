package de.codesourcery.treewalk.exceptions;

public class InvalidCharacterException extends DOMException {

	public final String name;

	public InvalidCharacterException(String name)
	{
		super("Not a valid name: '"+name+"'", INVALID_CHARACTER_ERR);
		this.name = name;
	}
}
