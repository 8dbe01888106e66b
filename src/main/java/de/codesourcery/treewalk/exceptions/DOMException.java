package de.codesourcery.treewalk.exceptions;

/**
 * Base class for errors raised by tree mutations that violate the
 * DOM's structural rules.
 *
 * <p>The {@link #code} carries the legacy numeric DOM exception code.</p>
 */
public class DOMException extends RuntimeException {

	public static final int INVALID_CHARACTER_ERR = 5;
	public static final int HIERARCHY_REQUEST_ERR = 3;
	public static final int NOT_FOUND_ERR = 8;
	public static final int INUSE_ATTRIBUTE_ERR = 10;

	public final int code;

	public DOMException(String message,int code)
	{
		super(message);
		this.code = code;
	}
}
