package de.codesourcery.treewalk.dom;

import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.treewalk.exceptions.InvalidCharacterException;

public final class Names {

	private static final Pattern NAME_PATTERN = Pattern.compile("^[\\p{L}_:][\\p{L}\\p{N}_:.\\-]*$");

	private Names() {
	}

	public static boolean isValidName(String s) {
		return s != null && NAME_PATTERN.matcher( s ).matches();
	}

	public static String validate(String name)
	{
		if ( ! isValidName( name ) ) {
			throw new InvalidCharacterException( name );
		}
		return name;
	}

	/**
	 * Splits a qualified name into prefix and local name.
	 *
	 * @param qualifiedName
	 * @return two-element array, prefix is <code>null</code> if the name has none
	 */
	public static String[] splitQualifiedName(String qualifiedName)
	{
		validate( qualifiedName );
		final int idx = qualifiedName.indexOf(':');
		if ( idx <= 0 ) {
			return new String[] { null , qualifiedName };
		}
		final String prefix = qualifiedName.substring( 0 , idx );
		final String localName = qualifiedName.substring( idx+1 );
		if ( StringUtils.isEmpty( localName ) || localName.indexOf(':') != -1 ) {
			throw new InvalidCharacterException( qualifiedName );
		}
		return new String[] { prefix , localName };
	}

	public static String qualifiedName(String prefix,String localName) {
		return prefix == null ? localName : prefix+":"+localName;
	}
}
