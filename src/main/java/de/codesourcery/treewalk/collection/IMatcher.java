package de.codesourcery.treewalk.collection;

import de.codesourcery.treewalk.dom.Element;

/**
 * Decides which elements are members of an {@link HTMLCollection}.
 */
@FunctionalInterface
public interface IMatcher
{
	public boolean matches(Element element);
}
