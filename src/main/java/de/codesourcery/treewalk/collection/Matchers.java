package de.codesourcery.treewalk.collection;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.treewalk.dom.Element;

public final class Matchers
{
	private static final IMatcher MATCH_TRUE = new IMatcher()
	{
		@Override
		public boolean matches(Element element) {
			return true;
		}

		@Override
		public String toString() {
			return "true";
		}
	};

	private static final IMatcher MATCH_FALSE = new IMatcher()
	{
		@Override
		public boolean matches(Element element) {
			return false;
		}

		@Override
		public String toString() {
			return "false";
		}
	};

	private Matchers() {
	}

	public static IMatcher matchTrue() {
		return MATCH_TRUE;
	}

	public static IMatcher matchFalse() {
		return MATCH_FALSE;
	}

	/**
	 * Matches elements by tag name, ignoring case. <code>*</code> matches every element.
	 *
	 * @param tagName
	 * @return
	 */
	public static IMatcher byTagName(String tagName)
	{
		Validate.notNull(tagName , "tag name must not be null");
		return new ByTagName( tagName );
	}

	/**
	 * Matches elements that carry all of the given space-separated classes.
	 *
	 * @param classNames
	 * @return
	 */
	public static IMatcher byClassName(String classNames)
	{
		Validate.notNull(classNames , "class names must not be null");
		return new ByClassName( classNames );
	}

	public static IMatcher byName(String name)
	{
		Validate.notNull(name , "name must not be null");
		return new ByName( name );
	}

	/**
	 * Matches <code>a</code> and <code>area</code> elements with a <code>href</code> attribute.
	 *
	 * @return
	 */
	public static IMatcher links() {
		return ByLinks.INSTANCE;
	}

	/**
	 * Matches <code>a</code> elements with a <code>name</code> attribute.
	 *
	 * @return
	 */
	public static IMatcher anchors() {
		return ByAnchors.INSTANCE;
	}

	private static final class ByTagName implements IMatcher
	{
		private final String tag;
		private final boolean isWildcard;

		public ByTagName(String tag)
		{
			this.tag = tag;
			this.isWildcard = "*".equals( tag );
		}

		@Override
		public boolean matches(Element element) {
			return isWildcard || tag.equalsIgnoreCase( element.getTagName() );
		}

		@Override
		public String toString() {
			return "tagName="+tag;
		}
	}

	private static final class ByClassName implements IMatcher
	{
		private final List<String> classNames;

		public ByClassName(String classNames) {
			this.classNames = Arrays.asList( StringUtils.split( classNames ) );
		}

		@Override
		public boolean matches(Element element)
		{
			if ( classNames.isEmpty() ) {
				return false;
			}
			return element.getClassList().containsAll( classNames );
		}

		@Override
		public String toString() {
			return "className="+StringUtils.join( classNames , ' ' );
		}
	}

	private static final class ByName implements IMatcher
	{
		private final String name;

		public ByName(String name) {
			this.name = name;
		}

		@Override
		public boolean matches(Element element) {
			return name.equals( element.getAttribute("name") );
		}

		@Override
		public String toString() {
			return "name="+name;
		}
	}

	private static final class ByLinks implements IMatcher
	{
		public static final ByLinks INSTANCE = new ByLinks();

		@Override
		public boolean matches(Element element)
		{
			final String tag = element.getLocalName();
			if ( ! "a".equalsIgnoreCase( tag ) && ! "area".equalsIgnoreCase( tag ) ) {
				return false;
			}
			return element.hasAttribute("href");
		}

		@Override
		public String toString() {
			return "links";
		}
	}

	private static final class ByAnchors implements IMatcher
	{
		public static final ByAnchors INSTANCE = new ByAnchors();

		@Override
		public boolean matches(Element element) {
			return "a".equalsIgnoreCase( element.getLocalName() ) && element.hasAttribute("name");
		}

		@Override
		public String toString() {
			return "anchors";
		}
	}
}
