package de.codesourcery.treewalk.traversal;

import de.codesourcery.treewalk.dom.INode;

public final class NodeFilter
{
	public static enum FilterResult
	{
		ACCEPT(1),
		REJECT(2),
		SKIP(3);

		public final int code;

		private FilterResult(int code) {
			this.code = code;
		}
	}

	public static final int SHOW_ALL = 0xFFFFFFFF;
	public static final int SHOW_ELEMENT = 0x1;
	public static final int SHOW_ATTRIBUTE = 0x2;
	public static final int SHOW_TEXT = 0x4;
	public static final int SHOW_CDATA_SECTION = 0x8;
	public static final int SHOW_ENTITY_REFERENCE = 0x10;
	public static final int SHOW_ENTITY = 0x20;
	public static final int SHOW_PROCESSING_INSTRUCTION = 0x40;
	public static final int SHOW_COMMENT = 0x80;
	public static final int SHOW_DOCUMENT = 0x100;
	public static final int SHOW_DOCUMENT_TYPE = 0x200;
	public static final int SHOW_DOCUMENT_FRAGMENT = 0x400;
	public static final int SHOW_NOTATION = 0x800;

	private NodeFilter() {
	}

	/**
	 * Checks a node against a type mask and an optional filter.
	 *
	 * @param whatToShow bit mask of <code>SHOW_*</code> constants
	 * @param filter filter to consult for nodes whose type is shown, may be <code>null</code>
	 * @param node
	 * @return {@link FilterResult#REJECT} if the node's type is not shown, otherwise the filter's verdict
	 * ({@link FilterResult#ACCEPT} if there is no filter)
	 */
	public static FilterResult verify(int whatToShow,INodeFilter filter,INode node)
	{
		if ( ( whatToShow & node.getNodeType().getShowMask() ) == 0 ) {
			return FilterResult.REJECT;
		}
		if ( filter == null ) {
			return FilterResult.ACCEPT;
		}
		final FilterResult result = filter.acceptNode( node );
		return result == null ? FilterResult.REJECT : result;
	}
}
