package de.codesourcery.treewalk.dom;

public enum NodeType
{
	ELEMENT(1),
	ATTRIBUTE(2),
	TEXT(3),
	CDATA_SECTION(4),
	ENTITY_REFERENCE(5),
	ENTITY(6),
	PROCESSING_INSTRUCTION(7),
	COMMENT(8),
	DOCUMENT(9),
	DOCUMENT_TYPE(10),
	DOCUMENT_FRAGMENT(11),
	NOTATION(12);

	public final int code;

	private NodeType(int code) {
		this.code = code;
	}

	/**
	 * Returns the <code>whatToShow</code> bit that selects nodes of this type.
	 *
	 * @return
	 */
	public int getShowMask() {
		return 1 << (code-1);
	}

	public static NodeType fromCode(int code)
	{
		for ( final NodeType t : values() ) {
			if ( t.code == code ) {
				return t;
			}
		}
		throw new IllegalArgumentException("Unknown node type: "+code);
	}
}
