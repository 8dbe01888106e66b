package de.codesourcery.treewalk.dom;

public class ProcessingInstruction extends CharacterData {

	private final String target;

	protected ProcessingInstruction(Document ownerDocument,String target,String data)
	{
		super(ownerDocument,data);
		this.target = Names.validate( target );
	}

	public String getTarget() {
		return target;
	}

	@Override
	public NodeType getNodeType() {
		return NodeType.PROCESSING_INSTRUCTION;
	}

	@Override
	public String getNodeName() {
		return target;
	}

	@Override
	protected boolean hasEqualProperties(INode other)
	{
		return target.equals( ((ProcessingInstruction) other).target ) && super.hasEqualProperties( other );
	}

	@Override
	public String toString() {
		return "<?"+target+" "+getData()+"?>";
	}
}
