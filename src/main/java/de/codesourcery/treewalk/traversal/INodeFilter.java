package de.codesourcery.treewalk.traversal;

import de.codesourcery.treewalk.dom.INode;
import de.codesourcery.treewalk.traversal.NodeFilter.FilterResult;

@FunctionalInterface
public interface INodeFilter
{
	public FilterResult acceptNode(INode node);
}
