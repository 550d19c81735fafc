package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.ast.SourceLocation;
import org.lokray.scad.builder.BuildContext;
import org.lokray.scad.cst.CstNode;

import java.util.List;

/**
 * The parts of a {@code module_instantiation} every call handler needs.
 */
public class CallSite
{
	private final CstNode node;
	private final String name;
	private final SourceLocation location;
	private final SourceLocation nameLocation;
	private final String modifier;
	private final List<Parameter> parameters;

	private CallSite(CstNode node, String name, SourceLocation location, SourceLocation nameLocation, String modifier,
					 List<Parameter> parameters)
	{
		this.node = node;
		this.name = name;
		this.location = location;
		this.nameLocation = nameLocation;
		this.modifier = modifier;
		this.parameters = parameters;
	}

	public static CallSite of(CstNode instantiation, BuildContext context)
	{
		CstNode nameNode = instantiation.getChildForFieldName("name");
		StringBuilder modifier = new StringBuilder();
		for (CstNode m : instantiation.getChildrenForFieldName("modifier"))
		{
			modifier.append(m.getText().trim());
		}
		return new CallSite(instantiation,
				nameNode == null ? "" : nameNode.getText(),
				LocationMapper.map(instantiation),
				nameNode == null ? null : LocationMapper.map(nameNode),
				modifier.toString(),
				ArgumentExtractor.extract(instantiation.getChildForFieldName("arguments"), context));
	}

	public CstNode getNode()
	{
		return node;
	}

	public String getName()
	{
		return name;
	}

	public SourceLocation getLocation()
	{
		return location;
	}

	public SourceLocation getNameLocation()
	{
		return nameLocation;
	}

	public String getModifier()
	{
		return modifier;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	/**
	 * The statement after the argument list: a block, a single child statement, or {@code null} for {@code ;}.
	 */
	public CstNode getBody()
	{
		return node.getChildForFieldName("body");
	}
}
