package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.ModuleParameter;
import org.lokray.scad.builder.BuildContext;
import org.lokray.scad.cst.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared parameters of a module or function, with defaults folded where they are constant.
 */
public final class ModuleParameterExtractor
{
	private ModuleParameterExtractor()
	{
	}

	public static List<ModuleParameter> extract(CstNode parameterList, BuildContext context)
	{
		List<ModuleParameter> parameters = new ArrayList<>();
		if (parameterList == null)
		{
			return parameters;
		}
		for (CstNode declaration : parameterList.getNamedChildren())
		{
			CstNode name = declaration.getChildForFieldName("name");
			if (!"parameter_declaration".equals(declaration.getType()) || name == null || name.isMissing())
			{
				continue;
			}
			CstNode defaultNode = declaration.getChildForFieldName("default");
			parameters.add(new ModuleParameter(name.getText(), LocationMapper.map(name),
					ValueExtractor.extract(defaultNode, context).orElse(null),
					defaultNode == null ? null : context.getExpressions().build(defaultNode)));
		}
		return parameters;
	}
}
