package org.lokray.scad.error;

import org.lokray.scad.ast.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Problems with meaning rather than structure. Reported as warnings: OpenSCAD itself
 * renders such files and only complains at evaluation time.
 */
public class SemanticError extends ParserError
{
	public SemanticError(String message, ErrorCode code, String source, Position position, List<ErrorSuggestion> suggestions)
	{
		super(message, code, Severity.WARNING, source, position, suggestions);
	}

	public static SemanticError undefinedVariable(String variableName, String source, Position position)
	{
		return undefinedVariable(variableName, List.of(), source, position);
	}

	/**
	 * @param candidates names close to {@code variableName}, offered first as "did you mean" fixes.
	 */
	public static SemanticError undefinedVariable(String variableName, List<String> candidates, String source, Position position)
	{
		List<ErrorSuggestion> suggestions = new ArrayList<>();
		for (String candidate : candidates)
		{
			suggestions.add(new ErrorSuggestion(String.format("Did you mean '%s'?", candidate), candidate));
		}
		suggestions.add(new ErrorSuggestion(String.format("Define the variable '%s' before using it", variableName),
				variableName + " = value; // Define the variable"));
		return new SemanticError(String.format("Undefined variable '%s'", variableName), ErrorCode.UNDEFINED_VARIABLE,
				source, position, suggestions);
	}

	public static SemanticError typeMismatch(String expectedType, String actualType, String source, Position position)
	{
		return new SemanticError(String.format("Type mismatch: expected '%s', got '%s'", expectedType, actualType),
				ErrorCode.TYPE_MISMATCH, source, position,
				List.of(new ErrorSuggestion(String.format("Convert the value to '%s'", expectedType))));
	}

	public static SemanticError invalidParameter(String paramName, String moduleName, String source, Position position)
	{
		return new SemanticError(String.format("Invalid parameter '%s' for module '%s'", paramName, moduleName),
				ErrorCode.INVALID_ARGUMENTS, source, position,
				List.of(new ErrorSuggestion(String.format("Check the documentation for valid parameters for '%s'", moduleName))));
	}

	public static SemanticError missingRequiredParameter(String paramName, String moduleName, String source, Position position)
	{
		return new SemanticError(String.format("Missing required parameter '%s' for module '%s'", paramName, moduleName),
				ErrorCode.MISSING_REQUIRED_PARAMETER, source, position,
				List.of(new ErrorSuggestion(String.format("Add the required parameter '%s'", paramName), paramName + "=value")));
	}
}
