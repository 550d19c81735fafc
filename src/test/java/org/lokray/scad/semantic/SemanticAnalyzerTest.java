package org.lokray.scad.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.scad.error.ErrorCode;
import org.lokray.scad.error.ParserError;
import org.lokray.scad.session.OpenScadParser;
import org.lokray.scad.util.ParserConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticAnalyzerTest
{
	private List<ErrorCode> problems(String text)
	{
		OpenScadParser session = new OpenScadParser(ParserConfig.defaults());
		session.parseToAST(text);
		return session.getDiagnostics().getProblems().stream().map(ParserError::getCode).toList();
	}

	@Test
	void cleanFileHasNoProblems()
	{
		assertThat(problems("size = 3; cube(size, center = true); cylinder(h = 2, r = 1, $fn = 30);")).isEmpty();
	}

	@Test
	void unknownNamedArgumentOfAPrimitive()
	{
		assertThat(problems("cube(sise = 3);")).containsExactly(ErrorCode.INVALID_ARGUMENTS);
		assertThat(problems("sphere(radius = 3);")).containsExactly(ErrorCode.INVALID_ARGUMENTS);
	}

	@Test
	void cylinderWithoutHeight()
	{
		assertThat(problems("cylinder(r = 3);")).containsExactly(ErrorCode.MISSING_REQUIRED_PARAMETER);
		assertThat(problems("cylinder(5, 1);")).isEmpty();
		assertThat(problems("h = 4; cylinder(h = h, r = 1);")).isEmpty();
	}

	@Test
	void undefinedVariable()
	{
		assertThat(problems("cube(side);")).containsExactly(ErrorCode.UNDEFINED_VARIABLE);
	}

	@Test
	void suggestionsAreCloseNames()
	{
		assertThat(SemanticAnalyzer.closest("widht", List.of("width", "height", "w"))).containsExactly("width");
		assertThat(SemanticAnalyzer.levenshtein("kitten", "sitting")).isEqualTo(3);
		assertThat(SemanticAnalyzer.levenshtein("", "abc")).isEqualTo(3);
	}
}
