package org.lokray.scad.error;

import org.junit.jupiter.api.Test;
import org.lokray.scad.ast.Position;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ParserErrorTest
{
	private static final String SOURCE = "x = 1;\ncube(10)\nsphere(2);";

	@Test
	void factoriesPickCodesAndSeverity()
	{
		assertThat(SyntaxError.missingSemicolon(SOURCE, new Position(1, 8, 15)).getCode()).isEqualTo(ErrorCode.MISSING_SEMICOLON);
		assertThat(SyntaxError.unmatchedToken("[", "]", SOURCE, new Position(0, 0, 0)).getCode()).isEqualTo(ErrorCode.UNCLOSED_BRACKET);
		assertThat(SyntaxError.unmatchedToken("{", "}", SOURCE, new Position(0, 0, 0)).getCode()).isEqualTo(ErrorCode.UNCLOSED_BRACE);
		assertThat(SyntaxError.unmatchedToken("(", ")", SOURCE, new Position(0, 0, 0)).getCode()).isEqualTo(ErrorCode.UNCLOSED_PAREN);
		assertThat(SyntaxError.invalidCharacter("@", SOURCE, new Position(0, 0, 0)).getSeverity()).isEqualTo(Severity.ERROR);
		assertThat(SemanticError.undefinedVariable("w", SOURCE, new Position(0, 0, 0)).getSeverity()).isEqualTo(Severity.WARNING);
	}

	@Test
	void baseMessageAndSuggestions()
	{
		SyntaxError error = SyntaxError.unexpectedToken("}", ";", SOURCE, new Position(0, 0, 0));

		assertThat(error.getBaseMessage()).isEqualTo("Unexpected token '}', expected ';'");
		assertThat(error.getSuggestions()).singleElement()
				.satisfies(suggestion -> assertThat(suggestion.getReplacement()).contains(";"));
	}

	@Test
	void formattedMessagePointsAtTheColumn()
	{
		SyntaxError error = SyntaxError.missingSemicolon(SOURCE, new Position(1, 8, 15));

		String formatted = error.getFormattedMessage();

		assertThat(error.getSourceLine()).isEqualTo("cube(10)");
		assertThat(formatted).contains("cube(10)\n        ^\n");
		assertThat(formatted).contains("Suggestions:\n1. Add a semicolon at the end of the statement\n   Try: ;\n");
	}

	@Test
	void sourceLineOutsideTheTextIsEmpty()
	{
		SyntaxError error = SyntaxError.unexpectedEndOfInput("}", SOURCE, new Position(9, 0, SOURCE.length()));

		assertThat(error.getSourceLine()).isEmpty();
	}

	@Test
	void undefinedVariableListsCandidates()
	{
		SemanticError error = SemanticError.undefinedVariable("widht", List.of("width"), SOURCE, new Position(0, 0, 0));

		assertThat(error.getCode()).isEqualTo(ErrorCode.UNDEFINED_VARIABLE);
		assertThat(error.getSuggestions()).extracting(ErrorSuggestion::getMessage).anyMatch(message -> message.contains("width"));
	}

	@Test
	void diagnosticsSortBySeverity()
	{
		Diagnostics diagnostics = new Diagnostics();
		diagnostics.report(SyntaxError.missingSemicolon(SOURCE, new Position(1, 8, 15)));
		diagnostics.report(SemanticError.undefinedVariable("w", SOURCE, new Position(0, 0, 0)));

		assertThat(diagnostics.hasErrors()).isTrue();
		assertThat(diagnostics.hasWarnings()).isTrue();
		assertThat(diagnostics.getProblems(SemanticError.class)).hasSize(1);

		diagnostics.clear();
		assertThat(diagnostics.getProblems()).isEmpty();
	}
}
