package org.lokray.scad.cst;

import org.junit.jupiter.api.Test;
import org.lokray.scad.error.SyntaxError;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class CstParserTest
{
	private final CstParser parser = new CstParser();

	@Test
	void statementsAreRootChildren()
	{
		CstParseResult result = parser.parse("cube(1);\nx = 2;");

		CstNode root = result.getRoot();
		assertThat(root.getType()).isEqualTo("source_file");
		assertThat(root.getChildren()).extracting(CstNode::getType).containsExactly("statement", "statement");
		assertThat(root.getChild(1).getStartPosition()).isEqualTo(new CstPoint(1, 0));
		assertThat(result.hasErrors()).isFalse();
	}

	@Test
	void namedChildrenAndFields()
	{
		CstNode call = parser.parse("cube(size = 2);").getRoot().getChild(0).getNamedChildren().get(0);

		assertThat(call.getType()).isEqualTo("module_instantiation");
		assertThat(call.getChildForFieldName("name").getText()).isEqualTo("cube");
		assertThat(call.getChildForFieldName("nonexistent")).isNull();
	}

	@Test
	void syntaxErrorsAreMarkedInTheTree()
	{
		CstParseResult result = parser.parse("sphere(5);\ncube([10,10,10);");

		assertThat(result.hasErrors()).isTrue();
		assertThat(result.getRoot().getChild(0).hasError()).isFalse();
		assertThat(result.getRoot().hasError()).isTrue();
		assertThat(result.getSyntaxErrors().get(0).getPosition().getLine()).isEqualTo(1);
	}

	@Test
	void parseFromKeepsAbsoluteOffsets()
	{
		String text = "cube(1);\nsphere(2);";

		CstParseResult tail = parser.parseFrom(text, 9);

		assertThat(tail.getRoot().getChildCount()).isEqualTo(1);
		CstNode sphere = tail.getRoot().getChild(0);
		assertThat(sphere.getStartIndex()).isEqualTo(9);
		assertThat(sphere.getStartPosition()).isEqualTo(new CstPoint(1, 0));
		assertThat(sphere.getText()).isEqualTo("sphere(2);");
	}

	@Test
	void reparseGraftsKeptChildren()
	{
		CstParseResult previous = parser.parse("cube(1);\nsphere(2);");
		CstNode kept = previous.getRoot().getChild(0);
		String edited = "cube(1);\nsphere(3);";

		CstParseResult reparsed = parser.reparse(previous, 1, edited);

		assertThat(reparsed.getRoot().getChild(0)).isSameAs(kept);
		assertThat(reparsed.getRoot().getChild(1).getText()).isEqualTo("sphere(3);");
		assertThat(reparsed.getRoot().toSExpression()).isEqualTo(parser.parse(edited).getRoot().toSExpression());
	}

	@Test
	void descendantForIndexFindsTheLeaf()
	{
		CstNode root = parser.parse("width = 3;").getRoot();

		assertThat(root.descendantForIndex(2).getText()).isEqualTo("width");
	}

	@Test
	void standaloneExpression()
	{
		CstParseResult result = parser.parseExpression("a + 1");

		assertThat(result.hasErrors()).isFalse();
		assertThat(result.getRoot().getText()).contains("a + 1");
	}

	@Test
	void statementRangesSplitAtTopLevelTerminators()
	{
		String text = "a = [1; 2];\nif (a) { cube(1); } else { sphere(1); }\ninclude <lib.scad>\nmodule m() { cube(2); }\nx";

		List<String> pieces = CstParser.statementRanges(text, 0).stream()
				.map(range -> text.substring(range[0], range[1]).trim())
				.collect(Collectors.toList());

		assertThat(pieces).containsExactly("a = [1; 2];", "if (a) { cube(1); } else { sphere(1); }",
				"include <lib.scad>", "module m() { cube(2); }", "x");
	}

	@Test
	void tooDeepStatementBecomesAnErrorNodeBetweenItsNeighbours()
	{
		String text = "cube(1);\nx = " + "1+".repeat(50000) + "1;\nsphere(2);";

		CstParseResult result = parser.parse(text);
		CstNode root = result.getRoot();

		assertThat(root.getStartIndex()).isZero();
		assertThat(root.getEndIndex()).isEqualTo(text.length());
		assertThat(root.getChild(0).getText()).isEqualTo("cube(1);");
		assertThat(root.getChild(root.getChildCount() - 1).getText()).isEqualTo("sphere(2);");
		assertThat(result.hasErrors()).isTrue();
	}

	@Test
	void expectedSetPrefersClosingTokens()
	{
		assertThat(SyntaxErrorListener.expectedToken("{'let', 'each', '(', ')'}")).isEqualTo(")");
		assertThat(SyntaxErrorListener.expectedToken("{'if', ';', '}'}")).isEqualTo(";");
		assertThat(SyntaxErrorListener.expectedToken("{'let', '(', NUMBER}")).isNull();
		assertThat(SyntaxErrorListener.expectedToken("{IDENTIFIER}")).isEqualTo("IDENTIFIER");
		assertThat(SyntaxErrorListener.expectedToken("';'")).isEqualTo(";");
	}

	@Test
	void strayOperatorInArgumentsDoesNotSuggestAKeyword()
	{
		CstParseResult result = parser.parse("cube(> 10);");

		assertThat(result.getSyntaxErrors()).isNotEmpty();
		assertThat(result.getSyntaxErrors()).extracting(SyntaxError::getBaseMessage)
				.noneMatch(message -> message.contains("'let'"));
	}
}
