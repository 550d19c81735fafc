package org.lokray.scad.query;

import org.junit.jupiter.api.Test;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.cst.CstParser;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryCompilerTest
{
	private final QueryCompiler compiler = new QueryCompiler();
	private final CstParseResult tree = new CstParser().parse("""
			module peg(h = 5) { cylinder(h = h, r = 1); }
			function twice(x) = 2 * x;
			peg(twice(3));
			""");

	private List<String> captured(String query, String name)
	{
		return compiler.compile(query).captures(tree.getRoot()).stream()
				.filter(c -> c.getName().equals(name))
				.map(c -> c.getNode().getText())
				.toList();
	}

	@Test
	void compilesNestedPatternsWithFieldsAndCaptures()
	{
		Query query = compiler.compile("(module_instantiation name: (identifier) @name (argument_list)) @call ; calls");

		assertThat(query.getPatterns()).hasSize(1);
		QueryPattern pattern = query.getPatterns().get(0);
		assertThat(pattern.getType()).isEqualTo("module_instantiation");
		assertThat(pattern.getFields()).containsKey("name");
		assertThat(pattern.getChildren()).hasSize(1);
		assertThat(pattern.getCaptures()).containsExactly("call");
	}

	@Test
	void capturesInDocumentOrder()
	{
		assertThat(captured("(module_instantiation name: (identifier) @name)", "name")).containsExactly("cylinder", "peg");
	}

	@Test
	void severalTopLevelPatterns()
	{
		Query query = compiler.compile("(module_definition name: (identifier) @def)\n(function_definition name: (identifier) @def)");

		assertThat(query.captures(tree.getRoot())).extracting(c -> c.getNode().getText()).containsExactly("peg", "twice");
		assertThat(query.captures(tree.getRoot())).extracting(QueryCapture::getPatternIndex).containsExactly(0, 1);
	}

	@Test
	void wildcardsAndTokens()
	{
		assertThat(captured("(function_definition \"function\" @kw)", "kw")).containsExactly("function");
		assertThat(captured("(call_expression function: (_) @callee)", "callee")).containsExactly("twice");
		assertThat(compiler.compile("_ @any").captures(tree.getRoot())).isNotEmpty();
	}

	@Test
	void fieldMustBePresent()
	{
		assertThat(captured("(parameter_declaration default: (_)) @p", "p")).containsExactly("h = 5");
	}

	@Test
	void malformedQueriesAreRejected()
	{
		assertThatThrownBy(() -> compiler.compile("")).isInstanceOf(QueryException.class);
		assertThatThrownBy(() -> compiler.compile("(cube")).isInstanceOf(QueryException.class).hasMessageContaining("Unclosed");
		assertThatThrownBy(() -> compiler.compile("(x) @")).isInstanceOf(QueryException.class);
		assertThatThrownBy(() -> compiler.compile("cube")).isInstanceOf(QueryException.class);
		assertThatThrownBy(() -> compiler.compile("(a name: (b) name: (c))")).isInstanceOf(QueryException.class);
	}

	@Test
	void noMatchGivesNoCaptures()
	{
		CstNode root = tree.getRoot();
		assertThat(compiler.compile("(include_statement) @inc").captures(root)).isEmpty();
	}
}
