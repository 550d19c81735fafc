package org.lokray.scad.query;

import org.junit.jupiter.api.Test;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.cst.CstParser;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryManagerTest
{
	private final CstParser parser = new CstParser();
	private final QueryManager manager = new QueryManager(10);

	@Test
	void repeatedQueryOnTheSameSourceHitsTheCache()
	{
		CstParseResult tree = parser.parse("x = 1; y = 2;");

		List<CstNode> first = manager.findNodesByType("assignment_statement", tree);
		List<CstNode> second = manager.findNodesByType("assignment_statement", tree);

		assertThat(first).hasSize(2);
		assertThat(second).isSameAs(first);
		assertThat(manager.getCacheStats().getHits()).isEqualTo(1);
		assertThat(manager.getCacheStats().getMisses()).isEqualTo(1);
	}

	@Test
	void changedSourceMisses()
	{
		manager.findNodesByType("assignment_statement", parser.parse("x = 1;"));
		List<CstNode> nodes = manager.findNodesByType("assignment_statement", parser.parse("x = 1; z = 3;"));

		assertThat(nodes).hasSize(2);
		assertThat(manager.getCacheStats().getHits()).isZero();
	}

	@Test
	void findsSeveralTypesAtOnce()
	{
		CstParseResult tree = parser.parse("include <a.scad>\nuse <b.scad>\ncube(1);");

		assertThat(manager.findNodesByTypes(List.of("include_statement", "use_statement"), tree))
				.extracting(CstNode::getType)
				.containsExactly("include_statement", "use_statement");
	}

	@Test
	void queryBelowOneNode()
	{
		String text = "module a() { cube(1); } module b() { cube(2); sphere(3); }";
		CstParseResult tree = parser.parse(text);
		CstNode second = manager.findNodesByType("module_definition", tree).get(1);

		assertThat(manager.executeQueryOnNode("(module_instantiation) @m", second, text)).hasSize(2);
	}

	@Test
	void clearResetsTheCache()
	{
		CstParseResult tree = parser.parse("x = 1;");
		manager.findNodesByType("assignment_statement", tree);
		manager.clearCache();

		assertThat(manager.getCacheStats().getSize()).isZero();
	}
}
