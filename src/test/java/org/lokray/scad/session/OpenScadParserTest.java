package org.lokray.scad.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.scad.ast.AssignmentNode;
import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.CubeNode;
import org.lokray.scad.ast.CylinderNode;
import org.lokray.scad.ast.ErrorNode;
import org.lokray.scad.ast.IfNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SphereNode;
import org.lokray.scad.ast.TransformNode;
import org.lokray.scad.error.ErrorCode;
import org.lokray.scad.error.ParserError;
import org.lokray.scad.error.SyntaxError;
import org.lokray.scad.evaluation.EvaluationResult;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.ParserConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenScadParserTest
{
	private OpenScadParser parser;

	@BeforeEach
	void setUp()
	{
		parser = new OpenScadParser(ParserConfig.defaults());
	}

	@Test
	void cubeWithScalarSize()
	{
		List<AstNode> ast = parser.parseToAST("cube(10);");

		assertThat(ast).hasSize(1);
		assertThat(ast.get(0)).isInstanceOf(CubeNode.class);
		CubeNode cube = (CubeNode) ast.get(0);
		assertThat(cube.getKind()).isEqualTo(NodeKind.CUBE);
		assertThat(cube.getSize()).isEqualTo(EvaluationResult.number(10));
		assertThat(cube.isCenter()).isFalse();
	}

	@Test
	void cylinderDerivesRadiiFromDiameter()
	{
		CylinderNode cylinder = (CylinderNode) parser.parseToAST("cylinder(h=12,d=8);").get(0);

		assertThat(cylinder.getH()).contains(12.0);
		assertThat(cylinder.getD()).contains(8.0);
		assertThat(cylinder.getR()).contains(4.0);
		assertThat(cylinder.getR1()).contains(4.0);
		assertThat(cylinder.getR2()).contains(4.0);
	}

	@Test
	void transformKeepsItsChild()
	{
		List<AstNode> ast = parser.parseToAST("translate([1, 2, 3]) sphere(d = 4);");

		assertThat(ast).singleElement().isInstanceOf(TransformNode.class);
		TransformNode translate = (TransformNode) ast.get(0);
		assertThat(translate.getPrimaryValue()).contains(EvaluationResult.numbers(1, 2, 3));
		assertThat(translate.getChildren()).singleElement().isInstanceOf(SphereNode.class);
		assertThat(((SphereNode) translate.getChildren().get(0)).getR()).isEqualTo(2.0);
	}

	@Test
	void unterminatedVectorKeepsThePrecedingStatement()
	{
		List<AstNode> ast = parser.parseToAST("sphere(5); cube([10,10,10); ");

		assertThat(ast).isNotEmpty();
		assertThat(ast.get(0)).isInstanceOf(SphereNode.class);
		assertThat(parser.getDiagnostics().getProblems(SyntaxError.class)).isNotEmpty();
		assertThat(parser.getDiagnostics().hasErrors()).isTrue();
	}

	@Test
	void garbageBetweenStatementsBecomesAnErrorNode()
	{
		List<AstNode> ast = parser.parseToAST("cube(1);\n@@@ ;\nsphere(2);");

		assertThat(ast.get(0)).isInstanceOf(CubeNode.class);
		assertThat(ast.get(ast.size() - 1)).isInstanceOf(SphereNode.class);
		assertThat(parser.getDiagnostics().hasErrors()).isTrue();
	}

	@Test
	void deeplyNestedParenthesesDoNotLoseTheSurroundingStatements()
	{
		String deep = "x = " + "(".repeat(5000) + "1" + ")".repeat(5000) + ";";

		List<AstNode> ast = parser.parseToAST("cube(1);\n" + deep + "\nsphere(2);");

		assertThat(ast.get(0)).isInstanceOf(CubeNode.class);
		assertThat(ast.get(ast.size() - 1)).isInstanceOf(SphereNode.class);
		assertThat(parser.getDiagnostics().hasErrors()).isTrue();
	}

	@Test
	void longOperatorChainDoesNotLoseTheSurroundingStatements()
	{
		String deep = "x = " + "1+".repeat(5000) + "1;";

		List<AstNode> ast = parser.parseToAST("cube(1);\n" + deep + "\nsphere(2);");

		assertThat(ast.get(0)).isInstanceOf(CubeNode.class);
		assertThat(ast.get(ast.size() - 1)).isInstanceOf(SphereNode.class);
		assertThat(parser.getDiagnostics().hasErrors()).isTrue();
	}

	@Test
	void strayTokenBeforeANumberKeepsTheAssignment()
	{
		List<AstNode> ast = parser.parseToAST("x = <1;");

		assertThat(ast).singleElement().isInstanceOf(AssignmentNode.class);
		assertThat(((AssignmentNode) ast.get(0)).getName()).isEqualTo("x");
		assertThat(parser.getDiagnostics().getProblems()).extracting(ParserError::getCode)
				.isNotEmpty()
				.doesNotContain(ErrorCode.INTERNAL_ERROR);
	}

	@Test
	void doubledOperatorInAConditionKeepsTheBranch()
	{
		List<AstNode> ast = parser.parseToAST("if (y >> 1) cube(2);");

		assertThat(ast).singleElement().isInstanceOf(IfNode.class);
		assertThat(((IfNode) ast.get(0)).getThenBranch()).singleElement().isInstanceOf(CubeNode.class);
		assertThat(parser.getDiagnostics().getProblems()).extracting(ParserError::getCode)
				.doesNotContain(ErrorCode.INTERNAL_ERROR);
	}

	@Test
	void parsingTwiceGivesEqualTrees()
	{
		String text = """
				module box(s = 2) { cube(s, center = true); }
				for (i = [0:3]) translate([i * 10, 0, 0]) box(i);
				r = 5;
				difference() { sphere(r); cylinder(h = 20, r = 1, center = true); }
				""";

		List<AstNode> first = parser.parseToAST(text);
		List<AstNode> second = new OpenScadParser(ParserConfig.defaults()).parseToAST(text);

		assertThat(second).isEqualTo(first);
		assertThat(parser.parseToAST(text)).isEqualTo(first);
	}

	@Test
	void updateMatchesAFreshParse()
	{
		String before = "a = 1;\ncube(a);\nsphere(2);\ncylinder(h = 3, r = 1);\n";
		parser.parseToAST(before);

		String after = before.replace("sphere(2)", "sphere(r = 20)");
		int start = before.indexOf("sphere(2)") + "sphere(".length();
		List<AstNode> updated = parser.update(after, start, start + 1, start + "r = 20".length());

		assertThat(updated).isEqualTo(new OpenScadParser(ParserConfig.defaults()).parseToAST(after));
		assertThat(parser.getText()).isEqualTo(after);
		assertThat(parser.getChangeTracker().getChanges()).hasSize(1);
		assertThat(parser.getReusedStatementCount()).isEqualTo(1);
	}

	@Test
	void cancelledParseSkipsTheSymbolPass()
	{
		CancellationToken token = new CancellationToken();
		token.cancel();

		List<AstNode> ast = parser.parseToAST("cube(1); sphere(1);", token);

		assertThat(ast).isEmpty();
		assertThat(parser.isReady()).isTrue();
	}

	@Test
	void undefinedVariableIsAWarningWithASuggestion()
	{
		parser.parseToAST("width = 10;\ncube(widht);");

		assertThat(parser.getDiagnostics().hasWarnings()).isTrue();
		assertThat(parser.getDiagnostics().getWarnings()).anyMatch(w -> w.contains("widht"));
		assertThat(parser.getDiagnostics().getProblems().get(0).getSuggestions())
				.anyMatch(s -> s.getReplacement().filter("width"::equals).isPresent());
	}

	@Test
	void queriesRunAgainstTheCurrentTree()
	{
		parser.parseToAST("cube(1); sphere(2); cube(3);");

		assertThat(parser.executeQuery("(module_instantiation name: (identifier) @name)"))
				.extracting(n -> n.getText())
				.containsExactly("cube", "sphere", "cube");
		parser.executeQuery("(module_instantiation name: (identifier) @name)");
		assertThat(parser.getQueryCacheStats().getHits()).isEqualTo(1);
	}

	@Test
	void outlineListsTopLevelDeclarations()
	{
		parser.parseToAST("module m(a, b) {}\nfunction f(x) = x;\nv = 1;");

		assertThat(parser.getOutline()).extracting(e -> e.getName()).containsExactly("m", "f", "v");
		assertThat(parser.getOutline().get(0).getChildren()).extracting(e -> e.getName()).containsExactly("a", "b");
	}

	@Test
	void dumpsTheAstAsJson()
	{
		parser.parseToAST("cube(2);");
		assertThat(parser.dumpAst()).contains("\"kind\": \"CUBE\"");
	}
}
