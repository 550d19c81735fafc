package org.lokray.scad.builder;

import org.junit.jupiter.api.Test;
import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.CubeNode;
import org.lokray.scad.ast.ErrorNode;
import org.lokray.scad.ast.ModuleInstantiationNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.TransformNode;
import org.lokray.scad.builder.extractor.CallSite;
import org.lokray.scad.builder.extractor.CubeExtractor;
import org.lokray.scad.cst.CstParser;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.error.ErrorCode;
import org.lokray.scad.error.ParserError;
import org.lokray.scad.error.recovery.RecoveryStrategyFactory;
import org.lokray.scad.evaluation.ExpressionEvaluatorRegistry;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.ParserConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AstBuilderTest
{
	private final CstParser parser = new CstParser();
	private final Diagnostics diagnostics = new Diagnostics();

	private static AstBuilder builderWith(NodeHandlerRegistry handlers)
	{
		return new AstBuilder(ParserConfig.defaults(), handlers, ExpressionEvaluatorRegistry.createDefault(), new RecoveryStrategyFactory());
	}

	private List<AstNode> build(AstBuilder builder, String text)
	{
		return builder.build(parser.parse(text), diagnostics, CancellationToken.NONE);
	}

	@Test
	void topLevelStatementsInSourceOrder()
	{
		List<AstNode> ast = build(new AstBuilder(ParserConfig.defaults()), "cube(1);\nx = 2;\nsphere(3);");

		assertThat(ast).extracting(AstNode::getKind)
				.containsExactly(NodeKind.CUBE, NodeKind.ASSIGNMENT, NodeKind.SPHERE);
		assertThat(ast.get(1).getLocation().getStart().getLine()).isEqualTo(1);
	}

	@Test
	void childrenAreNestedUnderTheirTransform()
	{
		List<AstNode> ast = build(new AstBuilder(ParserConfig.defaults()), "translate([1, 2, 3]) { cube(1); sphere(2); }");

		assertThat(ast).hasSize(1);
		TransformNode translate = (TransformNode) ast.get(0);
		assertThat(translate.getKind()).isEqualTo(NodeKind.TRANSLATE);
		assertThat(translate.getChildren()).extracting(AstNode::getKind).containsExactly(NodeKind.CUBE, NodeKind.SPHERE);
	}

	@Test
	void unknownModuleBecomesAGenericInstantiation()
	{
		List<AstNode> ast = build(new AstBuilder(ParserConfig.defaults()), "gear(teeth = 12);");

		assertThat(ast).singleElement().isInstanceOf(ModuleInstantiationNode.class);
		assertThat(((ModuleInstantiationNode) ast.get(0)).getName()).isEqualTo("gear");
	}

	@Test
	void failingHandlerYieldsAnErrorNodeAndAnInternalError()
	{
		NodeHandlerRegistry handlers = NodeHandlerRegistry.createDefault();
		handlers.register("cube", (node, context) ->
		{
			throw new IllegalStateException("boom");
		});
		AstBuilder builder = builderWith(handlers);

		List<AstNode> ast = build(builder, "cube(1); sphere(2);");

		assertThat(ast).extracting(AstNode::getKind).containsExactly(NodeKind.ERROR, NodeKind.SPHERE);
		assertThat(((ErrorNode) ast.get(0)).getCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
		assertThat(diagnostics.getProblems()).singleElement()
				.satisfies(problem ->
				{
					assertThat(problem.getCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
					assertThat(problem.getBaseMessage()).contains("boom");
				});
	}

	@Test
	void customHandlerForAUserModule()
	{
		NodeHandlerRegistry handlers = NodeHandlerRegistry.createDefault();
		handlers.register("block_of", (node, context) -> CubeExtractor.extract(CallSite.of(node, context)));
		AstBuilder builder = builderWith(handlers);

		List<AstNode> ast = build(builder, "block_of(4);");

		assertThat(ast).singleElement().isInstanceOf(CubeNode.class);
		assertThat(((CubeNode) ast.get(0)).getSize().asNumber()).contains(4.0);
	}

	@Test
	void handlerReturningNullDropsTheStatement()
	{
		NodeHandlerRegistry handlers = NodeHandlerRegistry.createDefault();
		handlers.register("echo", (node, context) -> null);
		AstBuilder builder = builderWith(handlers);

		assertThat(build(builder, "echo(\"hi\"); cube(1);")).extracting(AstNode::getKind).containsExactly(NodeKind.CUBE);
	}

	@Test
	void brokenStatementDoesNotHideItsNeighbours()
	{
		List<AstNode> ast = build(new AstBuilder(ParserConfig.defaults()), "cube(1);\n@@@ ;\ncylinder(h = 1, r = 2);");

		assertThat(ast.get(0).getKind()).isEqualTo(NodeKind.CUBE);
		assertThat(ast.get(ast.size() - 1).getKind()).isEqualTo(NodeKind.CYLINDER);
		assertThat(ast).extracting(AstNode::getKind).contains(NodeKind.ERROR);
	}

	@Test
	void cancelledBuildStopsEarly()
	{
		CancellationToken token = new CancellationToken();
		token.cancel();

		assertThat(new AstBuilder(ParserConfig.defaults()).build(parser.parse("cube(1); cube(2);"), diagnostics, token)).isEmpty();
	}

	@Test
	void problemsStayInTheirList()
	{
		build(new AstBuilder(ParserConfig.defaults()), "cube(1);");

		assertThat(diagnostics.getProblems(ParserError.class)).isEmpty();
	}
}
