package org.lokray.scad.error.recovery;

import org.junit.jupiter.api.Test;
import org.lokray.scad.ast.Position;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParser;
import org.lokray.scad.error.ErrorCode;
import org.lokray.scad.error.ErrorSuggestion;
import org.lokray.scad.error.ParserError;
import org.lokray.scad.error.SemanticError;
import org.lokray.scad.error.SyntaxError;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryStrategyFactoryTest
{
	private static final String SOURCE = "cube(1);\n@@@ ;\nsphere(2);";
	private static final Position START = new Position(0, 0, 0);

	private final RecoveryStrategyFactory factory = new RecoveryStrategyFactory();

	private Optional<String> strategyName(ParserError error)
	{
		return factory.createStrategy(error).map(RecoveryStrategy::getName);
	}

	@Test
	void missingTokensWithAReplacementAreInserted()
	{
		assertThat(strategyName(SyntaxError.missingSemicolon(SOURCE, START))).contains("InsertMissingToken");
		assertThat(strategyName(SyntaxError.unmatchedToken("(", ")", SOURCE, START))).contains("InsertMissingToken");
		assertThat(strategyName(SyntaxError.missingToken("]", SOURCE, START))).contains("InsertMissingToken");
	}

	@Test
	void missingTokenWithoutAReplacementSkipsTheStatement()
	{
		SyntaxError error = new SyntaxError("Missing something", ErrorCode.MISSING_TOKEN, SOURCE, START,
				List.of(new ErrorSuggestion("Add it")));

		assertThat(strategyName(error)).contains("SkipToNextStatement");
	}

	@Test
	void extraTokensAreDeleted()
	{
		assertThat(strategyName(SyntaxError.unexpectedToken("}", ";", SOURCE, START))).contains("DeleteExtraToken");
		assertThat(strategyName(SyntaxError.invalidCharacter("@", SOURCE, START))).contains("DeleteExtraToken");
	}

	@Test
	void generalSyntaxErrorsSkipTheStatement()
	{
		assertThat(strategyName(SyntaxError.unexpectedEndOfInput("}", SOURCE, START))).contains("SkipToNextStatement");
		assertThat(strategyName(new SyntaxError("bad", ErrorCode.SYNTAX_ERROR, SOURCE, START, List.of())))
				.contains("SkipToNextStatement");
	}

	@Test
	void semanticProblemsHaveNoRecovery()
	{
		assertThat(factory.createStrategy(SemanticError.undefinedVariable("x", SOURCE, START))).isEmpty();
		assertThat(factory.createStrategy(SemanticError.invalidParameter("sise", "cube", SOURCE, START))).isEmpty();
	}

	@Test
	void strategiesResumeAfterTheErrorNode()
	{
		CstNode root = new CstParser().parse(SOURCE).getRoot();
		CstNode error = root.getChildren().stream().filter(CstNode::isError).findFirst().orElseThrow();
		ParserError problem = SyntaxError.invalidCharacter("@", SOURCE, START);

		Optional<CstNode> skipped = new SkipToNextStatementStrategy().recover(error, problem);
		assertThat(skipped).isPresent();
		assertThat(skipped.get().getText()).startsWith("sphere");
		assertThat(SkipToNextStatementStrategy.isStatement(skipped.get())).isTrue();

		Optional<CstNode> deleted = new DeleteExtraTokenStrategy().recover(error, problem);
		assertThat(deleted).containsSame(error.getNextSibling());

		assertThat(new InsertMissingTokenStrategy().recover(error, problem)).isEmpty();
		assertThat(new InsertMissingTokenStrategy().recover(error, SyntaxError.missingSemicolon(SOURCE, START)))
				.containsSame(error);
	}

	@Test
	void nothingToSkipToAtTheEnd()
	{
		CstNode root = new CstParser().parse("cube(1);\n@@@").getRoot();
		CstNode error = root.getChildren().stream().filter(CstNode::isError).findFirst().orElseThrow();

		assertThat(new SkipToNextStatementStrategy().recover(error, SyntaxError.invalidCharacter("@", "", START))).isEmpty();
	}
}
