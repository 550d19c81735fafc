package org.lokray.scad.builder.extractor;

import org.junit.jupiter.api.Test;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArgumentExtractorTest
{
	private static Parameter positional(double value)
	{
		return new Parameter(null, EvaluationResult.number(value), null, null);
	}

	private static Parameter named(String name, double value)
	{
		return new Parameter(name, EvaluationResult.number(value), null, null);
	}

	@Test
	void positionalArgumentsFillDeclaredNamesInOrder()
	{
		Map<String, Parameter> resolved = ArgumentExtractor.resolve(List.of(positional(1), positional(2)), List.of("a", "b", "c"));

		assertThat(resolved).containsOnlyKeys("a", "b");
		assertThat(ValueExtractor.number(resolved.get("b"))).contains(2.0);
	}

	@Test
	void namedArgumentsTakeTheirSlotFirst()
	{
		Map<String, Parameter> resolved = ArgumentExtractor.resolve(List.of(positional(1), named("a", 9)), List.of("a", "b"));

		assertThat(ValueExtractor.number(resolved.get("a"))).contains(9.0);
		assertThat(ValueExtractor.number(resolved.get("b"))).contains(1.0);
	}

	@Test
	void surplusPositionalArgumentsAreDropped()
	{
		Map<String, Parameter> resolved = ArgumentExtractor.resolve(List.of(positional(1), positional(2)), List.of("r"));

		assertThat(resolved).containsOnlyKeys("r");
	}

	@Test
	void specialVariablesKeepTheirName()
	{
		Map<String, Parameter> resolved = ArgumentExtractor.resolve(List.of(named("$fn", 30), positional(5)), List.of("r"));

		assertThat(resolved).containsOnlyKeys("$fn", "r");
	}
}
