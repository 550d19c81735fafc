package org.lokray.scad.evaluation;

import java.util.List;

@FunctionalInterface
public interface BuiltinFunction
{
	EvaluationResult apply(List<EvaluationResult> arguments);
}
