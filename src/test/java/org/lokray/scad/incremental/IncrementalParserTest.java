package org.lokray.scad.incremental;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.lokray.scad.builder.AstBuilder;
import org.lokray.scad.cst.CstParser;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.ParserConfig;

import static org.assertj.core.api.Assertions.assertThat;

class IncrementalParserTest
{
	private static final String SOURCE = """
			// parts
			w = 10;
			module peg(h = 5) { cylinder(h = h, r = 1); }
			cube([w, w, 2]);
			translate([0, 0, 2]) peg();
			for (i = [0:2]) translate([i * 3, 0, 0]) sphere(1);
			""";

	private final IncrementalParser parser = new IncrementalParser(new CstParser(), new AstBuilder(ParserConfig.defaults()));

	private ParseSnapshot fresh(String text)
	{
		return parser.parse(text, new Diagnostics(), CancellationToken.NONE);
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"sphere(1)|sphere(r = 2)",
			"w = 10;|w = 12;",
			"peg();|peg(7);",
			"cube([w, w, 2]);|cube([w, w, 2]",
			"// parts|// parts\\nextra = 1;",
			"for (i = [0:2])|for (i = [0:4])"
	})
	void reparseEqualsAFreshParse(String from, String to)
	{
		String target = to.replace("\\n", "\n");
		String edited = SOURCE.replace(from, target);
		int start = SOURCE.indexOf(from);
		InputEdit edit = new InputEdit(start, start + from.length(), start + target.length());

		ParseSnapshot updated = parser.reparse(fresh(SOURCE), edited, edit, new Diagnostics(), CancellationToken.NONE);

		assertThat(updated.getAst()).isEqualTo(fresh(edited).getAst());
		assertThat(updated.getSource()).isEqualTo(edited);
	}

	@Test
	void editsNearTheEndReuseTheStatementsInFront()
	{
		String edited = SOURCE.replace("sphere(1)", "sphere(2)");
		int start = SOURCE.indexOf("sphere(1)") + "sphere(".length();

		ParseSnapshot updated = parser.reparse(fresh(SOURCE), edited, new InputEdit(start, start + 1, start + 1),
				new Diagnostics(), CancellationToken.NONE);

		assertThat(updated.getReusedStatements()).isGreaterThan(0);
		assertThat(updated.isComplete()).isTrue();
	}

	@Test
	void editAtTheStartReparsesEverything()
	{
		String edited = "x = 1;\n" + SOURCE;

		ParseSnapshot updated = parser.reparse(fresh(SOURCE), edited, new InputEdit(0, 0, 7), new Diagnostics(), CancellationToken.NONE);

		assertThat(updated.getReusedStatements()).isZero();
		assertThat(updated.getAst()).isEqualTo(fresh(edited).getAst());
	}

	@Test
	void mismatchedEditFallsBackToAFullParse()
	{
		String edited = SOURCE.replace("w = 10;", "w = 99;");

		ParseSnapshot updated = parser.reparse(fresh(SOURCE), edited, new InputEdit(0, 1, 1), new Diagnostics(), CancellationToken.NONE);

		assertThat(updated.getReusedStatements()).isZero();
		assertThat(updated.getAst()).isEqualTo(fresh(edited).getAst());
	}

	@Test
	void syntaxErrorsOfTheEditedRegionAreReported()
	{
		String edited = SOURCE.replace("sphere(1);", "sphere(1;");
		int start = SOURCE.indexOf("sphere(1);") + "sphere(1".length();
		Diagnostics diagnostics = new Diagnostics();

		parser.reparse(fresh(SOURCE), edited, new InputEdit(start, start + 1, start), diagnostics, CancellationToken.NONE);

		assertThat(diagnostics.hasErrors()).isTrue();
	}
}
