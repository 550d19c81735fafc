package org.lokray.scad.semantic.rename;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.scad.session.OpenScadParser;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.ParserConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenameServiceTest
{
	private OpenScadParser session;

	@BeforeEach
	void setUp()
	{
		session = new OpenScadParser(ParserConfig.defaults());
	}

	private RenameEdits rename(String text, String target, int occurrence, String newName)
	{
		session.parseToAST(text);
		return session.provideRenameEdits(offsetOf(text, target, occurrence), newName);
	}

	private static int offsetOf(String text, String target, int occurrence)
	{
		int index = -1;
		for (int i = 0; i <= occurrence; i++)
		{
			index = text.indexOf(target, index + 1);
		}
		return index;
	}

	@Test
	void renamesModuleDeclarationAndCallSite()
	{
		String text = "module m(){} m(); mm = 1; echo(mm);";

		RenameEdits edits = rename(text, "m", 1, "n");

		assertThat(edits).isNotNull();
		assertThat(edits.getEdits()).hasSize(2);
		assertThat(edits.getEdits()).allMatch(e -> e.getNewText().equals("n"));
		assertThat(edits.applyTo(text)).isEqualTo("module n(){} n(); mm = 1; echo(mm);");
	}

	@Test
	void editsAreSortedByOffset()
	{
		String text = "x = 1; cube(x); sphere(x);";

		RenameEdits edits = rename(text, "x", 2, "size");

		assertThat(edits.getEdits()).extracting(e -> e.getRange().getStart().getOffset()).isSorted();
		assertThat(edits.applyTo(text)).isEqualTo("size = 1; cube(size); sphere(size);");
	}

	@Test
	void prepareReportsRangeAndName()
	{
		String text = "function area(r) = PI * r * r;\necho(area(2));";
		session.parseToAST(text);

		PrepareRenameResult result = session.prepareRename(offsetOf(text, "area", 1) + 2);

		assertThat(result.getText()).isEqualTo("area");
		assertThat(result.getRange().getStart().getOffset()).isEqualTo(offsetOf(text, "area", 1));
		assertThat(result.getRange().getStart().getLine()).isEqualTo(1);
	}

	@Test
	void builtinConstantCannotBeRenamed()
	{
		String text = "x = PI;";
		session.parseToAST(text);

		assertThatThrownBy(() -> session.prepareRename(text.indexOf("PI")))
				.isInstanceOf(CannotRenameConstantException.class)
				.hasMessageContaining("PI");
		assertThat(session.provideRenameEdits(text.indexOf("PI"), "TAU")).isNull();
	}

	@Test
	void nothingToRenameOnWhitespace()
	{
		String text = "cube(1);    x = 2;";
		session.parseToAST(text);

		assertThatThrownBy(() -> session.prepareRename(10)).isInstanceOf(NoSymbolAtPositionException.class);
		assertThat(session.provideRenameEdits(10, "y")).isNull();
	}

	@Test
	void rejectsKeywordsAndInvalidIdentifiers()
	{
		String text = "v = 1; echo(v);";

		assertThat(rename(text, "v", 0, "module")).isNull();
		assertThat(rename(text, "v", 0, "cube")).isNull();
		assertThat(rename(text, "v", 0, "2fast")).isNull();
		assertThat(rename(text, "v", 0, "ok_name")).isNotNull();
	}

	@Test
	void collisionWithAnExistingDeclarationIsRefused()
	{
		assertThat(rename("a = 1; b = 2; echo(a);", "a", 0, "b")).isNull();
	}

	@Test
	void renameThatWouldBeCapturedByAnInnerDeclarationIsRefused()
	{
		assertThat(rename("a = 1; module m() { b = 2; echo(a); }", "a", 0, "b")).isNull();
	}

	@Test
	void shadowedOccurrencesAreLeftAlone()
	{
		String text = "x = 1; module m(x) { echo(x); } echo(x);";

		RenameEdits edits = rename(text, "x", 0, "y");

		assertThat(edits.applyTo(text)).isEqualTo("y = 1; module m(x) { echo(x); } echo(y);");
	}

	@Test
	void parametersRenameWithinTheirDefinition()
	{
		String text = "module m(size) { cube(size); } size = 3;";

		RenameEdits edits = rename(text, "size", 1, "s");

		assertThat(edits.applyTo(text)).isEqualTo("module m(s) { cube(s); } size = 3;");
	}

	@Test
	void cancelledRequestsReturnNull()
	{
		String text = "v = 1;";
		session.parseToAST(text);
		CancellationToken token = new CancellationToken();
		token.cancel();

		assertThat(session.prepareRename(0, token)).isNull();
		assertThat(session.provideRenameEdits(0, "w", token)).isNull();
	}

	@Test
	void notReadyBeforeTheFirstParse()
	{
		assertThat(session.isReady()).isFalse();
		assertThat(session.prepareRename(0)).isNull();
		assertThat(session.provideRenameEdits(0, "w")).isNull();
	}

	@Test
	void keywordListIsFixed()
	{
		assertThat(ReservedKeywords.isReserved("for")).isTrue();
		assertThat(ReservedKeywords.isValidIdentifier("_tmp1")).isTrue();
		assertThat(ReservedKeywords.isValidIdentifier("$fn")).isFalse();
		assertThat(ReservedKeywords.all()).contains("module", "function", "sphere");
	}
}
