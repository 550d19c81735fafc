package org.lokray.scad.ast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.scad.session.OpenScadParser;
import org.lokray.scad.util.ParserConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AstJsonWriterTest
{
	@TempDir
	Path temp;

	@Test
	void writesTheDumpCreatingParentDirectories() throws IOException
	{
		List<AstNode> ast = new OpenScadParser(ParserConfig.defaults()).parseToAST("translate([1, 0, 0]) cube(2);");
		Path out = temp.resolve("dumps/model.json");

		AstJsonWriter.write(ast, out);

		String json = Files.readString(out);
		assertThat(json).isEqualTo(AstJsonWriter.toJson(ast));
		assertThat(json).contains("\"kind\": \"TRANSLATE\"", "\"kind\": \"CUBE\"");
	}

	@Test
	void emptyTreeIsAnEmptyArray()
	{
		assertThat(AstJsonWriter.toJson(List.of())).isEqualTo("[]");
	}
}
