package org.lokray.scad.ast;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.scad.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Dumps ASTs as pretty-printed JSON for debugging.
 */
public final class AstJsonWriter
{
	private static final Gson GSON = new GsonBuilder()
			.setPrettyPrinting()
			.serializeSpecialFloatingPointValues()
			.create();

	private AstJsonWriter()
	{
	}

	public static String toJson(List<AstNode> nodes)
	{
		return GSON.toJson(nodes);
	}

	public static void write(List<AstNode> nodes, Path out) throws IOException
	{
		if (out.getParent() != null)
		{
			Files.createDirectories(out.getParent());
		}
		Files.writeString(out, toJson(nodes), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote AST dump to: " + out);
	}
}
