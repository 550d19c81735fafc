package org.lokray.scad.session;

import org.lokray.scad.ast.AstJsonWriter;
import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.Position;
import org.lokray.scad.builder.AstBuilder;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.cst.CstParser;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.incremental.ChangeTracker;
import org.lokray.scad.incremental.IncrementalParser;
import org.lokray.scad.incremental.InputEdit;
import org.lokray.scad.incremental.ParseSnapshot;
import org.lokray.scad.query.CacheStats;
import org.lokray.scad.query.QueryManager;
import org.lokray.scad.semantic.SemanticAnalyzer;
import org.lokray.scad.semantic.SymbolProvider;
import org.lokray.scad.semantic.SymbolTable;
import org.lokray.scad.semantic.SymbolTableBuilder;
import org.lokray.scad.semantic.rename.PrepareRenameResult;
import org.lokray.scad.semantic.rename.RenameEdits;
import org.lokray.scad.semantic.rename.RenameService;
import org.lokray.scad.semantic.rename.SymbolTableSource;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.Debug;
import org.lokray.scad.util.ParserConfig;

import java.util.List;

/**
 * One editing session over one OpenSCAD document. Holds the current CST and AST, keeps them in step
 * with edits and answers queries and rename requests against them. Not thread-safe: the caller
 * serializes access.
 */
public class OpenScadParser implements SymbolTableSource
{
	private final ParserConfig config;
	private final IncrementalParser incrementalParser;
	private final ChangeTracker changeTracker = new ChangeTracker();
	private final QueryManager queryManager;
	private final RenameService renameService;
	private final SymbolProvider symbolProvider = new SymbolProvider();
	private final Diagnostics diagnostics = new Diagnostics();

	private ParseSnapshot snapshot;
	private SymbolTable symbolTable;

	public OpenScadParser()
	{
		this(ParserConfig.load());
	}

	public OpenScadParser(ParserConfig config)
	{
		this(config, new AstBuilder(config));
	}

	public OpenScadParser(ParserConfig config, AstBuilder builder)
	{
		this.config = config;
		this.incrementalParser = new IncrementalParser(new CstParser(), builder);
		this.queryManager = new QueryManager(config.getQueryCacheMaxSize());
		this.renameService = new RenameService(this);
	}

	public ParserConfig getConfig()
	{
		return config;
	}

	public List<AstNode> parseToAST(String text)
	{
		return parseToAST(text, CancellationToken.NONE);
	}

	/**
	 * Parses {@code text} from scratch, replacing whatever the session held. A cancelled build
	 * returns the statements built so far.
	 */
	public List<AstNode> parseToAST(String text, CancellationToken token)
	{
		diagnostics.clear();
		changeTracker.clear();
		snapshot = incrementalParser.parse(text, diagnostics, token);
		analyze(token);
		return snapshot.getAst();
	}

	public List<AstNode> update(String newText, int startIndex, int oldEndIndex, int newEndIndex)
	{
		return update(newText, new InputEdit(startIndex, oldEndIndex, newEndIndex));
	}

	/**
	 * Brings the session to {@code newText}, which must be the previous text with {@code edit}
	 * applied. An edit that does not fit is tolerated by parsing from scratch.
	 */
	public List<AstNode> update(String newText, InputEdit edit)
	{
		if (snapshot == null)
		{
			return parseToAST(newText);
		}
		if (edit.isConsistentWith(snapshot.getSource(), newText))
		{
			changeTracker.trackChange(edit, newText);
		}
		diagnostics.clear();
		snapshot = incrementalParser.reparse(snapshot, newText, edit, diagnostics, CancellationToken.NONE);
		analyze(CancellationToken.NONE);
		return snapshot.getAst();
	}

	/**
	 * Like {@link #update(String, InputEdit)} with the edit worked out from the two texts.
	 */
	public List<AstNode> update(String newText)
	{
		if (snapshot == null)
		{
			return parseToAST(newText);
		}
		return update(newText, InputEdit.between(snapshot.getSource(), newText));
	}

	private void analyze(CancellationToken token)
	{
		symbolTable = null;
		if (token.isCancellationRequested())
		{
			Debug.logDebug("Parse cancelled, skipping semantic analysis");
			return;
		}
		symbolTable = new SymbolTableBuilder().build(snapshot.getAst());
		new SemanticAnalyzer(snapshot.getSource(), diagnostics).analyze(snapshot.getAst(), symbolTable);
	}

	@Override
	public boolean isReady()
	{
		return snapshot != null;
	}

	/**
	 * Null until the first parse.
	 */
	public CstParseResult getCst()
	{
		return snapshot == null ? null : snapshot.getCst();
	}

	public List<AstNode> getAst()
	{
		return snapshot == null ? List.of() : snapshot.getAst();
	}

	public String getText()
	{
		return snapshot == null ? "" : snapshot.getSource();
	}

	public Diagnostics getDiagnostics()
	{
		return diagnostics;
	}

	public ChangeTracker getChangeTracker()
	{
		return changeTracker;
	}

	/**
	 * How many top-level nodes the last update carried over without reparsing.
	 */
	public int getReusedStatementCount()
	{
		return snapshot == null ? 0 : snapshot.getReusedStatements();
	}

	@Override
	public SymbolTable getSymbolTable()
	{
		if (symbolTable == null && snapshot != null)
		{
			symbolTable = new SymbolTableBuilder().build(snapshot.getAst());
		}
		return symbolTable;
	}

	public List<SymbolProvider.OutlineEntry> getOutline()
	{
		return isReady() ? symbolProvider.outline(getSymbolTable()) : List.of();
	}

	public int offsetOf(int line, int column)
	{
		return LocationMapper.offsetOf(snapshot.getCst().getLineIndex(), new Position(line, column, -1));
	}

	public PrepareRenameResult prepareRename(int offset)
	{
		return prepareRename(offset, CancellationToken.NONE);
	}

	public PrepareRenameResult prepareRename(int offset, CancellationToken token)
	{
		return renameService.prepareRename(offset, token);
	}

	public RenameEdits provideRenameEdits(int offset, String newName)
	{
		return provideRenameEdits(offset, newName, CancellationToken.NONE);
	}

	public RenameEdits provideRenameEdits(int offset, String newName, CancellationToken token)
	{
		return renameService.provideRenameEdits(offset, newName, token);
	}

	/**
	 * Captured nodes of {@code query} over the current CST; empty before the first parse.
	 */
	public List<CstNode> executeQuery(String query)
	{
		return isReady() ? queryManager.executeQuery(query, snapshot.getCst()) : List.of();
	}

	public List<CstNode> findNodesByType(String type)
	{
		return isReady() ? queryManager.findNodesByType(type, snapshot.getCst()) : List.of();
	}

	public CacheStats getQueryCacheStats()
	{
		return queryManager.getCacheStats();
	}

	public String dumpAst()
	{
		return AstJsonWriter.toJson(getAst());
	}
}
