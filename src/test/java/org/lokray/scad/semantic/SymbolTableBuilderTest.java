package org.lokray.scad.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.scad.session.OpenScadParser;
import org.lokray.scad.util.ParserConfig;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableBuilderTest
{
	private SymbolTable table(String text)
	{
		OpenScadParser session = new OpenScadParser(ParserConfig.defaults());
		session.parseToAST(text);
		return session.getSymbolTable();
	}

	@Test
	void modulesFunctionsAndVariablesLiveInSeparateNamespaces()
	{
		SymbolTable table = table("module a() {} function a() = 1; a = 2;");
		Scope global = table.getGlobalScope();

		assertThat(global.resolveLocally(Namespace.MODULE, "a")).get().extracting(Symbol::getKind).isEqualTo(SymbolKind.MODULE);
		assertThat(global.resolveLocally(Namespace.FUNCTION, "a")).get().extracting(Symbol::getKind).isEqualTo(SymbolKind.FUNCTION);
		assertThat(global.resolveLocally(Namespace.VARIABLE, "a")).get().extracting(Symbol::getKind).isEqualTo(SymbolKind.VARIABLE);
	}

	@Test
	void declarationsAreVisibleBeforeTheirStatement()
	{
		String text = "m(); module m() {}";
		SymbolTable table = table(text);

		SymbolReference call = table.findReferenceAt(0).orElseThrow();

		assertThat(call.isResolved()).isTrue();
		assertThat(call.isDeclaration()).isFalse();
		assertThat(table.findReferences(call.getSymbol())).hasSize(2);
	}

	@Test
	void reassignmentIsTheSameVariable()
	{
		SymbolTable table = table("x = 1; x = 2; echo(x);");

		Symbol x = table.getGlobalScope().resolveLocally(Namespace.VARIABLE, "x").orElseThrow();

		assertThat(table.findReferences(x)).hasSize(3);
		assertThat(table.findReferences(x)).filteredOn(SymbolReference::isDeclaration).hasSize(2);
	}

	@Test
	void letAndForBindingsAreScoped()
	{
		SymbolTable table = table("for (i = [0:3]) cube(i); let (j = 2) sphere(j); echo(i);");

		assertThat(table.getUnresolved()).extracting(SymbolReference::getName).containsExactly("i");
		assertThat(table.getGlobalScope().resolveLocally(Namespace.VARIABLE, "i")).isEmpty();
	}

	@Test
	void comprehensionVariablesResolveInsideTheComprehension()
	{
		SymbolTable table = table("v = [for (k = [1:3]) k * k];");

		assertThat(table.getUnresolved()).isEmpty();
	}

	@Test
	void builtinsResolveWithoutDeclarations()
	{
		SymbolTable table = table("x = PI * sin(30); sphere(1, $fn = 12); echo($fn);");

		assertThat(table.getUnresolved()).isEmpty();
		assertThat(table.getBuiltinScope().resolveLocally(Namespace.VARIABLE, "PI")).get()
				.extracting(Symbol::getKind).isEqualTo(SymbolKind.CONSTANT);
		assertThat(table.getSymbols()).extracting(Symbol::getName).containsExactly("x");
	}

	@Test
	void unknownFunctionIsUnresolvedInTheFunctionNamespace()
	{
		SymbolTable table = table("x = helper(1);");

		assertThat(table.getUnresolved()).singleElement()
				.extracting(SymbolReference::getNamespace).isEqualTo(Namespace.FUNCTION);
	}
}
