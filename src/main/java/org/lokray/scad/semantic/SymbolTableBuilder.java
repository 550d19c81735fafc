package org.lokray.scad.semantic;

import org.lokray.scad.ast.AssignmentNode;
import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.Binding;
import org.lokray.scad.ast.CallNode;
import org.lokray.scad.ast.ForLoopNode;
import org.lokray.scad.ast.FunctionDefinitionNode;
import org.lokray.scad.ast.IfNode;
import org.lokray.scad.ast.LetNode;
import org.lokray.scad.ast.ModuleDefinitionNode;
import org.lokray.scad.ast.ModuleInstantiationNode;
import org.lokray.scad.ast.ModuleParameter;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.ast.SourceLocation;
import org.lokray.scad.ast.expression.ExpressionNode;
import org.lokray.scad.ast.expression.FunctionCallNode;
import org.lokray.scad.ast.expression.IdentifierNode;
import org.lokray.scad.ast.expression.LetExpressionNode;
import org.lokray.scad.ast.expression.ListComprehensionNode;
import org.lokray.scad.evaluation.BuiltinFunctions;
import org.lokray.scad.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Walks an AST once and records declarations and uses. Scopes live on an explicit stack since AST
 * nodes do not know their parents.
 */
public class SymbolTableBuilder
{
	public static final List<String> BUILTIN_CONSTANTS = List.of("PI");
	public static final List<String> BUILTIN_SPECIAL_VARIABLES = List.of(
			"$fn", "$fa", "$fs", "$t", "$vpr", "$vpt", "$vpd", "$vpf", "$children", "$preview");

	private final Deque<Scope> scopeStack = new ArrayDeque<>();
	private final List<Scope> scopes = new ArrayList<>();
	private final List<SymbolReference> references = new ArrayList<>();
	private int nextScopeId;

	public SymbolTable build(List<AstNode> ast)
	{
		scopeStack.clear();
		scopes.clear();
		references.clear();
		nextScopeId = 0;

		Scope builtins = push("builtins");
		for (String name : BUILTIN_CONSTANTS)
		{
			builtins.define(new Symbol(name, SymbolKind.CONSTANT, null, builtins.getId()));
		}
		for (String name : BUILTIN_SPECIAL_VARIABLES)
		{
			builtins.define(new Symbol(name, SymbolKind.CONSTANT, null, builtins.getId()));
		}
		Scope global = push("global");
		sequence(ast);
		pop();
		pop();

		Debug.logDebug("Symbol pass: " + scopes.size() + " scopes, " + references.size() + " references");
		return new SymbolTable(builtins, global, scopes, references);
	}

	private Scope current()
	{
		return scopeStack.peek();
	}

	private Scope push(String description)
	{
		Scope scope = new Scope(nextScopeId++, description, scopeStack.peek());
		scopes.add(scope);
		scopeStack.push(scope);
		return scope;
	}

	private void pop()
	{
		scopeStack.pop();
	}

	/**
	 * Declarations are visible throughout the statement list that holds them, so they are defined
	 * before any statement is walked.
	 */
	private void sequence(List<AstNode> statements)
	{
		Scope scope = current();
		for (AstNode node : statements)
		{
			if (node instanceof ModuleDefinitionNode md)
			{
				scope.define(new Symbol(md.getName(), SymbolKind.MODULE, md.getNameLocation(), scope.getId()));
			}
			else if (node instanceof FunctionDefinitionNode fd)
			{
				scope.define(new Symbol(fd.getName(), SymbolKind.FUNCTION, fd.getNameLocation(), scope.getId()));
			}
			else if (node instanceof AssignmentNode an)
			{
				scope.define(new Symbol(an.getName(), SymbolKind.VARIABLE, an.getNameLocation(), scope.getId()));
			}
		}
		for (AstNode node : statements)
		{
			statement(node);
		}
	}

	private void scopedSequence(String description, List<AstNode> statements)
	{
		if (statements.isEmpty())
		{
			return;
		}
		push(description);
		sequence(statements);
		pop();
	}

	private void statement(AstNode node)
	{
		if (node instanceof ModuleDefinitionNode md)
		{
			declared(Namespace.MODULE, md.getName(), md.getNameLocation());
			push("module " + md.getName());
			parameters(md.getParameters());
			sequence(md.getBody());
			pop();
		}
		else if (node instanceof FunctionDefinitionNode fd)
		{
			declared(Namespace.FUNCTION, fd.getName(), fd.getNameLocation());
			push("function " + fd.getName());
			parameters(fd.getParameters());
			expression(fd.getExpression());
			pop();
		}
		else if (node instanceof AssignmentNode an)
		{
			declared(Namespace.VARIABLE, an.getName(), an.getNameLocation());
			expression(an.getValue());
		}
		else if (node instanceof CallNode call)
		{
			if (call instanceof ModuleInstantiationNode)
			{
				use(Namespace.MODULE, call.getName(), call.getNameLocation());
			}
			arguments(call.getParameters());
			scopedSequence("children of " + call.getName(), call.getChildren());
		}
		else if (node instanceof IfNode in)
		{
			expression(in.getCondition());
			scopedSequence("if", in.getThenBranch());
			scopedSequence("else", in.getElseBranch());
		}
		else if (node instanceof ForLoopNode fl)
		{
			push("for");
			bindings(fl.getBindings());
			sequence(fl.getBody());
			pop();
		}
		else if (node instanceof LetNode ln)
		{
			push("let");
			bindings(ln.getBindings());
			sequence(ln.getBody());
			pop();
		}
		else if (node instanceof ExpressionNode expression)
		{
			expression(expression);
		}
		else
		{
			// include/use statements and error nodes hold no names
			node.getSubNodes().forEach(this::statement);
		}
	}

	private void expression(ExpressionNode node)
	{
		if (node == null)
		{
			return;
		}
		if (node instanceof IdentifierNode id)
		{
			identifier(id);
		}
		else if (node instanceof FunctionCallNode call)
		{
			if (call.getCallee() instanceof IdentifierNode callee)
			{
				functionName(callee);
			}
			else
			{
				expression(call.getCallee());
			}
			arguments(call.getArguments());
		}
		else if (node instanceof LetExpressionNode let)
		{
			push("let");
			bindings(let.getBindings());
			expression(let.getBody());
			pop();
		}
		else if (node instanceof ListComprehensionNode comprehension)
		{
			boolean scoped = comprehension.getForm() != ListComprehensionNode.Form.IF;
			if (scoped)
			{
				push(comprehension.getForm().name().toLowerCase() + " comprehension");
			}
			bindings(comprehension.getBindings());
			comprehension.getCondition().ifPresent(this::expression);
			expression(comprehension.getBody());
			comprehension.getAlternative().ifPresent(this::expression);
			if (scoped)
			{
				pop();
			}
		}
		else
		{
			for (AstNode sub : node.getSubNodes())
			{
				if (sub instanceof ExpressionNode e)
				{
					expression(e);
				}
				else
				{
					statement(sub);
				}
			}
		}
	}

	private void identifier(IdentifierNode id)
	{
		Optional<Symbol> symbol = current().resolve(Namespace.VARIABLE, id.getName());
		if (symbol.isPresent() || !id.isSpecialVariable())
		{
			// Unknown special variables are dynamically scoped; they are not reported
			references.add(new SymbolReference(id.getName(), Namespace.VARIABLE, symbol.orElse(null), id.getLocation(), false, current()));
		}
	}

	private void functionName(IdentifierNode callee)
	{
		String name = callee.getName();
		Optional<Symbol> function = current().resolve(Namespace.FUNCTION, name);
		if (function.isPresent())
		{
			references.add(new SymbolReference(name, Namespace.FUNCTION, function.get(), callee.getLocation(), false, current()));
			return;
		}
		if (BuiltinFunctions.defaults().containsKey(name))
		{
			return;
		}
		// A variable may hold a function literal
		Optional<Symbol> variable = current().resolve(Namespace.VARIABLE, name);
		references.add(variable
				.map(v -> new SymbolReference(name, Namespace.VARIABLE, v, callee.getLocation(), false, current()))
				.orElseGet(() -> new SymbolReference(name, Namespace.FUNCTION, null, callee.getLocation(), false, current())));
	}

	private void arguments(List<Parameter> parameters)
	{
		for (Parameter parameter : parameters)
		{
			expression(parameter.getExpression());
		}
	}

	private void parameters(List<ModuleParameter> parameters)
	{
		Scope scope = current();
		for (ModuleParameter parameter : parameters)
		{
			parameter.getDefaultExpression().ifPresent(this::expression);
			Symbol symbol = scope.define(new Symbol(parameter.getName(), SymbolKind.PARAMETER, parameter.getLocation(), scope.getId()));
			references.add(new SymbolReference(parameter.getName(), Namespace.VARIABLE, symbol, parameter.getLocation(), true, scope));
		}
	}

	/**
	 * Let and for bindings see the ones before them.
	 */
	private void bindings(List<Binding> bindings)
	{
		Scope scope = current();
		for (Binding binding : bindings)
		{
			expression(binding.getValue());
			Symbol symbol = scope.define(new Symbol(binding.getName(), SymbolKind.VARIABLE, binding.getNameLocation(), scope.getId()));
			references.add(new SymbolReference(binding.getName(), Namespace.VARIABLE, symbol, binding.getNameLocation(), true, scope));
		}
	}

	private void declared(Namespace namespace, String name, SourceLocation location)
	{
		Symbol symbol = current().resolveLocally(namespace, name).orElse(null);
		references.add(new SymbolReference(name, namespace, symbol, location, true, current()));
	}

	private void use(Namespace namespace, String name, SourceLocation location)
	{
		Symbol symbol = current().resolve(namespace, name).orElse(null);
		references.add(new SymbolReference(name, namespace, symbol, location, false, current()));
	}
}
