package org.lokray.scad.builder;

import org.lokray.scad.util.Debug;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps node-type keys to handlers. Keys are module names ({@code cube}, {@code translate}) for
 * module calls and CST node types ({@code if_statement}) for everything else. A later registration
 * for the same key replaces the earlier one.
 */
public class NodeHandlerRegistry
{
	private final Map<String, NodeHandler> handlers = new HashMap<>();

	public static NodeHandlerRegistry createDefault()
	{
		NodeHandlerRegistry registry = new NodeHandlerRegistry();
		BuiltinHandlers.registerAll(registry);
		return registry;
	}

	public void register(String nodeType, NodeHandler handler)
	{
		if (nodeType == null || nodeType.isBlank())
		{
			throw new InvalidRegistrationException("Node type must not be empty");
		}
		if (handler == null)
		{
			throw new InvalidRegistrationException("Handler for '" + nodeType + "' must not be null");
		}
		if (handlers.put(nodeType, handler) != null)
		{
			Debug.logDebug("Replaced handler for '" + nodeType + "'");
		}
	}

	public Optional<NodeHandler> getHandler(String nodeType)
	{
		return Optional.ofNullable(handlers.get(nodeType));
	}

	public boolean hasHandler(String nodeType)
	{
		return handlers.containsKey(nodeType);
	}

	public boolean unregister(String nodeType)
	{
		return handlers.remove(nodeType) != null;
	}

	/**
	 * Registered keys in alphabetical order.
	 */
	public Set<String> listRegisteredTypes()
	{
		return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
	}
}
