package org.lokray.scad.builder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeHandlerRegistryTest
{
	@Test
	void defaultRegistryKnowsPrimitivesAndStatements()
	{
		NodeHandlerRegistry registry = NodeHandlerRegistry.createDefault();

		assertThat(registry.listRegisteredTypes()).contains("cube", "sphere", "cylinder", "translate", "color", "offset",
				"if_statement", "module_definition");
		assertThat(registry.hasHandler("cube")).isTrue();
		assertThat(registry.hasHandler("no_such_node")).isFalse();
	}

	@Test
	void blankOrNullRegistrationsAreRejected()
	{
		NodeHandlerRegistry registry = new NodeHandlerRegistry();

		assertThatThrownBy(() -> registry.register(null, (node, context) -> null))
				.isInstanceOf(InvalidRegistrationException.class);
		assertThatThrownBy(() -> registry.register("  ", (node, context) -> null))
				.isInstanceOf(InvalidRegistrationException.class);
		assertThatThrownBy(() -> registry.register("cube", null))
				.isInstanceOf(InvalidRegistrationException.class)
				.hasMessageContaining("cube");
	}

	@Test
	void laterRegistrationReplacesEarlierOne()
	{
		NodeHandlerRegistry registry = new NodeHandlerRegistry();
		NodeHandler first = (node, context) -> null;
		NodeHandler second = (node, context) -> null;

		registry.register("cube", first);
		registry.register("cube", second);

		assertThat(registry.getHandler("cube")).containsSame(second);
		assertThat(registry.listRegisteredTypes()).containsExactly("cube");
	}

	@Test
	void unregisterRemovesTheHandler()
	{
		NodeHandlerRegistry registry = NodeHandlerRegistry.createDefault();

		assertThat(registry.unregister("sphere")).isTrue();
		assertThat(registry.unregister("sphere")).isFalse();
		assertThat(registry.getHandler("sphere")).isEmpty();
	}

	@Test
	void listedTypesAreSortedAndReadOnly()
	{
		NodeHandlerRegistry registry = new NodeHandlerRegistry();
		registry.register("sphere", (node, context) -> null);
		registry.register("cube", (node, context) -> null);

		assertThat(registry.listRegisteredTypes()).containsExactly("cube", "sphere");
		assertThatThrownBy(() -> registry.listRegisteredTypes().add("x")).isInstanceOf(UnsupportedOperationException.class);
	}
}
