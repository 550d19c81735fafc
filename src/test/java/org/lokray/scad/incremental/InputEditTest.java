package org.lokray.scad.incremental;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InputEditTest
{
	@Test
	void betweenFindsTheChangedSpan()
	{
		InputEdit edit = InputEdit.between("cube(10);", "cube(120);");

		assertThat(edit).isEqualTo(new InputEdit(6, 6, 7));
		assertThat(edit.getDelta()).isEqualTo(1);
		assertThat(edit.isConsistentWith("cube(10);", "cube(120);")).isTrue();
	}

	@Test
	void betweenHandlesDeletionAtTheEnd()
	{
		InputEdit edit = InputEdit.between("cube(1); sphere(2);", "cube(1);");

		assertThat(edit).isEqualTo(new InputEdit(8, 19, 8));
	}

	@Test
	void inconsistentEditsAreDetected()
	{
		assertThat(new InputEdit(0, 1, 1).isConsistentWith("abc", "xbcd")).isFalse();
		assertThat(new InputEdit(2, 1, 3).isConsistentWith("abc", "abc")).isFalse();
		assertThat(new InputEdit(0, 1, 2).isConsistentWith("abc", "zzbc")).isTrue();
	}
}
