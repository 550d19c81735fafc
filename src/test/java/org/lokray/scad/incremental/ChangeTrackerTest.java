package org.lokray.scad.incremental;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeTrackerTest
{
	private ChangeTracker tracker;

	@BeforeEach
	void setUp()
	{
		tracker = new ChangeTracker();
	}

	@Test
	void recordsPositionsInTheNewText()
	{
		Change change = tracker.trackChange(new InputEdit(8, 8, 12), "cube(1);\nsphere(2);");

		assertThat(change.getVersion()).isEqualTo(1);
		assertThat(change.getStartPosition().getLine()).isZero();
		assertThat(change.getNewEndPosition().getLine()).isEqualTo(1);
		assertThat(change.getNewEndPosition().getColumn()).isEqualTo(3);
		assertThat(tracker.getChanges()).containsExactly(change);
	}

	@Test
	void changesSinceAVersion()
	{
		tracker.trackChange(new InputEdit(0, 0, 1), "ab");
		Change second = tracker.trackChange(new InputEdit(1, 1, 2), "ab");

		assertThat(tracker.getChangesSince(1)).containsExactly(second);
		assertThat(tracker.getLastVersion()).isEqualTo(2);
	}

	@Test
	void overlapDecidesWhetherANodeIsAffected()
	{
		tracker.trackChange(new InputEdit(10, 12, 15), "x".repeat(40));

		assertThat(tracker.isNodeAffected(0, 9, 0)).isFalse();
		assertThat(tracker.isNodeAffected(0, 10, 0)).isTrue();
		assertThat(tracker.isNodeAffected(11, 11, 0)).isTrue();
		assertThat(tracker.isNodeAffected(15, 20, 0)).isTrue();
		assertThat(tracker.isNodeAffected(16, 20, 0)).isFalse();
		assertThat(tracker.isNodeAffected(0, 10, 1)).isFalse();
	}

	@Test
	void outOfBoundsEditIsRejected()
	{
		assertThatThrownBy(() -> tracker.trackChange(new InputEdit(0, 0, 10), "abc"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void clearForgetsEverything()
	{
		tracker.trackChange(new InputEdit(0, 0, 1), "a");
		tracker.clear();

		assertThat(tracker.getChanges()).isEmpty();
	}
}
