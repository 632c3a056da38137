package org.crossword.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class DomainStoreTest {

	private final Variable a = new Variable(0, 0, Direction.ACROSS, 3);
	private final Variable b = new Variable(0, 0, Direction.DOWN, 3);

	@Test
	public void testEachVariableGetsIndependentCopy() {
		DomainStore store = new DomainStore(List.of(a, b), List.of("CAT", "DOG"));

		store.removeAll(a, List.of("CAT"));

		assertEquals(Set.of("DOG"), store.get(a));
		assertEquals(Set.of("CAT", "DOG"), store.get(b));
	}

	@Test
	public void testRemoveAllReportsRemovedCount() {
		DomainStore store = new DomainStore(List.of(a), List.of("CAT", "DOG", "NET"));

		assertEquals(2, store.removeAll(a, List.of("CAT", "NET", "ZZZ")));
		assertEquals(0, store.removeAll(a, List.of("CAT")));
		assertEquals(1, store.size(a));
	}

	@Test
	public void testEmptyDomainDetection() {
		DomainStore store = new DomainStore(List.of(a, b), List.of("CAT"));
		assertFalse(store.hasEmptyDomain());

		store.removeAll(b, List.of("CAT"));
		assertTrue(store.isEmpty(b));
		assertTrue(store.hasEmptyDomain());
	}

	@Test
	public void testSnapshotAndRestore() {
		DomainStore store = new DomainStore(List.of(a, b), List.of("CAT", "DOG"));
		DomainStore saved = store.snapshot();

		store.set(a, Set.of("CAT"));
		store.removeAll(b, List.of("CAT", "DOG"));
		assertEquals(Set.of("CAT", "DOG"), saved.get(a));

		store.restore(saved);
		assertEquals(Set.of("CAT", "DOG"), store.get(a));
		assertEquals(Set.of("CAT", "DOG"), store.get(b));
	}

	@Test
	public void testDomainViewIsReadOnlyAndSorted() {
		DomainStore store = new DomainStore(List.of(a), List.of("NET", "CAT"));

		assertEquals(List.of("CAT", "NET"), List.copyOf(store.get(a)));
		assertThrows(UnsupportedOperationException.class, () -> store.get(a).add("DOG"));
		assertThrows(IllegalArgumentException.class, () -> store.get(b));
	}
}
