package org.crossword.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

public class VariableTest {

	@Test
	public void testEqualityUsesAllFields() {
		Variable v = new Variable(1, 2, Direction.ACROSS, 4);

		assertEquals(v, new Variable(1, 2, Direction.ACROSS, 4));
		assertEquals(v.hashCode(), new Variable(1, 2, Direction.ACROSS, 4).hashCode());
		assertNotEquals(v, new Variable(1, 2, Direction.DOWN, 4));
		assertNotEquals(v, new Variable(1, 2, Direction.ACROSS, 5));
		assertNotEquals(v, new Variable(0, 2, Direction.ACROSS, 4));
		assertNotEquals(v, new Variable(1, 3, Direction.ACROSS, 4));
	}

	@Test
	public void testCellsFollowDirection() {
		Variable across = new Variable(2, 1, Direction.ACROSS, 3);
		Variable down = new Variable(2, 1, Direction.DOWN, 3);

		assertEquals(List.of(new Cell(2, 1), new Cell(2, 2), new Cell(2, 3)), across.getCells());
		assertEquals(List.of(new Cell(2, 1), new Cell(3, 1), new Cell(4, 1)), down.getCells());
	}

	@Test
	public void testNaturalOrder() {
		Variable a = new Variable(0, 0, Direction.ACROSS, 3);
		Variable b = new Variable(0, 0, Direction.DOWN, 3);
		Variable c = new Variable(0, 1, Direction.ACROSS, 2);
		Variable d = new Variable(1, 0, Direction.ACROSS, 2);

		Set<Variable> sorted = new TreeSet<>(List.of(d, c, b, a));
		assertEquals(List.of(a, b, c, d), List.copyOf(sorted));
		assertTrue(a.compareTo(b) < 0);
		assertEquals(0, a.compareTo(new Variable(0, 0, Direction.ACROSS, 3)));
	}

	@Test
	public void testInvalidParameters() {
		assertThrows(IllegalArgumentException.class, () -> new Variable(-1, 0, Direction.ACROSS, 3));
		assertThrows(IllegalArgumentException.class, () -> new Variable(0, 0, null, 3));
		assertThrows(IllegalArgumentException.class, () -> new Variable(0, 0, Direction.DOWN, 0));
	}
}
