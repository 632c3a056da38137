package org.crossword.csp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.crossword.support.Direction;
import org.crossword.support.Variable;
import org.junit.jupiter.api.Test;

public class CSPResultTest {

	private final Variable across = new Variable(0, 0, Direction.ACROSS, 3);
	private final Variable down = new Variable(0, 2, Direction.DOWN, 3);

	@Test
	public void testSatisfiableCopiesAssignmentInNaturalOrder() {
		Map<Variable, String> assignment = new HashMap<>();
		assignment.put(down, "TEN");
		assignment.put(across, "CAT");

		CSPResult result = CSPResult.satisfiable(assignment, new CSPStatistics());
		assignment.clear();

		assertTrue(result.isSatisfiable());
		assertEquals(List.of(across, down), List.copyOf(result.getAssignment().keySet()));
		assertThrows(UnsupportedOperationException.class, () -> result.getAssignment().put(across, "DOG"));
		assertTrue(result.toString().startsWith("SAT\n"));
	}

	@Test
	public void testUnsatisfiable() {
		CSPResult result = CSPResult.unsatisfiable("dominio vuoto", new CSPStatistics());

		assertTrue(result.isUnsatisfiable());
		assertEquals("UNSAT\nNessuna soluzione: dominio vuoto\n", result.toString());
		assertThrows(IllegalArgumentException.class, () -> CSPResult.satisfiable(null, null));
	}

	@Test
	public void testStatisticsTimerStopsOnce() {
		CSPStatistics statistics = new CSPStatistics();
		statistics.startTimer();
		statistics.stopTimer();
		long time = statistics.getExecutionTimeMs();
		statistics.stopTimer();

		assertTrue(statistics.isTimerStopped());
		assertEquals(time, statistics.getExecutionTimeMs());
	}

	@Test
	public void testStatisticsTimerIdleUntilStarted() throws InterruptedException {
		CSPStatistics statistics = new CSPStatistics();
		Thread.sleep(20);

		assertFalse(statistics.isTimerStarted());
		assertEquals(0, statistics.getExecutionTimeMs());

		statistics.stopTimer();
		assertEquals(0, statistics.getExecutionTimeMs());
	}
}
