package io.evitadb.lexicon.stage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StageSummary should be an immutable counter")
public class StageSummaryTest {

	@Test
	@DisplayName("shouldCountWithoutMutation")
	void shouldCountWithoutMutation() {
		final StageSummary empty = StageSummary.empty();
		final StageSummary summary = empty.withProcessed().withProcessed().withSkipped().withFailure();

		assertEquals(0, empty.getTotalCount());
		assertEquals(2, summary.processed());
		assertEquals(1, summary.skipped());
		assertEquals(1, summary.failed());
		assertEquals(4, summary.getTotalCount());
		assertFalse(summary.aborted());
	}

	@Test
	@DisplayName("shouldCombineSummariesAndKeepAbort")
	void shouldCombineSummariesAndKeepAbort() {
		final StageSummary combined = StageSummary.empty().withProcessed()
			.add(StageSummary.empty().withFailure().withAbort());

		assertEquals(1, combined.processed());
		assertEquals(1, combined.failed());
		assertTrue(combined.aborted());
		assertTrue(combined.toString().contains("aborted"));
	}
}
