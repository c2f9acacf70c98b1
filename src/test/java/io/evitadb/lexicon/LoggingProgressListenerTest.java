package io.evitadb.lexicon;

import io.evitadb.lexicon.testing.TestLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoggingProgressListener should log a textual progress bar")
public class LoggingProgressListenerTest {

	@Test
	@DisplayName("shouldRenderBar")
	void shouldRenderBar() {
		assertEquals("[=====     ]  50% es (5/10)", LoggingProgressListener.render(5, 10, "es"));
		assertEquals("[==========] 100% fr (3/3)", LoggingProgressListener.render(3, 3, "fr"));
	}

	@Test
	@DisplayName("shouldLogOncePerTenPercent")
	void shouldLogOncePerTenPercent() {
		final TestLog testLog = new TestLog();
		final LoggingProgressListener listener = new LoggingProgressListener(testLog);

		for (int i = 1; i <= 100; i++) {
			listener.onProgress(i, 100, "es");
		}

		assertEquals(10, testLog.getInfos().size());
		assertTrue(testLog.hasInfo("100% es (100/100)"));
	}

	@Test
	@DisplayName("shouldRestartForNextStage")
	void shouldRestartForNextStage() {
		final TestLog testLog = new TestLog();
		final LoggingProgressListener listener = new LoggingProgressListener(testLog);

		listener.onProgress(1, 1, "es");
		listener.onProgress(1, 1, "fr");

		assertEquals(2, testLog.getInfos().size());
	}
}
