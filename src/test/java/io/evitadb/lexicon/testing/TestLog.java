package io.evitadb.lexicon.testing;

import org.apache.maven.plugin.logging.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maven log capturing every message per level.
 */
public class TestLog implements Log {
	private final List<String> debugs = Collections.synchronizedList(new ArrayList<>());
	private final List<String> infos = Collections.synchronizedList(new ArrayList<>());
	private final List<String> warns = Collections.synchronizedList(new ArrayList<>());
	private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

	@Override public boolean isDebugEnabled() { return true; }
	@Override public void debug(CharSequence content) { debugs.add(content.toString()); }
	@Override public void debug(CharSequence content, Throwable error) { debugs.add(content.toString()); }
	@Override public void debug(Throwable error) {}
	@Override public boolean isInfoEnabled() { return true; }
	@Override public void info(CharSequence content) { infos.add(content.toString()); }
	@Override public void info(CharSequence content, Throwable error) { infos.add(content.toString()); }
	@Override public void info(Throwable error) {}
	@Override public boolean isWarnEnabled() { return true; }
	@Override public void warn(CharSequence content) { warns.add(content.toString()); }
	@Override public void warn(CharSequence content, Throwable error) { warns.add(content.toString()); }
	@Override public void warn(Throwable error) {}
	@Override public boolean isErrorEnabled() { return true; }
	@Override public void error(CharSequence content) { errors.add(content.toString()); }
	@Override public void error(CharSequence content, Throwable error) { errors.add(content.toString()); }
	@Override public void error(Throwable error) {}

	public boolean hasInfo(String substring) {
		return contains(infos, substring);
	}

	public boolean hasWarn(String substring) {
		return contains(warns, substring);
	}

	public boolean hasError(String substring) {
		return contains(errors, substring);
	}

	public List<String> getInfos() {
		return List.copyOf(infos);
	}

	public String getAll() {
		final List<String> all = new ArrayList<>();
		all.addAll(debugs);
		all.addAll(infos);
		all.addAll(warns);
		all.addAll(errors);
		return String.join("\n", all);
	}

	private static boolean contains(List<String> messages, String substring) {
		synchronized (messages) {
			return messages.stream().anyMatch(s -> s.toLowerCase().contains(substring.toLowerCase()));
		}
	}
}
