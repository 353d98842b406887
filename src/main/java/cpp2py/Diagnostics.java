package cpp2py;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects the diagnostics of one translation and echoes them to the log.
 *
 * Not thread-safe; every translation owns its own instance.
 */
public final class Diagnostics {
	private static final Logger LOGGER = Logger.getLogger(Diagnostics.class.getName());

	private final List<Diagnostic> entries = new ArrayList<>();

	public void report(Diagnostic.Stage stage, String message, int line) {
		Diagnostic d = new Diagnostic(stage, message, line);
		entries.add(d);
		LOGGER.log(stage == Diagnostic.Stage.GENERATION ? Level.FINE : Level.WARNING, message);
	}

	public List<Diagnostic> entries() {
		return Collections.unmodifiableList(entries);
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public boolean has(Diagnostic.Stage stage) {
		return entries.stream().anyMatch(d -> d.stage() == stage);
	}
}
