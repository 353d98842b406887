package cpp2py;

import java.util.List;

/**
 * Outcome of one translation: the rendered Python body (no header) and everything reported on the way.
 */
public record Translation(String python, List<Diagnostic> diagnostics) {
	/**
	 * True when the parse was abandoned; {@link #python()} is then empty.
	 */
	public boolean failed() {
		return diagnostics.stream().anyMatch(d -> d.stage() == Diagnostic.Stage.SYNTAX);
	}
}
