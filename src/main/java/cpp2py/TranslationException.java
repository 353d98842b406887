package cpp2py;

import java.util.List;

/**
 * Thrown in strict mode when a translation produced diagnostics.
 */
public class TranslationException extends Exception {
	private final List<Diagnostic> diagnostics;

	public TranslationException(String message, List<Diagnostic> diagnostics) {
		super(message);
		this.diagnostics = List.copyOf(diagnostics);
	}

	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}
}
