package cpp2py;

/**
 * A single advisory message produced while translating.
 *
 * {@code line} is -1 when the message is not tied to a source line.
 */
public record Diagnostic(Stage stage, String message, int line) {
	public enum Stage {
		LEXICAL, SYNTAX, GENERATION
	}

	@Override
	public String toString() {
		return stage + ": " + message;
	}
}
