package cpp2py;

/**
 * Settings for one {@link Transpiler}.
 *
 * @param indentWidth spaces per indentation level of the generated Python
 * @param strict      when true, any diagnostic aborts the translation with a {@link TranslationException}
 * @param header      provenance comment written on the first line of translated files
 */
public record TranspilerConfig(int indentWidth, boolean strict, String header) {
	public static final String DEFAULT_HEADER = "# Translated from C++ (subset) to Python";

	public TranspilerConfig {
		if (indentWidth < 1) {
			throw new IllegalArgumentException("indentWidth must be positive: " + indentWidth);
		}
		if (header == null) {
			header = DEFAULT_HEADER;
		}
	}

	public static TranspilerConfig defaults() {
		return new TranspilerConfig(4, false, DEFAULT_HEADER);
	}

	public TranspilerConfig withStrict(boolean strict) {
		return new TranspilerConfig(indentWidth, strict, header);
	}
}
