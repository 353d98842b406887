package cpp2py;

import cpp2py.ast.cpp.CppProgram;
import cpp2py.parse.cpp.CppParser;
import cpp2py.print.PythonPrinter;

/**
 * Public entrypoint for C++ -> Python translation.
 *
 * Each call builds its own lexer, parser, printer and environment, so one instance may serve concurrent callers.
 */
public final class Transpiler {
	private final TranspilerConfig config;

	public Transpiler() {
		this(TranspilerConfig.defaults());
	}

	public Transpiler(TranspilerConfig config) {
		this.config = config;
	}

	/**
	 * Translates and hands back diagnostics alongside the output. Never throws, whatever the mode.
	 */
	public Translation translate(String cppSource) {
		Diagnostics diagnostics = new Diagnostics();
		CppProgram program = new CppParser(diagnostics).parse(cppSource);
		String python = new PythonPrinter(diagnostics, config.indentWidth()).print(program);
		return new Translation(python, diagnostics.entries());
	}

	/**
	 * Translates to the Python body. In strict mode any diagnostic becomes a {@link TranslationException}.
	 */
	public String transpile(String cppSource) throws TranslationException {
		Translation result = translate(cppSource);
		if (config.strict() && !result.diagnostics().isEmpty()) {
			throw new TranslationException(
					"Translation produced " + result.diagnostics().size() + " diagnostic(s)", result.diagnostics());
		}
		return result.python();
	}
}
