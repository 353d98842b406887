package cpp2py;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Main {
	static final String USAGE = "Usage: cpp2py [--strict] <input.cpp|input-dir> <output.py|output-dir>";

	private Main() {
	}

	public static void main(String[] args) throws IOException {
		int status = run(args);
		if (status != 0) {
			System.exit(status);
		}
	}

	/**
	 * Returns the process exit status: 0 on success, 1 on bad usage, 2 when strict mode rejected the input.
	 */
	static int run(String[] args) throws IOException {
		boolean strict = false;
		List<String> paths = new ArrayList<>();
		for (String arg : args) {
			if (arg.equals("--strict")) {
				strict = true;
			} else if (arg.startsWith("--")) {
				System.err.println("Unknown option: " + arg);
				System.err.println(USAGE);
				return 1;
			} else {
				paths.add(arg);
			}
		}
		if (paths.size() != 2) {
			System.err.println(USAGE);
			return 1;
		}

		Path input = Path.of(paths.get(0));
		Path output = Path.of(paths.get(1));
		FileTranslator translator = new FileTranslator(TranspilerConfig.defaults().withStrict(strict));
		try {
			if (Files.isDirectory(input)) {
				translator.translateTree(input, output);
			} else {
				translator.translateFile(input, output);
			}
		} catch (TranslationException ex) {
			System.err.println(ex.getMessage());
			for (Diagnostic d : ex.diagnostics()) {
				System.err.println("  " + d);
			}
			return 2;
		}
		return 0;
	}
}
