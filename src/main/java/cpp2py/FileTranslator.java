package cpp2py;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Translates C++ files on disk.
 *
 * Output files hold the configured header line, the translated body and a trailing newline.
 */
public final class FileTranslator {
	private static final Logger LOGGER = Logger.getLogger(FileTranslator.class.getName());

	private static final List<String> SOURCE_EXTENSIONS = List.of(".cpp", ".cc", ".cxx");

	private final TranspilerConfig config;
	private final Transpiler transpiler;

	public FileTranslator() {
		this(TranspilerConfig.defaults());
	}

	public FileTranslator(TranspilerConfig config) {
		this.config = config;
		this.transpiler = new Transpiler(config);
	}

	public void translateFile(Path input, Path output) throws IOException, TranslationException {
		String source = Files.readString(input, StandardCharsets.UTF_8);
		String python = transpiler.transpile(source);

		Path parent = output.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(output, config.header() + "\n" + python + "\n", StandardCharsets.UTF_8);
		LOGGER.info("Translation complete. Wrote " + output);
	}

	/**
	 * Translates every C++ source under {@code cppRoot} to a parallel tree of .py files.
	 *
	 * Important: each input file produces one output file; nothing is merged or resolved across files.
	 */
	public void translateTree(Path cppRoot, Path pyOutRoot) throws IOException, TranslationException {
		List<Path> sources;
		try (Stream<Path> paths = Files.walk(cppRoot)) {
			sources = paths
					.filter(Files::isRegularFile)
					.filter(p -> sourceExtension(p) != null)
					.sorted()
					.collect(Collectors.toList());
		}
		for (Path source : sources) {
			translateFile(source, pyOutRoot.resolve(outputPath(cppRoot.relativize(source))));
		}
	}

	static Path outputPath(Path relativeSource) {
		String fileName = relativeSource.getFileName().toString();
		String ext = sourceExtension(relativeSource);
		String base = ext == null ? fileName : fileName.substring(0, fileName.length() - ext.length());
		Path parent = relativeSource.getParent();
		return parent == null ? Path.of(base + ".py") : parent.resolve(base + ".py");
	}

	private static String sourceExtension(Path p) {
		String name = p.getFileName().toString();
		for (String ext : SOURCE_EXTENSIONS) {
			if (name.endsWith(ext)) {
				return ext;
			}
		}
		return null;
	}
}
