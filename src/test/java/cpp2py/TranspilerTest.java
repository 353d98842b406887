package cpp2py;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TranspilerTest {
	@Test
	void permissiveModeKeepsGoingPastDiagnostics() throws Exception {
		String python = new Transpiler().transpile("int a = 1 $ ;\ncout << a << endl;");

		assertEquals("a = 1\nprint(a)", python);
	}

	@Test
	void translateExposesDiagnostics() {
		Translation result = new Transpiler().translate("int a = 1 $ ;");

		assertFalse(result.failed());
		assertEquals(1, result.diagnostics().size());
		assertEquals(Diagnostic.Stage.LEXICAL, result.diagnostics().get(0).stage());
	}

	@Test
	void unbalancedBracesGiveEmptyOutput() {
		Translation result = new Transpiler().translate("int main() { if (x) { y = 1; }");

		assertTrue(result.failed());
		assertEquals("", result.python());
	}

	@Test
	void oversizedArrayFailsWithoutThrowing() {
		Translation result = new Transpiler().translate("int main() { int a[99999999999999999999]; return 0; }");

		assertTrue(result.failed());
		assertEquals("", result.python());
	}

	@Test
	void globalConstructorDeclarationTranslates() throws Exception {
		String python = new Transpiler().transpile("struct P { int v; P(int a) : v(a) { } };\nP origin(4);\nint n(2);");

		assertTrue(python.endsWith("origin = P(4)\nn = 2"), python);
	}

	@Test
	void strictModeRejectsAnyDiagnostic() {
		Transpiler strict = new Transpiler(TranspilerConfig.defaults().withStrict(true));

		TranslationException ex = assertThrows(TranslationException.class, () -> strict.transpile("vector v;"));
		assertEquals(Diagnostic.Stage.GENERATION, ex.diagnostics().get(0).stage());
	}

	@Test
	void emptyInputTranslatesToEmptyBody() throws Exception {
		assertEquals("", new Transpiler().transpile("// nothing here\n"));
	}

	@Test
	void configRejectsNonPositiveIndent() {
		assertThrows(IllegalArgumentException.class, () -> new TranspilerConfig(0, false, null));
		assertEquals(TranspilerConfig.DEFAULT_HEADER, new TranspilerConfig(2, false, null).header());
	}

	@Test
	void configuredIndentWidthIsUsed() throws Exception {
		TranspilerConfig config = new TranspilerConfig(2, false, null);

		assertEquals("while x:\n  x = x - 1", new Transpiler(config).transpile("while (x) x--;"));
	}
}
