package cpp2py.parse.cpp;

import cpp2py.Diagnostic;
import cpp2py.Diagnostics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CppLexerTest {
	private static String lexemes(List<CppToken> tokens) {
		return tokens.stream()
				.filter(t -> t.type() != CppTokenType.EOF)
				.map(CppToken::lexeme)
				.collect(Collectors.joining("|"));
	}

	@Test
	void skipsCommentsButNotInsideStrings() {
		String input = "int x = 1; // line\n" +
				"/* block */ int y=2;\n" +
				"string s = \"/* not a comment */\"; // trailing\n";

		List<CppToken> tokens = new CppLexer(new Diagnostics()).lex(input);

		assertEquals("int|x|=|1|;|int|y|=|2|;|string|s|=|\"/* not a comment */\"|;", lexemes(tokens));
	}

	@Test
	void dropsDirectivesUsingNamespaceAndStdPrefix() {
		String input = "#include <iostream>\n" +
				"  #define N 10\n" +
				"using namespace std;\n" +
				"std::cout << std::endl;\n";

		List<CppToken> tokens = new CppLexer(new Diagnostics()).lex(input);

		assertEquals("cout|<<|endl|;", lexemes(tokens));
		assertEquals(CppTokenType.KEYWORD, tokens.get(0).type());
		assertEquals(4, tokens.get(0).line());
	}

	@Test
	void prefersTwoCharacterSymbols() {
		List<CppToken> tokens = new CppLexer(new Diagnostics()).lex("a<<=b>>c!=d&&e||f++ -= ::");

		List<String> lexemes = tokens.stream()
				.filter(t -> t.type() != CppTokenType.EOF)
				.map(CppToken::lexeme)
				.collect(Collectors.toList());
		assertEquals(List.of("a", "<<", "=", "b", ">>", "c", "!=", "d", "&&", "e", "||", "f", "++", "-=", "::"), lexemes);
	}

	@Test
	void convertsNumericLiterals() {
		List<CppToken> tokens = new CppLexer(new Diagnostics()).lex("42 10UL 3.5f .5 1e3 7");

		assertEquals(CppTokenType.INT, tokens.get(0).type());
		assertEquals(42L, tokens.get(0).value());
		assertEquals(CppTokenType.INT, tokens.get(1).type());
		assertEquals(10L, tokens.get(1).value());
		assertEquals("10UL", tokens.get(1).lexeme());
		assertEquals(CppTokenType.FLOAT, tokens.get(2).type());
		assertEquals(3.5, tokens.get(2).value());
		assertEquals(0.5, tokens.get(3).value());
		assertEquals(CppTokenType.FLOAT, tokens.get(4).type());
		assertEquals(1000.0, tokens.get(4).value());
		assertEquals(7L, tokens.get(5).value());
	}

	@Test
	void leadingZeroAndHexPrefixSelectRadix() {
		Diagnostics diagnostics = new Diagnostics();
		List<CppToken> tokens = new CppLexer(diagnostics).lex("010 0 0x1F 0XffUL 0.5");

		assertEquals(8L, tokens.get(0).value());
		assertEquals(0L, tokens.get(1).value());
		assertEquals(31L, tokens.get(2).value());
		assertEquals(255L, tokens.get(3).value());
		assertEquals("0XffUL", tokens.get(3).lexeme());
		assertEquals(0.5, tokens.get(4).value());
		assertTrue(diagnostics.isEmpty());
	}

	@Test
	void octalLiteralWithDecimalDigitIsReported() {
		Diagnostics diagnostics = new Diagnostics();
		List<CppToken> tokens = new CppLexer(diagnostics).lex("09");

		assertEquals(9L, tokens.get(0).value());
		assertTrue(diagnostics.has(Diagnostic.Stage.LEXICAL));
	}

	@Test
	void booleansCarryTheirValue() {
		List<CppToken> tokens = new CppLexer(new Diagnostics()).lex("true false");

		assertEquals(Boolean.TRUE, tokens.get(0).value());
		assertEquals(Boolean.FALSE, tokens.get(1).value());
	}

	@Test
	void keepsEscapesVerbatim() {
		List<CppToken> tokens = new CppLexer(new Diagnostics()).lex("\"a\\\"b\\n\" '\\''");

		assertEquals(CppTokenType.STRING, tokens.get(0).type());
		assertEquals("\"a\\\"b\\n\"", tokens.get(0).lexeme());
		assertEquals(CppTokenType.CHAR, tokens.get(1).type());
		assertEquals("'\\''", tokens.get(1).lexeme());
	}

	@Test
	void reportsIllegalCharacterAndContinues() {
		Diagnostics diagnostics = new Diagnostics();
		List<CppToken> tokens = new CppLexer(diagnostics).lex("int a;\nint b @ 3;");

		assertEquals("int|a|;|int|b|3|;", lexemes(tokens));
		assertEquals(1, diagnostics.entries().size());
		Diagnostic d = diagnostics.entries().get(0);
		assertEquals(Diagnostic.Stage.LEXICAL, d.stage());
		assertEquals("Illegal character '@' at line 2", d.message());
		assertEquals(2, d.line());
	}

	@Test
	void countsLinesInsideBlockComments() {
		List<CppToken> tokens = new CppLexer(new Diagnostics()).lex("/* one\ntwo\n*/ x");

		assertEquals(3, tokens.get(0).line());
	}

	@Test
	void reportsUnterminatedString() {
		Diagnostics diagnostics = new Diagnostics();
		new CppLexer(diagnostics).lex("string s = \"open;\nint x;");

		assertTrue(diagnostics.has(Diagnostic.Stage.LEXICAL));
	}
}
