package cpp2py.parse.cpp;

import cpp2py.Diagnostic;
import cpp2py.Diagnostics;
import cpp2py.ast.SourcePos;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for the supported C++ subset.
 *
 * Notes:
 * - Skips whitespace, // line comments and /* block comments *\/.
 * - Drops preprocessor lines and {@code using namespace x;} as whole units.
 * - Strips {@code std::} so {@code std::cout} lexes as {@code cout}.
 * - String and char escapes are kept verbatim.
 * - An unrecognized character is reported and skipped; lexing never aborts.
 */
public final class CppLexer {
	static final Set<String> KEYWORDS = Set.of(
			"int", "long", "short", "unsigned", "signed", "float", "double", "char", "bool", "string", "void", "const",
			"if", "else", "for", "while", "return", "break", "continue",
			"cin", "cout", "endl",
			"class", "struct", "public", "private", "protected",
			"true", "false");

	private static final Set<String> DIRECTIVES = Set.of(
			"include", "define", "ifdef", "ifndef", "endif", "pragma", "error");

	private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(
			"==", "!=", "<=", ">=", "&&", "||", "<<", ">>", "++", "--", "+=", "-=", "*=", "/=", "%=", "::");

	private static final String ONE_CHAR_SYMBOLS = "+-*/%=<>!?:.;,(){}[]";

	private static final Pattern USING_NAMESPACE = Pattern.compile("using\\s+namespace\\s+[A-Za-z_][A-Za-z0-9_]*\\s*;");

	private final Diagnostics diagnostics;

	private String input;
	private int pos;
	private int line;
	private int lineStart;

	public CppLexer(Diagnostics diagnostics) {
		this.diagnostics = diagnostics;
	}

	public List<CppToken> lex(String source) {
		this.input = source;
		this.pos = 0;
		this.line = 1;
		this.lineStart = 0;

		List<CppToken> tokens = new ArrayList<>();
		while (pos < input.length()) {
			char c = input.charAt(pos);

			if (c == '\n') {
				newline(pos + 1);
				pos++;
				continue;
			}
			if (Character.isWhitespace(c)) {
				pos++;
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && pos + 1 < input.length()) {
				char n = input.charAt(pos + 1);
				if (n == '/') {
					skipToEndOfLine();
					continue;
				}
				if (n == '*') {
					skipBlockComment();
					continue;
				}
			}

			if (c == '#' && atLineStart() && skipDirective()) {
				continue;
			}

			if (c == '"') {
				tokens.add(quoted(CppTokenType.STRING, '"'));
				continue;
			}
			if (c == '\'') {
				tokens.add(quoted(CppTokenType.CHAR, '\''));
				continue;
			}

			if (c == '0' && pos + 2 < input.length() && (input.charAt(pos + 1) == 'x' || input.charAt(pos + 1) == 'X')
					&& Character.digit(input.charAt(pos + 2), 16) >= 0) {
				tokens.add(hexNumber());
				continue;
			}
			if (Character.isDigit(c) || (c == '.' && nextIsDigit(pos + 1))) {
				tokens.add(number());
				continue;
			}

			if (Character.isLetter(c) || c == '_') {
				CppToken word = word();
				if (word != null) {
					tokens.add(word);
				}
				continue;
			}

			String two = (pos + 1 < input.length()) ? input.substring(pos, pos + 2) : "";
			if (TWO_CHAR_SYMBOLS.contains(two)) {
				tokens.add(token(CppTokenType.SYMBOL, two, two, pos));
				pos += 2;
				continue;
			}
			if (ONE_CHAR_SYMBOLS.indexOf(c) >= 0) {
				String s = String.valueOf(c);
				tokens.add(token(CppTokenType.SYMBOL, s, s, pos));
				pos++;
				continue;
			}

			diagnostics.report(Diagnostic.Stage.LEXICAL,
					"Illegal character '" + c + "' at line " + line, line);
			pos++;
		}

		tokens.add(token(CppTokenType.EOF, "", "", input.length()));
		return tokens;
	}

	private CppToken word() {
		int start = pos;
		if (input.startsWith("using", start)) {
			Matcher m = USING_NAMESPACE.matcher(input).region(start, input.length());
			if (m.lookingAt()) {
				advanceTo(m.end());
				return null;
			}
		}

		pos++;
		while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
			pos++;
		}
		String text = input.substring(start, pos);

		if (text.equals("std") && input.startsWith("::", pos)) {
			pos += 2;
			return null;
		}
		if (text.equals("true") || text.equals("false")) {
			return token(CppTokenType.KEYWORD, text, Boolean.valueOf(text), start);
		}
		if (KEYWORDS.contains(text)) {
			return token(CppTokenType.KEYWORD, text, text, start);
		}
		return token(CppTokenType.IDENT, text, text, start);
	}

	private CppToken number() {
		int start = pos;
		boolean isFloat = false;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos++;
		}
		if (pos < input.length() && input.charAt(pos) == '.') {
			isFloat = true;
			pos++;
			while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
				pos++;
			}
		}
		if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
			int exp = pos + 1;
			if (exp < input.length() && (input.charAt(exp) == '+' || input.charAt(exp) == '-')) {
				exp++;
			}
			if (nextIsDigit(exp)) {
				isFloat = true;
				pos = exp;
				while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
					pos++;
				}
			}
		}
		String digits = input.substring(start, pos);

		// suffixes carry no meaning for the target
		String suffixes = isFloat ? "fFlL" : "uUlL";
		while (pos < input.length() && suffixes.indexOf(input.charAt(pos)) >= 0) {
			pos++;
		}
		String lexeme = input.substring(start, pos);

		if (isFloat) {
			return token(CppTokenType.FLOAT, lexeme, Double.parseDouble(digits), start);
		}
		// a leading zero makes the literal octal
		boolean octal = digits.length() > 1 && digits.charAt(0) == '0';
		if (octal && (digits.indexOf('8') >= 0 || digits.indexOf('9') >= 0)) {
			diagnostics.report(Diagnostic.Stage.LEXICAL,
					"Invalid digit in octal literal " + digits + " at line " + line, line);
			octal = false;
		}
		return integer(digits, octal ? 8 : 10, lexeme, start);
	}

	private CppToken hexNumber() {
		int start = pos;
		pos += 2;
		int digitsStart = pos;
		while (pos < input.length() && Character.digit(input.charAt(pos), 16) >= 0) {
			pos++;
		}
		String digits = input.substring(digitsStart, pos);
		while (pos < input.length() && "uUlL".indexOf(input.charAt(pos)) >= 0) {
			pos++;
		}
		return integer(digits, 16, input.substring(start, pos), start);
	}

	private CppToken integer(String digits, int radix, String lexeme, int start) {
		try {
			return token(CppTokenType.INT, lexeme, Long.parseLong(digits, radix), start);
		} catch (NumberFormatException ex) {
			diagnostics.report(Diagnostic.Stage.LEXICAL,
					"Integer literal " + lexeme + " out of range at line " + line, line);
			return token(CppTokenType.INT, lexeme, Long.MAX_VALUE, start);
		}
	}

	private CppToken quoted(CppTokenType type, char quote) {
		int start = pos;
		int startLine = line;
		int startColumn = start - lineStart + 1;
		pos++;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '\\') {
				// skip escaped character if present
				pos = Math.min(pos + 2, input.length());
				continue;
			}
			if (c == quote) {
				pos++;
				break;
			}
			if (c == '\n') {
				diagnostics.report(Diagnostic.Stage.LEXICAL,
						"Unterminated literal at line " + startLine, startLine);
				break;
			}
			pos++;
		}
		String text = input.substring(start, pos);
		return new CppToken(type, text, text, new SourcePos(startLine, startColumn));
	}

	private boolean skipDirective() {
		int i = pos + 1;
		while (i < input.length() && (input.charAt(i) == ' ' || input.charAt(i) == '\t')) {
			i++;
		}
		int wordStart = i;
		while (i < input.length() && Character.isLetter(input.charAt(i))) {
			i++;
		}
		if (!DIRECTIVES.contains(input.substring(wordStart, i))) {
			return false;
		}
		skipToEndOfLine();
		return true;
	}

	private void skipToEndOfLine() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	private void skipBlockComment() {
		int end = input.indexOf("*/", pos + 2);
		advanceTo(end < 0 ? input.length() : end + 2);
	}

	private void advanceTo(int target) {
		while (pos < target) {
			if (input.charAt(pos) == '\n') {
				newline(pos + 1);
			}
			pos++;
		}
	}

	private boolean atLineStart() {
		for (int i = lineStart; i < pos; i++) {
			if (!Character.isWhitespace(input.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	private boolean nextIsDigit(int i) {
		return i < input.length() && Character.isDigit(input.charAt(i));
	}

	private void newline(int nextLineStart) {
		line++;
		lineStart = nextLineStart;
	}

	private CppToken token(CppTokenType type, String lexeme, Object value, int start) {
		return new CppToken(type, lexeme, value, new SourcePos(line, start - lineStart + 1));
	}
}
