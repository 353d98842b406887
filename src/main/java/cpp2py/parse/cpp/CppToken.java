package cpp2py.parse.cpp;

import cpp2py.ast.SourcePos;

/**
 * {@code value} holds the parsed payload of literal tokens ({@link Long}, {@link Double}, {@link Boolean}) and the
 * lexeme for everything else.
 */
public record CppToken(CppTokenType type, String lexeme, Object value, SourcePos pos) {
	public boolean is(CppTokenType type, String lexeme) {
		return this.type == type && this.lexeme.equals(lexeme);
	}

	public int line() {
		return pos.line();
	}
}
