package cpp2py.parse.cpp;

public enum CppTokenType {
	IDENT, KEYWORD, INT, FLOAT, STRING, CHAR, SYMBOL, EOF
}
