package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

/**
 * Literal value. {@code value} is a {@link Long}, {@link Double} or {@link Boolean}; strings and chars keep their
 * quoted source text in {@code text}.
 */
public record CppLiteral(Kind kind, Object value, String text, SourcePos pos) implements CppExpr {
	public enum Kind {
		INT, FLOAT, BOOL, STRING, CHAR
	}

	public static CppLiteral ofInt(long value, SourcePos pos) {
		return new CppLiteral(Kind.INT, value, Long.toString(value), pos);
	}

	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitLiteral(this, ctx);
	}
}
