package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

/**
 * Prefix or postfix unary operation: {@code - + ! ++ --}.
 */
public record CppUnary(String op, CppExpr operand, boolean postfix, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitUnary(this, ctx);
	}
}
