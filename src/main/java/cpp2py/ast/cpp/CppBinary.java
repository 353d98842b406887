package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppBinary(CppExpr left, String op, CppExpr right, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitBinary(this, ctx);
	}
}
