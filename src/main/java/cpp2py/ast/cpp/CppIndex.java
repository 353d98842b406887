package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppIndex(CppExpr array, CppExpr index, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitIndex(this, ctx);
	}
}
