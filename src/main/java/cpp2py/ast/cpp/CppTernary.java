package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppTernary(CppExpr cond, CppExpr whenTrue, CppExpr whenFalse, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitTernary(this, ctx);
	}
}
