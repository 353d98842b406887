package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppVar(String name, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitVar(this, ctx);
	}
}
