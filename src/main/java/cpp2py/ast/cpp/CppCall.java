package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

public record CppCall(CppExpr callee, List<CppExpr> args, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitCall(this, ctx);
	}
}
