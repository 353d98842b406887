package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

public record CppInitList(List<CppExpr> elements, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitInitList(this, ctx);
	}
}
