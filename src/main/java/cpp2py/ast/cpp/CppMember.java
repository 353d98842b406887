package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppMember(CppExpr object, String name, SourcePos pos) implements CppExpr {
	@Override
	public <R, C> R accept(CppExprVisitor<R, C> visitor, C ctx) {
		return visitor.visitMember(this, ctx);
	}
}
