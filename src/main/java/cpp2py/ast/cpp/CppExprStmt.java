package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppExprStmt(CppExpr expr, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitExprStmt(this, ctx);
	}
}
