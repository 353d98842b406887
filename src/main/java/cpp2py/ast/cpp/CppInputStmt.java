package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

public record CppInputStmt(List<CppExpr> targets, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitInputStmt(this, ctx);
	}
}
