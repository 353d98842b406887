package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppIf(CppExpr cond, CppBlock thenBlock, CppBlock elseBlock, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitIf(this, ctx);
	}
}
