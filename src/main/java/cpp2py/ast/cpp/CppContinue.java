package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppContinue(SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitContinue(this, ctx);
	}
}
