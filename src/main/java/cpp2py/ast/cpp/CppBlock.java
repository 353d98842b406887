package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

public record CppBlock(List<CppStmt> stmts, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitBlock(this, ctx);
	}
}
