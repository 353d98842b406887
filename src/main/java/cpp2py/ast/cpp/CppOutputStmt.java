package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

public record CppOutputStmt(List<CppStreamItem> items, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitOutputStmt(this, ctx);
	}
}
