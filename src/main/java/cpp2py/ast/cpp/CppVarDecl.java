package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

/**
 * {@code type name [= init];} with {@code init} null when absent.
 */
public record CppVarDecl(String type, String name, CppExpr init, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitVarDecl(this, ctx);
	}
}
