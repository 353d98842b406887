package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

/**
 * Three-part loop. Each of {@code init}, {@code cond} and {@code iter} may be null.
 */
public record CppFor(CppStmt init, CppExpr cond, CppStmt iter, CppBlock body, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitFor(this, ctx);
	}
}
