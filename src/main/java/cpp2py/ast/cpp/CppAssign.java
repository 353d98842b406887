package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

/**
 * Plain assignment. Compound assignments arrive here already lowered to {@code target = target OP value}.
 */
public record CppAssign(CppExpr target, CppExpr value, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitAssign(this, ctx);
	}
}
