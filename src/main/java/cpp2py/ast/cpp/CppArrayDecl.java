package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

/**
 * {@code type name[size] [= {...}];}
 */
public record CppArrayDecl(String type, String name, int size, CppInitList init, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitArrayDecl(this, ctx);
	}
}
