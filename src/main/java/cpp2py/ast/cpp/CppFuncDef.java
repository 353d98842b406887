package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

/**
 * Function or method definition. Parameter and return types are not kept.
 */
public record CppFuncDef(String name, List<String> params, CppBlock body, SourcePos pos) implements CppStmt {
	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitFuncDef(this, ctx);
	}
}
