package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

/**
 * Class or struct definition.
 *
 * Fields are {@link CppVarDecl} or {@link CppArrayDecl}; {@code constructor} is null when the class declares none.
 */
public record CppClassDef(String name, List<CppStmt> fields, CppFuncDef constructor, List<CppFuncDef> methods,
		SourcePos pos) implements CppStmt {
	public boolean isEmpty() {
		return fields.isEmpty() && methods.isEmpty() && constructor == null;
	}

	@Override
	public <R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx) {
		return visitor.visitClassDef(this, ctx);
	}
}
