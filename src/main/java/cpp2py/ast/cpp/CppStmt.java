package cpp2py.ast.cpp;

public sealed interface CppStmt extends CppNode permits CppBlock, CppVarDecl, CppArrayDecl, CppAssign, CppExprStmt,
		CppIf, CppWhile, CppFor, CppBreak, CppContinue, CppReturn, CppOutputStmt, CppInputStmt, CppFuncDef,
		CppClassDef {
	<R, C> R accept(CppStmtVisitor<R, C> visitor, C ctx);
}
