package cpp2py.ast.cpp;

/**
 * One method per statement kind. {@code C} is a caller-defined context threaded through the traversal.
 */
public interface CppStmtVisitor<R, C> {
	R visitBlock(CppBlock block, C ctx);

	R visitVarDecl(CppVarDecl decl, C ctx);

	R visitArrayDecl(CppArrayDecl decl, C ctx);

	R visitAssign(CppAssign assign, C ctx);

	R visitExprStmt(CppExprStmt stmt, C ctx);

	R visitIf(CppIf stmt, C ctx);

	R visitWhile(CppWhile stmt, C ctx);

	R visitFor(CppFor stmt, C ctx);

	R visitBreak(CppBreak stmt, C ctx);

	R visitContinue(CppContinue stmt, C ctx);

	R visitReturn(CppReturn stmt, C ctx);

	R visitOutputStmt(CppOutputStmt stmt, C ctx);

	R visitInputStmt(CppInputStmt stmt, C ctx);

	R visitFuncDef(CppFuncDef def, C ctx);

	R visitClassDef(CppClassDef def, C ctx);
}
