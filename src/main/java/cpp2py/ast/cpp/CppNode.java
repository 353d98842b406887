package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public sealed interface CppNode permits CppProgram, CppStmt, CppExpr, CppStreamItem {
	SourcePos pos();
}
