package cpp2py.ast.cpp;

public sealed interface CppExpr extends CppNode permits CppVar, CppLiteral, CppBinary, CppUnary, CppTernary, CppCall,
		CppIndex, CppMember, CppInitList {
	<R, C> R accept(CppExprVisitor<R, C> visitor, C ctx);
}
