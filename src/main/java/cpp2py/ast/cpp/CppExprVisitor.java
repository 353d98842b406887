package cpp2py.ast.cpp;

public interface CppExprVisitor<R, C> {
	R visitVar(CppVar expr, C ctx);

	R visitLiteral(CppLiteral expr, C ctx);

	R visitBinary(CppBinary expr, C ctx);

	R visitUnary(CppUnary expr, C ctx);

	R visitTernary(CppTernary expr, C ctx);

	R visitCall(CppCall expr, C ctx);

	R visitIndex(CppIndex expr, C ctx);

	R visitMember(CppMember expr, C ctx);

	R visitInitList(CppInitList expr, C ctx);
}
