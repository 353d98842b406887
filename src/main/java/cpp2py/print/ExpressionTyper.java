package cpp2py.print;

import cpp2py.ast.cpp.CppBinary;
import cpp2py.ast.cpp.CppExpr;
import cpp2py.ast.cpp.CppIndex;
import cpp2py.ast.cpp.CppLiteral;
import cpp2py.ast.cpp.CppTernary;
import cpp2py.ast.cpp.CppUnary;
import cpp2py.ast.cpp.CppVar;
import cpp2py.ast.cpp.TypeCategory;
import cpp2py.transform.MutationScanner;

import java.util.Set;

/**
 * Best-effort static category of an expression, from literals and the declarations recorded in the
 * {@link Environment}. Anything it cannot tell is {@link TypeCategory#OTHER}.
 */
final class ExpressionTyper {
	private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");

	private ExpressionTyper() {
	}

	static TypeCategory categoryOf(CppExpr expr, Environment env) {
		if (expr instanceof CppLiteral lit) {
			return switch (lit.kind()) {
				case INT -> TypeCategory.INTEGER;
				case FLOAT -> TypeCategory.FLOATING;
				case BOOL -> TypeCategory.BOOLEAN;
				case STRING -> TypeCategory.STRING;
				case CHAR -> TypeCategory.CHARACTER;
			};
		}
		if (expr instanceof CppVar v) {
			return env.categoryOf(v.name());
		}
		if (expr instanceof CppIndex idx) {
			String root = MutationScanner.rootName(idx);
			return root == null ? TypeCategory.OTHER : env.categoryOf(root);
		}
		if (expr instanceof CppBinary bin) {
			if (!ARITHMETIC.contains(bin.op())) {
				return TypeCategory.BOOLEAN;
			}
			TypeCategory l = categoryOf(bin.left(), env);
			TypeCategory r = categoryOf(bin.right(), env);
			if (l == TypeCategory.INTEGER && r == TypeCategory.INTEGER) {
				return TypeCategory.INTEGER;
			}
			if (isNumeric(l) && isNumeric(r)) {
				return TypeCategory.FLOATING;
			}
			return TypeCategory.OTHER;
		}
		if (expr instanceof CppUnary u) {
			return u.op().equals("!") ? TypeCategory.BOOLEAN : categoryOf(u.operand(), env);
		}
		if (expr instanceof CppTernary t) {
			TypeCategory a = categoryOf(t.whenTrue(), env);
			return a == categoryOf(t.whenFalse(), env) ? a : TypeCategory.OTHER;
		}
		return TypeCategory.OTHER;
	}

	private static boolean isNumeric(TypeCategory c) {
		return c == TypeCategory.INTEGER || c == TypeCategory.FLOATING;
	}
}
