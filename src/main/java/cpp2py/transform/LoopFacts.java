package cpp2py.transform;

import cpp2py.ast.cpp.CppExpr;

/**
 * Knowledge about names that the loop analysis cannot derive from the loop itself.
 */
public interface LoopFacts {
	/**
	 * False only when {@code expr} is known to produce something other than an integer.
	 */
	boolean mayBeIntegral(CppExpr expr);

	/**
	 * True for a parameter or variable local to the enclosing function that no callee can rebind. Globals, fields
	 * and anything at program top level are not.
	 */
	boolean isScalarLocal(String name);
}
