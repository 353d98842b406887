package cpp2py.transform;

import cpp2py.ast.cpp.CppBlock;
import cpp2py.ast.cpp.CppExpr;

/**
 * A {@code for} loop recognized as {@code for var in range(start, end, step)}.
 *
 * {@code end} is already exclusive: an inclusive bound has been widened (or narrowed, for a descending loop) by one.
 */
public record CountedLoop(String var, String type, CppExpr start, CppExpr end, long step, CppBlock body) {
	public boolean hasUnitStep() {
		return step == 1;
	}
}
