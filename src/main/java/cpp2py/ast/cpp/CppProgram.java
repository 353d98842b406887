package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

import java.util.List;

/**
 * Root of a translation unit. The body of {@code main} is flattened into {@link #stmts()}.
 *
 * An empty program is also what the parser hands back after a syntax error.
 */
public record CppProgram(List<CppStmt> stmts, SourcePos pos) implements CppNode {
	public static CppProgram empty() {
		return new CppProgram(List.of(), SourcePos.NONE);
	}

	public boolean isEmpty() {
		return stmts.isEmpty();
	}
}
