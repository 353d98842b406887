package cpp2py.transform;

import cpp2py.ast.cpp.CppBlock;
import cpp2py.ast.cpp.CppContinue;
import cpp2py.ast.cpp.CppExpr;
import cpp2py.ast.cpp.CppFor;
import cpp2py.ast.cpp.CppIf;
import cpp2py.ast.cpp.CppLiteral;
import cpp2py.ast.cpp.CppStmt;
import cpp2py.ast.cpp.CppWhile;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers any {@code for} loop to its initializer followed by a {@code while} loop.
 *
 * The iterator runs as the last statement of the body and also right before every {@code continue} that belongs
 * to this loop, so a skipped iteration still advances. A missing condition becomes {@code true}.
 */
public final class WhileLoopStrategy {
	public List<CppStmt> lower(CppFor loop) {
		List<CppStmt> out = new ArrayList<>();
		if (loop.init() != null) {
			out.add(loop.init());
		}

		CppExpr cond = loop.cond() != null
				? loop.cond()
				: new CppLiteral(CppLiteral.Kind.BOOL, Boolean.TRUE, "true", loop.pos());

		List<CppStmt> body = new ArrayList<>();
		if (loop.iter() != null) {
			body.addAll(advanceBeforeContinue(loop.body(), loop.iter()).stmts());
			body.add(loop.iter());
		} else {
			body.addAll(loop.body().stmts());
		}

		out.add(new CppWhile(cond, new CppBlock(body, loop.body().pos()), loop.pos()));
		return out;
	}

	private static CppBlock advanceBeforeContinue(CppBlock block, CppStmt iter) {
		List<CppStmt> stmts = new ArrayList<>();
		for (CppStmt s : block.stmts()) {
			stmts.add(advanceBeforeContinue(s, iter));
		}
		return new CppBlock(stmts, block.pos());
	}

	private static CppStmt advanceBeforeContinue(CppStmt stmt, CppStmt iter) {
		if (stmt instanceof CppContinue) {
			return new CppBlock(List.of(iter, stmt), stmt.pos());
		}
		if (stmt instanceof CppBlock block) {
			return advanceBeforeContinue(block, iter);
		}
		if (stmt instanceof CppIf cppIf) {
			CppBlock elseBlock = cppIf.elseBlock() == null ? null : advanceBeforeContinue(cppIf.elseBlock(), iter);
			return new CppIf(cppIf.cond(), advanceBeforeContinue(cppIf.thenBlock(), iter), elseBlock, cppIf.pos());
		}
		// nested loops own their continues
		return stmt;
	}
}
