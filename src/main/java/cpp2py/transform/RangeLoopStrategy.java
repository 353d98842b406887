package cpp2py.transform;

import cpp2py.ast.cpp.CppAssign;
import cpp2py.ast.cpp.CppBinary;
import cpp2py.ast.cpp.CppExpr;
import cpp2py.ast.cpp.CppExprStmt;
import cpp2py.ast.cpp.CppFor;
import cpp2py.ast.cpp.CppLiteral;
import cpp2py.ast.cpp.CppStmt;
import cpp2py.ast.cpp.CppUnary;
import cpp2py.ast.cpp.CppVar;
import cpp2py.ast.cpp.CppVarDecl;
import cpp2py.ast.cpp.TypeCategory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Recognizes counted loops that can be rendered as a Python {@code range} iteration.
 *
 * Shape: {@code for (T v = start; v OP bound; step) body} where T is an integer type, OP is one of
 * {@code < <= > >=}, and step changes {@code v} by a non-zero integer literal in the direction OP requires.
 * {@code range} evaluates its bounds once, so the loop is rejected when the body could change {@code v} or anything
 * the bound reads. Rejected loops go to {@link WhileLoopStrategy}.
 */
public final class RangeLoopStrategy {
	public Optional<CountedLoop> match(CppFor loop, LoopFacts facts) {
		if (!(loop.init() instanceof CppVarDecl decl) || decl.init() == null) {
			return Optional.empty();
		}
		if (TypeCategory.of(decl.type()) != TypeCategory.INTEGER) {
			return Optional.empty();
		}
		String var = decl.name();

		if (!(loop.cond() instanceof CppBinary cond) || !isVar(cond.left(), var)) {
			return Optional.empty();
		}
		boolean ascending = cond.op().equals("<") || cond.op().equals("<=");
		boolean descending = cond.op().equals(">") || cond.op().equals(">=");
		if (!ascending && !descending) {
			return Optional.empty();
		}

		OptionalLong step = stepOf(loop.iter(), var);
		if (step.isEmpty() || step.getAsLong() == 0 || (step.getAsLong() > 0) != ascending) {
			return Optional.empty();
		}

		CppExpr bound = cond.right();
		if (!facts.mayBeIntegral(decl.init()) || !facts.mayBeIntegral(bound)) {
			return Optional.empty();
		}
		if (MutationScanner.hasSideEffects(bound)) {
			return Optional.empty();
		}
		Set<String> boundReads = MutationScanner.readNames(bound);
		if (boundReads.contains(var)) {
			return Optional.empty();
		}

		Mutations body = MutationScanner.scan(loop.body());
		if (body.mutated().contains(var)) {
			return Optional.empty();
		}
		for (String name : boundReads) {
			if (body.mutated().contains(name)) {
				return Optional.empty();
			}
		}
		// a callee may write through an alias: an array argument, an object, a field or a global
		if (body.hasCalls()) {
			if (MutationScanner.hasAccessPaths(bound)) {
				return Optional.empty();
			}
			for (String name : boundReads) {
				if (!facts.isScalarLocal(name)) {
					return Optional.empty();
				}
			}
		}

		CppExpr end = switch (cond.op()) {
			case "<=" -> offset(bound, 1);
			case ">=" -> offset(bound, -1);
			default -> bound;
		};
		return Optional.of(new CountedLoop(var, decl.type(), decl.init(), end, step.getAsLong(), loop.body()));
	}

	/**
	 * Per-iteration change of {@code var} made by {@code iter}, if it is a literal constant.
	 */
	static OptionalLong stepOf(CppStmt iter, String var) {
		if (iter instanceof CppExprStmt stmt && stmt.expr() instanceof CppUnary u && isVar(u.operand(), var)) {
			if (u.op().equals("++")) {
				return OptionalLong.of(1);
			}
			if (u.op().equals("--")) {
				return OptionalLong.of(-1);
			}
			return OptionalLong.empty();
		}
		if (iter instanceof CppAssign assign && isVar(assign.target(), var)
				&& assign.value() instanceof CppBinary bin) {
			boolean plus = bin.op().equals("+");
			if (!plus && !bin.op().equals("-")) {
				return OptionalLong.empty();
			}
			if (isVar(bin.left(), var)) {
				OptionalLong k = intConstant(bin.right());
				if (k.isPresent()) {
					return OptionalLong.of(plus ? k.getAsLong() : -k.getAsLong());
				}
			} else if (plus && isVar(bin.right(), var)) {
				return intConstant(bin.left());
			}
		}
		return OptionalLong.empty();
	}

	private static OptionalLong intConstant(CppExpr expr) {
		if (expr instanceof CppLiteral lit && lit.kind() == CppLiteral.Kind.INT) {
			return OptionalLong.of((Long) lit.value());
		}
		if (expr instanceof CppUnary u && u.op().equals("-") && !u.postfix()) {
			OptionalLong inner = intConstant(u.operand());
			return inner.isPresent() ? OptionalLong.of(-inner.getAsLong()) : inner;
		}
		return OptionalLong.empty();
	}

	private static CppExpr offset(CppExpr bound, long delta) {
		OptionalLong k = intConstant(bound);
		if (k.isPresent()) {
			return CppLiteral.ofInt(k.getAsLong() + delta, bound.pos());
		}
		return new CppBinary(bound, delta > 0 ? "+" : "-", CppLiteral.ofInt(Math.abs(delta), bound.pos()), bound.pos());
	}

	private static boolean isVar(CppExpr expr, String name) {
		return expr instanceof CppVar v && v.name().equals(name);
	}
}
