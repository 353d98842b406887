package cpp2py.transform;

import cpp2py.ast.cpp.CppArrayDecl;
import cpp2py.ast.cpp.CppAssign;
import cpp2py.ast.cpp.CppBinary;
import cpp2py.ast.cpp.CppBlock;
import cpp2py.ast.cpp.CppBreak;
import cpp2py.ast.cpp.CppCall;
import cpp2py.ast.cpp.CppClassDef;
import cpp2py.ast.cpp.CppContinue;
import cpp2py.ast.cpp.CppExpr;
import cpp2py.ast.cpp.CppExprStmt;
import cpp2py.ast.cpp.CppExprVisitor;
import cpp2py.ast.cpp.CppFor;
import cpp2py.ast.cpp.CppFuncDef;
import cpp2py.ast.cpp.CppIf;
import cpp2py.ast.cpp.CppIndex;
import cpp2py.ast.cpp.CppInitList;
import cpp2py.ast.cpp.CppInputStmt;
import cpp2py.ast.cpp.CppLiteral;
import cpp2py.ast.cpp.CppMember;
import cpp2py.ast.cpp.CppOutputStmt;
import cpp2py.ast.cpp.CppReturn;
import cpp2py.ast.cpp.CppStmt;
import cpp2py.ast.cpp.CppStmtVisitor;
import cpp2py.ast.cpp.CppStreamItem;
import cpp2py.ast.cpp.CppStreamValue;
import cpp2py.ast.cpp.CppTernary;
import cpp2py.ast.cpp.CppUnary;
import cpp2py.ast.cpp.CppVar;
import cpp2py.ast.cpp.CppVarDecl;
import cpp2py.ast.cpp.CppWhile;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read/write analysis over statement and expression subtrees.
 */
public final class MutationScanner implements CppStmtVisitor<Void, Void>, CppExprVisitor<Void, Void> {
	private final Set<String> rebound = new LinkedHashSet<>();
	private final Set<String> mutated = new LinkedHashSet<>();
	private final Set<String> declared = new LinkedHashSet<>();
	private final Set<String> read = new LinkedHashSet<>();
	private boolean hasCalls;
	private boolean hasIncrements;
	private boolean hasAccessPaths;

	private MutationScanner() {
	}

	public static Mutations scan(CppStmt stmt) {
		MutationScanner s = new MutationScanner();
		stmt.accept(s, null);
		return new Mutations(Set.copyOf(s.rebound), Set.copyOf(s.mutated), Set.copyOf(s.declared), s.hasCalls);
	}

	/**
	 * Every variable name an expression reads.
	 */
	public static Set<String> readNames(CppExpr expr) {
		MutationScanner s = new MutationScanner();
		expr.accept(s, null);
		return s.read;
	}

	/**
	 * True when evaluating the expression could have side effects or depend on them: calls and ++/--.
	 */
	public static boolean hasSideEffects(CppExpr expr) {
		MutationScanner s = new MutationScanner();
		expr.accept(s, null);
		return s.hasCalls || s.hasIncrements;
	}

	/**
	 * True when the expression reads through an array element or a member, storage a callee can reach.
	 */
	public static boolean hasAccessPaths(CppExpr expr) {
		MutationScanner s = new MutationScanner();
		expr.accept(s, null);
		return s.hasAccessPaths;
	}

	/**
	 * Leftmost variable of an access path: {@code a} for {@code a[i].x}. Null when there is none.
	 */
	public static String rootName(CppExpr expr) {
		CppExpr e = expr;
		while (true) {
			if (e instanceof CppVar v) {
				return v.name();
			}
			if (e instanceof CppIndex idx) {
				e = idx.array();
			} else if (e instanceof CppMember m) {
				e = m.object();
			} else {
				return null;
			}
		}
	}

	private void write(CppExpr target) {
		if (target instanceof CppVar v) {
			rebound.add(v.name());
		}
		String root = rootName(target);
		if (root != null) {
			mutated.add(root);
		}
		target.accept(this, null);
	}

	@Override
	public Void visitBlock(CppBlock block, Void ctx) {
		for (CppStmt s : block.stmts()) {
			s.accept(this, ctx);
		}
		return null;
	}

	@Override
	public Void visitVarDecl(CppVarDecl decl, Void ctx) {
		declared.add(decl.name());
		mutated.add(decl.name());
		if (decl.init() != null) {
			decl.init().accept(this, ctx);
		}
		return null;
	}

	@Override
	public Void visitArrayDecl(CppArrayDecl decl, Void ctx) {
		declared.add(decl.name());
		mutated.add(decl.name());
		if (decl.init() != null) {
			decl.init().accept(this, ctx);
		}
		return null;
	}

	@Override
	public Void visitAssign(CppAssign assign, Void ctx) {
		write(assign.target());
		assign.value().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitExprStmt(CppExprStmt stmt, Void ctx) {
		stmt.expr().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitIf(CppIf stmt, Void ctx) {
		stmt.cond().accept(this, ctx);
		stmt.thenBlock().accept(this, ctx);
		if (stmt.elseBlock() != null) {
			stmt.elseBlock().accept(this, ctx);
		}
		return null;
	}

	@Override
	public Void visitWhile(CppWhile stmt, Void ctx) {
		stmt.cond().accept(this, ctx);
		stmt.body().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitFor(CppFor stmt, Void ctx) {
		if (stmt.init() != null) {
			stmt.init().accept(this, ctx);
		}
		if (stmt.cond() != null) {
			stmt.cond().accept(this, ctx);
		}
		if (stmt.iter() != null) {
			stmt.iter().accept(this, ctx);
		}
		stmt.body().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitBreak(CppBreak stmt, Void ctx) {
		return null;
	}

	@Override
	public Void visitContinue(CppContinue stmt, Void ctx) {
		return null;
	}

	@Override
	public Void visitReturn(CppReturn stmt, Void ctx) {
		if (stmt.value() != null) {
			stmt.value().accept(this, ctx);
		}
		return null;
	}

	@Override
	public Void visitOutputStmt(CppOutputStmt stmt, Void ctx) {
		for (CppStreamItem item : stmt.items()) {
			if (item instanceof CppStreamValue v) {
				v.value().accept(this, ctx);
			}
		}
		return null;
	}

	@Override
	public Void visitInputStmt(CppInputStmt stmt, Void ctx) {
		for (CppExpr target : stmt.targets()) {
			write(target);
		}
		return null;
	}

	@Override
	public Void visitFuncDef(CppFuncDef def, Void ctx) {
		// a nested definition does not run where it appears
		declared.add(def.name());
		return null;
	}

	@Override
	public Void visitClassDef(CppClassDef def, Void ctx) {
		declared.add(def.name());
		return null;
	}

	@Override
	public Void visitVar(CppVar expr, Void ctx) {
		read.add(expr.name());
		return null;
	}

	@Override
	public Void visitLiteral(CppLiteral expr, Void ctx) {
		return null;
	}

	@Override
	public Void visitBinary(CppBinary expr, Void ctx) {
		expr.left().accept(this, ctx);
		expr.right().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitUnary(CppUnary expr, Void ctx) {
		if (expr.op().equals("++") || expr.op().equals("--")) {
			hasIncrements = true;
			write(expr.operand());
			return null;
		}
		expr.operand().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitTernary(CppTernary expr, Void ctx) {
		expr.cond().accept(this, ctx);
		expr.whenTrue().accept(this, ctx);
		expr.whenFalse().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitCall(CppCall expr, Void ctx) {
		hasCalls = true;
		expr.callee().accept(this, ctx);
		for (CppExpr arg : expr.args()) {
			arg.accept(this, ctx);
		}
		return null;
	}

	@Override
	public Void visitIndex(CppIndex expr, Void ctx) {
		hasAccessPaths = true;
		expr.array().accept(this, ctx);
		expr.index().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitMember(CppMember expr, Void ctx) {
		hasAccessPaths = true;
		expr.object().accept(this, ctx);
		return null;
	}

	@Override
	public Void visitInitList(CppInitList expr, Void ctx) {
		for (CppExpr e : expr.elements()) {
			e.accept(this, ctx);
		}
		return null;
	}
}
