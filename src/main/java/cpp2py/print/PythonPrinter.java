package cpp2py.print;

import cpp2py.Diagnostic;
import cpp2py.Diagnostics;
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
import cpp2py.ast.cpp.CppProgram;
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
import cpp2py.ast.cpp.TypeCategory;
import cpp2py.transform.CountedLoop;
import cpp2py.transform.LoopFacts;
import cpp2py.transform.MutationScanner;
import cpp2py.transform.Mutations;
import cpp2py.transform.RangeLoopStrategy;
import cpp2py.transform.WhileLoopStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a C++ AST as Python source.
 *
 * Every statement kind renders to zero or more complete lines at the context's indentation, joined with
 * {@code \n} and without a trailing newline. Rendering never fails: unknown types fall back to defaults and
 * leave a {@link Diagnostic.Stage#GENERATION} diagnostic behind.
 */
public final class PythonPrinter implements CppStmtVisitor<String, RenderContext> {
	// arrays up to this size render as a literal list of zero values
	private static final int LITERAL_ARRAY_LIMIT = 16;

	private final Diagnostics diagnostics;
	private final int indentWidth;
	private final RangeLoopStrategy rangeLoops = new RangeLoopStrategy();
	private final WhileLoopStrategy whileLoops = new WhileLoopStrategy();
	private final Expressions expressions = new Expressions();

	public PythonPrinter(Diagnostics diagnostics) {
		this(diagnostics, 4);
	}

	public PythonPrinter(Diagnostics diagnostics, int indentWidth) {
		this.diagnostics = diagnostics;
		this.indentWidth = indentWidth;
	}

	/**
	 * Renders a whole program with a fresh {@link Environment}.
	 */
	public String print(CppProgram program) {
		return renderAll(program.stmts(), RenderContext.root(new Environment(), indentWidth));
	}

	public String render(CppStmt stmt, RenderContext ctx) {
		return stmt.accept(this, ctx);
	}

	public String render(CppExpr expr, RenderContext ctx) {
		return expr.accept(expressions, ctx);
	}

	private String renderAll(List<CppStmt> stmts, RenderContext ctx) {
		List<String> lines = new ArrayList<>();
		for (CppStmt s : stmts) {
			String code = s.accept(this, ctx);
			if (!code.isEmpty()) {
				lines.add(code);
			}
		}
		return String.join("\n", lines);
	}

	private String body(CppBlock block, RenderContext inner) {
		String code = renderAll(block.stmts(), inner);
		return code.isBlank() ? inner.pad() + "pass" : code;
	}

	/**
	 * Expression without the outer parentheses a nested binary or conditional expression would get.
	 */
	private String top(CppExpr expr, RenderContext ctx) {
		if (expr instanceof CppBinary bin) {
			return expressions.binary(bin, ctx, false);
		}
		if (expr instanceof CppTernary ternary) {
			return expressions.ternary(ternary, ctx, false);
		}
		return render(expr, ctx);
	}

	@Override
	public String visitBlock(CppBlock block, RenderContext ctx) {
		return renderAll(block.stmts(), ctx);
	}

	@Override
	public String visitVarDecl(CppVarDecl decl, RenderContext ctx) {
		declare(decl.name(), decl.type(), ctx);
		return ctx.pad() + decl.name() + " = " + scalarValue(decl, ctx);
	}

	@Override
	public String visitArrayDecl(CppArrayDecl decl, RenderContext ctx) {
		declare(decl.name(), decl.type(), ctx);
		return ctx.pad() + decl.name() + " = " + arrayValue(decl, ctx);
	}

	private static void declare(String name, String type, RenderContext ctx) {
		ctx.env().declare(name, type);
		if (!ctx.inFunction()) {
			ctx.env().declareGlobal(name);
		}
	}

	private String scalarValue(CppVarDecl decl, RenderContext ctx) {
		if (decl.init() != null) {
			return top(decl.init(), ctx);
		}
		return zeroValue(decl.type(), decl.name(), decl.pos().line(), ctx);
	}

	private String arrayValue(CppArrayDecl decl, RenderContext ctx) {
		if (decl.init() != null) {
			return render(decl.init(), ctx);
		}
		String zero = zeroValue(decl.type(), decl.name(), decl.pos().line(), ctx);
		boolean instances = ctx.env().isClass(decl.type());
		if (decl.size() <= LITERAL_ARRAY_LIMIT) {
			return "[" + String.join(", ", Collections.nCopies(decl.size(), zero)) + "]";
		}
		// one instance per element
		if (instances) {
			return "[" + zero + " for _ in range(" + decl.size() + ")]";
		}
		return "[" + zero + "] * " + decl.size();
	}

	private String zeroValue(String type, String name, int line, RenderContext ctx) {
		switch (TypeCategory.of(type)) {
			case INTEGER:
				return "0";
			case FLOATING:
				return "0.0";
			case CHARACTER:
			case STRING:
				return "''";
			case BOOLEAN:
				return "False";
			default:
				break;
		}
		if (ctx.env().isClass(type)) {
			return type + "()";
		}
		diagnostics.report(Diagnostic.Stage.GENERATION,
				"No default value for type '" + type + "' of '" + name + "', using None", line);
		return "None";
	}

	@Override
	public String visitAssign(CppAssign assign, RenderContext ctx) {
		return ctx.pad() + render(assign.target(), ctx) + " = " + top(assign.value(), ctx);
	}

	@Override
	public String visitExprStmt(CppExprStmt stmt, RenderContext ctx) {
		if (stmt.expr() instanceof CppUnary u && isIncrement(u.op())) {
			String target = render(u.operand(), ctx);
			return ctx.pad() + target + " = " + target + (u.op().equals("++") ? " + 1" : " - 1");
		}
		return ctx.pad() + top(stmt.expr(), ctx);
	}

	private static boolean isIncrement(String op) {
		return op.equals("++") || op.equals("--");
	}

	@Override
	public String visitIf(CppIf stmt, RenderContext ctx) {
		RenderContext inner = ctx.indented();
		StringBuilder sb = new StringBuilder();
		sb.append(ctx.pad()).append("if ").append(top(stmt.cond(), ctx)).append(":\n")
				.append(body(stmt.thenBlock(), inner));

		CppBlock elseBlock = stmt.elseBlock();
		while (elseBlock != null) {
			if (elseBlock.stmts().size() == 1 && elseBlock.stmts().get(0) instanceof CppIf nested) {
				sb.append('\n').append(ctx.pad()).append("elif ").append(top(nested.cond(), ctx)).append(":\n")
						.append(body(nested.thenBlock(), inner));
				elseBlock = nested.elseBlock();
				continue;
			}
			sb.append('\n').append(ctx.pad()).append("else:\n").append(body(elseBlock, inner));
			elseBlock = null;
		}
		return sb.toString();
	}

	@Override
	public String visitWhile(CppWhile stmt, RenderContext ctx) {
		return ctx.pad() + "while " + top(stmt.cond(), ctx) + ":\n" + body(stmt.body(), ctx.indented());
	}

	@Override
	public String visitFor(CppFor stmt, RenderContext ctx) {
		Optional<CountedLoop> counted = rangeLoops.match(stmt, loopFacts(ctx));
		if (counted.isPresent()) {
			return renderRange(counted.get(), ctx);
		}
		return renderAll(whileLoops.lower(stmt), ctx);
	}

	private static LoopFacts loopFacts(RenderContext ctx) {
		return new LoopFacts() {
			@Override
			public boolean mayBeIntegral(CppExpr expr) {
				TypeCategory c = ExpressionTyper.categoryOf(expr, ctx.env());
				return c == TypeCategory.INTEGER || c == TypeCategory.OTHER;
			}

			@Override
			public boolean isScalarLocal(String name) {
				MemberScope members = ctx.members();
				return ctx.inFunction() && members != null && members.locals().contains(name);
			}
		};
	}

	private String renderRange(CountedLoop loop, RenderContext ctx) {
		declare(loop.var(), loop.type(), ctx);
		String args = top(loop.start(), ctx) + ", " + top(loop.end(), ctx);
		if (!loop.hasUnitStep()) {
			args += ", " + loop.step();
		}
		return ctx.pad() + "for " + loop.var() + " in range(" + args + "):\n" + body(loop.body(), ctx.indented());
	}

	@Override
	public String visitBreak(CppBreak stmt, RenderContext ctx) {
		return ctx.pad() + "break";
	}

	@Override
	public String visitContinue(CppContinue stmt, RenderContext ctx) {
		return ctx.pad() + "continue";
	}

	@Override
	public String visitReturn(CppReturn stmt, RenderContext ctx) {
		String value = stmt.value() == null ? null : top(stmt.value(), ctx);
		if (ctx.inFunction()) {
			return ctx.pad() + (value == null ? "return" : "return " + value);
		}
		// top level is the body of main
		return ctx.pad() + (value == null ? "raise SystemExit" : "raise SystemExit(" + value + ")");
	}

	@Override
	public String visitOutputStmt(CppOutputStmt stmt, RenderContext ctx) {
		List<String> args = new ArrayList<>();
		for (CppStreamItem item : stmt.items()) {
			if (item instanceof CppStreamValue v) {
				args.add(top(v.value(), ctx));
			}
		}
		return ctx.pad() + "print(" + String.join(", ", args) + ")";
	}

	@Override
	public String visitInputStmt(CppInputStmt stmt, RenderContext ctx) {
		List<String> lines = new ArrayList<>();
		for (CppExpr target : stmt.targets()) {
			String name = render(target, ctx);
			String root = MutationScanner.rootName(target);
			Optional<String> type = root == null ? Optional.empty() : ctx.env().typeOf(root);
			if (type.isEmpty()) {
				diagnostics.report(Diagnostic.Stage.GENERATION,
						"No recorded type for '" + name + "', reading raw text", target.pos().line());
			}
			lines.add(ctx.pad() + name + " = " + readExpression(TypeCategory.of(type.orElse(null))));
		}
		return String.join("\n", lines);
	}

	private static String readExpression(TypeCategory category) {
		return switch (category) {
			case INTEGER -> "int(input())";
			case FLOATING -> "float(input())";
			case CHARACTER -> "input()[:1]";
			case BOOLEAN -> "input().strip().lower() in ('1', 'true', 'yes')";
			case STRING, OTHER -> "input()";
		};
	}

	@Override
	public String visitFuncDef(CppFuncDef def, RenderContext ctx) {
		Mutations writes = MutationScanner.scan(def.body());
		Set<String> locals = new HashSet<>(def.params());
		locals.addAll(writes.declared());
		RenderContext inner = ctx.inFunction(new MemberScope(Set.of(), Set.of(), locals));

		return ctx.pad() + "def " + def.name() + "(" + String.join(", ", def.params()) + "):\n"
				+ globalLine(writes, locals, Set.of(), inner)
				+ body(def.body(), inner);
	}

	/**
	 * {@code global} declaration for the top-level names a function body rebinds, with its trailing newline.
	 */
	private static String globalLine(Mutations writes, Set<String> locals, Set<String> fields, RenderContext inner) {
		List<String> names = writes.rebound().stream()
				.filter(n -> !locals.contains(n) && !fields.contains(n) && inner.env().isGlobal(n))
				.sorted()
				.collect(Collectors.toList());
		return names.isEmpty() ? "" : inner.pad() + "global " + String.join(", ", names) + "\n";
	}

	@Override
	public String visitClassDef(CppClassDef def, RenderContext ctx) {
		ctx.env().declareClass(def.name());
		RenderContext memberCtx = ctx.indented();
		String header = ctx.pad() + "class " + def.name() + ":";
		if (def.isEmpty()) {
			return header + "\n" + memberCtx.pad() + "pass";
		}

		Set<String> fields = new LinkedHashSet<>();
		for (CppStmt f : def.fields()) {
			if (f instanceof CppVarDecl v) {
				fields.add(v.name());
			} else if (f instanceof CppArrayDecl a) {
				fields.add(a.name());
			}
		}
		Set<String> methods = def.methods().stream().map(CppFuncDef::name).collect(Collectors.toSet());

		List<String> parts = new ArrayList<>();
		if (!fields.isEmpty() || def.constructor() != null) {
			parts.add(renderConstructor(def, fields, methods, memberCtx));
		}
		for (CppFuncDef method : def.methods()) {
			parts.add(renderMethod(method, "def " + method.name(), fields, methods, memberCtx));
		}
		return header + "\n" + String.join("\n", parts);
	}

	private String renderConstructor(CppClassDef def, Set<String> fields, Set<String> methods,
			RenderContext memberCtx) {
		RenderContext fieldCtx = memberCtx.inFunction(new MemberScope(fields, methods, Set.of()));
		List<String> lines = new ArrayList<>();
		for (CppStmt f : def.fields()) {
			if (f instanceof CppVarDecl v) {
				fieldCtx.env().declare(v.name(), v.type());
				lines.add(fieldCtx.pad() + "self." + v.name() + " = " + scalarValue(v, fieldCtx));
			} else if (f instanceof CppArrayDecl a) {
				fieldCtx.env().declare(a.name(), a.type());
				lines.add(fieldCtx.pad() + "self." + a.name() + " = " + arrayValue(a, fieldCtx));
			}
		}

		CppFuncDef ctor = def.constructor();
		List<String> params = ctor == null ? List.of() : ctor.params();
		if (ctor != null) {
			String code = renderMethodBody(ctor, fields, methods, memberCtx);
			if (!code.isBlank()) {
				lines.add(code);
			}
		}
		String body = lines.isEmpty() ? fieldCtx.pad() + "pass" : String.join("\n", lines);
		return memberCtx.pad() + "def __init__(" + withSelf(params) + "):\n" + body;
	}

	private String renderMethod(CppFuncDef method, String signature, Set<String> fields, Set<String> methods,
			RenderContext memberCtx) {
		String code = renderMethodBody(method, fields, methods, memberCtx);
		String body = code.isBlank() ? memberCtx.indented().pad() + "pass" : code;
		return memberCtx.pad() + signature + "(" + withSelf(method.params()) + "):\n" + body;
	}

	private String renderMethodBody(CppFuncDef method, Set<String> fields, Set<String> methods,
			RenderContext memberCtx) {
		Mutations writes = MutationScanner.scan(method.body());
		Set<String> locals = new HashSet<>(method.params());
		locals.addAll(writes.declared());
		RenderContext inner = memberCtx.inFunction(new MemberScope(fields, methods, locals));
		return globalLine(writes, locals, fields, inner) + renderAll(method.body().stmts(), inner);
	}

	private static String withSelf(List<String> params) {
		List<String> all = new ArrayList<>();
		all.add("self");
		all.addAll(params);
		return String.join(", ", all);
	}

	static String pythonFloat(double d) {
		if (Double.isNaN(d)) {
			return "float('nan')";
		}
		if (Double.isInfinite(d)) {
			return d > 0 ? "float('inf')" : "float('-inf')";
		}
		if (d == Math.rint(d) && Math.abs(d) < 1e16) {
			return (long) d + ".0";
		}
		return Double.toString(d).replace('E', 'e');
	}

	private final class Expressions implements CppExprVisitor<String, RenderContext> {
		@Override
		public String visitVar(CppVar expr, RenderContext ctx) {
			MemberScope members = ctx.members();
			if (members != null) {
				if (expr.name().equals("this")) {
					return "self";
				}
				if (members.isField(expr.name())) {
					return "self." + expr.name();
				}
			}
			return expr.name();
		}

		@Override
		public String visitLiteral(CppLiteral expr, RenderContext ctx) {
			return switch (expr.kind()) {
				case INT -> Long.toString((Long) expr.value());
				case FLOAT -> pythonFloat((Double) expr.value());
				case BOOL -> Boolean.TRUE.equals(expr.value()) ? "True" : "False";
				case STRING, CHAR -> expr.text();
			};
		}

		@Override
		public String visitBinary(CppBinary expr, RenderContext ctx) {
			return binary(expr, ctx, true);
		}

		String binary(CppBinary expr, RenderContext ctx, boolean parenthesize) {
			String array = sizeofLength(expr, ctx);
			if (array != null) {
				return "len(" + array + ")";
			}
			String left = render(expr.left(), ctx);
			String right = render(expr.right(), ctx);
			if (expr.op().equals("/")
					&& ExpressionTyper.categoryOf(expr.left(), ctx.env()) == TypeCategory.INTEGER
					&& ExpressionTyper.categoryOf(expr.right(), ctx.env()) == TypeCategory.INTEGER) {
				return truncatingDivision(expr, left, right);
			}
			String text = left + " " + pythonOperator(expr.op()) + " " + right;
			return parenthesize ? "(" + text + ")" : text;
		}

		/**
		 * C++ integer division truncates toward zero; Python's {@code //} floors. Both agree unless the signs differ.
		 * Operands are repeated, so the exact form is used only when evaluating them twice is harmless.
		 */
		private String truncatingDivision(CppBinary expr, String left, String right) {
			if (MutationScanner.hasSideEffects(expr.left()) || MutationScanner.hasSideEffects(expr.right())) {
				diagnostics.report(Diagnostic.Stage.GENERATION,
						"Integer division with side effects goes through float division", expr.pos().line());
				return "int(" + left + " / " + right + ")";
			}
			return "(" + left + " // " + right + " if " + left + " * " + right + " >= 0 else -(-" + left + " // "
					+ right + "))";
		}

		/**
		 * Array name for {@code sizeof(a) / sizeof(a[0])}, else null.
		 */
		private String sizeofLength(CppBinary expr, RenderContext ctx) {
			if (!expr.op().equals("/")) {
				return null;
			}
			CppExpr whole = sizeofArg(expr.left());
			CppExpr element = sizeofArg(expr.right());
			if (whole == null || !(element instanceof CppIndex idx)) {
				return null;
			}
			String array = render(whole, ctx);
			return array.equals(render(idx.array(), ctx)) ? array : null;
		}

		private CppExpr sizeofArg(CppExpr expr) {
			if (expr instanceof CppCall call && call.callee() instanceof CppVar v && v.name().equals("sizeof")
					&& call.args().size() == 1) {
				return call.args().get(0);
			}
			return null;
		}

		private String pythonOperator(String op) {
			return switch (op) {
				case "&&" -> "and";
				case "||" -> "or";
				default -> op;
			};
		}

		@Override
		public String visitUnary(CppUnary expr, RenderContext ctx) {
			String operand = render(expr.operand(), ctx);
			switch (expr.op()) {
				case "!":
					return "(not " + operand + ")";
				case "++":
				case "--":
					return increment(expr, operand);
				default:
					return expr.op() + operand;
			}
		}

		private String increment(CppUnary expr, String operand) {
			String delta = expr.op().equals("++") ? "+" : "-";
			String undo = expr.op().equals("++") ? "-" : "+";
			if (expr.operand() instanceof CppVar && !operand.contains(".")) {
				String assign = "(" + operand + " := " + operand + " " + delta + " 1)";
				return expr.postfix() ? "(" + assign + " " + undo + " 1)" : assign;
			}
			diagnostics.report(Diagnostic.Stage.GENERATION,
					"Side effect of '" + expr.op() + "' on '" + operand + "' dropped inside an expression",
					expr.pos().line());
			return "(" + operand + " " + delta + " 1)";
		}

		@Override
		public String visitTernary(CppTernary expr, RenderContext ctx) {
			return ternary(expr, ctx, true);
		}

		String ternary(CppTernary expr, RenderContext ctx, boolean parenthesize) {
			String text = top(expr.whenTrue(), ctx) + " if " + top(expr.cond(), ctx) + " else "
					+ top(expr.whenFalse(), ctx);
			return parenthesize ? "(" + text + ")" : text;
		}

		@Override
		public String visitCall(CppCall expr, RenderContext ctx) {
			String callee;
			if (expr.callee() instanceof CppVar v && ctx.members() != null && ctx.members().isMethod(v.name())) {
				callee = "self." + v.name();
			} else {
				callee = render(expr.callee(), ctx);
			}
			List<String> args = new ArrayList<>();
			for (CppExpr arg : expr.args()) {
				args.add(top(arg, ctx));
			}
			return callee + "(" + String.join(", ", args) + ")";
		}

		@Override
		public String visitIndex(CppIndex expr, RenderContext ctx) {
			return render(expr.array(), ctx) + "[" + top(expr.index(), ctx) + "]";
		}

		@Override
		public String visitMember(CppMember expr, RenderContext ctx) {
			return render(expr.object(), ctx) + "." + expr.name();
		}

		@Override
		public String visitInitList(CppInitList expr, RenderContext ctx) {
			List<String> elements = new ArrayList<>();
			for (CppExpr e : expr.elements()) {
				elements.add(top(e, ctx));
			}
			return "[" + String.join(", ", elements) + "]";
		}
	}
}
