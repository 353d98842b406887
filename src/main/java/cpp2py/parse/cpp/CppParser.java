package cpp2py.parse.cpp;

import cpp2py.Diagnostic;
import cpp2py.Diagnostics;
import cpp2py.ast.SourcePos;
import cpp2py.ast.cpp.CppArrayDecl;
import cpp2py.ast.cpp.CppAssign;
import cpp2py.ast.cpp.CppBinary;
import cpp2py.ast.cpp.CppBlock;
import cpp2py.ast.cpp.CppBreak;
import cpp2py.ast.cpp.CppCall;
import cpp2py.ast.cpp.CppClassDef;
import cpp2py.ast.cpp.CppContinue;
import cpp2py.ast.cpp.CppEndl;
import cpp2py.ast.cpp.CppExpr;
import cpp2py.ast.cpp.CppExprStmt;
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
import cpp2py.ast.cpp.CppStreamItem;
import cpp2py.ast.cpp.CppStreamValue;
import cpp2py.ast.cpp.CppTernary;
import cpp2py.ast.cpp.CppUnary;
import cpp2py.ast.cpp.CppVar;
import cpp2py.ast.cpp.CppVarDecl;
import cpp2py.ast.cpp.CppWhile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the supported C++ subset.
 *
 * Precedence, lowest to highest: ternary, ||, &&, equality, relational, additive, multiplicative, unary, postfix.
 * A syntax error is reported to the {@link Diagnostics} and the whole parse is abandoned in favor of an empty
 * {@link CppProgram}; callers must treat an empty program as a failed translation.
 *
 * Class names seen during one call to {@link #parse(String)} are forgotten at the next; instances must not be shared
 * across threads.
 */
public final class CppParser {
	private static final Set<String> TYPE_KEYWORDS = Set.of(
			"int", "long", "short", "unsigned", "signed", "float", "double", "char", "bool", "string", "void", "const");

	// checked in order: the first base type present wins ("long double" is a double, "unsigned long" a long)
	private static final List<String> BASE_TYPES = List.of(
			"double", "float", "char", "bool", "string", "void", "long", "short", "int");

	private static final Map<String, String> COMPOUND_OPS = Map.of(
			"+=", "+", "-=", "-", "*=", "*", "/=", "/", "%=", "%");

	private final Diagnostics diagnostics;
	private final Set<String> classNames = new HashSet<>();

	public CppParser(Diagnostics diagnostics) {
		this.diagnostics = diagnostics;
	}

	public CppProgram parse(String source) {
		classNames.clear();
		List<CppToken> tokens = new CppLexer(diagnostics).lex(source);
		Cursor c = new Cursor(tokens);
		try {
			return parseProgram(c);
		} catch (SyntaxError err) {
			diagnostics.report(Diagnostic.Stage.SYNTAX, err.getMessage(), err.line);
			return CppProgram.empty();
		}
	}

	private CppProgram parseProgram(Cursor c) {
		SourcePos start = c.peek().pos();
		List<CppStmt> items = new ArrayList<>();
		List<CppStmt> mainBody = null;

		while (!c.isAtEnd()) {
			if (c.acceptSymbol(";")) {
				continue;
			}
			if (c.peekIsKeyword("class") || c.peekIsKeyword("struct")) {
				items.add(parseClass(c));
				continue;
			}
			int afterType = c.scanType(c.position());
			if (afterType >= 0 && c.at(afterType).type() == CppTokenType.IDENT
					&& c.at(afterType + 1).is(CppTokenType.SYMBOL, "(")
					&& startsParameterList(c, afterType + 2)) {
				parseType(c);
				CppToken name = c.expect(CppTokenType.IDENT);
				CppFuncDef fn = parseFunctionRest(name, c);
				if (fn == null) {
					continue; // prototype
				}
				if (fn.name().equals("main")) {
					mainBody = withoutTrailingReturn(fn.body().stmts());
				} else {
					items.add(fn);
				}
				continue;
			}
			items.addAll(parseStatement(c));
		}

		// main runs after every global definition, including functions defined below it
		if (mainBody != null) {
			items.addAll(mainBody);
		}
		return new CppProgram(items, start);
	}

	/**
	 * Whether the tokens after an opening parenthesis read as parameters rather than constructor arguments:
	 * {@code f()}, {@code f(int x)}, {@code f(Point p)} or {@code f(Point)} for a class defined earlier.
	 */
	private boolean startsParameterList(Cursor c, int index) {
		CppToken t = c.at(index);
		if (t.is(CppTokenType.SYMBOL, ")")) {
			return true;
		}
		if (t.type() == CppTokenType.KEYWORD) {
			return TYPE_KEYWORDS.contains(t.lexeme());
		}
		return t.type() == CppTokenType.IDENT
				&& (classNames.contains(t.lexeme()) || c.at(index + 1).type() == CppTokenType.IDENT);
	}

	private static List<CppStmt> withoutTrailingReturn(List<CppStmt> stmts) {
		if (!stmts.isEmpty() && stmts.get(stmts.size() - 1) instanceof CppReturn) {
			return stmts.subList(0, stmts.size() - 1);
		}
		return stmts;
	}

	/**
	 * Parses parameters and body after {@code name}. Returns null for a prototype.
	 */
	private CppFuncDef parseFunctionRest(CppToken name, Cursor c) {
		List<String> params = parseParams(c);
		if (c.acceptSymbol(";")) {
			return null;
		}
		CppBlock body = parseBlock(c);
		return new CppFuncDef(name.lexeme(), params, body, name.pos());
	}

	private List<String> parseParams(Cursor c) {
		c.expectSymbol("(");
		List<String> params = new ArrayList<>();
		if (c.peekIsKeyword("void") && c.at(c.position() + 1).is(CppTokenType.SYMBOL, ")")) {
			c.next();
		}
		if (!c.peekIsSymbol(")")) {
			int unnamed = 0;
			while (true) {
				parseType(c);
				if (c.peek().type() == CppTokenType.IDENT) {
					params.add(c.next().lexeme());
				} else {
					params.add("_arg" + unnamed++);
				}
				// array parameter: int a[] or int a[10]
				if (c.acceptSymbol("[")) {
					if (c.peek().type() == CppTokenType.INT) {
						c.next();
					}
					c.expectSymbol("]");
				}
				if (c.acceptSymbol(",")) {
					continue;
				}
				break;
			}
		}
		c.expectSymbol(")");
		return params;
	}

	private CppClassDef parseClass(Cursor c) {
		CppToken start = c.next();
		CppToken nameTok = c.expect(CppTokenType.IDENT);
		String className = nameTok.lexeme();
		classNames.add(className);
		c.expectSymbol("{");

		List<CppStmt> fields = new ArrayList<>();
		List<CppFuncDef> methods = new ArrayList<>();
		CppFuncDef constructor = null;

		while (!c.isAtEnd() && !c.peekIsSymbol("}")) {
			if (c.acceptSymbol(";")) {
				continue;
			}
			if (c.peekIsKeyword("public") || c.peekIsKeyword("private") || c.peekIsKeyword("protected")) {
				c.next();
				c.expectSymbol(":");
				continue;
			}
			if (c.peek().is(CppTokenType.IDENT, className) && c.at(c.position() + 1).is(CppTokenType.SYMBOL, "(")) {
				CppToken ctorTok = c.next();
				CppFuncDef ctor = parseConstructorRest(ctorTok, c);
				if (ctor != null) {
					constructor = ctor;
				}
				continue;
			}

			String type = parseType(c);
			if (c.peek().type() == CppTokenType.IDENT && c.at(c.position() + 1).is(CppTokenType.SYMBOL, "(")) {
				CppToken methodName = c.next();
				CppFuncDef method = parseFunctionRest(methodName, c);
				if (method != null) {
					methods.add(method);
				}
				continue;
			}
			fields.addAll(parseDeclarators(type, c));
			c.expectSymbol(";");
		}
		c.expectSymbol("}");
		c.acceptSymbol(";");
		return new CppClassDef(className, fields, constructor, methods, start.pos());
	}

	private CppFuncDef parseConstructorRest(CppToken nameTok, Cursor c) {
		List<String> params = parseParams(c);
		if (c.acceptSymbol(";")) {
			return null;
		}

		// member initializer list becomes leading assignments
		List<CppStmt> stmts = new ArrayList<>();
		if (c.acceptSymbol(":")) {
			do {
				CppToken field = c.expect(CppTokenType.IDENT);
				c.expectSymbol("(");
				CppExpr value = parseExpr(c);
				c.expectSymbol(")");
				CppExpr target = new CppMember(new CppVar("this", field.pos()), field.lexeme(), field.pos());
				stmts.add(new CppAssign(target, value, field.pos()));
			} while (c.acceptSymbol(","));
		}
		CppBlock body = parseBlock(c);
		stmts.addAll(body.stmts());
		return new CppFuncDef(nameTok.lexeme(), params, new CppBlock(stmts, body.pos()), nameTok.pos());
	}

	private CppBlock parseBlock(Cursor c) {
		CppToken start = c.expectSymbol("{");
		List<CppStmt> stmts = new ArrayList<>();
		while (!c.isAtEnd() && !c.peekIsSymbol("}")) {
			stmts.addAll(parseStatement(c));
		}
		c.expectSymbol("}");
		return new CppBlock(stmts, start.pos());
	}

	/**
	 * Body of if/while/for. A single statement is wrapped into a block.
	 */
	private CppBlock parseBody(Cursor c) {
		if (c.peekIsSymbol("{")) {
			return parseBlock(c);
		}
		SourcePos pos = c.peek().pos();
		return new CppBlock(parseStatement(c), pos);
	}

	/**
	 * A statement yields zero ({@code ;}), one, or several (multi-declarator declaration) nodes.
	 */
	private List<CppStmt> parseStatement(Cursor c) {
		CppToken t = c.peek();

		if (t.is(CppTokenType.SYMBOL, "{")) {
			return List.of(parseBlock(c));
		}
		if (t.is(CppTokenType.SYMBOL, ";")) {
			c.next();
			return List.of();
		}
		if (t.type() == CppTokenType.KEYWORD) {
			switch (t.lexeme()) {
				case "if":
					return List.of(parseIf(c));
				case "while":
					return List.of(parseWhile(c));
				case "for":
					return List.of(parseFor(c));
				case "break":
					c.next();
					c.expectSymbol(";");
					return List.of(new CppBreak(t.pos()));
				case "continue":
					c.next();
					c.expectSymbol(";");
					return List.of(new CppContinue(t.pos()));
				case "return":
					return List.of(parseReturn(c));
				case "cout":
					return List.of(parseOutput(c));
				case "cin":
					return List.of(parseInput(c));
				default:
					break;
			}
		}
		if (isDeclarationStart(c)) {
			String type = parseType(c);
			List<CppStmt> decls = parseDeclarators(type, c);
			c.expectSymbol(";");
			return decls;
		}

		CppStmt simple = parseSimple(c);
		c.expectSymbol(";");
		return List.of(simple);
	}

	private boolean isDeclarationStart(Cursor c) {
		CppToken t = c.peek();
		if (t.type() == CppTokenType.KEYWORD) {
			return TYPE_KEYWORDS.contains(t.lexeme());
		}
		// ClassName var ...
		return t.type() == CppTokenType.IDENT && c.at(c.position() + 1).type() == CppTokenType.IDENT;
	}

	private CppIf parseIf(Cursor c) {
		CppToken start = c.next();
		c.expectSymbol("(");
		CppExpr cond = parseExpr(c);
		c.expectSymbol(")");
		CppBlock thenBlock = parseBody(c);
		CppBlock elseBlock = null;
		// innermost if takes the else
		if (c.peekIsKeyword("else")) {
			c.next();
			elseBlock = parseBody(c);
		}
		return new CppIf(cond, thenBlock, elseBlock, start.pos());
	}

	private CppWhile parseWhile(Cursor c) {
		CppToken start = c.next();
		c.expectSymbol("(");
		CppExpr cond = parseExpr(c);
		c.expectSymbol(")");
		return new CppWhile(cond, parseBody(c), start.pos());
	}

	private CppFor parseFor(Cursor c) {
		CppToken start = c.next();
		c.expectSymbol("(");

		CppStmt init = null;
		if (!c.peekIsSymbol(";")) {
			if (isDeclarationStart(c)) {
				SourcePos pos = c.peek().pos();
				String type = parseType(c);
				List<CppStmt> decls = parseDeclarators(type, c);
				init = decls.size() == 1 ? decls.get(0) : new CppBlock(decls, pos);
			} else {
				init = parseSimple(c);
			}
		}
		c.expectSymbol(";");

		CppExpr cond = c.peekIsSymbol(";") ? null : parseExpr(c);
		c.expectSymbol(";");

		CppStmt iter = null;
		if (!c.peekIsSymbol(")")) {
			SourcePos pos = c.peek().pos();
			List<CppStmt> iters = new ArrayList<>();
			do {
				iters.add(parseSimple(c));
			} while (c.acceptSymbol(","));
			iter = iters.size() == 1 ? iters.get(0) : new CppBlock(iters, pos);
		}
		c.expectSymbol(")");

		return new CppFor(init, cond, iter, parseBody(c), start.pos());
	}

	private CppReturn parseReturn(Cursor c) {
		CppToken start = c.next();
		CppExpr value = c.peekIsSymbol(";") ? null : parseExpr(c);
		c.expectSymbol(";");
		return new CppReturn(value, start.pos());
	}

	private CppOutputStmt parseOutput(Cursor c) {
		CppToken start = c.next();
		List<CppStreamItem> items = new ArrayList<>();
		c.expectSymbol("<<");
		do {
			CppToken t = c.peek();
			if (t.is(CppTokenType.KEYWORD, "endl")) {
				c.next();
				items.add(new CppEndl(t.pos()));
			} else {
				CppExpr value = parseExpr(c);
				items.add(new CppStreamValue(value, value.pos()));
			}
		} while (c.acceptSymbol("<<"));
		c.expectSymbol(";");
		return new CppOutputStmt(items, start.pos());
	}

	private CppInputStmt parseInput(Cursor c) {
		CppToken start = c.next();
		List<CppExpr> targets = new ArrayList<>();
		c.expectSymbol(">>");
		do {
			CppToken t = c.peek();
			CppExpr target = parsePostfix(c);
			if (!isAssignable(target)) {
				throw new SyntaxError(t);
			}
			targets.add(target);
		} while (c.acceptSymbol(">>"));
		c.expectSymbol(";");
		return new CppInputStmt(targets, start.pos());
	}

	/**
	 * Assignment, compound assignment, or bare expression; no trailing semicolon.
	 */
	private CppStmt parseSimple(Cursor c) {
		CppToken start = c.peek();
		CppExpr expr = parseExpr(c);
		CppToken t = c.peek();
		if (t.is(CppTokenType.SYMBOL, "=")) {
			requireAssignable(expr, start);
			c.next();
			return new CppAssign(expr, parseExpr(c), expr.pos());
		}
		if (t.type() == CppTokenType.SYMBOL && COMPOUND_OPS.containsKey(t.lexeme())) {
			requireAssignable(expr, start);
			c.next();
			CppExpr rhs = parseExpr(c);
			CppExpr lowered = new CppBinary(expr, COMPOUND_OPS.get(t.lexeme()), rhs, expr.pos());
			return new CppAssign(expr, lowered, expr.pos());
		}
		return new CppExprStmt(expr, expr.pos());
	}

	private static void requireAssignable(CppExpr expr, CppToken start) {
		if (!isAssignable(expr)) {
			throw new SyntaxError(start);
		}
	}

	private static boolean isAssignable(CppExpr expr) {
		return expr instanceof CppVar || expr instanceof CppIndex || expr instanceof CppMember;
	}

	private List<CppStmt> parseDeclarators(String type, Cursor c) {
		List<CppStmt> decls = new ArrayList<>();
		do {
			CppToken name = c.expect(CppTokenType.IDENT);

			if (c.acceptSymbol("[")) {
				int size = -1;
				CppToken sizeTok = c.peek();
				if (sizeTok.type() == CppTokenType.INT) {
					long declared = (Long) sizeTok.value();
					if (declared > Integer.MAX_VALUE) {
						throw new SyntaxError(sizeTok);
					}
					c.next();
					size = (int) declared;
				}
				c.expectSymbol("]");
				CppInitList init = null;
				if (c.acceptSymbol("=")) {
					init = parseInitList(c);
				}
				if (size < 0) {
					if (init == null) {
						throw new SyntaxError(c.peek());
					}
					size = init.elements().size();
				}
				decls.add(new CppArrayDecl(type, name.lexeme(), size, init, name.pos()));
				continue;
			}

			CppExpr init = null;
			if (c.acceptSymbol("=")) {
				init = parseExpr(c);
			} else if (c.peekIsSymbol("(")) {
				// Point p(1, 2); int n(5);
				List<CppExpr> args = parseArgs(c);
				if (TYPE_KEYWORDS.contains(type) && args.size() == 1) {
					init = args.get(0);
				} else {
					init = new CppCall(new CppVar(type, name.pos()), args, name.pos());
				}
			}
			decls.add(new CppVarDecl(type, name.lexeme(), init, name.pos()));
		} while (c.acceptSymbol(","));
		return decls;
	}

	private CppInitList parseInitList(Cursor c) {
		CppToken start = c.expectSymbol("{");
		List<CppExpr> elements = new ArrayList<>();
		if (!c.peekIsSymbol("}")) {
			do {
				if (c.peekIsSymbol("}")) {
					break; // trailing comma
				}
				elements.add(parseExpr(c));
			} while (c.acceptSymbol(","));
		}
		c.expectSymbol("}");
		return new CppInitList(elements, start.pos());
	}

	/**
	 * Reads a type specifier and folds qualifiers into one tag: {@code const unsigned long long} becomes {@code long}.
	 */
	private String parseType(Cursor c) {
		CppToken t = c.peek();
		if (t.is(CppTokenType.KEYWORD, "const")) {
			c.next();
			t = c.peek();
		}
		if (t.type() == CppTokenType.IDENT) {
			c.next();
			return t.lexeme();
		}

		List<String> words = new ArrayList<>();
		while (c.peek().type() == CppTokenType.KEYWORD && TYPE_KEYWORDS.contains(c.peek().lexeme())) {
			words.add(c.next().lexeme());
		}
		if (words.isEmpty()) {
			throw new SyntaxError(t);
		}
		for (String base : BASE_TYPES) {
			if (words.contains(base)) {
				return base;
			}
		}
		// bare unsigned / signed
		return "int";
	}

	private CppExpr parseExpr(Cursor c) {
		CppExpr cond = parseOr(c);
		if (c.acceptSymbol("?")) {
			CppExpr whenTrue = parseExpr(c);
			c.expectSymbol(":");
			CppExpr whenFalse = parseExpr(c);
			return new CppTernary(cond, whenTrue, whenFalse, cond.pos());
		}
		return cond;
	}

	private CppExpr parseOr(Cursor c) {
		CppExpr left = parseAnd(c);
		while (c.peekIsSymbol("||")) {
			String op = c.next().lexeme();
			left = new CppBinary(left, op, parseAnd(c), left.pos());
		}
		return left;
	}

	private CppExpr parseAnd(Cursor c) {
		CppExpr left = parseEquality(c);
		while (c.peekIsSymbol("&&")) {
			String op = c.next().lexeme();
			left = new CppBinary(left, op, parseEquality(c), left.pos());
		}
		return left;
	}

	private CppExpr parseEquality(Cursor c) {
		CppExpr left = parseRelational(c);
		while (c.peekIsSymbol("==") || c.peekIsSymbol("!=")) {
			String op = c.next().lexeme();
			left = new CppBinary(left, op, parseRelational(c), left.pos());
		}
		return left;
	}

	private CppExpr parseRelational(Cursor c) {
		CppExpr left = parseAdditive(c);
		while (c.peekIsSymbol("<") || c.peekIsSymbol("<=") || c.peekIsSymbol(">") || c.peekIsSymbol(">=")) {
			String op = c.next().lexeme();
			left = new CppBinary(left, op, parseAdditive(c), left.pos());
		}
		return left;
	}

	private CppExpr parseAdditive(Cursor c) {
		CppExpr left = parseMultiplicative(c);
		while (c.peekIsSymbol("+") || c.peekIsSymbol("-")) {
			String op = c.next().lexeme();
			left = new CppBinary(left, op, parseMultiplicative(c), left.pos());
		}
		return left;
	}

	private CppExpr parseMultiplicative(Cursor c) {
		CppExpr left = parseUnary(c);
		while (c.peekIsSymbol("*") || c.peekIsSymbol("/") || c.peekIsSymbol("%")) {
			String op = c.next().lexeme();
			left = new CppBinary(left, op, parseUnary(c), left.pos());
		}
		return left;
	}

	private CppExpr parseUnary(Cursor c) {
		CppToken t = c.peek();
		if (t.type() == CppTokenType.SYMBOL) {
			switch (t.lexeme()) {
				case "-":
				case "+":
				case "!":
				case "++":
				case "--":
					c.next();
					return new CppUnary(t.lexeme(), parseUnary(c), false, t.pos());
				default:
					break;
			}
		}
		return parsePostfix(c);
	}

	private CppExpr parsePostfix(Cursor c) {
		CppExpr expr = parsePrimary(c);
		while (true) {
			if (c.peekIsSymbol("(")) {
				expr = new CppCall(expr, parseArgs(c), expr.pos());
				continue;
			}
			if (c.acceptSymbol("[")) {
				CppExpr index = parseExpr(c);
				c.expectSymbol("]");
				expr = new CppIndex(expr, index, expr.pos());
				continue;
			}
			if (c.acceptSymbol(".")) {
				CppToken member = c.expect(CppTokenType.IDENT);
				expr = new CppMember(expr, member.lexeme(), expr.pos());
				continue;
			}
			if (c.peekIsSymbol("++") || c.peekIsSymbol("--")) {
				expr = new CppUnary(c.next().lexeme(), expr, true, expr.pos());
				continue;
			}
			return expr;
		}
	}

	private List<CppExpr> parseArgs(Cursor c) {
		c.expectSymbol("(");
		List<CppExpr> args = new ArrayList<>();
		if (!c.peekIsSymbol(")")) {
			do {
				args.add(parseExpr(c));
			} while (c.acceptSymbol(","));
		}
		c.expectSymbol(")");
		return args;
	}

	private CppExpr parsePrimary(Cursor c) {
		CppToken t = c.peek();
		switch (t.type()) {
			case INT:
				c.next();
				return new CppLiteral(CppLiteral.Kind.INT, t.value(), t.lexeme(), t.pos());
			case FLOAT:
				c.next();
				return new CppLiteral(CppLiteral.Kind.FLOAT, t.value(), t.lexeme(), t.pos());
			case STRING:
				c.next();
				return new CppLiteral(CppLiteral.Kind.STRING, t.value(), t.lexeme(), t.pos());
			case CHAR:
				c.next();
				return new CppLiteral(CppLiteral.Kind.CHAR, t.value(), t.lexeme(), t.pos());
			case IDENT:
				c.next();
				return new CppVar(t.lexeme(), t.pos());
			case KEYWORD:
				if (t.value() instanceof Boolean) {
					c.next();
					return new CppLiteral(CppLiteral.Kind.BOOL, t.value(), t.lexeme(), t.pos());
				}
				break;
			case SYMBOL:
				if (t.lexeme().equals("(")) {
					c.next();
					CppExpr inner = parseExpr(c);
					c.expectSymbol(")");
					return inner;
				}
				break;
			default:
				break;
		}
		throw new SyntaxError(t);
	}

	private static final class SyntaxError extends RuntimeException {
		final int line;

		SyntaxError(CppToken t) {
			super(t.type() == CppTokenType.EOF
					? "Syntax error at EOF"
					: "Syntax error at token " + t.type() + ", value '" + t.lexeme() + "', line " + t.line());
			this.line = t.line();
		}
	}

	private static final class Cursor {
		private final List<CppToken> tokens;
		private int pos;

		Cursor(List<CppToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == CppTokenType.EOF;
		}

		int position() {
			return pos;
		}

		CppToken peek() {
			return tokens.get(pos);
		}

		CppToken at(int index) {
			return tokens.get(Math.min(index, tokens.size() - 1));
		}

		CppToken next() {
			CppToken t = tokens.get(pos);
			if (t.type() != CppTokenType.EOF) {
				pos++;
			}
			return t;
		}

		boolean peekIsSymbol(String lexeme) {
			return peek().is(CppTokenType.SYMBOL, lexeme);
		}

		boolean peekIsKeyword(String lexeme) {
			return peek().is(CppTokenType.KEYWORD, lexeme);
		}

		boolean acceptSymbol(String lexeme) {
			if (peekIsSymbol(lexeme)) {
				pos++;
				return true;
			}
			return false;
		}

		/**
		 * Index just past a type specifier starting at {@code from}, or -1 if none starts there.
		 */
		int scanType(int from) {
			int i = from;
			if (at(i).is(CppTokenType.KEYWORD, "const")) {
				i++;
			}
			if (at(i).type() == CppTokenType.IDENT) {
				return i + 1;
			}
			int start = i;
			while (at(i).type() == CppTokenType.KEYWORD && TYPE_KEYWORDS.contains(at(i).lexeme())) {
				i++;
			}
			return i > start ? i : -1;
		}

		CppToken expectSymbol(String lexeme) {
			CppToken t = peek();
			if (!t.is(CppTokenType.SYMBOL, lexeme)) {
				throw new SyntaxError(t);
			}
			return next();
		}

		CppToken expect(CppTokenType type) {
			CppToken t = peek();
			if (t.type() != type) {
				throw new SyntaxError(t);
			}
			return next();
		}
	}
}
