package cpp2py.print;

import cpp2py.Diagnostic;
import cpp2py.Diagnostics;
import cpp2py.parse.cpp.CppParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PythonPrinterTest {
	private static String print(String cpp) {
		return print(cpp, new Diagnostics());
	}

	private static String print(String cpp, Diagnostics diagnostics) {
		return new PythonPrinter(diagnostics).print(new CppParser(diagnostics).parse(cpp));
	}

	@Test
	void declarationsDefaultToZeroValues() {
		String out = print("int a; double b; char c; string s; bool f; float g = 1.5; long big = 3;");

		assertEquals("a = 0\n" +
				"b = 0.0\n" +
				"c = ''\n" +
				"s = ''\n" +
				"f = False\n" +
				"g = 1.5\n" +
				"big = 3", out);
	}

	@Test
	void arraysRenderAsListsOrRepetition() {
		String out = print("int a[3]; double big[20]; int c[] = {1, 2};");

		assertEquals("a = [0, 0, 0]\n" +
				"big = [0.0] * 20\n" +
				"c = [1, 2]", out);
	}

	@Test
	void unknownTypeFallsBackToNoneWithDiagnostic() {
		Diagnostics diagnostics = new Diagnostics();
		String out = print("vector v;", diagnostics);

		assertEquals("v = None", out);
		assertTrue(diagnostics.has(Diagnostic.Stage.GENERATION));
	}

	@Test
	void inputConvertsByRecordedType() {
		String out = print("int n; double x; char ch; bool ok; string name;\n" +
				"cin >> n >> x >> ch >> ok >> name;");

		assertTrue(out.endsWith("n = int(input())\n" +
				"x = float(input())\n" +
				"ch = input()[:1]\n" +
				"ok = input().strip().lower() in ('1', 'true', 'yes')\n" +
				"name = input()"), out);
	}

	@Test
	void inputIntoUndeclaredNameReadsRawText() {
		Diagnostics diagnostics = new Diagnostics();
		String out = print("cin >> z;", diagnostics);

		assertEquals("z = input()", out);
		assertEquals("No recorded type for 'z', reading raw text", diagnostics.entries().get(0).message());
	}

	@Test
	void outputChainsFoldIntoOnePrint() {
		String out = print("int n = 2; cout << \"n=\" << n << endl; cout << endl;");

		assertEquals("n = 2\n" +
				"print(\"n=\", n)\n" +
				"print()", out);
	}

	@Test
	void ifElseChainsUseElif() {
		String out = print("if (a < b) { x = 1; } else if (a > b) { x = 2; } else { x = 3; }");

		assertEquals("if a < b:\n" +
				"    x = 1\n" +
				"elif a > b:\n" +
				"    x = 2\n" +
				"else:\n" +
				"    x = 3", out);
	}

	@Test
	void emptyBodiesGetPass() {
		assertEquals("while x:\n    pass", print("while (x) { }"));
	}

	@Test
	void countedLoopsBecomeRange() {
		assertEquals("for i in range(0, 3):\n    print(i)",
				print("for (int i = 0; i < 3; i++) { cout << i << endl; }"));
		assertEquals("for i in range(10, 0, -2):\n    pass",
				print("for (int i = 10; i > 0; i -= 2) { }"));
		assertEquals("for i in range(1, n + 1):\n    pass",
				print("int n = 4; for (int i = 1; i <= n; ++i) { }").substring("n = 4\n".length()));
	}

	@Test
	void loopWithConditionalOutput() {
		String out = print("int a = 5; int b = 10;\n" +
				"for (int i = 0; i < 3; i++) {\n" +
				"  if (a < b) { cout << \"a is less\" << endl; } else { cout << \"a is not less\" << endl; }\n" +
				"}");

		assertEquals("a = 5\n" +
				"b = 10\n" +
				"for i in range(0, 3):\n" +
				"    if a < b:\n" +
				"        print(\"a is less\")\n" +
				"    else:\n" +
				"        print(\"a is not less\")", out);
	}

	@Test
	void inclusiveAndExclusiveBoundsGiveSameRange() {
		assertEquals("for i in range(0, 5):\n    pass", print("for (int i = 0; i <= 4; i++) { }"));
		assertEquals("for i in range(0, 4 + 1):\n    pass", print("for (int i = 0; i < 4 + 1; i++) { }"));
	}

	@Test
	void boundReachableFromCalleeKeepsWhileLoop() {
		String out = print("void dec(int a[]) { a[0] = a[0] - 1; }\n" +
				"void g() { int a[2] = {3, 0}; for (int i = 0; i < a[0]; i++) { dec(a); cout << i << endl; } }");

		assertTrue(out.contains("    while i < a[0]:\n" +
				"        dec(a)\n" +
				"        print(i)\n" +
				"        i = i + 1"), out);
		assertFalse(out.contains("range"), out);
	}

	@Test
	void fieldBoundWithCallsKeepsWhileLoop() {
		String out = print("class C {\n" +
				"  int n;\n" +
				"  void shrink() { n = n - 1; }\n" +
				"  void run() { for (int i = 0; i < n; i++) { shrink(); } }\n" +
				"};");

		assertTrue(out.contains("while i < self.n:"), out);
		assertFalse(out.contains("range"), out);
	}

	@Test
	void localBoundWithCallsStillUsesRange() {
		String out = print("void h(int n) { for (int i = 0; i < n; i++) { tick(); } }");

		assertEquals("def h(n):\n" +
				"    for i in range(0, n):\n" +
				"        tick()", out);
	}

	@Test
	void topLevelBoundWithCallsKeepsWhileLoop() {
		String out = print("int main() { int n = 3; for (int i = 0; i < n; i++) { tick(); } }");

		assertTrue(out.contains("while i < n:"), out);
	}

	@Test
	void otherLoopsLowerToWhileAndAdvanceBeforeContinue() {
		String out = print("int i; for (i = 0; i < 5; i++) { if (i == 2) continue; s = s + i; }");

		assertEquals("i = 0\n" +
				"i = 0\n" +
				"while i < 5:\n" +
				"    if i == 2:\n" +
				"        i = i + 1\n" +
				"        continue\n" +
				"    s = s + i\n" +
				"    i = i + 1", out);
	}

	@Test
	void functionsDeclareRebindingOfGlobals() {
		String out = print("int total = 0;\n" +
				"void add(int v) { total += v; }\n" +
				"int main() { add(2); cout << total << endl; return 0; }");

		assertEquals("total = 0\n" +
				"def add(v):\n" +
				"    global total\n" +
				"    total = total + v\n" +
				"add(2)\n" +
				"print(total)", out);
	}

	@Test
	void localShadowingGlobalNeedsNoGlobalLine() {
		String out = print("int n = 0;\nint f() { int n = 3; n = n + 1; return n; }");

		assertFalse(out.contains("global"), out);
	}

	@Test
	void returnInTopLevelCodeExits() {
		String out = print("int main() { if (bad) { return 1; } cout << 1 << endl; return 0; }");

		assertEquals("if bad:\n" +
				"    raise SystemExit(1)\n" +
				"print(1)", out);
	}

	@Test
	void integerDivisionTruncates() {
		String out = print("int a = 7; int b = 2; double c = 7.0; int q = a / b; double r = c / b;");

		assertTrue(out.contains("q = (a // b if a * b >= 0 else -(-a // b))"), out);
		assertTrue(out.contains("r = c / b"), out);
	}

	@Test
	void integerDivisionStaysExactForLargeOperands() {
		Diagnostics diagnostics = new Diagnostics();
		String out = print("long big = 9007199254740993; long q = big / 1;", diagnostics);

		assertTrue(out.endsWith("q = (big // 1 if big * 1 >= 0 else -(-big // 1))"), out);
		assertTrue(diagnostics.isEmpty());
	}

	@Test
	void integerDivisionWithSideEffectFallsBackAndReports() {
		Diagnostics diagnostics = new Diagnostics();
		String out = print("int a = 7; int b = 2; int q = a / b++;", diagnostics);

		assertTrue(out.endsWith("q = int(a / ((b := b + 1) - 1))"), out);
		assertTrue(diagnostics.has(Diagnostic.Stage.GENERATION));
	}

	@Test
	void octalLiteralRendersItsValue() {
		assertEquals("mode = 493", print("int mode = 0755;"));
	}

	@Test
	void sizeofIdiomBecomesLen() {
		String out = print("int arr[4]; int n = sizeof(arr) / sizeof(arr[0]);");

		assertTrue(out.endsWith("n = len(arr)"), out);
	}

	@Test
	void incrementInsideExpressionUsesAssignmentExpression() {
		String out = print("int i = 0; int j = i++; int k = ++i;");

		assertEquals("i = 0\n" +
				"j = ((i := i + 1) - 1)\n" +
				"k = (i := i + 1)", out);
	}

	@Test
	void incrementOfElementInsideExpressionIsReported() {
		Diagnostics diagnostics = new Diagnostics();
		String out = print("int a[2]; a[0]++; x = a[1]--;", diagnostics);

		assertTrue(out.contains("a[0] = a[0] + 1"), out);
		assertTrue(out.endsWith("x = (a[1] - 1)"), out);
		assertTrue(diagnostics.has(Diagnostic.Stage.GENERATION));
	}

	@Test
	void logicalOperatorsAndTernary() {
		assertEquals("t = ((not a) and b) or c", print("t = !a && b || c;"));
		assertEquals("m = a if a > b else b", print("m = a > b ? a : b;"));
	}

	@Test
	void classesBecomePythonClasses() {
		String out = print("class Point {\n" +
				"public:\n" +
				"  int x, y;\n" +
				"  Point(int a, int b) : x(a), y(b) { }\n" +
				"  int sum() { return x + y; }\n" +
				"  void shift(int d) { x += d; move(); }\n" +
				"  void move() { }\n" +
				"};\n" +
				"int main() { Point p(1, 2); cout << p.sum() << endl; }");

		assertEquals("class Point:\n" +
				"    def __init__(self, a, b):\n" +
				"        self.x = 0\n" +
				"        self.y = 0\n" +
				"        self.x = a\n" +
				"        self.y = b\n" +
				"    def sum(self):\n" +
				"        return self.x + self.y\n" +
				"    def shift(self, d):\n" +
				"        self.x = self.x + d\n" +
				"        self.move()\n" +
				"    def move(self):\n" +
				"        pass\n" +
				"p = Point(1, 2)\n" +
				"print(p.sum())", out);
	}

	@Test
	void classTypedDeclarationsConstructInstances() {
		String out = print("struct E { };\nint main() { E e; E pair[2]; E many[20]; }");

		assertEquals("class E:\n" +
				"    pass\n" +
				"e = E()\n" +
				"pair = [E(), E()]\n" +
				"many = [E() for _ in range(20)]", out);
	}

	@Test
	void honorsIndentWidth() {
		Diagnostics diagnostics = new Diagnostics();
		String out = new PythonPrinter(diagnostics, 2).print(new CppParser(diagnostics).parse("if (a) b = 1;"));

		assertEquals("if a:\n  b = 1", out);
	}

	@Test
	void formatsFloatsAsPythonLiterals() {
		assertEquals("2.0", PythonPrinter.pythonFloat(2.0));
		assertEquals("0.1", PythonPrinter.pythonFloat(0.1));
		assertEquals("1.0e20", PythonPrinter.pythonFloat(1e20));
		assertEquals("float('inf')", PythonPrinter.pythonFloat(Double.POSITIVE_INFINITY));
	}
}
