package cpp2py.transform;

import cpp2py.Diagnostics;
import cpp2py.ast.cpp.CppBinary;
import cpp2py.ast.cpp.CppExpr;
import cpp2py.ast.cpp.CppFor;
import cpp2py.ast.cpp.CppLiteral;
import cpp2py.ast.cpp.CppUnary;
import cpp2py.ast.cpp.CppVar;
import cpp2py.parse.cpp.CppParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RangeLoopStrategyTest {
	private static final LoopFacts NO_LOCALS = facts(Set.of());

	private static LoopFacts facts(Set<String> locals) {
		return new LoopFacts() {
			@Override
			public boolean mayBeIntegral(CppExpr expr) {
				return !(expr instanceof CppLiteral lit) || lit.kind() == CppLiteral.Kind.INT;
			}

			@Override
			public boolean isScalarLocal(String name) {
				return locals.contains(name);
			}
		};
	}

	private static CppFor loop(String source) {
		return (CppFor) new CppParser(new Diagnostics()).parse(source).stmts().get(0);
	}

	private static Optional<CountedLoop> match(String source) {
		return new RangeLoopStrategy().match(loop(source), NO_LOCALS);
	}

	private static long intValue(CppExpr expr) {
		return (Long) assertInstanceOf(CppLiteral.class, expr).value();
	}

	@Test
	void matchesSimpleAscendingLoop() {
		CountedLoop counted = match("for (int i = 0; i < n; i++) { s = s + i; }").orElseThrow();

		assertEquals("i", counted.var());
		assertEquals(0, intValue(counted.start()));
		assertEquals("n", assertInstanceOf(CppVar.class, counted.end()).name());
		assertTrue(counted.hasUnitStep());
	}

	@Test
	void inclusiveBoundIsOffset() {
		CountedLoop literal = match("for (int i = 1; i <= 10; i++) { }").orElseThrow();
		assertEquals(11, intValue(literal.end()));

		CountedLoop symbolic = match("for (int i = 1; i <= n; i++) { }").orElseThrow();
		CppBinary end = assertInstanceOf(CppBinary.class, symbolic.end());
		assertEquals("+", end.op());
		assertEquals(1, intValue(end.right()));
	}

	@Test
	void descendingLoopsUseNegativeStep() {
		CountedLoop counted = match("for (int i = 10; i >= 0; i -= 2) { }").orElseThrow();

		assertEquals(-2, counted.step());
		assertEquals(-1, intValue(counted.end()));
		assertFalse(counted.hasUnitStep());
	}

	@Test
	void recognizesStepForms() {
		assertEquals(3, match("for (int i = 0; i < 9; i = i + 3) { }").orElseThrow().step());
		assertEquals(3, match("for (int i = 0; i < 9; i = 3 + i) { }").orElseThrow().step());
		assertEquals(-1, match("for (int i = 9; i > 0; --i) { }").orElseThrow().step());
		assertEquals(-4, match("for (int i = 9; i > 0; i = i + -4) { }").orElseThrow().step());
	}

	@Test
	void rejectsStepAgainstDirectionOrZero() {
		assertTrue(match("for (int i = 0; i < 10; i--) { }").isEmpty());
		assertTrue(match("for (int i = 0; i < 10; i += 0) { }").isEmpty());
		assertTrue(match("for (int i = 0; i != 10; i++) { }").isEmpty());
	}

	@Test
	void rejectsLoopsWithoutOwnIntegerVariable() {
		assertTrue(match("for (i = 0; i < 10; i++) { }").isEmpty());
		assertTrue(match("for (double d = 0; d < 1; d++) { }").isEmpty());
		assertTrue(match("for (int i = 0; i < 2.5; i++) { }").isEmpty());
	}

	@Test
	void rejectsWhenBodyChangesVariableOrBound() {
		assertTrue(match("for (int i = 0; i < n; i++) { i = i + 1; }").isEmpty());
		assertTrue(match("for (int i = 0; i < n; i++) { n--; }").isEmpty());
		assertTrue(match("for (int i = 0; i < a[0]; i++) { a[0] = 1; }").isEmpty());
	}

	@Test
	void rejectsBoundWithSideEffectsOrSelfReference() {
		assertTrue(match("for (int i = 0; i < size(); i++) { }").isEmpty());
		assertTrue(match("for (int i = 0; i < n - i; i++) { }").isEmpty());
	}

	@Test
	void callsInBodyRequireScalarLocalBound() {
		CppFor withCall = loop("for (int i = 0; i < n; i++) { tick(); }");

		assertTrue(new RangeLoopStrategy().match(withCall, facts(Set.of("n"))).isPresent());
		assertTrue(new RangeLoopStrategy().match(withCall, NO_LOCALS).isEmpty());
	}

	@Test
	void callsInBodyRejectElementBound() {
		CppFor withCall = loop("for (int i = 0; i < a[0]; i++) { dec(a); }");

		assertTrue(new RangeLoopStrategy().match(withCall, facts(Set.of("a"))).isEmpty());
	}

	@Test
	void callsInBodyRejectMemberBound() {
		CppFor withCall = loop("for (int i = 0; i < box.size; i++) { box.shrink(); }");

		assertTrue(new RangeLoopStrategy().match(withCall, facts(Set.of("box"))).isEmpty());
	}

	@Test
	void callsInBodyRejectFieldBound() {
		// inside a method a bare field name is not a local
		CppFor withCall = loop("for (int i = 0; i < count; i++) { shrink(); }");

		assertTrue(new RangeLoopStrategy().match(withCall, facts(Set.of("i"))).isEmpty());
	}

	@Test
	void elementBoundWithoutCallsStillMatches() {
		assertTrue(match("for (int i = 0; i < a[0]; i++) { s = s + i; }").isPresent());
	}

	@Test
	void rangeVisitsSameValuesAsOriginalLoop() {
		long[] starts = {-3, 0, 2, 5};
		long[] bounds = {-4, 0, 3, 7};
		long[] strides = {1, 2, 3};
		int checked = 0;
		for (long start : starts) {
			for (long bound : bounds) {
				for (long stride : strides) {
					for (String op : List.of("<", "<=", ">", ">=")) {
						long step = op.startsWith("<") ? stride : -stride;
						String source = "for (int i = " + start + "; i " + op + " " + bound + "; " + stepText(step)
								+ ") { }";
						CountedLoop counted = match(source).orElseThrow(() -> new AssertionError(source));

						assertEquals(simulate(start, op, bound, step), rangeValues(counted), source);
						checked++;
					}
				}
			}
		}
		assertEquals(192, checked);
	}

	private static String stepText(long step) {
		if (step == 1) {
			return "i++";
		}
		if (step == -1) {
			return "i--";
		}
		return step > 0 ? "i += " + step : "i -= " + (-step);
	}

	private static List<Long> simulate(long start, String op, long bound, long step) {
		List<Long> values = new ArrayList<>();
		for (long v = start; holds(v, op, bound); v += step) {
			values.add(v);
		}
		return values;
	}

	private static boolean holds(long v, String op, long bound) {
		switch (op) {
			case "<":
				return v < bound;
			case "<=":
				return v <= bound;
			case ">":
				return v > bound;
			default:
				return v >= bound;
		}
	}

	private static List<Long> rangeValues(CountedLoop loop) {
		long start = constant(loop.start());
		long end = constant(loop.end());
		List<Long> values = new ArrayList<>();
		for (long v = start; loop.step() > 0 ? v < end : v > end; v += loop.step()) {
			values.add(v);
		}
		return values;
	}

	private static long constant(CppExpr expr) {
		if (expr instanceof CppUnary u && u.op().equals("-")) {
			return -constant(u.operand());
		}
		return intValue(expr);
	}
}
