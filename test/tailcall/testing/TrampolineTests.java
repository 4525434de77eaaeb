// This file is part of the TailCall Compiler (tcc).
//
// The TailCall Compiler is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The TailCall Compiler is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the TailCall Compiler. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2026, the TailCall Compiler authors.
package tailcall.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import tailcall.core.Interpreter;
import tailcall.core.Interpreter.Procedure;
import tailcall.core.Pipeline;
import tailcall.core.TrampolineDriver;
import tailcall.core.TrampolineDriver.Activation;
import tailcall.core.TrampolineDriver.Flag;
import tailcall.core.TrampolineDriver.Suspension;
import tailcall.core.Trampoliner;
import tailcall.core.Syntax.Expr;
import tailcall.util.EvaluationError;
import tailcall.util.MalformedExpression;
import tailcall.util.NameGenerator;

/**
 * Tests for installing trampolines, and for driving them at runtime.
 */
public class TrampolineTests {
	private static final String COUNT_DOWN = "(fn count-down [x] (if (zero? x) x (count-down (dec x))))";

	private final NameGenerator names = new NameGenerator();
	private final Trampoliner trampoliner = new Trampoliner(names);

	@BeforeEach
	public void reset() {
		names.reset();
	}

	// ==============================================================
	// Static Rewrite
	// ==============================================================

	@Test
	public void test_0x001() {
		check("(fn count-down [x k1] (thunk (if (zero? x) (app-cont k1 x) (count-down (dec x) k1))))",
				"(fn count-down [x k1] (trampoline done2 (fn count-down1 [x k1] (thunk (if (zero? x) (app-cont k1 x) (count-down1 (dec x) k1)))) x (cont [v3] (complete done2 (app-cont k1 v3)))))");
	}

	@Test
	public void test_0x002() {
		check("(fn [x k] (thunk (app-cont k (+ x 1))))",
				"(fn [x k] (trampoline done2 (fn fn1 [x k] (thunk (app-cont k (+ x 1)))) x (cont [v3] (complete done2 (app-cont k v3)))))");
	}

	@Test
	public void test_0x003() {
		// Only calls are redirected to the helper
		check("(fn f [x k] (thunk (g f (cont [v] (f v k)))))",
				"(fn f [x k] (trampoline done2 (fn f1 [x k] (thunk (g f (cont [v] (f1 v k))))) x (cont [v3] (complete done2 (app-cont k v3)))))");
	}

	@Test
	public void test_0x004() {
		// Inner binders shadow the function's name
		Expr r = trampoliner.apply(Trees.read("(fn f [x k] (thunk ((fn [f j] (thunk (f x j))) (fn [y j] (thunk (app-cont j y))) k)))"));
		String s = r.toString();
		assertTrue(s.contains("(f x j)"), s);
		assertFalse(s.contains("(f7 x j)"), s);
		assertTrue(s.startsWith("(fn f [x k] (trampoline done8 (fn f7 [x k]"), s);
	}

	@Test
	public void test_0x005() {
		// Fresh names avoid variables already in use
		check("(fn [k] (thunk (app-cont k fn1)))",
				"(fn [k] (trampoline done3 (fn fn2 [k] (thunk (app-cont k fn1))) (cont [v4] (complete done3 (app-cont k v4)))))");
	}

	@Test
	public void test_0x007() {
		// Each clause has its own trampoline, sharing one helper
		check("(fn f ([x k1] (thunk (f x 0 k1))) ([x y k2] (thunk (app-cont k2 (+ x y)))))",
				"(fn f ([x k1] (trampoline done2 (fn f1 ([x k1] (thunk (f1 x 0 k1))) ([x y k2] (thunk (app-cont k2 (+ x y))))) x (cont [v3] (complete done2 (app-cont k1 v3)))))"
						+ " ([x y k2] (trampoline done4 (fn f1 ([x k1] (thunk (f1 x 0 k1))) ([x y k2] (thunk (app-cont k2 (+ x y))))) x y (cont [v5] (complete done4 (app-cont k2 v5))))))");
	}

	@Test
	public void test_0x006() {
		assertThrows(MalformedExpression.class, () -> trampoliner.apply(Trees.read("(fn [x k] (app-cont k x))")));
		assertThrows(MalformedExpression.class, () -> trampoliner.apply(Trees.read("(fn [] (thunk 1))")));
	}

	// ==============================================================
	// Driver
	// ==============================================================

	@Test
	public void test_0x010() {
		TrampolineDriver driver = new TrampolineDriver();
		Flag done = new Flag();
		Object r = driver.drive(countDown(3, done), done);
		assertEquals("finished", r);
		assertEquals(4, driver.getInvocations());
		driver.reset();
		assertEquals(0, driver.getInvocations());
	}

	@Test
	public void test_0x011() {
		// Completed before the first step
		TrampolineDriver driver = new TrampolineDriver();
		Flag done = new Flag();
		done.set();
		assertEquals(1L, driver.drive(1L, done));
		assertEquals(0, driver.getInvocations());
	}

	@Test
	public void test_0x012() {
		// A final value without completion is an error
		TrampolineDriver driver = new TrampolineDriver();
		Flag done = new Flag();
		Suspension s = () -> 1L;
		assertThrows(EvaluationError.class, () -> driver.drive(s, done));
	}

	@Test
	public void test_0x013() {
		// An activation produced by a step is resumed by the running driver
		TrampolineDriver driver = new TrampolineDriver();
		Flag done = new Flag();
		Flag inner = new Flag();
		Suspension s = () -> new Activation(inner, () -> {
			done.set();
			return "finished";
		});
		assertEquals("finished", driver.drive(s, done));
		assertEquals(2, driver.getInvocations());
		assertFalse(inner.isSet());
	}

	@Test
	public void test_0x014() {
		TrampolineDriver driver = new TrampolineDriver();
		Flag done = new Flag();
		assertEquals("finished", driver.drive(new Activation(done, countDown(2, done))));
		assertEquals(2, driver.getInvocations());
	}

	// ==============================================================
	// Trampolined Programs
	// ==============================================================

	@Test
	public void test_0x020() {
		// Five recursive steps plus the base case
		Interpreter interpreter = new Interpreter();
		Procedure f = compile(interpreter, COUNT_DOWN);
		AtomicReference<Object> recorded = new AtomicReference<>();
		Object r = f.invoke(5L, recorder(recorded));
		assertEquals(6, interpreter.driver().getInvocations());
		assertEquals(0L, recorded.get());
		assertEquals(0L, r);
	}

	@Test
	public void test_0x021() {
		// Deep recursion without exhausting the stack
		Interpreter interpreter = new Interpreter();
		Procedure f = compile(interpreter, COUNT_DOWN);
		AtomicReference<Object> recorded = new AtomicReference<>();
		f.invoke(100000L, recorder(recorded));
		assertEquals(100001, interpreter.driver().getInvocations());
		assertEquals(0L, recorded.get());
	}

	@Test
	public void test_0x022() {
		Interpreter interpreter = new Interpreter();
		Procedure f = compile(interpreter, "(fn sum [n acc] (if (zero? n) acc (sum (dec n) (+ n acc))))");
		assertEquals(5000050000L, f.invoke(100000L, 0L, identity()));
	}

	@Test
	public void test_0x023() {
		// Non-tail recursion
		Interpreter interpreter = new Interpreter();
		Procedure fib = compile(interpreter, "(fn fib [n] (if (< n 2) n (+ (fib (- n 1)) (fib (- n 2)))))");
		Procedure fact = compile(interpreter, "(fn fact [n] (if (zero? n) 1 (* n (fact (dec n)))))");
		assertEquals(55L, fib.invoke(10L, identity()));
		assertEquals(3628800L, fact.invoke(10L, identity()));
	}

	@Test
	public void test_0x024() {
		// Mutual recursion between separately trampolined functions
		Interpreter interpreter = new Interpreter();
		interpreter.define("even?", compile(interpreter, "(fn even? [n] (if (zero? n) true (odd? (dec n))))"));
		interpreter.define("odd?", compile(interpreter, "(fn odd? [n] (if (zero? n) false (even? (dec n))))"));
		Procedure even = (Procedure) interpreter.evaluate(Trees.read("even?"));
		assertEquals(true, even.invoke(10L, identity()));
		assertEquals(false, even.invoke(7L, identity()));
	}

	@Test
	public void test_0x027() {
		// Deep mutual recursion without exhausting the stack
		Interpreter interpreter = new Interpreter();
		interpreter.define("even?", compile(interpreter, "(fn even? [n] (if (zero? n) true (odd? (dec n))))"));
		interpreter.define("odd?", compile(interpreter, "(fn odd? [n] (if (zero? n) false (even? (dec n))))"));
		Procedure even = (Procedure) interpreter.evaluate(Trees.read("even?"));
		assertEquals(true, even.invoke(100000L, identity()));
		assertEquals(false, even.invoke(100001L, identity()));
	}

	@Test
	public void test_0x028() {
		// Deep non-tail recursion without exhausting the stack
		Interpreter interpreter = new Interpreter();
		Procedure sum = compile(interpreter, "(fn sum [n] (if (zero? n) 0 (+ n (sum (dec n)))))");
		assertEquals(5000050000L, sum.invoke(100000L, identity()));
	}

	@Test
	public void test_0x029() {
		// Clauses of one function dispatch on the number of arguments
		Interpreter interpreter = new Interpreter();
		Procedure sum = compile(interpreter,
				"(fn sum ([n] (sum n 0)) ([n acc] (if (zero? n) acc (sum (dec n) (+ n acc)))))");
		assertEquals(5000050000L, sum.invoke(100000L, identity()));
		assertEquals(15L, sum.invoke(5L, 0L, identity()));
	}

	@Test
	public void test_0x025() {
		// Re-entrant activations own separate flags
		Interpreter interpreter = new Interpreter();
		Procedure f = compile(interpreter, COUNT_DOWN);
		AtomicReference<Object> recorded = new AtomicReference<>();
		Procedure again = args -> f.invoke(3L, recorder(recorded));
		assertEquals(0L, f.invoke(5L, again));
		assertEquals(0L, recorded.get());
		assertEquals(10, interpreter.driver().getInvocations());
	}

	@Test
	public void test_0x026() throws Exception {
		// Concurrent activations own separate flags
		Interpreter interpreter = new Interpreter();
		Procedure f = compile(interpreter, "(fn sum [n acc] (if (zero? n) acc (sum (dec n) (+ n acc))))");
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<Object>> results = new ArrayList<>();
			for (long i = 1; i <= 8; ++i) {
				long n = i * 1000;
				results.add(executor.submit(() -> f.invoke(n, 0L, identity())));
			}
			for (int i = 0; i != results.size(); ++i) {
				long n = (i + 1) * 1000L;
				assertEquals(n * (n + 1) / 2, results.get(i).get());
			}
		} finally {
			executor.shutdown();
		}
		assertEquals(36008, interpreter.driver().getInvocations());
	}

	private void check(String input, String output) {
		assertEquals(Trees.read(output), trampoliner.apply(Trees.read(input)));
	}

	private Procedure compile(Interpreter interpreter, String input) {
		Expr e = new Pipeline(names).apply(Trees.read(input));
		return (Procedure) interpreter.evaluate(e);
	}

	private static Procedure identity() {
		return args -> args[0];
	}

	private static Procedure recorder(AtomicReference<Object> recorded) {
		return args -> {
			recorded.set(args[0]);
			return args[0];
		};
	}

	/**
	 * Construct a chain of suspensions which sets the flag on its final step.
	 *
	 * @param n
	 * @param done
	 * @return
	 */
	private static Suspension countDown(int n, Flag done) {
		return () -> {
			if (n == 0) {
				done.set();
				return "finished";
			}
			return countDown(n - 1, done);
		};
	}
}
