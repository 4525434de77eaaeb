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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import tailcall.core.FreeVariables;

/**
 * Tests for computing the free variables of an expression.
 */
public class FreeVariableTests {

	@Test
	public void test_0x001() {
		check("1");
		check("true");
		check("x", "x");
	}

	@Test
	public void test_0x002() {
		check("(if (zero? x) y (f z))", "x", "y", "f", "z");
		check("(+ x (* y 2))", "x", "y");
		check("(f f)", "f");
	}

	@Test
	public void test_0x003() {
		check("(fn [x] (+ x y))", "y");
		check("(fn [x y] (+ x y))");
		// A binder removes its name, even if it also occurs free elsewhere
		check("(f x (fn [x] x))", "f", "x");
	}

	@Test
	public void test_0x004() {
		check("(fn fact [n] (if (zero? n) 1 (* n (fact (dec n)))))");
		check("(fn f [x] (g x))", "g");
		check("(fn f [f] f)");
	}

	@Test
	public void test_0x005() {
		check("(cont [v] (app-cont k v))", "k");
		check("(thunk (f x k))", "f", "x", "k");
	}

	@Test
	public void test_0x006() {
		// The flag is bound in the arguments, but not in the helper
		check("(trampoline d (fn g [x k] (thunk (g x k))) x (cont [v] (complete d (app-cont k v))))", "x", "k");
		check("(trampoline d (fn g [k] (thunk (app-cont k d))) (cont [v] v))", "d");
		check("(complete d 1)", "d");
	}

	@Test
	public void test_0x007() {
		// Free variables of a sequence of expressions
		assertEquals(new HashSet<>(Arrays.asList("x", "y")), FreeVariables.of(Trees.readAll("x (fn [z] y) 1")));
	}

	@Test
	public void test_0x008() {
		// Formals of one clause are not bound in another
		check("(fn ([x] (+ x y)) ([x z] (+ x z w)))", "y", "w");
		check("(fn ([a] (+ a b)) ([b c] (+ a b c)))", "a", "b");
		check("(fn f ([x] (f x)) ([x f] (f x g)))", "g");
	}

	private static void check(String input, String... expected) {
		Set<String> actual = FreeVariables.of(Trees.read(input));
		assertEquals(new HashSet<>(Arrays.asList(expected)), actual);
	}
}
