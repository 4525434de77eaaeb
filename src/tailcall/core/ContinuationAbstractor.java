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
package tailcall.core;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.util.AbstractRewriter;

/**
 * Makes the continuations threaded through a CPS tree explicit. The trailing
 * formal parameter of every function binds a continuation and, within its
 * scope, a call to that continuation with a single argument is rewritten as an
 * <code>app-cont</code>. Likewise, a direct call to a <code>cont</code> value
 * is rewritten as an <code>app-cont</code>. For example:
 *
 * <pre>
 * (fn f [x k1] (if (zero? x) (k1 x) (f (dec x) k1)))
 * ==>
 * (fn f [x k1] (if (zero? x) (app-cont k1 x) (f (dec x) k1)))
 * </pre>
 *
 * Calls which merely forward a continuation (as their last argument) are left
 * in place. A <code>cont</code> applied to a continuation binds its parameter
 * to that continuation, so calls to the parameter are rewritten too. The state
 * of this rewriter is the set of continuation variables currently in scope.
 */
public class ContinuationAbstractor extends AbstractRewriter<Set<String>> {

	/**
	 * Abstract the continuations of a CPS tree which has no free continuation
	 * variables.
	 *
	 * @param expr
	 * @return
	 */
	public Expr apply(Expr expr) {
		return apply(new HashSet<>(), expr);
	}

	/**
	 * Abstract the continuations of a CPS tree, where the given free variables
	 * are known to be continuations (e.g. the top-level continuation of a
	 * program).
	 *
	 * @param expr
	 * @param continuations
	 * @return
	 */
	public Expr apply(Expr expr, String... continuations) {
		return apply(new HashSet<>(Arrays.asList(continuations)), expr);
	}

	@Override
	public Expr apply(Set<String> ks, Expr.Application expr) {
		Expr operator = expr.operator();
		Expr[] operands = expr.operands();
		if (operands.length != 1 || !isContinuation(ks, operator)) {
			return walk(ks, expr);
		} else if (operator instanceof Expr.Cont && isContinuation(ks, operands[0])) {
			// A continuation bound to a name, whose calls are continuation calls
			Expr.Cont c = (Expr.Cont) operator;
			Set<String> inner = new HashSet<>(ks);
			inner.add(c.parameter());
			Expr body = apply(inner, c.body());
			operator = new Expr.Cont(c.parameter(), body, c.attributes());
			return new Expr.AppCont(operator, apply(ks, operands[0]), expr.attributes());
		} else {
			return new Expr.AppCont(apply(ks, operator), apply(ks, operands[0]), expr.attributes());
		}
	}

	@Override
	public Expr apply(Set<String> ks, Expr.Function expr) {
		return expr.with(enter(ks, expr, null));
	}

	@Override
	public Expr apply(Set<String> ks, Expr.NamedFunction expr) {
		return expr.with(enter(ks, expr, expr.name()));
	}

	@Override
	public Expr apply(Set<String> ks, Expr.Cont expr) {
		if (ks.contains(expr.parameter())) {
			ks = new HashSet<>(ks);
			ks.remove(expr.parameter());
		}
		return walk(ks, expr);
	}

	/**
	 * Rewrite the clauses of a function. Within a clause, formals and the
	 * function's own name shadow outer continuations, except for the trailing
	 * formal which is itself a continuation.
	 *
	 * @param ks
	 * @param expr
	 * @param self
	 * @return
	 */
	private Clause[] enter(Set<String> ks, Expr.Function expr, String self) {
		Clause[] clauses = expr.clauses();
		for (int i = 0; i != clauses.length; ++i) {
			Clause c = clauses[i];
			Set<String> inner = new HashSet<>(ks);
			inner.remove(self);
			inner.removeAll(Arrays.asList(c.formals()));
			inner.add(c.continuation());
			clauses[i] = c.with(c.formals(), apply(inner, c.body()));
		}
		return clauses;
	}

	private static boolean isContinuation(Set<String> ks, Expr operator) {
		if (operator instanceof Expr.Variable) {
			return ks.contains(((Expr.Variable) operator).name());
		} else {
			return operator instanceof Expr.Cont;
		}
	}
}
