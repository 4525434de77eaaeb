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
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.util.AbstractTransformer;

/**
 * Computes the set of variables occurring free in an expression. A binder
 * (formal parameter, function name, continuation parameter or completion flag)
 * removes its name from the free variables of the expressions in its scope,
 * regardless of whether the same name also occurs free elsewhere.
 */
public class FreeVariables extends AbstractTransformer<Void, Set<String>> {
	private static final FreeVariables INSTANCE = new FreeVariables();

	/**
	 * Determine the free variables of a given expression.
	 *
	 * @param expr
	 * @return
	 */
	public static Set<String> of(Expr expr) {
		return INSTANCE.apply(null, expr);
	}

	/**
	 * Determine the free variables of a sequence of expressions.
	 *
	 * @param exprs
	 * @return
	 */
	public static Set<String> of(Expr... exprs) {
		return INSTANCE.union(exprs);
	}

	@Override
	public Set<String> apply(Void state, Expr.Literal expr) {
		return new HashSet<>();
	}

	@Override
	public Set<String> apply(Void state, Expr.Variable expr) {
		return new HashSet<>(Collections.singleton(expr.name()));
	}

	@Override
	public Set<String> apply(Void state, Expr.Conditional expr) {
		return union(expr.condition(), expr.trueBranch(), expr.falseBranch());
	}

	@Override
	public Set<String> apply(Void state, Expr.PrimitiveApp expr) {
		// NOTE: operator tokens are not variables
		return union(expr.operands());
	}

	@Override
	public Set<String> apply(Void state, Expr.Application expr) {
		Set<String> r = apply(state, expr.operator());
		r.addAll(union(expr.operands()));
		return r;
	}

	@Override
	public Set<String> apply(Void state, Expr.Function expr) {
		HashSet<String> r = new HashSet<>();
		for (Clause c : expr.clauses()) {
			Set<String> free = union(c.body());
			free.removeAll(Arrays.asList(c.formals()));
			r.addAll(free);
		}
		return r;
	}

	@Override
	public Set<String> apply(Void state, Expr.NamedFunction expr) {
		Set<String> r = apply(state, (Expr.Function) expr);
		r.remove(expr.name());
		return r;
	}

	@Override
	public Set<String> apply(Void state, Expr.Cont expr) {
		Set<String> r = apply(state, expr.body());
		r.remove(expr.parameter());
		return r;
	}

	@Override
	public Set<String> apply(Void state, Expr.AppCont expr) {
		return union(expr.continuation(), expr.value());
	}

	@Override
	public Set<String> apply(Void state, Expr.Thunk expr) {
		return apply(state, expr.body());
	}

	@Override
	public Set<String> apply(Void state, Expr.Trampoline expr) {
		Set<String> r = union(expr.arguments());
		r.remove(expr.flag());
		r.addAll(apply(state, expr.helper()));
		return r;
	}

	@Override
	public Set<String> apply(Void state, Expr.Complete expr) {
		Set<String> r = apply(state, expr.body());
		r.add(expr.flag());
		return r;
	}

	private Set<String> union(Expr... exprs) {
		HashSet<String> r = new HashSet<>();
		for (Expr e : exprs) {
			r.addAll(apply(null, e));
		}
		return r;
	}
}
