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
package tailcall.util;

import tailcall.core.Syntax.Expr;

/**
 * A transformer from expressions to expressions which, by default, simply
 * rebuilds each node from its transformed children. A stage then overrides
 * only those forms which it treats specially.
 *
 * @param <S>
 */
public abstract class AbstractRewriter<S> extends AbstractTransformer<S, Expr> {

	/**
	 * Rewrite every expression in a sequence.
	 *
	 * @param state
	 * @param exprs
	 * @return
	 */
	public Expr[] apply(S state, Expr[] exprs) {
		Expr[] nexprs = new Expr[exprs.length];
		for (int i = 0; i != exprs.length; ++i) {
			nexprs[i] = apply(state, exprs[i]);
		}
		return nexprs;
	}

	@Override
	public Expr apply(S state, Expr.Literal expr) {
		return expr;
	}

	@Override
	public Expr apply(S state, Expr.Variable expr) {
		return expr;
	}

	@Override
	public Expr apply(S state, Expr.Conditional expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.PrimitiveApp expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.Application expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.Function expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.NamedFunction expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.Cont expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.AppCont expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.Thunk expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.Trampoline expr) {
		return walk(state, expr);
	}

	@Override
	public Expr apply(S state, Expr.Complete expr) {
		return walk(state, expr);
	}

	protected Expr walk(S state, Expr expr) {
		return expr.walk(e -> apply(state, e));
	}
}
