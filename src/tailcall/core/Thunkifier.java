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

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.util.AbstractRewriter;
import tailcall.util.MalformedExpression;

/**
 * Defers the work of every function in a CPS tree. The body of each function
 * is wrapped in a <code>thunk</code>, so that applying the function returns
 * "the next step" of the computation rather than performing it. For example:
 *
 * <pre>
 * (fn f [x k1] (if (zero? x) (app-cont k1 x) (f (dec x) k1)))
 * ==>
 * (fn f [x k1] (thunk (if (zero? x) (app-cont k1 x) (f (dec x) k1))))
 * </pre>
 *
 * Each clause of a function is deferred separately. The trailing continuation
 * argument of a call is never deferred, although the body of a
 * <code>cont</code> passed there is still rewritten.
 */
public class Thunkifier extends AbstractRewriter<Void> {

	public Expr apply(Expr expr) {
		return apply(null, expr);
	}

	@Override
	public Expr apply(Void state, Expr.Function expr) {
		return expr.with(thunkify(expr));
	}

	@Override
	public Expr apply(Void state, Expr.NamedFunction expr) {
		return expr.with(thunkify(expr));
	}

	@Override
	public Expr apply(Void state, Expr.Application expr) {
		Expr[] operands = expr.operands();
		Expr[] noperands = new Expr[operands.length];
		int last = operands.length - 1;
		for (int i = 0; i < last; ++i) {
			noperands[i] = apply(state, operands[i]);
		}
		if (last >= 0) {
			Expr k = operands[last];
			if (k instanceof Expr.Cont) {
				Expr.Cont c = (Expr.Cont) k;
				k = new Expr.Cont(c.parameter(), apply(state, c.body()), c.attributes());
			}
			noperands[last] = k;
		}
		return new Expr.Application(apply(state, expr.operator()), noperands, expr.attributes());
	}

	private Clause[] thunkify(Expr.Function expr) {
		Clause[] clauses = expr.clauses();
		for (int i = 0; i != clauses.length; ++i) {
			Expr[] body = clauses[i].body();
			if (body.length != 1) {
				throw new MalformedExpression("function body not in continuation-passing style", clauses[i]);
			}
			Expr thunk = new Expr.Thunk(apply(null, body[0]), body[0].attributes());
			clauses[i] = clauses[i].with(clauses[i].formals(), new Expr[] { thunk });
		}
		return clauses;
	}
}
