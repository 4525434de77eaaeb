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
import tailcall.util.MalformedExpression;
import tailcall.util.NameGenerator;

/**
 * Installs a trampoline around every function of a thunkified tree. The real
 * body of a function is lifted into a helper, and the function itself becomes
 * a wrapper which invokes the helper once and then drives the result until
 * its own completion flag is set. For example:
 *
 * <pre>
 * (fn f [x k1] (thunk (if (zero? x) (app-cont k1 x) (f (dec x) k1))))
 * ==>
 * (fn f [x k1]
 *   (trampoline done3 (fn f2 [x k1] (thunk (if (zero? x) (app-cont k1 x) (f2 (dec x) k1))))
 *     x (cont [v4] (complete done3 (app-cont k1 v4)))))
 * </pre>
 *
 * The helper receives a continuation which sets the flag just before the
 * original continuation is given the final value. Recursive calls (i.e. calls
 * to the function's own name) within the helper are redirected to the helper
 * itself, so they continue within the running trampoline rather than
 * installing another one. Other uses of the name (e.g. passing the function
 * as a value) still refer to the wrapper. Nested functions are processed
 * first. Every clause of a function with several clauses gets a trampoline
 * of its own, although they share a single helper.
 */
public class Trampoliner extends AbstractRewriter<Void> {
	private final NameGenerator names;

	public Trampoliner(NameGenerator names) {
		this.names = names;
	}

	public Expr apply(Expr expr) {
		return apply(null, expr);
	}

	@Override
	public Expr apply(Void state, Expr.Function expr) {
		Expr.Function f = (Expr.Function) walk(state, expr);
		return install(f, null);
	}

	@Override
	public Expr apply(Void state, Expr.NamedFunction expr) {
		Expr.NamedFunction f = (Expr.NamedFunction) walk(state, expr);
		return install(f, f.name());
	}

	/**
	 * Replace the body of each clause of a function with a trampoline driving a
	 * helper which holds the original clauses. Every clause shares the same
	 * helper, so that a recursive call may continue in any clause of it.
	 *
	 * @param f
	 *            A function whose nested functions have already been processed.
	 * @param self
	 *            The name of the function, or <code>null</code> if anonymous.
	 * @return
	 */
	private Expr install(Expr.Function f, String self) {
		Clause[] clauses = f.clauses();
		Set<String> avoid = new HashSet<>();
		for (Clause c : clauses) {
			Expr[] body = c.body();
			if (body.length != 1 || !(body[0] instanceof Expr.Thunk)) {
				throw new MalformedExpression("function body not thunkified", c);
			}
			avoid.addAll(FreeVariables.of(body));
			avoid.addAll(Arrays.asList(c.formals()));
		}
		if (self != null) {
			avoid.add(self);
		}
		String name = fresh(self == null ? "fn" : self, avoid);
		Clause[] lifted = new Clause[clauses.length];
		for (int i = 0; i != clauses.length; ++i) {
			Clause c = clauses[i];
			// Formals named after the function shadow its self reference
			if (self != null && !c.binds(self)) {
				c = c.with(c.formals(), new SelfCallRenamer(self, name).apply(null, c.body()));
			}
			lifted[i] = c;
		}
		Expr.NamedFunction helper = new Expr.NamedFunction(name, lifted, f.attributes());
		Clause[] wrappers = new Clause[clauses.length];
		for (int i = 0; i != clauses.length; ++i) {
			wrappers[i] = install(clauses[i], helper, avoid);
		}
		return f.with(wrappers);
	}

	private Clause install(Clause clause, Expr.NamedFunction helper, Set<String> avoid) {
		String[] formals = clause.formals();
		String done = fresh("done", avoid);
		String v = fresh("v", avoid);
		// Arguments for the first invocation of the helper
		Expr[] arguments = new Expr[formals.length];
		for (int i = 0; i < formals.length - 1; ++i) {
			arguments[i] = new Expr.Variable(formals[i]);
		}
		Expr k = new Expr.Variable(clause.continuation());
		Expr finish = new Expr.Complete(done, new Expr.AppCont(k, new Expr.Variable(v)));
		arguments[formals.length - 1] = new Expr.Cont(v, finish);
		Expr trampoline = new Expr.Trampoline(done, helper, arguments, clause.attributes());
		return clause.with(formals, new Expr[] { trampoline });
	}

	private String fresh(String hint, Set<String> avoid) {
		String name = names.fresh(hint);
		while (avoid.contains(name)) {
			name = names.fresh(hint);
		}
		avoid.add(name);
		return name;
	}

	/**
	 * Redirects calls to a function from within its own body. Only variables in
	 * call position are affected, and only where they are not shadowed by an
	 * inner binder.
	 */
	private static final class SelfCallRenamer extends AbstractRewriter<Void> {
		private final String from;
		private final String to;

		public SelfCallRenamer(String from, String to) {
			this.from = from;
			this.to = to;
		}

		@Override
		public Expr apply(Void state, Expr.Application expr) {
			Expr operator = expr.operator();
			if (operator instanceof Expr.Variable && ((Expr.Variable) operator).name().equals(from)) {
				operator = new Expr.Variable(to, operator.attributes());
			} else {
				operator = apply(state, operator);
			}
			return new Expr.Application(operator, apply(state, expr.operands()), expr.attributes());
		}

		@Override
		public Expr apply(Void state, Expr.Function expr) {
			return expr.with(rename(expr.clauses()));
		}

		@Override
		public Expr apply(Void state, Expr.NamedFunction expr) {
			return expr.name().equals(from) ? expr : expr.with(rename(expr.clauses()));
		}

		@Override
		public Expr apply(Void state, Expr.Cont expr) {
			return expr.parameter().equals(from) ? expr : walk(state, expr);
		}

		@Override
		public Expr apply(Void state, Expr.Trampoline expr) {
			if (expr.flag().equals(from)) {
				// Flag shadows the name within the arguments only
				Expr.NamedFunction helper = (Expr.NamedFunction) apply(state, expr.helper());
				return new Expr.Trampoline(expr.flag(), helper, expr.arguments(), expr.attributes());
			}
			return walk(state, expr);
		}

		private Clause[] rename(Clause[] clauses) {
			for (int i = 0; i != clauses.length; ++i) {
				Clause c = clauses[i];
				if (!c.binds(from)) {
					clauses[i] = c.with(c.formals(), apply(null, c.body()));
				}
			}
			return clauses;
		}
	}
}
