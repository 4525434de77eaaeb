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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Set;

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.util.AbstractRewriter;
import tailcall.util.NameGenerator;

/**
 * Capture-avoiding substitution of one variable name for another. Only free
 * occurrences of the old name are replaced. Whenever the new name would be
 * captured by a binder in scope, that binder is first renamed throughout its
 * scope to a fresh name, and only then is the substitution applied. For
 * example, renaming <code>x</code> to <code>y</code> in
 * <code>(fn [y] (+ x y))</code> gives <code>(fn [y1] (+ y y1))</code>.
 */
public class AlphaRenamer extends AbstractRewriter<AlphaRenamer.Substitution> {
	private static final String[] NONE = new String[0];

	private final NameGenerator names;

	public AlphaRenamer(NameGenerator names) {
		this.names = names;
	}

	/**
	 * Replace every free occurrence of <code>from</code> in a given expression
	 * with <code>to</code>.
	 *
	 * @param expr
	 * @param from
	 * @param to
	 * @return
	 */
	public Expr rename(Expr expr, String from, String to) {
		return apply(new Substitution(from, to), expr);
	}

	/**
	 * Replace every free occurrence of <code>from</code> in a sequence of
	 * expressions with <code>to</code>.
	 *
	 * @param exprs
	 * @param from
	 * @param to
	 * @return
	 */
	public Expr[] rename(Expr[] exprs, String from, String to) {
		return apply(new Substitution(from, to), exprs);
	}

	@Override
	public Expr apply(Substitution s, Expr.Variable expr) {
		if (expr.name().equals(s.from)) {
			return new Expr.Variable(s.to, expr.attributes());
		} else {
			return expr;
		}
	}

	@Override
	public Expr apply(Substitution s, Expr.Function expr) {
		return expr.with(rename(s, expr.clauses()));
	}

	@Override
	public Expr apply(Substitution s, Expr.NamedFunction expr) {
		if (expr.name().equals(s.from)) {
			// Self reference shadows the outer binding
			return expr;
		}
		Clause[] clauses = expr.clauses();
		if (expr.name().equals(s.to)) {
			// Rename self reference out of the way first
			String alt = fresh(expr.name(), formals(clauses), bodies(clauses));
			clauses = rename(new Substitution(expr.name(), alt), clauses);
			expr = new Expr.NamedFunction(alt, clauses, expr.attributes());
		}
		return expr.with(rename(s, clauses));
	}

	@Override
	public Expr apply(Substitution s, Expr.Cont expr) {
		if (expr.parameter().equals(s.from)) {
			return expr;
		} else if (expr.parameter().equals(s.to)) {
			String alt = fresh(expr.parameter(), NONE, expr.body());
			Expr body = rename(expr.body(), expr.parameter(), alt);
			return new Expr.Cont(alt, apply(s, body), expr.attributes());
		} else {
			return new Expr.Cont(expr.parameter(), apply(s, expr.body()), expr.attributes());
		}
	}

	@Override
	public Expr apply(Substitution s, Expr.Trampoline expr) {
		Expr helper = apply(s, expr.helper());
		String flag = expr.flag();
		Expr[] arguments = expr.arguments();
		if (flag.equals(s.from)) {
			// Arguments refer to the flag, not the outer binding
			return new Expr.Trampoline(flag, (Expr.NamedFunction) helper, arguments, expr.attributes());
		} else if (flag.equals(s.to)) {
			String alt = fresh(flag, NONE, arguments);
			arguments = rename(arguments, flag, alt);
			flag = alt;
		}
		return new Expr.Trampoline(flag, (Expr.NamedFunction) helper, apply(s, arguments), expr.attributes());
	}

	@Override
	public Expr apply(Substitution s, Expr.Complete expr) {
		String flag = expr.flag().equals(s.from) ? s.to : expr.flag();
		return new Expr.Complete(flag, apply(s, expr.body()), expr.attributes());
	}

	private Clause[] rename(Substitution s, Clause[] clauses) {
		Clause[] nclauses = new Clause[clauses.length];
		for (int i = 0; i != clauses.length; ++i) {
			nclauses[i] = rename(s, clauses[i]);
		}
		return nclauses;
	}

	/**
	 * Apply a substitution to one clause of a function, taking care of its formal
	 * parameters. If the old name is a formal then it is shadowed and the clause
	 * is returned unchanged. If the new name is a formal, then that formal is
	 * renamed to a fresh name <i>before</i> the substitution is applied to the
	 * body. Otherwise, the substitution is applied to the body.
	 *
	 * @param s
	 * @param clause
	 * @return
	 */
	private Clause rename(Substitution s, Clause clause) {
		String[] formals = clause.formals();
		Expr[] body = clause.body();
		if (indexOf(formals, s.from) >= 0) {
			return clause;
		}
		int i = indexOf(formals, s.to);
		if (i >= 0) {
			String alt = fresh(formals[i], formals, body);
			body = rename(body, formals[i], alt);
			assert !FreeVariables.of(body).contains(s.to) : "capture hazard: " + s.to;
			formals[i] = alt;
		}
		return clause.with(formals, apply(s, body));
	}

	/**
	 * Generate a fresh name for a binder whose scope is given. The name must
	 * differ from the binders declared alongside it.
	 *
	 * @param hint
	 * @param siblings
	 * @param scope
	 * @return
	 */
	private String fresh(String hint, String[] siblings, Expr... scope) {
		Set<String> free = FreeVariables.of(scope);
		String alt = names.fresh(hint);
		// A binder which is already free in its scope would capture it
		while (free.contains(alt) || indexOf(siblings, alt) >= 0) {
			alt = names.fresh(hint);
		}
		return alt;
	}

	private static String[] formals(Clause[] clauses) {
		ArrayList<String> formals = new ArrayList<>();
		for (Clause c : clauses) {
			formals.addAll(Arrays.asList(c.formals()));
		}
		return formals.toArray(new String[formals.size()]);
	}

	private static Expr[] bodies(Clause[] clauses) {
		ArrayList<Expr> body = new ArrayList<>();
		for (Clause c : clauses) {
			body.addAll(Arrays.asList(c.body()));
		}
		return body.toArray(new Expr[body.size()]);
	}

	private static int indexOf(String[] names, String name) {
		for (int i = 0; i != names.length; ++i) {
			if (names[i].equals(name)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * A single renaming of one variable to another.
	 */
	public static final class Substitution {
		private final String from;
		private final String to;

		public Substitution(String from, String to) {
			this.from = from;
			this.to = to;
		}

		@Override
		public String toString() {
			return from + " -> " + to;
		}
	}
}
