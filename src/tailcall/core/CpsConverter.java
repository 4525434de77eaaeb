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
import java.util.Collection;
import java.util.Set;

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.util.AbstractTransformer;
import tailcall.util.MalformedExpression;
import tailcall.util.NameGenerator;

/**
 * Converts direct-style expressions into continuation-passing style. An
 * expression is <i>trivial</i> if it can be evaluated without invoking a
 * continuation (literals, variables, functions and primitive operations over
 * trivial operands), and <i>serious</i> otherwise (conditionals and calls).
 * Trivial conversion leaves the shape of an expression alone, except that
 * every function gains a trailing continuation parameter. Serious conversion,
 * implemented by this transformer, takes the continuation as its state and
 * produces an expression which delivers its result to that continuation. For
 * example:
 *
 * <pre>
 * (fn f [x] (if (zero? x) x (f (dec x))))
 * ==>
 * (fn f [x k1] (if (zero? x) (k1 x) (f (dec x) k1)))
 * </pre>
 *
 * Serious operands are evaluated first, from left to right, with a
 * continuation (<code>cont</code>) whose parameter stands for their value in
 * the remainder of the computation. A conditional whose continuation is such
 * a <code>cont</code> first binds it to a variable, which both branches then
 * share:
 *
 * <pre>
 * (fn [a] (+ (if a 1 2) 3))
 * ==>
 * (fn [a k1] ((cont [k3] (if a (k3 1) (k3 2))) (cont [v2] (k1 (+ v2 3)))))
 * </pre>
 */
public class CpsConverter extends AbstractTransformer<Expr, Expr> {
	private final NameGenerator names;

	public CpsConverter(NameGenerator names) {
		this.names = names;
	}

	/**
	 * Convert a trivial expression (e.g. a function definition).
	 *
	 * @param expr
	 * @return
	 */
	public Expr convert(Expr expr) {
		if (!isTrivial(expr)) {
			throw new MalformedExpression("expression requires a continuation", expr);
		}
		return trivial(expr);
	}

	/**
	 * Convert an expression so that it delivers its result to a given
	 * continuation.
	 *
	 * @param expr
	 * @param k
	 * @return
	 */
	public Expr convert(Expr expr, Expr k) {
		return apply(k, expr);
	}

	/**
	 * Determine whether an expression can be evaluated without invoking a
	 * continuation.
	 *
	 * @param expr
	 * @return
	 */
	public static boolean isTrivial(Expr expr) {
		switch (expr.getOpcode()) {
		case Syntax.EXPR_literal:
		case Syntax.EXPR_variable:
		case Syntax.EXPR_function:
		case Syntax.EXPR_namedfunction:
			return true;
		case Syntax.EXPR_primitive:
			for (Expr operand : ((Expr.PrimitiveApp) expr).operands()) {
				if (!isTrivial(operand)) {
					return false;
				}
			}
			return true;
		default:
			return false;
		}
	}

	@Override
	public Expr apply(Expr k, Expr.Literal expr) {
		return deliver(k, expr);
	}

	@Override
	public Expr apply(Expr k, Expr.Variable expr) {
		return deliver(k, expr);
	}

	@Override
	public Expr apply(Expr k, Expr.Conditional expr) {
		if (!(k instanceof Expr.Variable)) {
			// Bind the continuation once, rather than copying it into both branches
			Set<String> avoid = FreeVariables.of(expr);
			avoid.addAll(FreeVariables.of(k));
			String j = fresh("k", avoid);
			Expr body = apply(new Expr.Variable(j), expr);
			return new Expr.Application(new Expr.Cont(j, body), new Expr[] { k });
		}
		return bind(expr, k, new Expr[] { expr.condition() },
				ts -> new Expr.Conditional(ts[0], apply(k, expr.trueBranch()), apply(k, expr.falseBranch()),
						expr.attributes()));
	}

	@Override
	public Expr apply(Expr k, Expr.PrimitiveApp expr) {
		return bind(expr, k, expr.operands(),
				ts -> deliver(k, new Expr.PrimitiveApp(expr.operator(), ts, expr.attributes())));
	}

	@Override
	public Expr apply(Expr k, Expr.Application expr) {
		Expr[] operands = expr.operands();
		Expr[] items = new Expr[operands.length + 1];
		items[0] = expr.operator();
		System.arraycopy(operands, 0, items, 1, operands.length);
		return bind(expr, k, items, ts -> {
			Expr[] arguments = Arrays.copyOfRange(ts, 1, ts.length + 1);
			// Pass the continuation as the final argument
			arguments[arguments.length - 1] = k;
			return new Expr.Application(ts[0], arguments, expr.attributes());
		});
	}

	@Override
	public Expr apply(Expr k, Expr.Function expr) {
		return deliver(k, trivial(expr));
	}

	@Override
	public Expr apply(Expr k, Expr.NamedFunction expr) {
		return deliver(k, trivial(expr));
	}

	@Override
	public Expr apply(Expr k, Expr.Cont expr) {
		throw new MalformedExpression("expression not in direct style", expr);
	}

	@Override
	public Expr apply(Expr k, Expr.AppCont expr) {
		throw new MalformedExpression("expression not in direct style", expr);
	}

	@Override
	public Expr apply(Expr k, Expr.Thunk expr) {
		throw new MalformedExpression("expression not in direct style", expr);
	}

	@Override
	public Expr apply(Expr k, Expr.Trampoline expr) {
		throw new MalformedExpression("expression not in direct style", expr);
	}

	@Override
	public Expr apply(Expr k, Expr.Complete expr) {
		throw new MalformedExpression("expression not in direct style", expr);
	}

	/**
	 * Trivial conversion, which is only defined for trivial expressions.
	 *
	 * @param expr
	 * @return
	 */
	private Expr trivial(Expr expr) {
		switch (expr.getOpcode()) {
		case Syntax.EXPR_literal:
		case Syntax.EXPR_variable:
			return expr;
		case Syntax.EXPR_primitive: {
			Expr.PrimitiveApp p = (Expr.PrimitiveApp) expr;
			Expr[] operands = p.operands();
			Expr[] noperands = new Expr[operands.length];
			for (int i = 0; i != operands.length; ++i) {
				noperands[i] = trivial(operands[i]);
			}
			return new Expr.PrimitiveApp(p.operator(), noperands, p.attributes());
		}
		case Syntax.EXPR_function:
		case Syntax.EXPR_namedfunction: {
			Expr.Function f = (Expr.Function) expr;
			String self = f instanceof Expr.NamedFunction ? ((Expr.NamedFunction) f).name() : null;
			Clause[] clauses = f.clauses();
			for (int i = 0; i != clauses.length; ++i) {
				clauses[i] = trivial(clauses[i], self);
			}
			return f.with(clauses);
		}
		default:
			throw new MalformedExpression("expression requires a continuation", expr);
		}
	}

	/**
	 * Convert one clause of a function, which gains its own continuation
	 * parameter.
	 *
	 * @param clause
	 * @param self
	 *            The name of the enclosing function, or <code>null</code>.
	 * @return
	 */
	private Clause trivial(Clause clause, String self) {
		String[] formals = clause.formals();
		Set<String> avoid = FreeVariables.of(clause.body());
		avoid.addAll(Arrays.asList(formals));
		if (self != null) {
			avoid.add(self);
		}
		String k = fresh("k", avoid);
		String[] nformals = Arrays.copyOf(formals, formals.length + 1);
		nformals[formals.length] = k;
		return clause.with(nformals, new Expr[] { body(clause.body(), new Expr.Variable(k)) });
	}

	/**
	 * Convert the body of a function into a single expression delivering its
	 * value to a given continuation. Any non-final expressions are evaluated for
	 * their effect only.
	 *
	 * @param body
	 * @param k
	 * @return
	 */
	private Expr body(Expr[] body, Expr k) {
		Expr r = apply(k, body[body.length - 1]);
		for (int i = body.length - 2; i >= 0; --i) {
			// NOTE: trivial expressions have no effect and are dropped
			if (!isTrivial(body[i])) {
				String ignored = fresh("_", FreeVariables.of(r));
				r = apply(new Expr.Cont(ignored, r), body[i]);
			}
		}
		return r;
	}

	/**
	 * Bind the values of a sequence of sub-expressions before constructing the
	 * expression which uses them. Trivial sub-expressions are converted in place,
	 * whilst each serious sub-expression is replaced by a fresh variable and
	 * evaluated beforehand with a continuation binding that variable.
	 *
	 * @param expr  The expression being converted
	 * @param k     The continuation of the expression being converted
	 * @param items The sub-expressions to bind, in evaluation order
	 * @param build Constructs the final expression from the bound sub-expressions
	 * @return
	 */
	private Expr bind(Expr expr, Expr k, Expr[] items, Builder build) {
		Set<String> avoid = FreeVariables.of(expr);
		avoid.addAll(FreeVariables.of(k));
		Expr[] ts = new Expr[items.length];
		String[] vs = new String[items.length];
		for (int i = 0; i != items.length; ++i) {
			if (isTrivial(items[i])) {
				ts[i] = trivial(items[i]);
			} else {
				vs[i] = fresh("v", avoid);
				ts[i] = new Expr.Variable(vs[i]);
			}
		}
		Expr r = build.build(ts);
		for (int i = items.length - 1; i >= 0; --i) {
			if (vs[i] != null) {
				r = apply(new Expr.Cont(vs[i], r), items[i]);
			}
		}
		return r;
	}

	private String fresh(String hint, Collection<String> avoid) {
		String name = names.fresh(hint);
		while (avoid.contains(name)) {
			name = names.fresh(hint);
		}
		return name;
	}

	private static Expr deliver(Expr k, Expr value) {
		return new Expr.Application(k, new Expr[] { value });
	}

	private interface Builder {
		Expr build(Expr[] operands);
	}
}
