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

import tailcall.core.Syntax;
import tailcall.core.Syntax.Expr;

/**
 * Dispatches over the closed set of expression forms, providing one method per
 * form. Since every method is abstract, introducing a new form forces every
 * transformer to be updated accordingly.
 *
 * @param <S> The state threaded through the transformation (e.g. a
 *            substitution or an environment)
 * @param <R> The result of transforming an expression
 */
public abstract class AbstractTransformer<S, R> {

	public R apply(S state, Expr expr) {
		if (expr == null) {
			throw new MalformedExpression("missing expression", null);
		} else if (!(expr instanceof Expr.AbstractExpr)) {
			throw new MalformedExpression("unrecognised expression", expr);
		}
		switch (expr.getOpcode()) {
		case Syntax.EXPR_literal:
			return apply(state, (Expr.Literal) expr);
		case Syntax.EXPR_variable:
			return apply(state, (Expr.Variable) expr);
		case Syntax.EXPR_conditional:
			return apply(state, (Expr.Conditional) expr);
		case Syntax.EXPR_primitive:
			return apply(state, (Expr.PrimitiveApp) expr);
		case Syntax.EXPR_application:
			return apply(state, (Expr.Application) expr);
		case Syntax.EXPR_function:
			return apply(state, (Expr.Function) expr);
		case Syntax.EXPR_namedfunction:
			return apply(state, (Expr.NamedFunction) expr);
		case Syntax.EXPR_cont:
			return apply(state, (Expr.Cont) expr);
		case Syntax.EXPR_appcont:
			return apply(state, (Expr.AppCont) expr);
		case Syntax.EXPR_thunk:
			return apply(state, (Expr.Thunk) expr);
		case Syntax.EXPR_trampoline:
			return apply(state, (Expr.Trampoline) expr);
		case Syntax.EXPR_complete:
			return apply(state, (Expr.Complete) expr);
		}
		// Give up
		throw new MalformedExpression("invalid expression encountered", expr);
	}

	public abstract R apply(S state, Expr.Literal expr);

	public abstract R apply(S state, Expr.Variable expr);

	public abstract R apply(S state, Expr.Conditional expr);

	public abstract R apply(S state, Expr.PrimitiveApp expr);

	public abstract R apply(S state, Expr.Application expr);

	public abstract R apply(S state, Expr.Function expr);

	public abstract R apply(S state, Expr.NamedFunction expr);

	public abstract R apply(S state, Expr.Cont expr);

	public abstract R apply(S state, Expr.AppCont expr);

	public abstract R apply(S state, Expr.Thunk expr);

	public abstract R apply(S state, Expr.Trampoline expr);

	public abstract R apply(S state, Expr.Complete expr);
}
