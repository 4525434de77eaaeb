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
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

import tailcall.util.EvaluationError;
import tailcall.util.MalformedExpression;
import tailcall.util.SyntacticElement;

/**
 * The closed grammar of expression trees handled by the compiler. Trees are
 * produced by an external reader in direct style (literals, variables,
 * conditionals, primitive and general applications, functions) and are then
 * rewritten by each stage, which introduces the remaining forms
 * (continuations, thunks and trampolines). All nodes are immutable.
 */
public class Syntax {
	public final static int EXPR_literal = 0;
	public final static int EXPR_variable = 1;
	public final static int EXPR_conditional = 2;
	public final static int EXPR_primitive = 3;
	public final static int EXPR_application = 4;
	public final static int EXPR_function = 5;
	public final static int EXPR_namedfunction = 6;
	public final static int EXPR_cont = 7;
	public final static int EXPR_appcont = 8;
	public final static int EXPR_thunk = 9;
	public final static int EXPR_trampoline = 10;
	public final static int EXPR_complete = 11;

	/**
	 * The fixed set of primitive operators. A primitive is never renamed or
	 * substituted, and each accepts a fixed range of operand counts.
	 */
	public enum Primitive {
		ADD("+", 0, -1) {
			@Override
			public Object apply(Object... args) {
				long r = 0;
				for (Object arg : args) {
					r = r + number(this, arg);
				}
				return r;
			}
		},
		SUB("-", 1, -1) {
			@Override
			public Object apply(Object... args) {
				long r = number(this, args[0]);
				if (args.length == 1) {
					return -r;
				}
				for (int i = 1; i != args.length; ++i) {
					r = r - number(this, args[i]);
				}
				return r;
			}
		},
		MUL("*", 0, -1) {
			@Override
			public Object apply(Object... args) {
				long r = 1;
				for (Object arg : args) {
					r = r * number(this, arg);
				}
				return r;
			}
		},
		DIV("/", 1, -1) {
			@Override
			public Object apply(Object... args) {
				long r = args.length == 1 ? 1 : number(this, args[0]);
				for (int i = args.length == 1 ? 0 : 1; i != args.length; ++i) {
					long d = number(this, args[i]);
					if (d == 0) {
						throw new EvaluationError("division by zero");
					}
					r = r / d;
				}
				return r;
			}
		},
		LT("<", 1, -1) {
			@Override
			public Object apply(Object... args) {
				return chain(this, args, (a, b) -> a < b);
			}
		},
		LTEQ("<=", 1, -1) {
			@Override
			public Object apply(Object... args) {
				return chain(this, args, (a, b) -> a <= b);
			}
		},
		EQ("=", 1, -1) {
			@Override
			public Object apply(Object... args) {
				for (int i = 1; i < args.length; ++i) {
					if (!Objects.equals(args[i - 1], args[i])) {
						return false;
					}
				}
				return true;
			}
		},
		GTEQ(">=", 1, -1) {
			@Override
			public Object apply(Object... args) {
				return chain(this, args, (a, b) -> a >= b);
			}
		},
		GT(">", 1, -1) {
			@Override
			public Object apply(Object... args) {
				return chain(this, args, (a, b) -> a > b);
			}
		},
		ZERO("zero?", 1, 1) {
			@Override
			public Object apply(Object... args) {
				return number(this, args[0]) == 0;
			}
		},
		INC("inc", 1, 1) {
			@Override
			public Object apply(Object... args) {
				return number(this, args[0]) + 1;
			}
		},
		DEC("dec", 1, 1) {
			@Override
			public Object apply(Object... args) {
				return number(this, args[0]) - 1;
			}
		};

		private final String token;
		private final int min;
		private final int max;

		private Primitive(String token, int min, int max) {
			this.token = token;
			this.min = min;
			this.max = max;
		}

		/**
		 * The token used for this operator in concrete syntax.
		 *
		 * @return
		 */
		public String token() {
			return token;
		}

		/**
		 * Check whether this operator can be applied to a given number of operands.
		 *
		 * @param n
		 * @return
		 */
		public boolean accepts(int n) {
			return n >= min && (max < 0 || n <= max);
		}

		/**
		 * Apply this operator to a sequence of fully evaluated operands.
		 *
		 * @param args
		 * @return
		 */
		public abstract Object apply(Object... args);

		/**
		 * Look up the primitive operator with a given token.
		 *
		 * @param token
		 * @return
		 */
		public static Primitive fromToken(String token) {
			for (Primitive p : values()) {
				if (p.token.equals(token)) {
					return p;
				}
			}
			throw new MalformedExpression("unknown primitive operator \"" + token + "\"", null);
		}

		private static long number(Primitive p, Object arg) {
			if (arg instanceof Long) {
				return (Long) arg;
			}
			throw new EvaluationError(p.token + " expects a number, got " + arg);
		}

		private static boolean chain(Primitive p, Object[] args, BiPredicate<Long, Long> test) {
			for (int i = 1; i < args.length; ++i) {
				if (!test.test(number(p, args[i - 1]), number(p, args[i]))) {
					return false;
				}
			}
			// still check types for the single operand case
			number(p, args[0]);
			return true;
		}

		@Override
		public String toString() {
			return token;
		}
	}

	public interface Expr extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this expression.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Apply a given function to every immediate child of this expression, and
		 * reconstruct an expression of the same form from the results. Names, operator
		 * kinds and attributes are left unchanged.
		 *
		 * @param fn
		 * @return
		 */
		public Expr walk(UnaryOperator<Expr> fn);

		/**
		 * An abstract expression to be implemented by all other expressions.
		 */
		public static abstract class AbstractExpr extends SyntacticElement.Impl implements Expr {
			private final int opcode;

			AbstractExpr(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * Represents a boolean or integer constant, such as <code>true</code> or
		 * <code>123</code>.
		 */
		public class Literal extends AbstractExpr {
			private final Object value;

			public Literal(boolean value, Attribute... attributes) {
				super(EXPR_literal, attributes);
				this.value = value;
			}

			public Literal(long value, Attribute... attributes) {
				super(EXPR_literal, attributes);
				this.value = value;
			}

			/**
			 * Return the constant, which is either a <code>Boolean</code> or a
			 * <code>Long</code>.
			 *
			 * @return
			 */
			public Object value() {
				return value;
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return this;
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Literal && ((Literal) o).value.equals(value);
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		public class Variable extends AbstractExpr {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(EXPR_variable, attributes);
				this.name = identifier(name, "variable name");
			}

			public String name() {
				return name;
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return this;
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Represents a conditional such as the following:
		 *
		 * <pre>
		 * (if (zero? x) 1 x)
		 * </pre>
		 */
		public class Conditional extends AbstractExpr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			public Conditional(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
				super(EXPR_conditional, attributes);
				this.condition = required(condition, "condition");
				this.trueBranch = required(trueBranch, "true branch");
				this.falseBranch = required(falseBranch, "false branch");
			}

			public Expr condition() {
				return condition;
			}

			public Expr trueBranch() {
				return trueBranch;
			}

			public Expr falseBranch() {
				return falseBranch;
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return new Conditional(fn.apply(condition), fn.apply(trueBranch), fn.apply(falseBranch),
						attributes());
			}

			@Override
			public int hashCode() {
				return Objects.hash(condition, trueBranch, falseBranch);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Conditional) {
					Conditional c = (Conditional) o;
					return condition.equals(c.condition) && trueBranch.equals(c.trueBranch)
							&& falseBranch.equals(c.falseBranch);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(if " + condition + " " + trueBranch + " " + falseBranch + ")";
			}
		}

		/**
		 * Represents the application of a primitive operator, such as
		 * <code>(+ x 1)</code> or <code>(zero? n)</code>.
		 */
		public class PrimitiveApp extends AbstractExpr {
			private final Primitive operator;
			private final Expr[] operands;

			public PrimitiveApp(Primitive operator, Expr[] operands, Attribute... attributes) {
				super(EXPR_primitive, attributes);
				this.operator = required(operator, "primitive operator");
				this.operands = requiredAll(operands, "operand").clone();
				if (!operator.accepts(this.operands.length)) {
					throw new MalformedExpression(
							"primitive " + operator + " cannot accept " + this.operands.length + " operand(s)", this);
				}
			}

			public Primitive operator() {
				return operator;
			}

			public Expr[] operands() {
				return operands.clone();
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return new PrimitiveApp(operator, map(operands, fn), attributes());
			}

			@Override
			public int hashCode() {
				return operator.hashCode() ^ Arrays.hashCode(operands);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof PrimitiveApp) {
					PrimitiveApp p = (PrimitiveApp) o;
					return operator == p.operator && Arrays.equals(operands, p.operands);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(" + operator + render(operands) + ")";
			}
		}

		/**
		 * Represents a general call, such as <code>(f x 1)</code>.
		 */
		public class Application extends AbstractExpr {
			private final Expr operator;
			private final Expr[] operands;

			public Application(Expr operator, Expr[] operands, Attribute... attributes) {
				super(EXPR_application, attributes);
				this.operator = required(operator, "operator");
				this.operands = requiredAll(operands, "operand").clone();
			}

			public Expr operator() {
				return operator;
			}

			public Expr[] operands() {
				return operands.clone();
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return new Application(fn.apply(operator), map(operands, fn), attributes());
			}

			@Override
			public int hashCode() {
				return operator.hashCode() ^ Arrays.hashCode(operands);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Application) {
					Application a = (Application) o;
					return operator.equals(a.operator) && Arrays.equals(operands, a.operands);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(" + operator + render(operands) + ")";
			}
		}

		/**
		 * Represents an anonymous function such as <code>(fn [x y] (+ x y))</code>.
		 * A function has one or more clauses, each with its own formal parameters
		 * and body, such as <code>(fn ([x] x) ([x y] (+ x y)))</code>. No two clauses
		 * accept the same number of arguments.
		 */
		public class Function extends AbstractExpr {
			private final Clause[] clauses;

			public Function(String[] formals, Expr[] body, Attribute... attributes) {
				this(new Clause[] { new Clause(formals, body, attributes) }, attributes);
			}

			public Function(Clause[] clauses, Attribute... attributes) {
				this(EXPR_function, clauses, attributes);
			}

			Function(int opcode, Clause[] clauses, Attribute... attributes) {
				super(opcode, attributes);
				this.clauses = requiredAll(clauses, "clause").clone();
				if (this.clauses.length == 0) {
					throw new MalformedExpression("function requires a clause", this);
				}
				HashSet<Integer> arities = new HashSet<>();
				for (Clause c : this.clauses) {
					if (!arities.add(c.arity())) {
						throw new MalformedExpression("duplicate clause of arity " + c.arity(), this);
					}
				}
			}

			public Clause[] clauses() {
				return clauses.clone();
			}

			public int size() {
				return clauses.length;
			}

			public Clause clause(int i) {
				return clauses[i];
			}

			/**
			 * Find the clause accepting a given number of arguments, or
			 * <code>null</code> if there is none.
			 *
			 * @param arity
			 * @return
			 */
			public Clause forArity(int arity) {
				for (Clause c : clauses) {
					if (c.arity() == arity) {
						return c;
					}
				}
				return null;
			}

			/**
			 * Construct a function of the same kind as this one (i.e. keeping any name)
			 * with different clauses.
			 *
			 * @param clauses
			 * @return
			 */
			public Function with(Clause[] clauses) {
				return new Function(clauses, attributes());
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				Clause[] nclauses = new Clause[clauses.length];
				for (int i = 0; i != clauses.length; ++i) {
					nclauses[i] = clauses[i].walk(fn);
				}
				return with(nclauses);
			}

			@Override
			public int hashCode() {
				return Arrays.hashCode(clauses);
			}

			@Override
			public boolean equals(Object o) {
				if (o != null && o.getClass() == getClass()) {
					return Arrays.equals(clauses, ((Function) o).clauses);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(fn " + renderClauses() + ")";
			}

			String renderClauses() {
				if (clauses.length == 1) {
					return clauses[0].toString();
				}
				String r = "";
				for (int i = 0; i != clauses.length; ++i) {
					r += (i == 0 ? "(" : " (") + clauses[i] + ")";
				}
				return r;
			}
		}

		/**
		 * Represents a function with a name, such as
		 * <code>(fn fact [n] (if (zero? n) 1 (* n (fact (dec n)))))</code>. The name
		 * is bound within the bodies of every clause, thus permitting recursive
		 * calls.
		 */
		public class NamedFunction extends Function {
			private final String name;

			public NamedFunction(String name, String[] formals, Expr[] body, Attribute... attributes) {
				this(name, new Clause[] { new Clause(formals, body, attributes) }, attributes);
			}

			public NamedFunction(String name, Clause[] clauses, Attribute... attributes) {
				super(EXPR_namedfunction, clauses, attributes);
				this.name = identifier(name, "function name");
			}

			public String name() {
				return name;
			}

			@Override
			public NamedFunction with(Clause[] clauses) {
				return new NamedFunction(name, clauses, attributes());
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ super.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return super.equals(o) && ((NamedFunction) o).name.equals(name);
			}

			@Override
			public String toString() {
				return "(fn " + name + " " + renderClauses() + ")";
			}
		}

		/**
		 * Represents a continuation value, such as <code>(cont [v] (k (+ v 1)))</code>.
		 * The single parameter names the value delivered to the continuation.
		 */
		public class Cont extends AbstractExpr {
			private final String parameter;
			private final Expr body;

			public Cont(String parameter, Expr body, Attribute... attributes) {
				super(EXPR_cont, attributes);
				this.parameter = identifier(parameter, "continuation parameter");
				this.body = required(body, "continuation body");
			}

			public String parameter() {
				return parameter;
			}

			public Expr body() {
				return body;
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return new Cont(parameter, fn.apply(body), attributes());
			}

			@Override
			public int hashCode() {
				return parameter.hashCode() ^ body.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Cont) {
					Cont c = (Cont) o;
					return parameter.equals(c.parameter) && body.equals(c.body);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(cont [" + parameter + "] " + body + ")";
			}
		}

		/**
		 * Represents the delivery of a computed value to a continuation, such as
		 * <code>(app-cont k x)</code>.
		 */
		public class AppCont extends AbstractExpr {
			private final Expr continuation;
			private final Expr value;

			public AppCont(Expr continuation, Expr value, Attribute... attributes) {
				super(EXPR_appcont, attributes);
				this.continuation = required(continuation, "continuation");
				this.value = required(value, "continuation argument");
			}

			public Expr continuation() {
				return continuation;
			}

			public Expr value() {
				return value;
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return new AppCont(fn.apply(continuation), fn.apply(value), attributes());
			}

			@Override
			public int hashCode() {
				return continuation.hashCode() ^ value.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof AppCont) {
					AppCont a = (AppCont) o;
					return continuation.equals(a.continuation) && value.equals(a.value);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(app-cont " + continuation + " " + value + ")";
			}
		}

		/**
		 * Represents a zero-argument deferred computation. Evaluating a thunk does
		 * not evaluate its body; that happens only when the resulting suspension is
		 * resumed.
		 */
		public class Thunk extends AbstractExpr {
			private final Expr body;

			public Thunk(Expr body, Attribute... attributes) {
				super(EXPR_thunk, attributes);
				this.body = required(body, "thunk body");
			}

			public Expr body() {
				return body;
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return new Thunk(fn.apply(body), attributes());
			}

			@Override
			public int hashCode() {
				return 31 * body.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Thunk && ((Thunk) o).body.equals(body);
			}

			@Override
			public String toString() {
				return "(thunk " + body + ")";
			}
		}

		/**
		 * Installs a trampoline: a fresh completion flag is bound, the helper is
		 * invoked once with the given arguments (which may refer to the flag) and the
		 * result is driven until the flag is set.
		 */
		public class Trampoline extends AbstractExpr {
			private final String flag;
			private final NamedFunction helper;
			private final Expr[] arguments;

			public Trampoline(String flag, NamedFunction helper, Expr[] arguments, Attribute... attributes) {
				super(EXPR_trampoline, attributes);
				this.flag = identifier(flag, "completion flag");
				this.helper = required(helper, "trampoline helper");
				this.arguments = requiredAll(arguments, "trampoline argument").clone();
			}

			public String flag() {
				return flag;
			}

			public NamedFunction helper() {
				return helper;
			}

			public Expr[] arguments() {
				return arguments.clone();
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				Expr h = fn.apply(helper);
				if (!(h instanceof NamedFunction)) {
					throw new MalformedExpression("trampoline helper must be a named function", h);
				}
				return new Trampoline(flag, (NamedFunction) h, map(arguments, fn), attributes());
			}

			@Override
			public int hashCode() {
				return flag.hashCode() ^ helper.hashCode() ^ Arrays.hashCode(arguments);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Trampoline) {
					Trampoline t = (Trampoline) o;
					return flag.equals(t.flag) && helper.equals(t.helper) && Arrays.equals(arguments, t.arguments);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(trampoline " + flag + " " + helper + render(arguments) + ")";
			}
		}

		/**
		 * Sets the completion flag of the enclosing trampoline, and then evaluates
		 * its body.
		 */
		public class Complete extends AbstractExpr {
			private final String flag;
			private final Expr body;

			public Complete(String flag, Expr body, Attribute... attributes) {
				super(EXPR_complete, attributes);
				this.flag = identifier(flag, "completion flag");
				this.body = required(body, "body");
			}

			public String flag() {
				return flag;
			}

			public Expr body() {
				return body;
			}

			@Override
			public Expr walk(UnaryOperator<Expr> fn) {
				return new Complete(flag, fn.apply(body), attributes());
			}

			@Override
			public int hashCode() {
				return flag.hashCode() ^ body.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Complete) {
					Complete c = (Complete) o;
					return flag.equals(c.flag) && body.equals(c.body);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(complete " + flag + " " + body + ")";
			}
		}
	}

	/**
	 * One clause of a function: pairwise distinct formal parameters, and a
	 * non-empty body whose last expression produces the value. Once a function
	 * has been converted into continuation-passing style, the trailing formal of
	 * each clause binds its continuation.
	 */
	public static final class Clause extends SyntacticElement.Impl {
		private final String[] formals;
		private final Expr[] body;

		public Clause(String[] formals, Expr[] body, Attribute... attributes) {
			super(attributes);
			this.formals = requiredAll(formals, "formal parameter").clone();
			this.body = requiredAll(body, "body expression").clone();
			if (this.body.length == 0) {
				throw new MalformedExpression("function requires a body", this);
			} else if (new HashSet<>(Arrays.asList(this.formals)).size() != this.formals.length) {
				throw new MalformedExpression("duplicate formal parameter", this);
			}
			for (String formal : this.formals) {
				identifier(formal, "formal parameter");
			}
		}

		public String[] formals() {
			return formals.clone();
		}

		public Expr[] body() {
			return body.clone();
		}

		public int arity() {
			return formals.length;
		}

		public boolean binds(String name) {
			return Arrays.asList(formals).contains(name);
		}

		/**
		 * Get the trailing formal parameter, which binds the continuation of a
		 * clause in continuation-passing style.
		 *
		 * @return
		 */
		public String continuation() {
			if (formals.length == 0) {
				throw new MalformedExpression("function has no continuation parameter", this);
			}
			return formals[formals.length - 1];
		}

		public Clause with(String[] formals, Expr[] body) {
			return new Clause(formals, body, attributes());
		}

		public Clause walk(UnaryOperator<Expr> fn) {
			return new Clause(formals, map(body, fn), attributes());
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(formals) ^ Arrays.hashCode(body);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Clause) {
				Clause c = (Clause) o;
				return Arrays.equals(formals, c.formals) && Arrays.equals(body, c.body);
			}
			return false;
		}

		@Override
		public String toString() {
			return "[" + String.join(" ", formals) + "]" + render(body);
		}
	}

	private static Expr[] map(Expr[] items, UnaryOperator<Expr> fn) {
		Expr[] nitems = new Expr[items.length];
		for (int i = 0; i != items.length; ++i) {
			nitems[i] = fn.apply(items[i]);
		}
		return nitems;
	}

	private static String render(Expr[] items) {
		String r = "";
		for (int i = 0; i != items.length; ++i) {
			r += " " + items[i];
		}
		return r;
	}

	private static <T> T required(T item, String what) {
		if (item == null) {
			throw new MalformedExpression("missing " + what, null);
		}
		return item;
	}

	private static <T> T[] requiredAll(T[] items, String what) {
		if (items == null) {
			throw new MalformedExpression("missing " + what + "s", null);
		}
		for (T item : items) {
			required(item, what);
		}
		return items;
	}

	private static String identifier(String name, String what) {
		if (name == null || name.isEmpty()) {
			throw new MalformedExpression("missing " + what, null);
		}
		return name;
	}
}
