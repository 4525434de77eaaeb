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

import java.util.HashMap;
import java.util.Map;

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.util.AbstractTransformer;
import tailcall.util.EvaluationError;

/**
 * A reference interpreter for expression trees, covering both direct-style
 * trees and the forms introduced by each stage of the compiler. Values are
 * <code>Boolean</code>s, <code>Long</code>s, procedures, suspensions and
 * completion flags. Evaluation is eager and proceeds from left to right.
 * <p>
 * The result of an expression in tail position may be left unfinished. A
 * delivery to a continuation (<code>app-cont</code>) is returned as a pending
 * call, and an entered trampoline as an {@link TrampolineDriver.Activation}.
 * Both are finished only where a value is actually needed (e.g. an operand, or
 * the result handed back to a host procedure). Pending calls are run in a loop,
 * so that long chains of continuations do not consume the stack. Activations
 * produced by a step of a running trampoline are returned to its driver, so
 * that calls between trampolined functions do not nest driver loops.
 */
public class Interpreter extends AbstractTransformer<Interpreter.Environment, Object> {
	private final Map<String, Object> globals = new HashMap<>();
	private final TrampolineDriver driver;

	public Interpreter() {
		this(new TrampolineDriver());
	}

	public Interpreter(TrampolineDriver driver) {
		this.driver = driver;
	}

	/**
	 * Get the driver used for every trampoline encountered by this interpreter.
	 *
	 * @return
	 */
	public TrampolineDriver driver() {
		return driver;
	}

	/**
	 * Bind a global name to a given value (e.g. a host procedure). Globals are
	 * visible everywhere unless shadowed.
	 *
	 * @param name
	 * @param value
	 */
	public void define(String name, Object value) {
		globals.put(name, value);
	}

	/**
	 * Evaluate a closed expression (i.e. one whose free variables are all
	 * defined as globals).
	 *
	 * @param expr
	 * @return
	 */
	public Object evaluate(Expr expr) {
		return value(new Environment(), expr);
	}

	@Override
	public Object apply(Environment env, Expr.Literal expr) {
		return expr.value();
	}

	@Override
	public Object apply(Environment env, Expr.Variable expr) {
		return lookup(env, expr.name());
	}

	@Override
	public Object apply(Environment env, Expr.Conditional expr) {
		Object test = value(env, expr.condition());
		if (!(test instanceof Boolean)) {
			throw new EvaluationError("expected boolean condition, got " + test);
		}
		return apply(env, ((Boolean) test) ? expr.trueBranch() : expr.falseBranch());
	}

	@Override
	public Object apply(Environment env, Expr.PrimitiveApp expr) {
		return expr.operator().apply(values(env, expr.operands()));
	}

	@Override
	public Object apply(Environment env, Expr.Application expr) {
		Object operator = value(env, expr.operator());
		Object[] arguments = values(env, expr.operands());
		return call(procedure(operator), arguments);
	}

	@Override
	public Object apply(Environment env, Expr.Function expr) {
		return new Closure(env, expr);
	}

	@Override
	public Object apply(Environment env, Expr.NamedFunction expr) {
		return new Closure(env, expr);
	}

	@Override
	public Object apply(Environment env, Expr.Cont expr) {
		return new Continuation(env, expr);
	}

	@Override
	public Object apply(Environment env, Expr.AppCont expr) {
		Procedure k = procedure(value(env, expr.continuation()));
		Object argument = value(env, expr.value());
		return new PendingCall(k, argument);
	}

	@Override
	public Object apply(Environment env, Expr.Thunk expr) {
		Expr body = expr.body();
		return (TrampolineDriver.Suspension) () -> unwind(apply(env, body));
	}

	@Override
	public Object apply(Environment env, Expr.Trampoline expr) {
		TrampolineDriver.Flag done = new TrampolineDriver.Flag();
		Procedure helper = procedure(value(env, expr.helper()));
		Object[] arguments = values(env.bind(expr.flag(), done), expr.arguments());
		return new TrampolineDriver.Activation(done, () -> unwind(call(helper, arguments)));
	}

	@Override
	public Object apply(Environment env, Expr.Complete expr) {
		Object flag = lookup(env, expr.flag());
		if (!(flag instanceof TrampolineDriver.Flag)) {
			throw new EvaluationError("expected completion flag, got " + flag);
		}
		((TrampolineDriver.Flag) flag).set();
		return apply(env, expr.body());
	}

	/**
	 * Evaluate an expression whose value is needed, finishing any pending calls
	 * and driving any trampoline entered along the way.
	 *
	 * @param env
	 * @param expr
	 * @return
	 */
	private Object value(Environment env, Expr expr) {
		return finish(apply(env, expr));
	}

	private Object[] values(Environment env, Expr[] exprs) {
		Object[] values = new Object[exprs.length];
		for (int i = 0; i != exprs.length; ++i) {
			values[i] = value(env, exprs[i]);
		}
		return values;
	}

	private Object finish(Object result) {
		result = unwind(result);
		while (result instanceof TrampolineDriver.Activation) {
			result = unwind(driver.drive((TrampolineDriver.Activation) result));
		}
		return result;
	}

	private static Object unwind(Object result) {
		while (result instanceof PendingCall) {
			result = ((PendingCall) result).run();
		}
		return result;
	}

	private static Object call(Procedure p, Object... arguments) {
		if (p instanceof Local) {
			return ((Local) p).call(arguments);
		} else {
			return p.invoke(arguments);
		}
	}

	private Object lookup(Environment env, String name) {
		if (env.contains(name)) {
			return env.get(name);
		} else if (globals.containsKey(name)) {
			return globals.get(name);
		}
		throw new EvaluationError("unbound variable " + name);
	}

	private static Procedure procedure(Object value) {
		if (value instanceof Procedure) {
			return (Procedure) value;
		}
		throw new EvaluationError("expected procedure, got " + value);
	}

	/**
	 * Anything which can be called with a sequence of arguments. Host procedures
	 * defined as globals implement this directly.
	 */
	public interface Procedure {
		public Object invoke(Object... arguments);
	}

	/**
	 * A procedure defined by the program being interpreted. Calling it from
	 * within the interpreter may leave its result unfinished, whilst invoking
	 * it from the host always produces a value.
	 */
	private abstract class Local implements Procedure {
		protected final Environment env;

		public Local(Environment env) {
			this.env = env;
		}

		public abstract Object call(Object... arguments);

		@Override
		public Object invoke(Object... arguments) {
			return finish(call(arguments));
		}
	}

	/**
	 * A function value, capturing the environment in which it was created.
	 */
	private final class Closure extends Local {
		private final Expr.Function function;

		public Closure(Environment env, Expr.Function function) {
			super(env);
			this.function = function;
		}

		@Override
		public Object call(Object... arguments) {
			Clause clause = function.forArity(arguments.length);
			if (clause == null) {
				throw new EvaluationError("no clause accepting " + arguments.length + " argument(s) in " + function);
			}
			String[] formals = clause.formals();
			Environment frame = env;
			if (function instanceof Expr.NamedFunction) {
				// Bind self reference first, so formals can shadow it
				frame = frame.bind(((Expr.NamedFunction) function).name(), this);
			}
			for (int i = 0; i != formals.length; ++i) {
				frame = frame.bind(formals[i], arguments[i]);
			}
			Expr[] body = clause.body();
			for (int i = 0; i < body.length - 1; ++i) {
				value(frame, body[i]);
			}
			return apply(frame, body[body.length - 1]);
		}

		@Override
		public String toString() {
			return "#closure" + function;
		}
	}

	/**
	 * A continuation value, which accepts exactly one argument.
	 */
	private final class Continuation extends Local {
		private final Expr.Cont cont;

		public Continuation(Environment env, Expr.Cont cont) {
			super(env);
			this.cont = cont;
		}

		@Override
		public Object call(Object... arguments) {
			if (arguments.length != 1) {
				throw new EvaluationError("continuation expects one argument, got " + arguments.length);
			}
			return apply(env.bind(cont.parameter(), arguments[0]), cont.body());
		}

		@Override
		public String toString() {
			return "#continuation" + cont;
		}
	}

	/**
	 * The delivery of a value to a continuation, which has yet to be made.
	 */
	private static final class PendingCall {
		private final Procedure target;
		private final Object argument;

		public PendingCall(Procedure target, Object argument) {
			this.target = target;
			this.argument = argument;
		}

		public Object run() {
			return call(target, argument);
		}
	}

	/**
	 * An immutable mapping from local variable names to values. Binding a name
	 * produces an updated environment, leaving the original unchanged.
	 */
	public static final class Environment {
		private final HashMap<String, Object> bindings;

		/**
		 * Construct an initial (empty) environment
		 */
		public Environment() {
			this.bindings = new HashMap<>();
		}

		private Environment(HashMap<String, Object> bindings) {
			this.bindings = bindings;
		}

		public boolean contains(String name) {
			return bindings.containsKey(name);
		}

		public Object get(String name) {
			return bindings.get(name);
		}

		/**
		 * Bind a given name to a given value producing an updated environment. Observe
		 * that the name may already exist, in which case the original binding is simply
		 * lost.
		 *
		 * @param name
		 * @param value
		 * @return
		 */
		public Environment bind(String name, Object value) {
			// Clone the bindings map in order to update it
			HashMap<String, Object> nbindings = new HashMap<>(bindings);
			nbindings.put(name, value);
			return new Environment(nbindings);
		}

		@Override
		public String toString() {
			return bindings.toString();
		}
	}
}
