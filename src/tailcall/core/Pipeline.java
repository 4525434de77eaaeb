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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.util.AbstractTransformer;
import tailcall.util.NameGenerator;

/**
 * Runs the stages of the compiler in order over a direct-style tree. No name
 * generated during a run clashes with any name occurring in its input. Such
 * names are only reserved for the duration of that run.
 */
public class Pipeline {
	private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

	/**
	 * The stages of the pipeline, in order of application.
	 */
	public enum Stage {
		CPS, ABSTRACT_K, THUNKIFY, TRAMPOLINE
	}

	private final NameGenerator names;
	private final ContinuationAbstractor abstractor;
	private final Thunkifier thunkifier;

	public Pipeline(NameGenerator names) {
		this.names = names;
		this.abstractor = new ContinuationAbstractor();
		this.thunkifier = new Thunkifier();
	}

	/**
	 * Compile a trivial expression (e.g. a function definition) through every
	 * stage.
	 *
	 * @param expr
	 * @return
	 */
	public Expr apply(Expr expr) {
		return apply(expr, Stage.TRAMPOLINE);
	}

	/**
	 * Compile a trivial expression (e.g. a function definition) up to and
	 * including a given stage.
	 *
	 * @param expr
	 * @param last
	 * @return
	 */
	public Expr apply(Expr expr, Stage last) {
		NameGenerator run = names.reserving(NameCollector.of(expr));
		Expr r = new CpsConverter(run).convert(expr);
		return remaining(run, r, last);
	}

	/**
	 * Compile a whole program, whose result is delivered to a top-level
	 * continuation variable, up to and including a given stage.
	 *
	 * @param expr
	 * @param k
	 *            Name of the top-level continuation.
	 * @param last
	 * @return
	 */
	public Expr apply(Expr expr, String k, Stage last) {
		Set<String> used = NameCollector.of(expr);
		used.add(k);
		NameGenerator run = names.reserving(used);
		Expr r = new CpsConverter(run).convert(expr, new Expr.Variable(k));
		return remaining(run, r, last, k);
	}

	private Expr remaining(NameGenerator run, Expr r, Stage last, String... continuations) {
		LOGGER.debug("{}: {}", Stage.CPS, r);
		if (last == Stage.CPS) {
			return r;
		}
		r = abstractor.apply(r, continuations);
		LOGGER.debug("{}: {}", Stage.ABSTRACT_K, r);
		if (last == Stage.ABSTRACT_K) {
			return r;
		}
		r = thunkifier.apply(r);
		LOGGER.debug("{}: {}", Stage.THUNKIFY, r);
		if (last == Stage.THUNKIFY) {
			return r;
		}
		r = new Trampoliner(run).apply(r);
		LOGGER.debug("{}: {}", Stage.TRAMPOLINE, r);
		return r;
	}

	/**
	 * Collects every name occurring in a tree, whether bound or free.
	 */
	private static final class NameCollector extends AbstractTransformer<Set<String>, Void> {

		public static Set<String> of(Expr expr) {
			HashSet<String> r = new HashSet<>();
			new NameCollector().apply(r, expr);
			return r;
		}

		@Override
		public Void apply(Set<String> names, Expr.Literal expr) {
			return null;
		}

		@Override
		public Void apply(Set<String> names, Expr.Variable expr) {
			names.add(expr.name());
			return null;
		}

		@Override
		public Void apply(Set<String> names, Expr.Conditional expr) {
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.PrimitiveApp expr) {
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.Application expr) {
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.Function expr) {
			for (Clause c : expr.clauses()) {
				names.addAll(Arrays.asList(c.formals()));
			}
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.NamedFunction expr) {
			names.add(expr.name());
			return apply(names, (Expr.Function) expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.Cont expr) {
			names.add(expr.parameter());
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.AppCont expr) {
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.Thunk expr) {
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.Trampoline expr) {
			names.add(expr.flag());
			return children(names, expr);
		}

		@Override
		public Void apply(Set<String> names, Expr.Complete expr) {
			names.add(expr.flag());
			return children(names, expr);
		}

		private Void children(Set<String> names, Expr expr) {
			// Walk purely for effect, discarding the rebuilt tree
			expr.walk(e -> {
				apply(names, e);
				return e;
			});
			return null;
		}
	}
}
