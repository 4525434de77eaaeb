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

import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tailcall.util.EvaluationError;

/**
 * The runtime loop of a trampoline. Starting from the value produced by the
 * first invocation of a trampolined function, the driver repeatedly resumes
 * the current suspension until the completion flag of that activation is set.
 * The driver is either <i>running</i> (the flag is clear and the current value
 * is a suspension) or <i>done</i> (the flag is set, and the current value is
 * the final result). Since each step returns to the loop before the next one
 * begins, the stack depth is bounded regardless of the depth of recursion.
 * A step may also produce the {@link Activation} of another trampoline (e.g.
 * for a tail call between mutually recursive functions). The running driver
 * simply resumes it, rather than a second loop being started within the
 * current step.
 */
public class TrampolineDriver {
	private static final Logger LOGGER = LoggerFactory.getLogger(TrampolineDriver.class);

	/**
	 * Counts every suspension resumed by this driver.
	 */
	private final AtomicLong invocations = new AtomicLong();

	/**
	 * Drive a computation to completion.
	 *
	 * @param initial
	 *            The value produced by the first invocation of the trampolined
	 *            function.
	 * @param done
	 *            The completion flag owned by this activation.
	 * @return The final value.
	 */
	public Object drive(Object initial, Flag done) {
		Object value = initial;
		long steps = 0;
		while (!done.isSet()) {
			if (!(value instanceof Suspension)) {
				throw new EvaluationError("trampoline stalled on " + value + " before completion");
			}
			value = ((Suspension) value).resume();
			invocations.incrementAndGet();
			steps = steps + 1;
		}
		LOGGER.debug("trampoline completed after {} step(s) with {}", steps, value);
		return value;
	}

	/**
	 * Drive an activation which is not part of any running trampoline.
	 *
	 * @param activation
	 * @return The final value.
	 */
	public Object drive(Activation activation) {
		return drive(activation.resume(), activation.flag());
	}

	/**
	 * Get the total number of suspensions resumed since this driver was created
	 * or last reset.
	 *
	 * @return
	 */
	public long getInvocations() {
		return invocations.get();
	}

	public void reset() {
		invocations.set(0);
	}

	/**
	 * A deferred computation standing in for the next step.
	 */
	public interface Suspension {
		/**
		 * Perform the next step, producing either another suspension or (once the
		 * completion flag has been set) the final value.
		 *
		 * @return
		 */
		public Object resume();
	}

	/**
	 * A trampoline which has been entered but not yet started. Resuming it
	 * performs the first invocation of its helper.
	 */
	public static final class Activation implements Suspension {
		private final Flag flag;
		private final Suspension first;

		public Activation(Flag flag, Suspension first) {
			this.flag = flag;
			this.first = first;
		}

		public Flag flag() {
			return flag;
		}

		@Override
		public Object resume() {
			return first.resume();
		}

		@Override
		public String toString() {
			return "#activation(" + flag + ")";
		}
	}

	/**
	 * The completion flag of a single trampoline activation. Once set, a flag is
	 * never cleared.
	 */
	public static final class Flag {
		private volatile boolean set;

		public void set() {
			this.set = true;
		}

		public boolean isSet() {
			return set;
		}

		@Override
		public String toString() {
			return set ? "done" : "running";
		}
	}
}
