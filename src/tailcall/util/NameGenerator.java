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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates variable names which are guaranteed not to have been produced
 * before during the current run. A name is formed from a hint (with any
 * trailing digits stripped) followed by the next value of a counter shared by
 * all hints. For example, the first name generated for hint <code>y</code>
 * after a reset is <code>y1</code>. A generator can be narrowed to one which
 * also skips a given set of names (e.g. those already used in a tree), whilst
 * still drawing from the same counter.
 */
public class NameGenerator {
	private final AtomicLong counter;
	private final Set<String> reserved;

	public NameGenerator() {
		this(new AtomicLong(), Collections.emptySet());
	}

	private NameGenerator(AtomicLong counter, Set<String> reserved) {
		this.counter = counter;
		this.reserved = reserved;
	}

	/**
	 * Generate a fresh name based on a given hint.
	 *
	 * @param hint
	 * @return
	 */
	public String fresh(String hint) {
		String base = stripDigits(hint);
		String name;
		do {
			name = base + counter.incrementAndGet();
		} while (reserved.contains(name));
		return name;
	}

	/**
	 * Construct a generator sharing this generator's counter, which never
	 * produces any of the given names. This generator is unaffected.
	 *
	 * @param names
	 * @return
	 */
	public NameGenerator reserving(Collection<String> names) {
		HashSet<String> nreserved = new HashSet<>(reserved);
		nreserved.addAll(names);
		return new NameGenerator(counter, Collections.unmodifiableSet(nreserved));
	}

	/**
	 * Restart the counter shared with every generator narrowed from this one.
	 * This makes consecutive runs produce identical names.
	 */
	public void reset() {
		counter.set(0);
	}

	private static String stripDigits(String hint) {
		int end = hint.length();
		while (end > 0 && Character.isDigit(hint.charAt(end - 1))) {
			end = end - 1;
		}
		// a purely numeric hint would otherwise produce a number
		return end == 0 ? "t" : hint.substring(0, end);
	}
}
