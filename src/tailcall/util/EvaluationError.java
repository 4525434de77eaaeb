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

/**
 * Thrown when a tree fails during evaluation, for example when calling
 * something which is not a procedure or when a trampoline is handed a value
 * which is neither final nor resumable.
 */
public class EvaluationError extends RuntimeException {
	public static final long serialVersionUID = 1l;

	public EvaluationError(String msg) {
		super(msg);
	}

	public EvaluationError(String msg, Throwable cause) {
		super(msg, cause);
	}
}
