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

import tailcall.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when an expression tree does not match the shape
 * expected by the grammar, or by the stage being applied to it. It is fatal:
 * the transform is aborted and no partial tree is produced.
 */
public class MalformedExpression extends RuntimeException {
	public static final long serialVersionUID = 1l;

	private final String msg;
	private final SyntacticElement element;

	/**
	 * Identify a malformed expression.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param element
	 *            The offending subtree, or <code>null</code> if the required
	 *            sub-form was missing altogether.
	 */
	public MalformedExpression(String msg, SyntacticElement element) {
		this.msg = msg;
		this.element = element;
	}

	@Override
	public String getMessage() {
		String m = msg == null ? "" : msg;
		if (element == null) {
			return m;
		}
		Attribute.Source source = element.attribute(Attribute.Source.class);
		if (source != null) {
			return m + " " + source + ": " + element;
		} else {
			return m + ": " + element;
		}
	}

	/**
	 * Error message
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * The offending subtree.
	 *
	 * @return
	 */
	public SyntacticElement element() {
		return element;
	}

	/**
	 * Get index of first character of offending location, or <code>-1</code> if
	 * the element carries no source span.
	 *
	 * @return
	 */
	public int start() {
		Attribute.Source source = element == null ? null : element.attribute(Attribute.Source.class);
		return source == null ? -1 : source.start;
	}

	/**
	 * Get index of last character of offending location, or <code>-1</code> if the
	 * element carries no source span.
	 *
	 * @return
	 */
	public int end() {
		Attribute.Source source = element == null ? null : element.attribute(Attribute.Source.class);
		return source == null ? -1 : source.end;
	}
}
