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
package tailcall.testing;

import java.util.ArrayList;
import java.util.List;

import tailcall.core.Syntax.Clause;
import tailcall.core.Syntax.Expr;
import tailcall.core.Syntax.Primitive;
import tailcall.util.SyntacticElement.Attribute;

/**
 * Reads expression trees from the s-expression notation used when rendering
 * them, which keeps test inputs short. For example:
 *
 * <pre>
 * (fn count-down [x] (if (zero? x) x (count-down (dec x))))
 * (fn add ([x] (add x 1)) ([x y] (+ x y)))
 * </pre>
 *
 * Every node read carries the source span it was read from.
 */
public class Trees {

	/**
	 * Read exactly one expression from a given string.
	 *
	 * @param input
	 * @return
	 */
	public static Expr read(String input) {
		Trees reader = new Trees(input);
		Expr e = reader.parse();
		if (reader.index < reader.tokens.size()) {
			throw reader.error("unexpected trailing input");
		}
		return e;
	}

	/**
	 * Read a sequence of expressions from a given string.
	 *
	 * @param input
	 * @return
	 */
	public static Expr[] readAll(String input) {
		Trees reader = new Trees(input);
		ArrayList<Expr> exprs = new ArrayList<>();
		while (reader.index < reader.tokens.size()) {
			exprs.add(reader.parse());
		}
		return exprs.toArray(new Expr[exprs.size()]);
	}

	private final List<Token> tokens;
	private int index;

	private Trees(String input) {
		this.tokens = scan(input);
	}

	private Expr parse() {
		Token lookahead = next();
		if (lookahead.text.equals("(")) {
			return parseCompound(lookahead.start);
		} else if (lookahead.text.equals("true") || lookahead.text.equals("false")) {
			return new Expr.Literal(Boolean.parseBoolean(lookahead.text), sourceAttr(lookahead.start));
		} else if (lookahead.text.matches("-?[0-9]+")) {
			return new Expr.Literal(Long.parseLong(lookahead.text), sourceAttr(lookahead.start));
		} else if (isBracket(lookahead)) {
			throw error("unexpected " + lookahead.text);
		} else {
			return new Expr.Variable(lookahead.text, sourceAttr(lookahead.start));
		}
	}

	private Expr parseCompound(int start) {
		Token head = peek();
		switch (head.text) {
		case "if": {
			next();
			Expr c = parse();
			Expr t = parse();
			Expr f = parse();
			match(")");
			return new Expr.Conditional(c, t, f, sourceAttr(start));
		}
		case "fn": {
			next();
			String name = null;
			if (!peek().text.equals("[")) {
				name = next().text;
			}
			Clause[] clauses;
			if (peek().text.equals("[")) {
				String[] formals = parseNames();
				Expr[] body = parseUntilClose();
				clauses = new Clause[] { new Clause(formals, body, sourceAttr(start)) };
			} else {
				clauses = parseClauses();
			}
			if (name == null) {
				return new Expr.Function(clauses, sourceAttr(start));
			} else {
				return new Expr.NamedFunction(name, clauses, sourceAttr(start));
			}
		}
		case "cont": {
			next();
			String[] params = parseNames();
			if (params.length != 1) {
				throw error("continuation requires exactly one parameter");
			}
			Expr body = parse();
			match(")");
			return new Expr.Cont(params[0], body, sourceAttr(start));
		}
		case "app-cont": {
			next();
			Expr k = parse();
			Expr v = parse();
			match(")");
			return new Expr.AppCont(k, v, sourceAttr(start));
		}
		case "thunk": {
			next();
			Expr body = parse();
			match(")");
			return new Expr.Thunk(body, sourceAttr(start));
		}
		case "complete": {
			next();
			String flag = next().text;
			Expr body = parse();
			match(")");
			return new Expr.Complete(flag, body, sourceAttr(start));
		}
		case "trampoline": {
			next();
			String flag = next().text;
			Expr helper = parse();
			if (!(helper instanceof Expr.NamedFunction)) {
				throw error("trampoline requires a named helper");
			}
			Expr[] arguments = parseUntilClose();
			return new Expr.Trampoline(flag, (Expr.NamedFunction) helper, arguments, sourceAttr(start));
		}
		default:
			Primitive p = primitive(head.text);
			if (p != null) {
				next();
				return new Expr.PrimitiveApp(p, parseUntilClose(), sourceAttr(start));
			}
			Expr operator = parse();
			return new Expr.Application(operator, parseUntilClose(), sourceAttr(start));
		}
	}

	private Clause[] parseClauses() {
		ArrayList<Clause> clauses = new ArrayList<>();
		while (!peek().text.equals(")")) {
			int start = next().start;
			if (!tokens.get(index - 1).text.equals("(")) {
				throw error("expected clause");
			}
			String[] formals = parseNames();
			Expr[] body = parseUntilClose();
			clauses.add(new Clause(formals, body, sourceAttr(start)));
		}
		match(")");
		return clauses.toArray(new Clause[clauses.size()]);
	}

	private String[] parseNames() {
		match("[");
		ArrayList<String> names = new ArrayList<>();
		while (!peek().text.equals("]")) {
			Token t = next();
			if (isBracket(t)) {
				throw error("expected name, found " + t.text);
			}
			names.add(t.text);
		}
		match("]");
		return names.toArray(new String[names.size()]);
	}

	private Expr[] parseUntilClose() {
		ArrayList<Expr> exprs = new ArrayList<>();
		while (!peek().text.equals(")")) {
			exprs.add(parse());
		}
		match(")");
		return exprs.toArray(new Expr[exprs.size()]);
	}

	private Attribute.Source sourceAttr(int start) {
		Token last = tokens.get(index - 1);
		return new Attribute.Source(start, last.start + last.text.length() - 1);
	}

	private Token peek() {
		if (index >= tokens.size()) {
			throw error("unexpected end-of-file");
		}
		return tokens.get(index);
	}

	private Token next() {
		Token t = peek();
		index = index + 1;
		return t;
	}

	private void match(String text) {
		Token t = next();
		if (!t.text.equals(text)) {
			throw error("expected " + text + ", found " + t.text);
		}
	}

	private IllegalArgumentException error(String msg) {
		int pos = index < tokens.size() ? tokens.get(index).start : -1;
		return new IllegalArgumentException(msg + " (at " + pos + ")");
	}

	private static Primitive primitive(String token) {
		for (Primitive p : Primitive.values()) {
			if (p.token().equals(token)) {
				return p;
			}
		}
		return null;
	}

	private static boolean isBracket(Token t) {
		return t.text.length() == 1 && "()[]".indexOf(t.text.charAt(0)) >= 0;
	}

	private static List<Token> scan(String input) {
		ArrayList<Token> tokens = new ArrayList<>();
		int pos = 0;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isWhitespace(c)) {
				pos++;
			} else if ("()[]".indexOf(c) >= 0) {
				tokens.add(new Token(Character.toString(c), pos));
				pos++;
			} else {
				int start = pos;
				while (pos < input.length() && !Character.isWhitespace(input.charAt(pos))
						&& "()[]".indexOf(input.charAt(pos)) < 0) {
					pos++;
				}
				tokens.add(new Token(input.substring(start, pos), start));
			}
		}
		return tokens;
	}

	private static final class Token {
		private final String text;
		private final int start;

		public Token(String text, int start) {
			this.text = text;
			this.start = start;
		}
	}
}
