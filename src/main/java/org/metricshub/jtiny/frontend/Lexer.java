package org.metricshub.jtiny.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jtiny
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.jtiny.frontend.ast.LexerException;

/**
 * Cuts a Jtiny script into tokens.
 * <p>
 * Besides the token stream, the lexer owns the variable naming scheme: each
 * distinct identifier is given a small integer id, in order of first
 * appearance (the first name seen is variable 0). The rest of the
 * interpreter only ever sees these ids.
 */
class Lexer {

	/**
	 * Contains a mapping of Jtiny keywords to their
	 * token values.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		KEYWORDS.put("int", Token.KW_INT);
		KEYWORDS.put("print", Token.KW_PRINT);
		KEYWORDS.put("if", Token.KW_IF);
		KEYWORDS.put("else", Token.KW_ELSE);
		KEYWORDS.put("end", Token.KW_END);
	}

	private final Reader reader;
	private final String sourceDescription;
	private final Map<String, Integer> identifiers = new LinkedHashMap<String, Integer>();

	private int c;
	private int line = 1;
	private int tokenLine = 1;
	private Token token;
	private final StringBuilder text = new StringBuilder();

	Lexer(Reader reader, String sourceDescription) throws IOException {
		this.reader = reader;
		this.sourceDescription = sourceDescription;
		c = readChar();
	}

	private int readChar() throws IOException {
		int ch = reader.read();
		// completely bypass \r's
		while (ch == '\r') {
			ch = reader.read();
		}
		return ch;
	}

	private void read() throws IOException {
		if (c == '\n') {
			line++;
		}
		text.append((char) c);
		c = readChar();
	}

	/**
	 * @return the source text of the current token
	 */
	String text() {
		return text.toString();
	}

	/**
	 * @return the line on which the current token starts
	 */
	int tokenLine() {
		return tokenLine;
	}

	/**
	 * @return the variable id of the current {@link Token#ID} token
	 */
	int identifierId() {
		assert token == Token.ID;
		return identifiers.get(text.toString());
	}

	/**
	 * @return the value of the current {@link Token#INTEGER} token
	 */
	int integerValue() {
		assert token == Token.INTEGER;
		return Integer.parseInt(text.toString());
	}

	/**
	 * @return the identifiers seen so far, mapped to their variable id
	 */
	Map<String, Integer> identifiers() {
		return Collections.unmodifiableMap(identifiers);
	}

	String sourceDescription() {
		return sourceDescription;
	}

	LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, line);
	}

	/**
	 * Moves to the next token.
	 *
	 * @return the new current token
	 * @throws IOException upon an IO error
	 */
	Token lexer() throws IOException {
		// clear whitespace and comments
		while (c == ' ' || c == '\t' || c == '\n' || c == '#') {
			if (c == '#') {
				// kill comment
				while (c >= 0 && c != '\n') {
					read();
				}
			} else {
				read();
			}
		}
		text.setLength(0);
		tokenLine = line;
		if (c < 0) {
			token = Token.EOF;
			return token;
		}
		switch (c) {
		case '(':
			return single(Token.OPEN_PAREN);
		case ')':
			return single(Token.CLOSE_PAREN);
		case ';':
			return single(Token.SEMICOLON);
		case ':':
			return single(Token.COLON);
		case '+':
			return single(Token.PLUS);
		case '-':
			return single(Token.MINUS);
		case '*':
			return single(Token.MULT);
		case '/':
			return single(Token.DIVIDE);
		case '=':
			read();
			if (c == '=') {
				return single(Token.EQ);
			}
			token = Token.EQUALS;
			return token;
		case '!':
			read();
			if (c == '=') {
				return single(Token.NE);
			}
			throw lexerException("use != for inequality");
		case '<':
			read();
			if (c == '=') {
				return single(Token.LE);
			}
			token = Token.LT;
			return token;
		case '>':
			read();
			if (c == '=') {
				return single(Token.GE);
			}
			token = Token.GT;
			return token;
		default:
			break;
		}

		if (isDigit(c)) {
			while (isDigit(c)) {
				read();
			}
			try {
				Integer.parseInt(text.toString());
			} catch (NumberFormatException nfe) {
				throw lexerException("Integer literal out of range: " + text);
			}
			token = Token.INTEGER;
			return token;
		}

		if (isIdentifierStart(c)) {
			read();
			while (isIdentifierStart(c) || isDigit(c)) {
				read();
			}
			String name = text.toString();
			Token kwToken = KEYWORDS.get(name);
			if (kwToken != null) {
				token = kwToken;
				return token;
			}
			if (!identifiers.containsKey(name)) {
				identifiers.put(name, identifiers.size());
			}
			token = Token.ID;
			return token;
		}

		throw lexerException("Invalid character (" + c + "): " + ((char) c));
	}

	private Token single(Token t) throws IOException {
		read();
		token = t;
		return token;
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private static boolean isIdentifierStart(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
	}
}
