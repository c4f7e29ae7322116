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

/** Lexer token values. */
enum Token {
	EOF,
	ID,
	INTEGER,

	EQUALS,

	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,

	PLUS,
	MINUS,
	MULT,
	DIVIDE,

	SEMICOLON,
	COLON,
	OPEN_PAREN,
	CLOSE_PAREN,

	KW_INT,
	KW_PRINT,
	KW_IF,
	KW_ELSE,
	KW_END;

	/**
	 * @return whether this token is one of the comparison operators allowed
	 *         in an <code>if</code> condition
	 */
	boolean isComparison() {
		return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
	}
}
