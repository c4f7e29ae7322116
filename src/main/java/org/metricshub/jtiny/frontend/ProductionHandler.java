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

import org.metricshub.jtiny.ast.Node;

/**
 * Receives the grammar productions recognized by {@link JtinyParser}, one
 * call per completed production, children first.
 * <p>
 * Every argument of type {@link Node} is the value an earlier call
 * returned. The parser never looks inside those values, so an
 * implementation is free to build whatever it likes with them.
 */
public interface ProductionHandler {

	/** <code>expr : INTEGER</code> */
	Node integerLiteral(int value, int line);

	/** <code>expr : VARIABLE</code> */
	Node variable(int id, int line);

	/** <code>expr : expr ('+'|'-'|'*'|'/') expr</code> */
	Node binary(String symbol, Node left, Node right, int line);

	/** <code>condition : expr OP expr</code> */
	Node condition(String symbol, Node left, Node right, int line);

	/** <code>declaration : INT VARIABLE '=' expr ';'</code> */
	Node declaration(int id, Node value, int line);

	/** <code>assignment : VARIABLE '=' expr ';'</code> */
	Node assignment(int id, Node value, int line);

	/** <code>printStatement : PRINT '(' expr ')' ';'</code> */
	Node print(Node value, int line);

	/** <code>stmt : expr ';'</code> */
	Node expressionStatement(Node value, int line);

	/** <code>IfStatement : IF '(' condition ')' ':' block ELSE ':' block END</code> */
	Node ifElse(Node condition, Node thenBlock, Node elseBlock, int line);

	/** <code>IfStatement : IF '(' condition ')' ':' block END</code> */
	Node ifThen(Node condition, Node thenBlock, int line);

	/** <code>stmts : %empty</code> */
	Node emptyList();

	/** <code>stmts : stmts stmt</code> */
	Node appendStatement(Node list, Node statement);

	/**
	 * <code>program : stmts</code>
	 *
	 * @param statements the top-level statement list, {@code null} for an empty program
	 * @return the root of the program
	 */
	Node program(Node statements);
}
