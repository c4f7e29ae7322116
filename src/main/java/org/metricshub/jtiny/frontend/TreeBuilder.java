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

import org.metricshub.jtiny.ast.Assign;
import org.metricshub.jtiny.ast.BinaryOp;
import org.metricshub.jtiny.ast.BinaryOperator;
import org.metricshub.jtiny.ast.Declare;
import org.metricshub.jtiny.ast.If;
import org.metricshub.jtiny.ast.IntLiteral;
import org.metricshub.jtiny.ast.Node;
import org.metricshub.jtiny.ast.Print;
import org.metricshub.jtiny.ast.StmtList;
import org.metricshub.jtiny.ast.VarRef;

/**
 * Builds the syntax tree out of the productions the parser recognizes.
 * <p>
 * Nothing is evaluated here: a condition becomes a comparison node whose
 * value is only computed when the <code>if</code> executes, and a bare
 * expression statement becomes a print of that expression.
 */
public class TreeBuilder implements ProductionHandler {

	@Override
	public Node integerLiteral(int value, int line) {
		return new IntLiteral(value, line);
	}

	@Override
	public Node variable(int id, int line) {
		return new VarRef(id, line);
	}

	@Override
	public Node binary(String symbol, Node left, Node right, int line) {
		return new BinaryOp(BinaryOperator.fromSymbol(symbol), left, right, line);
	}

	@Override
	public Node condition(String symbol, Node left, Node right, int line) {
		return new BinaryOp(BinaryOperator.fromSymbol(symbol), left, right, line);
	}

	@Override
	public Node declaration(int id, Node value, int line) {
		return new Declare(new VarRef(id, line), value, line);
	}

	@Override
	public Node assignment(int id, Node value, int line) {
		return new Assign(new VarRef(id, line), value, line);
	}

	@Override
	public Node print(Node value, int line) {
		return new Print(value, line);
	}

	@Override
	public Node expressionStatement(Node value, int line) {
		return new Print(value, line);
	}

	@Override
	public Node ifElse(Node condition, Node thenBlock, Node elseBlock, int line) {
		return new If(condition, thenBlock, elseBlock, line);
	}

	@Override
	public Node ifThen(Node condition, Node thenBlock, int line) {
		return new If(condition, thenBlock, null, line);
	}

	@Override
	public Node emptyList() {
		return null;
	}

	@Override
	public Node appendStatement(Node list, Node statement) {
		// a first statement is still wrapped, so that every block is a chain
		return new StmtList(list, statement, statement.getLineNumber());
	}

	@Override
	public Node program(Node statements) {
		return statements;
	}
}
