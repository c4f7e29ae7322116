package org.metricshub.jtiny.ast;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * Draws a syntax tree as a vertical diagram, rotated a quarter turn: the
 * right subtree comes above its parent and the left subtree below it, each
 * level indented by {@value #SPACING} more columns.
 * <p>
 * Given a statement list, the list itself is not drawn: every statement
 * gets its own diagram, in program order. Each diagram is followed by
 * {@link #SEPARATOR}.
 * <p>
 * The printer only reads the tree.
 */
public class TreePrinter {

	/** Indentation added at each level of the diagram. */
	public static final int SPACING = 5;

	/** Written after every diagram. */
	public static final String SEPARATOR = "\n--------------------------------------------------\n\n";

	private final PrintStream out;

	/**
	 * @param out destination of the diagrams
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public TreePrinter(PrintStream out) {
		this.out = out;
	}

	/**
	 * Draws {@code node}, or each statement of it when it is a statement list.
	 *
	 * @param node the tree to draw, {@code null} draws nothing
	 */
	public void print(Node node) {
		if (node == null) {
			return;
		}
		for (Node statement : StmtList.statementsOf(node)) {
			render(statement, 0);
			out.print(SEPARATOR);
		}
	}

	/**
	 * @param node a tree node
	 * @return the text drawn for {@code node} itself, without its children
	 */
	public static String label(Node node) {
		switch (node.getKind()) {
		case INT_LITERAL:
			return "INTEGER(" + ((IntLiteral) node).getValue() + ")";
		case VAR_REF:
			return "VAR(id=" + ((VarRef) node).getId() + ")";
		case BINARY_OP:
			return ((BinaryOp) node).getOperator().getSymbol();
		case DECLARE:
			return "dec";
		case ASSIGN:
			return "assign";
		case PRINT:
			return "print";
		case IF:
			return "if";
		case STMT_LIST:
			return "stmtlist";
		default:
			throw new IllegalStateException("Unexpected node kind: " + node.getKind());
		}
	}

	private void render(Node node, int space) {
		if (node == null) {
			return;
		}
		int indent = space + SPACING;
		switch (node.getKind()) {
		case INT_LITERAL:
		case VAR_REF:
			line(label(node), indent);
			break;
		case BINARY_OP:
			renderChain((BinaryOp) node, indent);
			break;
		case DECLARE: {
			Declare declare = (Declare) node;
			render(declare.getValue(), indent);
			line(label(node), indent);
			render(declare.getTarget(), indent);
			break;
		}
		case ASSIGN: {
			Assign assign = (Assign) node;
			render(assign.getValue(), indent);
			line(label(node), indent);
			render(assign.getTarget(), indent);
			break;
		}
		case PRINT:
			line(label(node), indent);
			render(((Print) node).getValue(), indent);
			break;
		case IF: {
			If ifNode = (If) node;
			renderBranches(ifNode, indent);
			line(label(node), indent);
			render(ifNode.getCondition(), indent);
			break;
		}
		case STMT_LIST: {
			StmtList list = (StmtList) node;
			render(list.getStatement(), indent);
			line(label(node), indent);
			render(list.getPrevious(), indent);
			break;
		}
		default:
			throw new IllegalStateException("Unexpected node kind: " + node.getKind());
		}
	}

	// a + b + c ... leans left: walk down the left spine instead of recursing
	private void renderChain(BinaryOp top, int indent) {
		BinaryOp op = top;
		int level = indent;
		while (true) {
			render(op.getRight(), level);
			line(label(op), level);
			Node left = op.getLeft();
			if (left == null || left.getKind() != NodeKind.BINARY_OP) {
				render(left, level);
				return;
			}
			op = (BinaryOp) left;
			level += SPACING;
		}
	}

	// the then/else pair hangs under a "branches" node, right of the condition
	private void renderBranches(If ifNode, int space) {
		int indent = space + SPACING;
		render(ifNode.getElseList(), indent);
		line("branches", indent);
		render(ifNode.getThenList(), indent);
	}

	private void line(String label, int indent) {
		StringBuilder sb = new StringBuilder();
		sb.append('\n');
		for (int i = SPACING; i < indent; i++) {
			sb.append(' ');
		}
		sb.append(label).append('\n');
		out.print(sb);
	}
}
