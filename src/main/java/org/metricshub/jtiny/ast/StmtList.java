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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * One link of a statement chain. {@code previous} holds every statement
 * parsed before {@code statement} in the same block, or {@code null} for the
 * first one.
 */
public final class StmtList extends Node {

	private final Node previous;
	private final Node statement;

	public StmtList(Node previous, Node statement, int lineNo) {
		super(NodeKind.STMT_LIST, lineNo);
		this.previous = previous;
		this.statement = statement;
	}

	public Node getPrevious() {
		return previous;
	}

	public Node getStatement() {
		return statement;
	}

	/**
	 * Unrolls a statement chain.
	 *
	 * @param list a statement list, a single statement, or {@code null}
	 * @return the statements of {@code list} in program order, oldest first
	 */
	public static List<Node> statementsOf(Node list) {
		Deque<Node> stack = new ArrayDeque<Node>();
		Node ptr = list;
		while (ptr != null && ptr.getKind() == NodeKind.STMT_LIST) {
			StmtList link = (StmtList) ptr;
			if (link.statement != null) {
				stack.push(link.statement);
			}
			ptr = link.previous;
		}
		if (ptr != null) {
			stack.push(ptr);
		}
		return new ArrayList<Node>(stack);
	}

	@Override
	public String toString() {
		return super.toString() + " <" + statement + ">";
	}
}
