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

/**
 * A conditional. Both branches are statement lists; either may be
 * {@code null} when the block is empty, and a {@code null} else list also
 * stands for a missing <code>else</code> clause.
 */
public final class If extends Node {

	private final Node condition;
	private final Node thenList;
	private final Node elseList;

	public If(Node condition, Node thenList, Node elseList, int lineNo) {
		super(NodeKind.IF, lineNo);
		this.condition = condition;
		this.thenList = thenList;
		this.elseList = elseList;
	}

	public Node getCondition() {
		return condition;
	}

	public Node getThenList() {
		return thenList;
	}

	public Node getElseList() {
		return elseList;
	}

	public boolean hasElse() {
		return elseList != null;
	}
}
