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
 * Base class of the syntax tree.
 * <p>
 * Nodes are plain data: they are built bottom-up by the tree builder, own
 * their children exclusively and know nothing about evaluation. No
 * validation happens at construction time, a malformed tree is rejected
 * when it is executed.
 */
public abstract class Node {

	private final NodeKind kind;
	private final int lineNo;

	protected Node(NodeKind kind, int lineNo) {
		this.kind = kind;
		this.lineNo = lineNo;
	}

	/**
	 * @return the tag of this node
	 */
	public final NodeKind getKind() {
		return kind;
	}

	/**
	 * @return the source line of the construct this node was built for
	 */
	public final int getLineNumber() {
		return lineNo;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
