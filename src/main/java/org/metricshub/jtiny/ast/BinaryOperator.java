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

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of binary operators of the language.
 */
public enum BinaryOperator {
	ADD("+", false),
	SUBTRACT("-", false),
	MULTIPLY("*", false),
	DIVIDE("/", false),
	EQ("==", true),
	NE("!=", true),
	LT("<", true),
	LE("<=", true),
	GT(">", true),
	GE(">=", true);

	private static final Map<String, BinaryOperator> BY_SYMBOL = new HashMap<String, BinaryOperator>();

	static {
		for (BinaryOperator op : values()) {
			BY_SYMBOL.put(op.symbol, op);
		}
	}

	private final String symbol;
	private final boolean comparison;

	BinaryOperator(String symbol, boolean comparison) {
		this.symbol = symbol;
		this.comparison = comparison;
	}

	/**
	 * @return the operator as written in the source
	 */
	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return whether the operator yields 1 or 0 rather than an arithmetic result
	 */
	public boolean isComparison() {
		return comparison;
	}

	/**
	 * Maps an operator string coming from the grammar onto the enum.
	 *
	 * @param symbol the operator as written in the source
	 * @return the matching operator
	 * @throws IllegalArgumentException if the symbol is not an operator of the
	 *         language, which means the grammar and this enum disagree
	 */
	public static BinaryOperator fromSymbol(String symbol) {
		BinaryOperator op = BY_SYMBOL.get(symbol);
		if (op == null) {
			throw new IllegalArgumentException("Unknown operator symbol: " + symbol);
		}
		return op;
	}
}
