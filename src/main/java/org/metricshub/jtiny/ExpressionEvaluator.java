package org.metricshub.jtiny;

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
import org.metricshub.jtiny.ast.Node;
import org.metricshub.jtiny.backend.Evaluator;
import org.metricshub.jtiny.frontend.JtinyParser;
import org.metricshub.jtiny.frontend.ast.ParserException;
import org.metricshub.jtiny.jrt.FaultReporter;
import org.metricshub.jtiny.jrt.RuntimeOutput;
import org.metricshub.jtiny.jrt.SemanticException;
import org.metricshub.jtiny.jrt.SymbolStore;
import org.metricshub.jtiny.util.JtinySettings;
import org.metricshub.jtiny.util.ScriptSource;

/**
 * Utility class to evaluate standalone Jtiny expressions.
 * <p>
 * Variables are named by id in this context, since no declaration assigns
 * them a name: in <code>a + b</code>, <code>a</code> is variable 0 and
 * <code>b</code> is variable 1.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	/**
	 * Evaluates an expression with every variable at 0.
	 *
	 * @param expression the expression text
	 * @return its value
	 * @throws IOException upon an IO error
	 * @throws ParserException when the text is not an expression
	 */
	public static int eval(String expression) throws IOException {
		return eval(expression, new SymbolStore(), new JtinySettings());
	}

	/**
	 * Evaluates an expression against the given variables, reporting faults on
	 * standard error.
	 *
	 * @param expression the expression text
	 * @param store the variables
	 * @return its value
	 * @throws IOException upon an IO error
	 * @throws ParserException when the text is not an expression
	 * @throws SemanticException when a variable id is outside the store
	 */
	public static int eval(String expression, SymbolStore store) throws IOException {
		return eval(expression, store, new JtinySettings());
	}

	/**
	 * Evaluates an expression against the given variables. Faults (division by
	 * zero) are reported on the error stream of the settings.
	 *
	 * @param expression the expression text
	 * @param store the variables
	 * @param settings where faults are reported
	 * @return its value
	 * @throws IOException upon an IO error
	 * @throws ParserException when the text is not an expression
	 * @throws SemanticException when a variable id is outside the store
	 */
	public static int eval(String expression, SymbolStore store, JtinySettings settings) throws IOException {
		Node tree;
		try (ScriptSource source = ScriptSource.of(expression)) {
			tree = new JtinyParser().parseExpression(source);
		}
		return eval(tree, store, settings);
	}

	/**
	 * Evaluates an already parsed expression.
	 *
	 * @param tree the expression
	 * @param store the variables
	 * @param settings where faults are reported
	 * @return its value
	 * @throws SemanticException when {@code tree} is not an expression, or a
	 *         variable id is outside the store
	 */
	public static int eval(Node tree, SymbolStore store, JtinySettings settings) {
		Evaluator evaluator = new Evaluator(
				store,
				new RuntimeOutput(settings.getOutputStream()),
				new FaultReporter(settings.getErrorStream()),
				null);
		return evaluator.evaluateExpression(tree);
	}
}
