package org.metricshub.jtiny.backend;

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
import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.jtiny.ast.Assign;
import org.metricshub.jtiny.ast.BinaryOp;
import org.metricshub.jtiny.ast.Declare;
import org.metricshub.jtiny.ast.If;
import org.metricshub.jtiny.ast.IntLiteral;
import org.metricshub.jtiny.ast.Node;
import org.metricshub.jtiny.ast.NodeKind;
import org.metricshub.jtiny.ast.Print;
import org.metricshub.jtiny.ast.StmtList;
import org.metricshub.jtiny.ast.TreePrinter;
import org.metricshub.jtiny.ast.VarRef;
import org.metricshub.jtiny.jrt.FaultReporter;
import org.metricshub.jtiny.jrt.RuntimeOutput;
import org.metricshub.jtiny.jrt.SemanticException;
import org.metricshub.jtiny.jrt.SymbolStore;
import org.metricshub.jtiny.util.JtinyLogger;
import org.metricshub.jtiny.util.JtinySettings;
import org.slf4j.Logger;

/**
 * Walks a completed syntax tree and executes it against a
 * {@link SymbolStore}.
 * <p>
 * Statements run in program order. Before a statement runs, its tree is
 * drawn on the tree channel (when one is configured); the branch of an
 * <code>if</code> that is not taken is never visited, so it is neither
 * drawn nor executed.
 * <p>
 * Faults never stop the run:
 * <ul>
 * <li>a division by zero is reported and evaluates to 0, the enclosing
 * statement completes with that value;
 * <li>a {@link SemanticException} is reported and the statement raising it
 * is abandoned, the store untouched;
 * <li>a statement nested deeper than the call stack allows is reported and
 * abandoned the same way.
 * </ul>
 */
public class Evaluator implements JtinyInterpreter {

	private static final Logger LOG = JtinyLogger.getLogger(Evaluator.class);

	private final SymbolStore store;
	private final RuntimeOutput output;
	private final FaultReporter faults;
	private final TreePrinter treePrinter;

	/**
	 * Creates an evaluator with a fresh store and the channels of the given
	 * settings.
	 *
	 * @param settings channels and store capacity
	 */
	public Evaluator(JtinySettings settings) {
		this(
				new SymbolStore(settings.getStoreCapacity()),
				new RuntimeOutput(settings.getOutputStream()),
				new FaultReporter(settings.getErrorStream()),
				settings.isTreeEnabled() ? new TreePrinter(settings.getTreeStream()) : null);
	}

	/**
	 * @param store the variables
	 * @param output the runtime-output channel
	 * @param faults the fault channel
	 * @param treePrinter the tree channel, {@code null} to draw nothing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Evaluator(SymbolStore store, RuntimeOutput output, FaultReporter faults, TreePrinter treePrinter) {
		this.store = store;
		this.output = output;
		this.faults = faults;
		this.treePrinter = treePrinter;
	}

	/**
	 * @return the variables this evaluator reads and writes
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public SymbolStore getStore() {
		return store;
	}

	/**
	 * @return the number of faults reported by this evaluator so far
	 */
	public int getFaultCount() {
		return faults.getFaultCount();
	}

	@Override
	public void interpret(Node program) {
		LOG.debug("Executing program");
		executeStatementList(program);
		LOG.debug("Execution complete, {} fault(s), store: {}", faults.getFaultCount(), store);
	}

	/**
	 * Executes each statement of a statement chain, oldest first.
	 *
	 * @param list a statement list, a single statement, or {@code null}
	 */
	public void executeStatementList(Node list) {
		for (Node statement : StmtList.statementsOf(list)) {
			executeStatement(statement);
		}
	}

	/**
	 * Draws then executes one statement.
	 *
	 * @param stmt the statement, {@code null} does nothing
	 */
	public void executeStatement(Node stmt) {
		if (stmt == null) {
			return;
		}
		if (stmt.getKind() == NodeKind.STMT_LIST) {
			executeStatementList(stmt);
			return;
		}
		try {
			if (treePrinter != null) {
				treePrinter.print(stmt);
			}
			LOG.trace("Line {}: {}", stmt.getLineNumber(), stmt.getKind());
			switch (stmt.getKind()) {
			case DECLARE: {
				Declare declare = (Declare) stmt;
				int id = targetId(declare.getTarget(), stmt, "Declaration left side is not a variable");
				int value = evaluateExpression(requireExpression(declare.getValue(), stmt));
				store.set(id, value);
				output.declared(id, value);
				break;
			}
			case ASSIGN: {
				Assign assign = (Assign) stmt;
				int id = targetId(assign.getTarget(), stmt, "Assignment left side is not a variable");
				int value = evaluateExpression(requireExpression(assign.getValue(), stmt));
				store.set(id, value);
				output.assigned(id, value);
				break;
			}
			case PRINT: {
				Print print = (Print) stmt;
				output.print(evaluateExpression(requireExpression(print.getValue(), stmt)));
				break;
			}
			case IF: {
				If ifNode = (If) stmt;
				int condition = evaluateExpression(requireExpression(ifNode.getCondition(), stmt));
				if (condition != 0) {
					executeStatementList(ifNode.getThenList());
				} else if (ifNode.hasElse()) {
					executeStatementList(ifNode.getElseList());
				}
				break;
			}
			default:
				throw new SemanticException(
						stmt.getLineNumber(),
						"Expected a statement, found " + TreePrinter.label(stmt));
			}
		} catch (SemanticException e) {
			faults.report(e);
		} catch (StackOverflowError e) {
			faults.report(FaultReporter.TOO_DEEPLY_NESTED, stmt.getLineNumber());
		}
	}

	/**
	 * Computes the value of an expression.
	 *
	 * @param node an integer literal, a variable reference or a binary operation
	 * @return the value of the expression, comparisons yield 1 or 0
	 * @throws SemanticException if {@code node} is not an expression, or
	 *         refers to a variable outside the store
	 */
	public int evaluateExpression(Node node) {
		switch (node.getKind()) {
		case INT_LITERAL:
			return ((IntLiteral) node).getValue();
		case VAR_REF: {
			VarRef ref = (VarRef) node;
			checkVariable(ref);
			return store.get(ref.getId());
		}
		case BINARY_OP:
			return evaluateBinary((BinaryOp) node);
		default:
			throw new SemanticException(
					node.getLineNumber(),
					"Expected an expression, found " + TreePrinter.label(node));
		}
	}

	private int evaluateBinary(BinaryOp top) {
		// a + b + c ... leans left: unroll the left spine, innermost operation first
		Deque<BinaryOp> spine = new ArrayDeque<BinaryOp>();
		Node current = top;
		while (current.getKind() == NodeKind.BINARY_OP) {
			BinaryOp op = (BinaryOp) current;
			spine.push(op);
			current = requireExpression(op.getLeft(), op);
		}
		int value = evaluateExpression(current);
		while (!spine.isEmpty()) {
			BinaryOp op = spine.pop();
			int right = evaluateExpression(requireExpression(op.getRight(), op));
			value = apply(op, value, right);
		}
		return value;
	}

	private int apply(BinaryOp op, int left, int right) {
		switch (op.getOperator()) {
		case ADD:
			return left + right;
		case SUBTRACT:
			return left - right;
		case MULTIPLY:
			return left * right;
		case DIVIDE:
			if (right == 0) {
				faults.report("Division by zero", op.getLineNumber());
				return 0;
			}
			return left / right;
		case EQ:
			return left == right ? 1 : 0;
		case NE:
			return left != right ? 1 : 0;
		case LT:
			return left < right ? 1 : 0;
		case LE:
			return left <= right ? 1 : 0;
		case GT:
			return left > right ? 1 : 0;
		case GE:
			return left >= right ? 1 : 0;
		default:
			throw new IllegalStateException("Unexpected operator: " + op.getOperator());
		}
	}

	private int targetId(Node target, Node stmt, String message) {
		if (target == null || target.getKind() != NodeKind.VAR_REF) {
			throw new SemanticException(stmt.getLineNumber(), message);
		}
		VarRef ref = (VarRef) target;
		checkVariable(ref);
		return ref.getId();
	}

	private void checkVariable(VarRef ref) {
		if (!store.contains(ref.getId())) {
			throw new SemanticException(
					ref.getLineNumber(),
					"Variable id " + ref.getId() + " out of range (capacity " + store.capacity() + ")");
		}
	}

	private static Node requireExpression(Node node, Node parent) {
		if (node == null) {
			throw new SemanticException(parent.getLineNumber(), "Missing expression in " + TreePrinter.label(parent));
		}
		return node;
	}
}
