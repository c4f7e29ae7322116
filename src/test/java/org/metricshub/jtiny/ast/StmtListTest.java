package org.metricshub.jtiny.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class StmtListTest {

	@Test
	public void statementsInProgramOrder() {
		Node a = new Print(new IntLiteral(1, 1), 1);
		Node b = new Print(new IntLiteral(2, 2), 2);
		Node c = new Print(new IntLiteral(3, 3), 3);
		Node list = new StmtList(new StmtList(new StmtList(null, a, 1), b, 2), c, 3);
		assertEquals(Arrays.asList(a, b, c), StmtList.statementsOf(list));
	}

	@Test
	public void singleStatementAndNull() {
		Node a = new Print(new IntLiteral(1, 1), 1);
		List<Node> single = StmtList.statementsOf(a);
		assertEquals(1, single.size());
		assertSame(a, single.get(0));
		assertTrue(StmtList.statementsOf(null).isEmpty());
	}

	@Test
	public void longChainDoesNotOverflowTheStack() {
		Node list = null;
		for (int i = 0; i < 200_000; i++) {
			list = new StmtList(list, new Print(new IntLiteral(i, i + 1), i + 1), i + 1);
		}
		List<Node> statements = StmtList.statementsOf(list);
		assertEquals(200_000, statements.size());
		assertEquals(0, ((IntLiteral) ((Print) statements.get(0)).getValue()).getValue());
	}

	@Test
	public void operatorSymbols() {
		for (BinaryOperator op : BinaryOperator.values()) {
			assertSame(op, BinaryOperator.fromSymbol(op.getSymbol()));
		}
		assertTrue(BinaryOperator.NE.isComparison());
		assertFalse(BinaryOperator.DIVIDE.isComparison());
		assertTrue(NodeKind.BINARY_OP.isExpression());
		assertFalse(NodeKind.STMT_LIST.isExpression());
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownOperatorSymbol() {
		BinaryOperator.fromSymbol("%");
	}
}
