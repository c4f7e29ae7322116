package org.metricshub.jtiny.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringReader;
import java.util.List;
import org.junit.Test;
import org.metricshub.jtiny.ast.BinaryOp;
import org.metricshub.jtiny.ast.BinaryOperator;
import org.metricshub.jtiny.ast.Declare;
import org.metricshub.jtiny.ast.If;
import org.metricshub.jtiny.ast.IntLiteral;
import org.metricshub.jtiny.ast.Node;
import org.metricshub.jtiny.ast.NodeKind;
import org.metricshub.jtiny.ast.Print;
import org.metricshub.jtiny.ast.StmtList;
import org.metricshub.jtiny.ast.VarRef;
import org.metricshub.jtiny.frontend.ast.LexerException;
import org.metricshub.jtiny.frontend.ast.ParserException;
import org.metricshub.jtiny.util.ScriptSource;

public class JtinyParserTest {

	private static List<Node> parse(String script) throws Exception {
		return StmtList.statementsOf(new JtinyParser().parse(ScriptSource.of(script)));
	}

	@Test
	public void emptyProgramIsNull() throws Exception {
		assertNull(new JtinyParser().parse(ScriptSource.of("")));
		assertNull(new JtinyParser().parse(ScriptSource.of("  # only a comment\n\n")));
	}

	@Test
	public void rootIsAlwaysAStatementList() throws Exception {
		Node root = new JtinyParser().parse(ScriptSource.of("print(1);"));
		assertEquals(NodeKind.STMT_LIST, root.getKind());
		assertNull(((StmtList) root).getPrevious());
	}

	@Test
	public void declaration() throws Exception {
		List<Node> statements = parse("int total = 3;");
		Declare declare = (Declare) statements.get(0);
		assertEquals(0, ((VarRef) declare.getTarget()).getId());
		assertEquals(3, ((IntLiteral) declare.getValue()).getValue());
	}

	@Test
	public void identifiersNumberedByFirstAppearance() throws Exception {
		JtinyParser parser = new JtinyParser();
		parser.parse(ScriptSource.of("int b = 1; int a = b; c = a + b;"));
		assertEquals(Integer.valueOf(0), parser.getIdentifiers().get("b"));
		assertEquals(Integer.valueOf(1), parser.getIdentifiers().get("a"));
		assertEquals(Integer.valueOf(2), parser.getIdentifiers().get("c"));
		assertEquals(3, parser.getIdentifiers().size());
	}

	@Test
	public void keywordsAreNotIdentifiers() throws Exception {
		JtinyParser parser = new JtinyParser();
		parser.parse(ScriptSource.of("int ending = 1; if (ending > 0): print(ending); else: end"));
		assertEquals(1, parser.getIdentifiers().size());
		assertTrue(parser.getIdentifiers().containsKey("ending"));
	}

	@Test
	public void precedenceAndAssociativity() throws Exception {
		Print print = (Print) parse("print(1 - 2 - 3 * 4 / 5);").get(0);
		// ((1 - 2) - ((3 * 4) / 5))
		BinaryOp root = (BinaryOp) print.getValue();
		assertEquals(BinaryOperator.SUBTRACT, root.getOperator());
		BinaryOp left = (BinaryOp) root.getLeft();
		assertEquals(BinaryOperator.SUBTRACT, left.getOperator());
		BinaryOp right = (BinaryOp) root.getRight();
		assertEquals(BinaryOperator.DIVIDE, right.getOperator());
		assertEquals(BinaryOperator.MULTIPLY, ((BinaryOp) right.getLeft()).getOperator());
	}

	@Test
	public void expressionStatementStartingWithVariable() throws Exception {
		Print print = (Print) parse("x * 2 + 1;").get(0);
		BinaryOp sum = (BinaryOp) print.getValue();
		assertEquals(BinaryOperator.ADD, sum.getOperator());
		BinaryOp product = (BinaryOp) sum.getLeft();
		assertEquals(BinaryOperator.MULTIPLY, product.getOperator());
		assertEquals(NodeKind.VAR_REF, product.getLeft().getKind());
	}

	@Test
	public void assignmentVersusComparisonStatement() throws Exception {
		List<Node> statements = parse("x = 1;\nx;");
		assertEquals(NodeKind.ASSIGN, statements.get(0).getKind());
		assertEquals(NodeKind.PRINT, statements.get(1).getKind());
		assertEquals(2, statements.get(1).getLineNumber());
	}

	@Test
	public void elseBindsToInnermostIf() throws Exception {
		List<Node> statements = parse("if (1 < 2): if (3 < 4): print(1); else: print(2); end end");
		If outer = (If) statements.get(0);
		assertFalse(outer.hasElse());
		If inner = (If) StmtList.statementsOf(outer.getThenList()).get(0);
		assertTrue(inner.hasElse());
	}

	@Test
	public void sequentialIfs() throws Exception {
		List<Node> statements = parse("if (a > b): print(1); end\nif (c > d): print(2); else: print(3); end");
		assertEquals(2, statements.size());
		assertFalse(((If) statements.get(0)).hasElse());
		assertTrue(((If) statements.get(1)).hasElse());
		assertEquals(2, statements.get(1).getLineNumber());
	}

	@Test
	public void emptyBlocks() throws Exception {
		If ifNode = (If) parse("if (1 == 1): else: end").get(0);
		assertNull(ifNode.getThenList());
		assertNull(ifNode.getElseList());
		assertFalse(ifNode.hasElse());
	}

	@Test
	public void lineNumbersOfNodes() throws Exception {
		List<Node> statements = parse("\n\nprint(1 +\n 2);");
		Print print = (Print) statements.get(0);
		assertEquals(3, print.getLineNumber());
		assertEquals(3, print.getValue().getLineNumber());
		assertEquals(4, ((BinaryOp) print.getValue()).getRight().getLineNumber());
	}

	@Test
	public void carriageReturnsIgnored() throws Exception {
		List<Node> statements = parse("print(1);\r\nprint(2);\r\n");
		assertEquals(2, statements.get(1).getLineNumber());
	}

	@Test
	public void parseExpression() throws Exception {
		Node expr = new JtinyParser().parseExpression(ScriptSource.of("(a + 2) * b"));
		assertEquals(BinaryOperator.MULTIPLY, ((BinaryOp) expr).getOperator());
	}

	@Test(expected = ParserException.class)
	public void parseExpressionRejectsTrailingTokens() throws Exception {
		new JtinyParser().parseExpression(ScriptSource.of("1 + 2;"));
	}

	@Test
	public void parserExceptionCarriesSourceAndLine() throws Exception {
		try {
			new JtinyParser().parse(new ScriptSource("prog.tiny", new StringReader("print(1);\nprint 2;")));
			fail("ParserException expected");
		} catch (ParserException e) {
			assertEquals("Expecting OPEN_PAREN. Found: INTEGER (2)", e.getMessage());
			assertEquals(2, e.getLineNumber());
			assertEquals("prog.tiny", e.getSourceDescription());
		}
	}

	@Test
	public void unbalancedEnd() throws Exception {
		try {
			parse("print(1);\nend");
			fail("ParserException expected");
		} catch (ParserException e) {
			assertEquals("Expecting EOF. Found: KW_END (end)", e.getMessage());
		}
	}

	@Test
	public void missingExpression() throws Exception {
		try {
			parse("int x = ;");
			fail("ParserException expected");
		} catch (ParserException e) {
			assertEquals("Expecting expression. Found: SEMICOLON (;)", e.getMessage());
		}
	}

	@Test
	public void lexerException() throws Exception {
		try {
			parse("print(1);\nprint(2 @ 3);");
			fail("LexerException expected");
		} catch (LexerException e) {
			assertEquals("Invalid character (64): @", e.getMessage());
			assertEquals(2, e.getLineNumber());
			assertEquals(ScriptSource.DESCRIPTION_INLINE_SCRIPT, e.getSourceDescription());
		}
	}
}
