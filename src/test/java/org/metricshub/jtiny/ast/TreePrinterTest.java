package org.metricshub.jtiny.ast;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Before;
import org.junit.Test;

public class TreePrinterTest {

	private ByteArrayOutputStream buffer;
	private TreePrinter printer;

	@Before
	public void setUp() throws Exception {
		buffer = new ByteArrayOutputStream();
		printer = new TreePrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8.name()));
	}

	private String printed() {
		return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void declaration() {
		printer.print(new Declare(new VarRef(0, 1), new IntLiteral(5, 1), 1));
		assertEquals(
				"\n     INTEGER(5)\n"
						+ "\ndec\n"
						+ "\n     VAR(id=0)\n"
						+ TreePrinter.SEPARATOR,
				printed());
	}

	@Test
	public void rightChildAboveLeftChildBelow() {
		Node sum = new BinaryOp(BinaryOperator.ADD, new IntLiteral(2, 1), new IntLiteral(3, 1), 1);
		printer.print(new Print(sum, 1));
		assertEquals(
				"\nprint\n"
						+ "\n          INTEGER(3)\n"
						+ "\n     +\n"
						+ "\n          INTEGER(2)\n"
						+ TreePrinter.SEPARATOR,
				printed());
	}

	@Test
	public void ifWithBranches() {
		Node cond = new BinaryOp(BinaryOperator.GT, new VarRef(0, 1), new IntLiteral(1, 1), 1);
		Node thenList = new StmtList(null, new Print(new IntLiteral(7, 2), 2), 2);
		Node elseList = new StmtList(null, new Print(new IntLiteral(8, 4), 4), 4);
		printer.print(new If(cond, thenList, elseList, 1));
		assertEquals(
				line(15, "print")
						+ line(20, "INTEGER(8)")
						+ line(10, "stmtlist")
						+ line(5, "branches")
						+ line(15, "print")
						+ line(20, "INTEGER(7)")
						+ line(10, "stmtlist")
						+ line(0, "if")
						+ line(10, "INTEGER(1)")
						+ line(5, ">")
						+ line(10, "VAR(id=0)")
						+ TreePrinter.SEPARATOR,
				printed());
	}

	@Test
	public void ifWithoutElse() {
		Node cond = new BinaryOp(BinaryOperator.EQ, new IntLiteral(1, 1), new IntLiteral(1, 1), 1);
		printer.print(new If(cond, null, null, 1));
		assertEquals(
				line(5, "branches")
						+ line(0, "if")
						+ line(10, "INTEGER(1)")
						+ line(5, "==")
						+ line(10, "INTEGER(1)")
						+ TreePrinter.SEPARATOR,
				printed());
	}

	@Test
	public void leftLeaningChain() {
		// (1 - 2) - 3
		Node inner = new BinaryOp(BinaryOperator.SUBTRACT, new IntLiteral(1, 1), new IntLiteral(2, 1), 1);
		printer.print(new Print(new BinaryOp(BinaryOperator.SUBTRACT, inner, new IntLiteral(3, 1), 1), 1));
		assertEquals(
				line(0, "print")
						+ line(10, "INTEGER(3)")
						+ line(5, "-")
						+ line(15, "INTEGER(2)")
						+ line(10, "-")
						+ line(15, "INTEGER(1)")
						+ TreePrinter.SEPARATOR,
				printed());
	}

	private static String line(int spaces, String label) {
		StringBuilder sb = new StringBuilder("\n");
		for (int i = 0; i < spaces; i++) {
			sb.append(' ');
		}
		return sb.append(label).append('\n').toString();
	}

	@Test
	public void eachStatementOfAListGetsItsOwnDiagram() {
		Node list = new StmtList(null, new Print(new IntLiteral(1, 1), 1), 1);
		list = new StmtList(list, new Assign(new VarRef(3, 2), new IntLiteral(2, 2), 2), 2);
		printer.print(list);
		assertEquals(
				"\nprint\n\n     INTEGER(1)\n"
						+ TreePrinter.SEPARATOR
						+ "\n     INTEGER(2)\n\nassign\n\n     VAR(id=3)\n"
						+ TreePrinter.SEPARATOR,
				printed());
	}

	@Test
	public void nullPrintsNothing() {
		printer.print(null);
		assertEquals("", printed());
	}

	@Test
	public void labels() {
		assertEquals("INTEGER(-4)", TreePrinter.label(new IntLiteral(-4, 1)));
		assertEquals("VAR(id=12)", TreePrinter.label(new VarRef(12, 1)));
		assertEquals("<=", TreePrinter.label(new BinaryOp(BinaryOperator.LE, null, null, 1)));
		assertEquals("stmtlist", TreePrinter.label(new StmtList(null, null, 1)));
	}
}
