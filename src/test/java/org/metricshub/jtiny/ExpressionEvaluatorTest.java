package org.metricshub.jtiny;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.jtiny.frontend.ast.ParserException;
import org.metricshub.jtiny.jrt.SemanticException;
import org.metricshub.jtiny.jrt.SymbolStore;
import org.metricshub.jtiny.util.JtinySettings;

public class ExpressionEvaluatorTest {

	@Test
	public void constants() throws Exception {
		assertEquals(14, ExpressionEvaluator.eval("2 + 3 * 4"));
		assertEquals(20, ExpressionEvaluator.eval("(2 + 3) * 4"));
		assertEquals(1, ExpressionEvaluator.eval("10 / 3 / 3"));
	}

	@Test
	public void unsetVariablesAreZero() throws Exception {
		assertEquals(7, ExpressionEvaluator.eval("a + 7 * (b + 1)"));
	}

	@Test
	public void variablesFromStore() throws Exception {
		SymbolStore store = new SymbolStore(4);
		store.set(0, 6);
		store.set(1, 2);
		assertEquals(3, ExpressionEvaluator.eval("a / b", store, new JtinySettings()));
		assertEquals(8, ExpressionEvaluator.eval("b + a", store));
	}

	@Test
	public void divisionByZeroReported() throws Exception {
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		JtinySettings settings = new JtinySettings();
		settings.setErrorStream(new PrintStream(err, true, StandardCharsets.UTF_8.name()));
		assertEquals(0, ExpressionEvaluator.eval("4 / (2 - 2)", new SymbolStore(), settings));
		assertEquals("Error: Division by zero at line 1\n", new String(err.toByteArray(), StandardCharsets.UTF_8));
	}

	@Test(expected = ParserException.class)
	public void comparisonsAreNotExpressions() throws Exception {
		ExpressionEvaluator.eval("1 < 2");
	}

	@Test(expected = SemanticException.class)
	public void variableOutsideStore() throws Exception {
		ExpressionEvaluator.eval("a + b", new SymbolStore(1));
	}
}
