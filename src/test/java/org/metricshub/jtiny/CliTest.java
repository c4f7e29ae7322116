package org.metricshub.jtiny;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jtiny.JtinyTestSupport.cliTest;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jtiny.ast.TreePrinter;
import org.metricshub.jtiny.jrt.SymbolStore;

public class CliTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void runsScriptFile() throws Exception {
		cliTest("script file")
				.script("int x = 2;", "print(x * 21);")
				.expectLines("Declared var[0] = 2", "Print: 42")
				.runAndAssert(tmp.getRoot().toPath());
	}

	@Test
	public void runtimeFaultStillExitsZero() throws Exception {
		cliTest("division by zero")
				.script("print(1 / 0);")
				.expectLines("Print: 0")
				.expectErrors("Error: Division by zero at line 1")
				.runAndAssert(tmp.getRoot().toPath());
	}

	@Test
	public void syntaxErrorExitsOne() throws Exception {
		cliTest("syntax error")
				.script("print(1)")
				.expectLines()
				.expectErrors("Error: syntax error, Expecting SEMICOLON. Found: EOF at line 2")
				.expectExitCode(1)
				.runAndAssert(tmp.getRoot().toPath());
	}

	@Test
	public void capacityOption() throws Exception {
		cliTest("small store")
				.argument("--capacity", "1")
				.script("int a = 1;", "int b = 2;")
				.expectLines("Declared var[0] = 1")
				.expectErrors("Error: Variable id 1 out of range (capacity 1) at line 2")
				.runAndAssert(tmp.getRoot().toPath());
	}

	@Test
	public void dumpSyntaxDoesNotExecute() throws Exception {
		String output = cliTest("dump syntax")
				.argument("--dump-syntax")
				.script("int x = 5;", "if (x > 9): print(x); end")
				.runAndAssert(tmp.getRoot().toPath());
		assertFalse(output.contains("Declared"));
		assertTrue(output.startsWith("\n     INTEGER(5)\n\ndec\n"));
		assertEquals(3, output.split(TreePrinter.SEPARATOR, -1).length);
	}

	@Test
	public void outputTreeAndErrorFiles() throws Exception {
		Path script = tmp.newFile("in.txt").toPath();
		Files.write(script, "int x = 1;\nprint(x / 0);\n".getBytes(StandardCharsets.UTF_8));
		File outFile = new File(tmp.getRoot(), "out.txt");
		File treeFile = new File(tmp.getRoot(), "tree.txt");
		File errFile = new File(tmp.getRoot(), "err.txt");

		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli cli = Cli
				.create(
						new String[] {
								"-o",
								outFile.getPath(),
								"-t",
								treeFile.getPath(),
								"-e",
								errFile.getPath(),
								script.toString() },
						new PrintStream(out, true, "UTF-8"),
						new PrintStream(err, true, "UTF-8"));

		assertEquals(0, cli.getExitCode());
		assertEquals(0, out.size());
		assertEquals(0, err.size());
		assertEquals("Declared var[0] = 1\nPrint: 0\n", read(outFile));
		assertEquals("Error: Division by zero at line 2\n", read(errFile));
		assertTrue(read(treeFile).endsWith(TreePrinter.SEPARATOR));
	}

	@Test
	public void treeChannelDisabledByDefault() throws Exception {
		Cli cli = new Cli();
		cli.parse(new String[] { "prog.txt" });
		assertFalse(cli.getSettings().isTreeEnabled());
		assertEquals("prog.txt", cli.getScriptFile());
	}

	@Test
	public void defaultScriptFile() {
		Cli cli = new Cli();
		cli.parse(new String[0]);
		assertEquals(Cli.DEFAULT_SCRIPT_FILE, cli.getScriptFile());
		assertEquals(SymbolStore.DEFAULT_CAPACITY, cli.getSettings().getStoreCapacity());
	}

	@Test
	public void usage() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Cli cli = Cli.create(new String[] { "-h" }, new PrintStream(out, true, "UTF-8"), System.err);
		assertEquals(0, cli.getExitCode());
		assertTrue(out.toString("UTF-8").startsWith("Usage:"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownOption() {
		new Cli().parse(new String[] { "-x" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void missingOptionValue() {
		new Cli().parse(new String[] { "-o" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalidCapacity() {
		new Cli().parse(new String[] { "--capacity", "zero" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void nonPositiveCapacity() {
		new Cli().parse(new String[] { "--capacity", "0" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void tooManyArguments() {
		new Cli().parse(new String[] { "a.txt", "b.txt" });
	}

	@Test(expected = IOException.class)
	public void missingScriptFile() throws Exception {
		Cli cli = new Cli();
		cli.parse(new String[] { new File(tmp.getRoot(), "absent.txt").getPath() });
		cli.run();
	}

	private static String read(File file) throws IOException {
		return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
	}

	@Test
	public void longExpressionRunsAndDumps() throws Exception {
		StringBuilder chain = new StringBuilder("1");
		for (int i = 1; i < 3000; i++) {
			chain.append(" * 1");
		}
		String program = "print(" + chain + ");";
		cliTest("long product")
				.script(program)
				.expectLines("Print: 1")
				.runAndAssert(tmp.getRoot().toPath());
		String dump = cliTest("long product, tree only")
				.argument("--dump-syntax")
				.script(program)
				.runAndAssert(tmp.getRoot().toPath());
		assertTrue(dump.startsWith("\nprint\n"));
		assertTrue(dump.endsWith(TreePrinter.SEPARATOR));
	}
}
