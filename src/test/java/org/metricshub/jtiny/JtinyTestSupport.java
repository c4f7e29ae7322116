package org.metricshub.jtiny;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.jtiny.util.JtinySettings;

/**
 * Reusable helpers for building and executing Jtiny tests. The class exposes
 * fluent builders ({@link #jtinyTest(String)} and {@link #cliTest(String)})
 * that let tests describe their programs and expectations declaratively
 * before executing or asserting the results.
 */
public final class JtinyTestSupport {

	private JtinyTestSupport() {}

	/**
	 * Creates a builder for a test that runs a program through the
	 * {@link Jtiny} API.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static JtinyTestBuilder jtinyTest(String description) {
		return new JtinyTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that runs a program file through the
	 * {@link Cli} entry point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	static List<String> normalizeLines(String text) {
		if (text.isEmpty()) {
			return Collections.emptyList();
		}
		String normalized = text.replace("\r\n", "\n");
		if (normalized.endsWith("\n")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return Arrays.asList(normalized.split("\n", -1));
	}

	/**
	 * Shared expectations of both builders.
	 *
	 * @param <B> the builder type used for fluent chaining
	 */
	private abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected String script = "";
		protected List<String> expectedLines;
		protected List<String> expectedErrors = Collections.emptyList();

		BaseTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * @param scriptLines the program, one element per source line
		 * @return this builder for method chaining
		 */
		@SuppressWarnings("unchecked")
		public B script(String... scriptLines) {
			this.script = String.join("\n", scriptLines) + "\n";
			return (B) this;
		}

		/**
		 * @param lines the runtime output expected, in order
		 * @return this builder for method chaining
		 */
		@SuppressWarnings("unchecked")
		public B expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return (B) this;
		}

		/**
		 * @param errors the fault lines expected, in order; none when not called
		 * @return this builder for method chaining
		 */
		@SuppressWarnings("unchecked")
		public B expectErrors(String... errors) {
			this.expectedErrors = Arrays.asList(errors);
			return (B) this;
		}

		void assertChannels(String output, String errors) {
			if (expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectedLines, normalizeLines(output));
			}
			assertEquals("Unexpected errors for " + description, expectedErrors, normalizeLines(errors));
		}
	}

	/**
	 * Fluent builder for tests that execute {@link Jtiny#run(String, JtinySettings)}.
	 */
	public static final class JtinyTestBuilder extends BaseTestBuilder<JtinyTestBuilder> {
		private final JtinySettings settings = new JtinySettings();
		private boolean expectExecuted = true;

		private JtinyTestBuilder(String description) {
			super(description);
		}

		/**
		 * @param capacity number of variable slots of the store
		 * @return this builder for method chaining
		 */
		public JtinyTestBuilder capacity(int capacity) {
			settings.setStoreCapacity(capacity);
			return this;
		}

		/**
		 * Expects the program to be rejected before anything runs.
		 *
		 * @return this builder for method chaining
		 */
		public JtinyTestBuilder expectNotExecuted() {
			this.expectExecuted = false;
			return this;
		}

		/**
		 * Executes the program without asserting anything.
		 *
		 * @return what the run wrote on each channel
		 * @throws IOException upon an IO error
		 */
		public ExecutionResult run() throws IOException {
			return new Jtiny().run(script, settings);
		}

		/**
		 * Executes the program and asserts the configured expectations.
		 *
		 * @return what the run wrote on each channel, for further assertions
		 * @throws IOException upon an IO error
		 */
		public ExecutionResult runAndAssert() throws IOException {
			ExecutionResult result = run();
			assertChannels(result.getOutput(), result.getErrors());
			assertEquals("Unexpected execution for " + description, expectExecuted, result.isExecuted());
			assertEquals("Unexpected fault count for " + description, expectedErrors.size(), result.getFaultCount());
			return result;
		}
	}

	/**
	 * Fluent builder for tests that execute the {@link Cli}. The program is
	 * written to a temporary file which is passed as the script argument.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<String>();
		private int expectedExitCode;

		private CliTestBuilder(String description) {
			super(description);
		}

		/**
		 * @param args options placed before the script file name
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * @param code the exit code expected, 0 when not called
		 * @return this builder for method chaining
		 */
		public CliTestBuilder expectExitCode(int code) {
			this.expectedExitCode = code;
			return this;
		}

		/**
		 * Writes the program, runs the CLI on it and asserts the expectations.
		 *
		 * @param directory where the program file is created
		 * @return the captured standard output
		 * @throws IOException upon an IO error
		 */
		public String runAndAssert(Path directory) throws IOException {
			Path scriptFile = Files.createTempFile(directory, "jtiny", ".txt");
			Files.write(scriptFile, script.getBytes(StandardCharsets.UTF_8));
			List<String> args = new ArrayList<String>(arguments);
			args.add(scriptFile.toString());

			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			Cli cli;
			try (PrintStream outPs = new PrintStream(out, true, StandardCharsets.UTF_8.name());
					PrintStream errPs = new PrintStream(err, true, StandardCharsets.UTF_8.name())) {
				cli = Cli.create(args.toArray(new String[0]), outPs, errPs);
			}
			String output = new String(out.toByteArray(), StandardCharsets.UTF_8);
			assertChannels(output, new String(err.toByteArray(), StandardCharsets.UTF_8));
			assertEquals("Unexpected exit code for " + description, expectedExitCode, cli.getExitCode());
			return output;
		}
	}
}
