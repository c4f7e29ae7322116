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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.metricshub.jtiny.ast.Node;
import org.metricshub.jtiny.ast.TreePrinter;
import org.metricshub.jtiny.frontend.ast.LexerException;
import org.metricshub.jtiny.frontend.ast.ParserException;
import org.metricshub.jtiny.jrt.FaultReporter;
import org.metricshub.jtiny.jrt.SymbolStore;
import org.metricshub.jtiny.util.JtinyLogger;
import org.metricshub.jtiny.util.JtinySettings;
import org.metricshub.jtiny.util.ScriptFileSource;
import org.metricshub.jtiny.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Jtiny.
 */
public final class Cli {

	private static final Logger LOG = JtinyLogger.getLogger(Cli.class);

	/**
	 * Script read when none is named on the command line.
	 */
	public static final String DEFAULT_SCRIPT_FILE = "in.txt";

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jtiny.jar";
		}
		JAR_NAME = myName;
	}

	private final JtinySettings settings = new JtinySettings();
	private final PrintStream out;
	private final PrintStream err;

	private String scriptFile = DEFAULT_SCRIPT_FILE;
	private String outputFile;
	private String treeFile;
	private String errorFile;
	private boolean dumpSyntaxTree;
	private boolean printUsage;
	private int exitCode;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out where runtime output goes unless <code>-o</code> is given
	 * @param err where faults go unless <code>-e</code> is given
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link JtinySettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JtinySettings getSettings() {
		return settings;
	}

	public String getScriptFile() {
		return scriptFile;
	}

	/**
	 * @return 0 after the program ran, 1 if it could not be parsed
	 */
	public int getExitCode() {
		return exitCode;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException on an unknown or incomplete option
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				break;
			} else if (arg.equals("-o")) {
				checkParameterHasArgument(args, argIdx);
				outputFile = args[++argIdx];
			} else if (arg.equals("-t")) {
				checkParameterHasArgument(args, argIdx);
				treeFile = args[++argIdx];
			} else if (arg.equals("-e")) {
				checkParameterHasArgument(args, argIdx);
				errorFile = args[++argIdx];
			} else if (arg.equals("--capacity")) {
				checkParameterHasArgument(args, argIdx);
				settings.setStoreCapacity(parseCapacity(args[++argIdx]));
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx < args.length) {
			scriptFile = args[argIdx++];
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parseCapacity(String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid store capacity: " + value, e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException when the script cannot be read or an output file
	 *         cannot be created
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			exitCode = 0;
			return;
		}
		try (ScriptSource script = new ScriptFileSource(scriptFile)) {
			if (dumpSyntaxTree) {
				dumpSyntaxTree(script);
			} else {
				execute(script);
			}
		}
	}

	private void dumpSyntaxTree(ScriptSource script) throws IOException {
		FaultReporter faults = new FaultReporter(err);
		Node ast;
		try {
			ast = new Jtiny().compile(script);
		} catch (LexerException | ParserException e) {
			faults.report("syntax error, " + e.getMessage(), e.getLineNumber());
			exitCode = 1;
			return;
		}
		try {
			new TreePrinter(out).print(ast);
		} catch (StackOverflowError e) {
			faults.report(FaultReporter.TOO_DEEPLY_NESTED, ast.getLineNumber());
			exitCode = 1;
			return;
		}
		exitCode = 0;
	}

	private void execute(ScriptSource script) throws IOException {
		try (PrintStream outStream = open(outputFile);
				PrintStream treeStream = open(treeFile);
				PrintStream errStream = open(errorFile)) {
			if (outStream != null) {
				settings.setOutputStream(outStream);
			}
			if (treeStream != null) {
				settings.setTreeStream(treeStream);
			}
			if (errStream != null) {
				settings.setErrorStream(errStream);
			}
			LOG.debug("Running {} with {}", script, settings.toDescriptionString());
			exitCode = new Jtiny().invoke(script, settings) ? 0 : 1;
		}
	}

	private static PrintStream open(String path) throws IOException {
		if (path == null) {
			return null;
		}
		return new PrintStream(new FileOutputStream(path), false, StandardCharsets.UTF_8.name());
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-o output-filename]" +
								" [-t tree-filename]" +
								" [-e error-filename]" +
								" [--capacity N]" +
								" [--dump-syntax]" +
								" [script-filename]");
		dest.println();
		dest.println(" script-filename = Program to run, " + DEFAULT_SCRIPT_FILE + " if omitted.");
		dest.println(" -o filename = Write runtime output to filename instead of stdout.");
		dest.println(" -t filename = Draw the tree of each executed statement to filename.");
		dest.println(" -e filename = Write faults to filename instead of stderr.");
		dest.println(" --capacity N = Number of variable slots (default " + SymbolStore.DEFAULT_CAPACITY + ").");
		dest.println(" --dump-syntax = Print the syntax tree and do not execute.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for runtime output
	 * @param es error stream for faults
	 * @return configured and executed CLI instance
	 * @throws IOException if the script cannot be read
	 */
	public static Cli create(String[] args, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		int code;
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
			code = cli.getExitCode();
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.println(e.getMessage());
			code = 1;
		} catch (IOException e) {
			LOG.error("Cannot run the program", e);
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			code = 1;
		}
		System.exit(code);
	}
}
