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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import org.metricshub.jtiny.ast.Node;
import org.metricshub.jtiny.ast.TreePrinter;
import org.metricshub.jtiny.backend.Evaluator;
import org.metricshub.jtiny.frontend.JtinyParser;
import org.metricshub.jtiny.frontend.ast.LexerException;
import org.metricshub.jtiny.frontend.ast.ParserException;
import org.metricshub.jtiny.jrt.FaultReporter;
import org.metricshub.jtiny.jrt.RuntimeOutput;
import org.metricshub.jtiny.jrt.SymbolStore;
import org.metricshub.jtiny.util.JtinyLogger;
import org.metricshub.jtiny.util.JtinySettings;
import org.metricshub.jtiny.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of a Jtiny program.
 * This entry point is used both when Jtiny is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to execute a Jtiny program is as follows:
 * <ul>
 * <li>Parse the whole program, producing an abstract syntax tree.
 * Nothing runs while parsing.
 * <li>Walk the completed tree once, top to bottom, executing each statement
 * against a fresh symbol store.
 * </ul>
 * A program that cannot be parsed does not run at all: the syntax fault is
 * reported on the fault channel and no statement executes.
 *
 * @see org.metricshub.jtiny.backend.Evaluator
 */
public class Jtiny {

	private static final Logger LOG = JtinyLogger.getLogger(Jtiny.class);

	/**
	 * The last parsed {@link Node} produced during compilation.
	 */
	private Node lastAst;

	private Map<String, Integer> lastIdentifiers = Collections.emptyMap();

	/**
	 * Returns the last parsed AST produced by {@link #compile(ScriptSource)}.
	 *
	 * @return the last root, or {@code null} if no compilation occurred or the
	 *         program was empty
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Node getLastAst() {
		return lastAst;
	}

	/**
	 * @return the variable names of the last compiled program, mapped to their id
	 */
	public Map<String, Integer> getLastIdentifiers() {
		return lastIdentifiers;
	}

	/**
	 * Parses a program without executing it. The source is left open, it
	 * belongs to the caller.
	 *
	 * @param script the program
	 * @return the root statement list, {@code null} for an empty program
	 * @throws IOException upon an IO error
	 * @throws LexerException when the program contains an invalid token
	 * @throws ParserException when the program does not match the grammar, or
	 *         nests deeper than the call stack allows
	 */
	public Node compile(ScriptSource script) throws IOException {
		JtinyParser parser = new JtinyParser();
		lastAst = parser.parse(script);
		lastIdentifiers = parser.getIdentifiers();
		return lastAst;
	}

	/**
	 * Parses an in-memory program without executing it.
	 *
	 * @param script the program text
	 * @return the root statement list, {@code null} for an empty program
	 * @throws IOException upon an IO error
	 */
	public Node compile(String script) throws IOException {
		try (ScriptSource source = ScriptSource.of(script)) {
			return compile(source);
		}
	}

	/**
	 * Compiles then executes the program, writing to the channels of the
	 * settings.
	 *
	 * @param script the program
	 * @param settings channels and store capacity
	 * @return {@code true} if the program was executed, {@code false} if it
	 *         could not be parsed
	 * @throws IOException upon an IO error while reading the program
	 */
	public boolean invoke(ScriptSource script, JtinySettings settings) throws IOException {
		return invoke(script, settings, new FaultReporter(settings.getErrorStream()));
	}

	/**
	 * Compiles then executes an in-memory program.
	 *
	 * @param script the program text
	 * @param settings channels and store capacity
	 * @return {@code true} if the program was executed, {@code false} if it
	 *         could not be parsed
	 * @throws IOException upon an IO error
	 */
	public boolean invoke(String script, JtinySettings settings) throws IOException {
		try (ScriptSource source = ScriptSource.of(script)) {
			return invoke(source, settings);
		}
	}

	/**
	 * Executes an already compiled program.
	 *
	 * @param program the root statement list
	 * @param settings channels and store capacity
	 * @return the number of faults reported while executing
	 */
	public int invoke(Node program, JtinySettings settings) {
		Evaluator evaluator = createEvaluator(settings, new FaultReporter(settings.getErrorStream()));
		evaluator.interpret(program);
		return evaluator.getFaultCount();
	}

	private boolean invoke(ScriptSource script, JtinySettings settings, FaultReporter faults) throws IOException {
		Node program;
		try {
			program = compile(script);
		} catch (LexerException | ParserException e) {
			LOG.debug("Not executing {}: {}", script, e.getMessage());
			faults.report("syntax error, " + e.getMessage(), e.getLineNumber());
			return false;
		}
		createEvaluator(settings, faults).interpret(program);
		return true;
	}

	/**
	 * Creates the interpreter of one run. A new symbol store is allocated for
	 * every run.
	 *
	 * @param settings channels and store capacity
	 * @param faults the fault channel
	 * @return a new evaluator
	 */
	protected Evaluator createEvaluator(JtinySettings settings, FaultReporter faults) {
		return new Evaluator(
				new SymbolStore(settings.getStoreCapacity()),
				new RuntimeOutput(settings.getOutputStream()),
				faults,
				settings.isTreeEnabled() ? new TreePrinter(settings.getTreeStream()) : null);
	}

	/**
	 * Executes the specified program and captures the three channels.
	 *
	 * @param script the program text
	 * @return the captured runtime output, tree diagrams and faults
	 * @throws IOException upon an IO error
	 */
	public ExecutionResult run(String script) throws IOException {
		return run(script, new JtinySettings());
	}

	/**
	 * Executes the specified program and captures the three channels. The
	 * streams of {@code settings} are ignored, only its other parameters are
	 * used.
	 *
	 * @param script the program text
	 * @param template store capacity to use
	 * @return the captured runtime output, tree diagrams and faults
	 * @throws IOException upon an IO error
	 */
	public ExecutionResult run(String script, JtinySettings template) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream tree = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		try (ScriptSource source = ScriptSource.of(script);
				PrintStream outPs = newPrintStream(out);
				PrintStream treePs = newPrintStream(tree);
				PrintStream errPs = newPrintStream(err)) {
			JtinySettings settings = new JtinySettings();
			settings.setStoreCapacity(template.getStoreCapacity());
			settings.setOutputStream(outPs);
			settings.setTreeStream(treePs);
			settings.setErrorStream(errPs);
			FaultReporter faults = new FaultReporter(errPs);
			boolean executed = invoke(source, settings, faults);
			outPs.flush();
			treePs.flush();
			errPs.flush();
			return new ExecutionResult(
					out.toString(StandardCharsets.UTF_8.name()),
					tree.toString(StandardCharsets.UTF_8.name()),
					err.toString(StandardCharsets.UTF_8.name()),
					executed,
					faults.getFaultCount());
		}
	}

	private static PrintStream newPrintStream(ByteArrayOutputStream os) throws UnsupportedEncodingException {
		return new PrintStream(os, false, StandardCharsets.UTF_8.name());
	}
}
