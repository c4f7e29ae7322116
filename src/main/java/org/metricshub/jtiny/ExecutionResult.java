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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * What a run of {@link Jtiny#run(String)} wrote on each channel.
 */
public final class ExecutionResult {

	private final String output;
	private final String tree;
	private final String errors;
	private final boolean executed;
	private final int faultCount;

	ExecutionResult(String output, String tree, String errors, boolean executed, int faultCount) {
		this.output = output;
		this.tree = tree;
		this.errors = errors;
		this.executed = executed;
		this.faultCount = faultCount;
	}

	/**
	 * @return the runtime events, one per line
	 */
	public String getOutput() {
		return output;
	}

	/**
	 * @return the tree diagrams of the executed statements
	 */
	public String getTree() {
		return tree;
	}

	/**
	 * @return the fault lines
	 */
	public String getErrors() {
		return errors;
	}

	/**
	 * @return {@code false} if the program could not be parsed and nothing ran
	 */
	public boolean isExecuted() {
		return executed;
	}

	/**
	 * A non-zero count means some values may not be trusted, for instance a
	 * division by zero that evaluated to 0.
	 *
	 * @return the number of faults reported, syntax faults included
	 */
	public int getFaultCount() {
		return faultCount;
	}

	/**
	 * @return the runtime events split into lines
	 */
	public List<String> getOutputLines() {
		return lines(output);
	}

	/**
	 * @return the fault lines split into lines
	 */
	public List<String> getErrorLines() {
		return lines(errors);
	}

	private static List<String> lines(String text) {
		if (text.isEmpty()) {
			return Collections.emptyList();
		}
		String normalized = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
		return Arrays.asList(normalized.split("\n", -1));
	}
}
