package org.metricshub.jtiny.jrt;

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
import java.io.PrintStream;
import org.metricshub.jtiny.util.JtinyLogger;
import org.slf4j.Logger;

/**
 * The fault channel. Each reported fault becomes one
 * <code>Error: &lt;message&gt; at line &lt;line&gt;</code> line.
 * <p>
 * The reporter also counts the faults, so that callers can tell whether a
 * run produced values that should not be trusted (a division by zero
 * evaluates to 0).
 */
public class FaultReporter {

	private static final Logger LOG = JtinyLogger.getLogger(FaultReporter.class);

	/** Reported when a program nests deeper than the call stack allows. */
	public static final String TOO_DEEPLY_NESTED = "program too deeply nested";

	private final PrintStream err;
	private int faultCount;

	/**
	 * @param err destination of the fault lines
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public FaultReporter(PrintStream err) {
		this.err = err;
	}

	/**
	 * Reports a fault.
	 *
	 * @param message description of the fault
	 * @param lineNumber source line associated with the fault
	 */
	public void report(String message, int lineNumber) {
		faultCount++;
		LOG.debug("Fault #{} at line {}: {}", faultCount, lineNumber, message);
		err.print("Error: " + message + " at line " + lineNumber);
		err.print('\n');
	}

	/**
	 * Reports a fault carried by an exception.
	 *
	 * @param e the exception describing the fault
	 */
	public void report(JtinyRuntimeException e) {
		report(e.getMessage(), e.getLineNumber());
	}

	/**
	 * @return the number of faults reported so far
	 */
	public int getFaultCount() {
		return faultCount;
	}
}
