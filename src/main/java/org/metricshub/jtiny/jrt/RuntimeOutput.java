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
 * The runtime-output channel: one line per executed declaration,
 * assignment or print, in execution order.
 */
public class RuntimeOutput {

	private static final Logger LOG = JtinyLogger.getLogger(RuntimeOutput.class);

	private final PrintStream out;

	/**
	 * @param out destination of the events
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public RuntimeOutput(PrintStream out) {
		this.out = out;
	}

	/**
	 * @param id id of the declared variable
	 * @param value its initial value
	 */
	public void declared(int id, int value) {
		emit("Declared var[" + id + "] = " + value);
	}

	/**
	 * @param id id of the assigned variable
	 * @param value its new value
	 */
	public void assigned(int id, int value) {
		emit("Assigned var[" + id + "] = " + value);
	}

	/**
	 * @param value the printed value
	 */
	public void print(int value) {
		emit("Print: " + value);
	}

	private void emit(String line) {
		LOG.trace("{}", line);
		// always \n, whatever the platform
		out.print(line);
		out.print('\n');
	}
}
