package org.metricshub.jtiny.util;

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
import org.metricshub.jtiny.jrt.SymbolStore;

/**
 * A simple container for the parameters of a single Jtiny invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jtiny programmatically, from within Java code.
 */
public class JtinySettings {

	/**
	 * Where the runtime events (declarations, assignments, prints) are written.
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Where the syntax tree of each executed statement is drawn.
	 * <code>null</code> by default, which disables the diagnostic tree.
	 */
	private PrintStream treeStream = null;

	/**
	 * Where faults are reported.
	 * <code>System.err</code> by default.
	 */
	private PrintStream errorStream = System.err;

	/**
	 * Number of slots of the symbol store.
	 */
	private int storeCapacity = SymbolStore.DEFAULT_CAPACITY;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("storeCapacity = ").append(getStoreCapacity()).append(newLine);
		desc.append("treeEnabled = ").append(isTreeEnabled()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the stream receiving the runtime events
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream the stream receiving the runtime events
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	/**
	 * @return the stream receiving the tree diagrams, or {@code null} when disabled
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getTreeStream() {
		return treeStream;
	}

	/**
	 * @param treeStream the stream receiving the tree diagrams, {@code null} to disable them
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setTreeStream(PrintStream treeStream) {
		this.treeStream = treeStream;
	}

	/**
	 * @return whether a tree diagram is drawn before each executed statement
	 */
	public boolean isTreeEnabled() {
		return treeStream != null;
	}

	/**
	 * @return the stream receiving the fault reports
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	/**
	 * @param errorStream the stream receiving the fault reports
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setErrorStream(PrintStream errorStream) {
		this.errorStream = errorStream;
	}

	/**
	 * @return the number of variable slots
	 */
	public int getStoreCapacity() {
		return storeCapacity;
	}

	/**
	 * @param storeCapacity the number of variable slots, must be positive
	 */
	public void setStoreCapacity(int storeCapacity) {
		if (storeCapacity <= 0) {
			throw new IllegalArgumentException("Store capacity must be positive: " + storeCapacity);
		}
		this.storeCapacity = storeCapacity;
	}
}
