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

import java.util.Arrays;

/**
 * Global variable slots of a Jtiny program.
 * <p>
 * Variables are addressed by the small integer id the lexer assigned to
 * their name. Every slot holds 0 until a declaration or an assignment
 * stores something else in it.
 */
public class SymbolStore {

	/** Number of slots when no capacity is configured. */
	public static final int DEFAULT_CAPACITY = 256;

	private final int[] globals;

	/**
	 * Creates a store with {@link #DEFAULT_CAPACITY} slots.
	 */
	public SymbolStore() {
		this(DEFAULT_CAPACITY);
	}

	/**
	 * @param capacity number of slots, must be positive
	 */
	public SymbolStore(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("Store capacity must be positive: " + capacity);
		}
		globals = new int[capacity];
	}

	/**
	 * @return the number of slots
	 */
	public int capacity() {
		return globals.length;
	}

	/**
	 * @param id a variable id
	 * @return whether {@code id} addresses a slot of this store
	 */
	public boolean contains(int id) {
		return id >= 0 && id < globals.length;
	}

	/**
	 * @param id a variable id within capacity
	 * @return the current value of the variable, 0 if never stored
	 */
	public int get(int id) {
		checkId(id);
		return globals[id];
	}

	/**
	 * @param id a variable id within capacity
	 * @param value the new value of the variable
	 */
	public void set(int id, int value) {
		checkId(id);
		globals[id] = value;
	}

	/**
	 * Restores every slot to 0.
	 */
	public void reset() {
		Arrays.fill(globals, 0);
	}

	private void checkId(int id) {
		if (!contains(id)) {
			throw new IndexOutOfBoundsException("Variable id " + id + " outside of store capacity " + globals.length);
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("SymbolStore{");
		boolean first = true;
		for (int i = 0; i < globals.length; i++) {
			if (globals[i] != 0) {
				if (!first) {
					sb.append(", ");
				}
				sb.append(i).append('=').append(globals[i]);
				first = false;
			}
		}
		return sb.append('}').toString();
	}
}
