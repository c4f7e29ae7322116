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

/**
 * Raised while executing a statement whose tree cannot be given a meaning:
 * a declaration or assignment target that is not a variable, a variable id
 * outside the symbol store, or a statement node in expression position.
 * <p>
 * The statement that raised it is abandoned; execution continues with the
 * next one.
 */
public class SemanticException extends JtinyRuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param lineno source line of the offending construct
	 * @param msg description of the fault
	 */
	public SemanticException(int lineno, String msg) {
		super(lineno, msg);
	}
}
