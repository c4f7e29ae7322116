package org.metricshub.jtiny.frontend.ast;

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

import org.metricshub.jtiny.jrt.JtinyRuntimeException;

/**
 * Raised when the token sequence does not match any production of the
 * grammar.
 */
public class ParserException extends JtinyRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;

	/**
	 * @param msg what was expected and what was found
	 * @param sourceDescription description of the script being parsed
	 * @param lineNo line of the offending token
	 */
	public ParserException(String msg, String sourceDescription, int lineNo) {
		super(lineNo, msg);
		this.sourceDescription = sourceDescription;
	}

	/**
	 * @return description of the script being parsed
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}
}
