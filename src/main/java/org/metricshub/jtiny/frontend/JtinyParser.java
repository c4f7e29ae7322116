package org.metricshub.jtiny.frontend;

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

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import org.metricshub.jtiny.ast.Node;
import org.metricshub.jtiny.frontend.ast.ParserException;
import org.metricshub.jtiny.jrt.FaultReporter;
import org.metricshub.jtiny.util.JtinyLogger;
import org.metricshub.jtiny.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Recognizes the Jtiny grammar and reports each completed production to a
 * {@link ProductionHandler}, which builds the syntax tree.
 * <p>
 * The parser itself never evaluates anything and keeps no tree of its own.
 * An <code>else</code> always belongs to the nearest <code>if</code> that
 * has not been closed yet: a nested <code>if</code> consumes its own
 * <code>else</code> and <code>end</code> before its enclosing block resumes.
 */
public class JtinyParser {

	private static final Logger LOG = JtinyLogger.getLogger(JtinyParser.class);

	private final ProductionHandler handler;

	private Lexer lexer;
	private Token token;
	private int productions;

	/**
	 * Creates a parser building the standard syntax tree.
	 */
	public JtinyParser() {
		this(new TreeBuilder());
	}

	/**
	 * @param handler receiver of the recognized productions
	 */
	public JtinyParser(ProductionHandler handler) {
		this.handler = handler;
	}

	/**
	 * Parse the script streamed by the source. Build and return the
	 * root of the abstract syntax tree which represents the program.
	 *
	 * @param source the script to parse
	 * @return the root statement list, {@code null} for an empty program
	 * @throws IOException upon an IO error
	 * @throws ParserException when the script does not match the grammar, or
	 *         nests deeper than the call stack allows
	 * @throws org.metricshub.jtiny.frontend.ast.LexerException when the script
	 *         contains an invalid token
	 */
	public Node parse(ScriptSource source) throws IOException {
		start(source);
		Node root;
		try {
			root = PROGRAM();
		} catch (StackOverflowError e) {
			throw tooDeeplyNested();
		}
		LOG.debug("Parsed {}: {} productions, {} variables", source, productions, lexer.identifiers().size());
		return root;
	}

	/**
	 * Parse a single expression and return the corresponding tree.
	 *
	 * @param source The expression to parse (not a statement, just an expression)
	 * @return the root of the expression tree
	 * @throws IOException upon an IO error
	 */
	public Node parseExpression(ScriptSource source) throws IOException {
		start(source);
		Node expr;
		try {
			expr = EXPRESSION(null);
		} catch (StackOverflowError e) {
			throw tooDeeplyNested();
		}
		lexer(Token.EOF);
		return expr;
	}

	/**
	 * @return the identifiers of the last parsed script, mapped to their
	 *         variable id, in order of first appearance
	 */
	public Map<String, Integer> getIdentifiers() {
		return lexer == null ? Collections.<String, Integer>emptyMap() : lexer.identifiers();
	}

	private void start(ScriptSource source) throws IOException {
		if (source == null) {
			throw new IOException("No script source supplied");
		}
		lexer = new Lexer(source.getReader(), source.getDescription());
		productions = 0;
		lexer();
	}

	private Token lexer(Token expectedToken) throws IOException {
		if (token != expectedToken) {
			throw parserException("Expecting " + expectedToken.name() + ". Found: " + describe());
		}
		return lexer();
	}

	private Token lexer() throws IOException {
		token = lexer.lexer();
		return token;
	}

	private String describe() {
		return token == Token.EOF ? token.name() : token.name() + " (" + lexer.text() + ")";
	}

	private Node reduced(Node node) {
		productions++;
		return node;
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : STATEMENT_LIST EOF
	Node PROGRAM() throws IOException {
		Node statements = STATEMENT_LIST();
		lexer(Token.EOF);
		return reduced(handler.program(statements));
	}

	// STATEMENT_LIST : { STATEMENT }
	// ends before else, end or EOF, which belong to the enclosing construct
	Node STATEMENT_LIST() throws IOException {
		Node list = reduced(handler.emptyList());
		while (token != Token.EOF && token != Token.KW_ELSE && token != Token.KW_END) {
			Node stmt = STATEMENT();
			list = reduced(handler.appendStatement(list, stmt));
		}
		return list;
	}

	// STATEMENT :
	// DECLARATION
	// | PRINT_STATEMENT
	// | IF_STATEMENT
	// | ID = EXPRESSION ;
	// | EXPRESSION ;
	Node STATEMENT() throws IOException {
		if (token == Token.KW_INT) {
			return DECLARATION();
		} else if (token == Token.KW_PRINT) {
			return PRINT_STATEMENT();
		} else if (token == Token.KW_IF) {
			return IF_STATEMENT();
		}
		int line = lexer.tokenLine();
		Node first = null;
		if (token == Token.ID) {
			// either an assignment or an expression starting with a variable
			int id = lexer.identifierId();
			lexer();
			if (token == Token.EQUALS) {
				lexer();
				Node value = EXPRESSION(null);
				lexer(Token.SEMICOLON);
				return reduced(handler.assignment(id, value, line));
			}
			first = reduced(handler.variable(id, line));
		}
		Node expr = EXPRESSION(first);
		lexer(Token.SEMICOLON);
		return reduced(handler.expressionStatement(expr, line));
	}

	// DECLARATION : int ID = EXPRESSION ;
	Node DECLARATION() throws IOException {
		int line = lexer.tokenLine();
		lexer(Token.KW_INT);
		if (token != Token.ID) {
			throw parserException("Expecting variable name. Found: " + describe());
		}
		int id = lexer.identifierId();
		lexer();
		lexer(Token.EQUALS);
		Node value = EXPRESSION(null);
		lexer(Token.SEMICOLON);
		return reduced(handler.declaration(id, value, line));
	}

	// PRINT_STATEMENT : print ( EXPRESSION ) ;
	Node PRINT_STATEMENT() throws IOException {
		int line = lexer.tokenLine();
		lexer(Token.KW_PRINT);
		lexer(Token.OPEN_PAREN);
		Node value = EXPRESSION(null);
		lexer(Token.CLOSE_PAREN);
		lexer(Token.SEMICOLON);
		return reduced(handler.print(value, line));
	}

	// IF_STATEMENT : if ( CONDITION ) : STATEMENT_LIST [ else : STATEMENT_LIST ] end
	Node IF_STATEMENT() throws IOException {
		int line = lexer.tokenLine();
		lexer(Token.KW_IF);
		lexer(Token.OPEN_PAREN);
		Node condition = CONDITION();
		lexer(Token.CLOSE_PAREN);
		lexer(Token.COLON);
		Node thenBlock = STATEMENT_LIST();
		if (token == Token.KW_ELSE) {
			lexer();
			lexer(Token.COLON);
			Node elseBlock = STATEMENT_LIST();
			lexer(Token.KW_END);
			return reduced(handler.ifElse(condition, thenBlock, elseBlock, line));
		}
		lexer(Token.KW_END);
		return reduced(handler.ifThen(condition, thenBlock, line));
	}

	// CONDITION : EXPRESSION (==|!=|<|<=|>|>=) EXPRESSION
	Node CONDITION() throws IOException {
		Node left = EXPRESSION(null);
		if (!token.isComparison()) {
			throw parserException("Expecting comparison operator. Found: " + describe());
		}
		int line = lexer.tokenLine();
		String symbol = lexer.text();
		lexer();
		Node right = EXPRESSION(null);
		return reduced(handler.condition(symbol, left, right, line));
	}

	// EXPRESSION : TERM [ (+|-) TERM ]...
	// first, when not null, is the already reduced leading variable of the expression
	Node EXPRESSION(Node first) throws IOException {
		Node term = TERM(first);
		while (token == Token.PLUS || token == Token.MINUS) {
			int line = lexer.tokenLine();
			String symbol = lexer.text();
			lexer();
			Node nextTerm = TERM(null);

			// Build the tree in left-associative manner
			term = reduced(handler.binary(symbol, term, nextTerm, line));
		}
		return term;
	}

	// TERM : FACTOR [ (*|/) FACTOR ]...
	Node TERM(Node first) throws IOException {
		Node factor = first != null ? first : FACTOR();
		while (token == Token.MULT || token == Token.DIVIDE) {
			int line = lexer.tokenLine();
			String symbol = lexer.text();
			lexer();
			Node nextFactor = FACTOR();

			// Build the tree in left-associative manner
			factor = reduced(handler.binary(symbol, factor, nextFactor, line));
		}
		return factor;
	}

	// FACTOR : INTEGER | ID | ( EXPRESSION )
	Node FACTOR() throws IOException {
		int line = lexer.tokenLine();
		if (token == Token.INTEGER) {
			int value = lexer.integerValue();
			lexer();
			return reduced(handler.integerLiteral(value, line));
		} else if (token == Token.ID) {
			int id = lexer.identifierId();
			lexer();
			return reduced(handler.variable(id, line));
		} else if (token == Token.OPEN_PAREN) {
			lexer();
			// parentheses only group, they produce no node
			Node expr = EXPRESSION(null);
			lexer(Token.CLOSE_PAREN);
			return expr;
		}
		throw parserException("Expecting expression. Found: " + describe());
	}
	// CHECKSTYLE.ON: MethodName

	// nesting (parentheses, nested ifs) is bounded by the call stack
	private ParserException tooDeeplyNested() {
		LOG.debug("Call stack exhausted at line {}", lexer.tokenLine());
		return parserException(FaultReporter.TOO_DEEPLY_NESTED);
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, lexer.sourceDescription(), lexer.tokenLine());
	}
}
