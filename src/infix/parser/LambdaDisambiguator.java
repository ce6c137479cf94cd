package infix.parser;

import infix.model.OperatorTable;
import infix.model.token.FormToken;
import infix.model.token.SymbolToken;
import infix.model.token.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * Recognises {@code params => body} before an expression is compiled. The parameters
 * are a single identifier or a parenthesised list of identifiers, none of which may be
 * an operator or the arrow itself, and the body must not be empty.
 *
 */
public class LambdaDisambiguator {

	private final OperatorTable table;

	public LambdaDisambiguator(OperatorTable table) {
		this.table = table;
	}

	public boolean matches(List<Token> tokens) {
		return tokens.size() >= 3 && isArrow(tokens.get(1)) && isParameterList(tokens.get(0));
	}

	/**
	 * @param tokens a token sequence for which {@link #matches(List)} holds
	 */
	public List<SymbolToken> getParameters(List<Token> tokens) {
		Token first = tokens.get(0);
		if (first instanceof SymbolToken) {
			return Collections.singletonList((SymbolToken) first);
		}
		List<SymbolToken> parameters = new ArrayList<>();
		for (Token element : ((FormToken) first).getElements()) {
			parameters.add((SymbolToken) element);
		}
		return parameters;
	}

	/**
	 * @param tokens a token sequence for which {@link #matches(List)} holds
	 */
	public List<Token> getBody(List<Token> tokens) {
		return tokens.subList(2, tokens.size());
	}

	private boolean isArrow(Token token) {
		return token instanceof SymbolToken && table.isLambdaArrow(((SymbolToken) token).getName());
	}

	private boolean isParameter(Token token) {
		if (!(token instanceof SymbolToken)) {
			return false;
		}
		String name = ((SymbolToken) token).getName();
		return !table.isOperator(name) && !table.isLambdaArrow(name);
	}

	private boolean isParameterList(Token token) {
		if (isParameter(token)) {
			return true;
		}
		if (!(token instanceof FormToken) || !((FormToken) token).isParenthesised()) {
			return false;
		}
		for (Token element : ((FormToken) token).getElements()) {
			if (!isParameter(element)) {
				return false;
			}
		}
		return true;
	}
}
