package infix.parser;

import infix.model.OperatorTable;
import infix.model.token.Delimiter;
import infix.model.token.FormToken;
import infix.model.token.SymbolToken;
import infix.model.token.Token;

import java.util.List;

/**
 *
 * Decides what a nested form is.
 *
 * <p>A parenthesised form is a call when its head is an identifier and either the head
 * takes operators as literal arguments (the table's allow-list) or no operator in the
 * form sits between two other elements. A form with such an operand-operator-operand
 * triple is a grouped sub-expression. Forms that are neither, such as {@code (+ 1 2)},
 * are prefix calls and stay opaque.</p>
 *
 * <p>This is a heuristic: {@code (f x + y)} reads as a grouped expression even if the
 * reader meant a call of f. Readers that know better produce a form with
 * {@link Delimiter#GROUP}, which is always a grouped expression.</p>
 *
 */
public class GroupingClassifier {

	private final OperatorTable table;
	private final LambdaDisambiguator lambdaDisambiguator;

	public GroupingClassifier(OperatorTable table) {
		this.table = table;
		this.lambdaDisambiguator = new LambdaDisambiguator(table);
	}

	public FormKind classify(FormToken form) {
		switch (form.getDelimiter()) {
			case BRACKET:
			case BRACE:
				return FormKind.COLLECTION;
			case GROUP:
				return lambdaDisambiguator.matches(form.getElements()) ? FormKind.LAMBDA : FormKind.GROUPED_EXPRESSION;
			case PAREN:
				break;
		}
		List<Token> elements = form.getElements();
		if (elements.isEmpty()) {
			return FormKind.COLLECTION;
		}
		if (lambdaDisambiguator.matches(elements)) {
			return FormKind.LAMBDA;
		}
		Token head = elements.get(0);
		if (isIdentifier(head) &&
				(table.isLiteralArgumentFunction(((SymbolToken) head).getName()) || !containsInfixPattern(elements))) {
			return FormKind.CALL_FORM;
		}
		if (containsInfixPattern(elements)) {
			return FormKind.GROUPED_EXPRESSION;
		}
		return FormKind.CALL_FORM;
	}

	/**
	 * @return true if some operator in tokens has an element on both sides
	 */
	public boolean containsInfixPattern(List<Token> tokens) {
		for (int i = 1; i < tokens.size() - 1; i++) {
			if (isOperator(tokens.get(i))) {
				return true;
			}
		}
		return false;
	}

	public boolean isOperator(Token token) {
		return token instanceof SymbolToken && table.isOperator(((SymbolToken) token).getName());
	}

	public boolean isIdentifier(Token token) {
		return token instanceof SymbolToken && !table.isOperator(((SymbolToken) token).getName());
	}
}
