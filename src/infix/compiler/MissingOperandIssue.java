package infix.compiler;

import infix.errors.Issue;
import infix.errors.IssueVisitor;
import infix.parser.OperatorLexeme;

public class MissingOperandIssue extends Issue {
	private final OperatorLexeme operator;
	private final int available;

	public MissingOperandIssue(OperatorLexeme operator, int available) {
		this.operator = operator;
		this.available = available;
	}

	public OperatorLexeme getOperator() {
		return operator;
	}

	/**
	 * @return how many operands were on the stack when the operator was reached
	 */
	public int getAvailable() {
		return available;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
