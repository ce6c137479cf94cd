package infix.model;

import infix.errors.Issue;
import infix.errors.IssueVisitor;

public class InvalidOperatorTableIssue extends Issue {
	private final String problem;

	public InvalidOperatorTableIssue(String problem) {
		this.problem = problem;
	}

	public InvalidOperatorTableIssue(String problem, Throwable cause) {
		this.problem = problem;
		initCause(cause);
	}

	public String getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
