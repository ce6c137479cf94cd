package infix.parser;

import infix.errors.Issue;
import infix.errors.IssueVisitor;

public class UnbalancedGroupingIssue extends Issue {

	public enum Problem {
		UNMATCHED_GROUP_END,
		UNCLOSED_GROUP_START,
	}

	private final Problem problem;
	private final Lexeme marker;

	public UnbalancedGroupingIssue(Problem problem, Lexeme marker) {
		this.problem = problem;
		this.marker = marker;
	}

	public Problem getProblem() {
		return problem;
	}

	public Lexeme getMarker() {
		return marker;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
