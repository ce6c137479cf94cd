package infix.compiler;

import infix.errors.Issue;
import infix.errors.IssueVisitor;
import infix.util.SourceLocation;

public class EmptyExpressionIssue extends Issue {
	private final SourceLocation location;

	public EmptyExpressionIssue(SourceLocation location) {
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
