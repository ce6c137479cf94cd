package infix.errors;

import infix.compiler.DanglingOperandIssue;
import infix.compiler.EmptyExpressionIssue;
import infix.compiler.MissingOperandIssue;
import infix.model.InvalidOperatorTableIssue;
import infix.parser.UnbalancedGroupingIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(InvalidOperatorTableIssue invalidOperatorTableIssue) throws E;
	public abstract T visit(UnbalancedGroupingIssue unbalancedGroupingIssue) throws E;
	public abstract T visit(MissingOperandIssue missingOperandIssue) throws E;
	public abstract T visit(DanglingOperandIssue danglingOperandIssue) throws E;
	public abstract T visit(EmptyExpressionIssue emptyExpressionIssue) throws E;
}
