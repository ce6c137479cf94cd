package infix.compiler;

import infix.errors.Issue;
import infix.errors.IssueVisitor;
import infix.model.tree.CallTreeNode;

import java.util.Collections;
import java.util.List;

/**
 * More than one operand was left once every operator had been applied, as in
 * {@code a b + c}: there is no operator to join them.
 */
public class DanglingOperandIssue extends Issue {
	private final List<CallTreeNode> operands;

	public DanglingOperandIssue(List<CallTreeNode> operands) {
		this.operands = Collections.unmodifiableList(operands);
	}

	public List<CallTreeNode> getOperands() {
		return operands;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
