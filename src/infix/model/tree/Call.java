package infix.model.tree;

import infix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 
 * head applied to operands, in order.
 * 
 * Calls built from operators always have at least one operand. Calls read as
 * call-forms keep the argument count they were written with, which may be zero.
 *
 */
public class Call extends CallTreeNode {

	private final CallTreeNode head;
	private final List<CallTreeNode> operands;

	public Call(SourceLocation location, CallTreeNode head, List<CallTreeNode> operands) {
		super(location);
		this.head = head;
		this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
	}

	public CallTreeNode getHead() {
		return head;
	}

	public List<CallTreeNode> getOperands() {
		return operands;
	}

	@Override
	public <T, E extends Throwable> T accept(CallTreeNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + head.hashCode();
		result = prime * result + operands.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Call other = (Call) obj;
		return head.equals(other.head) && operands.equals(other.operands);
	}

}
