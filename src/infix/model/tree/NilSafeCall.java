package infix.model.tree;

import infix.model.ThreadingDirection;
import infix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 
 * The short-circuiting form of a threading operator.
 * 
 * An executor evaluates the subject exactly once. If it is null, the whole node is null
 * and nothing else is evaluated; otherwise the result is the call returned by
 * {@link #splice(CallTreeNode)} applied to the subject's value.
 *
 */
public class NilSafeCall extends CallTreeNode {

	private final ThreadingDirection direction;
	private final CallTreeNode subject;
	private final CallTreeNode head;
	private final List<CallTreeNode> arguments;

	public NilSafeCall(SourceLocation location, ThreadingDirection direction, CallTreeNode subject,
	                   CallTreeNode head, List<CallTreeNode> arguments) {
		super(location);
		this.direction = direction;
		this.subject = subject;
		this.head = head;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public ThreadingDirection getDirection() {
		return direction;
	}

	public CallTreeNode getSubject() {
		return subject;
	}

	public CallTreeNode getHead() {
		return head;
	}

	public List<CallTreeNode> getArguments() {
		return arguments;
	}

	/**
	 * @param value the node standing for the already evaluated subject
	 * @return the call to run when the subject is not null
	 */
	public Call splice(CallTreeNode value) {
		return direction.splice(getLocation(), head, arguments, value);
	}

	@Override
	public <T, E extends Throwable> T accept(CallTreeNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + direction.hashCode();
		result = prime * result + subject.hashCode();
		result = prime * result + head.hashCode();
		result = prime * result + arguments.hashCode();
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
		NilSafeCall other = (NilSafeCall) obj;
		return direction == other.direction && subject.equals(other.subject) && head.equals(other.head) &&
				arguments.equals(other.arguments);
	}

}
