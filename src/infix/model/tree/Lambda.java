package infix.model.tree;

import infix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Lambda extends CallTreeNode {

	private final List<Symbol> parameters;
	private final CallTreeNode body;

	public Lambda(SourceLocation location, List<Symbol> parameters, CallTreeNode body) {
		super(location);
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		this.body = body;
	}

	public List<Symbol> getParameters() {
		return parameters;
	}

	public CallTreeNode getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CallTreeNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + parameters.hashCode();
		result = prime * result + body.hashCode();
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
		Lambda other = (Lambda) obj;
		return parameters.equals(other.parameters) && body.equals(other.body);
	}

}
