package infix.model.tree;

import infix.util.SourceLocation;

import java.util.Objects;

public class Literal extends CallTreeNode {

	private final Object value;

	public Literal(SourceLocation location, Object value) {
		super(location);
		this.value = value;
	}

	public Object getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(CallTreeNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Literal other = (Literal) obj;
		return Objects.equals(value, other.value);
	}

}
