package infix.model.tree;

import infix.util.SourceLocation;

/**
 * 
 * A reference to a name: an identifier, or an operator tag used as the head of a call
 * or passed as a value.
 *
 */
public class Symbol extends CallTreeNode {

	private final String name;

	public Symbol(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(CallTreeNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Symbol other = (Symbol) obj;
		return name.equals(other.name);
	}

}
