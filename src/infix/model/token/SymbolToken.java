package infix.model.token;

import infix.util.SourceLocation;

/**
 * 
 * An unqualified name. Whether a symbol is an operator tag or an identifier is not part
 * of the token: it is decided against the operator table when the token is flattened.
 *
 */
public class SymbolToken extends Token {

	private final String name;

	public SymbolToken(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TokenVisitor<T, E> v) throws E {
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
		SymbolToken other = (SymbolToken) obj;
		return name.equals(other.name);
	}

}
