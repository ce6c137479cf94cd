package infix.model.token;

import infix.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A leaf value passed through untouched: a number, a string, a boolean, null, a keyword
 * or anything else the reader produced that is not a symbol or a form.
 *
 */
public class AtomToken extends Token {

	private final Object value;

	public AtomToken(SourceLocation location, Object value) {
		super(location);
		this.value = value;
	}

	public Object getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(TokenVisitor<T, E> v) throws E {
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
		AtomToken other = (AtomToken) obj;
		return Objects.equals(value, other.value);
	}

}
