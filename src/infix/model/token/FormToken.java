package infix.model.token;

import infix.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 
 * A nested sequence of tokens. Whether a parenthesised form is a call or a grouped
 * sub-expression is not known here.
 *
 */
public class FormToken extends Token {

	private final Delimiter delimiter;
	private final List<Token> elements;

	public FormToken(SourceLocation location, Delimiter delimiter, List<Token> elements) {
		super(location);
		this.delimiter = delimiter;
		this.elements = Collections.unmodifiableList(elements);
	}

	public Delimiter getDelimiter() {
		return delimiter;
	}

	public List<Token> getElements() {
		return elements;
	}

	public boolean isParenthesised() {
		return delimiter == Delimiter.PAREN || delimiter == Delimiter.GROUP;
	}

	@Override
	public <T, E extends Throwable> T accept(TokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + delimiter.hashCode();
		result = prime * result + elements.hashCode();
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
		FormToken other = (FormToken) obj;
		return delimiter == other.delimiter && elements.equals(other.elements);
	}

}
