package infix.model.tree;

import infix.model.token.Delimiter;
import infix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 
 * A bracketed or braced literal, or an empty parenthesised form. Each element was
 * compiled on its own; the collection itself is passed through to the host as written.
 *
 */
public class CollectionLiteral extends CallTreeNode {

	private final Delimiter delimiter;
	private final List<CallTreeNode> elements;

	public CollectionLiteral(SourceLocation location, Delimiter delimiter, List<CallTreeNode> elements) {
		super(location);
		this.delimiter = delimiter;
		this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
	}

	public Delimiter getDelimiter() {
		return delimiter;
	}

	public List<CallTreeNode> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(CallTreeNodeVisitor<T, E> v) throws E {
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
		CollectionLiteral other = (CollectionLiteral) obj;
		return delimiter == other.delimiter && elements.equals(other.elements);
	}

}
