package infix.model.tree;

import infix.Unreachable;
import infix.formatters.CallTreeFormattingVisitor;
import infix.formatters.IndentingWriter;
import infix.util.SourceLocatable;
import infix.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * 
 * The base class for every node of a compiled call tree. Nodes are immutable and, like
 * tokens, compare equal regardless of their source locations.
 *
 */
public abstract class CallTreeNode extends SourceLocatable {
	private final SourceLocation location;

	public CallTreeNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new CallTreeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(CallTreeNodeVisitor<T, E> v) throws E;

}
