package infix.model.token;

import infix.Unreachable;
import infix.formatters.IndentingWriter;
import infix.formatters.TokenFormattingVisitor;
import infix.util.SourceLocatable;
import infix.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * 
 * One unit of the already-read input stream: an atom, a symbol or a nested form.
 * Tokens are immutable. Equality ignores source locations, so tokens read from
 * different places compare equal when they spell the same thing.
 *
 */
public abstract class Token extends SourceLocatable {
	private final SourceLocation location;

	public Token(SourceLocation location) {
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
			accept(new TokenFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(TokenVisitor<T, E> v) throws E;

}
