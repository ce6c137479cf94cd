package infix.parser;

import infix.util.SourceLocation;

public class GroupEndLexeme extends Lexeme {
	private final SourceLocation location;

	public GroupEndLexeme(int position, SourceLocation location) {
		super(position);
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(LexemeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
