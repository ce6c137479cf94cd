package infix.parser;

import infix.model.token.Token;
import infix.util.SourceLocation;

/**
 * An atom or an identifier, compiled to a leaf as is.
 */
public class OperandLexeme extends Lexeme {
	private final Token token;

	public OperandLexeme(int position, Token token) {
		super(position);
		this.token = token;
	}

	public Token getToken() {
		return token;
	}

	@Override
	public SourceLocation getLocation() {
		return token.getLocation();
	}

	@Override
	public <T, E extends Throwable> T accept(LexemeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
