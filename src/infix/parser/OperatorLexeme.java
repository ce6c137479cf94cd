package infix.parser;

import infix.model.OperatorSpec;
import infix.model.token.SymbolToken;
import infix.util.SourceLocation;

public class OperatorLexeme extends Lexeme {
	private final SymbolToken token;
	private final OperatorSpec spec;

	public OperatorLexeme(int position, SymbolToken token, OperatorSpec spec) {
		super(position);
		this.token = token;
		this.spec = spec;
	}

	public SymbolToken getToken() {
		return token;
	}

	@Override
	public boolean isOperator() {
		return true;
	}

	@Override
	public OperatorSpec getOperatorSpec() {
		return spec;
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
