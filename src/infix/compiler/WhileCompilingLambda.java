package infix.compiler;

import infix.errors.Context;
import infix.errors.ContextVisitor;
import infix.model.token.SymbolToken;

import java.util.List;

public class WhileCompilingLambda extends Context {
	private final List<SymbolToken> parameters;

	public WhileCompilingLambda(List<SymbolToken> parameters) {
		this.parameters = parameters;
	}

	public List<SymbolToken> getParameters() {
		return parameters;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
