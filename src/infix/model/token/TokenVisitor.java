package infix.model.token;

public abstract class TokenVisitor<T, E extends Throwable> {
	public abstract T visit(AtomToken atomToken) throws E;
	public abstract T visit(SymbolToken symbolToken) throws E;
	public abstract T visit(FormToken formToken) throws E;
}
