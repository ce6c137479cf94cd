package infix.errors;

/**
 * What the compiler was doing when an issue was raised.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;

}
