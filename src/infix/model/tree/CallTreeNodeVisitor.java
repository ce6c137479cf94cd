package infix.model.tree;

public abstract class CallTreeNodeVisitor<T, E extends Throwable> {
	public abstract T visit(Literal literal) throws E;
	public abstract T visit(Symbol symbol) throws E;
	public abstract T visit(Call call) throws E;
	public abstract T visit(NilSafeCall nilSafeCall) throws E;
	public abstract T visit(Lambda lambda) throws E;
	public abstract T visit(CollectionLiteral collectionLiteral) throws E;
}
