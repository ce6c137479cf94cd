package infix.trans;

import infix.errors.Context;
import infix.errors.ContextVisitor;

public class WhileCompilingExpression extends Context {
	private final int index;

	public WhileCompilingExpression(int index) {
		this.index = index;
	}

	/**
	 * @return the 0-based index of the expression within its batch
	 */
	public int getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
