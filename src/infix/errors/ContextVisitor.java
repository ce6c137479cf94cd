package infix.errors;

import infix.compiler.WhileCompilingForm;
import infix.compiler.WhileCompilingLambda;
import infix.trans.WhileCompilingExpression;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileCompilingForm whileCompilingForm) throws E;
	public abstract T visit(WhileCompilingLambda whileCompilingLambda) throws E;
	public abstract T visit(WhileCompilingExpression whileCompilingExpression) throws E;

}
