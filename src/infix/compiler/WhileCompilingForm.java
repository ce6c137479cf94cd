package infix.compiler;

import infix.errors.Context;
import infix.errors.ContextVisitor;
import infix.model.token.FormToken;

public class WhileCompilingForm extends Context {
	private final FormToken form;

	public WhileCompilingForm(FormToken form) {
		this.form = form;
	}

	public FormToken getForm() {
		return form;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
