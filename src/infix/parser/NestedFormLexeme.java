package infix.parser;

import infix.model.token.FormToken;
import infix.util.SourceLocation;

/**
 * A form the flattener kept opaque. It is an operand of the surrounding expression and is
 * compiled separately according to its kind.
 */
public class NestedFormLexeme extends Lexeme {
	private final FormToken form;
	private final FormKind kind;

	public NestedFormLexeme(int position, FormToken form, FormKind kind) {
		super(position);
		this.form = form;
		this.kind = kind;
	}

	public FormToken getForm() {
		return form;
	}

	public FormKind getKind() {
		return kind;
	}

	@Override
	public SourceLocation getLocation() {
		return form.getLocation();
	}

	@Override
	public <T, E extends Throwable> T accept(LexemeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
