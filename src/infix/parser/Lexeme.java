package infix.parser;

import infix.Unreachable;
import infix.formatters.IndentingWriter;
import infix.formatters.LexemeFormattingVisitor;
import infix.model.OperatorSpec;
import infix.util.SourceLocatable;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * One element of a flattened or postfix stream. What each token is gets decided once,
 * when the {@link Flattener} builds the lexeme, and is never re-interpreted afterwards.
 *
 * <p>The position is the lexeme's index in the flattened stream and is kept when the
 * parser reorders lexemes, so that errors can point back at the offending element.</p>
 *
 */
public abstract class Lexeme extends SourceLocatable {
	private final int position;

	public Lexeme(int position) {
		this.position = position;
	}

	public int getPosition() {
		return position;
	}

	public boolean isOperator() {
		return false;
	}

	public boolean isGroupStart() {
		return false;
	}

	/**
	 * @return the operator's spec; only meaningful if {@link #isOperator()}
	 */
	public OperatorSpec getOperatorSpec() {
		return null;
	}

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new LexemeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(LexemeVisitor<T, E> v) throws E;
}
