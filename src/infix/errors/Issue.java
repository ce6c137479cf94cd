package infix.errors;

import infix.InfixException;
import infix.Unreachable;
import infix.formatters.IndentingWriter;
import infix.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem that stops the compilation of one expression. The message is rendered on
 * demand by {@link IssueFormattingVisitor}.
 */
public abstract class Issue extends InfixException {
	public Issue() {
		super("Compilation Error", "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	@Override
	public String getMsg() {
		return getMessage();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
