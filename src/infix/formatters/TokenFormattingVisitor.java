package infix.formatters;

import infix.model.token.AtomToken;
import infix.model.token.FormToken;
import infix.model.token.SymbolToken;
import infix.model.token.TokenVisitor;

import java.io.IOException;

public class TokenFormattingVisitor extends TokenVisitor<Void, IOException> {

	private final IndentingWriter out;

	public TokenFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	/**
	 * Writes a leaf value: null as nil, strings quoted, anything else as its string form.
	 */
	public static void writeValue(IndentingWriter out, Object value) throws IOException {
		if (value == null) {
			out.write("nil");
		} else if (value instanceof CharSequence) {
			out.write('"');
			out.write(value.toString().replace("\\", "\\\\").replace("\"", "\\\""));
			out.write('"');
		} else {
			out.write(value.toString());
		}
	}

	@Override
	public Void visit(AtomToken atomToken) throws IOException {
		writeValue(out, atomToken.getValue());
		return null;
	}

	@Override
	public Void visit(SymbolToken symbolToken) throws IOException {
		out.write(symbolToken.getName());
		return null;
	}

	@Override
	public Void visit(FormToken formToken) throws IOException {
		out.write(formToken.getDelimiter().getOpen());
		out.writeSeparated(formToken.getElements(), " ", e -> e.accept(this));
		out.write(formToken.getDelimiter().getClose());
		return null;
	}
}
