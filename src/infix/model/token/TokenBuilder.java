package infix.model.token;

import infix.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 * Shorthand constructors for tokens with unknown source locations, for readers that do
 * not track positions and for tests.
 */
public class TokenBuilder {
	private TokenBuilder() {}

	public static AtomToken atom(Object value) {
		return new AtomToken(SourceLocation.unknown(), value);
	}

	public static AtomToken num(long value) {
		return atom(value);
	}

	public static AtomToken str(String value) {
		return atom(value);
	}

	public static AtomToken nil() {
		return atom(null);
	}

	public static SymbolToken sym(String name) {
		return new SymbolToken(SourceLocation.unknown(), name);
	}

	public static SymbolToken symAt(String name, int line, int column) {
		return new SymbolToken(SourceLocation.at(line, column), name);
	}

	public static FormToken list(Token... elements) {
		return new FormToken(SourceLocation.unknown(), Delimiter.PAREN, Arrays.asList(elements));
	}

	public static FormToken group(Token... elements) {
		return new FormToken(SourceLocation.unknown(), Delimiter.GROUP, Arrays.asList(elements));
	}

	public static FormToken vector(Token... elements) {
		return new FormToken(SourceLocation.unknown(), Delimiter.BRACKET, Arrays.asList(elements));
	}

	public static FormToken braces(Token... elements) {
		return new FormToken(SourceLocation.unknown(), Delimiter.BRACE, Arrays.asList(elements));
	}

	public static List<Token> tokens(Token... tokens) {
		return Arrays.asList(tokens);
	}
}
