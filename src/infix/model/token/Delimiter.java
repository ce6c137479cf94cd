package infix.model.token;

/**
 * The bracket a nested form was read with.
 */
public enum Delimiter {
	/**
	 * Ordinary parentheses: either a call or a grouped sub-expression, decided by
	 * {@link infix.parser.GroupingClassifier}.
	 */
	PAREN("(", ")"),
	/**
	 * An explicit grouping marker. Always a grouped sub-expression, never a call.
	 */
	GROUP("(", ")"),
	BRACKET("[", "]"),
	BRACE("{", "}");

	private final String open;
	private final String close;

	Delimiter(String open, String close) {
		this.open = open;
		this.close = close;
	}

	public String getOpen() {
		return open;
	}

	public String getClose() {
		return close;
	}
}
