package infix.parser;

/**
 * What a nested form turned out to be.
 */
public enum FormKind {
	/**
	 * Head applied to arguments. The head and every argument are compiled on their own.
	 */
	CALL_FORM,
	/**
	 * A parenthesised infix sub-expression, flattened into the enclosing stream.
	 */
	GROUPED_EXPRESSION,
	/**
	 * Parameters, the lambda arrow, and a body.
	 */
	LAMBDA,
	/**
	 * A bracketed or braced literal, or the empty parenthesised form.
	 */
	COLLECTION,
}
