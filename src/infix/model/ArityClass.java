package infix.model;

/**
 * How many operands an operator takes off the postfix stack, and what it builds from
 * them.
 */
public enum ArityClass {
	UNARY,
	BINARY,
	/**
	 * Two operands: the data on the left is spliced into the operation on the right.
	 */
	THREADING,
}
