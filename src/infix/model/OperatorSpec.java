package infix.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 
 * Everything the parser and the postfix compiler need to know about one operator tag.
 * Direction and nil-safety are only meaningful for {@link ArityClass#THREADING}; for
 * other arity classes the direction is null and nilSafe is false.
 *
 */
public final class OperatorSpec {

	private final String tag;
	private final BigDecimal precedence;
	private final Associativity associativity;
	private final ArityClass arityClass;
	private final ThreadingDirection direction;
	private final boolean nilSafe;

	private OperatorSpec(String tag, BigDecimal precedence, Associativity associativity, ArityClass arityClass,
	                     ThreadingDirection direction, boolean nilSafe) {
		this.tag = Objects.requireNonNull(tag, "tag");
		this.precedence = Objects.requireNonNull(precedence, "precedence");
		this.associativity = Objects.requireNonNull(associativity, "associativity");
		this.arityClass = Objects.requireNonNull(arityClass, "arityClass");
		this.direction = direction;
		this.nilSafe = nilSafe;
	}

	public static OperatorSpec unary(String tag, BigDecimal precedence, Associativity associativity) {
		return new OperatorSpec(tag, precedence, associativity, ArityClass.UNARY, null, false);
	}

	public static OperatorSpec binary(String tag, BigDecimal precedence, Associativity associativity) {
		return new OperatorSpec(tag, precedence, associativity, ArityClass.BINARY, null, false);
	}

	public static OperatorSpec threading(String tag, BigDecimal precedence, Associativity associativity,
	                                     ThreadingDirection direction, boolean nilSafe) {
		return new OperatorSpec(tag, precedence, associativity, ArityClass.THREADING,
				Objects.requireNonNull(direction, "direction"), nilSafe);
	}

	public String getTag() {
		return tag;
	}

	public BigDecimal getPrecedence() {
		return precedence;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	public ArityClass getArityClass() {
		return arityClass;
	}

	public ThreadingDirection getDirection() {
		return direction;
	}

	public boolean isNilSafe() {
		return nilSafe;
	}

	public boolean isLeftAssociative() {
		return associativity == Associativity.LEFT;
	}

	/**
	 * @return the number of operands this operator consumes
	 */
	public int getArity() {
		return arityClass == ArityClass.UNARY ? 1 : 2;
	}

	@Override
	public int hashCode() {
		return Objects.hash(tag, precedence.stripTrailingZeros(), associativity, arityClass, direction, nilSafe);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		OperatorSpec other = (OperatorSpec) obj;
		return tag.equals(other.tag) && precedence.compareTo(other.precedence) == 0 &&
				associativity == other.associativity && arityClass == other.arityClass &&
				direction == other.direction && nilSafe == other.nilSafe;
	}

	@Override
	public String toString() {
		return "OperatorSpec [tag=" + tag + ", precedence=" + precedence + ", associativity=" + associativity +
				", arityClass=" + arityClass + ", direction=" + direction + ", nilSafe=" + nilSafe + "]";
	}
}
