package infix.model.tree;

import infix.model.ThreadingDirection;
import infix.model.token.Delimiter;
import infix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthand constructors for call trees with unknown source locations.
 */
public class CallTreeBuilder {
	private CallTreeBuilder() {}

	public static Literal lit(Object value) {
		return new Literal(SourceLocation.unknown(), value);
	}

	public static Symbol id(String name) {
		return new Symbol(SourceLocation.unknown(), name);
	}

	public static Call call(CallTreeNode head, CallTreeNode... operands) {
		return new Call(SourceLocation.unknown(), head, Arrays.asList(operands));
	}

	public static Call call(String head, CallTreeNode... operands) {
		return call(id(head), operands);
	}

	public static List<Symbol> params(String... names) {
		List<Symbol> result = new ArrayList<>();
		for(String name : names) {
			result.add(id(name));
		}
		return result;
	}

	public static Lambda fn(List<Symbol> parameters, CallTreeNode body) {
		return new Lambda(SourceLocation.unknown(), parameters, body);
	}

	public static NilSafeCall someFirst(CallTreeNode subject, CallTreeNode head, CallTreeNode... arguments) {
		return new NilSafeCall(SourceLocation.unknown(), ThreadingDirection.FIRST, subject, head, Arrays.asList(arguments));
	}

	public static NilSafeCall someLast(CallTreeNode subject, CallTreeNode head, CallTreeNode... arguments) {
		return new NilSafeCall(SourceLocation.unknown(), ThreadingDirection.LAST, subject, head, Arrays.asList(arguments));
	}

	public static CollectionLiteral vec(CallTreeNode... elements) {
		return new CollectionLiteral(SourceLocation.unknown(), Delimiter.BRACKET, Arrays.asList(elements));
	}

	public static CollectionLiteral coll(Delimiter delimiter, CallTreeNode... elements) {
		return new CollectionLiteral(SourceLocation.unknown(), delimiter, Arrays.asList(elements));
	}
}
