package infix;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import infix.model.token.Delimiter;
import infix.model.token.Token;
import infix.model.tree.CallTreeNode;

import static infix.model.token.TokenBuilder.*;
import static infix.model.tree.CallTreeBuilder.*;

@RunWith(Parameterized.class)
public class InfixCompilerTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// single elements
				{tokens(sym("x")), id("x")},
				{tokens(num(42)), lit(42L)},
				{tokens(nil()), lit(null)},
				{tokens(str("hi")), lit("hi")},

				// precedence and associativity
				{tokens(sym("a"), sym("+"), sym("b"), sym("*"), sym("c")),
						call("+", id("a"), call("*", id("b"), id("c")))},
				{tokens(sym("a"), sym("*"), sym("b"), sym("+"), sym("c")),
						call("+", call("*", id("a"), id("b")), id("c"))},
				{tokens(sym("a"), sym("-"), sym("b"), sym("-"), sym("c")),
						call("-", call("-", id("a"), id("b")), id("c"))},
				{tokens(sym("a"), sym("="), sym("b"), sym("or"), sym("c"), sym("<"), sym("d")),
						call("or", call("=", id("a"), id("b")), call("<", id("c"), id("d")))},
				{tokens(sym("a"), sym("and"), sym("b"), sym("or"), sym("c")),
						call("or", call("and", id("a"), id("b")), id("c"))},

				// grouping
				{tokens(group(sym("a"), sym("+"), sym("b")), sym("*"), sym("c")),
						call("*", call("+", id("a"), id("b")), id("c"))},
				{tokens(list(sym("a"), sym("+"), sym("b")), sym("*"), sym("c")),
						call("*", call("+", id("a"), id("b")), id("c"))},
				{tokens(list(num(1), sym("+"), num(2)), sym("*"), num(3)),
						call("*", call("+", lit(1L), lit(2L)), lit(3L))},
				{tokens(sym("a"), sym("*"), list(sym("b"), sym("+"), list(sym("c"), sym("-"), sym("d")))),
						call("*", id("a"), call("+", id("b"), call("-", id("c"), id("d"))))},

				// unary
				{tokens(sym("not"), sym("a"), sym("and"), sym("b")),
						call("and", call("not", id("a")), id("b"))},
				{tokens(sym("not"), sym("not"), sym("a")),
						call("not", call("not", id("a")))},
				{tokens(sym("a"), sym("and"), sym("not"), sym("b")),
						call("and", id("a"), call("not", id("b")))},

				// call-forms stay calls
				{tokens(sym("a"), sym("+"), list(sym("f"), sym("x"))),
						call("+", id("a"), call("f", id("x")))},
				{tokens(list(sym("reduce"), sym("+"), num(0), sym("xs"))),
						call("reduce", id("+"), lit(0L), id("xs"))},
				{tokens(list(sym("+"), num(1), num(2))),
						call("+", lit(1L), lit(2L))},
				{tokens(list(sym("-"), sym("x"))),
						call("-", id("x"))},
				{tokens(list(sym("f"))),
						call("f")},

				// threading
				{tokens(sym("a"), sym("->"), sym("f")),
						call("f", id("a"))},
				{tokens(sym("a"), sym("->"), list(sym("g"), sym("x"))),
						call("g", id("a"), id("x"))},
				{tokens(sym("a"), sym("->>"), list(sym("g"), sym("x"))),
						call("g", id("x"), id("a"))},
				{tokens(sym("a"), sym("->"), sym("f"), sym("->"), sym("g")),
						call("g", call("f", id("a")))},
				{tokens(sym("xs"), sym("|>"), list(sym("map"), sym("inc")), sym("|>"), list(sym("filter"), sym("odd?"))),
						call("filter", id("odd?"), call("map", id("inc"), id("xs")))},
				{tokens(sym("s"), sym("->"), list(sym(".toUpperCase"))),
						call(".toUpperCase", id("s"))},
				{tokens(sym("a"), sym("+"), sym("b"), sym("->"), sym("f")),
						call("f", call("+", id("a"), id("b")))},

				// nil-safe threading
				{tokens(sym("m"), sym("some->"), list(sym("get"), sym("k"))),
						someFirst(id("m"), id("get"), id("k"))},
				{tokens(sym("xs"), sym("some->>"), sym("first")),
						someLast(id("xs"), id("first"))},
				{tokens(sym("m"), sym("some->"), list(sym("get"), sym("a")), sym("some->"), list(sym("get"), sym("b"))),
						someFirst(someFirst(id("m"), id("get"), id("a")), id("get"), id("b"))},

				// lambdas
				{tokens(sym("x"), sym("=>"), sym("x"), sym("*"), sym("x")),
						fn(params("x"), call("*", id("x"), id("x")))},
				{tokens(list(sym("x"), sym("y")), sym("=>"), sym("x"), sym("+"), sym("y")),
						fn(params("x", "y"), call("+", id("x"), id("y")))},
				{tokens(list(), sym("=>"), num(1)),
						fn(params(), lit(1L))},
				{tokens(list(sym("map"), list(sym("x"), sym("=>"), sym("x"), sym("+"), num(1)), sym("xs"))),
						call("map", fn(params("x"), call("+", id("x"), lit(1L))), id("xs"))},
				{tokens(sym("x"), sym("=>"), group(sym("y"), sym("=>"), sym("x"), sym("+"), sym("y"))),
						fn(params("x"), fn(params("y"), call("+", id("x"), id("y"))))},
				{tokens(sym("xs"), sym("->>"), list(sym("map"), group(sym("x"), sym("=>"), sym("x"), sym("*"), num(2)))),
						call("map", fn(params("x"), call("*", id("x"), lit(2L))), id("xs"))},

				// collections
				{tokens(vector(sym("a"), list(num(1), sym("+"), num(2)))),
						vec(id("a"), call("+", lit(1L), lit(2L)))},
				{tokens(vector()),
						vec()},
				{tokens(list()),
						coll(Delimiter.PAREN)},
				{tokens(braces(sym("k"), list(sym("f"), sym("x")))),
						coll(Delimiter.BRACE, id("k"), call("f", id("x")))},
				{tokens(vector(num(1), num(2)), sym("->>"), list(sym("map"), sym("inc"))),
						call("map", id("inc"), vec(lit(1L), lit(2L)))},

				// unknown tags are identifiers
				{tokens(list(sym("**"), sym("a"), sym("b"))),
						call("**", id("a"), id("b"))},
		});
	}

	private final List<Token> input;
	private final CallTreeNode expected;

	public InfixCompilerTest(List<Token> input, CallTreeNode expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		CallTreeNode actual = new InfixCompiler().compile(input);
		assertThat(actual, is(expected));
	}

}
