package infix.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import infix.model.token.Delimiter;
import infix.model.tree.CallTreeNode;

import static infix.model.tree.CallTreeBuilder.*;

@RunWith(Parameterized.class)
public class CallTreeFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{lit(1L), "1"},
				{lit(null), "nil"},
				{lit("say \"hi\""), "\"say \\\"hi\\\"\""},
				{lit(true), "true"},
				{id("x"), "x"},
				{call("f"), "(f)"},
				{call("+", id("a"), call("*", id("b"), id("c"))), "(+ a (* b c))"},
				{call(fn(params("x"), id("x")), lit(1L)), "((fn [x] x) 1)"},
				{fn(params("x", "y"), call("+", id("x"), id("y"))), "(fn [x y] (+ x y))"},
				{fn(params(), lit(1L)), "(fn [] 1)"},
				{someFirst(id("m"), id("get"), id("k")), "(some-> m (get k))"},
				{someLast(id("xs"), id("first")), "(some->> xs (first))"},
				{vec(id("a"), lit(2L)), "[a 2]"},
				{vec(), "[]"},
				{coll(Delimiter.BRACE, id("k"), id("v")), "{k v}"},
				{coll(Delimiter.PAREN), "()"},
		});
	}

	private final CallTreeNode node;
	private final String expected;

	public CallTreeFormattingVisitorTest(CallTreeNode node, String expected) {
		this.node = node;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(node.toString(), is(expected));
	}

}
