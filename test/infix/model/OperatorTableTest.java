package infix.model;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import org.json.JSONObject;
import org.junit.Test;

public class OperatorTableTest {

	private static OperatorTable loadString(String json) throws IOException {
		try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
			return OperatorTable.load(in);
		}
	}

	@Test
	public void defaultTableLevels() {
		OperatorTable table = OperatorTable.defaultTable();
		assertThat(table.precedence("*").compareTo(new BigDecimal("2")), is(0));
		assertThat(table.precedence("-").compareTo(BigDecimal.ONE), is(0));
		assertThat(table.precedence("not").compareTo(new BigDecimal("0.8")), is(0));
		assertThat(table.precedence("<=").compareTo(new BigDecimal("0.5")), is(0));
		assertThat(table.precedence("and").compareTo(new BigDecimal("0.2")), is(0));
		assertThat(table.precedence("or").compareTo(new BigDecimal("0.1")), is(0));
		assertThat(table.precedence("->>").compareTo(new BigDecimal("0.05")), is(0));
		assertTrue(table.precedence("or").compareTo(table.precedence("and")) < 0);
		assertTrue(table.precedence("|>").compareTo(table.precedence("or")) < 0);
	}

	@Test
	public void defaultTableArityAndAssociativity() {
		OperatorTable table = OperatorTable.defaultTable();
		assertThat(table.arityClass("not"), is(ArityClass.UNARY));
		assertThat(table.associativity("not"), is(Associativity.RIGHT));
		assertThat(table.arityClass("/"), is(ArityClass.BINARY));
		assertThat(table.associativity("/"), is(Associativity.LEFT));
		assertThat(table.arityClass("some->"), is(ArityClass.THREADING));

		OperatorSpec someLast = table.getSpec("some->>");
		assertThat(someLast.getDirection(), is(ThreadingDirection.LAST));
		assertTrue(someLast.isNilSafe());
		assertFalse(table.getSpec("->").isNilSafe());
		assertThat(table.getSpec("->").getDirection(), is(ThreadingDirection.FIRST));
		assertThat(table.getSpec("|>").getDirection(), is(ThreadingDirection.LAST));
	}

	@Test
	public void unknownTagsAreNotOperators() {
		OperatorTable table = OperatorTable.defaultTable();
		assertFalse(table.isOperator("**"));
		assertThat(table.getSpec("**"), is(nullValue()));
		assertThat(table.precedence("**"), is(BigDecimal.ZERO));
		assertThat(table.associativity("**"), is(Associativity.LEFT));
		assertThat(table.arityClass("**"), is(nullValue()));
	}

	@Test
	public void defaultTableExtras() {
		OperatorTable table = OperatorTable.defaultTable();
		assertThat(table.getLambdaArrow(), is("=>"));
		assertFalse(table.isOperator("=>"));
		for (String name : new String[] {"apply", "reduce", "map", "filter", "partial", "comp"}) {
			assertTrue(name, table.isLiteralArgumentFunction(name));
		}
		assertFalse(table.isLiteralArgumentFunction("inc"));
	}

	@Test
	public void loadFromClasspathFixture() throws IOException {
		OperatorTable table;
		try (InputStream in = OperatorTableTest.class.getResourceAsStream("custom-operators.json")) {
			assertThat(in, is(notNullValue()));
			table = OperatorTable.load(in);
		}
		assertThat(table.getLambdaArrow(), is("fn=>"));
		assertTrue(table.isLiteralArgumentFunction("fold"));
		assertFalse(table.isLiteralArgumentFunction("map"));
		assertFalse(table.isOperator("-"));
		assertThat(table.getOperators().size(), is(5));

		// associativity and arity default to left and binary
		assertThat(table.getSpec("+"), is(OperatorSpec.binary("+", BigDecimal.ONE, Associativity.LEFT)));
		assertThat(table.associativity("^"), is(Associativity.RIGHT));
		assertThat(table.getSpec("neg"), is(OperatorSpec.unary("neg", new BigDecimal("2.50"), Associativity.RIGHT)));
		assertThat(table.getSpec("|"),
				is(OperatorSpec.threading("|", new BigDecimal("0.5"), Associativity.LEFT, ThreadingDirection.LAST, false)));
	}

	@Test
	public void numericPrecedence() {
		JSONObject json = new JSONObject("{\"operators\": [{\"tag\": \"@\", \"precedence\": 1.5}]}");
		OperatorTable table = OperatorTable.fromJSON(json);
		assertThat(table.precedence("@").compareTo(new BigDecimal("1.5")), is(0));
		assertThat(table.getLambdaArrow(), is(OperatorTable.DEFAULT_LAMBDA_ARROW));
	}

	@Test(expected = InvalidOperatorTableIssue.class)
	public void notJSON() throws IOException {
		loadString("this is not json");
	}

	@Test(expected = InvalidOperatorTableIssue.class)
	public void missingOperators() throws IOException {
		loadString("{\"lambdaArrow\": \"=>\"}");
	}

	@Test(expected = InvalidOperatorTableIssue.class)
	public void missingPrecedence() throws IOException {
		loadString("{\"operators\": [{\"tag\": \"+\"}]}");
	}

	@Test
	public void threadingWithoutDirection() throws IOException {
		try {
			loadString("{\"operators\": [{\"tag\": \"~>\", \"precedence\": \"1\", \"arity\": \"threading\"}]}");
			fail("expected an InvalidOperatorTableIssue");
		} catch (InvalidOperatorTableIssue issue) {
			assertThat(issue.getProblem(), is("threading operator ~> has no direction"));
			assertThat(issue.getMessage(), is("invalid operator table: threading operator ~> has no direction"));
		}
	}

	@Test
	public void invalidAssociativity() throws IOException {
		try {
			loadString("{\"operators\": [{\"tag\": \"+\", \"precedence\": \"1\", \"associativity\": \"middle\"}]}");
			fail("expected an InvalidOperatorTableIssue");
		} catch (InvalidOperatorTableIssue issue) {
			assertThat(issue.getProblem(), containsString("middle"));
			assertThat(issue.getCause(), is(instanceOf(IllegalArgumentException.class)));
		}
	}

	@Test
	public void builder() {
		OperatorTable table = new OperatorTable.Builder()
				.binary("+", "1", Associativity.LEFT)
				.binary("^", "3", Associativity.RIGHT)
				.unary("-", "4")
				.threading("~>", "0.01", ThreadingDirection.FIRST, true)
				.literalArgumentFunction("fold")
				.build();
		assertThat(table.arityClass("-"), is(ArityClass.UNARY));
		assertThat(table.associativity("-"), is(Associativity.RIGHT));
		assertTrue(table.getSpec("~>").isNilSafe());
		assertThat(table.getLambdaArrow(), is("=>"));
		assertTrue(table.isLiteralArgumentFunction("fold"));
	}

	@Test
	public void toBuilderKeepsContents() {
		OperatorTable original = OperatorTable.defaultTable();
		OperatorTable changed = original.toBuilder()
				.remove("|>")
				.binary("mod", "2", Associativity.LEFT)
				.build();
		assertFalse(changed.isOperator("|>"));
		assertTrue(changed.isOperator("mod"));
		assertThat(changed.getSpec("*"), is(original.getSpec("*")));
		assertThat(changed.getLiteralArgumentFunctions(), is(original.getLiteralArgumentFunctions()));
		assertTrue(original.isOperator("|>"));
	}

	@Test(expected = InvalidOperatorTableIssue.class)
	public void arrowMustNotBeAnOperator() {
		new OperatorTable.Builder()
				.binary("=>", "1", Associativity.LEFT)
				.build();
	}

	@Test(expected = InvalidOperatorTableIssue.class)
	public void emptyArrow() {
		new OperatorTable.Builder()
				.lambdaArrow("")
				.build();
	}

	@Test(expected = InvalidOperatorTableIssue.class)
	public void literalArgumentFunctionMustNotBeAnOperator() {
		new OperatorTable.Builder()
				.binary("+", "1", Associativity.LEFT)
				.literalArgumentFunction("+")
				.build();
	}
}
