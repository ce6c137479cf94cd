package infix.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import infix.model.Associativity;
import infix.model.OperatorTable;
import infix.model.token.Token;
import infix.util.SourceLocation;

import static infix.model.token.TokenBuilder.*;

public class PrecedenceParserTest {

	private static String postfix(OperatorTable table, List<Token> tokens) {
		Flattener flattener = new Flattener(table, new GroupingClassifier(table));
		return PrecedenceParser.toPostfix(flattener.flatten(tokens)).stream()
				.map(Lexeme::toString)
				.collect(Collectors.joining(" "));
	}

	private static String postfix(List<Token> tokens) {
		return postfix(OperatorTable.defaultTable(), tokens);
	}

	@Test
	public void tighterOperatorsGoFirst() {
		assertThat(postfix(tokens(num(1), sym("+"), num(2), sym("*"), num(3))), is("1 2 3 * +"));
		assertThat(postfix(tokens(num(1), sym("*"), num(2), sym("+"), num(3))), is("1 2 * 3 +"));
	}

	@Test
	public void leftAssociativeOperatorsPopEqualPrecedence() {
		assertThat(postfix(tokens(sym("a"), sym("-"), sym("b"), sym("+"), sym("c"))), is("a b - c +"));
		assertThat(postfix(tokens(sym("a"), sym("->"), sym("f"), sym("->>"), sym("g"))), is("a f -> g ->>"));
	}

	@Test
	public void rightAssociativeOperatorsStack() {
		OperatorTable table = OperatorTable.defaultTable().toBuilder()
				.binary("^", "3", Associativity.RIGHT)
				.build();
		assertThat(postfix(table, tokens(sym("a"), sym("^"), sym("b"), sym("^"), sym("c"))), is("a b c ^ ^"));
		assertThat(postfix(table, tokens(num(2), sym("*"), sym("a"), sym("^"), num(2))), is("2 a 2 ^ *"));
		assertThat(postfix(tokens(sym("not"), sym("not"), sym("a"))), is("a not not"));
	}

	@Test
	public void groupsBoundPopping() {
		assertThat(postfix(tokens(group(sym("a"), sym("+"), sym("b")), sym("*"), sym("c"))), is("a b + c *"));
		assertThat(postfix(tokens(sym("a"), sym("*"), group(sym("b"), sym("+"), sym("c")))), is("a b c + *"));
	}

	@Test
	public void nestedFormsAreOperands() {
		assertThat(postfix(tokens(sym("xs"), sym("->>"), list(sym("map"), sym("inc")))), is("xs (map inc) ->>"));
	}

	@Test
	public void positionsSurviveReordering() {
		OperatorTable table = OperatorTable.defaultTable();
		Flattener flattener = new Flattener(table, new GroupingClassifier(table));
		List<Lexeme> result = PrecedenceParser.toPostfix(
				flattener.flatten(tokens(sym("a"), sym("+"), sym("b"), sym("*"), sym("c"))));
		List<Integer> positions = result.stream().map(Lexeme::getPosition).collect(Collectors.toList());
		assertThat(positions, is(Arrays.asList(0, 2, 4, 3, 1)));
	}

	@Test
	public void unmatchedGroupEnd() {
		List<Lexeme> lexemes = Arrays.asList(
				new OperandLexeme(0, sym("a")),
				new GroupEndLexeme(1, SourceLocation.at(0, 4)));
		try {
			PrecedenceParser.toPostfix(lexemes);
			fail("expected an UnbalancedGroupingIssue");
		} catch (UnbalancedGroupingIssue issue) {
			assertThat(issue.getProblem(), is(UnbalancedGroupingIssue.Problem.UNMATCHED_GROUP_END));
			assertThat(issue.getMarker().getPosition(), is(1));
			assertThat(issue.getMessage(),
					is("unbalanced grouping: group end at position 1 has no matching group start at 1:5"));
		}
	}

	@Test
	public void unclosedGroupStart() {
		List<Lexeme> lexemes = Arrays.asList(
				new GroupStartLexeme(0, SourceLocation.unknown()),
				new OperandLexeme(1, sym("a")));
		try {
			PrecedenceParser.toPostfix(lexemes);
			fail("expected an UnbalancedGroupingIssue");
		} catch (UnbalancedGroupingIssue issue) {
			assertThat(issue.getProblem(), is(UnbalancedGroupingIssue.Problem.UNCLOSED_GROUP_START));
			assertThat(issue.getMessage(), is("unbalanced grouping: group start at position 0 is never closed"));
		}
	}

	@Test(expected = IllegalStateException.class)
	public void parserIsSingleUse() {
		PrecedenceParser parser = new PrecedenceParser();
		parser.parse(Arrays.asList(new OperandLexeme(0, sym("a"))));
		parser.parse(Arrays.asList(new OperandLexeme(0, sym("b"))));
	}
}
