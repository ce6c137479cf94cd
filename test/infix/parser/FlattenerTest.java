package infix.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import infix.model.OperatorTable;
import infix.model.token.FormToken;
import infix.model.token.Token;

import static infix.model.token.TokenBuilder.*;

public class FlattenerTest {

	private final OperatorTable table = OperatorTable.defaultTable();
	private final Flattener flattener = new Flattener(table, new GroupingClassifier(table));

	private static String render(List<Lexeme> lexemes) {
		return lexemes.stream().map(Lexeme::toString).collect(Collectors.joining(" "));
	}

	@Test
	public void plainExpression() {
		List<Lexeme> lexemes = flattener.flatten(tokens(sym("a"), sym("+"), num(1)));
		assertThat(render(lexemes), is("a + 1"));
		assertThat(lexemes.get(0), is(instanceOf(OperandLexeme.class)));
		assertThat(lexemes.get(1), is(instanceOf(OperatorLexeme.class)));
		assertThat(lexemes.get(1).getOperatorSpec(), is(table.getSpec("+")));
		assertThat(lexemes.get(2), is(instanceOf(OperandLexeme.class)));
	}

	@Test
	public void groupsAreSplicedBetweenMarkers() {
		List<Lexeme> lexemes = flattener.flatten(tokens(
				list(sym("a"), sym("+"), group(sym("b"), sym("-"), sym("c"))), sym("*"), sym("d")));
		assertThat(render(lexemes), is("( a + ( b - c ) ) * d"));
		assertTrue(lexemes.get(0).isGroupStart());
		assertThat(lexemes.get(8), is(instanceOf(GroupEndLexeme.class)));
		assertThat(lexemes.get(9).isOperator(), is(true));
	}

	@Test
	public void positionsFollowTheStream() {
		List<Lexeme> lexemes = flattener.flatten(tokens(group(sym("a"), sym("or"), sym("b")), sym("and"), sym("c")));
		for (int i = 0; i < lexemes.size(); i++) {
			assertThat(lexemes.get(i).getPosition(), is(i));
		}
	}

	@Test
	public void otherFormsStayOpaque() {
		FormToken call = list(sym("f"), sym("x"), sym("+"));
		FormToken vec = vector(num(1), sym("+"), num(2));
		FormToken lambda = list(sym("x"), sym("=>"), sym("x"));
		List<Lexeme> lexemes = flattener.flatten(tokens(call, sym("->"), vec, sym("->"), lambda));
		assertThat(lexemes.size(), is(5));

		NestedFormLexeme first = (NestedFormLexeme) lexemes.get(0);
		assertThat(first.getForm(), is(call));
		assertThat(first.getKind(), is(FormKind.CALL_FORM));
		assertThat(((NestedFormLexeme) lexemes.get(2)).getKind(), is(FormKind.COLLECTION));
		assertThat(((NestedFormLexeme) lexemes.get(4)).getKind(), is(FormKind.LAMBDA));
	}

	@Test
	public void unknownTagsAreOperands() {
		List<Lexeme> lexemes = flattener.flatten(tokens(sym("a"), sym("**"), sym("b")));
		for (Lexeme lexeme : lexemes) {
			assertFalse(lexeme.isOperator());
		}
	}

	@Test
	public void deepGroupsDoNotRecurse() {
		Token expr = sym("x");
		int depth = 20000;
		for (int i = 0; i < depth; i++) {
			expr = group(expr, sym("+"), num(i));
		}
		List<Lexeme> lexemes = flattener.flatten(tokens(expr));
		// each level contributes two markers, an operator and an operand
		assertThat(lexemes.size(), is(depth * 4 + 1));
		assertTrue(lexemes.get(depth - 1).isGroupStart());
		assertThat(lexemes.get(depth).toString(), is("x"));
	}
}
