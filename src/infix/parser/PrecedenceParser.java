package infix.parser;

import infix.model.OperatorSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 *
 * Shunting-yard conversion of a flattened lexeme stream into postfix order.
 *
 * <p>Operands go straight to the output. An incoming operator first pops every stacked
 * operator that binds tighter, or equally tight when the incoming operator is
 * left-associative; group markers bound the popping. Each operator is pushed and popped
 * at most once, so a parse is linear in the length of the stream.</p>
 *
 * <p>A parser holds the state of one parse and must not be reused.</p>
 *
 */
public class PrecedenceParser {

	private final List<Lexeme> output = new ArrayList<>();
	private final Deque<Lexeme> operators = new ArrayDeque<>();
	private boolean used = false;

	public static List<Lexeme> toPostfix(List<Lexeme> flattened) {
		return new PrecedenceParser().parse(flattened);
	}

	public List<Lexeme> parse(List<Lexeme> flattened) {
		if (used) {
			throw new IllegalStateException("a PrecedenceParser can only be used once");
		}
		used = true;
		LexemeVisitor<Void, UnbalancedGroupingIssue> step = new LexemeVisitor<Void, UnbalancedGroupingIssue>() {
			@Override
			public Void visit(OperandLexeme operandLexeme) {
				output.add(operandLexeme);
				return null;
			}

			@Override
			public Void visit(NestedFormLexeme nestedFormLexeme) {
				output.add(nestedFormLexeme);
				return null;
			}

			@Override
			public Void visit(OperatorLexeme operatorLexeme) {
				popTighterOperators(operatorLexeme.getOperatorSpec());
				operators.push(operatorLexeme);
				return null;
			}

			@Override
			public Void visit(GroupStartLexeme groupStartLexeme) {
				operators.push(groupStartLexeme);
				return null;
			}

			@Override
			public Void visit(GroupEndLexeme groupEndLexeme) throws UnbalancedGroupingIssue {
				closeGroup(groupEndLexeme);
				return null;
			}
		};
		for (Lexeme lexeme : flattened) {
			lexeme.accept(step);
		}
		while (!operators.isEmpty()) {
			Lexeme top = operators.pop();
			if (top.isGroupStart()) {
				throw new UnbalancedGroupingIssue(UnbalancedGroupingIssue.Problem.UNCLOSED_GROUP_START, top);
			}
			output.add(top);
		}
		return output;
	}

	private void popTighterOperators(OperatorSpec incoming) {
		while (!operators.isEmpty() && operators.peek().isOperator()) {
			OperatorSpec top = operators.peek().getOperatorSpec();
			int cmp = top.getPrecedence().compareTo(incoming.getPrecedence());
			if (cmp > 0 || (cmp == 0 && incoming.isLeftAssociative())) {
				output.add(operators.pop());
			} else {
				break;
			}
		}
	}

	private void closeGroup(GroupEndLexeme end) throws UnbalancedGroupingIssue {
		while (true) {
			if (operators.isEmpty()) {
				throw new UnbalancedGroupingIssue(UnbalancedGroupingIssue.Problem.UNMATCHED_GROUP_END, end);
			}
			Lexeme top = operators.pop();
			if (top.isGroupStart()) {
				return;
			}
			output.add(top);
		}
	}
}
