package infix.parser;

import infix.model.OperatorSpec;
import infix.model.OperatorTable;
import infix.model.token.AtomToken;
import infix.model.token.FormToken;
import infix.model.token.SymbolToken;
import infix.model.token.Token;
import infix.model.token.TokenVisitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 *
 * Turns a token sequence into one linear lexeme stream. Grouped sub-expressions are
 * spliced in between a group start and a group end, recursively; every other form stays a
 * single opaque lexeme. The markers emitted are always balanced.
 *
 * <p>The walk keeps its own stack of partially consumed groups, so nesting depth is not
 * limited by the Java call stack.</p>
 *
 */
public class Flattener {

	private final OperatorTable table;
	private final GroupingClassifier classifier;

	public Flattener(OperatorTable table, GroupingClassifier classifier) {
		this.table = table;
		this.classifier = classifier;
	}

	private static final class PendingGroup {
		final FormToken group;
		final Iterator<Token> remaining;

		PendingGroup(FormToken group, Iterator<Token> remaining) {
			this.group = group;
			this.remaining = remaining;
		}
	}

	public List<Lexeme> flatten(List<Token> tokens) {
		List<Lexeme> output = new ArrayList<>();
		Deque<PendingGroup> pending = new ArrayDeque<>();
		pending.push(new PendingGroup(null, tokens.iterator()));
		while (!pending.isEmpty()) {
			PendingGroup current = pending.peek();
			if (!current.remaining.hasNext()) {
				pending.pop();
				if (current.group != null) {
					output.add(new GroupEndLexeme(output.size(), current.group.getLocation()));
				}
				continue;
			}
			Token token = current.remaining.next();
			token.accept(new TokenVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(AtomToken atomToken) {
					output.add(new OperandLexeme(output.size(), atomToken));
					return null;
				}

				@Override
				public Void visit(SymbolToken symbolToken) {
					OperatorSpec spec = table.getSpec(symbolToken.getName());
					if (spec != null) {
						output.add(new OperatorLexeme(output.size(), symbolToken, spec));
					} else {
						output.add(new OperandLexeme(output.size(), symbolToken));
					}
					return null;
				}

				@Override
				public Void visit(FormToken formToken) {
					FormKind kind = classifier.classify(formToken);
					if (kind == FormKind.GROUPED_EXPRESSION) {
						output.add(new GroupStartLexeme(output.size(), formToken.getLocation()));
						pending.push(new PendingGroup(formToken, formToken.getElements().iterator()));
					} else {
						output.add(new NestedFormLexeme(output.size(), formToken, kind));
					}
					return null;
				}
			});
		}
		return output;
	}
}
