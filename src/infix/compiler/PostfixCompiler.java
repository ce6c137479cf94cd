package infix.compiler;

import infix.InternalCompilerError;
import infix.model.OperatorSpec;
import infix.model.tree.Call;
import infix.model.tree.CallTreeNode;
import infix.model.tree.Literal;
import infix.model.tree.NilSafeCall;
import infix.model.tree.Symbol;
import infix.model.token.AtomToken;
import infix.model.token.FormToken;
import infix.model.token.SymbolToken;
import infix.model.token.TokenVisitor;
import infix.parser.GroupEndLexeme;
import infix.parser.GroupStartLexeme;
import infix.parser.Lexeme;
import infix.parser.LexemeVisitor;
import infix.parser.NestedFormLexeme;
import infix.parser.OperandLexeme;
import infix.parser.OperatorLexeme;
import infix.util.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 *
 * Stack machine turning a postfix lexeme stream into a single call tree.
 *
 * <ul>
 *     <li>unary operators pop one operand a and push {@code (op a)}</li>
 *     <li>binary operators pop b then a and push {@code (op a b)}</li>
 *     <li>threading operators pop the operation b then the data a and splice a into b as
 *     its first or last argument if b is a call, or call b with a otherwise; nil-safe
 *     threading operators build a {@link NilSafeCall} instead</li>
 * </ul>
 *
 * <p>Nested forms are compiled before this runs; their results are supplied in the
 * order their lexemes appear in the postfix stream.</p>
 *
 */
public class PostfixCompiler {

	public CallTreeNode compile(List<Lexeme> postfix, List<CallTreeNode> nestedForms, SourceLocation location) {
		Deque<CallTreeNode> stack = new ArrayDeque<>();
		Iterator<CallTreeNode> nested = nestedForms.iterator();
		LexemeVisitor<Void, RuntimeException> step = new LexemeVisitor<Void, RuntimeException>() {
			@Override
			public Void visit(OperandLexeme operandLexeme) {
				stack.push(leaf(operandLexeme));
				return null;
			}

			@Override
			public Void visit(NestedFormLexeme nestedFormLexeme) {
				if (!nested.hasNext()) {
					throw new InternalCompilerError("no compiled result for nested form at position " +
							nestedFormLexeme.getPosition());
				}
				stack.push(nested.next());
				return null;
			}

			@Override
			public Void visit(OperatorLexeme operatorLexeme) {
				apply(stack, operatorLexeme);
				return null;
			}

			@Override
			public Void visit(GroupStartLexeme groupStartLexeme) {
				throw new InternalCompilerError("group marker in postfix stream at position " +
						groupStartLexeme.getPosition());
			}

			@Override
			public Void visit(GroupEndLexeme groupEndLexeme) {
				throw new InternalCompilerError("group marker in postfix stream at position " +
						groupEndLexeme.getPosition());
			}
		};
		for (Lexeme lexeme : postfix) {
			lexeme.accept(step);
		}
		if (stack.isEmpty()) {
			throw new EmptyExpressionIssue(location);
		}
		if (stack.size() > 1) {
			List<CallTreeNode> remaining = new ArrayList<>(stack);
			Collections.reverse(remaining);
			throw new DanglingOperandIssue(remaining);
		}
		return stack.pop();
	}

	private static CallTreeNode leaf(OperandLexeme operand) {
		return operand.getToken().accept(new TokenVisitor<CallTreeNode, RuntimeException>() {
			@Override
			public CallTreeNode visit(AtomToken atomToken) {
				return new Literal(atomToken.getLocation(), atomToken.getValue());
			}

			@Override
			public CallTreeNode visit(SymbolToken symbolToken) {
				return new Symbol(symbolToken.getLocation(), symbolToken.getName());
			}

			@Override
			public CallTreeNode visit(FormToken formToken) {
				throw new InternalCompilerError("form token used as a plain operand");
			}
		});
	}

	private static void apply(Deque<CallTreeNode> stack, OperatorLexeme operator) {
		OperatorSpec spec = operator.getOperatorSpec();
		if (stack.size() < spec.getArity()) {
			throw new MissingOperandIssue(operator, stack.size());
		}
		SourceLocation location = operator.getLocation();
		Symbol op = new Symbol(location, spec.getTag());
		switch (spec.getArityClass()) {
			case UNARY: {
				CallTreeNode a = stack.pop();
				stack.push(new Call(location, op, Collections.singletonList(a)));
				break;
			}
			case BINARY: {
				CallTreeNode b = stack.pop();
				CallTreeNode a = stack.pop();
				List<CallTreeNode> operands = new ArrayList<>(2);
				operands.add(a);
				operands.add(b);
				stack.push(new Call(location, op, operands));
				break;
			}
			case THREADING: {
				CallTreeNode operation = stack.pop();
				CallTreeNode data = stack.pop();
				stack.push(thread(location, spec, data, operation));
				break;
			}
			default:
				throw new InternalCompilerError("unhandled arity class " + spec.getArityClass());
		}
	}

	/**
	 * Splices data into operation according to a threading operator's direction and
	 * nil-safety.
	 */
	public static CallTreeNode thread(SourceLocation location, OperatorSpec spec, CallTreeNode data,
	                                  CallTreeNode operation) {
		final CallTreeNode head;
		final List<CallTreeNode> arguments;
		if (operation instanceof Call) {
			head = ((Call) operation).getHead();
			arguments = ((Call) operation).getOperands();
		} else {
			head = operation;
			arguments = Collections.emptyList();
		}
		if (spec.isNilSafe()) {
			return new NilSafeCall(location, spec.getDirection(), data, head, arguments);
		}
		return spec.getDirection().splice(location, head, arguments, data);
	}
}
