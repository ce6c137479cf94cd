package infix.formatters;

import infix.model.ThreadingDirection;
import infix.model.tree.Call;
import infix.model.tree.CallTreeNode;
import infix.model.tree.CallTreeNodeVisitor;
import infix.model.tree.CollectionLiteral;
import infix.model.tree.Lambda;
import infix.model.tree.Literal;
import infix.model.tree.NilSafeCall;
import infix.model.tree.Symbol;

import java.io.IOException;

/**
 * Writes call trees in prefix notation: {@code (head operand ...)} for calls,
 * {@code (fn [params] body)} for lambdas and {@code (some-> subject (head args))} or
 * {@code (some->> ...)} for nil-safe calls.
 */
public class CallTreeFormattingVisitor extends CallTreeNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public CallTreeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(Literal literal) throws IOException {
		TokenFormattingVisitor.writeValue(out, literal.getValue());
		return null;
	}

	@Override
	public Void visit(Symbol symbol) throws IOException {
		out.write(symbol.getName());
		return null;
	}

	@Override
	public Void visit(Call call) throws IOException {
		out.write("(");
		call.getHead().accept(this);
		for (CallTreeNode operand : call.getOperands()) {
			out.write(" ");
			operand.accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(NilSafeCall nilSafeCall) throws IOException {
		out.write(nilSafeCall.getDirection() == ThreadingDirection.FIRST ? "(some-> " : "(some->> ");
		nilSafeCall.getSubject().accept(this);
		out.write(" (");
		nilSafeCall.getHead().accept(this);
		for (CallTreeNode argument : nilSafeCall.getArguments()) {
			out.write(" ");
			argument.accept(this);
		}
		out.write("))");
		return null;
	}

	@Override
	public Void visit(Lambda lambda) throws IOException {
		out.write("(fn [");
		out.writeSeparated(lambda.getParameters(), " ", p -> p.accept(this));
		out.write("] ");
		lambda.getBody().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CollectionLiteral collectionLiteral) throws IOException {
		out.write(collectionLiteral.getDelimiter().getOpen());
		out.writeSeparated(collectionLiteral.getElements(), " ", e -> e.accept(this));
		out.write(collectionLiteral.getDelimiter().getClose());
		return null;
	}
}
