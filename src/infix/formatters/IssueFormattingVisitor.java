package infix.formatters;

import infix.compiler.DanglingOperandIssue;
import infix.compiler.EmptyExpressionIssue;
import infix.compiler.MissingOperandIssue;
import infix.errors.IssueVisitor;
import infix.errors.IssueWithContext;
import infix.model.InvalidOperatorTableIssue;
import infix.model.OperatorSpec;
import infix.parser.Lexeme;
import infix.parser.UnbalancedGroupingIssue;
import infix.util.SourceLocation;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	static void writeLocation(IndentingWriter out, SourceLocation location) throws IOException {
		if (location != null && !location.isUnknown()) {
			out.write(" ");
			location.writePretty(out);
		}
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(InvalidOperatorTableIssue invalidOperatorTableIssue) throws IOException {
		out.write("invalid operator table: ");
		out.write(invalidOperatorTableIssue.getProblem());
		return null;
	}

	@Override
	public Void visit(UnbalancedGroupingIssue unbalancedGroupingIssue) throws IOException {
		Lexeme marker = unbalancedGroupingIssue.getMarker();
		out.write("unbalanced grouping: ");
		switch (unbalancedGroupingIssue.getProblem()) {
			case UNMATCHED_GROUP_END:
				out.write("group end at position " + marker.getPosition() + " has no matching group start");
				break;
			case UNCLOSED_GROUP_START:
				out.write("group start at position " + marker.getPosition() + " is never closed");
				break;
		}
		writeLocation(out, marker.getLocation());
		return null;
	}

	@Override
	public Void visit(MissingOperandIssue missingOperandIssue) throws IOException {
		OperatorSpec spec = missingOperandIssue.getOperator().getOperatorSpec();
		int available = missingOperandIssue.getAvailable();
		out.write("missing operand: operator ");
		out.write(spec.getTag());
		out.write(" at position " + missingOperandIssue.getOperator().getPosition());
		out.write(" needs " + spec.getArity() + " operand(s) but ");
		out.write(available == 0 ? "none is" : "only " + available + " is");
		out.write(" available");
		writeLocation(out, missingOperandIssue.getOperator().getLocation());
		return null;
	}

	@Override
	public Void visit(DanglingOperandIssue danglingOperandIssue) throws IOException {
		out.write("malformed expression: ");
		out.write(Integer.toString(danglingOperandIssue.getOperands().size()));
		out.write(" operands are not joined by any operator: ");
		out.writeSeparated(danglingOperandIssue.getOperands(), ", ",
				operand -> operand.accept(new CallTreeFormattingVisitor(out)));
		return null;
	}

	@Override
	public Void visit(EmptyExpressionIssue emptyExpressionIssue) throws IOException {
		out.write("empty expression");
		writeLocation(out, emptyExpressionIssue.getLocation());
		return null;
	}
}
