package infix.formatters;

import infix.parser.GroupEndLexeme;
import infix.parser.GroupStartLexeme;
import infix.parser.LexemeVisitor;
import infix.parser.NestedFormLexeme;
import infix.parser.OperandLexeme;
import infix.parser.OperatorLexeme;

import java.io.IOException;

public class LexemeFormattingVisitor extends LexemeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public LexemeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(OperandLexeme operandLexeme) throws IOException {
		operandLexeme.getToken().accept(new TokenFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(NestedFormLexeme nestedFormLexeme) throws IOException {
		nestedFormLexeme.getForm().accept(new TokenFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(OperatorLexeme operatorLexeme) throws IOException {
		out.write(operatorLexeme.getOperatorSpec().getTag());
		return null;
	}

	@Override
	public Void visit(GroupStartLexeme groupStartLexeme) throws IOException {
		out.write("(");
		return null;
	}

	@Override
	public Void visit(GroupEndLexeme groupEndLexeme) throws IOException {
		out.write(")");
		return null;
	}
}
