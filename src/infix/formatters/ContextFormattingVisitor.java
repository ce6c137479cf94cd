package infix.formatters;

import infix.compiler.WhileCompilingForm;
import infix.compiler.WhileCompilingLambda;
import infix.errors.ContextVisitor;
import infix.model.token.SymbolToken;
import infix.trans.WhileCompilingExpression;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {
	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileCompilingForm whileCompilingForm) throws IOException {
		out.write("while compiling form ");
		whileCompilingForm.getForm().accept(new TokenFormattingVisitor(out));
		IssueFormattingVisitor.writeLocation(out, whileCompilingForm.getForm().getLocation());
		return null;
	}

	@Override
	public Void visit(WhileCompilingLambda whileCompilingLambda) throws IOException {
		out.write("while compiling lambda with parameters [");
		out.writeSeparated(whileCompilingLambda.getParameters(), " ", (SymbolToken p) -> out.write(p.getName()));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(WhileCompilingExpression whileCompilingExpression) throws IOException {
		out.write("while compiling expression #" + whileCompilingExpression.getIndex());
		return null;
	}
}
