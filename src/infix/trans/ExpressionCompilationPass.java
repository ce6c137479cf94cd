package infix.trans;

import infix.InfixCompiler;
import infix.errors.Issue;
import infix.errors.IssueContext;
import infix.model.token.Token;
import infix.model.tree.CallTreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Compiles expressions, reporting issues to an {@link IssueContext} instead of throwing
 * them.
 */
public class ExpressionCompilationPass {
	private ExpressionCompilationPass() {}

	private static final Logger logger = Logger.getLogger("Infix Compiler");

	/**
	 * @return the compiled tree, or null if an issue was reported to ctx
	 */
	public static CallTreeNode perform(IssueContext ctx, InfixCompiler compiler, List<Token> tokens) {
		try {
			return compiler.compile(tokens);
		} catch (Issue issue) {
			ctx.error(issue);
			return null;
		}
	}

	/**
	 * Compiles each expression independently; an issue in one does not stop the others.
	 *
	 * @return one entry per expression, null where that expression's issue was reported
	 * to ctx
	 */
	public static List<CallTreeNode> performAll(IssueContext ctx, InfixCompiler compiler, List<List<Token>> expressions) {
		List<CallTreeNode> results = new ArrayList<>(expressions.size());
		int failed = 0;
		for (int i = 0; i < expressions.size(); i++) {
			CallTreeNode result = perform(ctx.withContext(new WhileCompilingExpression(i)), compiler, expressions.get(i));
			if (result == null) {
				failed++;
			}
			results.add(result);
		}
		if (failed > 0) {
			logger.warning(failed + " of " + expressions.size() + " expression(s) failed to compile");
		}
		return results;
	}
}
