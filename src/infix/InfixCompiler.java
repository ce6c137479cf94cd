package infix;

import infix.compiler.CompilationJobExecutor;
import infix.compiler.CompilationJobFactory;
import infix.errors.Issue;
import infix.model.OperatorTable;
import infix.model.token.FormToken;
import infix.model.token.Token;
import infix.model.tree.CallTreeNode;
import infix.parser.FormKind;
import infix.parser.Lexeme;
import infix.util.SourceLocation;

import java.util.List;
import java.util.logging.Logger;

/**
 *
 * Compiles already-read token sequences into call trees.
 *
 * <pre>
 *     a + b * c          =&gt; (+ a (* b c))
 *     x =&gt; x * x         =&gt; (fn [x] (* x x))
 *     m -&gt; (get :k)      =&gt; (get m :k)
 * </pre>
 *
 * <p>A compiler holds nothing but its operator table, so one instance may be shared by
 * any number of threads. Nothing is ever evaluated: the result is handed to whatever
 * host collaborator executes or emits call trees.</p>
 *
 */
public class InfixCompiler {

	private static final Logger logger = Logger.getLogger("Infix Compiler");

	private final OperatorTable table;
	private final CompilationJobFactory jobs;

	public InfixCompiler() {
		this(OperatorTable.defaultTable());
	}

	public InfixCompiler(OperatorTable table) {
		this.table = table;
		this.jobs = new CompilationJobFactory(table);
	}

	public OperatorTable getTable() {
		return table;
	}

	/**
	 * Compiles one top-level expression: a lambda if tokens match
	 * {@code params => body}, an infix expression otherwise.
	 *
	 * @throws Issue if the expression is malformed; no partial tree is ever returned
	 */
	public CallTreeNode compile(List<Token> tokens) throws Issue {
		logger.fine("Compiling expression of " + tokens.size() + " token(s)");
		SourceLocation location = tokens.isEmpty() ? SourceLocation.unknown() : tokens.get(0).getLocation();
		return CompilationJobExecutor.execute(jobs.forExpression(tokens, location));
	}

	/**
	 * Compiles a single token the way a call argument is compiled: atoms and symbols
	 * become leaves, forms are classified and compiled according to their kind.
	 */
	public CallTreeNode compileElement(Token token) throws Issue {
		return CompilationJobExecutor.execute(jobs.forElement(token));
	}

	/**
	 * @return the postfix stream the parser produces for tokens; nested forms stay opaque
	 */
	public List<Lexeme> toPostfix(List<Token> tokens) throws Issue {
		return jobs.toPostfix(tokens);
	}

	public FormKind classify(FormToken form) {
		return jobs.getClassifier().classify(form);
	}
}
