package infix.compiler;

import infix.InternalCompilerError;
import infix.errors.Context;
import infix.model.OperatorTable;
import infix.model.token.AtomToken;
import infix.model.token.FormToken;
import infix.model.token.SymbolToken;
import infix.model.token.Token;
import infix.model.token.TokenVisitor;
import infix.model.tree.Call;
import infix.model.tree.CallTreeNode;
import infix.model.tree.CollectionLiteral;
import infix.model.tree.Lambda;
import infix.model.tree.Literal;
import infix.model.tree.Symbol;
import infix.parser.Flattener;
import infix.parser.FormKind;
import infix.parser.GroupingClassifier;
import infix.parser.LambdaDisambiguator;
import infix.parser.Lexeme;
import infix.parser.NestedFormLexeme;
import infix.parser.PrecedenceParser;
import infix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 *
 * Builds the compilation jobs for expressions, forms and single elements against one
 * operator table.
 *
 * <ul>
 *     <li>an expression is checked for the lambda pattern, then flattened, parsed into
 *     postfix and compiled; its opaque nested forms are its dependencies</li>
 *     <li>a call-form compiles its head and each argument as a single element, so a lone
 *     operator argument such as the + in {@code (reduce + 0 xs)} stays a symbol</li>
 *     <li>a collection literal compiles each element as a single element</li>
 * </ul>
 *
 */
public class CompilationJobFactory {

	private static final Logger logger = Logger.getLogger("Infix Compiler");

	private final GroupingClassifier classifier;
	private final LambdaDisambiguator lambdaDisambiguator;
	private final Flattener flattener;
	private final PostfixCompiler postfixCompiler;

	public CompilationJobFactory(OperatorTable table) {
		this.classifier = new GroupingClassifier(table);
		this.lambdaDisambiguator = new LambdaDisambiguator(table);
		this.flattener = new Flattener(table, classifier);
		this.postfixCompiler = new PostfixCompiler();
	}

	public GroupingClassifier getClassifier() {
		return classifier;
	}

	/**
	 * @return the postfix stream for tokens, without compiling any nested form
	 */
	public List<Lexeme> toPostfix(List<Token> tokens) {
		return PrecedenceParser.toPostfix(flattener.flatten(tokens));
	}

	public CompilationJob forExpression(List<Token> tokens, SourceLocation location) {
		if (lambdaDisambiguator.matches(tokens)) {
			return new LambdaJob(lambdaDisambiguator.getParameters(tokens), lambdaDisambiguator.getBody(tokens),
					location);
		}
		return new ExpressionJob(tokens, location);
	}

	public CompilationJob forElement(Token token) {
		return token.accept(new TokenVisitor<CompilationJob, RuntimeException>() {
			@Override
			public CompilationJob visit(AtomToken atomToken) {
				return new LeafJob(new Literal(atomToken.getLocation(), atomToken.getValue()));
			}

			@Override
			public CompilationJob visit(SymbolToken symbolToken) {
				return new LeafJob(new Symbol(symbolToken.getLocation(), symbolToken.getName()));
			}

			@Override
			public CompilationJob visit(FormToken formToken) {
				return forForm(formToken, classifier.classify(formToken));
			}
		});
	}

	public CompilationJob forForm(FormToken form, FormKind kind) {
		switch (kind) {
			case CALL_FORM:
				return new CallFormJob(form);
			case COLLECTION:
				return new CollectionJob(form);
			case LAMBDA:
			case GROUPED_EXPRESSION:
				return forExpression(form.getElements(), form.getLocation());
			default:
				throw new InternalCompilerError("unhandled form kind " + kind);
		}
	}

	private List<CompilationJob> forElements(List<Token> tokens) {
		List<CompilationJob> jobs = new ArrayList<>(tokens.size());
		for (Token token : tokens) {
			jobs.add(forElement(token));
		}
		return jobs;
	}

	private final class ExpressionJob extends CompilationJob {
		private final List<Token> tokens;
		private final SourceLocation location;
		private List<Lexeme> postfix;

		ExpressionJob(List<Token> tokens, SourceLocation location) {
			this.tokens = tokens;
			this.location = location;
		}

		@Override
		public List<CompilationJob> prepare() {
			postfix = toPostfix(tokens);
			if (logger.isLoggable(Level.FINEST)) {
				logger.finest("postfix: " + postfix.stream().map(Lexeme::toString).collect(Collectors.joining(" ")));
			}
			List<CompilationJob> nested = new ArrayList<>();
			for (Lexeme lexeme : postfix) {
				if (lexeme instanceof NestedFormLexeme) {
					NestedFormLexeme form = (NestedFormLexeme) lexeme;
					nested.add(forForm(form.getForm(), form.getKind()));
				}
			}
			return nested;
		}

		@Override
		public CallTreeNode complete(List<CallTreeNode> dependencyResults) {
			return postfixCompiler.compile(postfix, dependencyResults, location);
		}
	}

	private final class LambdaJob extends CompilationJob {
		private final List<SymbolToken> parameters;
		private final List<Token> body;
		private final SourceLocation location;

		LambdaJob(List<SymbolToken> parameters, List<Token> body, SourceLocation location) {
			this.parameters = parameters;
			this.body = body;
			this.location = location;
		}

		@Override
		public List<CompilationJob> prepare() {
			SourceLocation bodyLocation = body.get(0).getLocation();
			return Collections.singletonList(new ExpressionJob(body, bodyLocation));
		}

		@Override
		public CallTreeNode complete(List<CallTreeNode> dependencyResults) {
			List<Symbol> symbols = new ArrayList<>(parameters.size());
			for (SymbolToken parameter : parameters) {
				symbols.add(new Symbol(parameter.getLocation(), parameter.getName()));
			}
			return new Lambda(location, symbols, dependencyResults.get(0));
		}

		@Override
		public Context getContext() {
			return new WhileCompilingLambda(parameters);
		}
	}

	private final class CallFormJob extends CompilationJob {
		private final FormToken form;

		CallFormJob(FormToken form) {
			this.form = form;
		}

		@Override
		public List<CompilationJob> prepare() {
			return forElements(form.getElements());
		}

		@Override
		public CallTreeNode complete(List<CallTreeNode> dependencyResults) {
			return new Call(form.getLocation(), dependencyResults.get(0),
					dependencyResults.subList(1, dependencyResults.size()));
		}

		@Override
		public Context getContext() {
			return new WhileCompilingForm(form);
		}
	}

	private final class CollectionJob extends CompilationJob {
		private final FormToken form;

		CollectionJob(FormToken form) {
			this.form = form;
		}

		@Override
		public List<CompilationJob> prepare() {
			return forElements(form.getElements());
		}

		@Override
		public CallTreeNode complete(List<CallTreeNode> dependencyResults) {
			return new CollectionLiteral(form.getLocation(), form.getDelimiter(), dependencyResults);
		}

		@Override
		public Context getContext() {
			return new WhileCompilingForm(form);
		}
	}

	private static final class LeafJob extends CompilationJob {
		private final CallTreeNode leaf;

		LeafJob(CallTreeNode leaf) {
			this.leaf = leaf;
		}

		@Override
		public List<CompilationJob> prepare() {
			return Collections.emptyList();
		}

		@Override
		public CallTreeNode complete(List<CallTreeNode> dependencyResults) {
			return leaf;
		}
	}
}
