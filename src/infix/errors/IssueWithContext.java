package infix.errors;

public class IssueWithContext extends Issue {
	private final Context context;
	private final Issue issue;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
		initCause(issue);
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	/**
	 * @return the innermost issue, with every layer of context removed
	 */
	public Issue getRootIssue() {
		Issue current = issue;
		while(current instanceof IssueWithContext) {
			current = ((IssueWithContext) current).getIssue();
		}
		return current;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
