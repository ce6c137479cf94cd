package infix.compiler;

import infix.errors.Context;
import infix.model.tree.CallTreeNode;

import java.util.List;

/**
 *
 * One unit of work for the {@link CompilationJobExecutor}: something that can only be
 * completed once the jobs it depends on have produced their trees.
 *
 */
public abstract class CompilationJob {

	/**
	 * Called once, when the executor reaches this job.
	 *
	 * @return the jobs whose results {@link #complete(List)} needs, in order
	 */
	public abstract List<CompilationJob> prepare();

	/**
	 * @param dependencyResults the trees produced by the jobs {@link #prepare()} returned, in the same order
	 */
	public abstract CallTreeNode complete(List<CallTreeNode> dependencyResults);

	/**
	 * @return the context attached to issues raised while this job or any of its
	 * dependencies runs, or null for none
	 */
	public Context getContext() {
		return null;
	}
}
