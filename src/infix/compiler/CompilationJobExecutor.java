package infix.compiler;

import infix.errors.Context;
import infix.errors.Issue;
import infix.model.tree.CallTreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 *
 * Runs a tree of compilation jobs depth first on an explicit stack, so that deeply
 * nested input costs heap instead of Java stack frames.
 *
 * <p>An issue raised anywhere is wrapped with the context of every job still on the
 * stack, innermost first, before it is rethrown.</p>
 *
 */
public class CompilationJobExecutor {
	private CompilationJobExecutor() {}

	private static final class Frame {
		final CompilationJob job;
		List<CompilationJob> dependencies;
		final List<CallTreeNode> results = new ArrayList<>();

		Frame(CompilationJob job) {
			this.job = job;
		}
	}

	public static CallTreeNode execute(CompilationJob root) {
		Deque<Frame> frames = new ArrayDeque<>();
		frames.push(new Frame(root));
		try {
			while (true) {
				Frame frame = frames.peek();
				if (frame.dependencies == null) {
					frame.dependencies = frame.job.prepare();
				}
				if (frame.results.size() < frame.dependencies.size()) {
					frames.push(new Frame(frame.dependencies.get(frame.results.size())));
					continue;
				}
				CallTreeNode node = frame.job.complete(frame.results);
				frames.pop();
				if (frames.isEmpty()) {
					return node;
				}
				frames.peek().results.add(node);
			}
		} catch (Issue issue) {
			Issue wrapped = issue;
			for (Frame frame : frames) {
				Context context = frame.job.getContext();
				if (context != null) {
					wrapped = wrapped.withContext(context);
				}
			}
			throw wrapped;
		}
	}
}
