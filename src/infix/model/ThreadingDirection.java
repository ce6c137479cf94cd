package infix.model;

import infix.model.tree.Call;
import infix.model.tree.CallTreeNode;
import infix.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Where a threading operator places the threaded value among the operation's arguments.
 */
public enum ThreadingDirection {
	FIRST {
		@Override
		public Call splice(SourceLocation location, CallTreeNode head, List<CallTreeNode> arguments, CallTreeNode value) {
			List<CallTreeNode> operands = new ArrayList<>(arguments.size() + 1);
			operands.add(value);
			operands.addAll(arguments);
			return new Call(location, head, operands);
		}
	},
	LAST {
		@Override
		public Call splice(SourceLocation location, CallTreeNode head, List<CallTreeNode> arguments, CallTreeNode value) {
			List<CallTreeNode> operands = new ArrayList<>(arguments.size() + 1);
			operands.addAll(arguments);
			operands.add(value);
			return new Call(location, head, operands);
		}
	};

	public abstract Call splice(SourceLocation location, CallTreeNode head, List<CallTreeNode> arguments,
	                            CallTreeNode value);
}
