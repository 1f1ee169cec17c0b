package aldafmt.errors;

import aldafmt.model.alda.AldaNode;

public class MissingChildrenIssue extends Issue {
	private final AldaNode node;

	public MissingChildrenIssue(AldaNode node) {
		this.node = node;
	}

	public AldaNode getNode() {
		return node;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
