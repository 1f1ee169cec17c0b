package aldafmt.errors;

import aldafmt.model.alda.AldaNode;
import aldafmt.model.alda.AldaNodeType;

public class NodeTypeMismatchIssue extends Issue {
	private final AldaNode node;
	private final AldaNodeType expected;

	public NodeTypeMismatchIssue(AldaNode node, AldaNodeType expected) {
		this.node = node;
		this.expected = expected;
	}

	public AldaNode getNode() {
		return node;
	}

	public AldaNodeType getExpected() {
		return expected;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
