package aldafmt.errors;

import aldafmt.model.alda.AldaNode;

public class LiteralTypeMismatchIssue extends Issue {
	private final AldaNode node;
	private final Class<?> expected;

	public LiteralTypeMismatchIssue(AldaNode node, Class<?> expected) {
		this.node = node;
		this.expected = expected;
	}

	public AldaNode getNode() {
		return node;
	}

	public Class<?> getExpected() {
		return expected;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
