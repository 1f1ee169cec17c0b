package aldafmt.errors;

import aldafmt.model.alda.AldaNode;

/**
 * A node whose tag has no formatting rule where it was found, e.g. a denominator in event position.
 */
public class UnexpectedNodeIssue extends Issue {
	private final AldaNode node;
	private final String context;

	public UnexpectedNodeIssue(AldaNode node, String context) {
		this.node = node;
		this.context = context;
	}

	public AldaNode getNode() {
		return node;
	}

	/**
	 * @return what was being formatted, e.g. "event" or "duration"
	 */
	public String getContext() {
		return context;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
