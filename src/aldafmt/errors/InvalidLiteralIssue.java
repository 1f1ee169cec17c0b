package aldafmt.errors;

import aldafmt.model.alda.AldaNode;

/**
 * The literal has the right type but a value no Alda source can express, such as a NaN denominator.
 */
public class InvalidLiteralIssue extends Issue {
	private final AldaNode node;
	private final String expected;

	public InvalidLiteralIssue(AldaNode node, String expected) {
		this.node = node;
		this.expected = expected;
	}

	public AldaNode getNode() {
		return node;
	}

	public String getExpected() {
		return expected;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
