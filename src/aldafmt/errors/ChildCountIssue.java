package aldafmt.errors;

import aldafmt.model.alda.AldaNode;

import java.util.Arrays;

public class ChildCountIssue extends Issue {
	private final AldaNode node;
	private final int[] expectedCounts;

	public ChildCountIssue(AldaNode node, int[] expectedCounts) {
		this.node = node;
		this.expectedCounts = Arrays.copyOf(expectedCounts, expectedCounts.length);
	}

	public AldaNode getNode() {
		return node;
	}

	public int[] getExpectedCounts() {
		return Arrays.copyOf(expectedCounts, expectedCounts.length);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
