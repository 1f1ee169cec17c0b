package aldafmt.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(ChildCountIssue childCountIssue) throws E;
	public abstract T visit(MissingChildrenIssue missingChildrenIssue) throws E;
	public abstract T visit(NodeTypeMismatchIssue nodeTypeMismatchIssue) throws E;
	public abstract T visit(LiteralTypeMismatchIssue literalTypeMismatchIssue) throws E;
	public abstract T visit(InvalidLiteralIssue invalidLiteralIssue) throws E;
	public abstract T visit(UnexpectedNodeIssue unexpectedNodeIssue) throws E;
}
