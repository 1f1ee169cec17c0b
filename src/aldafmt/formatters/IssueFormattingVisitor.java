package aldafmt.formatters;

import aldafmt.errors.ChildCountIssue;
import aldafmt.errors.InvalidLiteralIssue;
import aldafmt.errors.IssueVisitor;
import aldafmt.errors.LiteralTypeMismatchIssue;
import aldafmt.errors.MissingChildrenIssue;
import aldafmt.errors.NodeTypeMismatchIssue;
import aldafmt.errors.UnexpectedNodeIssue;
import aldafmt.model.alda.AldaNode;

import java.io.IOException;
import java.io.Writer;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private Writer out;

	public IssueFormattingVisitor(Writer out) {
		this.out = out;
	}

	private void writeNode(AldaNode node) throws IOException {
		out.write(": ");
		out.write(node.toString());
		if (!node.getLocation().isUnknown()) {
			out.write(" ");
			out.write(node.getLocation().prettyString());
		}
	}

	@Override
	public Void visit(ChildCountIssue childCountIssue) throws IOException {
		AldaNode node = childCountIssue.getNode();
		int[] counts = childCountIssue.getExpectedCounts();
		out.write("expected ");
		out.write(node.getType().name());
		out.write(" to have ");
		for (int i = 0; i < counts.length; i++) {
			if (i > 0) {
				out.write(i == counts.length - 1 ? " or " : ", ");
			}
			out.write(Integer.toString(counts[i]));
		}
		out.write(" children but found ");
		out.write(Integer.toString(node.getChildCount()));
		writeNode(node);
		return null;
	}

	@Override
	public Void visit(MissingChildrenIssue missingChildrenIssue) throws IOException {
		AldaNode node = missingChildrenIssue.getNode();
		out.write("expected ");
		out.write(node.getType().name());
		out.write(" to have at least one child");
		writeNode(node);
		return null;
	}

	@Override
	public Void visit(NodeTypeMismatchIssue nodeTypeMismatchIssue) throws IOException {
		AldaNode node = nodeTypeMismatchIssue.getNode();
		out.write("expected node of type ");
		out.write(nodeTypeMismatchIssue.getExpected().name());
		out.write(" but found ");
		out.write(node.getType().name());
		writeNode(node);
		return null;
	}

	@Override
	public Void visit(LiteralTypeMismatchIssue literalTypeMismatchIssue) throws IOException {
		AldaNode node = literalTypeMismatchIssue.getNode();
		out.write("expected ");
		out.write(node.getType().name());
		out.write(" to hold a ");
		out.write(literalTypeMismatchIssue.getExpected().getSimpleName());
		out.write(" literal but found ");
		out.write(node.getLiteral() == null ? "none" : node.getLiteral().getClass().getSimpleName());
		writeNode(node);
		return null;
	}

	@Override
	public Void visit(InvalidLiteralIssue invalidLiteralIssue) throws IOException {
		AldaNode node = invalidLiteralIssue.getNode();
		out.write("expected ");
		out.write(node.getType().name());
		out.write(" to hold ");
		out.write(invalidLiteralIssue.getExpected());
		out.write(" but found ");
		out.write(String.valueOf(node.getLiteral()));
		writeNode(node);
		return null;
	}

	@Override
	public Void visit(UnexpectedNodeIssue unexpectedNodeIssue) throws IOException {
		AldaNode node = unexpectedNodeIssue.getNode();
		out.write("unexpected ");
		out.write(node.getType().name());
		out.write(" during formatting of ");
		out.write(unexpectedNodeIssue.getContext());
		writeNode(node);
		return null;
	}
}
