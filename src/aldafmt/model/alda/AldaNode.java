package aldafmt.model.alda;

import aldafmt.errors.ChildCountIssue;
import aldafmt.errors.LiteralTypeMismatchIssue;
import aldafmt.errors.MissingChildrenIssue;
import aldafmt.errors.NodeTypeMismatchIssue;
import aldafmt.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 *
 * A node of a parsed Alda score. Every node carries a tag, an optional literal whose Java type depends on the tag,
 * and an ordered list of children. Nodes are immutable.
 *
 * The expect* methods check the shape a consumer relies on and throw an {@link aldafmt.errors.Issue} describing
 * this node when it does not hold.
 *
 */
public final class AldaNode {
	private final SourceLocation location;
	private final AldaNodeType type;
	private final Object literal;
	private final List<AldaNode> children;

	public AldaNode(SourceLocation location, AldaNodeType type, Object literal, List<AldaNode> children) {
		this.location = Objects.requireNonNull(location);
		this.type = Objects.requireNonNull(type);
		this.literal = literal;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public SourceLocation getLocation() {
		return location;
	}

	public AldaNodeType getType() {
		return type;
	}

	public Object getLiteral() {
		return literal;
	}

	public List<AldaNode> getChildren() {
		return children;
	}

	public AldaNode getChild(int index) {
		return children.get(index);
	}

	public int getChildCount() {
		return children.size();
	}

	public void expectNChildren(int... counts) throws ChildCountIssue {
		for (int count : counts) {
			if (children.size() == count) {
				return;
			}
		}
		throw new ChildCountIssue(this, counts);
	}

	public void expectChildren() throws MissingChildrenIssue {
		if (children.isEmpty()) {
			throw new MissingChildrenIssue(this);
		}
	}

	public AldaNode expectNodeType(AldaNodeType expected) throws NodeTypeMismatchIssue {
		if (type != expected) {
			throw new NodeTypeMismatchIssue(this, expected);
		}
		return this;
	}

	public AldaNode expectChild(int index, AldaNodeType expected) throws ChildCountIssue, NodeTypeMismatchIssue {
		if (index >= children.size()) {
			throw new ChildCountIssue(this, new int[] {index + 1});
		}
		return children.get(index).expectNodeType(expected);
	}

	public String getText() throws LiteralTypeMismatchIssue {
		return expectLiteral(String.class);
	}

	public int getInt() throws LiteralTypeMismatchIssue {
		return expectLiteral(Integer.class);
	}

	public char getLetter() throws LiteralTypeMismatchIssue {
		return expectLiteral(Character.class);
	}

	public double getFloat() throws LiteralTypeMismatchIssue {
		return expectLiteral(Double.class);
	}

	private <T> T expectLiteral(Class<T> cls) throws LiteralTypeMismatchIssue {
		if (!cls.isInstance(literal)) {
			throw new LiteralTypeMismatchIssue(this, cls);
		}
		return cls.cast(literal);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, literal, children);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		AldaNode other = (AldaNode) obj;
		return type == other.type && Objects.equals(literal, other.literal) && children.equals(other.children);
	}

	/**
	 * Debug rendering used in diagnostics, e.g. {@code NOTE[NOTE_LETTER_AND_ACCIDENTALS[NOTE_LETTER('c')]]}.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(type.name());
		if (literal instanceof String) {
			sb.append("(\"").append(literal).append("\")");
		} else if (literal instanceof Character) {
			sb.append("('").append(literal).append("')");
		} else if (literal != null) {
			sb.append('(').append(literal).append(')');
		}
		if (!children.isEmpty()) {
			sb.append(children.stream().map(AldaNode::toString).collect(Collectors.joining(", ", "[", "]")));
		}
		return sb.toString();
	}
}
