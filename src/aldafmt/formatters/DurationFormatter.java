package aldafmt.formatters;

import aldafmt.errors.InvalidLiteralIssue;
import aldafmt.errors.UnexpectedNodeIssue;
import aldafmt.model.alda.AldaNode;
import aldafmt.model.alda.AldaNodeType;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Writes a duration together with the text directly before and after it (no spaces).
 *
 * A duration is a single unwrappable token, except that each barline inside it splits it into separate tokens
 * so that the barline itself can be wrapped. Consecutive lengths are tied with '~'; a barline breaks the tie.
 */
public class DurationFormatter {

	private WrappingWriter out;

	public DurationFormatter(WrappingWriter out) {
		this.out = out;
	}

	public void format(String prefix, AldaNode duration, String suffix) throws IOException, AldaFormattingException {
		duration.expectNodeType(AldaNodeType.DURATION);

		StringBuilder text = new StringBuilder(prefix);
		boolean shouldTie = false;

		List<AldaNode> components = duration.getChildren();
		for (int i = 0; i < components.size(); i++) {
			AldaNode component = components.get(i);
			switch (component.getType()) {
				case BARLINE:
					if (i == components.size() - 1) {
						// a trailing barline goes after the suffix
						text.append(suffix);
					}
					if (text.length() > 0) {
						out.write(text.toString());
					}
					out.write("|");
					text.setLength(0);
					shouldTie = false;
					break;
				case NOTE_LENGTH_MS:
					if (shouldTie) {
						text.append('~');
					}
					text.append(component.getText());
					shouldTie = true;
					break;
				case NOTE_LENGTH:
					if (shouldTie) {
						text.append('~');
					}
					text.append(noteLength(component));
					shouldTie = true;
					break;
				default:
					throw new UnexpectedNodeIssue(component, "duration");
			}
		}

		if (text.length() > 0) {
			text.append(suffix);
			out.write(text.toString());
		}
	}

	static String noteLength(AldaNode noteLength) throws AldaFormattingException {
		noteLength.expectNChildren(1, 2);
		AldaNode denominatorNode = noteLength.expectChild(0, AldaNodeType.DENOMINATOR);
		double denominator = denominatorNode.getFloat();
		if (!Double.isFinite(denominator)) {
			throw new InvalidLiteralIssue(denominatorNode, "a finite number");
		}
		int dots = 0;
		if (noteLength.getChildCount() > 1) {
			dots = noteLength.expectChild(1, AldaNodeType.DOTS).getInt();
		}
		StringBuilder sb = new StringBuilder(denominatorText(denominator));
		for (int i = 0; i < dots; i++) {
			sb.append('.');
		}
		return sb.toString();
	}

	/**
	 * @return the denominator without trailing zeros, e.g. "4" or "2.5"
	 */
	static String denominatorText(double denominator) {
		return BigDecimal.valueOf(denominator).stripTrailingZeros().toPlainString();
	}
}
