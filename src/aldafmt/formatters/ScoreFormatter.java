package aldafmt.formatters;

import aldafmt.errors.UnexpectedNodeIssue;
import aldafmt.model.alda.AldaNode;
import aldafmt.model.alda.AldaNodeType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats a whole score: each part's declaration followed by its indented events, with a blank line between parts.
 */
public class ScoreFormatter {

	private WrappingWriter out;
	private EventFormatter eventFormatter;

	public ScoreFormatter(WrappingWriter out) {
		this.out = out;
		this.eventFormatter = new EventFormatter(out);
	}

	public void format(AldaNode root) throws IOException, AldaFormattingException {
		root.expectNodeType(AldaNodeType.ROOT);
		List<AldaNode> parts = root.getChildren();
		for (int i = 0; i < parts.size(); i++) {
			AldaNode part = parts.get(i);
			switch (part.getType()) {
				case IMPLICIT_PART:
					formatImplicitPart(part);
					break;
				case PART:
					formatPart(part);
					break;
				default:
					throw new UnexpectedNodeIssue(part, "part");
			}

			if (i + 1 < parts.size()) {
				out.blankLine();
			}
		}
		out.flush();
	}

	private void formatImplicitPart(AldaNode part) throws IOException, AldaFormattingException {
		part.expectNChildren(1);
		AldaNode events = part.expectChild(0, AldaNodeType.EVENT_SEQUENCE);
		try (WrappingWriter.Indent ignored = out.mark()) {
			eventFormatter.format(events.getChildren());
		}
	}

	private void formatPart(AldaNode part) throws IOException, AldaFormattingException {
		part.expectNChildren(2);
		out.write(declarationText(part.expectChild(0, AldaNodeType.PART_DECLARATION)));

		AldaNode events = part.expectChild(1, AldaNodeType.EVENT_SEQUENCE);
		try (WrappingWriter.Indent ignored = out.indent()) {
			eventFormatter.format(events.getChildren());
		}
	}

	/**
	 * @return e.g. {@code piano:} or {@code violin/viola "strings":}
	 */
	private static String declarationText(AldaNode declaration) throws AldaFormattingException {
		declaration.expectNChildren(1, 2);
		AldaNode partNames = declaration.expectChild(0, AldaNodeType.PART_NAMES);
		partNames.expectChildren();

		List<String> names = new ArrayList<>();
		for (AldaNode name : partNames.getChildren()) {
			names.add(name.expectNodeType(AldaNodeType.PART_NAME).getText());
		}
		String namesText = String.join("/", names);

		if (declaration.getChildCount() > 1) {
			String alias = declaration.expectChild(1, AldaNodeType.PART_ALIAS).getText();
			return namesText + " \"" + alias + "\":";
		}
		return namesText + ":";
	}
}
