package aldafmt.formatters;

import aldafmt.errors.UnexpectedNodeIssue;
import aldafmt.model.alda.AldaNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an embedded S-expression as a single line of text, e.g. {@code (tempo '120)}.
 */
public class LispFormatter {

	private LispFormatter() {}

	public static String format(AldaNode lisp) throws AldaFormattingException {
		switch (lisp.getType()) {
			case LISP_LIST: {
				List<String> texts = new ArrayList<>();
				for (AldaNode child : lisp.getChildren()) {
					texts.add(format(child));
				}
				return "(" + String.join(" ", texts) + ")";
			}
			case LISP_NUMBER:
				return Integer.toString(lisp.getInt());
			case LISP_QUOTED_FORM:
				lisp.expectNChildren(1);
				return "'" + format(lisp.getChild(0));
			case LISP_STRING:
				return "\"" + lisp.getText() + "\"";
			case LISP_SYMBOL:
				return lisp.getText();
			default:
				throw new UnexpectedNodeIssue(lisp, "lisp form");
		}
	}
}
