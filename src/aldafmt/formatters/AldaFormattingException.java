package aldafmt.formatters;

import aldafmt.AldaFmtException;

/**
 * Exception during Alda AST to source text formatting
 *
 */
public class AldaFormattingException extends AldaFmtException {

	private static final long serialVersionUID = -6213554817399024518L;
	private static final String prefix = "Formatting Error";

	public AldaFormattingException(String msg) {
		super(prefix, msg);
	}

}
