package aldafmt;

public class FormattingOptionException extends Exception {

	private static final long serialVersionUID = 4180347326527614402L;

	public FormattingOptionException(String msg) {
		super(msg);
	}

	public FormattingOptionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
