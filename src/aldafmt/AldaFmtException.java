package aldafmt;

/**
 * An aldafmt exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class AldaFmtException extends RuntimeException {
	public AldaFmtException(String prefix, String msg) {
		super(prefix + ": " + msg);
	}
}
