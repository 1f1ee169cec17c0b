package aldafmt;

import aldafmt.formatters.AldaFormattingException;
import aldafmt.formatters.ScoreFormatter;
import aldafmt.formatters.WrappingWriter;
import aldafmt.model.alda.AldaNode;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * Entry point for turning a parsed Alda score back into source code, handling spacing, indentation and wrapping.
 *
 * The score is rendered into memory first, so nothing is written to the destination if the tree is malformed.
 */
public class AldaFormatter {
	private static final Logger logger = Logger.getLogger("Alda Formatter");

	private AldaFormatter() {}

	public static String formatToString(AldaNode root, FormattingOptions options) throws AldaFormattingException {
		logger.fine("Formatting " + root.getChildCount() + " part(s) with " + options);
		StringWriter buffer = new StringWriter();
		try {
			new ScoreFormatter(new WrappingWriter(buffer, options)).format(root);
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		String code = buffer.toString();
		logger.fine("Formatted score into " + code.length() + " character(s)");
		return code;
	}

	public static String formatToString(AldaNode root) throws AldaFormattingException {
		return formatToString(root, FormattingOptions.defaults());
	}

	public static void formatToCode(AldaNode root, OutputStream out, FormattingOptions options)
			throws IOException, AldaFormattingException {
		IOUtils.write(formatToString(root, options), out, StandardCharsets.UTF_8);
	}

	public static void formatToCode(AldaNode root, OutputStream out) throws IOException, AldaFormattingException {
		formatToCode(root, out, FormattingOptions.defaults());
	}

	public static void formatToCode(AldaNode root, Writer out, FormattingOptions options)
			throws IOException, AldaFormattingException {
		out.write(formatToString(root, options));
	}

	public static void formatToCode(AldaNode root, Writer out) throws IOException, AldaFormattingException {
		formatToCode(root, out, FormattingOptions.defaults());
	}
}
