package aldafmt;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Immutable settings for one formatting run.
 *
 * Options can be read from a JSON configuration document such as
 *
 * <pre>
 * { "softWrap": 100, "indentText": "\t" }
 * </pre>
 *
 * where every field is optional and falls back to its default.
 */
public class FormattingOptions {
	public static final int DEFAULT_SOFT_WRAP = 80;
	public static final String DEFAULT_INDENT_TEXT = "    ";

	// fields read from the JSON configuration
	public static final String SOFT_WRAP_FIELD = "softWrap";
	public static final String INDENT_TEXT_FIELD = "indentText";

	private final int softWrap;
	private final String indentText;

	private FormattingOptions(int softWrap, String indentText) {
		this.softWrap = softWrap;
		this.indentText = indentText;
	}

	public static FormattingOptions defaults() {
		return new FormattingOptions(DEFAULT_SOFT_WRAP, DEFAULT_INDENT_TEXT);
	}

	public static FormattingOptions fromJSON(JSONObject config) throws FormattingOptionException {
		FormattingOptions options = defaults();
		try {
			if (config.has(SOFT_WRAP_FIELD)) {
				Object softWrapValue = config.get(SOFT_WRAP_FIELD);
				if (!(softWrapValue instanceof Integer)) {
					throw new FormattingOptionException("Soft wrap must be an integer, got " + softWrapValue);
				}
				int softWrap = (Integer) softWrapValue;
				if (softWrap <= 0) {
					throw new FormattingOptionException("Soft wrap must be positive, got " + softWrap);
				}
				options = options.withSoftWrap(softWrap);
			}
			if (config.has(INDENT_TEXT_FIELD)) {
				Object indentText = config.get(INDENT_TEXT_FIELD);
				if (!(indentText instanceof String)) {
					throw new FormattingOptionException("Indent text must be a string, got " + indentText);
				}
				options = options.withIndentText((String) indentText);
			}
		} catch (JSONException e) {
			throw new FormattingOptionException("Configuration is invalid: " + e.getMessage(), e);
		}
		return options;
	}

	public static FormattingOptions fromJSON(String config) throws FormattingOptionException {
		try {
			return fromJSON(new JSONObject(config));
		} catch (JSONException e) {
			throw new FormattingOptionException("Configuration is invalid: " + e.getMessage(), e);
		}
	}

	public static FormattingOptions load(Path configFile) throws FormattingOptionException {
		String config;
		try {
			config = FileUtils.readFileToString(configFile.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new FormattingOptionException("Cannot read configuration file " + configFile, e);
		}
		Logger.getLogger("Alda Formatter").fine("Read formatting options from " + configFile);
		return fromJSON(config);
	}

	public FormattingOptions withSoftWrap(int softWrap) {
		if (softWrap <= 0) {
			throw new IllegalArgumentException("soft wrap must be positive, got " + softWrap);
		}
		return new FormattingOptions(softWrap, indentText);
	}

	public FormattingOptions withIndentText(String indentText) {
		return new FormattingOptions(softWrap, Objects.requireNonNull(indentText));
	}

	public int getSoftWrap() {
		return softWrap;
	}

	public String getIndentText() {
		return indentText;
	}

	@Override
	public int hashCode() {
		return Objects.hash(softWrap, indentText);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		FormattingOptions other = (FormattingOptions) obj;
		return softWrap == other.softWrap && indentText.equals(other.indentText);
	}

	@Override
	public String toString() {
		return "FormattingOptions [softWrap=" + softWrap + ", indentText=\"" + indentText + "\"]";
	}
}
