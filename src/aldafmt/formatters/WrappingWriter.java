package aldafmt.formatters;

import aldafmt.FormattingOptions;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects unwrappable tokens into lines, joining them with single spaces and
 * breaking a line before any token that would push it past the soft wrap column.
 * Only complete lines, each terminated by a single '\n', reach the underlying writer.
 */
public class WrappingWriter {

	Writer out;
	int softWrap;
	String indentText;

	boolean pauseWrap = false;
	boolean attachNext = false;
	int indentLevel = 0;
	List<String> texts = new ArrayList<>();

	/**
	 * Restores the indentation level that was current when it was created.
	 */
	public static class Indent implements AutoCloseable {

		WrappingWriter writer;
		int level;

		public Indent(WrappingWriter writer, int level) {
			this.writer = writer;
			this.level = level;
		}

		@Override
		public void close() throws IOException {
			writer.unindentTo(level);
		}

	}

	public WrappingWriter(Writer out, FormattingOptions options) {
		this.out = out;
		this.softWrap = options.getSoftWrap();
		this.indentText = options.getIndentText();
	}

	/**
	 * @return the current line as it would be flushed
	 */
	String line() {
		StringBuilder indent = new StringBuilder();
		for (int i = 0; i < indentLevel; i++) {
			indent.append(indentText);
		}
		return (indent + String.join(" ", texts).stripLeading()).stripTrailing();
	}

	/**
	 * Appends an unwrappable token to the current line. If the line would then exceed the soft wrap column, the
	 * line written so far is flushed first and the token starts the next line, unless wrapping is paused.
	 */
	public void write(String text) throws IOException {
		if (attachNext && !texts.isEmpty()) {
			text = texts.remove(texts.size() - 1) + text;
		}
		attachNext = false;
		texts.add(text);
		if (!pauseWrap && texts.size() > 1 && line().length() > softWrap) {
			texts.remove(texts.size() - 1);
			flush();
			texts.add(text);
		}
	}

	/**
	 * The next token written is joined to the last pending token without a space.
	 */
	public void attach() {
		attachNext = true;
	}

	public void flush() throws IOException {
		if (!texts.isEmpty()) {
			out.write(line());
			out.write("\n");
			texts.clear();
		}
		attachNext = false;
	}

	public void blankLine() throws IOException {
		flush();
		out.write("\n");
	}

	public Indent indent() throws IOException {
		int level = indentLevel;
		flush();
		indentLevel++;
		return new Indent(this, level);
	}

	/**
	 * @return an Indent that returns to the current level when closed, without indenting now
	 */
	public Indent mark() {
		return new Indent(this, indentLevel);
	}

	public void unindent() throws IOException {
		if (indentLevel == 0) {
			throw new IllegalStateException("can't unindent below 0");
		}
		flush();
		indentLevel--;
	}

	public void unindentTo(int level) throws IOException {
		while (indentLevel > level) {
			unindent();
		}
	}

	public void pauseWrap() {
		pauseWrap = true;
	}

	public void resumeWrap() {
		pauseWrap = false;
	}

	public boolean isWrapPaused() {
		return pauseWrap;
	}

	public int getIndentLevel() {
		return indentLevel;
	}
}
