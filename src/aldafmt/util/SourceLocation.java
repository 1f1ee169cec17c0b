package aldafmt.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a node came from in the score text, as reported by the parser. Lines and columns are 0-based.
 */
public class SourceLocation {
	private Path file;
	private int startLine;
	private int startColumn;
	private int endLine;
	private int endColumn;

	public SourceLocation(Path file, int startLine, int startColumn, int endLine, int endColumn) {
		this.file = file;
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.endLine = endLine;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	public String prettyString() {
		if (isUnknown()) {
			return "at unknown source location";
		}
		StringBuilder sb = new StringBuilder("at ");
		if (startLine != endLine) {
			sb.append(startLine + 1).append(':').append(startColumn + 1)
					.append('-').append(endLine + 1).append(':').append(endColumn);
		} else if (startColumn != endColumn) {
			sb.append(startLine + 1).append(':').append(startColumn + 1).append('-').append(endColumn);
		} else {
			sb.append(startLine + 1).append(':').append(startColumn + 1);
		}
		sb.append(" in file ").append(file);
		return sb.toString();
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, startColumn, endLine, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startLine == other.startLine && startColumn == other.startColumn && endLine == other.endLine &&
				endColumn == other.endColumn && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", startLine=" + startLine + ", startColumn=" + startColumn +
				", endLine=" + endLine + ", endColumn=" + endColumn + "]";
	}

}
