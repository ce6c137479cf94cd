package infix.util;

import infix.formatters.IndentingWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the reader found a token. Lines and columns are 0-based; offsets are character
 * offsets into whatever the reader consumed. The file may be null for in-memory input.
 */
public class SourceLocation {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation at(int line, int column) {
		return new SourceLocation(null, -1, -1, line, line, column, column);
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startLine < 0;
	}

	public void writePretty(IndentingWriter out) throws IOException {
		if(isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		out.write("at ");
		if(startLine != endLine) {
			out.write(""+(startLine+1)+":"+(startColumn+1)+"-"+(endLine+1)+":"+endColumn);
		} else if(startColumn != endColumn) {
			out.write(""+(startLine+1)+":"+(startColumn+1)+"-"+endColumn);
		} else {
			out.write(""+(startLine+1)+":"+(startColumn+1));
		}
		if(file != null) {
			out.write(" in file "+file);
		}
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

}
