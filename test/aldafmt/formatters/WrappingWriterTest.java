package aldafmt.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

import aldafmt.FormattingOptions;

public class WrappingWriterTest {

	private StringWriter sink = new StringWriter();

	private WrappingWriter writer(FormattingOptions options) {
		return new WrappingWriter(sink, options);
	}

	private WrappingWriter writer(int softWrap) {
		return writer(FormattingOptions.defaults().withSoftWrap(softWrap));
	}

	@Test
	public void testJoinsTokensWithSingleSpaces() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		out.write("a");
		out.write("b");
		out.write("c");
		assertThat(sink.toString(), is(""));
		out.flush();
		assertThat(sink.toString(), is("a b c\n"));
	}

	@Test
	public void testWrapsBeforeOverflowingToken() throws IOException {
		WrappingWriter out = writer(10);
		out.write("abcd");
		out.write("efgh");
		out.write("ijkl");
		out.flush();
		assertThat(sink.toString(), is("abcd efgh\nijkl\n"));
	}

	@Test
	public void testLineOfExactlySoftWrapFits() throws IOException {
		WrappingWriter out = writer(9);
		out.write("abcd");
		out.write("efgh");
		out.flush();
		assertThat(sink.toString(), is("abcd efgh\n"));
	}

	@Test
	public void testOversizedTokenIsNeverSplit() throws IOException {
		WrappingWriter out = writer(5);
		out.write("abcdefgh");
		out.write("x");
		out.write("abcdefgh");
		out.flush();
		assertThat(sink.toString(), is("abcdefgh\nx\nabcdefgh\n"));
	}

	@Test
	public void testPausedWritesNeverWrap() throws IOException {
		WrappingWriter out = writer(5);
		out.pauseWrap();
		out.write("aaa");
		out.write("bbb");
		out.write("ccc");
		out.resumeWrap();
		out.write("ddd");
		out.flush();
		assertThat(sink.toString(), is("aaa bbb ccc\nddd\n"));
	}

	@Test
	public void testIndentation() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		out.write("a");
		try (WrappingWriter.Indent ignored = out.indent()) {
			out.write("b");
		}
		out.write("c");
		out.flush();
		assertThat(sink.toString(), is("a\n    b\nc\n"));
		assertThat(out.getIndentLevel(), is(0));
	}

	@Test
	public void testIndentCountsTowardsSoftWrap() throws IOException {
		WrappingWriter out = writer(10);
		try (WrappingWriter.Indent ignored = out.indent()) {
			out.write("ab");
			out.write("cd");
			out.write("ef");
		}
		assertThat(sink.toString(), is("    ab cd\n    ef\n"));
	}

	@Test
	public void testCustomIndentText() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults().withIndentText("\t"));
		try (WrappingWriter.Indent ignored = out.indent()) {
			try (WrappingWriter.Indent ignored1 = out.indent()) {
				out.write("x");
			}
		}
		assertThat(sink.toString(), is("\t\tx\n"));
	}

	@Test
	public void testBlankLine() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		out.write("a");
		out.blankLine();
		out.write("b");
		out.flush();
		assertThat(sink.toString(), is("a\n\nb\n"));
	}

	@Test
	public void testFlushWithNothingPendingWritesNothing() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		out.flush();
		out.flush();
		assertThat(sink.toString(), is(""));
	}

	@Test
	public void testTrailingWhitespaceIsStripped() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		try (WrappingWriter.Indent ignored = out.indent()) {
			out.write("a ");
			out.write("");
		}
		assertThat(sink.toString(), is("    a\n"));
	}

	@Test(expected = IllegalStateException.class)
	public void testUnindentBelowZero() throws IOException {
		writer(FormattingOptions.defaults()).unindent();
	}

	@Test
	public void testAttachJoinsWithoutSpace() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		out.write("e");
		out.attach();
		out.write("/");
		out.attach();
		out.write("g");
		out.write("a");
		out.flush();
		assertThat(sink.toString(), is("e/g a\n"));
	}

	@Test
	public void testAttachedTokensWrapTogether() throws IOException {
		WrappingWriter out = writer(5);
		out.write("abc");
		out.write("e");
		out.attach();
		out.write("/");
		out.attach();
		out.write("g");
		out.flush();
		assertThat(sink.toString(), is("abc\ne/g\n"));
	}

	@Test
	public void testAttachWithNothingPending() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		out.attach();
		out.write("a");
		out.write("b");
		out.flush();
		assertThat(sink.toString(), is("a b\n"));
	}

	@Test
	public void testMarkRestoresLevel() throws IOException {
		WrappingWriter out = writer(FormattingOptions.defaults());
		try (WrappingWriter.Indent ignored = out.mark()) {
			out.indent();
			out.indent();
			out.write("x");
		}
		out.write("y");
		out.flush();
		assertThat(sink.toString(), is("        x\ny\n"));
		assertThat(out.getIndentLevel(), is(0));
	}
}
