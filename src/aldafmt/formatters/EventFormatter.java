package aldafmt.formatters;

import aldafmt.errors.UnexpectedNodeIssue;
import aldafmt.model.alda.AldaNode;
import aldafmt.model.alda.AldaNodeType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats the events making up the body of a part: notes, rests, chords, directives, variables, voices and so on.
 */
public class EventFormatter {

	private WrappingWriter out;
	private DurationFormatter durationFormatter;

	public EventFormatter(WrappingWriter out) {
		this.out = out;
		this.durationFormatter = new DurationFormatter(out);
	}

	public void format(List<AldaNode> events) throws IOException, AldaFormattingException {
		for (AldaNode event : events) {
			format(event);
		}
	}

	public void format(AldaNode event) throws IOException, AldaFormattingException {
		switch (event.getType()) {
			case AT_MARKER:
				out.write("@" + event.getText());
				break;
			case BARLINE:
				out.write("|");
				break;
			case CHORD:
				formatChord(event);
				break;
			case CRAM:
				formatCram(event);
				break;
			case EVENT_SEQUENCE:
				// standalone sequences (not part of a cram, voice, etc.) always go on their own indented lines
				out.flush();
				out.write("[");
				try (WrappingWriter.Indent ignored = out.indent()) {
					format(event.getChildren());
				}
				out.write("]");
				out.flush();
				break;
			case LISP_LIST:
				// lisp lists are generally short, keeping them whole reads better
				out.write(LispFormatter.format(event));
				break;
			case MARKER:
				out.write("%" + event.getText());
				break;
			case NOTE:
				formatNote(event);
				break;
			case OCTAVE_DOWN:
				out.write("<");
				break;
			case OCTAVE_SET:
				out.write("o" + event.getInt());
				break;
			case OCTAVE_UP:
				out.write(">");
				break;
			case REPEAT: {
				event.expectNChildren(2);
				format(event.getChild(0));
				int times = event.expectChild(1, AldaNodeType.TIMES).getInt();
				out.write("*" + times);
				break;
			}
			case REPETITIONS:
				formatRepetitions(event);
				break;
			case REST:
				event.expectNChildren(0, 1);
				if (event.getChildCount() > 0) {
					durationFormatter.format("r", event.expectChild(0, AldaNodeType.DURATION), "");
				} else {
					out.write("r");
				}
				break;
			case VARIABLE_DEFINITION:
				formatVariableDefinition(event);
				break;
			case VARIABLE_REFERENCE:
				out.write(event.getText());
				break;
			case VOICE: {
				event.expectNChildren(2);
				int number = event.expectChild(0, AldaNodeType.VOICE_NUMBER).getInt();
				AldaNode events = event.expectChild(1, AldaNodeType.EVENT_SEQUENCE);
				out.write("V" + number + ":");
				try (WrappingWriter.Indent ignored = out.indent()) {
					format(events.getChildren());
				}
				break;
			}
			case VOICE_GROUP:
				format(event.getChildren());
				break;
			case VOICE_GROUP_END_MARKER:
				// left open on purpose: the enclosing block's Indent brings the level back
				out.write("V0:");
				out.indent();
				break;
			default:
				throw new UnexpectedNodeIssue(event, "event");
		}
	}

	/**
	 * Each note and each separator is a separate token. A separator is only placed between two adjacent
	 * notes/rests, and is attached to both of them so the pair never wraps apart. A note whose duration ends in a
	 * barline leaves the separator standing after the '|', attached only to the next note.
	 */
	private void formatChord(AldaNode chord) throws IOException, AldaFormattingException {
		chord.expectChildren();
		List<AldaNode> children = chord.getChildren();
		for (int i = 0; i < children.size(); i++) {
			AldaNode child = children.get(i);
			format(child);
			boolean nextIsNoteOrRest = i + 1 < children.size() && children.get(i + 1).getType().isNoteOrRest();
			if (child.getType().isNoteOrRest() && nextIsNoteOrRest) {
				if (!endsWithBarline(child)) {
					out.attach();
				}
				out.write("/");
				out.attach();
			}
		}
	}

	private static boolean endsWithBarline(AldaNode noteOrRest) {
		for (AldaNode child : noteOrRest.getChildren()) {
			if (child.getType() == AldaNodeType.DURATION) {
				List<AldaNode> components = child.getChildren();
				return !components.isEmpty() &&
						components.get(components.size() - 1).getType() == AldaNodeType.BARLINE;
			}
		}
		return false;
	}

	private void formatCram(AldaNode cram) throws IOException, AldaFormattingException {
		cram.expectNChildren(1, 2);
		AldaNode events = cram.expectChild(0, AldaNodeType.EVENT_SEQUENCE);

		out.write("{");
		format(events.getChildren());

		if (cram.getChildCount() > 1) {
			durationFormatter.format("}", cram.expectChild(1, AldaNodeType.DURATION), "");
		} else {
			out.write("}");
		}
	}

	private void formatNote(AldaNode note) throws IOException, AldaFormattingException {
		note.expectNChildren(1, 2, 3);
		String pitch = pitchText(note.expectChild(0, AldaNodeType.NOTE_LETTER_AND_ACCIDENTALS));

		AldaNode duration = null;
		String tie = "";
		if (note.getChildCount() == 3) {
			duration = note.expectChild(1, AldaNodeType.DURATION);
			note.expectChild(2, AldaNodeType.TIE);
			tie = "~";
		} else if (note.getChildCount() == 2) {
			if (note.getChild(1).getType() == AldaNodeType.TIE) {
				tie = "~";
			} else {
				duration = note.expectChild(1, AldaNodeType.DURATION);
			}
		}

		if (duration != null) {
			durationFormatter.format(pitch, duration, tie);
		} else {
			out.write(pitch + tie);
		}
	}

	private static String pitchText(AldaNode letterAndAccidentals) throws AldaFormattingException {
		letterAndAccidentals.expectNChildren(1, 2);
		StringBuilder pitch = new StringBuilder();
		pitch.append(letterAndAccidentals.expectChild(0, AldaNodeType.NOTE_LETTER).getLetter());

		if (letterAndAccidentals.getChildCount() > 1) {
			AldaNode accidentals = letterAndAccidentals.expectChild(1, AldaNodeType.NOTE_ACCIDENTALS);
			for (AldaNode accidental : accidentals.getChildren()) {
				switch (accidental.getType()) {
					case FLAT:
						pitch.append('-');
						break;
					case NATURAL:
						pitch.append('_');
						break;
					case SHARP:
						pitch.append('+');
						break;
					default:
						throw new UnexpectedNodeIssue(accidental, "accidental");
				}
			}
		}
		return pitch.toString();
	}

	private void formatRepetitions(AldaNode repetitions) throws IOException, AldaFormattingException {
		repetitions.expectNChildren(2);
		format(repetitions.getChild(0));

		List<String> ranges = new ArrayList<>();
		for (AldaNode range : repetitions.expectChild(1, AldaNodeType.REPETITIONS).getChildren()) {
			range.expectNodeType(AldaNodeType.REPETITION_RANGE);
			range.expectNChildren(2);
			int first = range.expectChild(0, AldaNodeType.FIRST_REPETITION).getInt();
			int last = range.expectChild(1, AldaNodeType.LAST_REPETITION).getInt();
			if (first == last) {
				ranges.add(Integer.toString(first));
			} else {
				ranges.add(first + "-" + last);
			}
		}
		out.write("'" + String.join(",", ranges));
	}

	/**
	 * The name, '=' and the value are kept on one line by pausing wrapping. If the last event of the value is a
	 * sequence, its contents continue on indented lines with wrapping resumed.
	 */
	private void formatVariableDefinition(AldaNode definition) throws IOException, AldaFormattingException {
		out.flush();
		definition.expectNChildren(2);
		String name = definition.expectChild(0, AldaNodeType.VARIABLE_NAME).getText();
		List<AldaNode> events = definition.expectChild(1, AldaNodeType.EVENT_SEQUENCE).getChildren();

		out.pauseWrap();
		try {
			out.write(name + " =");
			if (!events.isEmpty()) {
				int lastIndex = events.size() - 1;
				format(events.subList(0, lastIndex));

				AldaNode last = events.get(lastIndex);
				if (last.getType() == AldaNodeType.EVENT_SEQUENCE) {
					out.write("[");
					try (WrappingWriter.Indent ignored = out.indent()) {
						out.resumeWrap();
						format(last.getChildren());
					}
					out.write("]");
				} else {
					format(last);
				}
			}
		} finally {
			out.resumeWrap();
		}
		out.flush();
	}
}
