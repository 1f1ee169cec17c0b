package aldafmt.model.alda;

/**
 * The closed set of node tags an Alda parser produces.
 */
public enum AldaNodeType {
	ROOT,
	IMPLICIT_PART,
	PART,
	PART_DECLARATION,
	PART_NAMES,
	PART_NAME,
	PART_ALIAS,
	EVENT_SEQUENCE,

	AT_MARKER,
	BARLINE,
	MARKER,
	OCTAVE_DOWN,
	OCTAVE_SET,
	OCTAVE_UP,

	VARIABLE_DEFINITION,
	VARIABLE_NAME,
	VARIABLE_REFERENCE,

	NOTE,
	NOTE_LETTER_AND_ACCIDENTALS,
	NOTE_LETTER,
	NOTE_ACCIDENTALS,
	FLAT,
	NATURAL,
	SHARP,
	TIE,
	REST,

	DURATION,
	NOTE_LENGTH,
	NOTE_LENGTH_MS,
	DENOMINATOR,
	DOTS,

	CHORD,
	CRAM,
	REPEAT,
	TIMES,
	// used both for the repeated event and for the list of its ranges
	REPETITIONS,
	REPETITION_RANGE,
	FIRST_REPETITION,
	LAST_REPETITION,

	VOICE_GROUP,
	VOICE,
	VOICE_NUMBER,
	VOICE_GROUP_END_MARKER,

	LISP_LIST,
	LISP_NUMBER,
	LISP_QUOTED_FORM,
	LISP_STRING,
	LISP_SYMBOL;

	public boolean isNoteOrRest() {
		return this == NOTE || this == REST;
	}
}
