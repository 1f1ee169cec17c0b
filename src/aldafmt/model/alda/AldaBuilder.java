package aldafmt.model.alda;

import aldafmt.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static aldafmt.model.alda.AldaNodeType.*;

/**
 * Static factories for well-formed Alda trees, with every node at the unknown source location.
 */
public class AldaBuilder {
	private AldaBuilder() {}

	public static AldaNode node(AldaNodeType type, AldaNode... children) {
		return new AldaNode(SourceLocation.unknown(), type, null, Arrays.asList(children));
	}

	public static AldaNode leaf(AldaNodeType type, Object literal) {
		return new AldaNode(SourceLocation.unknown(), type, literal, Collections.emptyList());
	}

	// score structure

	public static AldaNode root(AldaNode... parts) {
		return node(ROOT, parts);
	}

	public static AldaNode implicitPart(AldaNode... events) {
		return node(IMPLICIT_PART, seq(events));
	}

	public static List<String> names(String... names) {
		return Arrays.asList(names);
	}

	public static AldaNode part(List<String> names, String alias, AldaNode... events) {
		List<AldaNode> nameNodes = new ArrayList<>();
		for (String name : names) {
			nameNodes.add(leaf(PART_NAME, name));
		}
		AldaNode partNames = new AldaNode(SourceLocation.unknown(), PART_NAMES, null, nameNodes);
		AldaNode declaration = alias == null
				? node(PART_DECLARATION, partNames)
				: node(PART_DECLARATION, partNames, leaf(PART_ALIAS, alias));
		return node(PART, declaration, seq(events));
	}

	public static AldaNode part(String name, AldaNode... events) {
		return part(names(name), null, events);
	}

	public static AldaNode seq(AldaNode... events) {
		return node(EVENT_SEQUENCE, events);
	}

	// notes and rests

	public static AldaNode pitch(char letter, AldaNode... accidentals) {
		AldaNode letterNode = leaf(NOTE_LETTER, letter);
		if (accidentals.length == 0) {
			return node(NOTE_LETTER_AND_ACCIDENTALS, letterNode);
		}
		return node(NOTE_LETTER_AND_ACCIDENTALS, letterNode, node(NOTE_ACCIDENTALS, accidentals));
	}

	public static AldaNode sharp() {
		return node(SHARP);
	}

	public static AldaNode flat() {
		return node(FLAT);
	}

	public static AldaNode natural() {
		return node(NATURAL);
	}

	public static AldaNode note(char letter) {
		return node(NOTE, pitch(letter));
	}

	public static AldaNode note(char letter, AldaNode duration) {
		return node(NOTE, pitch(letter), duration);
	}

	public static AldaNode note(AldaNode pitch) {
		return node(NOTE, pitch);
	}

	public static AldaNode note(AldaNode pitch, AldaNode duration) {
		return node(NOTE, pitch, duration);
	}

	public static AldaNode tiedNote(AldaNode pitch) {
		return node(NOTE, pitch, tie());
	}

	public static AldaNode tiedNote(AldaNode pitch, AldaNode duration) {
		return node(NOTE, pitch, duration, tie());
	}

	public static AldaNode tie() {
		return node(TIE);
	}

	public static AldaNode rest() {
		return node(REST);
	}

	public static AldaNode rest(AldaNode duration) {
		return node(REST, duration);
	}

	// durations

	public static AldaNode duration(AldaNode... components) {
		return node(DURATION, components);
	}

	public static AldaNode length(double denominator) {
		return node(NOTE_LENGTH, leaf(DENOMINATOR, denominator));
	}

	public static AldaNode length(double denominator, int dots) {
		return node(NOTE_LENGTH, leaf(DENOMINATOR, denominator), leaf(DOTS, dots));
	}

	public static AldaNode ms(String length) {
		return leaf(NOTE_LENGTH_MS, length);
	}

	public static AldaNode barline() {
		return node(BARLINE);
	}

	// compound events

	public static AldaNode chord(AldaNode... events) {
		return node(CHORD, events);
	}

	public static AldaNode cram(AldaNode events) {
		return node(CRAM, events);
	}

	public static AldaNode cram(AldaNode events, AldaNode duration) {
		return node(CRAM, events, duration);
	}

	public static AldaNode repeat(AldaNode event, int times) {
		return node(REPEAT, event, leaf(TIMES, times));
	}

	public static AldaNode repetitions(AldaNode event, AldaNode... ranges) {
		return node(REPETITIONS, event, node(REPETITIONS, ranges));
	}

	public static AldaNode range(int first, int last) {
		return node(REPETITION_RANGE, leaf(FIRST_REPETITION, first), leaf(LAST_REPETITION, last));
	}

	// variables

	public static AldaNode varDef(String name, AldaNode... events) {
		return node(VARIABLE_DEFINITION, leaf(VARIABLE_NAME, name), seq(events));
	}

	public static AldaNode varRef(String name) {
		return leaf(VARIABLE_REFERENCE, name);
	}

	// voices

	public static AldaNode voiceGroup(AldaNode... voices) {
		return node(VOICE_GROUP, voices);
	}

	public static AldaNode voice(int number, AldaNode... events) {
		return node(VOICE, leaf(VOICE_NUMBER, number), seq(events));
	}

	public static AldaNode voiceGroupEnd() {
		return node(VOICE_GROUP_END_MARKER);
	}

	// directives

	public static AldaNode octaveUp() {
		return node(OCTAVE_UP);
	}

	public static AldaNode octaveDown() {
		return node(OCTAVE_DOWN);
	}

	public static AldaNode octaveSet(int octave) {
		return leaf(OCTAVE_SET, octave);
	}

	public static AldaNode marker(String name) {
		return leaf(MARKER, name);
	}

	public static AldaNode atMarker(String name) {
		return leaf(AT_MARKER, name);
	}

	// lisp

	public static AldaNode lisp(AldaNode... forms) {
		return node(LISP_LIST, forms);
	}

	public static AldaNode lispSymbol(String name) {
		return leaf(LISP_SYMBOL, name);
	}

	public static AldaNode lispNumber(int value) {
		return leaf(LISP_NUMBER, value);
	}

	public static AldaNode lispString(String value) {
		return leaf(LISP_STRING, value);
	}

	public static AldaNode quote(AldaNode form) {
		return node(LISP_QUOTED_FORM, form);
	}
}
