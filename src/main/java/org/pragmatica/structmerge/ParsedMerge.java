package org.pragmatica.structmerge;

import org.pragmatica.structmerge.error.ParseError;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.render.MarkerStyle;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * A text holding conflict marker blocks, split into plain text and conflicts.
 *
 * <p>Only blocks showing the base content can be read: every revision must be recoverable to
 * merge them again. Marker lines are recognised by the marker size of the style, labels are
 * ignored.
 */
public final class ParsedMerge {
    private final List<Section> sections;

    private ParsedMerge(List<Section> sections) {
        this.sections = List.copyOf(sections);
    }

    public sealed interface Section {
        record Text(String text) implements Section {}

        record Conflict(String left, String base, String right) implements Section {
            public String side(Revision revision) {
                return switch (revision) {
                    case ANCESTOR -> base;
                    case LEFT -> left;
                    case RIGHT -> right;
                };
            }
        }
    }

    public static ParsedMerge parse(String text, MarkerStyle style) throws ParseException {
        return new Reader(text, style).read();
    }

    public List<Section> sections() {
        return sections;
    }

    /**
     * The text of one revision: plain text with every conflict replaced by that revision's side.
     */
    public String reconstruct(Revision revision) {
        var result = new StringBuilder();
        for (var section : sections) {
            if (section instanceof Section.Text text) {
                result.append(text.text());
            } else if (section instanceof Section.Conflict conflict) {
                result.append(conflict.side(revision));
            }
        }
        return result.toString();
    }

    public int conflictCount() {
        return (int) sections.stream().filter(Section.Conflict.class::isInstance).count();
    }

    /**
     * Total number of characters inside the sides of all conflicts.
     */
    public int conflictMass() {
        int mass = 0;
        for (var section : sections) {
            if (section instanceof Section.Conflict conflict) {
                mass += conflict.left().length() + conflict.base().length() + conflict.right().length();
            }
        }
        return mass;
    }

    private enum State {
        TEXT,
        LEFT,
        BASE,
        RIGHT
    }

    private static final class Reader {
        private final String text;
        private final MarkerStyle style;
        private final List<Section> sections = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();
        private final String[] sides = new String[3];
        private State state = State.TEXT;
        private int blockStart;

        private Reader(String text, MarkerStyle style) {
            this.text = text;
            this.style = style;
        }

        ParsedMerge read() throws ParseException {
            int offset = 0;
            while (offset < text.length()) {
                int newline = text.indexOf('\n', offset);
                int end = newline < 0 ? text.length() : newline + 1;
                line(text.substring(offset, end), offset);
                offset = end;
            }
            if (state != State.TEXT) {
                throw error(blockStart, "Conflict is not closed");
            }
            if (!current.isEmpty()) {
                sections.add(new Section.Text(current.toString()));
            }
            return new ParsedMerge(sections);
        }

        private void line(String line, int offset) throws ParseException {
            var content = line.stripTrailing();
            switch (state) {
                case TEXT -> {
                    if (isLabelled(content, '<')) {
                        if (!current.isEmpty()) {
                            sections.add(new Section.Text(current.toString()));
                        }
                        blockStart = offset;
                        next(State.LEFT);
                        return;
                    }
                    rejectMarker(content, offset);
                }
                case LEFT -> {
                    if (isLabelled(content, '|')) {
                        sides[0] = current.toString();
                        next(State.BASE);
                        return;
                    }
                    if (isSeparator(content)) {
                        throw error(offset, "Conflict has no base section, two-way conflicts cannot be merged again");
                    }
                    rejectMarker(content, offset);
                }
                case BASE -> {
                    if (isSeparator(content)) {
                        sides[1] = current.toString();
                        next(State.RIGHT);
                        return;
                    }
                    rejectMarker(content, offset);
                }
                case RIGHT -> {
                    if (isLabelled(content, '>')) {
                        sections.add(new Section.Conflict(sides[0], sides[1], current.toString()));
                        next(State.TEXT);
                        return;
                    }
                    rejectMarker(content, offset);
                }
            }
            current.append(line);
        }

        private void next(State state) {
            this.state = state;
            current.setLength(0);
        }

        private void rejectMarker(String content, int offset) throws ParseException {
            if (isLabelled(content, '<') || isLabelled(content, '|')
                || isLabelled(content, '>') || isSeparator(content)) {
                throw error(offset, "Unexpected conflict marker '" + content + "'");
            }
        }

        private boolean isLabelled(String content, char marker) {
            var prefix = String.valueOf(marker).repeat(style.size());
            return content.startsWith(prefix)
                   && (content.length() == prefix.length() || content.charAt(prefix.length()) == ' ');
        }

        private boolean isSeparator(String content) {
            return content.equals(style.separatorMarker());
        }

        private ParseException error(int offset, String reason) {
            return new ParseException(new ParseError.SemanticError(SourceLocation.of(text, offset), reason));
        }
    }
}
