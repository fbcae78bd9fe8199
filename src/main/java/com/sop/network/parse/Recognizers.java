package com.sop.network.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named recognizers for the markdown conventions of procedure documents.
 * Each one looks at a line or a text fragment and returns a structured match,
 * or an empty result when the convention is absent. None of them throw on
 * unexpected input.
 */
public final class Recognizers {

    /** Bullet glyph emitted by the text-extraction tool for nested items. */
    public static final String NESTED_GLYPH = "I";

    private static final Pattern TITLE = Pattern.compile("^#\\s+\\*\\*(.+?)\\*\\*", Pattern.MULTILINE);
    private static final Pattern PLAIN_TITLE = Pattern.compile("^#\\s+([^#*\\s].*?)\\s*$", Pattern.MULTILINE);
    private static final Pattern DOCUMENT_IDENTITY = Pattern.compile(
            "\\*\\*Document Type:\\*\\*\\s*(\\w+)\\s*\\*\\*Document Number:\\*\\*\\s*([\\w.]*\\w)");
    private static final Pattern STATUS = Pattern.compile("\\*\\*Status:\\*\\*\\s*([^\\n]+)");
    private static final Pattern CAUSE_LABEL = Pattern.compile("\\*\\*Cause/Explanation:\\*\\*\\s*");
    private static final Pattern PEND_CODE = Pattern.compile("\\*\\*Pend Code:\\*\\*\\s*([A-Z0-9]+)");
    private static final Pattern REVISION_ROW = Pattern.compile(
            "\\|\\s*(\\d+\\.\\d+)\\s*\\|\\s*(\\d{1,2}/\\d{1,2}/\\d{2,4}|\\d{4}-\\d{2}-\\d{2})\\s*\\|([^|]+)\\|");

    private static final Pattern STEP_START = Pattern.compile("^(\\d+)\\.\\s+(.*)$");
    private static final Pattern BRANCH_MARKER = Pattern.compile(
            "^(\\s*)([-–•*]|I(?=[\\s*]))?\\s*(?:\\*\\*)?\\s*((?i:yes|no|unsure))(?:\\*\\*)?\\s*:(?:\\*\\*)?\\s*(.*)$");
    private static final Pattern LABELED_ITEM = Pattern.compile(
            "^(\\s*)(?:[-–•*]|I(?=[\\s*]))\\s*\\*\\*([^*:]+?):\\*\\*\\s*(.*)$");
    private static final Pattern INTERROGATIVE = Pattern.compile(
            "^(?:Is|Are|Does|Do|Did|Has|Have|Had|Was|Were|Can|Could|Should|Will|Would|May)\\b(?!\\s+not\\b)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern IMPORTANT_NOTE = Pattern.compile(
            "\\*\\*Important Note:(.+?)\\*\\*", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTINUE = Pattern.compile(
            "continue\\s+to\\s+(?:the\\s+)?next\\s+step", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROCEED = Pattern.compile(
            "proceed\\s+to\\s+(?:the\\s+)?(.+?)\\s+section", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_ROW = Pattern.compile("^\\s*\\|(.*)\\|\\s*$");
    private static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\s*\\|?(\\s*:?-{2,}:?\\s*\\|)+\\s*:?-*:?\\s*$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*$");
    private static final Pattern BOLD_LINE = Pattern.compile("^\\s*\\*\\*(.+?)\\*\\*:?\\s*$");

    private Recognizers() {
        // Utility class
    }

    /** Start of a numbered step. */
    public record StepStart(int number, String text) {
    }

    /**
     * A Yes/No/Unsure marker line.
     *
     * @param kind   marker kind
     * @param indent leading whitespace width
     * @param glyph  bullet glyph, empty when the line has none
     * @param text   text after the marker
     */
    public record BranchMarker(BranchKind kind, int indent, String glyph, String text) {

        public boolean usesNestedGlyph() {
            return NESTED_GLYPH.equals(glyph);
        }
    }

    /** A bulleted {@code **Label:**} line. */
    public record LabeledItem(String label, int indent, String text) {
    }

    /** Document type and number from the header line. */
    public record DocumentIdentity(String documentType, String documentNumber) {
    }

    /** A markdown heading. */
    public record Heading(int level, String text) {
    }

    // --- header ---

    public static Optional<String> title(String text) {
        Optional<String> bold = firstGroup(TITLE, text);
        return bold.isPresent() ? bold : firstGroup(PLAIN_TITLE, text);
    }

    public static Optional<DocumentIdentity> documentIdentity(String text) {
        Matcher matcher = DOCUMENT_IDENTITY.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new DocumentIdentity(matcher.group(1), matcher.group(2)));
    }

    public static Optional<String> status(String text) {
        return firstGroup(STATUS, text);
    }

    /**
     * The cause paragraph: the rest of the labelled line plus the following
     * lines up to a blank line or a line carrying markup.
     */
    public static Optional<String> causeExplanation(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = CAUSE_LABEL.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String[] lines = text.substring(matcher.end()).split("\n", -1);
        if (lines[0].isEmpty()) {
            return Optional.empty();
        }
        StringBuilder cause = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length && isCauseContinuation(lines[i]); i++) {
            cause.append('\n').append(lines[i]);
        }
        String value = collapseWhitespace(cause.toString());
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static boolean isCauseContinuation(String line) {
        return !line.isEmpty() && line.indexOf('*') < 0 && line.indexOf('#') < 0;
    }

    public static Optional<String> pendCode(String text) {
        return firstGroup(PEND_CODE, text);
    }

    /**
     * Rows of the revision table, e.g. {@code |1.0|01/02/2024|Initial release|}.
     * A row needs both a decimal revision and a date.
     */
    public static List<RevisionEntry> revisionEntries(String text) {
        List<RevisionEntry> entries = new ArrayList<>();
        Matcher matcher = REVISION_ROW.matcher(text);
        while (matcher.find()) {
            entries.add(new RevisionEntry(matcher.group(1), matcher.group(2).trim(), matcher.group(3).trim()));
        }
        return entries;
    }

    public static boolean isRevisionRow(String line) {
        return REVISION_ROW.matcher(line).find();
    }

    // --- structure ---

    public static Optional<Heading> heading(String line) {
        Matcher matcher = HEADING.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Heading(matcher.group(1).length(), matcher.group(2)));
    }

    /**
     * Category name if the line matches one of the heading patterns.
     */
    public static Optional<String> categoryHeading(String line, List<Pattern> headingPatterns) {
        for (Pattern pattern : headingPatterns) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                String name = stripEmphasis(matcher.group(1));
                if (!name.isEmpty()) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<StepStart> stepStart(String line) {
        Matcher matcher = STEP_START.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new StepStart(Integer.parseInt(matcher.group(1)), matcher.group(2)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<BranchMarker> branchMarker(String line) {
        Matcher matcher = BRANCH_MARKER.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Optional<BranchKind> kind = BranchKind.fromMarker(matcher.group(3));
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        String glyph = matcher.group(2) != null ? matcher.group(2) : "";
        return Optional.of(new BranchMarker(kind.get(), indentOf(matcher.group(1)), glyph, matcher.group(4).trim()));
    }

    /**
     * A labeled sub-item such as {@code - **Provider-submitted:** deny}. Yes/No/Unsure
     * markers and "Important Note" passages are not labeled items.
     */
    public static Optional<LabeledItem> labeledItem(String line) {
        Matcher matcher = LABELED_ITEM.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String label = matcher.group(2).trim();
        String lower = label.toLowerCase(Locale.ROOT);
        if (BranchKind.fromMarker(lower).isPresent() || lower.startsWith("important note")) {
            return Optional.empty();
        }
        return Optional.of(new LabeledItem(label, indentOf(matcher.group(1)), matcher.group(3).trim()));
    }

    /**
     * Whether a sentence reads as a question: leading interrogative verb or a question mark.
     * A negated lead such as "Do not" is an instruction.
     */
    public static boolean isQuestion(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lead = stripEmphasis(text);
        return INTERROGATIVE.matcher(lead).find() || text.contains("?");
    }

    public static List<String> importantNotes(String text) {
        List<String> notes = new ArrayList<>();
        Matcher matcher = IMPORTANT_NOTE.matcher(text);
        while (matcher.find()) {
            String note = collapseWhitespace(matcher.group(1));
            if (!note.isEmpty()) {
                notes.add(note);
            }
        }
        return notes;
    }

    public static boolean continueToNextStep(String text) {
        return text != null && CONTINUE.matcher(text).find();
    }

    public static Optional<String> proceedToSection(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return firstGroup(PROCEED, text).map(Recognizers::stripEmphasis);
    }

    // --- references ---

    /**
     * Distinct reference codes in the text, upper-cased, first sighting first.
     * A code seen several times keeps the first non-empty title.
     */
    public static List<ReferenceMention> referenceMentions(String text, Pattern referencePattern) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Map<String, String> titles = new LinkedHashMap<>();
        Matcher matcher = referencePattern.matcher(text);
        while (matcher.find()) {
            String code = matcher.group(1).toUpperCase(Locale.ROOT);
            String title = matcher.group(2) != null ? stripEmphasis(matcher.group(2)) : "";
            String known = titles.get(code);
            if (known == null || (known.isEmpty() && !title.isEmpty())) {
                titles.put(code, title);
            }
        }
        List<ReferenceMention> mentions = new ArrayList<>();
        titles.forEach((code, title) -> mentions.add(new ReferenceMention(code, title)));
        return mentions;
    }

    // --- tables ---

    /**
     * Cells of a pipe-delimited row, trimmed. Separator rows are not rows.
     */
    public static Optional<List<String>> tableRow(String line) {
        if (TABLE_SEPARATOR.matcher(line).matches()) {
            return Optional.empty();
        }
        Matcher matcher = TABLE_ROW.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(Arrays.stream(matcher.group(1).split("\\|", -1))
                .map(Recognizers::stripEmphasis)
                .toList());
    }

    public static boolean isTableLine(String line) {
        return TABLE_SEPARATOR.matcher(line).matches() || TABLE_ROW.matcher(line).matches();
    }

    /**
     * Text of a heading or of a line that is entirely bold, usable as a table caption.
     */
    public static Optional<String> caption(String line) {
        Optional<Heading> heading = heading(line);
        if (heading.isPresent()) {
            return Optional.of(stripEmphasis(heading.get().text()));
        }
        return firstGroup(BOLD_LINE, line).map(Recognizers::stripEmphasis);
    }

    // --- text helpers ---

    public static String collapseWhitespace(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }

    /**
     * Removes markdown emphasis markers and collapses whitespace.
     */
    public static String stripEmphasis(String text) {
        return collapseWhitespace(text == null ? "" : text.replaceAll("[*_`]+", " "));
    }

    public static String truncate(String text, int limit) {
        if (text == null) {
            return "";
        }
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    static int indentOf(String whitespace) {
        int width = 0;
        for (char c : whitespace.toCharArray()) {
            width += c == '\t' ? 4 : 1;
        }
        return width;
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
