package com.sop.network.parse;

import com.sop.network.extract.EntityExtractor;
import com.sop.network.extract.ExtractedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns raw procedure text into a {@link StructuralRecord}.
 *
 * <p>Parsing is best-effort: a convention that is absent simply leaves its
 * field empty, and {@link #parse(String)} never throws for malformed input.
 * The parser is stateless and can be shared between threads.</p>
 */
public class StructuralParser {
    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private final ParserConfig config;
    private final EntityExtractor entityExtractor;
    private final LookupTableExtractor tableExtractor;

    public StructuralParser() {
        this(ParserConfig.defaults());
    }

    public StructuralParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.entityExtractor = new EntityExtractor(config.getEntityPatterns());
        this.tableExtractor = new LookupTableExtractor();
    }

    public ParserConfig getConfig() {
        return config;
    }

    public EntityExtractor getEntityExtractor() {
        return entityExtractor;
    }

    public StructuralRecord parse(String rawText) {
        String text = rawText == null ? "" : rawText.replace("\r\n", "\n").replace('\r', '\n');

        DocumentHeader header = parseHeader(text);
        List<RevisionEntry> revisions = Recognizers.revisionEntries(text).stream()
                .map(r -> new RevisionEntry(r.revision(), r.date(),
                        Recognizers.truncate(r.description(), config.getActionExcerptLimit())))
                .toList();
        List<CategorySection> categories = parseCategories(text);

        StructuralRecord record = new StructuralRecord(
                header,
                revisions,
                categories,
                tableExtractor.extract(text),
                Recognizers.referenceMentions(text, config.getReferencePattern()),
                entityExtractor.extract(text),
                text);

        log.debug("parse.completed title='{}' categories={} steps={} references={} tables={}",
                header.title(), categories.size(),
                categories.stream().mapToInt(c -> c.steps().size()).sum(),
                record.references().size(), record.tables().size());
        return record;
    }

    // --- header ---

    private DocumentHeader parseHeader(String text) {
        Optional<Recognizers.DocumentIdentity> identity = Recognizers.documentIdentity(text);
        return new DocumentHeader(
                Recognizers.title(text).map(Recognizers::stripEmphasis).orElse(""),
                identity.map(Recognizers.DocumentIdentity::documentType).orElse(""),
                identity.map(Recognizers.DocumentIdentity::documentNumber).orElse(""),
                Recognizers.status(text).orElse(""),
                Recognizers.causeExplanation(text).orElse(""),
                Recognizers.pendCode(text).orElse(""));
    }

    // --- categories ---

    private List<CategorySection> parseCategories(String text) {
        String body = text;
        if (config.getStartMarker() != null) {
            Matcher start = config.getStartMarker().matcher(text);
            if (start.find()) {
                body = text.substring(start.end());
            }
        }

        Map<String, String> names = new LinkedHashMap<>();
        Map<String, StringBuilder> spans = new LinkedHashMap<>();
        String currentKey = null;
        for (String line : body.split("\n", -1)) {
            Optional<String> category = Recognizers.categoryHeading(line, config.getCategoryHeadings());
            if (category.isPresent()) {
                currentKey = categoryKey(category.get());
                if (names.putIfAbsent(currentKey, category.get()) == null) {
                    spans.put(currentKey, new StringBuilder());
                } else {
                    log.debug("parse.categoryMerged name='{}'", category.get());
                    spans.get(currentKey).append('\n');
                }
                continue;
            }
            Optional<Recognizers.Heading> heading = Recognizers.heading(line);
            if (heading.isPresent() && heading.get().level() <= 2) {
                currentKey = null;
                continue;
            }
            if (currentKey != null) {
                spans.get(currentKey).append(line).append('\n');
            }
        }

        List<CategorySection> categories = new ArrayList<>();
        names.forEach((key, name) -> {
            String span = spans.get(key).toString();
            if (isSkipped(name) || span.isBlank()) {
                log.debug("parse.categorySkipped name='{}'", name);
                return;
            }
            categories.add(new CategorySection(name, span, parseSteps(span)));
        });
        return categories;
    }

    private boolean isSkipped(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return config.getSkippedCategoryWords().stream()
                .anyMatch(word -> lower.contains(word.toLowerCase(Locale.ROOT)));
    }

    /**
     * Case, punctuation and spacing insensitive key used to merge near-duplicate headings.
     */
    static String categoryKey(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    // --- steps ---

    private List<StepRecord> parseSteps(String span) {
        List<StepRecord> steps = new ArrayList<>();
        Integer number = null;
        StringBuilder stepText = new StringBuilder();
        for (String line : span.split("\n", -1)) {
            Optional<Recognizers.StepStart> start = Recognizers.stepStart(line);
            if (start.isPresent()) {
                if (number != null) {
                    steps.add(parseStep(number, stepText.toString()));
                }
                number = start.get().number();
                stepText.setLength(0);
                stepText.append(start.get().text()).append('\n');
            } else if (number != null) {
                stepText.append(line).append('\n');
            }
        }
        if (number != null) {
            steps.add(parseStep(number, stepText.toString()));
        }
        return steps;
    }

    private StepRecord parseStep(int number, String text) {
        String[] lines = text.split("\n", -1);
        int firstMarker = -1;
        for (int i = 0; i < lines.length; i++) {
            if (Recognizers.branchMarker(lines[i]).isPresent()) {
                firstMarker = i;
                break;
            }
        }
        int leadEnd = firstMarker >= 0 ? firstMarker : lines.length;
        String leadText = Recognizers.collapseWhitespace(String.join(" ", List.of(lines).subList(0, leadEnd)));

        boolean hasMarkers = firstMarker >= 0;
        List<BranchRecord> branches = hasMarkers ? parseBranches(lines, firstMarker) : List.of();

        return new StepRecord(
                number,
                leadText,
                hasMarkers || Recognizers.isQuestion(leadText),
                branches,
                Recognizers.importantNotes(text),
                Recognizers.referenceMentions(leadText, config.getReferencePattern()),
                entityExtractor.extract(leadText),
                Recognizers.truncate(text.strip(), config.getStepExcerptLimit()));
    }

    // --- branches ---

    private List<BranchRecord> parseBranches(String[] lines, int firstMarker) {
        Recognizers.BranchMarker top = Recognizers.branchMarker(lines[firstMarker]).orElseThrow();
        List<BranchKind> kinds = new ArrayList<>();
        List<List<String>> bodies = new ArrayList<>();
        for (int i = firstMarker; i < lines.length; i++) {
            Optional<Recognizers.BranchMarker> marker = Recognizers.branchMarker(lines[i]);
            if (marker.isPresent() && !isNested(marker.get(), top)) {
                kinds.add(marker.get().kind());
                List<String> body = new ArrayList<>();
                body.add(marker.get().text());
                bodies.add(body);
            } else {
                bodies.get(bodies.size() - 1).add(lines[i]);
            }
        }
        List<BranchRecord> branches = new ArrayList<>();
        for (int b = 0; b < kinds.size(); b++) {
            branches.add(parseBranch(kinds.get(b), bodies.get(b)));
        }
        return branches;
    }

    static boolean isNested(Recognizers.BranchMarker marker, Recognizers.BranchMarker top) {
        return marker.indent() > top.indent()
                || (marker.usesNestedGlyph() && !top.usesNestedGlyph());
    }

    private BranchRecord parseBranch(BranchKind kind, List<String> body) {
        StringBuilder action = new StringBuilder(body.get(0));
        List<SubConditionDraft> drafts = new ArrayList<>();
        SubConditionDraft current = null;
        for (String line : body.subList(1, body.size())) {
            Optional<Recognizers.BranchMarker> nested = Recognizers.branchMarker(line);
            Optional<Recognizers.LabeledItem> labeled = nested.isPresent()
                    ? Optional.empty() : Recognizers.labeledItem(line);
            if (nested.isPresent()) {
                current = SubConditionDraft.of(nested.get());
                drafts.add(current);
            } else if (labeled.isPresent()) {
                current = new SubConditionDraft(SubConditionKind.LABELED, labeled.get().label(), labeled.get().text());
                drafts.add(current);
            } else if (current != null) {
                current.text.append(' ').append(line);
            } else {
                action.append(' ').append(line);
            }
        }

        String actionText = Recognizers.collapseWhitespace(action.toString());
        List<SubConditionRecord> subConditions = drafts.stream().map(this::toRecord).toList();
        return new BranchRecord(
                kind,
                Recognizers.truncate(actionText, config.getActionExcerptLimit()),
                Recognizers.continueToNextStep(actionText),
                Recognizers.proceedToSection(actionText).orElse(null),
                subConditions,
                Recognizers.referenceMentions(actionText, config.getReferencePattern()),
                entityExtractor.extract(actionText));
    }

    private SubConditionRecord toRecord(SubConditionDraft draft) {
        String text = Recognizers.collapseWhitespace(draft.text.toString());
        List<ExtractedEntity> entities = entityExtractor.extract(text);
        return new SubConditionRecord(
                draft.kind,
                draft.label,
                Recognizers.truncate(text, config.getActionExcerptLimit()),
                Recognizers.referenceMentions(text, config.getReferencePattern()),
                entities);
    }

    private static final class SubConditionDraft {
        private final SubConditionKind kind;
        private final String label;
        private final StringBuilder text;

        private SubConditionDraft(SubConditionKind kind, String label, String text) {
            this.kind = kind;
            this.label = label;
            this.text = new StringBuilder(text);
        }

        static SubConditionDraft of(Recognizers.BranchMarker marker) {
            return switch (marker.kind()) {
                case YES -> new SubConditionDraft(SubConditionKind.NESTED_YES, BranchKind.YES.getLabel(), marker.text());
                case NO -> new SubConditionDraft(SubConditionKind.NESTED_NO, BranchKind.NO.getLabel(), marker.text());
                case UNSURE -> new SubConditionDraft(SubConditionKind.LABELED, "Unsure", marker.text());
            };
        }
    }
}
