package com.sop.network.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds documents among the text files below a set of search roots.
 *
 * <p>A file matches when its base name contains the whole code (ignoring case
 * and punctuation), or, failing that, the code's trailing number as a
 * standalone digit run: {@code PR.OP.CL.2862} matches {@code PR_OP_CL_2862.md}
 * first and {@code 2862 - Duplicate claims.txt} second. Ties go to the
 * lexicographically smallest path, so lookups are repeatable.</p>
 */
public class DirectoryDocumentLocator implements DocumentLocator {
    private static final Logger log = LoggerFactory.getLogger(DirectoryDocumentLocator.class);

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".md", ".txt");
    private static final int MAX_SEARCH_DEPTH = 8;
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

    private final List<Path> roots;
    private final List<String> extensions;

    public DirectoryDocumentLocator(List<Path> roots) {
        this(roots, DEFAULT_EXTENSIONS);
    }

    public DirectoryDocumentLocator(List<Path> roots, List<String> extensions) {
        if (roots == null || roots.isEmpty()) {
            throw new IllegalArgumentException("at least one search root is required");
        }
        this.roots = List.copyOf(roots);
        this.extensions = extensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
    }

    public List<Path> getRoots() {
        return roots;
    }

    @Override
    public LocatorResult locate(String referenceCode) throws IOException {
        Optional<Path> match = findFile(referenceCode);
        if (match.isEmpty()) {
            log.debug("locator.notFound code={} roots={}", referenceCode, roots.size());
            return LocatorResult.notFound();
        }
        Path path = match.get();
        log.debug("locator.found code={} path={}", referenceCode, path);
        return LocatorResult.found(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    Optional<Path> findFile(String referenceCode) throws IOException {
        String compactCode = compact(referenceCode);
        Matcher number = TRAILING_NUMBER.matcher(referenceCode.trim());
        Pattern numberToken = number.find()
                ? Pattern.compile("(?<!\\d)" + Pattern.quote(number.group(1)) + "(?!\\d)")
                : null;

        Path best = null;
        int bestScore = 0;
        for (Path file : candidates()) {
            String baseName = baseName(file);
            int score = 0;
            if (!compactCode.isEmpty() && compact(baseName).contains(compactCode)) {
                score = 2;
            } else if (numberToken != null && numberToken.matcher(baseName).find()) {
                score = 1;
            }
            if (score > bestScore) {
                best = file;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    private List<Path> candidates() throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                log.warn("locator.rootMissing root={}", root);
                continue;
            }
            try (Stream<Path> walk = Files.walk(root, MAX_SEARCH_DEPTH)) {
                walk.filter(Files::isRegularFile)
                        .filter(this::hasAcceptedExtension)
                        .sorted(Comparator.comparing(Path::toString))
                        .forEach(files::add);
            }
        }
        return files;
    }

    private boolean hasAcceptedExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String compact(String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
