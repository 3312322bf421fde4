package im.arun.jsonnav.search;

import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.model.SearchMatchType;
import im.arun.jsonnav.model.SearchOptions;
import im.arun.jsonnav.model.SearchResult;
import im.arun.jsonnav.util.CancellationSignal;
import im.arun.jsonnav.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Answers text, wildcard and regex queries against the current {@link SearchIndex}.
 */
public class SearchEngine {
    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    private static final double EXACT_MATCH_BONUS = 2.0;
    private static final double DEPTH_BONUS_STEP = 0.1;
    private static final int DEPTH_BONUS_LEVELS = 5;
    private static final int CONTEXT_MIN_LENGTH = 50;
    private static final String ELLIPSIS = "...";

    private static final Comparator<SearchResult> RANKING = Comparator
        .comparingDouble(SearchResult::getScore).reversed()
        .thenComparing(SearchResult::getPathExpression);

    private final SearchIndexBuilder builder;
    private final int maxResults;
    private final long timeoutMillis;
    private final int contextRadius;
    private final AtomicReference<SearchIndex> current = new AtomicReference<>(SearchIndex.EMPTY);

    public SearchEngine(JsonNavConfig config) {
        this.builder = new SearchIndexBuilder(config.getNgramSize(), config.getNgramMinValueLength());
        this.maxResults = config.getMaxSearchResults();
        this.timeoutMillis = config.getSearchTimeoutMillis();
        this.contextRadius = config.getContextRadius();
    }

    public SearchIndex rebuildIndex(LazyNode root) {
        return rebuildIndex(root, CancellationSignal.none());
    }

    /**
     * Indexes the materialized tree and swaps the result in as the current index.
     */
    public SearchIndex rebuildIndex(LazyNode root, CancellationSignal signal) {
        SearchIndex index = builder.build(root, signal);
        current.set(index);
        return index;
    }

    public void clearIndex() {
        current.set(SearchIndex.EMPTY);
    }

    public SearchIndex currentIndex() {
        return current.get();
    }

    public CompletableFuture<List<SearchResult>> search(String query, SearchOptions options) {
        return search(query, options, new CancellationSignal());
    }

    public CompletableFuture<List<SearchResult>> search(String query, SearchOptions options, CancellationSignal signal) {
        return CompletableFuture.supplyAsync(() -> searchNow(query, options, signal), ExecutorProvider.getExecutor());
    }

    /**
     * Runs a query on the calling thread.
     *
     * @return ranked results, at most {@code maxSearchResults}; empty for a blank query
     * @throws InvalidPatternException if a regex query does not compile
     * @throws SearchTimeoutException  if a regex or wildcard scan exceeds the deadline
     * @throws java.util.concurrent.CancellationException if the signal is raised
     */
    public List<SearchResult> searchNow(String query, SearchOptions options, CancellationSignal signal) {
        if (query == null || query.isBlank()) {
            return Collections.emptyList();
        }

        long start = System.currentTimeMillis();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        SearchIndex index = current.get();
        Map<Map.Entry<NodePath, SearchMatchType>, SearchResult> found = new LinkedHashMap<>();

        if (options.isRegex()) {
            searchRegex(index, compile(query, options), options, signal, deadline, found);
        } else if (options.isWildcard()) {
            searchWildcard(index, wildcardPattern(query), options, signal, deadline, found);
        } else {
            searchText(index, query, options, signal, found);
        }

        List<SearchResult> results = new ArrayList<>(found.values());
        results.sort(RANKING);
        if (results.size() > maxResults) {
            results = new ArrayList<>(results.subList(0, maxResults));
        }

        logger.info("Search '{}' returned {} results in {} ms", query, results.size(), System.currentTimeMillis() - start);
        return results;
    }

    private void searchText(SearchIndex index, String query, SearchOptions options, CancellationSignal signal,
                            Map<Map.Entry<NodePath, SearchMatchType>, SearchResult> found) {
        String lowerQuery = query.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<IndexEntry>> bucket : index.buckets().entrySet()) {
            signal.throwIfCancelled();
            if (!bucket.getKey().contains(lowerQuery)) {
                continue;
            }
            for (IndexEntry entry : bucket.getValue()) {
                if (!options.includes(entry.getMatchType()) || found.containsKey(keyOf(entry))) {
                    continue;
                }
                String content = entry.getContent();
                int at = options.isCaseSensitive()
                    ? content.indexOf(query)
                    : indexOfIgnoreCase(content, query);
                if (at >= 0) {
                    found.put(keyOf(entry), toResult(entry, at, query.length()));
                }
            }
        }
    }

    private void searchWildcard(SearchIndex index, Pattern pattern, SearchOptions options, CancellationSignal signal,
                                long deadline, Map<Map.Entry<NodePath, SearchMatchType>, SearchResult> found) {
        for (Map.Entry<String, List<IndexEntry>> bucket : index.buckets().entrySet()) {
            signal.throwIfCancelled();
            DeadlineCharSequence.checkDeadline(deadline, timeoutMillis);
            if (!pattern.matcher(new DeadlineCharSequence(bucket.getKey(), deadline, timeoutMillis)).matches()) {
                continue;
            }
            for (IndexEntry entry : bucket.getValue()) {
                if (!options.includes(entry.getMatchType()) || found.containsKey(keyOf(entry))) {
                    continue;
                }
                // n-gram buckets hold values that only contain the key
                if (pattern.matcher(new DeadlineCharSequence(entry.getContent(), deadline, timeoutMillis)).matches()) {
                    found.put(keyOf(entry), toResult(entry, 0, entry.getContent().length()));
                }
            }
        }
    }

    private void searchRegex(SearchIndex index, Pattern pattern, SearchOptions options, CancellationSignal signal,
                             long deadline, Map<Map.Entry<NodePath, SearchMatchType>, SearchResult> found) {
        int scanned = 0;
        for (IndexEntry entry : index.entries()) {
            if (++scanned % 256 == 0) {
                signal.throwIfCancelled();
                DeadlineCharSequence.checkDeadline(deadline, timeoutMillis);
            }
            if (!options.includes(entry.getMatchType()) || found.containsKey(keyOf(entry))) {
                continue;
            }
            Matcher matcher = pattern.matcher(new DeadlineCharSequence(entry.getContent(), deadline, timeoutMillis));
            if (matcher.find()) {
                found.put(keyOf(entry), toResult(entry, matcher.start(), matcher.end() - matcher.start()));
            }
        }
    }

    /**
     * Offset of {@code query} in {@code content}, comparing char by char without case.
     * Offsets always refer to {@code content} itself, whose lowercase form may differ in length.
     */
    static int indexOfIgnoreCase(String content, String query) {
        int last = content.length() - query.length();
        for (int i = 0; i <= last; i++) {
            if (content.regionMatches(true, i, query, 0, query.length())) {
                return i;
            }
        }
        return -1;
    }

    private static Pattern compile(String query, SearchOptions options) {
        try {
            return Pattern.compile(query, options.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(query, e);
        }
    }

    /**
     * Translates {@code *} and {@code ?} into a whole-string, case-insensitive pattern.
     */
    static Pattern wildcardPattern(String query) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : query.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        regex.append('$');
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private SearchResult toResult(IndexEntry entry, int matchStart, int matchLength) {
        String content = entry.getContent();
        boolean exact = matchStart == 0 && matchLength == content.length();
        int depth = entry.getPath().depth();
        double score = entry.getMatchType().weight()
            + (exact ? EXACT_MATCH_BONUS : 0.0)
            + Math.max(0, DEPTH_BONUS_LEVELS - depth) * DEPTH_BONUS_STEP;

        return new SearchResult(entry.getPath(), entry.getMatchType(),
            content.substring(matchStart, matchStart + matchLength),
            context(content, matchStart, matchLength), matchStart, matchLength, score);
    }

    private String context(String content, int matchStart, int matchLength) {
        if (content.length() <= CONTEXT_MIN_LENGTH) {
            return content;
        }
        int from = Math.max(0, matchStart - contextRadius);
        int to = Math.min(content.length(), matchStart + matchLength + contextRadius);
        return (from > 0 ? ELLIPSIS : "") + content.substring(from, to) + (to < content.length() ? ELLIPSIS : "");
    }

    private static Map.Entry<NodePath, SearchMatchType> keyOf(IndexEntry entry) {
        return new AbstractMap.SimpleImmutableEntry<>(entry.getPath(), entry.getMatchType());
    }
}
