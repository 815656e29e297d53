package com.researchintel.deepresearch.citation;

import com.researchintel.deepresearch.model.Citation;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Allocates and tracks citation ids for a single run.
 *
 * Ids are {@code C} followed by a zero-padded three digit sequence ({@code C001} to {@code C999}).
 * The allocator continues from the highest id seen, so registering {@code C010} out of sequence
 * makes the next allocation {@code C011}. Instances are owned by one run and are not thread-safe.
 */
public class CitationRegistry {

    public static final Pattern CID = Pattern.compile("C\\d{3}");
    private static final Pattern REFERENCE_GROUP =
            Pattern.compile("\\(\\s*(C\\d{3}(?:\\s*,\\s*C\\d{3})*)\\s*\\)");
    private static final int MAX_SEQUENCE = 999;
    private static final int QUOTE_HASH_LENGTH = 16;

    private final Clock clock;
    private final Map<String, Citation> byId = new LinkedHashMap<>();
    private int highestSequence;

    public CitationRegistry() {
        this(Clock.systemUTC());
    }

    public CitationRegistry(Clock clock) {
        this.clock = clock;
    }

    public static boolean isValidId(String cid) {
        return cid != null && CID.matcher(cid).matches();
    }

    public static String formatId(int sequence) {
        return String.format("C%03d", sequence);
    }

    /**
     * Register a citation under a caller-assigned id.
     *
     * @throws IllegalArgumentException if the id is malformed or already registered in this run
     */
    public Citation register(String cid, String url, String title, String locator, String quote) {
        if (!isValidId(cid)) {
            throw new IllegalArgumentException("Citation id must be C followed by 3 digits, got: " + cid);
        }
        if (byId.containsKey(cid)) {
            throw new IllegalArgumentException("Citation id already registered: " + cid);
        }

        Citation citation = new Citation(
                cid,
                url,
                title,
                locator == null ? "" : locator,
                clock.instant(),
                quote == null || quote.isEmpty() ? null : quoteHash(quote),
                null);

        byId.put(cid, citation);
        highestSequence = Math.max(highestSequence, Integer.parseInt(cid.substring(1)));
        return citation;
    }

    public Citation register(String cid, String url, String title, String locator) {
        return register(cid, url, title, locator, null);
    }

    /**
     * Allocate the id after the highest one seen so far.
     */
    public String nextId() {
        if (highestSequence >= MAX_SEQUENCE) {
            throw new IllegalStateException("Citation ids exhausted at " + formatId(MAX_SEQUENCE));
        }
        highestSequence++;
        return formatId(highestSequence);
    }

    public Optional<Citation> lookup(String cid) {
        return Optional.ofNullable(byId.get(cid));
    }

    public boolean contains(String cid) {
        return byId.containsKey(cid);
    }

    /** Citations in registration order. */
    public List<Citation> all() {
        return List.copyOf(byId.values());
    }

    public int size() {
        return byId.size();
    }

    public void reset() {
        byId.clear();
        highestSequence = 0;
    }

    /**
     * Every citation id referenced inside a parenthesised group, e.g. {@code (C001)} or
     * {@code (C002, C003)}, in order of appearance.
     */
    public List<String> findReferences(String text) {
        List<String> found = new ArrayList<>();
        if (text == null) return found;

        Matcher m = REFERENCE_GROUP.matcher(text);
        while (m.find()) {
            for (String cid : m.group(1).split(",")) {
                found.add(cid.trim());
            }
        }
        return found;
    }

    /**
     * Cross-check the references in {@code text} against this registry.
     */
    public ReferenceCount countValid(String text) {
        List<String> found = findReferences(text);
        int valid = (int) found.stream().filter(byId::containsKey).count();
        return new ReferenceCount(valid, found.size() - valid);
    }

    static String quoteHash(String quote) {
        return DigestUtils.md5DigestAsHex(quote.getBytes(StandardCharsets.UTF_8)).substring(0, QUOTE_HASH_LENGTH);
    }

    public record ReferenceCount(int valid, int invalid) {
    }
}
