package com.taskforest.core.index;

import com.taskforest.core.extract.SubInstructionExtractor;
import com.taskforest.core.model.IndexedInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Prefix index from normalized declared instructions to the tasks that declared them.
 * <p>
 * One instance lives for one reconstruction pass and is discarded afterwards. All
 * indexing for the pass happens before the first query; the index is not safe for
 * concurrent use.
 */
public class InstructionIndex {

    private static final Logger log = LoggerFactory.getLogger(InstructionIndex.class);

    public static final int DEFAULT_MIN_SHARED_PREFIX = 16;
    public static final int DEFAULT_MAX_CANDIDATES = 64;

    /** Descending cut lengths for {@link #searchExactPrefix(String)}. */
    private static final int CUT_STEP = 16;
    private static final int SMALLEST_CUT = 16;

    private final InstructionNormalizer normalizer;
    private final SubInstructionExtractor extractor;
    private final int minSharedPrefix;
    private final int maxCandidates;

    private final RadixTree<List<IndexedInstruction>> tree = new RadixTree<>();
    private final Set<String> owners = new LinkedHashSet<>();
    private final Map<String, Integer> documentFrequency = new HashMap<>();
    private int entryCount;

    public InstructionIndex() {
        this(new InstructionNormalizer(), new SubInstructionExtractor(),
                DEFAULT_MIN_SHARED_PREFIX, DEFAULT_MAX_CANDIDATES);
    }

    public InstructionIndex(InstructionNormalizer normalizer, SubInstructionExtractor extractor,
                            int minSharedPrefix, int maxCandidates) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.minSharedPrefix = Math.max(1, minSharedPrefix);
        this.maxCandidates = Math.max(1, maxCandidates);
    }

    public InstructionNormalizer normalizer() {
        return normalizer;
    }

    public boolean add(String ownerTaskId, String rawInstruction) {
        return add(ownerTaskId, rawInstruction, null);
    }

    /**
     * Indexes one declared instruction.
     *
     * @param ownerTaskId    the declaring task
     * @param rawInstruction the instruction as declared
     * @param ownerWorkspace workspace tag for shared indexes (nullable)
     * @return true if a new (owner, prefix) entry was created
     */
    public boolean add(String ownerTaskId, String rawInstruction, String ownerWorkspace) {
        if (ownerTaskId == null || ownerTaskId.isBlank() || rawInstruction == null) {
            return false;
        }
        String key = normalizer.normalize(rawInstruction);
        if (key.isEmpty()) {
            return false;
        }
        List<IndexedInstruction> bucket = tree.get(key);
        if (bucket == null) {
            bucket = new ArrayList<>(1);
            tree.put(key, bucket);
        } else if (bucket.stream().anyMatch(e -> e.ownerTaskId().equals(ownerTaskId))) {
            return false;
        }
        var entry = new IndexedInstruction(key, ownerTaskId, rawInstruction.strip(), ownerWorkspace);
        bucket.add(entry);
        owners.add(ownerTaskId);
        for (String token : new LinkedHashSet<>(InstructionNormalizer.tokens(key))) {
            documentFrequency.merge(token, 1, Integer::sum);
        }
        entryCount++;
        return true;
    }

    public int addAllFromParentText(String ownerTaskId, String parentText) {
        return addAllFromParentText(ownerTaskId, parentText, null);
    }

    /**
     * Extracts sub-instructions from a parent's text and indexes each one.
     * Text without structural markers indexes nothing.
     *
     * @return number of new entries
     */
    public int addAllFromParentText(String ownerTaskId, String parentText, String ownerWorkspace) {
        int added = 0;
        for (String instruction : extractor.extract(parentText)) {
            if (add(ownerTaskId, instruction, ownerWorkspace)) {
                added++;
            }
        }
        if (added > 0) {
            log.debug("Indexed {} instruction(s) declared by {}", added, ownerTaskId);
        }
        return added;
    }

    /**
     * Entries that could plausibly be the declaration behind {@code text}: keys that
     * are prefixes of the query, keys that extend it, and keys sharing a leading run
     * of at least the configured minimum. Bounded by the candidate limit.
     */
    public List<IndexedInstruction> queryCandidates(String text) {
        String query = normalizer.normalize(text);
        if (query.isEmpty() || tree.isEmpty()) {
            return List.of();
        }
        Set<String> keys = new LinkedHashSet<>();
        List<String> prefixes = tree.prefixesOf(query);
        for (int i = prefixes.size() - 1; i >= 0; i--) {
            keys.add(prefixes.get(i));
        }
        keys.addAll(tree.keysWithPrefix(query, maxCandidates));
        int shared = tree.sharedPrefixLength(query);
        if (shared >= minSharedPrefix && shared < query.length()) {
            keys.addAll(tree.keysWithPrefix(query.substring(0, shared), maxCandidates));
        }

        var out = new ArrayList<IndexedInstruction>();
        for (String key : keys) {
            for (IndexedInstruction entry : tree.get(key)) {
                if (out.size() >= maxCandidates) {
                    return out;
                }
                out.add(entry);
            }
        }
        return out;
    }

    /**
     * Exact lookup of the query cut to decreasing lengths (192, 176, ... 32, 16),
     * returning the entries of the first length that hits, one per owner.
     */
    public List<IndexedInstruction> searchExactPrefix(String text) {
        String query = normalizer.normalize(text);
        if (query.isEmpty()) {
            return List.of();
        }
        int start = Math.min(normalizer.maxLength(), query.length());
        var cuts = new LinkedHashSet<Integer>();
        cuts.add(start);
        for (int len = normalizer.maxLength(); len >= SMALLEST_CUT; len -= CUT_STEP) {
            if (len < start) {
                cuts.add(len);
            }
        }
        for (int len : cuts) {
            List<IndexedInstruction> bucket = tree.get(query.substring(0, len).strip());
            if (bucket != null) {
                return List.copyOf(bucket);
            }
        }
        return List.of();
    }

    public int documentFrequency(String token) {
        return documentFrequency.getOrDefault(token, 0);
    }

    public int entryCount() {
        return entryCount;
    }

    public int size() {
        return tree.size();
    }

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    public IndexStats stats() {
        int distinct = tree.size();
        return new IndexStats(distinct, entryCount, owners.size(), tree.nodeCount(),
                distinct == 0 ? 0.0 : (double) entryCount / distinct);
    }

    public void clear() {
        tree.clear();
        owners.clear();
        documentFrequency.clear();
        entryCount = 0;
    }
}
