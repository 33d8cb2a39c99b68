package io.quorum.core.partition;

import io.quorum.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/// Partitions a corpus by directory, up to a fixed depth.
///
/// Every entry is assigned to the directory formed by its first `depth` path
/// segments. Root-level files form a single `(root)` unit. A unit is marked
/// oversized when its size exceeds `oversizedFactor` times the median unit size.
///
/// Units are ordered by directory name and numbered `U1..Un` in that order.
public class DirectoryPartitioner implements WorkUnitPartitioner {

    private static final Logger logger = Logger.getLogger(DirectoryPartitioner.class.getName());

    static final String ROOT_LABEL = "(root)";

    private final int depth;
    private final double oversizedFactor;

    public DirectoryPartitioner(int depth, double oversizedFactor) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1");
        }
        this.depth = depth;
        this.oversizedFactor = oversizedFactor;
    }

    @Override
    public List<WorkUnit> partition(CorpusDescription corpus) throws ConfigurationException {
        if (corpus.isEmpty()) {
            throw new ConfigurationException("Corpus '" + corpus.name() + "' has no resources");
        }

        Map<String, Long> sizes = new TreeMap<>();
        for (CorpusEntry entry : corpus.entries()) {
            // Empty files still cost an invocation
            sizes.merge(groupOf(entry), Math.max(1L, entry.size()), Long::sum);
        }

        double median = median(sizes.values().stream().mapToLong(Long::longValue).toArray());
        double limit = median * oversizedFactor;

        List<WorkUnit> units = new ArrayList<>(sizes.size());
        int index = 1;
        for (Map.Entry<String, Long> group : sizes.entrySet()) {
            String dir = group.getKey();
            long size = group.getValue();
            boolean oversized = size > limit;
            String label = dir.isEmpty() ? ROOT_LABEL : dir;
            String pattern = dir.isEmpty() ? "*" : dir + "/**";
            units.add(new WorkUnit("U" + index++, label, List.of(pattern), size, oversized));
            if (oversized) {
                logger.fine("Unit " + label + " is oversized (" + size + " > " + limit + ")");
            }
        }

        logger.info(
                "Partitioned corpus '"
                        + corpus.name()
                        + "' into "
                        + units.size()
                        + " units (median size "
                        + median
                        + ")");
        return units;
    }

    private String groupOf(CorpusEntry entry) {
        String dir = entry.directory();
        if (dir.isEmpty()) {
            return "";
        }
        String[] segments = dir.split("/");
        if (segments.length <= depth) {
            return dir;
        }
        return String.join("/", Arrays.copyOf(segments, depth));
    }

    static double median(long[] values) {
        long[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
