package io.waypoint.core.trie;

import io.waypoint.core.error.DuplicateRouteException;
import io.waypoint.core.model.RouteRecord;
import io.waypoint.core.pattern.CompiledPattern;
import io.waypoint.core.pattern.CompiledSegment;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Segment trie with backtracking match.
 *
 * <p>
 * At every node the walk tries the literal edge first, then the param edge, then the wildcard edge, which
 * consumes all remaining segments. The first complete walk wins, so static beats param beats wildcard at
 * every level. When the path runs out at a node, several terminals can apply (the node itself, an optional
 * param child, a wildcard child with an empty remainder); the highest score wins and ties go to the record
 * registered first.
 *
 * <p>
 * Param nodes are shared between patterns; capture names are taken from each record's own pattern.
 * Not thread-safe; the owning registry serializes access.
 */
public final class RouteTrie {

    private static final Logger LOG = LoggerFactory.getLogger(RouteTrie.class);

    private final String group;
    private final boolean caseSensitive;
    private final TrieNode root = new TrieNode(null, null, 0);
    private final Map<Long, TrieNode> terminals = new HashMap<>();

    public RouteTrie(String group, boolean caseSensitive) {
        this.group = group;
        this.caseSensitive = caseSensitive;
    }

    public String group() {
        return group;
    }

    /** Number of records in this trie. */
    public int size() {
        return terminals.size();
    }

    /**
     * Inserts a record at the node its pattern describes.
     *
     * @throws DuplicateRouteException if another record already occupies that node
     */
    public void insert(RouteRecord record) {
        TrieNode node = root;
        for (CompiledSegment segment : record.pattern().segments()) {
            node = switch (segment.kind()) {
                case STATIC -> {
                    String key = CompiledPattern.literalKey(segment.text(), caseSensitive);
                    TrieNode parent = node;
                    yield node.literals.computeIfAbsent(
                            key, k -> new TrieNode(parent, k, parent.weight + CompiledSegment.STATIC_WEIGHT));
                }
                case PARAM -> {
                    if (node.paramChild == null) {
                        node.paramChild = new TrieNode(node, null, node.weight + CompiledSegment.PARAM_WEIGHT);
                    }
                    yield node.paramChild;
                }
                case WILDCARD -> {
                    if (node.wildcardChild == null) {
                        node.wildcardChild = new TrieNode(node, null, node.weight + CompiledSegment.LOOSE_WEIGHT);
                    }
                    yield node.wildcardChild;
                }
            };
        }
        if (node.terminal != null && node.terminal.id() != record.id()) {
            RouteRecord existing = node.terminal;
            throw new DuplicateRouteException(
                    "Route '" + record.path() + "' conflicts with existing route '" + existing.path()
                            + "' in group '" + group + "'",
                    record.path(),
                    existing.id());
        }
        node.terminal = record;
        terminals.put(record.id(), node);
        LOG.debug("Inserted route {} into group '{}'", record.path(), group);
    }

    /**
     * Removes a record and prunes branches left without terminals.
     *
     * @return {@code true} if the record was present
     */
    public boolean remove(long recordId) {
        TrieNode node = terminals.remove(recordId);
        if (node == null) {
            return false;
        }
        node.terminal = null;
        prune(node);
        return true;
    }

    /** Exact lookup of the record sitting at the node a pattern describes. */
    public Optional<RouteRecord> find(CompiledPattern pattern) {
        TrieNode node = root;
        for (CompiledSegment segment : pattern.segments()) {
            node = switch (segment.kind()) {
                case STATIC -> node.literals.get(CompiledPattern.literalKey(segment.text(), caseSensitive));
                case PARAM -> node.paramChild;
                case WILDCARD -> node.wildcardChild;
            };
            if (node == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(node.terminal);
    }

    /**
     * Identity of the node a pattern occupies: two patterns with equal keys conflict in one trie. Param
     * names and optionality do not take part, e.g. {@code /user/:id} and {@code /user/:uid?} conflict.
     */
    public static String nodeKey(CompiledPattern pattern, boolean caseSensitive) {
        StringBuilder sb = new StringBuilder();
        for (CompiledSegment segment : pattern.segments()) {
            sb.append('/');
            switch (segment.kind()) {
                case STATIC -> sb.append(CompiledPattern.literalKey(segment.text(), caseSensitive));
                case PARAM -> sb.append(':');
                case WILDCARD -> sb.append('*');
            }
        }
        return sb.toString();
    }

    /**
     * Matches path segments.
     *
     * @param segments raw segments of a normalized path
     * @return the best match, or empty
     */
    public Optional<TrieMatch> match(List<String> segments) {
        List<String> values = new ArrayList<>();
        return Optional.ofNullable(walk(root, segments, 0, values));
    }

    private TrieMatch walk(TrieNode node, List<String> segments, int index, List<String> values) {
        if (index == segments.size()) {
            return atEnd(node, values);
        }
        String segment = segments.get(index);
        TrieNode literal = node.literals.get(CompiledPattern.literalKey(segment, caseSensitive));
        if (literal != null) {
            TrieMatch found = walk(literal, segments, index + 1, values);
            if (found != null) {
                return found;
            }
        }
        if (node.paramChild != null) {
            values.add(segment);
            TrieMatch found = walk(node.paramChild, segments, index + 1, values);
            values.remove(values.size() - 1);
            if (found != null) {
                return found;
            }
        }
        TrieNode wildcard = node.wildcardChild;
        if (wildcard != null && wildcard.terminal != null) {
            String rest = String.join("/", segments.subList(index, segments.size()));
            return hit(wildcard, capturesWith(values, rest));
        }
        return null;
    }

    private TrieMatch atEnd(TrieNode node, List<String> values) {
        TrieMatch best = null;
        if (node.terminal != null) {
            best = hit(node, new ArrayList<>(values));
        }
        TrieNode optional = node.paramChild;
        if (optional != null && optional.terminal != null && optional.terminal.pattern().endsOptional()) {
            best = better(best, hit(optional, capturesWith(values, null)));
        }
        TrieNode wildcard = node.wildcardChild;
        if (wildcard != null && wildcard.terminal != null) {
            best = better(best, hit(wildcard, capturesWith(values, "")));
        }
        return best;
    }

    private static List<String> capturesWith(List<String> values, String last) {
        List<String> captures = new ArrayList<>(values.size() + 1);
        captures.addAll(values);
        captures.add(last);
        return captures;
    }

    private static TrieMatch hit(TrieNode node, List<String> captures) {
        RouteRecord record = node.terminal;
        int score = node.weight + (record.pattern().endsOptional() ? CompiledSegment.LOOSE_WEIGHT : 0);
        return new TrieMatch(record, captures, score);
    }

    private static TrieMatch better(TrieMatch current, TrieMatch candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate.score() > current.score()) {
            return candidate;
        }
        if (candidate.score() == current.score() && candidate.record().id() < current.record().id()) {
            return candidate;
        }
        return current;
    }

    private static void prune(TrieNode node) {
        TrieNode current = node;
        while (current.parent != null && current.terminal == null && current.isLeaf()) {
            current.unlink();
            current = current.parent;
        }
    }
}
