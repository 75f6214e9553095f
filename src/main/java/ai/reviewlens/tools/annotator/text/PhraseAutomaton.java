package ai.reviewlens.tools.annotator.text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Aho–Corasick automaton over the phrases of a pattern-set list.
 *
 * <p>Built once per distinct pattern-set list and reusable for any number of texts. One pass
 * over the text finds every occurrence of every phrase, including overlapping and nested
 * ones. {@link #findMatches(String)} returns exactly what
 * {@link PhraseMatcher#findMatches(String, List)} returns for the same sets.</p>
 *
 * <p>Case-sensitive and case-insensitive phrases live in separate tries; the insensitive
 * trie is run over the folded text. Instances are immutable after construction and safe
 * to share between threads.</p>
 */
public final class PhraseAutomaton {

    private static final Comparator<Match> DISCOVERY_ORDER =
            Comparator.comparingInt(Match::order).thenComparingInt(Match::start);

    private final Trie exact;
    private final Trie folded;
    private final int phraseCount;

    private PhraseAutomaton(Trie exact, Trie folded, int phraseCount) {
        this.exact = exact;
        this.folded = folded;
        this.phraseCount = phraseCount;
    }

    /**
     * Compiles the searchable phrases of {@code sets}.
     *
     * @param sets pattern sets in priority order; {@code null} or empty yields an automaton that never matches
     * @return compiled automaton
     */
    public static PhraseAutomaton compile(List<PatternSet> sets) {
        final List<PhraseMatcher.Phrase> phrases = PhraseMatcher.phrases(sets);
        final Trie exact = new Trie();
        final Trie folded = new Trie();
        for (PhraseMatcher.Phrase p : phrases) {
            (p.set().caseSensitive() ? exact : folded).add(p);
        }
        exact.link();
        folded.link();
        return new PhraseAutomaton(exact, folded, phrases.size());
    }

    /** Number of searchable phrases compiled into this automaton. */
    public int phraseCount() {
        return phraseCount;
    }

    /**
     * Find all raw matches in {@code text}.
     *
     * @param text subject text; {@code null} is treated as empty
     * @return raw, possibly overlapping matches in discovery order (never {@code null})
     */
    public List<Match> findMatches(String text) {
        if (text == null || text.isEmpty() || phraseCount == 0) return List.of();
        final List<Match> out = new ArrayList<>();
        if (!exact.isEmpty()) exact.scan(text, text, out);
        if (!folded.isEmpty()) folded.scan(CaseFolding.fold(text), text, out);
        out.sort(DISCOVERY_ORDER);
        return out;
    }

    /* ----------------------------- trie ----------------------------- */

    private static final class Node {
        final Map<Character, Node> next = new HashMap<>();
        final List<PhraseMatcher.Phrase> outputs = new ArrayList<>();
        Node fail;
    }

    private static final class Trie {
        private final Node root = new Node();
        private int size;

        void add(PhraseMatcher.Phrase p) {
            Node n = root;
            for (int i = 0; i < p.key().length(); i++) {
                n = n.next.computeIfAbsent(p.key().charAt(i), c -> new Node());
            }
            n.outputs.add(p);
            size++;
        }

        boolean isEmpty() {
            return size == 0;
        }

        // Breadth-first so a node's failure target is complete before the node inherits its outputs.
        void link() {
            root.fail = root;
            final Queue<Node> queue = new ArrayDeque<>();
            for (Node child : root.next.values()) {
                child.fail = root;
                queue.add(child);
            }
            while (!queue.isEmpty()) {
                final Node node = queue.remove();
                for (Map.Entry<Character, Node> e : node.next.entrySet()) {
                    final char c = e.getKey();
                    final Node child = e.getValue();
                    Node f = node.fail;
                    while (f != root && !f.next.containsKey(c)) {
                        f = f.fail;
                    }
                    final Node target = f.next.get(c);
                    child.fail = (target != null && target != child) ? target : root;
                    child.outputs.addAll(child.fail.outputs);
                    queue.add(child);
                }
            }
        }

        void scan(String hay, String original, List<Match> out) {
            Node state = root;
            for (int i = 0; i < hay.length(); i++) {
                final char c = hay.charAt(i);
                while (state != root && !state.next.containsKey(c)) {
                    state = state.fail;
                }
                state = state.next.getOrDefault(c, root);
                for (PhraseMatcher.Phrase p : state.outputs) {
                    PhraseMatcher.addIfWhole(out, original, p, i + 1 - p.key().length());
                }
            }
        }
    }
}
