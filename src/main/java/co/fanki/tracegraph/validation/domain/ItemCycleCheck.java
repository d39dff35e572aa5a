package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.graph.domain.TraceabilityGraph;
import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds loops in the item links with an iterative depth-first search
 * using three colours. Each loop is reported once, starting at its
 * smallest uid. Self links are left to {@link LinkValidityCheck}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ItemCycleCheck implements ValidationCheck {

    private enum Color { WHITE, GRAY, BLACK }

    /** A node being explored and the parents still to visit. */
    private static final class Frame {
        private final String uid;
        private final Iterator<String> parents;

        private Frame(final String theUid, final Iterator<String> theParents) {
            this.uid = theUid;
            this.parents = theParents;
        }
    }

    @Override
    public String name() {
        return "item-cycles";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.itemCycles();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final TraceabilityGraph graph = context.graph();

        final Set<String> nodes = new TreeSet<>();
        for (final Item item : context.items()) {
            nodes.add(item.uid());
        }

        final Map<String, Color> colors = new HashMap<>();
        final Set<String> reported = new HashSet<>();
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final String start : nodes) {
            if (colors.getOrDefault(start, Color.WHITE) != Color.WHITE) {
                continue;
            }

            final Deque<Frame> stack = new ArrayDeque<>();
            final List<String> path = new ArrayList<>();
            push(start, graph, stack, path, colors);

            while (!stack.isEmpty()) {
                final Frame frame = stack.peek();
                if (!frame.parents.hasNext()) {
                    colors.put(frame.uid, Color.BLACK);
                    stack.pop();
                    path.remove(path.size() - 1);
                    continue;
                }

                final String next = frame.parents.next();
                if (next.equals(frame.uid) || !nodes.contains(next)) {
                    continue;
                }
                final Color color = colors.getOrDefault(next, Color.WHITE);
                if (color == Color.WHITE) {
                    push(next, graph, stack, path, colors);
                } else if (color == Color.GRAY) {
                    final List<String> loop = canonical(
                            path.subList(path.indexOf(next), path.size()));
                    if (reported.add(String.join(",", loop))) {
                        issues.add(describe(loop));
                    }
                }
            }
        }
        return issues;
    }

    private static void push(final String uid, final TraceabilityGraph graph,
            final Deque<Frame> stack, final List<String> path,
            final Map<String, Color> colors) {
        colors.put(uid, Color.GRAY);
        stack.push(new Frame(uid, graph.parentsOf(uid).iterator()));
        path.add(uid);
    }

    /** Rotates a loop so that it starts at its smallest uid. */
    private static List<String> canonical(final List<String> loop) {
        int smallest = 0;
        for (int i = 1; i < loop.size(); i++) {
            if (loop.get(i).compareTo(loop.get(smallest)) < 0) {
                smallest = i;
            }
        }
        final List<String> rotated = new ArrayList<>(loop.size());
        for (int i = 0; i < loop.size(); i++) {
            rotated.add(loop.get((smallest + i) % loop.size()));
        }
        return rotated;
    }

    private static ValidationIssue describe(final List<String> loop) {
        final List<String> closed = new ArrayList<>(loop);
        closed.add(loop.get(0));
        return ValidationIssue.error(loop.get(0), IssueCode.ITEM_CYCLE,
                "Cycle detected: " + String.join(" -> ", closed));
    }

}
