package com.scrapesentinel.monitors.diff;

import com.scrapesentinel.core.model.DiffResult;
import com.scrapesentinel.core.model.Snapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Line diffs between snapshots of the same source, matched by longest common subsequence in linear
 * memory and rendered as a unified diff.
 */
public class DiffEngine {
    public static final int DEFAULT_CONTEXT_LINES = 3;

    private final SnapshotStore store;
    private final int contextLines;

    public DiffEngine(SnapshotStore store) {
        this(store, DEFAULT_CONTEXT_LINES);
    }

    public DiffEngine(SnapshotStore store, int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must not be negative");
        }
        this.store = store;
        this.contextLines = contextLines;
    }

    /**
     * @throws com.scrapesentinel.core.error.NotFoundException if either label is unknown for the source
     */
    public DiffResult compare(String sourceKey, String fromLabel, String toLabel) {
        Snapshot from = store.get(sourceKey, fromLabel);
        Snapshot to = store.get(sourceKey, toLabel);
        return diff(from, to);
    }

    public List<DiffResult> exportHistory(String sourceKey) {
        List<Snapshot> history = store.history(sourceKey);
        List<DiffResult> diffs = new ArrayList<>();
        for (int i = 1; i < history.size(); i++) {
            diffs.add(diff(history.get(i - 1), history.get(i)));
        }
        return diffs;
    }

    public DiffResult diff(Snapshot from, Snapshot to) {
        List<String> a = from.content().lines().collect(Collectors.toList());
        List<String> b = to.content().lines().collect(Collectors.toList());
        List<Edit> edits = editScript(a, b);

        int common = 0;
        for (Edit edit : edits) {
            if (edit.op() == Op.EQUAL) {
                common++;
            }
        }
        int added = b.size() - common;
        int removed = a.size() - common;
        String unified = added + removed == 0
                ? ""
                : render(from.sourceKey() + "@" + from.label(), to.sourceKey() + "@" + to.label(), a, b, edits);

        return new DiffResult(
                from.sourceKey(),
                from.label(),
                to.label(),
                unified,
                added,
                removed,
                similarity(common, a.size(), b.size())
        );
    }

    /**
     * Edit script over a longest common subsequence of lines. Lines are interned to ids and lines
     * missing from the other side are dropped before matching, since they can never be part of the
     * subsequence. The subsequence itself is found with Hirschberg's divide and conquer, which keeps
     * memory linear in the input size.
     */
    static List<Edit> editScript(List<String> a, List<String> b) {
        Map<String, Integer> ids = new HashMap<>();
        int[] x = intern(a, ids);
        int[] y = intern(b, ids);
        int[] xPositions = positionsShared(x, y, ids.size());
        int[] yPositions = positionsShared(y, x, ids.size());
        int[] xShared = valuesAt(x, xPositions);
        int[] yShared = valuesAt(y, yPositions);

        List<int[]> matches = new ArrayList<>();
        collectMatches(xShared, 0, xShared.length, yShared, 0, yShared.length, matches);

        List<Edit> edits = new ArrayList<>(a.size() + b.size());
        int i = 0;
        int j = 0;
        for (int[] match : matches) {
            int matchedFrom = xPositions[match[0]];
            int matchedTo = yPositions[match[1]];
            while (i < matchedFrom) {
                edits.add(new Edit(Op.DELETE, i++, j));
            }
            while (j < matchedTo) {
                edits.add(new Edit(Op.INSERT, i, j++));
            }
            edits.add(new Edit(Op.EQUAL, i++, j++));
        }
        while (i < a.size()) {
            edits.add(new Edit(Op.DELETE, i++, j));
        }
        while (j < b.size()) {
            edits.add(new Edit(Op.INSERT, i, j++));
        }
        return edits;
    }

    private static void collectMatches(int[] x, int xLo, int xHi, int[] y, int yLo, int yHi, List<int[]> out) {
        while (xLo < xHi && yLo < yHi && x[xLo] == y[yLo]) {
            out.add(new int[]{xLo++, yLo++});
        }
        int xEnd = xHi;
        int yEnd = yHi;
        while (xEnd > xLo && yEnd > yLo && x[xEnd - 1] == y[yEnd - 1]) {
            xEnd--;
            yEnd--;
        }

        if (xLo < xEnd && yLo < yEnd) {
            if (xEnd - xLo == 1) {
                for (int k = yLo; k < yEnd; k++) {
                    if (y[k] == x[xLo]) {
                        out.add(new int[]{xLo, k});
                        break;
                    }
                }
            } else {
                int mid = (xLo + xEnd) >>> 1;
                int[] head = prefixLengths(x, xLo, mid, y, yLo, yEnd);
                int[] tail = suffixLengths(x, mid, xEnd, y, yLo, yEnd);
                int split = 0;
                int best = -1;
                for (int k = 0; k < head.length; k++) {
                    if (head[k] + tail[k] > best) {
                        best = head[k] + tail[k];
                        split = k;
                    }
                }
                collectMatches(x, xLo, mid, y, yLo, yLo + split, out);
                collectMatches(x, mid, xEnd, y, yLo + split, yEnd, out);
            }
        }

        for (int k = 0; k < xHi - xEnd; k++) {
            out.add(new int[]{xEnd + k, yEnd + k});
        }
    }

    // result[k] = LCS length of x[xLo, xHi) and y[yLo, yLo + k)
    private static int[] prefixLengths(int[] x, int xLo, int xHi, int[] y, int yLo, int yHi) {
        int n = yHi - yLo;
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        for (int i = xLo; i < xHi; i++) {
            current[0] = 0;
            for (int k = 1; k <= n; k++) {
                current[k] = x[i] == y[yLo + k - 1]
                        ? previous[k - 1] + 1
                        : Math.max(previous[k], current[k - 1]);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous;
    }

    // result[k] = LCS length of x[xLo, xHi) and y[yLo + k, yHi)
    private static int[] suffixLengths(int[] x, int xLo, int xHi, int[] y, int yLo, int yHi) {
        int n = yHi - yLo;
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        for (int i = xHi - 1; i >= xLo; i--) {
            current[n] = 0;
            for (int k = n - 1; k >= 0; k--) {
                current[k] = x[i] == y[yLo + k]
                        ? previous[k + 1] + 1
                        : Math.max(previous[k], current[k + 1]);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous;
    }

    private static int[] intern(List<String> lines, Map<String, Integer> ids) {
        int[] interned = new int[lines.size()];
        for (int i = 0; i < interned.length; i++) {
            interned[i] = ids.computeIfAbsent(lines.get(i), ignored -> ids.size());
        }
        return interned;
    }

    private static int[] positionsShared(int[] lines, int[] other, int idCount) {
        boolean[] present = new boolean[idCount];
        for (int id : other) {
            present[id] = true;
        }
        int count = 0;
        for (int id : lines) {
            if (present[id]) {
                count++;
            }
        }
        int[] positions = new int[count];
        int next = 0;
        for (int i = 0; i < lines.length; i++) {
            if (present[lines[i]]) {
                positions[next++] = i;
            }
        }
        return positions;
    }

    private static int[] valuesAt(int[] lines, int[] positions) {
        int[] values = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            values[i] = lines[positions[i]];
        }
        return values;
    }

    private String render(String fromHeader, String toHeader, List<String> a, List<String> b, List<Edit> edits) {
        StringBuilder out = new StringBuilder();
        out.append("--- ").append(fromHeader).append('\n');
        out.append("+++ ").append(toHeader).append('\n');

        int k = 0;
        while (k < edits.size()) {
            if (edits.get(k).op() == Op.EQUAL) {
                k++;
                continue;
            }
            int start = Math.max(0, k - contextLines);
            int lastChange = k;
            int p = k + 1;
            while (p < edits.size()) {
                if (edits.get(p).op() != Op.EQUAL) {
                    lastChange = p;
                    p++;
                    continue;
                }
                int q = p;
                while (q < edits.size() && edits.get(q).op() == Op.EQUAL) {
                    q++;
                }
                if (q < edits.size() && q - p <= 2 * contextLines) {
                    lastChange = q;
                    p = q + 1;
                } else {
                    break;
                }
            }
            int stop = Math.min(edits.size(), lastChange + contextLines + 1);
            appendHunk(out, a, b, edits.subList(start, stop));
            k = stop;
        }
        return out.toString();
    }

    private static void appendHunk(StringBuilder out, List<String> a, List<String> b, List<Edit> hunk) {
        int fromCount = 0;
        int toCount = 0;
        for (Edit edit : hunk) {
            if (edit.op() != Op.INSERT) {
                fromCount++;
            }
            if (edit.op() != Op.DELETE) {
                toCount++;
            }
        }
        Edit first = hunk.get(0);
        out.append("@@ -").append(range(first.fromIndex(), fromCount))
                .append(" +").append(range(first.toIndex(), toCount))
                .append(" @@\n");
        for (Edit edit : hunk) {
            switch (edit.op()) {
                case EQUAL -> out.append(' ').append(a.get(edit.fromIndex())).append('\n');
                case DELETE -> out.append('-').append(a.get(edit.fromIndex())).append('\n');
                case INSERT -> out.append('+').append(b.get(edit.toIndex())).append('\n');
            }
        }
    }

    private static String range(int start, int count) {
        if (count == 1) {
            return Integer.toString(start + 1);
        }
        if (count == 0) {
            return start + ",0";
        }
        return (start + 1) + "," + count;
    }

    private static double similarity(int common, int fromSize, int toSize) {
        if (fromSize + toSize == 0) {
            return 1.0;
        }
        return Math.round(2.0 * common / (fromSize + toSize) * 10_000) / 10_000.0;
    }

    enum Op {
        EQUAL,
        DELETE,
        INSERT
    }

    /**
     * One step of the edit script; the indices are the cursor positions in both inputs.
     */
    record Edit(Op op, int fromIndex, int toIndex) {
    }
}
