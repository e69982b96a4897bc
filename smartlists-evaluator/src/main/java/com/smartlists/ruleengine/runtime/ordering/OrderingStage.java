/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.runtime.ordering;

import com.smartlists.ruleengine.api.model.ListLimits;
import com.smartlists.ruleengine.api.model.ResultItem;
import com.smartlists.ruleengine.runtime.evaluation.MatchedItem;
import com.smartlists.ruleengine.runtime.model.ExpressionSet;
import com.smartlists.ruleengine.runtime.model.RuleGroups;
import com.smartlists.ruleengine.runtime.model.SortSpec;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sorts, groups and trims the matches of a run.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li><b>Per-group limits</b> (only when a set has {@code maxItems} or a default
 *       per-group maximum is given): sets are visited in index order, each set's items
 *       are sorted and the first ones not taken by an earlier set are kept, up to the
 *       set's limit. An item is attributed to the set that took it.</li>
 *   <li><b>Merge</b>: items are sorted by the full key tuple. The sort is stable, so
 *       ties keep their previous order. Rule Block Order keys by attributed set; as the
 *       primary key Rule Block Order Interleaved deals the sets out round-robin instead.</li>
 *   <li><b>Global limit</b>, then the <b>playtime cap</b>: runtimes accumulate in order
 *       and the first item that would exceed the cap ends the list.</li>
 * </ol>
 *
 * <p>Missing key values sort last whatever the direction.
 */
public final class OrderingStage {
    private static final Logger logger = LoggerFactory.getLogger(OrderingStage.class);

    private final SortKeyResolver resolver;
    private final Tracer tracer;

    public OrderingStage(SortKeyResolver resolver, Tracer tracer) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    /**
     * @param matches matched items in candidate order
     */
    public List<ResultItem> orderAndLimit(List<MatchedItem> matches, RuleGroups ruleGroups,
                                          SortSpec sortSpec, ListLimits limits) {
        Span span = tracer.spanBuilder("order-and-limit").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("matched", matches.size());

            List<ResultItem> attributed = ruleGroups.anyGroupLimited() || limits.hasPerGroupMax()
                    ? limitPerGroup(matches, ruleGroups, sortSpec, limits)
                    : attributeToFirstGroup(matches, sortSpec);

            List<ResultItem> ordered;
            if (!sortSpec.isEmpty() && sortSpec.keys().get(0).field().isInterleaving()) {
                ordered = interleave(attributed, sortSpec);
            } else {
                ordered = new ArrayList<>(attributed);
                if (!sortSpec.isEmpty()) {
                    ordered.sort(comparator(sortSpec));
                }
            }

            if (limits.hasGlobalMax() && ordered.size() > limits.globalMax()) {
                ordered = new ArrayList<>(ordered.subList(0, limits.globalMax()));
            }
            if (limits.hasPlaytimeCap()) {
                ordered = trimToPlaytime(ordered, limits.playtimeCapMinutes());
            }

            span.setAttribute("returned", ordered.size());
            logger.debug("Ordered {} matches into {} results", matches.size(), ordered.size());
            return ordered;
        } finally {
            span.end();
        }
    }

    private List<ResultItem> attributeToFirstGroup(List<MatchedItem> matches, SortSpec sortSpec) {
        List<ResultItem> items = new ArrayList<>(matches.size());
        for (MatchedItem match : matches) {
            int group = match.firstGroup();
            items.add(new ResultItem(match.item(), resolver.resolve(sortSpec, match.item(), group), group));
        }
        return items;
    }

    private List<ResultItem> limitPerGroup(List<MatchedItem> matches, RuleGroups ruleGroups,
                                           SortSpec sortSpec, ListLimits limits) {
        RoaringBitmap taken = new RoaringBitmap();
        List<ResultItem> selected = new ArrayList<>();
        Comparator<ResultItem> order = comparator(sortSpec);

        for (int g = 0; g < ruleGroups.size(); g++) {
            ExpressionSet set = ruleGroups.get(g);
            int limit = set.hasLimit() ? set.maxItems()
                    : limits.hasPerGroupMax() ? limits.perGroupMax() : Integer.MAX_VALUE;

            List<Candidate> members = new ArrayList<>();
            for (MatchedItem match : matches) {
                if (match.inGroup(g) && !taken.contains(match.ordinal())) {
                    members.add(new Candidate(match.ordinal(),
                            new ResultItem(match.item(), resolver.resolve(sortSpec, match.item(), g), g)));
                }
            }
            if (!sortSpec.isEmpty()) {
                members.sort((x, y) -> order.compare(x.result(), y.result()));
            }

            for (int i = 0; i < members.size() && i < limit; i++) {
                taken.add(members.get(i).ordinal());
                selected.add(members.get(i).result());
            }
        }
        return selected;
    }

    /**
     * Deals the attributed groups out round-robin: one item of each group per round,
     * groups in ascending index order. Descending visits the groups from the highest
     * index and, without further keys, walks each group from its end. Further keys
     * order the items inside each group.
     */
    static List<ResultItem> interleave(List<ResultItem> items, SortSpec sortSpec) {
        boolean descending = sortSpec.keys().get(0).descending();
        boolean ordersWithinGroup = sortSpec.keys().size() > 1;

        List<ResultItem> sorted = new ArrayList<>(items);
        if (ordersWithinGroup) {
            sorted.sort(comparator(sortSpec, 1));
        }
        TreeMap<Integer, List<ResultItem>> byGroup = new TreeMap<>();
        for (ResultItem item : sorted) {
            byGroup.computeIfAbsent(item.groupIndex(), g -> new ArrayList<>()).add(item);
        }
        List<List<ResultItem>> groups = new ArrayList<>(
                descending ? byGroup.descendingMap().values() : byGroup.values());
        if (descending && !ordersWithinGroup) {
            groups.forEach(Collections::reverse);
        }

        List<ResultItem> dealt = new ArrayList<>(items.size());
        for (int round = 0; dealt.size() < items.size(); round++) {
            for (List<ResultItem> group : groups) {
                if (round < group.size()) {
                    dealt.add(group.get(round));
                }
            }
        }
        return dealt;
    }

    private static List<ResultItem> trimToPlaytime(List<ResultItem> items, int capMinutes) {
        List<ResultItem> kept = new ArrayList<>();
        double total = 0;
        for (ResultItem item : items) {
            double runtime = item.runtimeMinutes();
            if (total + runtime > capMinutes) {
                break;
            }
            total += runtime;
            kept.add(item);
        }
        return kept;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // COMPARISON
    // ════════════════════════════════════════════════════════════════════════════════

    static Comparator<ResultItem> comparator(SortSpec sortSpec) {
        return comparator(sortSpec, 0);
    }

    private static Comparator<ResultItem> comparator(SortSpec sortSpec, int firstKey) {
        List<SortSpec.SortKey> keys = sortSpec.keys();
        return (a, b) -> {
            for (int i = firstKey; i < keys.size(); i++) {
                int cmp = compareValues(a.sortKey().get(i), b.sortKey().get(i), keys.get(i).descending());
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object a, Object b, boolean descending) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        int cmp;
        if (a instanceof String && b instanceof String) {
            cmp = NaturalStringComparator.INSTANCE.compare((String) a, (String) b);
        } else {
            cmp = ((Comparable) a).compareTo(b);
        }
        return descending ? -cmp : cmp;
    }

    private record Candidate(int ordinal, ResultItem result) {
    }
}
