package com.lawgraph.service.scoring;

import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.Span;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes overlapping citations of one text unit.
 *
 * <p>Citations sharing a group id (the siblings of one expanded range) are
 * treated as a single unit. Units are taken longest first, ties going to the
 * stronger resolution method and then to the earlier start; a unit is kept
 * unless it overlaps one already kept. A unit that only overlapped a dropped
 * unit therefore survives. The result is ordered by span start, stable for
 * equal starts.
 */
@Slf4j
@Service
public class CitationDeduplicator {

    private static final Comparator<Unit> PREFERENCE = Comparator
            .comparingInt((Unit u) -> u.span().length()).reversed()
            .thenComparing(Comparator.comparingInt((Unit u) -> u.precedence()).reversed())
            .thenComparingInt(u -> u.span().start());

    private record Unit(Span span, int precedence, List<Citation> members) {
    }

    public List<Citation> deduplicate(List<Citation> citations) {
        if (citations.size() < 2) {
            return citations;
        }

        List<Unit> units = group(citations);
        units.sort(PREFERENCE);

        List<Unit> kept = new ArrayList<>();
        for (Unit unit : units) {
            if (kept.stream().noneMatch(k -> k.span().overlaps(unit.span()))) {
                kept.add(unit);
            }
        }

        List<Citation> result = new ArrayList<>();
        for (Unit unit : kept) {
            result.addAll(unit.members());
        }
        // List.sort is stable
        result.sort(Comparator.comparingInt(c -> c.getSpan().start()));

        if (result.size() != citations.size()) {
            log.debug("Deduplicated {} citations down to {}", citations.size(), result.size());
        }
        return result;
    }

    private List<Unit> group(List<Citation> citations) {
        Map<Integer, List<Citation>> byGroup = new LinkedHashMap<>();
        for (Citation citation : citations) {
            byGroup.computeIfAbsent(citation.getGroupId(), g -> new ArrayList<>()).add(citation);
        }
        List<Unit> units = new ArrayList<>();
        for (List<Citation> members : byGroup.values()) {
            Citation first = members.get(0);
            int precedence = members.stream().mapToInt(c -> c.getMethod().precedence()).max().orElse(0);
            units.add(new Unit(first.getSpan(), precedence, members));
        }
        return units;
    }
}
