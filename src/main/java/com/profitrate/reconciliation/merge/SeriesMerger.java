package com.profitrate.reconciliation.merge;

import com.profitrate.reconciliation.core.model.Observation;
import com.profitrate.reconciliation.core.model.ObservationSet;
import com.profitrate.reconciliation.core.model.ResolutionMethod;
import com.profitrate.reconciliation.core.model.Unit;
import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Combines the normalized observation sets of one variable into a single series.
 *
 * <p>Per year:</p>
 * <ol>
 *   <li>one source with a value: kept as {@code native};</li>
 *   <li>several sources with a value: the first source in the priority list wins
 *       ({@code merged}); if the values differ a {@link MergeConflict} keeps every
 *       rejected alternative and the size of the disagreement;</li>
 *   <li>no source with a value: the year is recorded as missing.</li>
 * </ol>
 *
 * <p>The output depends only on the inputs and the priority list.</p>
 */
public class SeriesMerger {
    private static final Logger log = LoggerFactory.getLogger(SeriesMerger.class);

    /**
     * Merges observation sets that share a variable and unit.
     *
     * @param sets     normalized observation sets, at least one
     * @param priority source ids, highest priority first; must name every contributing source
     * @return the merged series and the conflicts encountered
     * @throws IllegalArgumentException if the sets disagree on variable or unit, or a source
     *                                  is absent from {@code priority}
     */
    public MergeOutcome merge(List<ObservationSet> sets, List<String> priority) {
        if (sets == null || sets.isEmpty()) {
            throw new IllegalArgumentException("At least one observation set is required");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority is required");
        }

        String variableId = sets.get(0).getVariableId();
        Unit unit = sets.get(0).getUnit();
        Map<String, Integer> rank = rankSources(variableId, priority);
        Set<String> seenSources = new HashSet<>();
        for (ObservationSet set : sets) {
            if (!set.getVariableId().equals(variableId)) {
                throw new IllegalArgumentException("Cannot merge variable " + set.getVariableId()
                        + " into " + variableId);
            }
            if (set.getUnit() != unit) {
                throw new IllegalArgumentException("Set " + set.getSourceId() + " is in " + set.getUnit()
                        + " but " + variableId + " is being merged in " + unit + "; normalize first");
            }
            if (!rank.containsKey(set.getSourceId())) {
                throw new IllegalArgumentException("Source '" + set.getSourceId()
                        + "' is not in the priority list for " + variableId + ": " + priority);
            }
            if (!seenSources.add(set.getSourceId())) {
                throw new IllegalArgumentException("Source '" + set.getSourceId()
                        + "' supplied twice for " + variableId);
            }
        }

        List<ObservationSet> ordered = new ArrayList<>(sets);
        ordered.sort(Comparator.comparingInt(s -> rank.get(s.getSourceId())));

        SortedSet<Integer> years = new TreeSet<>();
        ordered.forEach(s -> s.getObservations().forEach(o -> years.add(o.year())));

        try (LogContext ignored = LogContext.forVariable(variableId, "merge")) {
            VariableSeries.Builder builder = VariableSeries.builder(variableId, unit);
            List<MergeConflict> conflicts = new ArrayList<>();

            for (int year : years) {
                List<Observation> candidates = new ArrayList<>();
                for (ObservationSet set : ordered) {
                    set.get(year).filter(Observation::hasValue).ifPresent(candidates::add);
                }

                if (candidates.isEmpty()) {
                    builder.missing(year);
                } else if (candidates.size() == 1) {
                    builder.point(candidates.get(0), ResolutionMethod.NATIVE);
                } else {
                    Observation chosen = candidates.get(0);
                    builder.point(chosen, ResolutionMethod.MERGED);
                    MergeConflict conflict = conflictFor(chosen, candidates.subList(1, candidates.size()), priority);
                    if (conflict != null) {
                        conflicts.add(conflict);
                        log.debug("merge.conflict year={} chosen={} alternatives={} maxDiff={}",
                                year, chosen.sourceId(), conflict.alternatives().size(),
                                conflict.maxAbsoluteDifference());
                    }
                }
            }

            VariableSeries series = builder.build();
            log.info("merge.completed variableId={} sources={} years={} values={} missing={} conflicts={}",
                    variableId, ordered.size(), years.size(), series.size(),
                    series.getMissingYears().size(), conflicts.size());
            return new MergeOutcome(series, conflicts);
        }
    }

    /**
     * Builds the conflict record, or returns null when every alternative agrees exactly.
     */
    private MergeConflict conflictFor(Observation chosen, List<Observation> others, List<String> priority) {
        List<MergeConflict.RejectedAlternative> alternatives = new ArrayList<>();
        boolean disagreement = false;
        for (Observation other : others) {
            double diff = Math.abs(other.value() - chosen.value());
            double relative = chosen.value() == 0.0 ? Double.NaN : diff / Math.abs(chosen.value());
            alternatives.add(new MergeConflict.RejectedAlternative(other.sourceId(), other.value(), diff, relative));
            if (diff != 0.0) {
                disagreement = true;
            }
        }
        if (!disagreement) {
            return null;
        }
        String rationale = "source '" + chosen.sourceId() + "' ranks first in priority " + priority
                + "; rejected " + alternatives.stream().map(MergeConflict.RejectedAlternative::sourceId).toList();
        return new MergeConflict(chosen.variableId(), chosen.year(), chosen.sourceId(), chosen.value(),
                alternatives, rationale);
    }

    private Map<String, Integer> rankSources(String variableId, List<String> priority) {
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < priority.size(); i++) {
            if (rank.putIfAbsent(priority.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate source '" + priority.get(i)
                        + "' in priority list for " + variableId);
            }
        }
        return rank;
    }
}
