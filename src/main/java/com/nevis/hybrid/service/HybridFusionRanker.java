package com.nevis.hybrid.service;

import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.ScoredDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted-sum fusion of a lexical and a vector ranking.
 *
 * <p>Every document returned by either ranking takes part; a document missing from one ranking
 * gets {@code 0} for that component. {@code fused = textWeight * textRank + vectorWeight * similarity},
 * sorted best first with ties in insertion order, truncated to {@code limit}.
 */
@Component
public class HybridFusionRanker {

    public record FusedHit(Document document, long sequence, double textRank, double vectorRank, double fusedScore) {}

    private static final Comparator<FusedHit> BEST_FIRST = Comparator
        .comparingDouble(FusedHit::fusedScore).reversed()
        .thenComparingLong(FusedHit::sequence);

    private static final class Candidate {
        private final Document document;
        private final long sequence;
        private double textRank;
        private double vectorRank;

        private Candidate(ScoredDocument hit) {
            this.document = hit.document();
            this.sequence = hit.sequence();
        }
    }

    public List<FusedHit> fuse(
        List<ScoredDocument> textHits,
        List<ScoredDocument> vectorHits,
        double textWeight,
        double vectorWeight,
        int limit
    ) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (ScoredDocument hit : textHits) {
            candidates.computeIfAbsent(hit.id(), id -> new Candidate(hit)).textRank = hit.score();
        }
        for (ScoredDocument hit : vectorHits) {
            candidates.computeIfAbsent(hit.id(), id -> new Candidate(hit)).vectorRank = hit.score();
        }

        List<FusedHit> fused = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates.values()) {
            double score = textWeight * candidate.textRank + vectorWeight * candidate.vectorRank;
            fused.add(new FusedHit(candidate.document, candidate.sequence, candidate.textRank, candidate.vectorRank, score));
        }
        fused.sort(BEST_FIRST);
        return fused.size() > limit ? List.copyOf(fused.subList(0, limit)) : fused;
    }
}
