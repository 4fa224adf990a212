package net.bookharvest.application.dedup;

import lombok.extern.slf4j.Slf4j;
import net.bookharvest.domain.backfill.CandidateBook;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Clusters near-duplicate candidates and filters out books already present in the corpus.
 */
@Slf4j
@Component
public class DeduplicationEngine {

    private final CorpusLookup corpus;
    private final Executor executor;
    private final double threshold;

    @Autowired
    public DeduplicationEngine(CorpusLookup corpus,
                               @Qualifier("providerExecutor") Executor executor,
                               @Value("${app.dedup.similarity-threshold:0.6}") double threshold) {
        this.corpus = corpus;
        this.executor = executor;
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * Greedy clustering: each candidate joins the first cluster whose members it matches at or above the
     * threshold. Returns one representative per cluster (highest confidence, ties keep the first seen),
     * in first-seen order.
     */
    public List<CandidateBook> cluster(List<CandidateBook> candidates) {
        List<List<CandidateBook>> clusters = new ArrayList<>();
        for (CandidateBook candidate : candidates) {
            List<CandidateBook> home = null;
            for (List<CandidateBook> cluster : clusters) {
                if (matchesAny(candidate, cluster)) {
                    home = cluster;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                clusters.add(home);
            }
            home.add(candidate);
        }

        List<CandidateBook> representatives = new ArrayList<>(clusters.size());
        for (List<CandidateBook> cluster : clusters) {
            CandidateBook best = cluster.get(0);
            for (CandidateBook member : cluster) {
                if (member.confidence() > best.confidence()) {
                    best = member;
                }
            }
            representatives.add(best);
        }
        if (representatives.size() < candidates.size()) {
            log.info("[DEDUP] Clustered {} candidates into {} unique books", candidates.size(), representatives.size());
        }
        return representatives;
    }

    public boolean isDuplicate(CandidateBook left, CandidateBook right) {
        return StringSimilarity.bookSimilarity(left.title(), left.author(), right.title(), right.author()) >= threshold;
    }

    /**
     * Drops candidates already in the corpus, checking exact ISBN first and then fuzzy title/author.
     * Lookups run concurrently; a failed lookup keeps the candidate.
     */
    public CorpusFilterResult filterAgainstCorpus(List<CandidateBook> candidates) {
        List<CompletableFuture<CorpusMatch>> lookups = candidates.stream()
            .map(candidate -> CompletableFuture.supplyAsync(() -> lookup(candidate), executor)
                .exceptionally(failure -> {
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause() : failure;
                    log.warn("[DEDUP] Corpus lookup failed for '{}'; keeping candidate: {}",
                        candidate.title(), cause.getMessage());
                    return CorpusMatch.NONE;
                }))
            .toList();

        List<CandidateBook> fresh = new ArrayList<>();
        int exact = 0;
        int fuzzy = 0;
        for (int i = 0; i < candidates.size(); i++) {
            CorpusMatch match = lookups.get(i).join();
            switch (match) {
                case EXACT -> exact++;
                case FUZZY -> fuzzy++;
                case NONE -> fresh.add(candidates.get(i));
            }
        }
        log.info("[DEDUP] Corpus filter kept {}/{} candidates (exact={}, fuzzy={})",
            fresh.size(), candidates.size(), exact, fuzzy);
        return new CorpusFilterResult(fresh, exact, fuzzy);
    }

    private CorpusMatch lookup(CandidateBook candidate) {
        if (candidate.hasIsbn() && corpus.existsByIsbn(candidate.isbn())) {
            return CorpusMatch.EXACT;
        }
        if (corpus.existsSimilar(candidate.title(), candidate.author(), threshold)) {
            return CorpusMatch.FUZZY;
        }
        return CorpusMatch.NONE;
    }

    private boolean matchesAny(CandidateBook candidate, List<CandidateBook> cluster) {
        for (CandidateBook member : cluster) {
            if (isDuplicate(candidate, member)) {
                return true;
            }
        }
        return false;
    }

    private enum CorpusMatch {
        EXACT,
        FUZZY,
        NONE
    }

    /**
     * @param candidates  candidates not already stored
     * @param exactMatches dropped by ISBN
     * @param fuzzyMatches dropped by title/author similarity
     */
    public record CorpusFilterResult(List<CandidateBook> candidates, int exactMatches, int fuzzyMatches) {
    }
}
