package com.company.resolution.verify;

import com.company.resolution.config.ConfigurationException;
import com.company.resolution.config.PipelineConfig;
import com.company.resolution.core.model.Candidate;
import com.company.resolution.core.model.Cluster;
import com.company.resolution.core.model.EnrichmentStatus;
import com.company.resolution.core.model.SignalScores;
import com.company.resolution.rules.DefaultNormalizationRules;
import com.company.resolution.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scores website candidates against a company name and selects the best one.
 *
 * <p>Scoring is a pure function of the name, the candidate and the configuration.
 * The highest score wins; ties prefer the shorter host, then the smaller URL.
 * A winner scoring at least the acceptance threshold is {@code VERIFIED}.</p>
 */
public class CandidateVerifier {
    private static final Logger log = LoggerFactory.getLogger(CandidateVerifier.class);

    // absorbs rounding in the weighted sum so the threshold stays inclusive
    private static final double EPSILON = 1e-9;

    static final Comparator<Candidate> SELECTION_ORDER =
            Comparator.comparingDouble(Candidate::score).reversed()
                    .thenComparingInt((Candidate c) -> DomainNames.host(c.url()).length())
                    .thenComparing(Candidate::url);

    private final NormalizationEngine engine;
    private final SignalWeights weights;
    private final double acceptanceThreshold;
    private final Set<String> denylist;

    public CandidateVerifier(PipelineConfig config) {
        this(DefaultNormalizationRules.createEngine(config), config.getSignalWeights(),
                config.getAcceptanceThreshold(), config.getDenylist());
    }

    public CandidateVerifier(NormalizationEngine engine, SignalWeights weights,
                             double acceptanceThreshold, Collection<String> denylist) {
        if (acceptanceThreshold < 0.0 || acceptanceThreshold > 1.0) {
            throw new ConfigurationException("acceptanceThreshold must be between 0.0 and 1.0, got "
                    + acceptanceThreshold);
        }
        this.engine = engine;
        this.weights = weights;
        this.acceptanceThreshold = acceptanceThreshold;
        this.denylist = Set.copyOf(denylist);
    }

    /**
     * Returns the candidate with its score and evidence populated.
     */
    public Candidate score(String representativeName, Candidate candidate) {
        String key = engine.normalize(representativeName);
        List<String> tokens = NormalizationEngine.tokens(key);
        String host = DomainNames.host(candidate.url());

        SignalScores signals = new SignalScores(
                domainTokenMatch(key, tokens, host),
                nameInText(key, tokens, candidate),
                DomainNames.isDenylisted(host, denylist) ? 0.0 : 1.0,
                1.0 / (candidate.searchRank() + 1));
        return candidate.withScore(weights.combine(signals), signals);
    }

    /**
     * Scores all candidates of a cluster and picks the best one.
     */
    public CandidateSelection select(Cluster cluster, Stream<Candidate> candidates) {
        List<Candidate> scored = candidates
                .map(c -> score(cluster.representativeName(), c))
                .sorted(SELECTION_ORDER)
                .collect(Collectors.toList());
        if (scored.isEmpty()) {
            log.debug("verification.no-candidate cluster={}", cluster.clusterId());
            return CandidateSelection.noCandidate(cluster.clusterId());
        }
        Candidate best = scored.get(0);
        EnrichmentStatus status = best.score() + EPSILON >= acceptanceThreshold
                ? EnrichmentStatus.VERIFIED
                : EnrichmentStatus.UNVERIFIED;
        log.debug("verification.completed cluster={} url={} score={} status={} evidence={}",
                cluster.clusterId(), best.url(), best.score(), status, best.evidence());
        return new CandidateSelection(cluster.clusterId(), best, scored, status);
    }

    public CandidateSelection select(Cluster cluster, Collection<Candidate> candidates) {
        return select(cluster, candidates.stream());
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    private static double domainTokenMatch(String key, List<String> tokens, String host) {
        if (tokens.isEmpty() || host.isEmpty()) {
            return 0.0;
        }
        String label = DomainNames.registrableLabel(host).replace("-", "");
        if (key.replace(" ", "").equals(label)) {
            return 1.0;
        }
        List<String> significant = tokens.stream().filter(t -> t.length() > 1).collect(Collectors.toList());
        if (significant.isEmpty()) {
            significant = tokens;
        }
        long matched = significant.stream().filter(label::contains).count();
        return (double) matched / significant.size();
    }

    private double nameInText(String key, List<String> tokens, Candidate candidate) {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        String text = engine.normalize(candidate.title() + " " + candidate.snippet() + " " + candidate.pageText());
        if ((" " + text + " ").contains(" " + key + " ")) {
            return 1.0;
        }
        Set<String> textTokens = new HashSet<>(NormalizationEngine.tokens(text));
        long matched = tokens.stream().filter(textTokens::contains).count();
        return (double) matched / tokens.size();
    }
}
