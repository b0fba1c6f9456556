/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.enumeration.PairSign;
import com.ammann.trend.enumeration.SensSlopeMethod;
import com.ammann.trend.model.ComparisonPolicy;
import com.ammann.trend.model.MannKendallStatistic;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.PairResult;
import com.ammann.trend.model.SlopePool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Mann-Kendall score, tie-corrected variance, Z, p and Kendall's tau-b.
 *
 * <p>The pair scan is O(n^2). Series with at least {@code trend.pair-scan.parallel-threshold}
 * observations are split into row blocks that run on the pair-scan executor; the partial
 * sums and slope pools are merged afterwards, so the outcome does not depend on the order
 * in which blocks finish.
 *
 * <p>Variance uses the Kendall tau-b tie correction. The value tie groups are
 * <ul>
 *   <li>equal uncensored values (equal shadow values under substitution),</li>
 *   <li>observations censored with the same kind and limit,</li>
 *   <li>each remaining ambiguous pair, as a group of two.</li>
 * </ul>
 * Equal timestamps form the tie groups of the time axis.
 */
@ApplicationScoped
public class MannKendallService
{
    private static final Logger LOG = Logger.getLogger(MannKendallService.class);

    static final double VARIANCE_EPSILON = 1e-10;
    static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    @ConfigProperty(name = "trend.pair-scan.parallel-threshold", defaultValue = "2000")
    int parallelThreshold = 2000;

    @ConfigProperty(name = "trend.pair-scan.chunk-rows", defaultValue = "128")
    int chunkRows = 128;

    private final ComparisonOracle oracle;
    private final Executor executor;

    @Inject
    public MannKendallService(ComparisonOracle oracle, @Named("pair-scan-executor") ManagedExecutor executor)
    {
        this.oracle = oracle;
        this.executor = executor;
    }

    /**
     * Sequential service, used where no executor is available.
     */
    public MannKendallService(ComparisonOracle oracle)
    {
        this.oracle = oracle;
        this.executor = null;
    }

    /**
     * Sums of one pass over every pair of a series.
     *
     * @param s                   sum of signs over distinct-time pairs
     * @param ambiguousPairs      distinct-time pairs the oracle could not order
     * @param leftAmbiguousPairs  ambiguous pairs touching a left-censored value
     * @param rightAmbiguousPairs ambiguous pairs touching a right-censored value
     * @param pseudoTiePairs      ambiguous pairs that are not already in a shared censor level
     * @param tiedTimePairs       pairs with equal timestamps
     * @param pool                slope pool, {@code null} when slopes were not collected
     */
    public record PairScan(
            long s,
            long ambiguousPairs,
            long leftAmbiguousPairs,
            long rightAmbiguousPairs,
            long pseudoTiePairs,
            long tiedTimePairs,
            SlopePool pool
    ) {}

    /**
     * Scans every pair of a time-sorted series.
     *
     * @param series       time-sorted observations
     * @param policy       resolved comparison policy
     * @param slopeMethod  treatment of ambiguous slopes, or {@code null} to skip slope collection
     * @return partial sums and, if requested, the slope pool
     */
    public PairScan scan(List<Observation> series, ComparisonPolicy policy, SensSlopeMethod slopeMethod)
    {
        int n = series.size();
        if (executor == null || n < parallelThreshold || chunkRows < 1) {
            return scanRows(series, policy, slopeMethod, 0, n);
        }

        List<CompletableFuture<PairScan>> futures = new ArrayList<>();
        for (int start = 0; start < n; start += chunkRows) {
            int from = start;
            int to = Math.min(n, start + chunkRows);
            futures.add(CompletableFuture.supplyAsync(
                    () -> scanRows(series, policy, slopeMethod, from, to), executor));
        }
        LOG.debugf("Pair scan of %d observations split into %d blocks", n, futures.size());

        List<PairScan> parts = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<PairScan> future : futures) {
                parts.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
        return merge(parts, slopeMethod != null);
    }

    private PairScan scanRows(List<Observation> series, ComparisonPolicy policy,
                              SensSlopeMethod slopeMethod, int fromRow, int toRow)
    {
        int n = series.size();
        long s = 0;
        long ambiguous = 0;
        long leftAmbiguous = 0;
        long rightAmbiguous = 0;
        long pseudoTies = 0;
        long tiedTimes = 0;
        SlopePool.Builder pool = slopeMethod == null ? null : SlopePool.builder();

        for (int i = fromRow; i < toRow; i++) {
            Observation a = series.get(i);
            for (int j = i + 1; j < n; j++) {
                Observation b = series.get(j);
                if (a.time() == b.time()) {
                    tiedTimes++;
                    continue;
                }
                PairResult pair = oracle.evaluate(i, j, a, b, policy);
                if (pair.sign() == PairSign.AMBIGUOUS) {
                    ambiguous++;
                    if (pair.leftInvolved()) leftAmbiguous++;
                    if (pair.rightInvolved()) rightAmbiguous++;
                    if (!a.sameCensorLevel(b)) pseudoTies++;
                } else {
                    s += pair.sign().contribution();
                }
                if (pool != null) {
                    pool.addPair(pair, slopeMethod);
                }
            }
        }
        return new PairScan(s, ambiguous, leftAmbiguous, rightAmbiguous, pseudoTies, tiedTimes,
                pool == null ? null : pool.build());
    }

    private static PairScan merge(List<PairScan> parts, boolean withPool)
    {
        long s = 0, ambiguous = 0, left = 0, right = 0, pseudo = 0, tied = 0;
        List<SlopePool> pools = new ArrayList<>(parts.size());
        for (PairScan part : parts) {
            s += part.s();
            ambiguous += part.ambiguousPairs();
            left += part.leftAmbiguousPairs();
            right += part.rightAmbiguousPairs();
            pseudo += part.pseudoTiePairs();
            tied += part.tiedTimePairs();
            if (part.pool() != null) {
                pools.add(part.pool());
            }
        }
        return new PairScan(s, ambiguous, left, right, pseudo, tied, withPool ? SlopePool.union(pools) : null);
    }

    /**
     * Computes the statistic of one group.
     *
     * @param series time-sorted observations
     * @param policy resolved comparison policy
     */
    public MannKendallStatistic compute(List<Observation> series, ComparisonPolicy policy)
    {
        return compute(series, policy, scan(series, policy, null));
    }

    /**
     * Computes the statistic of one group from an existing pair scan.
     */
    public MannKendallStatistic compute(List<Observation> series, ComparisonPolicy policy, PairScan scan)
    {
        int n = series.size();
        List<String> notes = new ArrayList<>();

        TieSums valueTies = valueTieSums(series, policy, scan.pseudoTiePairs());
        TieSums timeTies = timeTieSums(series);

        double nn = n;
        double varS = (nn * (nn - 1) * (2 * nn + 5) - valueTies.variance() - timeTies.variance()) / 18.0;
        if (n > 2) {
            varS += valueTies.cubic() * timeTies.cubic() / (9.0 * nn * (nn - 1) * (nn - 2));
        }
        if (n > 1) {
            varS += valueTies.pairs() * timeTies.pairs() / (2.0 * nn * (nn - 1));
        }

        long s = scan.s();
        double z;
        double p;
        if (!(varS > VARIANCE_EPSILON)) {
            notes.add(MannKendallStatistic.NOTE_ZERO_VARIANCE);
            z = 0.0;
            p = 1.0;
        } else {
            z = zScore(s, varS);
            p = twoSidedP(z);
        }

        double n0 = nn * (nn - 1) / 2.0;
        double n1 = valueTies.pairs() / 2.0;
        double n2 = timeTies.pairs() / 2.0;
        double product = (n0 - n1) * (n0 - n2);
        double tau;
        double denominator;
        if (!(product > VARIANCE_EPSILON) || (n0 - n1) < 0) {
            notes.add(MannKendallStatistic.NOTE_TAU_DENOMINATOR);
            tau = 0.0;
            denominator = 0.0;
        } else {
            denominator = Math.sqrt(product);
            tau = s / denominator;
        }

        LOG.debugf("Mann-Kendall n=%d S=%d varS=%.4f Z=%.4f p=%.6f tau=%.4f ambiguous=%d",
                n, s, varS, z, p, tau, scan.ambiguousPairs());

        return new MannKendallStatistic(s, varS, z, p, tau, denominator,
                scan.ambiguousPairs(), scan.leftAmbiguousPairs(), scan.rightAmbiguousPairs(),
                scan.tiedTimePairs(), n, notes);
    }

    /**
     * Pools per-season statistics: S and varS are summed, tau is the ratio of the summed
     * scores to the summed tau denominators.
     */
    public MannKendallStatistic pool(List<MannKendallStatistic> seasons)
    {
        long s = 0;
        double varS = 0.0;
        double denominator = 0.0;
        long ambiguous = 0, left = 0, right = 0, tied = 0;
        int n = 0;
        for (MannKendallStatistic season : seasons) {
            s += season.s();
            varS += season.varS();
            denominator += season.tauDenominator();
            ambiguous += season.ambiguousPairs();
            left += season.leftAmbiguousPairs();
            right += season.rightAmbiguousPairs();
            tied += season.tiedTimePairs();
            n += season.n();
        }

        List<String> notes = new ArrayList<>();
        double z;
        double p;
        if (!(varS > VARIANCE_EPSILON)) {
            notes.add(MannKendallStatistic.NOTE_ZERO_VARIANCE);
            z = 0.0;
            p = 1.0;
        } else {
            z = zScore(s, varS);
            p = twoSidedP(z);
        }

        double tau;
        if (!(denominator > VARIANCE_EPSILON)) {
            notes.add(MannKendallStatistic.NOTE_TAU_DENOMINATOR);
            tau = 0.0;
        } else {
            tau = s / denominator;
        }
        return new MannKendallStatistic(s, varS, z, p, tau, denominator, ambiguous, left, right, tied, n, notes);
    }

    static double zScore(long s, double varS)
    {
        if (s == 0) {
            return 0.0;
        }
        return (s - Math.signum((double) s)) / Math.sqrt(varS);
    }

    static double twoSidedP(double z)
    {
        return Math.min(1.0, 2.0 * STANDARD_NORMAL.cumulativeProbability(-Math.abs(z)));
    }

    /** Sums of t(t-1)(2t+5), t(t-1)(t-2) and t(t-1) over the tie groups of one axis. */
    record TieSums(double variance, double cubic, double pairs)
    {
        static TieSums of(Iterable<Integer> groupSizes, long extraPairGroups)
        {
            double variance = 0.0, cubic = 0.0, pairs = 0.0;
            for (int size : groupSizes) {
                if (size < 2) {
                    continue;
                }
                double t = size;
                variance += t * (t - 1) * (2 * t + 5);
                cubic += t * (t - 1) * (t - 2);
                pairs += t * (t - 1);
            }
            // a group of two adds 2*1*9 to the variance sum and 2*1 to the pair sum
            variance += 18.0 * extraPairGroups;
            pairs += 2.0 * extraPairGroups;
            return new TieSums(variance, cubic, pairs);
        }
    }

    private static TieSums valueTieSums(List<Observation> series, ComparisonPolicy policy, long pseudoTiePairs)
    {
        Map<Object, Integer> groups = new HashMap<>();
        for (Observation o : series) {
            Object key;
            if (policy.isSubstitution()) {
                key = policy.rankValue(o) + 0.0;
            } else if (o.isCensored()) {
                key = o.censorKind().name() + ":" + (o.detectionLimit() + 0.0);
            } else {
                key = o.value() + 0.0;
            }
            groups.merge(key, 1, Integer::sum);
        }
        return TieSums.of(groups.values(), policy.isSubstitution() ? 0 : pseudoTiePairs);
    }

    private static TieSums timeTieSums(List<Observation> series)
    {
        Map<Double, Integer> groups = new HashMap<>();
        for (Observation o : series) {
            groups.merge(o.time() + 0.0, 1, Integer::sum);
        }
        return TieSums.of(groups.values(), 0);
    }
}
