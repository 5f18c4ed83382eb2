package com.gapfill.backfill;

import com.gapfill.config.FetcherProperties;
import com.gapfill.error.ConfigurationException;
import com.gapfill.error.FetchException;
import com.gapfill.error.TransientStoreException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains {@link GapRegistry} on a fixed delay. Each cycle claims at most
 * {@code concurrencyCeiling} symbols, runs one backfill task per claim on the worker pool
 * and waits for all of them before returning, so the next cycle starts only after the
 * previous one has joined.
 */
@Component
public class BackfillScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackfillScheduler.class);

    private final GapRegistry registry;
    private final RangeResolver rangeResolver;
    private final BarBackfiller backfiller;
    private final Executor executor;
    private final int concurrencyCeiling;
    private final int maxRequeueAttempts;
    private volatile boolean stopping;

    @Autowired
    public BackfillScheduler(
            GapRegistry registry,
            RangeResolver rangeResolver,
            BarBackfiller backfiller,
            @Qualifier("backfillTaskExecutor") Executor executor,
            FetcherProperties properties
    ) {
        this(registry,
                rangeResolver,
                backfiller,
                executor,
                properties.getBackfill().resolveConcurrencyCeiling(Runtime.getRuntime().availableProcessors()),
                properties.getBackfill().getMaxRequeueAttempts());
    }

    public BackfillScheduler(
            GapRegistry registry,
            RangeResolver rangeResolver,
            BarBackfiller backfiller,
            Executor executor,
            int concurrencyCeiling,
            int maxRequeueAttempts
    ) {
        if (concurrencyCeiling < 1) {
            throw new IllegalArgumentException("concurrencyCeiling must be positive: " + concurrencyCeiling);
        }
        this.registry = registry;
        this.rangeResolver = rangeResolver;
        this.backfiller = backfiller;
        this.executor = executor;
        this.concurrencyCeiling = concurrencyCeiling;
        this.maxRequeueAttempts = maxRequeueAttempts;
    }

    @Scheduled(fixedDelayString = "${gapfill.backfill.interval-ms:30000}",
            initialDelayString = "${gapfill.backfill.interval-ms:30000}")
    public void drain() {
        CycleReport report = runCycle();
        if (report.getClaimed() > 0) {
            log.info("BACKFILL_CYCLE_DONE claimed={} backfilled={} noGap={} failed={} stillPending={}",
                    report.getClaimed(),
                    report.getBackfilled(),
                    report.getNoGap(),
                    report.getFailed(),
                    registry.pendingCount());
        }
    }

    /**
     * One claim, fan-out and join pass. Never throws for per-symbol failures.
     */
    public CycleReport runCycle() {
        if (stopping) {
            return new CycleReport();
        }
        List<GapClaim> claims = registry.claimAll(concurrencyCeiling);
        CycleReport report = new CycleReport();
        if (claims.isEmpty()) {
            return report;
        }
        log.debug("BACKFILL_CYCLE_START claimed={} ceiling={}", claims.size(), concurrencyCeiling);
        List<CompletableFuture<Outcome>> tasks = new ArrayList<>(claims.size());
        for (GapClaim claim : claims) {
            try {
                tasks.add(CompletableFuture.supplyAsync(() -> runTask(claim), executor));
            } catch (RejectedExecutionException ex) {
                log.warn("BACKFILL_REJECTED symbol={}", claim.getSymbol(), ex);
                registry.release(claim.getSymbol());
                tasks.add(CompletableFuture.completedFuture(Outcome.FAILED));
            }
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        for (CompletableFuture<Outcome> task : tasks) {
            report.record(task.join());
        }
        return report;
    }

    public int getConcurrencyCeiling() {
        return concurrencyCeiling;
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        stopping = true;
        log.info("BACKFILL_STOPPING pending={}", registry.pendingCount());
    }

    private Outcome runTask(GapClaim claim) {
        String symbol = claim.getSymbol();
        try {
            Optional<ResolvedRange> range = rangeResolver.resolve(symbol, claim.getLastKnownTimestamp());
            if (range.isEmpty()) {
                registry.complete(symbol);
                log.info("BACKFILL_NO_GAP symbol={} lastKnown={}", symbol, claim.getLastKnownTimestamp());
                return Outcome.NO_GAP;
            }
            ResolvedRange resolved = range.get();
            int written = backfiller.backfill(symbol, resolved.getFrom(), resolved.getTo());
            registry.complete(symbol);
            log.info("BACKFILL_DONE range={} written={}", resolved, written);
            return Outcome.BACKFILLED;
        } catch (ConfigurationException ex) {
            log.error("BACKFILL_CONFIG_FAIL symbol={} reason={}", symbol, ex.getMessage(), ex);
            registry.release(symbol);
            return Outcome.FAILED;
        } catch (TransientStoreException ex) {
            log.error("BACKFILL_STORE_FAIL symbol={} reason={}", symbol, ex.getMessage(), ex);
            afterRetryableFailure(claim);
            return Outcome.FAILED;
        } catch (FetchException ex) {
            log.error("BACKFILL_FETCH_FAIL symbol={} reason={}", symbol, ex.getMessage(), ex);
            afterRetryableFailure(claim);
            return Outcome.FAILED;
        } catch (RuntimeException ex) {
            log.error("BACKFILL_FAIL symbol={}", symbol, ex);
            afterRetryableFailure(claim);
            return Outcome.FAILED;
        }
    }

    private void afterRetryableFailure(GapClaim claim) {
        if (maxRequeueAttempts <= 0) {
            registry.release(claim.getSymbol());
            return;
        }
        if (registry.requeue(claim, maxRequeueAttempts)) {
            log.warn("BACKFILL_REQUEUED symbol={} lastKnown={}", claim.getSymbol(), claim.getLastKnownTimestamp());
        } else if (registry.marker(claim.getSymbol()).map(GapMarker::isPending).orElse(false)) {
            log.info("BACKFILL_SUPERSEDED symbol={} lastKnown={}", claim.getSymbol(), claim.getLastKnownTimestamp());
        } else {
            log.warn("BACKFILL_GIVE_UP symbol={} attempts={}", claim.getSymbol(), maxRequeueAttempts);
        }
    }

    enum Outcome {
        BACKFILLED,
        NO_GAP,
        FAILED
    }

    public static final class CycleReport {
        private int claimed;
        private int backfilled;
        private int noGap;
        private int failed;

        private void record(Outcome outcome) {
            claimed++;
            switch (outcome) {
                case BACKFILLED:
                    backfilled++;
                    break;
                case NO_GAP:
                    noGap++;
                    break;
                default:
                    failed++;
                    break;
            }
        }

        public int getClaimed() {
            return claimed;
        }

        public int getBackfilled() {
            return backfilled;
        }

        public int getNoGap() {
            return noGap;
        }

        public int getFailed() {
            return failed;
        }
    }
}
