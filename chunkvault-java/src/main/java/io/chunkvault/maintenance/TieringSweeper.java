package io.chunkvault.maintenance;

import io.chunkvault.index.ChunkMeta;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reclassifies chunk tiers by access recency.
 *
 * <p>Only the tier field of the index changes. Reads and writes never depend on
 * the tier, so a sweep can run at any time alongside ingestion.</p>
 */
public class TieringSweeper {

    private static final Logger logger = LoggerFactory.getLogger(TieringSweeper.class);

    private final MetadataIndex index;
    private final Duration warmAfter;
    private final Duration coldAfter;
    private final Clock clock;

    public TieringSweeper(MetadataIndex index, Duration warmAfter, Duration coldAfter, Clock clock) {
        if (coldAfter.compareTo(warmAfter) < 0) {
            throw new IllegalArgumentException("coldAfter (" + coldAfter + ") must not be shorter than warmAfter (" + warmAfter + ")");
        }
        this.index = index;
        this.warmAfter = warmAfter;
        this.coldAfter = coldAfter;
        this.clock = clock;
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        int examined = 0;
        int demoted = 0;
        int promoted = 0;
        for (ChunkMeta chunk : index.listChunks()) {
            examined++;
            Tier target = classify(chunk, now);
            if (target == chunk.tier()) {
                continue;
            }
            if (!index.updateTier(chunk.digest(), target)) {
                continue;
            }
            if (target.ordinal() > chunk.tier().ordinal()) {
                demoted++;
            } else {
                promoted++;
            }
        }
        if (demoted > 0 || promoted > 0) {
            logger.info("Tiering sweep over {} chunks: {} demoted, {} promoted", examined, demoted, promoted);
        }
        return new SweepResult(examined, demoted, promoted);
    }

    Tier classify(ChunkMeta chunk, Instant now) {
        Duration idle = Duration.between(chunk.lastAccessedAt(), now);
        if (idle.compareTo(coldAfter) >= 0) {
            return Tier.COLD;
        }
        if (idle.compareTo(warmAfter) >= 0) {
            return Tier.WARM;
        }
        return Tier.HOT;
    }

    public record SweepResult(int examined, int demoted, int promoted) {}
}
