package io.github.clickin.batch.engine;

import io.github.clickin.batch.core.BatchProtocol;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;

/**
 * Allocates delimiter tokens of the form {@code <prefix>_<uuid>}.
 *
 * <p>Every call draws a fresh random UUID, so the batch boundary and the boundaries of all its
 * changesets are distinct. The random source is the only shared mutable state.
 */
public final class BoundaryAllocator {
    private final Random random;

    public BoundaryAllocator() {
        this(new SecureRandom());
    }

    /**
     * @param random source of the random part, injectable for reproducible output
     */
    public BoundaryAllocator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String batchBoundary(boolean response) {
        return (response ? BatchProtocol.BATCH_RESPONSE_BOUNDARY_PREFIX : BatchProtocol.BATCH_BOUNDARY_PREFIX) + randomId();
    }

    public String changesetBoundary(boolean response) {
        return (response ? BatchProtocol.CHANGESET_RESPONSE_BOUNDARY_PREFIX : BatchProtocol.CHANGESET_BOUNDARY_PREFIX) + randomId();
    }

    /**
     * A bare random id, used where an operation needs an identifier it was not given.
     */
    public String operationId() {
        return randomId();
    }

    private String randomId() {
        long msb = random.nextLong();
        long lsb = random.nextLong();
        // version 4, IETF variant
        msb = (msb & ~0xF000L) | 0x4000L;
        lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb).toString();
    }
}
