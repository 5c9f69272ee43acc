package org.broadinstitute.varanno.testutils;

import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.utils.reference.SequenceProvider;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SequenceProvider} over sequences held in memory, counting the number of lookups.
 */
public final class InMemorySequenceProvider implements SequenceProvider {

    private final Map<String, String> sequences = new HashMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    public InMemorySequenceProvider() {}

    public InMemorySequenceProvider(final String region, final String sequence) {
        withRegion(region, sequence);
    }

    public InMemorySequenceProvider withRegion(final String region, final String sequence) {
        sequences.put(Utils.nonNull(region), Utils.nonNull(sequence));
        return this;
    }

    /**
     * A region of {@code length} bases made of {@code fill} apart from the bases given in {@code overrides}
     * (1-based position to base).
     */
    public InMemorySequenceProvider withRegion(final String region, final int length, final char fill, final Map<Integer, Character> overrides) {
        final StringBuilder sb = new StringBuilder(length);
        for ( int i = 1; i <= length; ++i ) {
            sb.append(overrides.getOrDefault(i, fill));
        }
        return withRegion(region, sb.toString());
    }

    @Override
    public String fetch(final String region, final int start, final int end) {
        fetchCount.incrementAndGet();
        final String sequence = sequences.get(region);
        if ( sequence == null || start < 1 || end < start || end > sequence.length() ) {
            throw new VarAnnoException.SequenceUnavailable(region, start, end);
        }
        return sequence.substring(start - 1, end);
    }

    public int getFetchCount() {
        return fetchCount.get();
    }
}
