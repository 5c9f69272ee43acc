package org.broadinstitute.varanno.utils.reference;

import org.broadinstitute.varanno.exceptions.VarAnnoException;

/**
 * Source of reference bases for a named sequence region.
 * Implementations that are shared between annotation workers must be safe for concurrent reads.
 */
public interface SequenceProvider {

    /**
     * Get the forward-strand bases of a region.
     * @param region name of the sequence region (e.g. a chromosome).  Must not be {@code null}.
     * @param start 1-based inclusive start position.
     * @param end 1-based inclusive end position.  Must be {@code >= start}.
     * @return the bases in {@code [start, end]}, never {@code null}.
     * @throws VarAnnoException.SequenceUnavailable if the region is unknown or the span is out of range.
     */
    String fetch(final String region, final int start, final int end);
}
