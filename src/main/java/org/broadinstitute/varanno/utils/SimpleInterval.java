package org.broadinstitute.varanno.utils;

import htsjdk.samtools.util.Locatable;

import java.io.Serializable;

/**
 * Minimal immutable class representing a 1-based closed ended genomic interval.
 * SimpleInterval does not allow null contig names.
 */
public final class SimpleInterval implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;
    public static final char CONTIG_SEPARATOR = ':';
    public static final char START_END_SEPARATOR = '-';

    private final int start;
    private final int end;
    private final String contig;

    /**
     * Create a new immutable 1-based interval of the form [start, end]
     * @param contig the name of the contig, must not be null
     * @param start  1-based inclusive start position
     * @param end  1-based inclusive end position
     */
    public SimpleInterval(final String contig, final int start, final int end){
        validatePositions(contig, start, end);
        this.contig = contig;
        this.start = start;
        this.end = end;
    }

    /**
     * Create a new SimpleInterval from a {@link Locatable}
     * @param locatable any Locatable
     * @throws IllegalArgumentException if locatable violates any of the SimpleInterval constraints or is null
     */
    public SimpleInterval(final Locatable locatable){
        this(Utils.nonNull(locatable).getContig(), locatable.getStart(), locatable.getEnd());
    }

    static void validatePositions(final String contig, final int start, final int end) {
        Utils.validateArg(isValid(contig, start, end), () -> "Invalid interval. Contig:" + contig + " start:" + start + " end:" + end);
    }

    /**
     * Test that these are valid values for constructing a SimpleInterval:
     *    contig cannot be null
     *    start must be >= 1
     *    end must be >= start
     */
    public static boolean isValid(final String contig, final int start, final int end) {
        return contig != null && start > 0 && end >= start;
    }

    @Override
    public String getContig(){
        return contig;
    }

    @Override
    public int getStart(){
        return start;
    }

    @Override
    public int getEnd(){
        return end;
    }

    /**
     * @return number of bases covered by this interval (will always be > 0)
     */
    public int size() {
        return end - start + 1;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final SimpleInterval that = (SimpleInterval) o;
        return end == that.end && start == that.start && contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + end;
        result = 31 * result + contig.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return contig + CONTIG_SEPARATOR + start + START_END_SEPARATOR + end;
    }
}
