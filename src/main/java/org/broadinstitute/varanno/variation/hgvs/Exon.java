package org.broadinstitute.varanno.variation.hgvs;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.varanno.utils.SimpleInterval;
import org.broadinstitute.varanno.utils.Utils;

/**
 * An exon of a transcript: its genomic interval and the cDNA positions of its first and last transcribed bases.
 * On the negative strand {@link #getCdnaStart()} corresponds to the genomic end of the exon.
 */
public final class Exon implements Locatable {

    private final SimpleInterval interval;
    private final int cdnaStart;
    private final int cdnaEnd;

    public Exon(final Locatable interval, final int cdnaStart, final int cdnaEnd) {
        this.interval = new SimpleInterval(Utils.nonNull(interval, "interval"));
        Utils.validateArg(cdnaStart > 0, () -> "cdnaStart must be positive but was " + cdnaStart);
        Utils.validateArg(cdnaEnd - cdnaStart + 1 == this.interval.size(),
                () -> "cDNA span " + cdnaStart + "-" + cdnaEnd + " does not match the length of exon " + this.interval);
        this.cdnaStart = cdnaStart;
        this.cdnaEnd = cdnaEnd;
    }

    @Override
    public String getContig() {
        return interval.getContig();
    }

    @Override
    public int getStart() {
        return interval.getStart();
    }

    @Override
    public int getEnd() {
        return interval.getEnd();
    }

    public SimpleInterval getInterval() {
        return interval;
    }

    public int getCdnaStart() {
        return cdnaStart;
    }

    public int getCdnaEnd() {
        return cdnaEnd;
    }

    @Override
    public boolean equals(final Object o) {
        if ( this == o ) {
            return true;
        }
        if ( o == null || getClass() != o.getClass() ) {
            return false;
        }
        final Exon exon = (Exon) o;
        return cdnaStart == exon.cdnaStart && cdnaEnd == exon.cdnaEnd && interval.equals(exon.interval);
    }

    @Override
    public int hashCode() {
        int result = interval.hashCode();
        result = 31 * result + cdnaStart;
        result = 31 * result + cdnaEnd;
        return result;
    }

    @Override
    public String toString() {
        return interval + " (cDNA " + cdnaStart + "-" + cdnaEnd + ")";
    }
}
