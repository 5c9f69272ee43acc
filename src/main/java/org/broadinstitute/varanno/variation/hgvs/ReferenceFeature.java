package org.broadinstitute.varanno.variation.hgvs;

import htsjdk.samtools.util.Locatable;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.varanno.utils.SimpleInterval;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.variation.VariationFeature;

import java.util.Optional;

/**
 * A named stretch of the genome that notations are expressed against: a genomic slice, a gene or a transcript.
 *
 * Positions in the notation are counted from the 5' end of the feature on its own strand, so the first base of a
 * feature on {@link Strand#NEGATIVE} is its highest genomic coordinate.  Only features with an {@link ExonMap}
 * support cDNA numbering.
 */
public final class ReferenceFeature implements Locatable {

    private final String name;
    private final SimpleInterval interval;
    private final Strand strand;
    private final ExonMap exonMap;

    private ReferenceFeature(final String name, final SimpleInterval interval, final Strand strand, final ExonMap exonMap) {
        this.name = Utils.nonEmpty(name, "name");
        this.interval = Utils.nonNull(interval, "interval");
        VariationFeature.assertValidStrand(strand);
        this.strand = strand;
        this.exonMap = exonMap;
    }

    /**
     * A feature without exon structure, e.g. a chromosome or a gene.
     * @param name name written in the notation, e.g. {@code 7} or {@code NG_012345.1}.
     * @param interval genomic span of the feature.
     * @param strand strand of the feature.  Must not be {@link Strand#NONE}.
     */
    public static ReferenceFeature ofSlice(final String name, final Locatable interval, final Strand strand) {
        return new ReferenceFeature(name, new SimpleInterval(Utils.nonNull(interval, "interval")), strand, null);
    }

    /**
     * A transcript spanning its exons, on the strand of its exon map.
     * @param name name written in the notation, e.g. {@code ENST00000380152}.
     * @param exonMap exon structure of the transcript.  Must not be {@code null}.
     */
    public static ReferenceFeature ofTranscript(final String name, final ExonMap exonMap) {
        Utils.nonNull(exonMap, "exonMap");
        return new ReferenceFeature(name, exonMap.getSpan(), exonMap.getStrand(), exonMap);
    }

    public String getName() {
        return name;
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

    public Strand getStrand() {
        return strand;
    }

    public Optional<ExonMap> getExonMap() {
        return Optional.ofNullable(exonMap);
    }

    /**
     * @param genomicPosition a position on the contig of this feature.
     * @return its 1-based position counted from the 5' end of this feature.
     */
    public int toFeaturePosition(final int genomicPosition) {
        return strand == Strand.POSITIVE ? genomicPosition - interval.getStart() + 1 : interval.getEnd() - genomicPosition + 1;
    }

    /**
     * Inverse of {@link #toFeaturePosition(int)}.
     */
    public int toGenomicPosition(final int featurePosition) {
        return strand == Strand.POSITIVE ? interval.getStart() + featurePosition - 1 : interval.getEnd() - featurePosition + 1;
    }

    @Override
    public String toString() {
        return name + " (" + interval + " " + strand.encode() + ")";
    }
}
