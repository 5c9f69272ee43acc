package org.broadinstitute.varanno.variation.hgvs;

import htsjdk.samtools.util.Locatable;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.varanno.utils.SimpleInterval;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.variation.VariationFeature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The exon structure of a transcript, as supplied by the caller.
 *
 * <p>
 *     Exons are held in genomic order (ascending start) whatever the strand of the transcript.  The coding region
 *     boundaries are optional and expressed in cDNA numbering; a transcript without them is non-coding.
 * </p>
 *
 * Instances are immutable and can be shared between threads.
 */
public final class ExonMap {

    private final String contig;
    private final Strand strand;
    private final List<Exon> exons;
    private final Integer codingStart;
    private final Integer codingEnd;

    /**
     * @param strand strand of the transcript.  Must not be {@link Strand#NONE}.
     * @param exons exons of the transcript with their cDNA positions, in any order.  Must not be empty or overlap.
     * @param codingStart cDNA position of the first base of the start codon, or {@code null} for a non-coding transcript.
     * @param codingEnd cDNA position of the last base of the stop codon, or {@code null} for a non-coding transcript.
     */
    public ExonMap(final Strand strand, final List<Exon> exons, final Integer codingStart, final Integer codingEnd) {
        VariationFeature.assertValidStrand(strand);
        Utils.nonNull(exons, "exons");
        Utils.validateArg(!exons.isEmpty(), "A transcript must have at least one exon");
        Utils.containsNoNull(exons, "exons must not contain null");
        Utils.validateArg((codingStart == null) == (codingEnd == null), "codingStart and codingEnd must both be set or both be null");

        final List<Exon> sorted = new ArrayList<>(exons);
        sorted.sort(Comparator.comparingInt(Exon::getStart));

        this.contig = sorted.get(0).getContig();
        for ( int i = 0; i < sorted.size(); ++i ) {
            final Exon exon = sorted.get(i);
            Utils.validateArg(contig.equals(exon.getContig()), () -> "All exons must be on " + contig + " but found " + exon);
            if ( i > 0 ) {
                final Exon previous = sorted.get(i - 1);
                Utils.validateArg(previous.getEnd() < exon.getStart(), () -> "Exons " + previous + " and " + exon + " overlap");
            }
        }

        if ( codingStart != null ) {
            final int transcriptLength = sorted.stream().mapToInt(Exon::getLengthOnReference).sum();
            Utils.validateArg(codingStart >= 1 && codingStart <= codingEnd && codingEnd <= transcriptLength,
                    () -> "Coding region " + codingStart + "-" + codingEnd + " is not within the transcript (length " + transcriptLength + ")");
        }

        this.strand = strand;
        this.exons = Collections.unmodifiableList(sorted);
        this.codingStart = codingStart;
        this.codingEnd = codingEnd;
    }

    /**
     * Build an exon map from genomic exon intervals, numbering the transcribed bases from 1 in transcript order
     * (ascending genomic position on {@link Strand#POSITIVE}, descending on {@link Strand#NEGATIVE}).
     * @param strand strand of the transcript.  Must not be {@link Strand#NONE}.
     * @param exonIntervals genomic intervals of the exons, in any order.  Must not be empty.
     * @param codingStart cDNA position of the first base of the start codon, or {@code null}.
     * @param codingEnd cDNA position of the last base of the stop codon, or {@code null}.
     * @return a new {@link ExonMap}.
     */
    public static ExonMap fromExonIntervals(final Strand strand,
                                            final List<? extends Locatable> exonIntervals,
                                            final Integer codingStart,
                                            final Integer codingEnd) {
        VariationFeature.assertValidStrand(strand);
        Utils.nonNull(exonIntervals, "exonIntervals");
        Utils.containsNoNull(exonIntervals, "exonIntervals must not contain null");

        final List<Locatable> transcriptOrder = new ArrayList<>(exonIntervals);
        final Comparator<Locatable> byStart = Comparator.comparingInt(Locatable::getStart);
        transcriptOrder.sort(strand == Strand.POSITIVE ? byStart : byStart.reversed());

        final List<Exon> exons = new ArrayList<>(transcriptOrder.size());
        int transcribedBases = 0;
        for ( final Locatable interval : transcriptOrder ) {
            final int length = interval.getLengthOnReference();
            exons.add(new Exon(interval, transcribedBases + 1, transcribedBases + length));
            transcribedBases += length;
        }
        return new ExonMap(strand, exons, codingStart, codingEnd);
    }

    public String getContig() {
        return contig;
    }

    public Strand getStrand() {
        return strand;
    }

    /**
     * @return the exons in ascending genomic order.
     */
    public List<Exon> getExons() {
        return exons;
    }

    public boolean isCoding() {
        return codingStart != null;
    }

    /**
     * @return cDNA position of the first base of the start codon, or {@code null} for a non-coding transcript.
     */
    public Integer getCodingStart() {
        return codingStart;
    }

    /**
     * @return cDNA position of the last base of the stop codon, or {@code null} for a non-coding transcript.
     */
    public Integer getCodingEnd() {
        return codingEnd;
    }

    /**
     * @return the genomic span from the start of the first exon to the end of the last one.
     */
    public SimpleInterval getSpan() {
        return new SimpleInterval(contig, exons.get(0).getStart(), exons.get(exons.size() - 1).getEnd());
    }
}
