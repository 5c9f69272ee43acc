package org.broadinstitute.varanno.variation.hgvs;

import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;

import java.util.List;

/**
 * Converts genomic positions into cDNA numbering against an {@link ExonMap}.
 */
public final class CdnaCoordinateMapper {

    private CdnaCoordinateMapper() {}

    /**
     * Map a genomic position onto a transcript.
     *
     * <p>
     *     Exonic positions map to the cDNA position of the base.  Intronic positions are expressed relative to the
     *     closest exon boundary: {@code 88+2} is two bases into the intron after cDNA base 88, {@code 89-1} the last
     *     intronic base before cDNA base 89.  When the position is equally far from both flanking exons it is
     *     expressed relative to the exon with the lower genomic coordinates on {@link Strand#POSITIVE} transcripts
     *     and relative to the exon with the higher genomic coordinates on {@link Strand#NEGATIVE} transcripts.
     * </p>
     * <p>
     *     For coding transcripts the result is then rebased on the coding region: the first base of the start
     *     codon is 1, the base before it -1, and bases after the stop codon are numbered {@code *1}, {@code *2}...
     * </p>
     *
     * @param genomicPosition 1-based position on the contig of the transcript.
     * @param exonMap the exon structure of the transcript.  Must not be {@code null}.
     * @return the cDNA position, never {@code null}.
     * @throws VarAnnoException.OutOfTranscriptBounds if {@code genomicPosition} is before the first or after the last exon.
     */
    public static CdnaPosition toCdna(final int genomicPosition, final ExonMap exonMap) {
        Utils.nonNull(exonMap, "exonMap");

        final List<Exon> exons = exonMap.getExons();
        final boolean forward = exonMap.getStrand() == Strand.POSITIVE;

        int transcriptPosition = -1;
        int intronOffset = 0;
        for ( int i = 0; i < exons.size(); ++i ) {
            final Exon exon = exons.get(i);
            if ( genomicPosition > exon.getEnd() ) {
                continue;
            }

            if ( genomicPosition >= exon.getStart() ) {
                transcriptPosition = exon.getCdnaStart() + (forward ? genomicPosition - exon.getStart() : exon.getEnd() - genomicPosition);
            }
            else if ( i > 0 ) {
                final Exon upstreamExon = exons.get(i - 1);
                final int upstreamDistance = genomicPosition - upstreamExon.getEnd();
                final int downstreamDistance = exon.getStart() - genomicPosition;

                // Ties go to the upstream exon only on the forward strand.
                if ( upstreamDistance < downstreamDistance || (upstreamDistance == downstreamDistance && forward) ) {
                    transcriptPosition = forward ? upstreamExon.getCdnaEnd() : upstreamExon.getCdnaStart();
                    intronOffset = forward ? upstreamDistance : -upstreamDistance;
                }
                else {
                    transcriptPosition = forward ? exon.getCdnaStart() : exon.getCdnaEnd();
                    intronOffset = forward ? -downstreamDistance : downstreamDistance;
                }
            }
            break;
        }

        if ( transcriptPosition < 0 ) {
            throw new VarAnnoException.OutOfTranscriptBounds(genomicPosition, exonMap.getSpan());
        }
        return rebase(transcriptPosition, intronOffset, exonMap);
    }

    /**
     * Express a transcript position relative to the coding region of {@code exonMap}.
     * Non-coding transcripts keep their transcript numbering.
     */
    static CdnaPosition rebase(final int transcriptPosition, final int intronOffset, final ExonMap exonMap) {
        if ( !exonMap.isCoding() ) {
            return new CdnaPosition(transcriptPosition, transcriptPosition, intronOffset, false);
        }

        final int codingStart = exonMap.getCodingStart();
        final int codingEnd = exonMap.getCodingEnd();
        if ( transcriptPosition > codingEnd ) {
            return new CdnaPosition(transcriptPosition, transcriptPosition - codingEnd, intronOffset, true);
        }
        // No position 0: the start codon begins at 1 and the base before it is -1.
        final int coordinate = transcriptPosition >= codingStart
                ? transcriptPosition - codingStart + 1
                : transcriptPosition - codingStart;
        return new CdnaPosition(transcriptPosition, coordinate, intronOffset, false);
    }
}
