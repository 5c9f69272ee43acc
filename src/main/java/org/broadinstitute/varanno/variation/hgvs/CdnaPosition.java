package org.broadinstitute.varanno.variation.hgvs;

import java.util.Comparator;

/**
 * A position in cDNA numbering.
 *
 * <p>
 *     The printed form combines an exonic coordinate with an optional intronic offset: {@code 76}, {@code 88+2},
 *     {@code 89-1}.  In coding transcripts the coordinate is relative to the start codon, so 5' UTR positions are
 *     negative ({@code -14}) and 3' UTR positions are counted from the stop codon with a {@code *} prefix
 *     ({@code *3}).  There is no position 0.
 * </p>
 */
public final class CdnaPosition implements Comparable<CdnaPosition> {

    private static final Comparator<CdnaPosition> TRANSCRIPT_ORDER =
            Comparator.comparingInt(CdnaPosition::getTranscriptPosition).thenComparingInt(CdnaPosition::getIntronOffset);

    private final int transcriptPosition;
    private final int coordinate;
    private final int intronOffset;
    private final boolean threePrimeUtr;

    /**
     * @param transcriptPosition position of the nearest exonic base counted from the first transcribed base (1-based).
     * @param coordinate printed coordinate of that base after start/stop codon rebasing.
     * @param intronOffset signed distance into the intron from that base; 0 for exonic positions.
     * @param threePrimeUtr whether {@code coordinate} is relative to the stop codon.
     */
    public CdnaPosition(final int transcriptPosition, final int coordinate, final int intronOffset, final boolean threePrimeUtr) {
        this.transcriptPosition = transcriptPosition;
        this.coordinate = coordinate;
        this.intronOffset = intronOffset;
        this.threePrimeUtr = threePrimeUtr;
    }

    public int getTranscriptPosition() {
        return transcriptPosition;
    }

    public int getCoordinate() {
        return coordinate;
    }

    public int getIntronOffset() {
        return intronOffset;
    }

    public boolean isIntronic() {
        return intronOffset != 0;
    }

    public boolean isThreePrimeUtr() {
        return threePrimeUtr;
    }

    public boolean isFivePrimeUtr() {
        return !threePrimeUtr && coordinate < 0;
    }

    /**
     * Orders positions 5' to 3' along the transcript.
     */
    @Override
    public int compareTo(final CdnaPosition other) {
        return TRANSCRIPT_ORDER.compare(this, other);
    }

    @Override
    public boolean equals(final Object o) {
        if ( this == o ) {
            return true;
        }
        if ( o == null || getClass() != o.getClass() ) {
            return false;
        }
        final CdnaPosition that = (CdnaPosition) o;
        return transcriptPosition == that.transcriptPosition &&
                coordinate == that.coordinate &&
                intronOffset == that.intronOffset &&
                threePrimeUtr == that.threePrimeUtr;
    }

    @Override
    public int hashCode() {
        int result = transcriptPosition;
        result = 31 * result + coordinate;
        result = 31 * result + intronOffset;
        result = 31 * result + (threePrimeUtr ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        if ( threePrimeUtr ) {
            sb.append('*');
        }
        sb.append(coordinate);
        if ( intronOffset > 0 ) {
            sb.append('+').append(intronOffset);
        }
        else if ( intronOffset < 0 ) {
            sb.append(intronOffset);
        }
        return sb.toString();
    }
}
