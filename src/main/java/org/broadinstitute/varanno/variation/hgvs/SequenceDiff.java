package org.broadinstitute.varanno.variation.hgvs;

import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.variation.AlleleNormalizer;

import java.util.Locale;
import java.util.Optional;

/**
 * The change between a reference span and an alternate allele, classified as an {@link HgvsVariantType}
 * and placed on display coordinates.
 */
public final class SequenceDiff {

    private final HgvsVariantType type;
    private final int start;
    private final int end;
    private final String ref;
    private final String alt;

    SequenceDiff(final HgvsVariantType type, final int start, final int end, final String ref, final String alt) {
        this.type = type;
        this.start = start;
        this.end = end;
        this.ref = ref;
        this.alt = alt;
    }

    /**
     * Describe {@code allele} against a window of reference sequence.
     *
     * <p>
     *     The window holds the reference span of the variant at {@code [refStart, refEnd]} (1-based, within
     *     {@code referenceWindow}) preceded by up to as many bases as the allele is long, which are used to detect
     *     duplications.  For an insertion {@code refEnd == refStart - 1}.
     * </p>
     * <p>
     *     An insertion of the bases directly before it is a duplication of those bases; an alternate made of two
     *     copies of the reference span is a duplication of the span.  Insertions are placed between the two
     *     flanking positions, {@code displayEnd} and {@code displayStart}.
     * </p>
     *
     * @param allele the alternate allele; {@code -} characters are ignored.  Must not be {@code null}.
     * @param referenceWindow reference bases, on the same strand as {@code allele}.  Must not be {@code null}.
     * @param refStart 1-based start of the reference span in {@code referenceWindow}.
     * @param refEnd 1-based end of the reference span in {@code referenceWindow}.
     * @param displayStart position written for the first base of the reference span.
     * @param displayEnd position written for the last base of the reference span.
     * @return the change, or empty when the allele is identical to the reference span.
     */
    public static Optional<SequenceDiff> diff(final String allele,
                                              final String referenceWindow,
                                              final int refStart,
                                              final int refEnd,
                                              final int displayStart,
                                              final int displayEnd) {
        Utils.nonNull(allele, "allele");
        Utils.nonNull(referenceWindow, "referenceWindow");
        Utils.validateArg(refStart >= 1 && refEnd >= refStart - 1 && refEnd <= referenceWindow.length(),
                () -> "Reference span " + refStart + "-" + refEnd + " is not within a window of length " + referenceWindow.length());

        final String alt = AlleleNormalizer.stripGaps(allele).toUpperCase(Locale.ROOT);
        final String ref = referenceWindow.substring(refStart - 1, refEnd).toUpperCase(Locale.ROOT);

        if ( alt.equals(ref) ) {
            return Optional.empty();
        }
        if ( alt.isEmpty() ) {
            return Optional.of(new SequenceDiff(HgvsVariantType.DELETION, displayStart, displayEnd, ref, alt));
        }
        if ( ref.length() == 1 && alt.length() == 1 ) {
            return Optional.of(new SequenceDiff(HgvsVariantType.SUBSTITUTION, displayStart, displayEnd, ref, alt));
        }
        if ( ref.isEmpty() ) {
            final int precedingStart = refStart - 1 - alt.length();
            if ( precedingStart >= 0 && referenceWindow.substring(precedingStart, refStart - 1).toUpperCase(Locale.ROOT).equals(alt) ) {
                return Optional.of(new SequenceDiff(HgvsVariantType.DUPLICATION, displayEnd - alt.length() + 1, displayEnd, alt, alt));
            }
            return Optional.of(new SequenceDiff(HgvsVariantType.INSERTION, displayEnd, displayStart, ref, alt));
        }
        if ( alt.equals(ref + ref) ) {
            return Optional.of(new SequenceDiff(HgvsVariantType.DUPLICATION, displayStart, displayEnd, ref, alt));
        }
        return Optional.of(new SequenceDiff(HgvsVariantType.DELETION_INSERTION, displayStart, displayEnd, ref, alt));
    }

    public HgvsVariantType getType() {
        return type;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getRef() {
        return ref;
    }

    public String getAlt() {
        return alt;
    }

    @Override
    public String toString() {
        return start + "_" + end + type.renderBody(ref, alt);
    }
}
