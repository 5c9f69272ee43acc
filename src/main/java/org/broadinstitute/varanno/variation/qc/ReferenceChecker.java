package org.broadinstitute.varanno.variation.qc;

import htsjdk.samtools.util.SequenceUtil;
import htsjdk.tribble.annotation.Strand;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.utils.reference.SequenceProvider;
import org.broadinstitute.varanno.variation.AlleleNormalizer;
import org.broadinstitute.varanno.variation.VariationFeature;

/**
 * Checks the declared reference allele of a variant against a {@link SequenceProvider}.
 *
 * Comparison is case-insensitive and mismatches are reported, never corrected.  For variants on the
 * negative strand the retrieved sequence is reverse complemented before the comparison.
 */
public final class ReferenceChecker {

    private static final Logger logger = LogManager.getLogger(ReferenceChecker.class);

    private final SequenceProvider sequenceProvider;

    public ReferenceChecker(final SequenceProvider sequenceProvider) {
        this.sequenceProvider = Utils.nonNull(sequenceProvider, "sequenceProvider");
    }

    /**
     * Compare the reference allele of {@code variant} with the reference sequence at its span.
     * Insertions have an empty span, so they are compared against {@link AlleleNormalizer#GAP} without querying the provider;
     * their reference allele matches when it is empty once gaps are removed ({@code -}, {@code ""}).
     * @param variant the variant to check.  Must not be {@code null}.
     * @return the outcome of the comparison, never {@code null}.
     * @throws VarAnnoException.SequenceUnavailable if the provider cannot return the span of {@code variant}.
     */
    public ReferenceCheckResult checkReference(final VariationFeature variant) {
        Utils.nonNull(variant, "variant");

        final String declared = variant.getReferenceAlleleString();
        final String retrieved = getReferenceSequence(variant);

        if ( AlleleNormalizer.isSymbolic(declared) ) {
            return new ReferenceCheckResult(ReferenceCheckResult.MatchOutcome.NOT_CHECKED, declared, retrieved);
        }

        final boolean matches = variant.isInsertion()
                ? AlleleNormalizer.stripGaps(declared).isEmpty()
                : declared.equalsIgnoreCase(retrieved);
        if ( matches ) {
            return new ReferenceCheckResult(ReferenceCheckResult.MatchOutcome.MATCH, declared, retrieved);
        }
        logger.debug("Reference allele " + declared + " of " + variant.getName() + " does not match reference " + retrieved);
        return new ReferenceCheckResult(ReferenceCheckResult.MatchOutcome.MISMATCH, declared, retrieved);
    }

    /**
     * @return the reference bases at the span of {@code variant} on its strand, or {@link AlleleNormalizer#GAP} for an insertion.
     */
    private String getReferenceSequence(final VariationFeature variant) {
        if ( variant.isInsertion() ) {
            return AlleleNormalizer.GAP;
        }

        final String sequence = sequenceProvider.fetch(variant.getContig(), variant.getStart(), variant.getEnd());
        if ( sequence == null || sequence.length() != variant.getLengthOnReference() ) {
            throw new VarAnnoException.SequenceUnavailable(variant.getContig(), variant.getStart(), variant.getEnd());
        }
        return variant.getStrand() == Strand.NEGATIVE ? SequenceUtil.reverseComplement(sequence) : sequence;
    }

    /**
     * Verifies that the length of the reference allele agrees with the span of the variant.
     * A gap reference allele requires an insertion span ({@code end == start - 1}); a symbolic allele
     * is measured by its recorded length.
     * @param variant the variant to check.  Must not be {@code null}.
     * @return {@code true} iff the reference allele length is consistent with the coordinates.
     */
    public static boolean checkVariantSize(final VariationFeature variant) {
        Utils.nonNull(variant, "variant");

        final String reference = variant.getReferenceAlleleString();
        if ( AlleleNormalizer.GAP.equals(reference) ) {
            return variant.isInsertion();
        }
        final int referenceLength = AlleleNormalizer.isSymbolic(reference)
                ? AlleleNormalizer.symbolicLength(reference)
                : reference.length();
        return referenceLength == variant.getLengthOnReference();
    }
}
