package org.broadinstitute.varanno.variation.qc;

import org.broadinstitute.varanno.utils.Utils;

/**
 * Outcome of comparing the declared reference allele of a variant with the reference sequence at its span.
 */
public final class ReferenceCheckResult {

    public enum MatchOutcome {
        MATCH,
        MISMATCH,
        /**
         * The declared reference allele is symbolic, so its bases could not be compared.
         */
        NOT_CHECKED
    }

    private final MatchOutcome outcome;
    private final String declaredReference;
    private final String retrievedReference;

    public ReferenceCheckResult(final MatchOutcome outcome, final String declaredReference, final String retrievedReference) {
        this.outcome = Utils.nonNull(outcome, "outcome");
        this.declaredReference = Utils.nonNull(declaredReference, "declaredReference");
        this.retrievedReference = Utils.nonNull(retrievedReference, "retrievedReference");
    }

    public MatchOutcome getOutcome() {
        return outcome;
    }

    public boolean isMismatch() {
        return outcome == MatchOutcome.MISMATCH;
    }

    public String getDeclaredReference() {
        return declaredReference;
    }

    /**
     * @return the reference bases at the variant span, on the strand of the variant; {@code -} for an insertion.
     */
    public String getRetrievedReference() {
        return retrievedReference;
    }

    @Override
    public String toString() {
        return outcome + " (declared=" + declaredReference + ", reference=" + retrievedReference + ")";
    }
}
