package org.broadinstitute.varanno.variation.qc;

/**
 * Reasons for which a variant fails quality control.  The codes are stable identifiers used by the stores that
 * persist failures; they are not ordered by severity.
 */
public enum QcFailureReason {
    REFERENCE_MISMATCH(2, "reference allele does not match the reference sequence"),
    ALL_FOUR_BASES(3, "alleles are all four bases"),
    AMBIGUOUS_ALLELE(14, "allele contains an ambiguity code"),
    COORDINATE_ERROR(15, "reference sequence is unavailable or inconsistent with the variant coordinates");

    private final int code;
    private final String description;

    QcFailureReason(final int code, final String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @param code a failure code, e.g. {@code 14}.
     * @return the reason with that code.
     * @throws IllegalArgumentException if no reason has that code.
     */
    public static QcFailureReason fromCode(final int code) {
        for ( final QcFailureReason reason : values() ) {
            if ( reason.code == code ) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown QC failure code: " + code);
    }
}
