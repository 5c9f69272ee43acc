package org.broadinstitute.varanno.variation.hgvs;

/**
 * Kinds of change an HGVS notation can describe, with the token that introduces them in the notation.
 */
public enum HgvsVariantType {
    SUBSTITUTION(">"),
    INSERTION("ins"),
    DELETION("del"),
    DELETION_INSERTION("delins"),
    DUPLICATION("dup");

    private final String token;

    HgvsVariantType(final String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Render the part of a notation that follows the positions, e.g. {@code A>T}, {@code delAG}, {@code insTT},
     * {@code delAGinsTT} or {@code dupAG}.
     */
    public String renderBody(final String ref, final String alt) {
        switch ( this ) {
            case SUBSTITUTION:
                return ref + token + alt;
            case DELETION_INSERTION:
                return DELETION.token + ref + INSERTION.token + alt;
            case INSERTION:
                return token + alt;
            default:
                return token + ref;
        }
    }
}
