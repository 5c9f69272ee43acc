package org.broadinstitute.varanno.variation.hgvs;

/**
 * Coordinate system in which an HGVS notation is expressed.
 */
public enum ReferenceFrame {
    GENOMIC("g"),
    CDNA("c"),
    /**
     * Amino acid numbering.  Notations cannot be built in this frame.
     */
    PROTEIN("p");

    private final String numberingScheme;

    ReferenceFrame(final String numberingScheme) {
        this.numberingScheme = numberingScheme;
    }

    /**
     * @return the prefix written before the positions of a notation, e.g. {@code c} in {@code NM_000:c.76A>T}.
     */
    public String getNumberingScheme() {
        return numberingScheme;
    }
}
