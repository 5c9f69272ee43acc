package org.broadinstitute.varanno.variation.hgvs;

import org.broadinstitute.varanno.utils.Utils;

/**
 * An HGVS-style description of one allele of a variant against a named reference, e.g. {@code 7:g.1234A>T},
 * {@code ENST00000380152:c.88+2_88+3delAG} or {@code ENST00000523431:5insT} (non-coding transcript).
 */
public final class HgvsNotation {

    private final String allele;
    private final String referenceName;
    private final String numberingScheme;
    private final String start;
    private final String end;
    private final HgvsVariantType type;
    private final String ref;
    private final String alt;
    private final String rendered;

    /**
     * @param allele the allele this notation describes, as given in the variant.
     * @param referenceName name of the reference the positions refer to.
     * @param numberingScheme {@code g}, {@code c}, or empty for transcripts without a coding region.
     * @param start printed start position.
     * @param end printed end position; omitted from the notation when equal to {@code start}.
     * @param type kind of change.
     * @param ref reference bases of the change (empty for an insertion).
     * @param alt alternate bases of the change (empty for a deletion).
     */
    public HgvsNotation(final String allele,
                        final String referenceName,
                        final String numberingScheme,
                        final String start,
                        final String end,
                        final HgvsVariantType type,
                        final String ref,
                        final String alt) {
        this.allele = Utils.nonNull(allele, "allele");
        this.referenceName = Utils.nonNull(referenceName, "referenceName");
        this.numberingScheme = Utils.nonNull(numberingScheme, "numberingScheme");
        this.start = Utils.nonEmpty(start, "start");
        this.end = Utils.nonEmpty(end, "end");
        this.type = Utils.nonNull(type, "type");
        this.ref = Utils.nonNull(ref, "ref");
        this.alt = Utils.nonNull(alt, "alt");
        this.rendered = render();
    }

    private String render() {
        final StringBuilder sb = new StringBuilder(referenceName).append(':');
        if ( !numberingScheme.isEmpty() ) {
            sb.append(numberingScheme).append('.');
        }
        sb.append(start);
        if ( !end.equals(start) ) {
            sb.append('_').append(end);
        }
        return sb.append(type.renderBody(ref, alt)).toString();
    }

    public String getAllele() {
        return allele;
    }

    public String getReferenceName() {
        return referenceName;
    }

    public String getNumberingScheme() {
        return numberingScheme;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    public HgvsVariantType getType() {
        return type;
    }

    public String getRef() {
        return ref;
    }

    public String getAlt() {
        return alt;
    }

    public String getRendered() {
        return rendered;
    }

    @Override
    public boolean equals(final Object o) {
        if ( this == o ) {
            return true;
        }
        if ( o == null || getClass() != o.getClass() ) {
            return false;
        }
        final HgvsNotation that = (HgvsNotation) o;
        return allele.equals(that.allele) && rendered.equals(that.rendered);
    }

    @Override
    public int hashCode() {
        return 31 * allele.hashCode() + rendered.hashCode();
    }

    @Override
    public String toString() {
        return rendered;
    }
}
