package org.broadinstitute.varanno.variation;

import htsjdk.samtools.util.Locatable;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.varanno.utils.Nucleotide;
import org.broadinstitute.varanno.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A sequence change at a 1-based, closed genomic span.
 *
 * <p>
 *     An insertion between two bases is represented with {@code end == start - 1}; the span is then empty and
 *     {@link #getLengthOnReference()} is zero.  The allele string lists the alleles separated by {@code /},
 *     the first one being the reference allele, e.g. {@code A/G}, {@code -/CT} or {@code AGT/-}.
 * </p>
 *
 * Instances are immutable; use {@link Builder} (or {@link #toBuilder()}) to make modified copies.
 */
public final class VariationFeature implements Locatable {

    private final String name;
    private final String source;
    private final String contig;
    private final int start;
    private final int end;
    private final Strand strand;
    private final String alleleString;
    private final int mapWeight;
    private final Set<ValidationState> validationStates;

    private VariationFeature(final Builder builder) {
        this.name = builder.name;
        this.source = builder.source;
        this.contig = builder.contig;
        this.start = builder.start;
        this.end = builder.end;
        this.strand = builder.strand;
        this.alleleString = builder.alleleString;
        this.mapWeight = builder.mapWeight;
        this.validationStates = Collections.unmodifiableSet(EnumSet.copyOf(builder.validationStates));
    }

    /**
     * Asserts that the given strand is non-null and is not equal to {@link Strand#NONE}.
     * @param strand {@link Strand} to validate.
     */
    public static void assertValidStrand(final Strand strand) {
        Utils.nonNull(strand, "strand");
        Utils.validateArg(strand != Strand.NONE, "Strand must be POSITIVE or NEGATIVE.");
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    @Override
    public int getLengthOnReference() {
        return end - start + 1;
    }

    public Strand getStrand() {
        return strand;
    }

    public String getAlleleString() {
        return alleleString;
    }

    public int getMapWeight() {
        return mapWeight;
    }

    public boolean isInsertion() {
        return end == start - 1;
    }

    /**
     * @return the alleles of this variant, reference first.
     */
    public List<String> getAlleles() {
        return AlleleNormalizer.splitAlleles(alleleString);
    }

    /**
     * @return the first allele of the allele string.
     */
    public String getReferenceAlleleString() {
        return getAlleles().get(0);
    }

    /**
     * The IUPAC code covering every allele of this variant, e.g. {@code R} for {@code A/G}.
     * @return {@code null} unless every allele is a single standard base.
     */
    public String getAmbiguityCode() {
        final List<Nucleotide> bases = new ArrayList<>();
        for ( final String allele : getAlleles() ) {
            if ( allele.length() != 1 ) {
                return null;
            }
            final Nucleotide base = Nucleotide.decode(allele.charAt(0));
            if ( !base.isStandard() ) {
                return null;
            }
            bases.add(base);
        }
        final Nucleotide union = Nucleotide.union(bases);
        return union.isValid() ? String.valueOf(union.encodeAsChar()) : null;
    }

    public VariationClass getVariationClass() {
        return VariationClass.classify(alleleString);
    }

    /**
     * @return the validation states of this variant in their vocabulary order.
     */
    public Set<ValidationState> getAllValidationStates() {
        return validationStates;
    }

    public boolean hasValidationState(final ValidationState state) {
        return validationStates.contains(state);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public boolean equals(final Object o) {
        if ( this == o ) {
            return true;
        }
        if ( o == null || getClass() != o.getClass() ) {
            return false;
        }
        final VariationFeature that = (VariationFeature) o;
        return start == that.start &&
                end == that.end &&
                mapWeight == that.mapWeight &&
                Objects.equals(name, that.name) &&
                Objects.equals(source, that.source) &&
                contig.equals(that.contig) &&
                strand == that.strand &&
                alleleString.equals(that.alleleString) &&
                validationStates.equals(that.validationStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, source, contig, start, end, strand, alleleString, mapWeight, validationStates);
    }

    @Override
    public String toString() {
        return "VariationFeature{" +
                "name='" + name + '\'' +
                ", contig='" + contig + '\'' +
                ", start=" + start +
                ", end=" + end +
                ", strand=" + strand.encode() +
                ", alleleString='" + alleleString + '\'' +
                '}';
    }

    //==================================================================================================================

    /**
     * Builder for {@link VariationFeature}.  Strand defaults to {@link Strand#POSITIVE} and map weight to 1.
     */
    public static final class Builder {
        private String name;
        private String source;
        private String contig;
        private int start;
        private int end;
        private Strand strand = Strand.POSITIVE;
        private String alleleString;
        private int mapWeight = 1;
        private final EnumSet<ValidationState> validationStates = EnumSet.noneOf(ValidationState.class);

        public Builder() {}

        private Builder(final VariationFeature variant) {
            this.name = variant.name;
            this.source = variant.source;
            this.contig = variant.contig;
            this.start = variant.start;
            this.end = variant.end;
            this.strand = variant.strand;
            this.alleleString = variant.alleleString;
            this.mapWeight = variant.mapWeight;
            this.validationStates.addAll(variant.validationStates);
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder source(final String source) {
            this.source = source;
            return this;
        }

        public Builder contig(final String contig) {
            this.contig = contig;
            return this;
        }

        public Builder start(final int start) {
            this.start = start;
            return this;
        }

        public Builder end(final int end) {
            this.end = end;
            return this;
        }

        /**
         * Set start and end together from a {@link Locatable}, taking its contig as well.
         */
        public Builder location(final Locatable location) {
            Utils.nonNull(location, "location");
            return contig(location.getContig()).start(location.getStart()).end(location.getEnd());
        }

        public Builder strand(final Strand strand) {
            this.strand = strand;
            return this;
        }

        public Builder alleleString(final String alleleString) {
            this.alleleString = alleleString;
            return this;
        }

        public Builder mapWeight(final int mapWeight) {
            this.mapWeight = mapWeight;
            return this;
        }

        public Builder validationState(final ValidationState state) {
            validationStates.add(Utils.nonNull(state, "state"));
            return this;
        }

        /**
         * Add a validation state by its label.  Unknown labels are ignored with a warning.
         * @param label e.g. {@code "hapmap"} or {@code "1000Genome"}.
         */
        public Builder addValidationState(final String label) {
            ValidationState.fromLabel(label).ifPresent(validationStates::add);
            return this;
        }

        public VariationFeature make() {
            Utils.nonEmpty(contig, "contig");
            Utils.nonEmpty(alleleString, "alleleString");
            assertValidStrand(strand);
            Utils.validateArg(start > 0, () -> "start must be positive but was " + start);
            Utils.validateArg(end >= start - 1, () -> "end must be >= start - 1 but was " + contig + ":" + start + "-" + end);
            Utils.validateArg(mapWeight >= 0, "mapWeight must not be negative");
            return new VariationFeature(this);
        }
    }
}
