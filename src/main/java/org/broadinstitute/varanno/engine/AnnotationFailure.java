package org.broadinstitute.varanno.engine;

import org.broadinstitute.varanno.utils.Utils;

import java.util.Objects;
import java.util.Optional;

/**
 * A problem met while annotating one variant (or one of its alleles), returned next to the results that succeeded.
 */
public final class AnnotationFailure {

    public enum Stage {
        NORMALIZATION,
        QC,
        NOTATION
    }

    private final String variantName;
    private final Stage stage;
    private final String allele;
    private final String message;

    public AnnotationFailure(final String variantName, final Stage stage, final String allele, final String message) {
        this.variantName = variantName;
        this.stage = Utils.nonNull(stage, "stage");
        this.allele = allele;
        this.message = Utils.nonNull(message, "message");
    }

    public String getVariantName() {
        return variantName;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * @return the allele concerned, empty if the failure concerns the whole variant.
     */
    public Optional<String> getAllele() {
        return Optional.ofNullable(allele);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(final Object o) {
        if ( this == o ) {
            return true;
        }
        if ( o == null || getClass() != o.getClass() ) {
            return false;
        }
        final AnnotationFailure that = (AnnotationFailure) o;
        return Objects.equals(variantName, that.variantName) &&
                stage == that.stage &&
                Objects.equals(allele, that.allele) &&
                message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variantName, stage, allele, message);
    }

    @Override
    public String toString() {
        return variantName + " [" + stage + (allele == null ? "" : " " + allele) + "]: " + message;
    }
}
