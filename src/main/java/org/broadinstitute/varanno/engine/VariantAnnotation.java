package org.broadinstitute.varanno.engine;

import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.variation.VariationFeature;
import org.broadinstitute.varanno.variation.consequence.ConsequenceSet;
import org.broadinstitute.varanno.variation.consequence.ConsequenceType;
import org.broadinstitute.varanno.variation.hgvs.HgvsNotation;
import org.broadinstitute.varanno.variation.qc.QcFailureSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The annotations computed for one variant.
 */
public final class VariantAnnotation {

    private final VariationFeature variant;
    private final VariationFeature normalizedVariant;
    private final QcFailureSet qcFailures;
    private final List<HgvsNotation> notations;
    private final ConsequenceSet consequences;
    private final ConsequenceType displayConsequence;
    private final List<AnnotationFailure> failures;

    public VariantAnnotation(final VariationFeature variant,
                             final VariationFeature normalizedVariant,
                             final QcFailureSet qcFailures,
                             final List<HgvsNotation> notations,
                             final ConsequenceSet consequences,
                             final ConsequenceType displayConsequence,
                             final List<AnnotationFailure> failures) {
        this.variant = Utils.nonNull(variant, "variant");
        this.normalizedVariant = Utils.nonNull(normalizedVariant, "normalizedVariant");
        this.qcFailures = Utils.nonNull(qcFailures, "qcFailures");
        this.notations = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(notations, "notations")));
        this.consequences = Utils.nonNull(consequences, "consequences");
        this.displayConsequence = Utils.nonNull(displayConsequence, "displayConsequence");
        this.failures = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(failures, "failures")));
    }

    /**
     * @return the variant as requested.
     */
    public VariationFeature getVariant() {
        return variant;
    }

    /**
     * @return the variant on the forward strand with its normalized allele string.
     */
    public VariationFeature getNormalizedVariant() {
        return normalizedVariant;
    }

    public String getNormalizedAlleleString() {
        return normalizedVariant.getAlleleString();
    }

    public QcFailureSet getQcFailures() {
        return qcFailures;
    }

    public List<HgvsNotation> getNotations() {
        return notations;
    }

    /**
     * @return the rendered notations, in the order they were built.
     */
    public List<String> getRenderedNotations() {
        return notations.stream().map(HgvsNotation::getRendered).collect(Collectors.toList());
    }

    public ConsequenceSet getConsequences() {
        return consequences;
    }

    public ConsequenceType getDisplayConsequence() {
        return displayConsequence;
    }

    public List<AnnotationFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
