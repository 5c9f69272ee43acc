package org.broadinstitute.varanno.engine;

import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.variation.VariationFeature;
import org.broadinstitute.varanno.variation.consequence.ConsequenceSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything needed to annotate one variant: the variant itself, the references to describe it against, and the
 * consequences it has on the transcripts it overlaps.
 */
public final class VariantAnnotationRequest {

    private final VariationFeature variant;
    private final List<NotationTarget> notationTargets;
    private final List<ConsequenceSet> consequenceAnnotations;

    public VariantAnnotationRequest(final VariationFeature variant,
                                    final List<NotationTarget> notationTargets,
                                    final List<ConsequenceSet> consequenceAnnotations) {
        this.variant = Utils.nonNull(variant, "variant");
        Utils.containsNoNull(notationTargets, "notationTargets must not contain null");
        Utils.containsNoNull(consequenceAnnotations, "consequenceAnnotations must not contain null");
        this.notationTargets = Collections.unmodifiableList(new ArrayList<>(notationTargets));
        this.consequenceAnnotations = Collections.unmodifiableList(new ArrayList<>(consequenceAnnotations));
    }

    /**
     * A request for QC only, with no notations and no consequences.
     */
    public static VariantAnnotationRequest qcOnly(final VariationFeature variant) {
        return new VariantAnnotationRequest(variant, Collections.emptyList(), Collections.emptyList());
    }

    public VariationFeature getVariant() {
        return variant;
    }

    public List<NotationTarget> getNotationTargets() {
        return notationTargets;
    }

    public List<ConsequenceSet> getConsequenceAnnotations() {
        return consequenceAnnotations;
    }
}
