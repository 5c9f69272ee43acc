package org.broadinstitute.varanno.engine;

import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.variation.hgvs.ReferenceFeature;
import org.broadinstitute.varanno.variation.hgvs.ReferenceFrame;

/**
 * A reference feature and the frame in which the notations of a variant should be expressed against it.
 */
public final class NotationTarget {

    private final ReferenceFeature feature;
    private final ReferenceFrame frame;
    private final String referenceName;

    public NotationTarget(final ReferenceFeature feature, final ReferenceFrame frame) {
        this(feature, frame, Utils.nonNull(feature, "feature").getName());
    }

    /**
     * @param referenceName name written in the notations instead of the name of {@code feature}.
     */
    public NotationTarget(final ReferenceFeature feature, final ReferenceFrame frame, final String referenceName) {
        this.feature = Utils.nonNull(feature, "feature");
        this.frame = Utils.nonNull(frame, "frame");
        this.referenceName = Utils.nonEmpty(referenceName, "referenceName");
    }

    public ReferenceFeature getFeature() {
        return feature;
    }

    public ReferenceFrame getFrame() {
        return frame;
    }

    public String getReferenceName() {
        return referenceName;
    }

    @Override
    public String toString() {
        return referenceName + " (" + frame + ")";
    }
}
