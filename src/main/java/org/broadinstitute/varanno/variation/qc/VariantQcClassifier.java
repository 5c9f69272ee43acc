package org.broadinstitute.varanno.variation.qc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.utils.reference.SequenceProvider;
import org.broadinstitute.varanno.variation.AlleleNormalizer;
import org.broadinstitute.varanno.variation.VariationFeature;

import java.util.EnumSet;

/**
 * Maps the outcomes of the allele and reference checks of a variant onto {@link QcFailureReason} codes.
 *
 * The reference sequence is retrieved first.  If that fails the result is exactly
 * {@link QcFailureReason#COORDINATE_ERROR} and no other check is attempted; otherwise every check runs
 * and the failures are combined.
 */
public final class VariantQcClassifier {

    private static final Logger logger = LogManager.getLogger(VariantQcClassifier.class);

    private final ReferenceChecker referenceChecker;

    public VariantQcClassifier(final SequenceProvider sequenceProvider) {
        this(new ReferenceChecker(sequenceProvider));
    }

    public VariantQcClassifier(final ReferenceChecker referenceChecker) {
        this.referenceChecker = Utils.nonNull(referenceChecker, "referenceChecker");
    }

    /**
     * @param variant the variant to classify.  Must not be {@code null}.
     * @return the failures of {@code variant}; {@link QcFailureSet#PASSED} if there are none.
     */
    public QcFailureSet classify(final VariationFeature variant) {
        Utils.nonNull(variant, "variant");

        final ReferenceCheckResult referenceCheck;
        try {
            referenceCheck = referenceChecker.checkReference(variant);
        }
        catch (final VarAnnoException.CoordinateException e) {
            logger.warn("Could not check the reference of " + variant.getName() + ": " + e.getMessage());
            return QcFailureSet.of(QcFailureReason.COORDINATE_ERROR);
        }

        final EnumSet<QcFailureReason> failures = EnumSet.noneOf(QcFailureReason.class);
        final String alleleString = variant.getAlleleString();
        if ( AlleleNormalizer.checkFourBases(alleleString) ) {
            failures.add(QcFailureReason.ALL_FOUR_BASES);
        }
        if ( AlleleNormalizer.checkForAmbiguousAlleles(alleleString) ) {
            failures.add(QcFailureReason.AMBIGUOUS_ALLELE);
        }
        if ( referenceCheck.isMismatch() ) {
            failures.add(QcFailureReason.REFERENCE_MISMATCH);
        }
        if ( !ReferenceChecker.checkVariantSize(variant) ) {
            failures.add(QcFailureReason.COORDINATE_ERROR);
        }

        final QcFailureSet result = QcFailureSet.of(failures);
        if ( !result.isPassed() ) {
            logger.debug(variant.getName() + " failed QC: " + result);
        }
        return result;
    }
}
