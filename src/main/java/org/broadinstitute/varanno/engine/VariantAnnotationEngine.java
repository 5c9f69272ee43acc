package org.broadinstitute.varanno.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.utils.config.ConfigFactory;
import org.broadinstitute.varanno.utils.config.VarAnnoConfig;
import org.broadinstitute.varanno.utils.reference.SequenceProvider;
import org.broadinstitute.varanno.variation.AlleleNormalizer;
import org.broadinstitute.varanno.variation.VariationFeature;
import org.broadinstitute.varanno.variation.consequence.ConsequenceResolver;
import org.broadinstitute.varanno.variation.consequence.ConsequenceSet;
import org.broadinstitute.varanno.variation.consequence.ConsequenceType;
import org.broadinstitute.varanno.variation.hgvs.HgvsNotation;
import org.broadinstitute.varanno.variation.hgvs.HgvsNotationBuilder;
import org.broadinstitute.varanno.variation.hgvs.NotationResult;
import org.broadinstitute.varanno.variation.qc.QcFailureReason;
import org.broadinstitute.varanno.variation.qc.QcFailureSet;
import org.broadinstitute.varanno.variation.qc.VariantQcClassifier;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Runs allele normalization, QC, notation building and consequence resolution for variants.
 *
 * <p>
 *     Failures that concern a single variant or allele never stop the work: they are recorded as
 *     {@link AnnotationFailure}s on the {@link VariantAnnotation} of that variant.  Variants are independent of each
 *     other, so {@link #annotateAll(List)} spreads them over {@code engine.threads} workers.  The
 *     {@link SequenceProvider} is shared by the workers and must support concurrent reads.
 * </p>
 */
public final class VariantAnnotationEngine {

    private static final Logger logger = LogManager.getLogger(VariantAnnotationEngine.class);

    private final AlleleNormalizer alleleNormalizer;
    private final VariantQcClassifier qcClassifier;
    private final HgvsNotationBuilder notationBuilder;
    private final int numThreads;

    /**
     * Create an engine configured by {@link ConfigFactory#getVarAnnoConfig()}.
     */
    public VariantAnnotationEngine(final SequenceProvider sequenceProvider) {
        this(sequenceProvider, ConfigFactory.getInstance().getVarAnnoConfig());
    }

    public VariantAnnotationEngine(final SequenceProvider sequenceProvider, final VarAnnoConfig config) {
        Utils.nonNull(sequenceProvider, "sequenceProvider");
        ConfigFactory.validate(config);
        ConfigFactory.logConfigFields(config);

        this.alleleNormalizer = new AlleleNormalizer(config);
        this.qcClassifier = new VariantQcClassifier(sequenceProvider);
        this.notationBuilder = new HgvsNotationBuilder(sequenceProvider);
        this.numThreads = config.engineThreads();
    }

    public int getNumThreads() {
        return numThreads;
    }

    /**
     * Annotate a single variant.
     * @param request the variant and its context.  Must not be {@code null}.
     * @return the annotation, never {@code null}.
     */
    public VariantAnnotation annotate(final VariantAnnotationRequest request) {
        Utils.nonNull(request, "request");

        final VariationFeature variant = request.getVariant();
        final List<AnnotationFailure> failures = new ArrayList<>();

        VariationFeature normalizedVariant = variant;
        try {
            normalizedVariant = alleleNormalizer.normalize(variant);
        }
        catch (final VarAnnoException e) {
            failures.add(new AnnotationFailure(variant.getName(), AnnotationFailure.Stage.NORMALIZATION, null, e.getMessage()));
        }

        QcFailureSet qcFailures;
        try {
            qcFailures = qcClassifier.classify(variant);
        }
        catch (final VarAnnoException e) {
            failures.add(new AnnotationFailure(variant.getName(), AnnotationFailure.Stage.QC, null, e.getMessage()));
            qcFailures = QcFailureSet.of(QcFailureReason.COORDINATE_ERROR);
        }

        final List<HgvsNotation> notations = new ArrayList<>();
        for ( final NotationTarget target : request.getNotationTargets() ) {
            try {
                final NotationResult result = notationBuilder.buildNotationResult(normalizedVariant, target.getFrame(), target.getFeature(), target.getReferenceName());
                notations.addAll(result.getNotations());
                for ( final Map.Entry<String, String> skipped : result.getSkippedAlleles().entrySet() ) {
                    failures.add(new AnnotationFailure(variant.getName(), AnnotationFailure.Stage.NOTATION, skipped.getKey(), skipped.getValue()));
                }
            }
            catch (final VarAnnoException e) {
                logger.warn("Could not describe " + variant.getName() + " against " + target + ": " + e.getMessage());
                failures.add(new AnnotationFailure(variant.getName(), AnnotationFailure.Stage.NOTATION, null, e.getMessage()));
            }
        }

        final List<ConsequenceSet> annotations = request.getConsequenceAnnotations();
        final ConsequenceSet consequences = ConsequenceResolver.resolve(annotations);
        final ConsequenceType displayConsequence = ConsequenceResolver.displayConsequence(annotations);

        return new VariantAnnotation(variant, normalizedVariant, qcFailures, notations, consequences, displayConsequence, failures);
    }

    /**
     * Annotate variants in parallel.
     * @param requests the variants to annotate.  Must not be {@code null}.
     * @return one annotation per request, in the order of {@code requests}.
     */
    public List<VariantAnnotation> annotateAll(final List<VariantAnnotationRequest> requests) {
        Utils.nonNull(requests, "requests");
        Utils.containsNoNull(requests, "requests must not contain null");

        final List<VariantAnnotation> annotations = new ArrayList<>(requests.size());
        final Iterator<VariantAnnotation> iterator = Utils.transformParallel(requests.iterator(), this::annotate, numThreads);
        int failedQc = 0;
        int withFailures = 0;
        while ( iterator.hasNext() ) {
            final VariantAnnotation annotation = iterator.next();
            failedQc += annotation.getQcFailures().isPassed() ? 0 : 1;
            withFailures += annotation.hasFailures() ? 1 : 0;
            annotations.add(annotation);
        }

        logger.info("Annotated " + annotations.size() + " variants using " + numThreads + " threads: "
                + failedQc + " failed QC, " + withFailures + " with annotation failures");
        return annotations;
    }
}
