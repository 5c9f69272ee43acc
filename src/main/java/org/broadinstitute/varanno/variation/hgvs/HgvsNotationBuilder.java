package org.broadinstitute.varanno.variation.hgvs;

import htsjdk.samtools.util.SequenceUtil;
import htsjdk.tribble.annotation.Strand;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.utils.reference.SequenceProvider;
import org.broadinstitute.varanno.variation.AlleleNormalizer;
import org.broadinstitute.varanno.variation.VariationFeature;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the HGVS notations of the alleles of a variant against a {@link ReferenceFeature}.
 *
 * <p>
 *     The variant is first placed on the feature: its positions are counted from the 5' end of the feature and its
 *     alleles are reverse complemented when the variant and the feature are on opposite strands.  Each distinct
 *     allele made only of A, C, G, T and gaps is then compared with the reference sequence of the feature (read from
 *     the {@link SequenceProvider}, not taken from the declared reference allele).  Alleles identical to the
 *     reference produce no notation.
 * </p>
 * <p>
 *     In the {@link ReferenceFrame#CDNA} frame the positions are translated with {@link CdnaCoordinateMapper}, so
 *     intronic and UTR positions come out as {@code 88+2}, {@code -14} or {@code *3}.
 * </p>
 *
 * Instances hold no state besides the sequence provider and can be shared between threads if the provider can.
 */
public final class HgvsNotationBuilder {

    private static final Logger logger = LogManager.getLogger(HgvsNotationBuilder.class);

    private final SequenceProvider sequenceProvider;

    public HgvsNotationBuilder(final SequenceProvider sequenceProvider) {
        this.sequenceProvider = Utils.nonNull(sequenceProvider, "sequenceProvider");
    }

    /**
     * Equivalent to {@link #buildNotations(VariationFeature, ReferenceFrame, ReferenceFeature, String)} using the
     * name of {@code feature} as the reference name.
     */
    public List<HgvsNotation> buildNotations(final VariationFeature variant,
                                            final ReferenceFrame frame,
                                            final ReferenceFeature feature) {
        return buildNotationResult(variant, frame, feature, Utils.nonNull(feature, "feature").getName()).getNotations();
    }

    /**
     * @param variant the variant to describe.  Must not be {@code null}.
     * @param frame the coordinate system of the notations.  Must not be {@code null}.
     * @param feature the reference the positions are relative to.  Must not be {@code null}.
     * @param referenceName name written in front of the notations.  Must not be {@code null}.
     * @return one notation per distinct allele differing from the reference; empty if the variant is not within {@code feature}.
     * @throws VarAnnoException.UnsupportedReferenceFrame if {@code feature} cannot be described in {@code frame}.
     * @throws VarAnnoException.SequenceUnavailable if the reference sequence of {@code feature} cannot be read.
     */
    public List<HgvsNotation> buildNotations(final VariationFeature variant,
                                            final ReferenceFrame frame,
                                            final ReferenceFeature feature,
                                            final String referenceName) {
        return buildNotationResult(variant, frame, feature, referenceName).getNotations();
    }

    /**
     * Same as {@link #buildNotations(VariationFeature, ReferenceFrame, ReferenceFeature, String)}, but also reports
     * the alleles that were skipped because they are not plain nucleotide sequence.
     */
    public NotationResult buildNotationResult(final VariationFeature variant,
                                              final ReferenceFrame frame,
                                              final ReferenceFeature feature,
                                              final String referenceName) {
        Utils.nonNull(variant, "variant");
        Utils.nonNull(frame, "frame");
        Utils.nonNull(feature, "feature");
        Utils.nonNull(referenceName, "referenceName");
        assertFrameSupported(frame, feature);

        if ( !variant.getContig().equals(feature.getContig()) ) {
            logger.debug(variant.getName() + " is not on the contig of " + feature);
            return NotationResult.empty();
        }

        // Positions of the variant counted from the 5' end of the feature.
        final int featureStart = feature.getStrand() == Strand.POSITIVE ? feature.toFeaturePosition(variant.getStart()) : feature.toFeaturePosition(variant.getEnd());
        final int featureEnd = featureStart + variant.getLengthOnReference() - 1;
        if ( Math.min(featureStart, featureEnd) < 1 || Math.max(featureStart, featureEnd) > feature.getLengthOnReference() ) {
            logger.debug(variant.getName() + " is outside of " + feature);
            return NotationResult.empty();
        }

        final boolean reverseComplement = variant.getStrand() != feature.getStrand();
        final List<HgvsNotation> notations = new ArrayList<>();
        final Map<String, String> skippedAlleles = new LinkedHashMap<>();
        final Set<String> seenAlleles = new HashSet<>();

        for ( final String allele : variant.getAlleles() ) {
            if ( !AlleleNormalizer.isPlainAllele(allele) ) {
                final VarAnnoException.MalformedAllele malformed = new VarAnnoException.MalformedAllele(allele, "only A, C, G, T and - can be described");
                logger.warn("Skipping allele of " + variant.getName() + ": " + malformed.getMessage());
                skippedAlleles.put(allele, malformed.getMessage());
                continue;
            }

            final String featureAllele = AlleleNormalizer.stripGaps(reverseComplement ? AlleleNormalizer.reverseComplement(allele) : allele)
                    .toUpperCase(Locale.ROOT);
            if ( !seenAlleles.add(featureAllele) ) {
                continue;
            }

            final Optional<SequenceDiff> diff = diffAgainstReference(featureAllele, feature, featureStart, featureEnd);
            if ( !diff.isPresent() ) {
                continue;
            }

            final HgvsNotation notation = createNotation(allele, diff.get(), frame, feature, referenceName);
            logger.debug(variant.getName() + " allele " + allele + ": " + notation);
            notations.add(notation);
        }
        return new NotationResult(notations, skippedAlleles);
    }

    private static void assertFrameSupported(final ReferenceFrame frame, final ReferenceFeature feature) {
        if ( frame == ReferenceFrame.PROTEIN ) {
            throw new VarAnnoException.UnsupportedReferenceFrame(frame.getNumberingScheme(), feature.getName());
        }
        if ( frame == ReferenceFrame.CDNA && !feature.getExonMap().isPresent() ) {
            throw new VarAnnoException.UnsupportedReferenceFrame(frame.getNumberingScheme(), feature.getName());
        }
    }

    /**
     * Compare an allele with the reference span of the variant, reading as many bases before the span as the allele
     * has so that duplications can be recognised.
     */
    private Optional<SequenceDiff> diffAgainstReference(final String featureAllele,
                                                        final ReferenceFeature feature,
                                                        final int featureStart,
                                                        final int featureEnd) {
        int refStart = featureAllele.length() + 1;
        int refEnd = featureAllele.length() + (featureEnd - featureStart) + 1;
        int windowStart = featureStart - refStart;
        if ( windowStart < 0 ) {
            refStart += windowStart;
            refEnd += windowStart;
            windowStart = 0;
        }

        final String window = refEnd > 0 ? fetchFeatureSequence(feature, windowStart + 1, windowStart + refEnd) : "";
        return SequenceDiff.diff(featureAllele, window, refStart, refEnd, featureStart, featureEnd);
    }

    /**
     * @return the bases of {@code feature} between the given feature positions, read 5' to 3' on the strand of the feature.
     */
    private String fetchFeatureSequence(final ReferenceFeature feature, final int fromPosition, final int toPosition) {
        final int genomicStart = Math.min(feature.toGenomicPosition(fromPosition), feature.toGenomicPosition(toPosition));
        final int genomicEnd = Math.max(feature.toGenomicPosition(fromPosition), feature.toGenomicPosition(toPosition));

        final String bases = sequenceProvider.fetch(feature.getContig(), genomicStart, genomicEnd);
        if ( bases == null || bases.length() != genomicEnd - genomicStart + 1 ) {
            throw new VarAnnoException.SequenceUnavailable(feature.getContig(), genomicStart, genomicEnd);
        }
        return feature.getStrand() == Strand.NEGATIVE ? SequenceUtil.reverseComplement(bases) : bases;
    }

    private static HgvsNotation createNotation(final String allele,
                                               final SequenceDiff diff,
                                               final ReferenceFrame frame,
                                               final ReferenceFeature feature,
                                               final String referenceName) {
        if ( frame == ReferenceFrame.GENOMIC ) {
            return new HgvsNotation(allele, referenceName, frame.getNumberingScheme(),
                    String.valueOf(diff.getStart()), String.valueOf(diff.getEnd()), diff.getType(), diff.getRef(), diff.getAlt());
        }

        final ExonMap exonMap = feature.getExonMap().get();
        CdnaPosition start = CdnaCoordinateMapper.toCdna(feature.toGenomicPosition(diff.getStart()), exonMap);
        CdnaPosition end = CdnaCoordinateMapper.toCdna(feature.toGenomicPosition(diff.getEnd()), exonMap);
        if ( start.compareTo(end) > 0 ) {
            final CdnaPosition tmp = start;
            start = end;
            end = tmp;
        }
        final String numberingScheme = exonMap.isCoding() ? frame.getNumberingScheme() : "";
        return new HgvsNotation(allele, referenceName, numberingScheme,
                start.toString(), end.toString(), diff.getType(), diff.getRef(), diff.getAlt());
    }
}
