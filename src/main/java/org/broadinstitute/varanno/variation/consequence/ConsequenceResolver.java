package org.broadinstitute.varanno.variation.consequence;

import org.broadinstitute.varanno.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Folds the per-transcript consequences of a variant into a single list.
 *
 * <p>
 *     Tags compete in three independent buckets: regulatory region, splice site and consequence type.  For every
 *     bucket the most severe tag seen in any annotation wins, and the result lists the winners in the fixed order
 *     regulatory region, splice site, type.  The type bucket always has a winner since it defaults to
 *     {@link ConsequenceType#INTERGENIC}; the other two only appear when some annotation carries one of their tags.
 * </p>
 *
 * Resolution is order independent and associative, so partial results can be resolved again with more annotations.
 */
public final class ConsequenceResolver {

    private ConsequenceResolver() {}

    /**
     * @param annotations per-transcript annotations.  Must not be {@code null}.
     * @return the resolved consequences; {@code [INTERGENIC]} if there are no tags at all.
     */
    public static ConsequenceSet resolve(final Collection<ConsequenceSet> annotations) {
        Utils.nonNull(annotations, "annotations");
        Utils.containsNoNull(annotations, "annotations must not contain null");

        ConsequenceType highestRegulatory = null;
        ConsequenceType highestSplice = null;
        ConsequenceType highestType = ConsequenceType.INTERGENIC;

        for ( final ConsequenceSet annotation : annotations ) {
            for ( final ConsequenceType type : annotation.getTypes() ) {
                switch ( type.getBucket() ) {
                    case REGULATORY_REGION:
                        highestRegulatory = mostSevere(highestRegulatory, type);
                        break;
                    case SPLICE_SITE:
                        highestSplice = mostSevere(highestSplice, type);
                        break;
                    default:
                        highestType = mostSevere(highestType, type);
                        break;
                }
            }
        }

        final List<ConsequenceType> resolved = new ArrayList<>(3);
        if ( highestRegulatory != null ) {
            resolved.add(highestRegulatory);
        }
        if ( highestSplice != null ) {
            resolved.add(highestSplice);
        }
        resolved.add(highestType);
        return new ConsequenceSet(null, resolved);
    }

    /**
     * Resolve only the annotations of the given transcripts, e.g. the transcripts of one gene.
     * Annotations without a transcript identifier are ignored.
     * @param annotations per-transcript annotations.  Must not be {@code null}.
     * @param transcriptIds transcripts to keep.  Must not be {@code null}.
     * @return the resolved consequences of the selected annotations; {@code [INTERGENIC]} if none are selected.
     */
    public static ConsequenceSet resolve(final Collection<ConsequenceSet> annotations, final Set<String> transcriptIds) {
        Utils.nonNull(annotations, "annotations");
        Utils.nonNull(transcriptIds, "transcriptIds");

        final List<ConsequenceSet> selected = new ArrayList<>();
        for ( final ConsequenceSet annotation : annotations ) {
            if ( annotation.getTranscriptId().map(transcriptIds::contains).orElse(false) ) {
                selected.add(annotation);
            }
        }
        return resolve(selected);
    }

    /**
     * The single most severe tag over all annotations, ranked on the whole vocabulary, for display purposes.
     * @param annotations per-transcript annotations.  Must not be {@code null}.
     * @return the most severe tag, {@link ConsequenceType#INTERGENIC} if there are none.
     */
    public static ConsequenceType displayConsequence(final Collection<ConsequenceSet> annotations) {
        Utils.nonNull(annotations, "annotations");

        ConsequenceType highest = ConsequenceType.INTERGENIC;
        for ( final ConsequenceSet annotation : annotations ) {
            for ( final ConsequenceType type : annotation.getTypes() ) {
                if ( ConsequenceType.getRankTable().get(type) < ConsequenceType.getRankTable().get(highest) ) {
                    highest = type;
                }
            }
        }
        return highest;
    }

    private static ConsequenceType mostSevere(final ConsequenceType current, final ConsequenceType candidate) {
        return current == null || candidate.getBucketRank() < current.getBucketRank() ? candidate : current;
    }
}
