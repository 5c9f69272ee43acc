package org.broadinstitute.varanno.variation.consequence;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.utils.Utils;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The closed vocabulary of consequences a variant can have on a transcript, ranked by severity.
 * A lower rank is more severe.  The ranking is data: it is published by {@link #getRankTable()} and versioned by
 * {@link #RANK_TABLE_VERSION}, and comparisons go through {@link #getRank()} rather than the declaration order.
 */
public enum ConsequenceType {
    ESSENTIAL_SPLICE_SITE("ESSENTIAL_SPLICE_SITE", 1, Bucket.SPLICE_SITE, 1),
    STOP_GAINED("STOP_GAINED", 2, Bucket.TYPE, 0),
    STOP_LOST("STOP_LOST", 3, Bucket.TYPE, 0),
    FRAMESHIFT_CODING("FRAMESHIFT_CODING", 4, Bucket.TYPE, 0),
    NON_SYNONYMOUS_CODING("NON_SYNONYMOUS_CODING", 5, Bucket.TYPE, 0),
    SPLICE_SITE("SPLICE_SITE", 6, Bucket.SPLICE_SITE, 2),
    SYNONYMOUS_CODING("SYNONYMOUS_CODING", 7, Bucket.TYPE, 0),
    REGULATORY_REGION("REGULATORY_REGION", 8, Bucket.REGULATORY_REGION, 1),
    FIVE_PRIME_UTR("5PRIME_UTR", 9, Bucket.TYPE, 0),
    THREE_PRIME_UTR("3PRIME_UTR", 10, Bucket.TYPE, 0),
    INTRONIC("INTRONIC", 11, Bucket.TYPE, 0),
    UPSTREAM("UPSTREAM", 12, Bucket.TYPE, 0),
    DOWNSTREAM("DOWNSTREAM", 13, Bucket.TYPE, 0),
    INTERGENIC("INTERGENIC", 14, Bucket.TYPE, 0);

    /**
     * Version of the ranking below.  Bump it whenever a rank changes.
     */
    public static final int RANK_TABLE_VERSION = 1;

    private static final Logger logger = LogManager.getLogger(ConsequenceType.class);

    private static final ImmutableMap<ConsequenceType, Integer> RANK_TABLE;
    private static final ImmutableMap<String, ConsequenceType> BY_LABEL;

    static {
        final ImmutableMap.Builder<ConsequenceType, Integer> ranks = ImmutableMap.builder();
        final ImmutableMap.Builder<String, ConsequenceType> labels = ImmutableMap.builder();
        for ( final ConsequenceType type : values() ) {
            ranks.put(type, type.rank);
            labels.put(type.label, type);
        }
        RANK_TABLE = ranks.build();
        BY_LABEL = labels.build();
    }

    /**
     * Which of the independent slots of a resolved consequence list a type competes for.
     */
    public enum Bucket {
        REGULATORY_REGION,
        SPLICE_SITE,
        TYPE
    }

    private final String label;
    private final int rank;
    private final Bucket bucket;
    private final int bucketRank;

    ConsequenceType(final String label, final int rank, final Bucket bucket, final int bucketRank) {
        this.label = label;
        this.rank = rank;
        this.bucket = bucket;
        this.bucketRank = bucketRank;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return severity rank over the whole vocabulary; 1 is the most severe.
     */
    public int getRank() {
        return rank;
    }

    public Bucket getBucket() {
        return bucket;
    }

    /**
     * @return severity within {@link #getBucket()}.  Splice sites rank {@link #ESSENTIAL_SPLICE_SITE} before
     * {@link #SPLICE_SITE}; the type bucket uses {@link #getRank()}.
     */
    public int getBucketRank() {
        return bucket == Bucket.TYPE ? rank : bucketRank;
    }

    /**
     * @return every type mapped to its rank, most severe first.
     */
    public static ImmutableMap<ConsequenceType, Integer> getRankTable() {
        return RANK_TABLE;
    }

    /**
     * @param label a label such as {@code 5PRIME_UTR} or {@code NON_SYNONYMOUS_CODING}.
     * @return the type with that label.
     * @throws IllegalArgumentException if {@code label} is not part of the vocabulary.
     */
    public static ConsequenceType fromLabel(final String label) {
        Utils.nonNull(label, "label");
        final ConsequenceType type = BY_LABEL.get(label);
        Utils.validateArg(type != null, () -> label + " is not an allowed consequence type. The allowed types are: " + allowedLabels());
        return type;
    }

    /**
     * Lenient version of {@link #fromLabel(String)}: unknown labels are logged and ignored.
     * @return the type with that label, or empty.
     */
    public static Optional<ConsequenceType> tryParse(final String label) {
        final ConsequenceType type = label == null ? null : BY_LABEL.get(label);
        if ( type == null ) {
            logger.warn("Ignoring consequence type " + label + ". The allowed types are: " + allowedLabels());
        }
        return Optional.ofNullable(type);
    }

    private static String allowedLabels() {
        return Arrays.stream(values()).map(ConsequenceType::getLabel).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return label;
    }
}
