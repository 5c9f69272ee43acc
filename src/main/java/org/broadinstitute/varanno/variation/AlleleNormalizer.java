package org.broadinstitute.varanno.variation;

import htsjdk.tribble.annotation.Strand;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Nucleotide;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.utils.config.VarAnnoConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonicalizes allele strings ({@code ref/alt[/alt...]}) and detects alleles that cannot be trusted as literal bases.
 *
 * <p>
 *     Normalization only ever transforms the content of each allele: the order of the alleles, and so which one is the
 *     reference, never changes.  Very long alleles are replaced by a symbolic {@code <N>_base_deletion} form that keeps
 *     only their length.
 * </p>
 */
public final class AlleleNormalizer {

    private static final Logger logger = LogManager.getLogger(AlleleNormalizer.class);

    /**
     * Marker for "no sequence" in an allele string, as in {@code -/AG} for an insertion.
     */
    public static final String GAP = "-";

    /**
     * Separator written between alleles.
     */
    public static final String ALLELE_SEPARATOR = "/";

    /**
     * Separators accepted when reading an allele string.
     */
    public static final String ALLELE_SEPARATORS = "/|\\";

    public static final String SYMBOLIC_DELETION_SUFFIX = "_base_deletion";

    public static final int DEFAULT_SYMBOLIC_DELETION_THRESHOLD = 4000;
    public static final int DEFAULT_STORED_ALLELE_MAX_LENGTH = 100;

    private static final Pattern SYMBOLIC_DELETION_PATTERN = Pattern.compile("^(\\d+)" + SYMBOLIC_DELETION_SUFFIX + "$");
    private static final Pattern NAMED_CHANGE_PATTERN = Pattern.compile("deletion|insertion", Pattern.CASE_INSENSITIVE);

    private static final Set<String> FOUR_BASES = Set.of("A", "C", "G", "T");

    private final int symbolicDeletionThreshold;
    private final int storedAlleleMaxLength;

    public AlleleNormalizer() {
        this(DEFAULT_SYMBOLIC_DELETION_THRESHOLD, DEFAULT_STORED_ALLELE_MAX_LENGTH);
    }

    public AlleleNormalizer(final VarAnnoConfig config) {
        this(Utils.nonNull(config, "config").symbolicDeletionThreshold(), config.storedAlleleMaxLength());
    }

    /**
     * @param symbolicDeletionThreshold alleles longer than this become {@code <N>_base_deletion} in allele strings.
     * @param storedAlleleMaxLength alleles longer than this become {@code <N>_base_deletion} in per-allele records.
     */
    public AlleleNormalizer(final int symbolicDeletionThreshold, final int storedAlleleMaxLength) {
        Utils.validateArg(symbolicDeletionThreshold > 0, "symbolicDeletionThreshold must be positive");
        Utils.validateArg(storedAlleleMaxLength > 0, "storedAlleleMaxLength must be positive");
        this.symbolicDeletionThreshold = symbolicDeletionThreshold;
        this.storedAlleleMaxLength = storedAlleleMaxLength;
    }

    public int getSymbolicDeletionThreshold() {
        return symbolicDeletionThreshold;
    }

    //==================================================================================================================
    // Normalization:

    /**
     * Bring an allele string onto the forward strand and collapse over-long alleles.
     * @param rawAlleleString alleles separated by {@code /}.  Must not be {@code null}.
     * @param strand strand on which {@code rawAlleleString} is expressed.  Must be {@link Strand#POSITIVE} or {@link Strand#NEGATIVE}.
     * @return the normalized allele string, alleles in their original order.
     */
    public String normalize(final String rawAlleleString, final Strand strand) {
        Utils.nonNull(rawAlleleString, "rawAlleleString");
        VariationFeature.assertValidStrand(strand);

        final List<String> normalized = new ArrayList<>();
        for ( final String allele : splitAlleles(rawAlleleString) ) {
            String current = allele;
            if ( strand == Strand.NEGATIVE && isNucleotideSequence(current) ) {
                current = reverseComplement(current);
            }
            if ( !isSymbolic(current) && current.length() > symbolicDeletionThreshold ) {
                current = toSymbolic(current.length());
            }
            normalized.add(current);
        }
        return String.join(ALLELE_SEPARATOR, normalized);
    }

    /**
     * Normalize the allele string of a variant.  The returned variant is on the forward strand.
     * @param variant variant to normalize.  Must not be {@code null}.
     * @return a copy of {@code variant} with a normalized allele string.
     */
    public VariationFeature normalize(final VariationFeature variant) {
        Utils.nonNull(variant, "variant");
        final String normalized = normalize(variant.getAlleleString(), variant.getStrand());
        if ( variant.getStrand() == Strand.POSITIVE && normalized.equals(variant.getAlleleString()) ) {
            return variant;
        }
        logger.debug("Normalized " + variant.getName() + ": " + variant.getAlleleString() + " (" + variant.getStrand() + ") -> " + normalized);
        return variant.toBuilder().alleleString(normalized).strand(Strand.POSITIVE).make();
    }

    /**
     * Per-allele storage form: alleles longer than the stored maximum become symbolic, named changes are kept as they are
     * and everything else is upper-cased.
     * @param allele a single allele.  Must not be {@code null}.
     * @return the allele as it should be persisted.
     */
    public String toStoredAllele(final String allele) {
        Utils.nonNull(allele, "allele");
        if ( allele.length() > storedAlleleMaxLength ) {
            return toSymbolic(allele.length());
        }
        if ( NAMED_CHANGE_PATTERN.matcher(allele).find() ) {
            return allele;
        }
        return allele.toUpperCase(Locale.ROOT);
    }

    //==================================================================================================================
    // Static helpers:

    /**
     * @param alleleString alleles separated by {@code /}, {@code |} or {@code \}.  Must not be {@code null}.
     * @return the individual alleles, in order.
     */
    public static List<String> splitAlleles(final String alleleString) {
        return Utils.split(Utils.nonNull(alleleString, "alleleString"), ALLELE_SEPARATORS);
    }

    /**
     * Reverse complement an allele.  IUPAC ambiguity codes are complemented (e.g. {@code R} becomes {@code Y}),
     * gaps are kept, and the case of each base is preserved.
     * @param allele allele made of nucleotide codes and gaps.  Must not be {@code null}.
     * @return the reverse complement of {@code allele}.
     * @throws VarAnnoException.MalformedAllele if {@code allele} contains something other than nucleotide codes and gaps.
     */
    public static String reverseComplement(final String allele) {
        Utils.nonNull(allele, "allele");
        final StringBuilder sb = new StringBuilder(allele.length());
        for ( int i = allele.length() - 1; i >= 0; --i ) {
            final char c = allele.charAt(i);
            if ( c == '-' ) {
                sb.append(c);
                continue;
            }
            final Nucleotide nucleotide = Nucleotide.decode(c);
            if ( !nucleotide.isValid() ) {
                throw new VarAnnoException.MalformedAllele(allele, "cannot complement '" + c + "'");
            }
            final char complement = nucleotide.complement().encodeAsChar();
            sb.append(Character.isLowerCase(c) ? Character.toLowerCase(complement) : complement);
        }
        return sb.toString();
    }

    /**
     * @return {@code true} iff {@code allele} is non-empty and made only of nucleotide codes (ambiguity codes included) and gaps.
     */
    public static boolean isNucleotideSequence(final String allele) {
        if ( StringUtils.isEmpty(allele) ) {
            return false;
        }
        for ( int i = 0; i < allele.length(); ++i ) {
            final char c = allele.charAt(i);
            if ( c != '-' && !Nucleotide.decode(c).isValid() ) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return {@code true} iff {@code allele} is empty, a gap, or made only of the bases A, C, G and T (any case) and gaps.
     */
    public static boolean isPlainAllele(final String allele) {
        Utils.nonNull(allele, "allele");
        for ( int i = 0; i < allele.length(); ++i ) {
            final char c = allele.charAt(i);
            if ( c != '-' && !Nucleotide.decode(c).isStandard() ) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the allele with any gap characters removed, so a gap becomes the empty string.
     */
    public static String stripGaps(final String allele) {
        return StringUtils.remove(Utils.nonNull(allele, "allele"), '-');
    }

    public static boolean isSymbolic(final String allele) {
        return allele != null && SYMBOLIC_DELETION_PATTERN.matcher(allele).matches();
    }

    /**
     * @param allele an allele of the form {@code <N>_base_deletion}.
     * @return {@code N}.
     */
    public static int symbolicLength(final String allele) {
        final Matcher matcher = SYMBOLIC_DELETION_PATTERN.matcher(Utils.nonNull(allele, "allele"));
        Utils.validateArg(matcher.matches(), () -> allele + " is not a symbolic allele");
        return Integer.parseInt(matcher.group(1));
    }

    public static String toSymbolic(final int length) {
        Utils.validateArg(length > 0, "length must be positive");
        return length + SYMBOLIC_DELETION_SUFFIX;
    }

    /**
     * Length of the sequence an allele stands for: the recorded length for symbolic alleles, 0 for a gap.
     */
    public static int sequenceLength(final String allele) {
        return isSymbolic(allele) ? symbolicLength(allele) : stripGaps(allele).length();
    }

    /**
     * Detects an allele string listing every one of the four bases, i.e. a call of "any base".
     * @param alleleString alleles separated by {@code /}.  Must not be {@code null}.
     * @return {@code true} iff the alleles are exactly A, C, G and T in some order (any case).
     */
    public static boolean checkFourBases(final String alleleString) {
        final List<String> alleles = splitAlleles(alleleString);
        if ( alleles.size() != FOUR_BASES.size() ) {
            return false;
        }
        final Set<String> distinct = new HashSet<>();
        for ( final String allele : alleles ) {
            distinct.add(allele.toUpperCase(Locale.ROOT));
        }
        return distinct.equals(FOUR_BASES);
    }

    /**
     * @param alleleString alleles separated by {@code /}.  Must not be {@code null}.
     * @return {@code true} iff any non-symbolic allele contains an IUPAC ambiguity code.
     */
    public static boolean checkForAmbiguousAlleles(final String alleleString) {
        return !findAmbiguousAlleles(alleleString).isEmpty();
    }

    /**
     * @param alleleString alleles separated by {@code /}.  Must not be {@code null}.
     * @return the alleles that contain an IUPAC ambiguity code, in order.  Symbolic and named alleles
     * (e.g. {@code LARGEDELETION}) are never reported.
     */
    public static List<String> findAmbiguousAlleles(final String alleleString) {
        return splitAlleles(alleleString).stream()
                .filter(AlleleNormalizer::isAmbiguous)
                .collect(Collectors.toList());
    }

    /**
     * Drop every allele containing an IUPAC ambiguity code.
     * @param alleleString alleles separated by {@code /}.  Must not be {@code null}.
     * @return the remaining alleles joined by {@code /}; empty if none remain.
     */
    public static String removeAmbiguousAlleles(final String alleleString) {
        return splitAlleles(alleleString).stream()
                .filter(allele -> !isAmbiguous(allele))
                .collect(Collectors.joining(ALLELE_SEPARATOR));
    }

    private static boolean isAmbiguous(final String allele) {
        if ( !isNucleotideSequence(allele) ) {
            return false;
        }
        for ( int i = 0; i < allele.length(); ++i ) {
            if ( Nucleotide.decode(allele.charAt(i)).isAmbiguous() ) {
                return true;
            }
        }
        return false;
    }
}
