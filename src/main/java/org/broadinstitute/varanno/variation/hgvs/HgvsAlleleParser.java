package org.broadinstitute.varanno.variation.hgvs;

import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;
import org.broadinstitute.varanno.variation.AlleleNormalizer;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the reference and alternate alleles back out of a genomic or cDNA HGVS notation, e.g. when importing
 * variants that are only described by their notation.
 */
public final class HgvsAlleleParser {

    private static final String POSITION = "\\*?-?\\d+(?:[+-]\\d+)?";

    private static final Pattern NOTATION_PATTERN = Pattern.compile(
            "^(?:(.+):)?(?:([gcmnr])\\.)?(" + POSITION + ")(?:_(" + POSITION + "))?(.+)$");

    private static final Pattern SUBSTITUTION_PATTERN = Pattern.compile("^([ACGTN])>([ACGTN])$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DELETION_INSERTION_PATTERN = Pattern.compile("^del([ACGTN]*)ins([ACGTN]*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DELETION_PATTERN = Pattern.compile("^del([ACGTN]*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INSERTION_PATTERN = Pattern.compile("^ins([ACGTN]*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DUPLICATION_PATTERN = Pattern.compile("^dup([ACGTN]*)$", Pattern.CASE_INSENSITIVE);

    private HgvsAlleleParser() {}

    /**
     * The alleles encoded in a notation.  Bases a notation leaves out (as in {@code 7:g.100_102del}) are reported as
     * {@code null}; an allele that is absent by definition (the reference of an insertion) is the empty string.
     */
    public static final class ParsedNotation {
        private final String referenceName;
        private final String numberingScheme;
        private final String start;
        private final String end;
        private final HgvsVariantType type;
        private final String referenceAllele;
        private final String alternateAllele;

        ParsedNotation(final String referenceName, final String numberingScheme, final String start, final String end,
                       final HgvsVariantType type, final String referenceAllele, final String alternateAllele) {
            this.referenceName = referenceName;
            this.numberingScheme = numberingScheme;
            this.start = start;
            this.end = end;
            this.type = type;
            this.referenceAllele = referenceAllele;
            this.alternateAllele = alternateAllele;
        }

        /**
         * @return the reference name, or {@code null} if the notation has none.
         */
        public String getReferenceName() {
            return referenceName;
        }

        /**
         * @return the numbering scheme, empty if the notation has none.
         */
        public String getNumberingScheme() {
            return numberingScheme;
        }

        public String getStart() {
            return start;
        }

        /**
         * @return the end position, equal to {@link #getStart()} for single position notations.
         */
        public String getEnd() {
            return end;
        }

        public HgvsVariantType getType() {
            return type;
        }

        public String getReferenceAllele() {
            return referenceAllele;
        }

        public String getAlternateAllele() {
            return alternateAllele;
        }

        public boolean hasBothAlleles() {
            return referenceAllele != null && alternateAllele != null;
        }

        /**
         * @return {@code ref/alt}, with empty alleles written as {@code -}.
         * @throws IllegalStateException if one of the alleles is not given by the notation.
         */
        public String toAlleleString() {
            Utils.validate(hasBothAlleles(), () -> "The notation does not give both alleles");
            return toAllele(referenceAllele) + AlleleNormalizer.ALLELE_SEPARATOR + toAllele(alternateAllele);
        }

        private static String toAllele(final String bases) {
            return bases.isEmpty() ? AlleleNormalizer.GAP : bases;
        }
    }

    /**
     * @param notation a notation such as {@code 7:g.1234A>T}, {@code c.76_77insG} or {@code NM_000:c.88+2delAG}.  Must not be {@code null}.
     * @return the parts of {@code notation}.
     * @throws VarAnnoException.MalformedAllele if {@code notation} is not a nucleotide level notation this parser understands.
     */
    public static ParsedNotation parse(final String notation) {
        Utils.nonNull(notation, "notation");

        final Matcher matcher = NOTATION_PATTERN.matcher(notation.trim());
        if ( !matcher.matches() ) {
            throw new VarAnnoException.MalformedAllele(notation, "not an HGVS nucleotide notation");
        }

        final String referenceName = matcher.group(1);
        final String numberingScheme = matcher.group(2) == null ? "" : matcher.group(2);
        final String start = matcher.group(3);
        final String end = matcher.group(4) == null ? start : matcher.group(4);
        final String body = matcher.group(5);

        Matcher bodyMatcher = SUBSTITUTION_PATTERN.matcher(body);
        if ( bodyMatcher.matches() ) {
            return new ParsedNotation(referenceName, numberingScheme, start, end, HgvsVariantType.SUBSTITUTION,
                    upper(bodyMatcher.group(1)), upper(bodyMatcher.group(2)));
        }
        bodyMatcher = DELETION_INSERTION_PATTERN.matcher(body);
        if ( bodyMatcher.matches() ) {
            return new ParsedNotation(referenceName, numberingScheme, start, end, HgvsVariantType.DELETION_INSERTION,
                    givenOrNull(bodyMatcher.group(1)), givenOrNull(bodyMatcher.group(2)));
        }
        bodyMatcher = DELETION_PATTERN.matcher(body);
        if ( bodyMatcher.matches() ) {
            return new ParsedNotation(referenceName, numberingScheme, start, end, HgvsVariantType.DELETION,
                    givenOrNull(bodyMatcher.group(1)), "");
        }
        bodyMatcher = INSERTION_PATTERN.matcher(body);
        if ( bodyMatcher.matches() ) {
            return new ParsedNotation(referenceName, numberingScheme, start, end, HgvsVariantType.INSERTION,
                    "", givenOrNull(bodyMatcher.group(1)));
        }
        bodyMatcher = DUPLICATION_PATTERN.matcher(body);
        if ( bodyMatcher.matches() ) {
            final String duplicated = givenOrNull(bodyMatcher.group(1));
            return new ParsedNotation(referenceName, numberingScheme, start, end, HgvsVariantType.DUPLICATION,
                    duplicated, duplicated == null ? null : duplicated + duplicated);
        }
        throw new VarAnnoException.MalformedAllele(notation, "unsupported change '" + body + "'");
    }

    private static String givenOrNull(final String bases) {
        return bases.isEmpty() ? null : upper(bases);
    }

    private static String upper(final String bases) {
        return bases.toUpperCase(Locale.ROOT);
    }
}
