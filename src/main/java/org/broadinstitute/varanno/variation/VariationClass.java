package org.broadinstitute.varanno.variation;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.varanno.utils.Utils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * dbSNP-style class of a variant, derived from its allele string alone.
 */
public enum VariationClass {
    SNP("snp"),
    IN_DEL("in-del"),
    MNP("mnp"),
    NAMED("named"),
    MIXED("mixed"),
    MICROSAT("microsat"),
    HET("het"),
    CNV("cnv"),
    CNV_PROBE("cnv probe"),
    HGMD_MUTATION("hgmd_mutation");

    private static final Pattern SNP_PATTERN = Pattern.compile("^[ACGTN]([|\\\\/][ACGTN])+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEQUENCE_PATTERN = Pattern.compile("^[ACGTN]+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMED_PATTERN = Pattern.compile("LARGE|INS|DEL");
    private static final Pattern DIGIT_PATTERN = Pattern.compile("\\d");

    private final String label;

    VariationClass(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Classify an allele string such as {@code A/G}, {@code -/CA} or {@code (CA)14/25/26}.
     * @param alleleString alleles separated by {@code /}, {@code |} or {@code \}.  Must not be {@code null}.
     * @return the class of the variant, never {@code null}.
     */
    public static VariationClass classify(final String alleleString) {
        Utils.nonNull(alleleString, "alleleString");

        if ( SNP_PATTERN.matcher(alleleString).matches() ) {
            return SNP;
        }
        if ( alleleString.equals("cnv") ) {
            return CNV;
        }
        final String upperCase = alleleString.toUpperCase(Locale.ROOT);
        if ( upperCase.contains("CNV_PROBE") ) {
            return CNV_PROBE;
        }
        if ( upperCase.contains("HGMD_MUTATION") ) {
            return HGMD_MUTATION;
        }

        final List<String> alleles = AlleleNormalizer.splitAlleles(alleleString);
        if ( alleles.size() == 1 ) {
            return HET;
        }
        if ( alleles.size() == 2 ) {
            final String first = alleles.get(0);
            final String second = alleles.get(1);
            if ( (isSequence(first) && AlleleNormalizer.GAP.equals(second)) || (AlleleNormalizer.GAP.equals(first) && isSequence(second)) ) {
                return IN_DEL;
            }
            if ( NAMED_PATTERN.matcher(first).find() || NAMED_PATTERN.matcher(second).find() ) {
                return NAMED;
            }
            if ( countBases(first) > 1 || countBases(second) > 1 ) {
                return MNP;
            }
            return MIXED;
        }

        if ( DIGIT_PATTERN.matcher(alleles.get(0)).find() ) {
            return MICROSAT;
        }
        if ( alleles.stream().allMatch(VariationClass::isSequence) ) {
            return MNP;
        }
        return MIXED;
    }

    private static boolean isSequence(final String allele) {
        return SEQUENCE_PATTERN.matcher(allele).matches();
    }

    private static int countBases(final String allele) {
        return allele.length() - StringUtils.replaceChars(allele.toUpperCase(Locale.ROOT), "ACGT", "").length();
    }

    @Override
    public String toString() {
        return label;
    }
}
