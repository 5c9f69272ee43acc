package org.broadinstitute.varanno.variation.hgvs;

import org.broadinstitute.varanno.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The notations built for the alleles of a variant, together with the alleles that could not be described and why.
 */
public final class NotationResult {

    private final List<HgvsNotation> notations;
    private final Map<String, String> skippedAlleles;

    public NotationResult(final List<HgvsNotation> notations, final Map<String, String> skippedAlleles) {
        this.notations = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(notations, "notations")));
        this.skippedAlleles = Collections.unmodifiableMap(new LinkedHashMap<>(Utils.nonNull(skippedAlleles, "skippedAlleles")));
    }

    public static NotationResult empty() {
        return new NotationResult(Collections.emptyList(), Collections.emptyMap());
    }

    /**
     * @return one notation per distinct allele that differs from the reference, in allele order.
     */
    public List<HgvsNotation> getNotations() {
        return notations;
    }

    /**
     * @return alleles that were not described, mapped to the reason, in allele order.
     */
    public Map<String, String> getSkippedAlleles() {
        return skippedAlleles;
    }
}
