package org.broadinstitute.varanno.variation.qc;

import org.broadinstitute.varanno.utils.Utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of {@link QcFailureReason}s attached to a variant.  An empty set means the variant passed every check
 * that was performed.
 */
public final class QcFailureSet {

    public static final QcFailureSet PASSED = new QcFailureSet(EnumSet.noneOf(QcFailureReason.class));

    private final Set<QcFailureReason> reasons;

    private QcFailureSet(final EnumSet<QcFailureReason> reasons) {
        this.reasons = Collections.unmodifiableSet(reasons);
    }

    public static QcFailureSet of(final QcFailureReason... reasons) {
        return of(Arrays.asList(reasons));
    }

    public static QcFailureSet of(final Collection<QcFailureReason> reasons) {
        Utils.containsNoNull(reasons, "reasons must not contain null");
        return reasons.isEmpty() ? PASSED : new QcFailureSet(EnumSet.copyOf(reasons));
    }

    public boolean isPassed() {
        return reasons.isEmpty();
    }

    public boolean contains(final QcFailureReason reason) {
        return reasons.contains(reason);
    }

    public Set<QcFailureReason> getReasons() {
        return reasons;
    }

    /**
     * @return the failure codes in ascending order.
     */
    public List<Integer> getCodes() {
        return reasons.stream().map(QcFailureReason::getCode).sorted().collect(Collectors.toList());
    }

    @Override
    public boolean equals(final Object o) {
        if ( this == o ) {
            return true;
        }
        if ( o == null || getClass() != o.getClass() ) {
            return false;
        }
        return reasons.equals(((QcFailureSet) o).reasons);
    }

    @Override
    public int hashCode() {
        return reasons.hashCode();
    }

    /**
     * @return the codes joined by commas, e.g. {@code 2,14}; empty if passed.
     */
    @Override
    public String toString() {
        return getCodes().stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
