package org.broadinstitute.varanno.variation.consequence;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.varanno.utils.Utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An ordered list of consequence tags, either the annotation of a variant on one transcript (in which case it may
 * carry the transcript identifier) or the result of resolving several such annotations.
 */
public final class ConsequenceSet {

    private final String transcriptId;
    private final ImmutableList<ConsequenceType> types;

    public ConsequenceSet(final String transcriptId, final Collection<ConsequenceType> types) {
        Utils.containsNoNull(types, "types must not contain null");
        this.transcriptId = transcriptId;
        this.types = ImmutableList.copyOf(types);
    }

    public static ConsequenceSet of(final ConsequenceType... types) {
        return new ConsequenceSet(null, Arrays.asList(types));
    }

    public static ConsequenceSet forTranscript(final String transcriptId, final ConsequenceType... types) {
        return new ConsequenceSet(Utils.nonEmpty(transcriptId, "transcriptId"), Arrays.asList(types));
    }

    /**
     * @param transcriptId identifier of the annotated transcript, or {@code null}.
     * @param labels consequence labels such as {@code INTRONIC}; unknown labels are logged and dropped.
     */
    public static ConsequenceSet fromLabels(final String transcriptId, final List<String> labels) {
        Utils.nonNull(labels, "labels");
        return new ConsequenceSet(transcriptId, labels.stream()
                .map(ConsequenceType::tryParse)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList()));
    }

    public Optional<String> getTranscriptId() {
        return Optional.ofNullable(transcriptId);
    }

    public List<ConsequenceType> getTypes() {
        return types;
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    /**
     * @return the labels of the tags, in order.
     */
    public List<String> getLabels() {
        return types.stream().map(ConsequenceType::getLabel).collect(Collectors.toList());
    }

    @Override
    public boolean equals(final Object o) {
        if ( this == o ) {
            return true;
        }
        if ( o == null || getClass() != o.getClass() ) {
            return false;
        }
        final ConsequenceSet that = (ConsequenceSet) o;
        return Objects.equals(transcriptId, that.transcriptId) && types.equals(that.types);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transcriptId, types);
    }

    @Override
    public String toString() {
        return (transcriptId == null ? "" : transcriptId + ":") + types;
    }
}
