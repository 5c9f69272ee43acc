package org.broadinstitute.varanno.variation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evidence that a variant has been validated.
 * The declaration order is the order in which states are stored and reported.
 */
public enum ValidationState {
    CLUSTER("cluster"),
    FREQ("freq"),
    SUBMITTER("submitter"),
    DOUBLEHIT("doublehit"),
    HAPMAP("hapmap"),
    THOUSAND_GENOMES("1000Genome"),
    FAILED("failed"),
    PRECIOUS("precious");

    private static final Logger logger = LogManager.getLogger(ValidationState.class);

    private final String label;

    ValidationState(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Look up a state by its label, ignoring case.
     * @param label the label of the state (e.g. {@code "doublehit"}).
     * @return the matching state, or empty (with a warning logged) if {@code label} is not a recognised state.
     */
    public static Optional<ValidationState> fromLabel(final String label) {
        if ( label != null ) {
            final String lowerCaseLabel = label.toLowerCase(Locale.ROOT);
            for ( final ValidationState state : values() ) {
                if ( state.label.toLowerCase(Locale.ROOT).equals(lowerCaseLabel) ) {
                    return Optional.of(state);
                }
            }
        }
        logger.warn(label + " is not a recognised validation status. Recognised validation states are: "
                + EnumSet.allOf(ValidationState.class).stream().map(ValidationState::getLabel).collect(Collectors.joining(" ")));
        return Optional.empty();
    }

    /**
     * @param states any set of states.
     * @return the labels of {@code states} in declaration order.
     */
    public static List<String> toLabels(final Set<ValidationState> states) {
        return EnumSet.copyOf(states.isEmpty() ? EnumSet.noneOf(ValidationState.class) : states).stream()
                .map(ValidationState::getLabel)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return label;
    }
}
