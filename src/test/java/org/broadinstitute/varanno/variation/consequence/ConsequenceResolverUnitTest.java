package org.broadinstitute.varanno.variation.consequence;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import org.broadinstitute.varanno.testutils.VarAnnoBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.broadinstitute.varanno.variation.consequence.ConsequenceType.*;

public final class ConsequenceResolverUnitTest extends VarAnnoBaseTest {

    @DataProvider
    public Object[][] provideForTestResolve() {
        return new Object[][] {
                {Collections.emptyList(), Collections.singletonList(INTERGENIC)},
                {Collections.singletonList(ConsequenceSet.of()), Collections.singletonList(INTERGENIC)},
                {Arrays.asList(ConsequenceSet.of(ESSENTIAL_SPLICE_SITE), ConsequenceSet.of(STOP_GAINED)),
                        Arrays.asList(ESSENTIAL_SPLICE_SITE, STOP_GAINED)},
                {Arrays.asList(ConsequenceSet.of(INTRONIC, SPLICE_SITE), ConsequenceSet.of(REGULATORY_REGION), ConsequenceSet.of(NON_SYNONYMOUS_CODING)),
                        Arrays.asList(REGULATORY_REGION, SPLICE_SITE, NON_SYNONYMOUS_CODING)},
                {Arrays.asList(ConsequenceSet.of(SPLICE_SITE), ConsequenceSet.of(ESSENTIAL_SPLICE_SITE)),
                        Arrays.asList(ESSENTIAL_SPLICE_SITE, INTERGENIC)},
                {Arrays.asList(ConsequenceSet.of(UPSTREAM), ConsequenceSet.of(FIVE_PRIME_UTR, INTRONIC), ConsequenceSet.of(DOWNSTREAM)),
                        Collections.singletonList(FIVE_PRIME_UTR)},
                {Collections.singletonList(ConsequenceSet.of(SYNONYMOUS_CODING, FRAMESHIFT_CODING, STOP_LOST)),
                        Collections.singletonList(STOP_LOST)},
        };
    }

    @Test(dataProvider = "provideForTestResolve")
    public void testResolve(final List<ConsequenceSet> annotations, final List<ConsequenceType> expected) {
        final ConsequenceSet resolved = ConsequenceResolver.resolve(annotations);
        Assert.assertEquals(resolved.getTypes(), expected);
        Assert.assertFalse(resolved.getTranscriptId().isPresent());
    }

    @Test
    public void testResolveIgnoresOrder() {
        final List<ConsequenceSet> annotations = Arrays.asList(
                ConsequenceSet.of(INTRONIC, SPLICE_SITE),
                ConsequenceSet.of(REGULATORY_REGION),
                ConsequenceSet.of(THREE_PRIME_UTR),
                ConsequenceSet.of(SYNONYMOUS_CODING, ESSENTIAL_SPLICE_SITE));
        final ConsequenceSet expected = ConsequenceResolver.resolve(annotations);
        Assert.assertEquals(expected.getTypes(), Arrays.asList(REGULATORY_REGION, ESSENTIAL_SPLICE_SITE, SYNONYMOUS_CODING));

        for ( final List<ConsequenceSet> permutation : permutations(annotations) ) {
            Assert.assertEquals(ConsequenceResolver.resolve(permutation), expected);
        }
    }

    @Test
    public void testResolveIsAssociative() {
        final List<ConsequenceSet> first = Arrays.asList(ConsequenceSet.of(INTRONIC), ConsequenceSet.of(SPLICE_SITE));
        final List<ConsequenceSet> second = Arrays.asList(ConsequenceSet.of(REGULATORY_REGION), ConsequenceSet.of(STOP_GAINED, UPSTREAM));

        final List<ConsequenceSet> all = new ArrayList<>(first);
        all.addAll(second);

        final ConsequenceSet stepwise = ConsequenceResolver.resolve(Arrays.asList(ConsequenceResolver.resolve(first), ConsequenceResolver.resolve(second)));
        Assert.assertEquals(stepwise, ConsequenceResolver.resolve(all));
    }

    @Test
    public void testResolveSelectedTranscripts() {
        final List<ConsequenceSet> annotations = Arrays.asList(
                ConsequenceSet.forTranscript("ENST01", INTRONIC),
                ConsequenceSet.forTranscript("ENST02", STOP_GAINED),
                ConsequenceSet.forTranscript("ENST03", SPLICE_SITE),
                ConsequenceSet.of(FRAMESHIFT_CODING));

        Assert.assertEquals(ConsequenceResolver.resolve(annotations, ImmutableSet.of("ENST01", "ENST03")).getTypes(),
                Arrays.asList(SPLICE_SITE, INTRONIC));
        Assert.assertEquals(ConsequenceResolver.resolve(annotations, ImmutableSet.of("ENST02")).getTypes(),
                Collections.singletonList(STOP_GAINED));
        Assert.assertEquals(ConsequenceResolver.resolve(annotations, Collections.emptySet()).getTypes(),
                Collections.singletonList(INTERGENIC));
    }

    @DataProvider
    public Object[][] provideForTestDisplayConsequence() {
        return new Object[][] {
                {Collections.emptyList(), INTERGENIC},
                {Arrays.asList(ConsequenceSet.of(INTRONIC), ConsequenceSet.of(SPLICE_SITE)), SPLICE_SITE},
                {Arrays.asList(ConsequenceSet.of(REGULATORY_REGION), ConsequenceSet.of(SYNONYMOUS_CODING)), SYNONYMOUS_CODING},
                {Arrays.asList(ConsequenceSet.of(REGULATORY_REGION), ConsequenceSet.of(UPSTREAM)), REGULATORY_REGION},
                {Collections.singletonList(ConsequenceSet.of(STOP_GAINED, ESSENTIAL_SPLICE_SITE)), ESSENTIAL_SPLICE_SITE},
        };
    }

    @Test(dataProvider = "provideForTestDisplayConsequence")
    public void testDisplayConsequence(final List<ConsequenceSet> annotations, final ConsequenceType expected) {
        Assert.assertEquals(ConsequenceResolver.displayConsequence(annotations), expected);
    }

    private static <T> List<List<T>> permutations(final List<T> items) {
        if ( items.isEmpty() ) {
            return Collections.singletonList(Collections.emptyList());
        }
        final List<List<T>> result = new ArrayList<>();
        for ( int i = 0; i < items.size(); ++i ) {
            final List<T> rest = new ArrayList<>(items);
            final T head = rest.remove(i);
            for ( final List<T> tail : permutations(rest) ) {
                final List<T> permutation = Lists.newArrayList(head);
                permutation.addAll(tail);
                result.add(permutation);
            }
        }
        return result;
    }
}
