package org.broadinstitute.varanno.variation.qc;

import com.google.common.collect.ImmutableMap;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.testutils.InMemorySequenceProvider;
import org.broadinstitute.varanno.testutils.VarAnnoBaseTest;
import org.broadinstitute.varanno.variation.VariationFeature;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class ReferenceCheckerUnitTest extends VarAnnoBaseTest {

    private static InMemorySequenceProvider createProvider() {
        return new InMemorySequenceProvider().withRegion("1", 200, 'C', ImmutableMap.of(100, 'A', 101, 'G'));
    }

    @DataProvider
    public Object[][] provideForTestCheckReference() {
        return new Object[][] {
                {makeVariant("1", 100, 100, "A/T"), ReferenceCheckResult.MatchOutcome.MATCH, "A"},
                {makeVariant("1", 100, 100, "a/t"), ReferenceCheckResult.MatchOutcome.MATCH, "A"},
                {makeVariant("1", 100, 101, "AG/-"), ReferenceCheckResult.MatchOutcome.MATCH, "AG"},
                {makeVariant("1", 100, 100, "G/T"), ReferenceCheckResult.MatchOutcome.MISMATCH, "A"},
                {makeVariant("1", 100, 100, Strand.NEGATIVE, "T/G"), ReferenceCheckResult.MatchOutcome.MATCH, "T"},
                {makeVariant("1", 100, 101, Strand.NEGATIVE, "CT/-"), ReferenceCheckResult.MatchOutcome.MATCH, "CT"},
                {makeVariant("1", 100, 102, "3_base_deletion/-"), ReferenceCheckResult.MatchOutcome.NOT_CHECKED, "AGC"},
                {makeVariant("1", 101, 100, "-/T"), ReferenceCheckResult.MatchOutcome.MATCH, "-"},
                {makeVariant("1", 101, 100, "/T"), ReferenceCheckResult.MatchOutcome.MATCH, "-"},
                {makeVariant("1", 101, 100, "A/T"), ReferenceCheckResult.MatchOutcome.MISMATCH, "-"},
        };
    }

    @Test(dataProvider = "provideForTestCheckReference")
    public void testCheckReference(final VariationFeature variant,
                                   final ReferenceCheckResult.MatchOutcome expectedOutcome,
                                   final String expectedRetrieved) {
        final ReferenceCheckResult result = new ReferenceChecker(createProvider()).checkReference(variant);
        Assert.assertEquals(result.getOutcome(), expectedOutcome);
        Assert.assertEquals(result.getRetrievedReference(), expectedRetrieved);
        Assert.assertEquals(result.getDeclaredReference(), variant.getReferenceAlleleString());
        Assert.assertEquals(result.isMismatch(), expectedOutcome == ReferenceCheckResult.MatchOutcome.MISMATCH);
    }

    @Test
    public void testInsertionsDoNotReadTheReference() {
        final InMemorySequenceProvider provider = createProvider();
        final ReferenceCheckResult result = new ReferenceChecker(provider).checkReference(makeVariant("1", 101, 100, "-/T"));
        Assert.assertEquals(result.getOutcome(), ReferenceCheckResult.MatchOutcome.MATCH);
        Assert.assertEquals(result.getRetrievedReference(), "-");
        Assert.assertEquals(provider.getFetchCount(), 0);
    }

    @Test(expectedExceptions = VarAnnoException.SequenceUnavailable.class)
    public void testUnknownContig() {
        new ReferenceChecker(createProvider()).checkReference(makeVariant("2", 100, 100, "A/T"));
    }

    @Test(expectedExceptions = VarAnnoException.SequenceUnavailable.class)
    public void testPastEndOfContig() {
        new ReferenceChecker(createProvider()).checkReference(makeVariant("1", 199, 205, "CCCCCCC/-"));
    }

    @Test(expectedExceptions = VarAnnoException.SequenceUnavailable.class)
    public void testTruncatedSequence() {
        // a provider that silently returns too few bases
        new ReferenceChecker((region, start, end) -> "A").checkReference(makeVariant("1", 100, 101, "AG/-"));
    }

    @DataProvider
    public Object[][] provideForTestCheckVariantSize() {
        return new Object[][] {
                {"-/A", 101, 100, true},
                {"-/A", 100, 100, false},
                {"/A", 101, 100, true},
                {"AG/-", 100, 101, true},
                {"A/-", 100, 101, false},
                {"A/G", 100, 100, true},
                {"3_base_deletion/-", 100, 102, true},
                {"5_base_deletion/-", 100, 102, false},
        };
    }

    @Test(dataProvider = "provideForTestCheckVariantSize")
    public void testCheckVariantSize(final String alleleString, final int start, final int end, final boolean expected) {
        Assert.assertEquals(ReferenceChecker.checkVariantSize(makeVariant("1", start, end, alleleString)), expected);
    }
}
