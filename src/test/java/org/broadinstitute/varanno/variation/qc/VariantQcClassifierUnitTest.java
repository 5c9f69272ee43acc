package org.broadinstitute.varanno.variation.qc;

import com.google.common.collect.ImmutableMap;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.varanno.testutils.InMemorySequenceProvider;
import org.broadinstitute.varanno.testutils.VarAnnoBaseTest;
import org.broadinstitute.varanno.variation.VariationFeature;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class VariantQcClassifierUnitTest extends VarAnnoBaseTest {

    private static InMemorySequenceProvider createProvider() {
        return new InMemorySequenceProvider().withRegion("1", 200, 'C', ImmutableMap.of(100, 'A'));
    }

    @DataProvider
    public Object[][] provideForTestClassify() {
        return new Object[][] {
                {makeVariant("1", 100, 100, "G/T"), Collections.singletonList(2)},
                {makeVariant("1", 100, 100, "A/T"), Collections.emptyList()},
                {makeVariant("1", 100, 100, "a/t"), Collections.emptyList()},
                {makeVariant("1", 100, 100, "N/T"), Arrays.asList(2, 14)},
                {makeVariant("1", 100, 100, "A/C/G/T"), Collections.singletonList(3)},
                {makeVariant("1", 101, 100, "-/T"), Collections.emptyList()},
                {makeVariant("1", 101, 100, "/T"), Collections.emptyList()},
                {makeVariant("1", 101, 100, "A/T"), Arrays.asList(2, 15)},
                {makeVariant("1", 100, 100, "AC/T"), Arrays.asList(2, 15)},
                {makeVariant("1", 199, 205, "CC/-"), Collections.singletonList(15)},
                {makeVariant("1", 100, 100, Strand.NEGATIVE, "T/G"), Collections.emptyList()},
                {makeVariant("1", 100, 102, "3_base_deletion/-"), Collections.emptyList()},
                {makeVariant("1", 100, 102, "5_base_deletion/-"), Collections.singletonList(15)},
        };
    }

    @Test(dataProvider = "provideForTestClassify")
    public void testClassify(final VariationFeature variant, final List<Integer> expectedCodes) {
        final QcFailureSet failures = new VariantQcClassifier(createProvider()).classify(variant);
        Assert.assertEquals(failures.getCodes(), expectedCodes);
        Assert.assertEquals(failures.isPassed(), expectedCodes.isEmpty());
    }

    @Test
    public void testUnreadableReferenceShortCircuits() {
        // the ambiguity of N is not reported once the reference cannot be read
        final QcFailureSet failures = new VariantQcClassifier(createProvider()).classify(makeVariant("chrUn", 100, 100, "N/T"));
        Assert.assertEquals(failures, QcFailureSet.of(QcFailureReason.COORDINATE_ERROR));
    }

    @Test
    public void testInsertionPassesWithoutReadingTheReference() {
        final InMemorySequenceProvider provider = createProvider();
        final QcFailureSet failures = new VariantQcClassifier(new ReferenceChecker(provider)).classify(makeVariant("1", 101, 100, "-/T"));
        Assert.assertSame(failures, QcFailureSet.PASSED);
        Assert.assertEquals(provider.getFetchCount(), 0);
    }

    @Test
    public void testFailureSet() {
        final QcFailureSet failures = QcFailureSet.of(QcFailureReason.AMBIGUOUS_ALLELE, QcFailureReason.REFERENCE_MISMATCH);
        Assert.assertEquals(failures.getCodes(), Arrays.asList(2, 14));
        Assert.assertEquals(failures.toString(), "2,14");
        Assert.assertTrue(failures.contains(QcFailureReason.REFERENCE_MISMATCH));
        Assert.assertFalse(failures.contains(QcFailureReason.COORDINATE_ERROR));
        Assert.assertEquals(QcFailureSet.PASSED.toString(), "");
        Assert.assertSame(QcFailureSet.of(), QcFailureSet.PASSED);
    }

    @DataProvider
    public Object[][] provideForTestFromCode() {
        return new Object[][] {
                {2, QcFailureReason.REFERENCE_MISMATCH},
                {3, QcFailureReason.ALL_FOUR_BASES},
                {14, QcFailureReason.AMBIGUOUS_ALLELE},
                {15, QcFailureReason.COORDINATE_ERROR},
        };
    }

    @Test(dataProvider = "provideForTestFromCode")
    public void testFromCode(final int code, final QcFailureReason expected) {
        Assert.assertEquals(QcFailureReason.fromCode(code), expected);
        Assert.assertEquals(expected.getCode(), code);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFromUnknownCode() {
        QcFailureReason.fromCode(1);
    }
}
