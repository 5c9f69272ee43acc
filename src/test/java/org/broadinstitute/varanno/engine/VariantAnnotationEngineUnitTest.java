package org.broadinstitute.varanno.engine;

import com.google.common.collect.ImmutableMap;
import htsjdk.tribble.annotation.Strand;
import org.broadinstitute.varanno.exceptions.UserException;
import org.broadinstitute.varanno.testutils.InMemorySequenceProvider;
import org.broadinstitute.varanno.testutils.VarAnnoBaseTest;
import org.broadinstitute.varanno.utils.SimpleInterval;
import org.broadinstitute.varanno.utils.config.ConfigFactory;
import org.broadinstitute.varanno.utils.config.VarAnnoConfig;
import org.broadinstitute.varanno.variation.VariationFeature;
import org.broadinstitute.varanno.variation.consequence.ConsequenceSet;
import org.broadinstitute.varanno.variation.consequence.ConsequenceType;
import org.broadinstitute.varanno.variation.hgvs.ReferenceFeature;
import org.broadinstitute.varanno.variation.hgvs.ReferenceFrame;
import org.broadinstitute.varanno.variation.qc.QcFailureReason;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class VariantAnnotationEngineUnitTest extends VarAnnoBaseTest {

    private static final ReferenceFeature CHROMOSOME = ReferenceFeature.ofSlice("1", new SimpleInterval("1", 1, 200), Strand.POSITIVE);

    private static InMemorySequenceProvider createProvider() {
        return new InMemorySequenceProvider().withRegion("1", 200, 'C', ImmutableMap.of(100, 'A'));
    }

    private static VarAnnoConfig createConfig(final int threads) {
        final VarAnnoConfig config = ConfigFactory.getInstance().create(VarAnnoConfig.class);
        config.setProperty("engine.threads", String.valueOf(threads));
        return config;
    }

    private static VariantAnnotationRequest genomicRequest(final VariationFeature variant) {
        return new VariantAnnotationRequest(variant,
                Collections.singletonList(new NotationTarget(CHROMOSOME, ReferenceFrame.GENOMIC)),
                Collections.emptyList());
    }

    @Test
    public void testAnnotate() {
        final VariantAnnotationEngine engine = new VariantAnnotationEngine(createProvider(), createConfig(1));
        final VariationFeature variant = makeVariant("1", 100, 100, "A/T");
        final VariantAnnotationRequest request = new VariantAnnotationRequest(variant,
                Arrays.asList(new NotationTarget(CHROMOSOME, ReferenceFrame.GENOMIC),
                              new NotationTarget(CHROMOSOME, ReferenceFrame.GENOMIC, "NC_000001.10")),
                Arrays.asList(ConsequenceSet.forTranscript("ENST01", ConsequenceType.INTRONIC, ConsequenceType.SPLICE_SITE),
                              ConsequenceSet.forTranscript("ENST02", ConsequenceType.REGULATORY_REGION)));

        final VariantAnnotation annotation = engine.annotate(request);
        Assert.assertSame(annotation.getVariant(), variant);
        Assert.assertEquals(annotation.getNormalizedAlleleString(), "A/T");
        Assert.assertTrue(annotation.getQcFailures().isPassed());
        Assert.assertEquals(annotation.getRenderedNotations(), Arrays.asList("1:g.100A>T", "NC_000001.10:g.100A>T"));
        Assert.assertEquals(annotation.getConsequences().getTypes(),
                Arrays.asList(ConsequenceType.REGULATORY_REGION, ConsequenceType.SPLICE_SITE, ConsequenceType.INTRONIC));
        Assert.assertEquals(annotation.getDisplayConsequence(), ConsequenceType.SPLICE_SITE);
        Assert.assertFalse(annotation.hasFailures());
    }

    @Test
    public void testNegativeStrandVariantIsNormalized() {
        final VariantAnnotationEngine engine = new VariantAnnotationEngine(createProvider(), createConfig(1));
        final VariantAnnotation annotation = engine.annotate(genomicRequest(makeVariant("1", 100, 100, Strand.NEGATIVE, "T/G")));

        Assert.assertEquals(annotation.getNormalizedVariant().getStrand(), Strand.POSITIVE);
        Assert.assertEquals(annotation.getNormalizedAlleleString(), "A/C");
        Assert.assertTrue(annotation.getQcFailures().isPassed());
        Assert.assertEquals(annotation.getRenderedNotations(), Collections.singletonList("1:g.100A>C"));
    }

    @Test
    public void testFailuresAreRecordedPerTarget() {
        final VariantAnnotationEngine engine = new VariantAnnotationEngine(createProvider(), createConfig(1));
        final VariantAnnotationRequest request = new VariantAnnotationRequest(makeVariant("1", 100, 100, "A/N/T"),
                Arrays.asList(new NotationTarget(CHROMOSOME, ReferenceFrame.PROTEIN),
                              new NotationTarget(CHROMOSOME, ReferenceFrame.GENOMIC)),
                Collections.emptyList());

        final VariantAnnotation annotation = engine.annotate(request);
        Assert.assertEquals(annotation.getRenderedNotations(), Collections.singletonList("1:g.100A>T"));
        Assert.assertEquals(annotation.getQcFailures().getCodes(), Collections.singletonList(QcFailureReason.AMBIGUOUS_ALLELE.getCode()));
        Assert.assertTrue(annotation.hasFailures());

        final List<AnnotationFailure> failures = annotation.getFailures();
        Assert.assertEquals(failures.size(), 2);
        Assert.assertEquals(failures.get(0).getStage(), AnnotationFailure.Stage.NOTATION);
        Assert.assertFalse(failures.get(0).getAllele().isPresent());
        assertContains(failures.get(0).getMessage(), "HGVS p notation");
        Assert.assertEquals(failures.get(1).getStage(), AnnotationFailure.Stage.NOTATION);
        Assert.assertEquals(failures.get(1).getAllele().orElse(null), "N");
        Assert.assertEquals(failures.get(1).getVariantName(), "var_100");
    }

    @Test
    public void testUnknownContig() {
        final VariantAnnotationEngine engine = new VariantAnnotationEngine(createProvider(), createConfig(1));
        final VariantAnnotation annotation = engine.annotate(VariantAnnotationRequest.qcOnly(makeVariant("chrUn", 100, 100, "N/T")));
        Assert.assertEquals(annotation.getQcFailures().getCodes(), Collections.singletonList(QcFailureReason.COORDINATE_ERROR.getCode()));
        Assert.assertTrue(annotation.getNotations().isEmpty());
        Assert.assertEquals(annotation.getConsequences().getTypes(), Collections.singletonList(ConsequenceType.INTERGENIC));
        Assert.assertEquals(annotation.getDisplayConsequence(), ConsequenceType.INTERGENIC);
    }

    @DataProvider
    public Object[][] provideForTestAnnotateAll() {
        return new Object[][] {{1}, {3}};
    }

    @Test(dataProvider = "provideForTestAnnotateAll")
    public void testAnnotateAllKeepsOrder(final int threads) {
        final VariantAnnotationEngine engine = new VariantAnnotationEngine(createProvider(), createConfig(threads));
        Assert.assertEquals(engine.getNumThreads(), threads);

        final List<VariantAnnotationRequest> requests = new ArrayList<>();
        final List<String> expectedNotations = new ArrayList<>();
        for ( int position = 90; position <= 110; ++position ) {
            final String ref = position == 100 ? "A" : "C";
            requests.add(genomicRequest(makeVariant("1", position, position, ref + "/G")));
            expectedNotations.add("1:g." + position + ref + ">G");
        }
        // a reference mismatch in the middle of the batch; its declared reference is described like any other allele
        requests.add(10, genomicRequest(makeVariant("1", 100, 100, "G/A")));
        expectedNotations.add(10, "1:g.100A>G");

        final List<VariantAnnotation> annotations = engine.annotateAll(requests);
        Assert.assertEquals(annotations.size(), requests.size());
        for ( int i = 0; i < annotations.size(); ++i ) {
            Assert.assertSame(annotations.get(i).getVariant(), requests.get(i).getVariant());
        }
        Assert.assertEquals(annotations.stream().flatMap(a -> a.getRenderedNotations().stream()).collect(Collectors.toList()),
                expectedNotations);
        Assert.assertEquals(annotations.stream().filter(a -> !a.getQcFailures().isPassed()).count(), 1L);
        Assert.assertEquals(annotations.get(10).getQcFailures().getCodes(), Collections.singletonList(QcFailureReason.REFERENCE_MISMATCH.getCode()));
    }

    @Test
    public void testDefaultConfiguration() {
        Assert.assertEquals(new VariantAnnotationEngine(createProvider()).getNumThreads(), 4);
    }

    @Test(expectedExceptions = UserException.BadConfiguration.class)
    public void testBadConfiguration() {
        new VariantAnnotationEngine(createProvider(), createConfig(0));
    }
}
