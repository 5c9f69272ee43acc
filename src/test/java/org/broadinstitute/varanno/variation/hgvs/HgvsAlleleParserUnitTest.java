package org.broadinstitute.varanno.variation.hgvs;

import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.testutils.VarAnnoBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class HgvsAlleleParserUnitTest extends VarAnnoBaseTest {

    @DataProvider
    public Object[][] provideForTestParse() {
        // notation -> reference name, scheme, start, end, type, allele string
        return new Object[][] {
                {"7:g.1234A>T", "7", "g", "1234", "1234", HgvsVariantType.SUBSTITUTION, "A/T"},
                {"7:g.1234a>t", "7", "g", "1234", "1234", HgvsVariantType.SUBSTITUTION, "A/T"},
                {"NM_000:c.88+2_88+3delAG", "NM_000", "c", "88+2", "88+3", HgvsVariantType.DELETION, "AG/-"},
                {"c.76_77insG", null, "c", "76", "77", HgvsVariantType.INSERTION, "-/G"},
                {"1:g.99_100delTAinsGC", "1", "g", "99", "100", HgvsVariantType.DELETION_INSERTION, "TA/GC"},
                {"1:g.100dupA", "1", "g", "100", "100", HgvsVariantType.DUPLICATION, "A/AA"},
                {"TX1:c.*1T>C", "TX1", "c", "*1", "*1", HgvsVariantType.SUBSTITUTION, "T/C"},
                {"TX1:c.-10_-9delCC", "TX1", "c", "-10", "-9", HgvsVariantType.DELETION, "CC/-"},
                {"TX2:21A>G", "TX2", "", "21", "21", HgvsVariantType.SUBSTITUTION, "A/G"},
        };
    }

    @Test(dataProvider = "provideForTestParse")
    public void testParse(final String notation, final String referenceName, final String scheme,
                          final String start, final String end, final HgvsVariantType type, final String alleleString) {
        final HgvsAlleleParser.ParsedNotation parsed = HgvsAlleleParser.parse(notation);
        Assert.assertEquals(parsed.getReferenceName(), referenceName);
        Assert.assertEquals(parsed.getNumberingScheme(), scheme);
        Assert.assertEquals(parsed.getStart(), start);
        Assert.assertEquals(parsed.getEnd(), end);
        Assert.assertEquals(parsed.getType(), type);
        Assert.assertTrue(parsed.hasBothAlleles());
        Assert.assertEquals(parsed.toAlleleString(), alleleString);
    }

    @Test
    public void testDeletionWithoutBases() {
        final HgvsAlleleParser.ParsedNotation parsed = HgvsAlleleParser.parse("1:g.100_102del");
        Assert.assertEquals(parsed.getType(), HgvsVariantType.DELETION);
        Assert.assertNull(parsed.getReferenceAllele());
        Assert.assertEquals(parsed.getAlternateAllele(), "");
        Assert.assertFalse(parsed.hasBothAlleles());
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testAlleleStringNeedsBothAlleles() {
        HgvsAlleleParser.parse("1:g.100_102del").toAlleleString();
    }

    @DataProvider
    public Object[][] provideForTestMalformed() {
        return new Object[][] {
                {"1:g.100A="},
                {"foo"},
                {"1:p.12A>T"},
                {"1:g.100AC>T"},
                {""},
        };
    }

    @Test(dataProvider = "provideForTestMalformed", expectedExceptions = VarAnnoException.MalformedAllele.class)
    public void testMalformed(final String notation) {
        HgvsAlleleParser.parse(notation);
    }
}
