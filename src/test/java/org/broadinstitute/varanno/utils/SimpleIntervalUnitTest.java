package org.broadinstitute.varanno.utils;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.varanno.testutils.VarAnnoBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class SimpleIntervalUnitTest extends VarAnnoBaseTest {

    @DataProvider(name = "badIntervals")
    public Object[][] badIntervals(){
        return new Object[][]{
                {null, 1, 12, "null contig"},
                {"1", 0, 10, "start==0"},
                {"1", -10, 10, "negative start"},
                {"1", 10, 9, "end < start"}
        };
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervals(String contig, int start, int end, String name){
        new SimpleInterval(contig, start, end);
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervalsFromLocatable(String contig, int start, int end, String name){
        new SimpleInterval(getLocatable(contig, start, end));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void illegalArgumentExceptionFromNullLocatable(){
        new SimpleInterval((Locatable)null);
    }

    @Test
    public void testGoodInterval() {
        final SimpleInterval interval = new SimpleInterval("chr1", 100, 120);
        Assert.assertEquals(interval.getContig(), "chr1");
        Assert.assertEquals(interval.getStart(), 100);
        Assert.assertEquals(interval.getEnd(), 120);
        Assert.assertEquals(interval.size(), 21);
        Assert.assertEquals(interval.getLengthOnReference(), 21);
        Assert.assertEquals(interval.toString(), "chr1:100-120");
        Assert.assertEquals(new SimpleInterval(getLocatable("chr1", 100, 120)), interval);
        Assert.assertEquals(new SimpleInterval(getLocatable("chr1", 100, 120)).hashCode(), interval.hashCode());
    }

    @Test
    public void testNotEqual() {
        final SimpleInterval interval = new SimpleInterval("chr1", 100, 120);
        Assert.assertNotEquals(new SimpleInterval("chr2", 100, 120), interval);
        Assert.assertNotEquals(new SimpleInterval("chr1", 101, 120), interval);
        Assert.assertNotEquals(new SimpleInterval("chr1", 100, 121), interval);
    }

    private static Locatable getLocatable(final String contig, final int start, final int end) {
        return new Locatable() {
            @Override
            public String getContig() {
                return contig;
            }

            @Override
            public int getStart() {
                return start;
            }

            @Override
            public int getEnd() {
                return end;
            }
        };
    }
}
