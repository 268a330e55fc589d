package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.raster.PixelFormat;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class ConversionTableTest {

    private final ConversionTable table = ConversionTable.standard(new RangeRescaler(), new ChannelCompositor());

    private List<String> names(PixelFormat.Kind kind) {
        return table.stepsFor(kind).stream().map(ConversionTable.Step::getName).collect(Collectors.toList());
    }

    @Test
    public void testEveryKindHasALadder() {
        for (PixelFormat.Kind kind : PixelFormat.Kind.values()) {
            assertTrue(kind + " has no conversion", !table.stepsFor(kind).isEmpty());
        }
    }

    @Test
    public void testWideGrayFallsBackToDirectCast() {
        assertEquals(List.of(ConversionTable.LINEAR_RESCALE, ConversionTable.DIRECT_CAST), names(PixelFormat.Kind.GRAY_WIDE));
    }

    @Test
    public void testSingleStepLadders() {
        assertEquals(List.of(ConversionTable.PALETTE_EXPAND), names(PixelFormat.Kind.PALETTE));
        assertEquals(List.of(ConversionTable.GENERIC_RENDER), names(PixelFormat.Kind.FOREIGN));
        assertEquals(List.of(ConversionTable.DIRECT_RGB), names(PixelFormat.Kind.RGB));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testLaddersAreReadOnly() {
        table.stepsFor(PixelFormat.Kind.RGB).clear();
    }

    @Test
    public void testEmptyTable() {
        assertTrue(new ConversionTable().stepsFor(PixelFormat.Kind.RGB).isEmpty());
    }
}
