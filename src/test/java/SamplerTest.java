import com.plotlab.expr.ExpressionEngine;
import com.plotlab.sampling.Curve;
import com.plotlab.sampling.SamplePoint;
import com.plotlab.sampling.SampleResult;
import com.plotlab.sampling.Sampler;
import com.plotlab.sampling.SamplingSettings;
import com.plotlab.sampling.YRange;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SamplerTest {

    private final Sampler sampler = new Sampler(new ExpressionEngine(), SamplingSettings.defaults());

    /** Ten unit steps over [0, 10]; every x is an exact integer. */
    private final Sampler coarse = new Sampler(new ExpressionEngine(),
            new SamplingSettings(0, 10, 10, 0.2, 1.0, new YRange(-5, 5)));

    @Test
    void identityCoversWholeDomain() {
        SampleResult r = sampler.sample("x");
        assertTrue(r.isValid());
        assertEquals(401, r.getCurve().size());
        assertEquals(0, r.getSkippedPoints());
        assertEquals(0.0, r.getCurve().get(0).x, 0.0);
        assertEquals(10.0, r.getCurve().get(400).x, 0.0);
        // observed [0, 10] padded by 20% of the span on each side
        assertEquals(-2.0, r.getYRange().min, 1e-9);
        assertEquals(12.0, r.getYRange().max, 1e-9);
        assertNull(r.getCompileError());
    }

    @Test
    void pointsAreInAscendingX() {
        Curve c = sampler.sample("sin(x)").getCurve();
        for (int i = 1; i < c.size(); i++) {
            assertTrue(c.get(i).x > c.get(i - 1).x);
        }
    }

    @Test
    void flatCurveGetsNonZeroRange() {
        SampleResult r = sampler.sample("3");
        assertTrue(r.isValid());
        // widened to [2, 4], then the usual 20% margin
        assertEquals(1.6, r.getYRange().min, 1e-9);
        assertEquals(4.4, r.getYRange().max, 1e-9);
        assertTrue(r.getYRange().span() > 0);
    }

    @Test
    void singleBadPointIsSkipped() {
        SampleResult r = sampler.sample("1 / x");
        assertTrue(r.isValid());
        assertEquals(400, r.getCurve().size());
        assertEquals(1, r.getSkippedPoints());
        assertTrue(r.getCurve().get(0).x > 0);

        SampleResult log = sampler.sample("log(x)");
        assertTrue(log.isValid());
        assertEquals(400, log.getCurve().size());
    }

    @Test
    void partiallyDefinedFunctionKeepsOnlyRealPoints() {
        SampleResult r = coarse.sample("sqrt(x - 5)");
        assertTrue(r.isValid());
        assertEquals(6, r.getCurve().size());
        assertEquals(5, r.getSkippedPoints());
        assertEquals(new SamplePoint(5, 0), r.getCurve().get(0));
        assertEquals(new SamplePoint(9, 2), r.getCurve().get(4));
    }

    @Test
    void nothingRealGivesInvalidCurveWithFallbackRange() {
        SampleResult r = sampler.sample("sqrt(x - 20)");
        assertFalse(r.isValid());
        assertTrue(r.getCurve().isEmpty());
        assertEquals(401, r.getSkippedPoints());
        assertEquals(new YRange(-5, 5), r.getYRange());
    }

    @Test
    void rejectedTextIsInvalidWithReason() {
        SampleResult r = sampler.sample("sin(x");
        assertFalse(r.isValid());
        assertTrue(r.getCurve().isEmpty());
        assertNotNull(r.getCompileError());
        assertEquals(new YRange(-5, 5), r.getYRange());

        SampleResult hostile = sampler.sample("__import__('os').system('ls')");
        assertFalse(hostile.isValid());
        assertNotNull(hostile.getCompileError());
    }

    @Test
    void blankTextIsInvalidWithoutReason() {
        SampleResult r = sampler.sample("   ");
        assertFalse(r.isValid());
        assertNull(r.getCompileError());
        assertFalse(sampler.sample((String) null).isValid());
    }

    @Test
    void samplingIsDeterministic() {
        assertEquals(sampler.sample("exp(-x) * sin(x * 3)").getCurve(),
                sampler.sample("exp(-x) * sin(x * 3)").getCurve());
    }

    @Test
    void settingsRejectBadDomain() {
        assertThrows(IllegalArgumentException.class, () -> new SamplingSettings(5, 5, 10, 0.2, 1, new YRange(-5, 5)));
        assertThrows(IllegalArgumentException.class, () -> new SamplingSettings(0, 10, 0, 0.2, 1, new YRange(-5, 5)));
        assertThrows(IllegalArgumentException.class, () -> new YRange(1, 0));
    }
}
