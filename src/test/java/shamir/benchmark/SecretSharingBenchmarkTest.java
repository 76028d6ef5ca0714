package shamir.benchmark;

import org.junit.Test;
import shamir.facade.SecretSharingException;
import shamir.facade.ShamirFacade;
import shamir.random.SeededRandomGenerator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SecretSharingBenchmarkTest {

    @Test
    public void measuresEverySplitAndRecovery() throws SecretSharingException {
        ShamirFacade scheme = new ShamirFacade(new SeededRandomGenerator(new byte[]{5}));
        SecretSharingBenchmark benchmark = new SecretSharingBenchmark(scheme, 11);
        benchmark.runTests(5, 7, 4, 64);

        Measurement split = benchmark.getSplitMeasurement();
        Measurement recover = benchmark.getRecoverMeasurement();
        assertEquals(5, split.getSamples());
        assertEquals(5, recover.getSamples());
        assertTrue(split.getTotalTime() > 0);
        assertTrue(recover.getAverageInMillis(4) >= 0);
        assertTrue(split.toString().startsWith("split: "));
    }

    @Test
    public void emptyMeasurementAveragesToZero() {
        assertEquals(0, new Measurement("idle").getAverageInMillis(2), 0);
    }
}
