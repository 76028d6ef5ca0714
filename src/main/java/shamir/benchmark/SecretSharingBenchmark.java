package shamir.benchmark;

import shamir.facade.SecretSharingException;
import shamir.facade.ShamirFacade;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class SecretSharingBenchmark {
    private static final int nDecimals = 4;

    private final ShamirFacade scheme;
    private final Random rnd;
    private final Measurement mSplit;
    private final Measurement mRecover;

    public SecretSharingBenchmark(ShamirFacade scheme, long seed) {
        this.scheme = scheme;
        this.rnd = new Random(seed);
        this.mSplit = new Measurement("split");
        this.mRecover = new Measurement("recover");
    }

    public static void main(String[] args) throws SecretSharingException {
        if (args.length != 5) {
            System.out.println("USAGE: ... shamir.benchmark.SecretSharingBenchmark " +
                    "<share count> <threshold> <secret size> <warm up iterations> <test iterations>");
            System.exit(-1);
        }

        int shareCount = Integer.parseInt(args[0]);
        int threshold = Integer.parseInt(args[1]);
        int secretSize = Integer.parseInt(args[2]);
        int warmUpIterations = Integer.parseInt(args[3]);
        int nTests = Integer.parseInt(args[4]);

        System.out.println("n = " + shareCount);
        System.out.println("t = " + threshold);
        System.out.println("secret size = " + secretSize);
        System.out.println();

        ShamirFacade scheme = ShamirFacade.fromConfiguration();

        System.out.println("Warming up (" + warmUpIterations + " iterations)");
        if (warmUpIterations > 0)
            new SecretSharingBenchmark(scheme, 1).runTests(warmUpIterations, shareCount, threshold, secretSize);
        System.out.println("Running test (" + nTests + " iterations)");
        if (nTests > 0) {
            SecretSharingBenchmark benchmark = new SecretSharingBenchmark(scheme, 2);
            benchmark.runTests(nTests, shareCount, threshold, secretSize);
            System.out.println("Split: " + benchmark.getSplitMeasurement().getAverageInMillis(nDecimals) + " ms");
            System.out.println("Recover: " + benchmark.getRecoverMeasurement().getAverageInMillis(nDecimals) + " ms");
        }
    }

    /**
     * Splits nTests random secrets and recovers each one from a random subset of threshold shares.
     * @throws SecretSharingException If a split or a recovery fails
     * @throws IllegalStateException If a recovered secret differs from the original one
     */
    public void runTests(int nTests, int shareCount, int threshold, int secretSize) throws SecretSharingException {
        for (int tn = 0; tn < nTests; tn++) {
            byte[] secret = new byte[secretSize];
            rnd.nextBytes(secret);

            mSplit.start();
            List<String> shares = scheme.split(secret, shareCount, threshold);
            mSplit.stop();

            List<String> subset = new ArrayList<>(shares);
            Collections.shuffle(subset, rnd);
            subset = subset.subList(0, threshold);

            mRecover.start();
            byte[] recovered = scheme.recover(subset);
            mRecover.stop();

            if (!Arrays.equals(secret, recovered))
                throw new IllegalStateException("Recovered secret differs from the original one");
        }
    }

    public Measurement getSplitMeasurement() {
        return mSplit;
    }

    public Measurement getRecoverMeasurement() {
        return mRecover;
    }
}
