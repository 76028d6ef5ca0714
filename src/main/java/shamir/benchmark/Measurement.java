package shamir.benchmark;

/**
 * Accumulates the time spent between {@link #start()} and {@link #stop()} calls.
 */
public class Measurement {
	private final String name;
	private long totalTime;
	private int samples;
	private long start;

	public Measurement(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public void start() {
		start = System.nanoTime();
	}

	public void stop() {
		totalTime += System.nanoTime() - start;
		samples++;
	}

	public int getSamples() {
		return samples;
	}

	public long getTotalTime() {
		return totalTime;
	}

	public double getAverageInMillis(int nDecimals) {
		if (samples == 0)
			return 0;
		double temp = Math.pow(10, nDecimals);
		return Math.round(((double) totalTime / samples / 1_000_000.0) * temp) / temp;
	}

	@Override
	public String toString() {
		return name + ": " + getAverageInMillis(4) + " ms (" + samples + " samples)";
	}
}
