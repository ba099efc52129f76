package common;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;

public class MLTimer {

	private String name;
	private Stopwatch timer;

	public MLTimer(final String nameP) {
		this.name = nameP;
		this.timer = Stopwatch.createUnstarted();
	}

	public synchronized void tic() {
		this.timer.reset().start();
	}

	public synchronized void toc(final String message) {
		System.out.printf("%s: %s elapsed [%s]\n", this.name, message,
				formatMillis(this.timer.elapsed(TimeUnit.MILLISECONDS)));
	}

	public synchronized void tocLoop(final String message, final long curLoop) {
		long elapsed = this.timer.elapsed(TimeUnit.MILLISECONDS);
		double speed = curLoop / Math.max(elapsed / 1000.0, 1e-3);
		System.out.printf("%s: %s [%d] elapsed [%s] cur_spd [%.0f/s]\n",
				this.name, message, curLoop, formatMillis(elapsed), speed);
	}

	private static String formatMillis(final long millis) {
		long minutes = TimeUnit.MILLISECONDS.toMinutes(millis);
		long seconds = TimeUnit.MILLISECONDS.toSeconds(millis)
				- TimeUnit.MINUTES.toSeconds(minutes);
		long rest = millis - TimeUnit.MINUTES.toMillis(minutes)
				- TimeUnit.SECONDS.toMillis(seconds);

		if (minutes > 0) {
			return String.format("%d min %d sec", minutes, seconds);
		}
		return String.format("%d.%03d sec", seconds, rest);
	}

}
