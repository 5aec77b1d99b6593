package com.github.mangstadt.projectchat.util;

import java.time.Duration;

/**
 * Wraps {@link Thread#sleep} so that unit tests can skip the delays while
 * still checking how long the code wanted to wait.
 */
public final class Sleeper {
	private static volatile boolean unitTest = false;
	private static long timeSlept;

	/**
	 * Sleeps the current thread. If interrupted, the thread's interrupt flag
	 * is restored and the method returns early.
	 * @param duration how long to sleep
	 */
	public static void sleep(Duration duration) {
		if (unitTest) {
			synchronized (Sleeper.class) {
				timeSlept += duration.toMillis();
			}
			return;
		}

		try {
			Thread.sleep(duration.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * Makes every call to {@link #sleep} return immediately.
	 */
	public static synchronized void startUnitTest() {
		unitTest = true;
		timeSlept = 0;
	}

	/**
	 * Restores normal sleeping behavior.
	 */
	public static synchronized void endUnitTest() {
		unitTest = false;
		timeSlept = 0;
	}

	/**
	 * Gets the total time that would have been slept since
	 * {@link #startUnitTest} was called.
	 * @return the time in milliseconds
	 */
	public static synchronized long getTimeSlept() {
		return timeSlept;
	}

	private Sleeper() {
		//hide constructor
	}
}
