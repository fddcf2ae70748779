package com.elphel.dempiv.common;
/**
 **
 ** MultiThreading - thread array helpers for per-tile processing
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiThreading.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import java.util.concurrent.atomic.AtomicReference;

public class MultiThreading {
	public static int THREADS_MAX = 100;
	/* From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */

	/**
	 * Create thread array limited by the number of available processors
	 * @param maxCPUs maximal number of threads, <= 0 - use THREADS_MAX
	 * @return empty array of threads to be populated by the caller
	 */
	public static Thread[] newThreadArray(int maxCPUs) {
		if (maxCPUs <= 0) maxCPUs = THREADS_MAX;
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus>maxCPUs)n_cpus=maxCPUs;
		return new Thread[n_cpus];
	}

	/**
	 * Start all given threads and wait on each of them until all are done.
	 * Unlike the ImageJ version, a failure in any of the threads is not lost:
	 * the first exception thrown by a worker is re-thrown here after all
	 * threads are joined.
	 * @param threads populated thread array
	 */
	public static void startAndJoin(Thread[] threads)
	{
		final AtomicReference<Throwable> first_failure = new AtomicReference<Throwable>();
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
				@Override
				public void uncaughtException(Thread t, Throwable e) {
					first_failure.compareAndSet(null, e);
				}
			});
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
		Throwable failure = first_failure.get();
		if (failure instanceof RuntimeException) {
			throw (RuntimeException) failure;
		}
		if (failure instanceof Error) {
			throw (Error) failure;
		}
		if (failure != null) {
			throw new RuntimeException(failure);
		}
	}
}
