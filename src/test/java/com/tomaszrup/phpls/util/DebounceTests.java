////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Debounce}: only the latest event of a burst is delivered,
 * either after the delay or on an explicit flush.
 */
class DebounceTests {

	private ScheduledExecutorService executor;
	private List<String> delivered;

	@BeforeEach
	void setup() {
		executor = Executors.newSingleThreadScheduledExecutor();
		delivered = Collections.synchronizedList(new ArrayList<>());
	}

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	@Test
	void testOnlyLatestEventIsDelivered() throws Exception {
		CountDownLatch latch = new CountDownLatch(1);
		Debounce<String> debounce = new Debounce<>(event -> {
			delivered.add(event);
			latch.countDown();
		}, 50, executor);

		debounce.handle("a");
		debounce.handle("b");
		debounce.handle("c");

		Assertions.assertTrue(latch.await(5, TimeUnit.SECONDS), "Debounced event should be delivered");
		// give a stray earlier event the chance to show up
		Thread.sleep(150);
		Assertions.assertEquals(Collections.singletonList("c"), delivered);
		Assertions.assertFalse(debounce.hasPending());
	}

	@Test
	void testFlushDeliversOnCallingThread() {
		List<Thread> threads = new ArrayList<>();
		Debounce<String> debounce = new Debounce<>(event -> {
			delivered.add(event);
			threads.add(Thread.currentThread());
		}, 60_000, executor);

		debounce.handle("x");
		Assertions.assertTrue(debounce.hasPending());
		debounce.flush();

		Assertions.assertEquals(Collections.singletonList("x"), delivered);
		Assertions.assertSame(Thread.currentThread(), threads.get(0));
		Assertions.assertFalse(debounce.hasPending());
	}

	@Test
	void testFlushWithoutPendingEventDoesNothing() {
		Debounce<String> debounce = new Debounce<>(delivered::add, 10, executor);
		debounce.flush();
		Assertions.assertTrue(delivered.isEmpty());
	}

	@Test
	void testClearDropsPendingEvent() throws Exception {
		Debounce<String> debounce = new Debounce<>(delivered::add, 20, executor);
		debounce.handle("dropped");
		debounce.clear();
		Thread.sleep(150);
		Assertions.assertTrue(delivered.isEmpty(), "Cleared event should never be delivered");
		Assertions.assertFalse(debounce.hasPending());
	}

	@Test
	void testHandlerExceptionIsContained() {
		Debounce<String> debounce = new Debounce<>(event -> {
			throw new IllegalStateException("boom");
		}, 60_000, executor);
		debounce.handle("x");
		Assertions.assertDoesNotThrow(debounce::flush);
	}

	@Test
	void testNegativeDelayRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new Debounce<String>(delivered::add, -1, executor));
	}
}
