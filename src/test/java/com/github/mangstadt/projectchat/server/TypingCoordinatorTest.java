package com.github.mangstadt.projectchat.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.mangstadt.projectchat.Identity;

class TypingCoordinatorTest {
	private final Identity alice = new Identity("u1", "Alice", null);
	private final Identity bob = new Identity("u2", "Bob", null);

	private ScheduledExecutorService scheduler;
	private List<Runnable> timers;
	private List<ScheduledFuture<?>> futures;
	private List<Long> expired;
	private TypingCoordinator typing;

	@BeforeEach
	void before() {
		timers = new ArrayList<>();
		futures = new ArrayList<>();
		expired = new ArrayList<>();

		scheduler = mock(ScheduledExecutorService.class);
		when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
			timers.add(invocation.getArgument(0, Runnable.class));
			var future = mock(ScheduledFuture.class);
			futures.add(future);
			return future;
		});

		typing = new TypingCoordinator(Duration.ofSeconds(3), scheduler, (identity, generation) -> expired.add(generation));
	}

	@Test
	void markTyping() {
		assertTrue(typing.markTyping(alice));
		assertFalse(typing.markTyping(alice));
		assertTrue(typing.markTyping(bob));

		assertEquals(List.of(alice, bob), typing.typing());
		assertTrue(typing.isTyping(alice));
		verify(scheduler, times(3)).schedule(any(Runnable.class), eq(3000L), eq(TimeUnit.MILLISECONDS));

		//restarting cancels the old timer
		verify(futures.get(0)).cancel(false);
	}

	@Test
	void markStopped() {
		assertFalse(typing.markStopped(alice));

		typing.markTyping(alice);
		assertTrue(typing.markStopped(alice));
		assertFalse(typing.isTyping(alice));
		verify(futures.get(0)).cancel(false);
	}

	@Test
	void expire() {
		typing.markTyping(alice);
		timers.get(0).run();
		assertEquals(1, expired.size());

		assertTrue(typing.expire(alice, expired.get(0)));
		assertFalse(typing.isTyping(alice));

		//already gone
		assertFalse(typing.expire(alice, expired.get(0)));
	}

	@Test
	void expire_stale_timer() {
		typing.markTyping(alice);
		typing.markTyping(alice);

		//the first timer fired before it could be cancelled
		timers.get(0).run();
		assertFalse(typing.expire(alice, expired.get(0)));
		assertTrue(typing.isTyping(alice));

		timers.get(1).run();
		assertTrue(typing.expire(alice, expired.get(1)));
	}

	@Test
	void expire_after_stop() {
		typing.markTyping(alice);
		typing.markStopped(alice);

		timers.get(0).run();
		assertFalse(typing.expire(alice, expired.get(0)));
	}

	@Test
	void clear() {
		typing.markTyping(alice);
		typing.markTyping(bob);

		typing.clear();
		assertEquals(List.of(), typing.typing());
		futures.forEach(future -> verify(future).cancel(false));
	}
}
