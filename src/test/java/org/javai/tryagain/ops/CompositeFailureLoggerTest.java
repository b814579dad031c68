package org.javai.tryagain.ops;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeFailureLoggerTest {

	private static final Instant AT = Instant.parse("2024-01-20T10:30:00Z");

	@Test
	void add_receivesBothKindsOfEvents() {
		List<String> events = new ArrayList<>();
		RecordingLogger first = new RecordingLogger("first", events);
		RecordingLogger second = new RecordingLogger("second", events);

		CompositeFailureLogger<String, String, String> composite = CompositeFailureLogger.<String, String, String>builder()
				.add(first)
				.add(second)
				.build();

		composite.logRecoverable("timeout", AT, "ctx");
		composite.logFatal("gone", AT, "ctx");

		assertThat(composite.recoverableSize()).isEqualTo(2);
		assertThat(composite.fatalSize()).isEqualTo(2);
		assertThat(events).containsExactly(
				"first recoverable timeout ctx",
				"second recoverable timeout ctx",
				"first fatal gone ctx",
				"second fatal gone ctx");
	}

	@Test
	void recoverableAndFatal_addOneSideOnly() {
		List<String> events = new ArrayList<>();

		CompositeFailureLogger<String, String, String> composite = CompositeFailureLogger.<String, String, String>builder()
				.recoverable((error, at, ctx) -> events.add("recoverable " + error))
				.fatal((error, at, ctx) -> events.add("fatal " + error))
				.build();

		composite.logRecoverable("timeout", AT, "ctx");
		composite.logFatal("gone", AT, "ctx");

		assertThat(composite.recoverableSize()).isEqualTo(1);
		assertThat(composite.fatalSize()).isEqualTo(1);
		assertThat(events).containsExactly("recoverable timeout", "fatal gone");
	}

	@Test
	void failingDelegate_doesNotStopOthers() {
		List<String> events = new ArrayList<>();

		CompositeFailureLogger<String, String, String> composite = CompositeFailureLogger.<String, String, String>builder()
				.fatal((error, at, ctx) -> {
					throw new IllegalStateException("sink down");
				})
				.fatal((error, at, ctx) -> events.add("fatal " + error))
				.recoverable((error, at, ctx) -> {
					throw new IllegalStateException("sink down");
				})
				.recoverable((error, at, ctx) -> events.add("recoverable " + error))
				.build();

		assertThatCode(() -> {
			composite.logRecoverable("timeout", AT, "ctx");
			composite.logFatal("gone", AT, "ctx");
		}).doesNotThrowAnyException();
		assertThat(events).containsExactly("recoverable timeout", "fatal gone");
	}

	@Test
	void nullDelegates_areIgnored() {
		CompositeFailureLogger<String, String, String> composite = CompositeFailureLogger.<String, String, String>builder()
				.recoverable(null)
				.fatal(null)
				.build();

		assertThat(composite.recoverableSize()).isZero();
		assertThat(composite.fatalSize()).isZero();
	}

	@Test
	void composite_servesAsBothLoggersOfOneCall() {
		List<String> events = new ArrayList<>();
		RecordingLogger recording = new RecordingLogger("sink", events);
		CompositeFailureLogger<String, String, String> composite = CompositeFailureLogger.<String, String, String>builder()
				.add(recording)
				.build();

		FailureLoggers<String, String, String> loggers = FailureLoggers.of("ctx", composite, composite);
		loggers.logRecoverable("timeout", AT);
		loggers.logFatal("gone", AT);

		assertThat(events).containsExactly("sink recoverable timeout ctx", "sink fatal gone ctx");
	}

	private record RecordingLogger(String name, List<String> events)
			implements RecoverableLogger<String, String>, FatalLogger<String, String> {

		@Override
		public void logRecoverable(String error, Instant occurredAt, String context) {
			events.add(name + " recoverable " + error + " " + context);
		}

		@Override
		public void logFatal(String error, Instant occurredAt, String context) {
			events.add(name + " fatal " + error + " " + context);
		}
	}
}
