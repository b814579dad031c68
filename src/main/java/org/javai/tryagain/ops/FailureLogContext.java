package org.javai.tryagain.ops;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A logging context for the sinks in this package: the operation name, an optional
 * correlation ID and tags the caller may add to at any time. Owned by the caller and lent
 * to one retried call at a time.
 */
public final class FailureLogContext {

	private final String operation;
	private final String correlationId;
	private final Map<String, String> tags = new LinkedHashMap<>();

	/**
	 * Creates a context for the named operation with no correlation ID.
	 *
	 * @param operation the operation name used in log output
	 */
	public static FailureLogContext forOperation(String operation) {
		return new FailureLogContext(operation, null);
	}

	/**
	 * @param operation the operation name used in log output
	 * @param correlationId optional correlation ID for tracing, may be null
	 */
	public FailureLogContext(String operation, String correlationId) {
		this.operation = Objects.requireNonNull(operation, "operation must not be null");
		this.correlationId = correlationId;
	}

	/**
	 * Adds a tag to every event logged through this context.
	 *
	 * @return this context
	 */
	public FailureLogContext tag(String key, String value) {
		tags.put(Objects.requireNonNull(key, "key must not be null"), Objects.requireNonNull(value, "value must not be null"));
		return this;
	}

	public String operation() {
		return operation;
	}

	public String correlationId() {
		return correlationId;
	}

	public Map<String, String> tags() {
		return Collections.unmodifiableMap(tags);
	}
}
