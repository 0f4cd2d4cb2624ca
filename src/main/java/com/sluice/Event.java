/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.sluice;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable, structured record handed to the downstream {@link EventQueue}.
 * <p>
 * An event is an ordered mapping of field names to values.  Text-oriented codecs produce a single {@value #MESSAGE_FIELD} field;
 * structured codecs (e.g. JSON) produce one field per top-level key of the decoded object.
 * Sluice always sets the {@value #HOST_FIELD} field to the remote address of the client that submitted the event.
 * <p>
 * Nested maps and lists are defensively copied and exposed as unmodifiable views.
 * <p>
 * Instances can be acquired via the {@link #withFields(Map)} and {@link #withMessage(String)} factory methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Event {
	@NonNull
	public static final String MESSAGE_FIELD;
	@NonNull
	public static final String HOST_FIELD;

	static {
		MESSAGE_FIELD = "message";
		HOST_FIELD = "host";
	}

	@NonNull
	private final Map<@NonNull String, @Nullable Object> fields;

	/**
	 * Acquires an event whose fields are a copy of the supplied map, in the map's iteration order.
	 *
	 * @param fields the fields for this event
	 * @return the event
	 */
	@NonNull
	public static Event withFields(@NonNull Map<@NonNull String, @Nullable ?> fields) {
		requireNonNull(fields);
		return new Event(fields);
	}

	/**
	 * Acquires an event with a single {@value #MESSAGE_FIELD} field.
	 *
	 * @param message the message text
	 * @return the event
	 */
	@NonNull
	public static Event withMessage(@NonNull String message) {
		requireNonNull(message);
		return new Event(Map.of(MESSAGE_FIELD, message));
	}

	private Event(@NonNull Map<@NonNull String, @Nullable ?> fields) {
		requireNonNull(fields);

		Map<String, Object> copy = new LinkedHashMap<>(fields.size());

		for (Map.Entry<String, ?> entry : fields.entrySet())
			copy.put(requireNonNull(entry.getKey(), "Event field names cannot be null"), immutableCopyOf(entry.getValue()));

		this.fields = Collections.unmodifiableMap(copy);
	}

	/**
	 * Vends a new event with the given field set, replacing any existing value for that field.
	 *
	 * @param name  the field name
	 * @param value the field value
	 * @return a new event; this instance is unchanged
	 */
	@NonNull
	public Event withField(@NonNull String name,
												 @Nullable Object value) {
		requireNonNull(name);

		Map<String, Object> fields = new LinkedHashMap<>(getFields());
		fields.put(name, value);

		return new Event(fields);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{fields=%s}", getClass().getSimpleName(), getFields());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Event event))
			return false;

		return Objects.equals(getFields(), event.getFields());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getFields());
	}

	/**
	 * The value of the given field, if present and non-null.
	 *
	 * @param name the field name
	 * @return the field value, or {@link Optional#empty()} if absent
	 */
	@NonNull
	public Optional<Object> getField(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getFields().get(name));
	}

	/**
	 * Convenience accessor for the {@value #MESSAGE_FIELD} field as a string.
	 *
	 * @return the message, or {@link Optional#empty()} if this event has no message
	 */
	@NonNull
	public Optional<String> getMessage() {
		return getField(MESSAGE_FIELD).map(Object::toString);
	}

	/**
	 * Convenience accessor for the {@value #HOST_FIELD} field as a string.
	 *
	 * @return the host, or {@link Optional#empty()} if not yet assigned
	 */
	@NonNull
	public Optional<String> getHost() {
		return getField(HOST_FIELD).map(Object::toString);
	}

	/**
	 * All fields of this event, in insertion order.
	 *
	 * @return an unmodifiable view of this event's fields
	 */
	@NonNull
	public Map<@NonNull String, @Nullable Object> getFields() {
		return this.fields;
	}

	@Nullable
	private static Object immutableCopyOf(@Nullable Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<Object, Object> copy = new LinkedHashMap<>(map.size());

			for (Map.Entry<?, ?> entry : map.entrySet())
				copy.put(entry.getKey(), immutableCopyOf(entry.getValue()));

			return Collections.unmodifiableMap(copy);
		}

		if (value instanceof List<?> list) {
			List<Object> copy = new ArrayList<>(list.size());

			for (Object element : list)
				copy.add(immutableCopyOf(element));

			return Collections.unmodifiableList(copy);
		}

		return value;
	}
}
