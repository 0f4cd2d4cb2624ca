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

import com.sluice.exception.DecodeException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.sluice.TestSupport.utf8;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CodecTests {
	@Test
	public void plain_codec_yields_single_message_event() {
		List<Map<String, Object>> events = Codec.plain().decode(utf8("hello\nworld"), StandardCharsets.UTF_8);

		Assertions.assertEquals(List.of(Map.of("message", "hello\nworld")), events);
	}

	@Test
	public void plain_codec_yields_one_event_with_empty_message_for_empty_body() {
		List<Map<String, Object>> events = Codec.plain().decode(new byte[0], StandardCharsets.UTF_8);

		Assertions.assertEquals(1, events.size());
		Assertions.assertEquals("", events.get(0).get("message"));
	}

	@Test
	public void plain_codec_honors_charset() {
		byte[] latin1 = "café".getBytes(StandardCharsets.ISO_8859_1);

		List<Map<String, Object>> events = Codec.plain().decode(latin1, StandardCharsets.ISO_8859_1);

		Assertions.assertEquals("café", events.get(0).get("message"));
	}

	@Test
	public void line_codec_splits_on_newlines_in_order() {
		List<Map<String, Object>> events = Codec.line().decode(utf8("foo\nbar"), StandardCharsets.UTF_8);

		Assertions.assertEquals(List.of(Map.of("message", "foo"), Map.of("message", "bar")), events);
	}

	@Test
	public void line_codec_strips_carriage_returns_and_ignores_empty_final_segment() {
		List<Map<String, Object>> events = Codec.line().decode(utf8("one\r\ntwo\r\n"), StandardCharsets.UTF_8);

		Assertions.assertEquals(List.of(Map.of("message", "one"), Map.of("message", "two")), events);
	}

	@Test
	public void line_codec_keeps_interior_empty_lines() {
		List<Map<String, Object>> events = Codec.line().decode(utf8("a\n\nb"), StandardCharsets.UTF_8);

		Assertions.assertEquals(3, events.size());
		Assertions.assertEquals("", events.get(1).get("message"));
	}

	@Test
	public void json_codec_decodes_object_into_top_level_fields() {
		List<Map<String, Object>> events = Codec.json().decode(utf8("{\"message\":\"hello\",\"count\":3,\"nested\":{\"a\":true}}"), StandardCharsets.UTF_8);

		Assertions.assertEquals(1, events.size());
		Map<String, Object> fields = events.get(0);
		Assertions.assertEquals("hello", fields.get("message"));
		Assertions.assertEquals(3, fields.get("count"));
		Assertions.assertEquals(Map.of("a", true), fields.get("nested"));
	}

	@Test
	public void json_codec_decodes_array_of_objects_in_order() {
		List<Map<String, Object>> events = Codec.json().decode(utf8("[{\"id\":1},{\"id\":2}]"), StandardCharsets.UTF_8);

		Assertions.assertEquals(List.of(Map.of("id", 1), Map.of("id", 2)), events);
	}

	@Test
	public void json_codec_rejects_scalars() {
		DecodeException exception = Assertions.assertThrows(DecodeException.class,
				() -> Codec.json().decode(utf8("42"), StandardCharsets.UTF_8));

		Assertions.assertTrue(exception.getMessage().contains("number"), exception.getMessage());
	}

	@Test
	public void json_codec_rejects_arrays_containing_non_objects() {
		Assertions.assertThrows(DecodeException.class,
				() -> Codec.json().decode(utf8("[{\"id\":1},\"oops\"]"), StandardCharsets.UTF_8));
	}

	@Test
	public void json_codec_rejects_malformed_json() {
		DecodeException exception = Assertions.assertThrows(DecodeException.class,
				() -> Codec.json().decode(utf8("{\"message\":"), StandardCharsets.UTF_8));

		Assertions.assertTrue(exception.getMessage().startsWith("Malformed JSON"), exception.getMessage());
	}

	@Test
	public void json_codec_rejects_content_after_first_value() {
		for (String body : List.of("{\"message\":\"a\"}{\"message\":\"b\"}", "{\"message\":\"a\"} garbage", "[{\"a\":1}] [{\"a\":2}]"))
			Assertions.assertThrows(DecodeException.class, () -> Codec.json().decode(utf8(body), StandardCharsets.UTF_8), body);
	}

	@Test
	public void json_codec_allows_trailing_whitespace() {
		Assertions.assertEquals(List.of(Map.of("a", 1)), Codec.json().decode(utf8("{\"a\":1}  \n"), StandardCharsets.UTF_8));
	}

	@Test
	public void json_codec_yields_nothing_for_blank_body() {
		Assertions.assertTrue(Codec.json().decode(utf8("  \n"), StandardCharsets.UTF_8).isEmpty());
	}

	@Test
	public void json_lines_codec_decodes_each_non_blank_line() {
		List<Map<String, Object>> events = Codec.jsonLines().decode(utf8("{\"a\":1}\n\n{\"a\":2}\r\n"), StandardCharsets.UTF_8);

		Assertions.assertEquals(List.of(Map.of("a", 1), Map.of("a", 2)), events);
	}

	@Test
	public void json_lines_codec_reports_offending_line_number() {
		DecodeException exception = Assertions.assertThrows(DecodeException.class,
				() -> Codec.jsonLines().decode(utf8("{\"a\":1}\n[1,2]"), StandardCharsets.UTF_8));

		Assertions.assertTrue(exception.getMessage().startsWith("Line 2:"), exception.getMessage());
	}

	@Test
	public void json_lines_codec_rejects_two_objects_on_one_line() {
		DecodeException exception = Assertions.assertThrows(DecodeException.class,
				() -> Codec.jsonLines().decode(utf8("{\"a\":1}\n{\"a\":2}{\"a\":3}\n"), StandardCharsets.UTF_8));

		Assertions.assertTrue(exception.getMessage().startsWith("Line 2:"), exception.getMessage());
	}
}
