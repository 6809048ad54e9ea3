/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.fossology.client.transport;

import org.junit.jupiter.api.Test;

import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultipartBodyTest {

  @Test
  void should_encode_text_and_file_parts_in_order() {
    // Given
    var fields = List.of(
      MultipartField.text("uploadformbuild", "tok"),
      MultipartField.file("fileInput", "a.txt", "text/plain", "hello".getBytes(UTF_8)),
      MultipartField.text("deciderRules[]", ""));

    // When
    var body = MultipartBody.encode(fields, "XYZ");

    // Then
    assertThat(new String(body.bytes(), UTF_8)).isEqualTo(
      "--XYZ\r\n" +
        "Content-Disposition: form-data; name=\"uploadformbuild\"\r\n" +
        "\r\n" +
        "tok\r\n" +
        "--XYZ\r\n" +
        "Content-Disposition: form-data; name=\"fileInput\"; filename=\"a.txt\"\r\n" +
        "Content-Type: text/plain\r\n" +
        "\r\n" +
        "hello\r\n" +
        "--XYZ\r\n" +
        "Content-Disposition: form-data; name=\"deciderRules[]\"\r\n" +
        "\r\n" +
        "\r\n" +
        "--XYZ--\r\n");
    assertThat(body.contentType()).isEqualTo("multipart/form-data; boundary=XYZ");
  }

  @Test
  void should_escape_quotes_and_line_breaks_in_file_names() {
    // When
    var body = MultipartBody.encode(List.of(MultipartField.file("fileInput", "a\"b\r\n.txt", "text/plain", new byte[0])), "B");

    // Then
    assertThat(new String(body.bytes(), UTF_8)).contains("filename=\"a%22b%0D%0A.txt\"");
  }

  @Test
  void generated_boundaries_differ_between_bodies() {
    // When
    var first = MultipartBody.encode(List.of(MultipartField.text("a", "1")));
    var second = MultipartBody.encode(List.of(MultipartField.text("a", "1")));

    // Then
    assertThat(first.boundary()).isNotEqualTo(second.boundary());
    assertThat(new String(first.bytes(), UTF_8)).endsWith("--" + first.boundary() + "--\r\n");
  }

  @Test
  void file_part_requires_a_content_type() {
    assertThatThrownBy(() -> MultipartField.file("fileInput", "a.txt", null, new byte[0])).isInstanceOf(IllegalArgumentException.class);
  }
}
