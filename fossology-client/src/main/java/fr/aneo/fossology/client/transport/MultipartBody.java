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

import com.google.common.net.MediaType;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Encoder for {@code multipart/form-data} bodies.
 */
final class MultipartBody {
  private static final String CRLF = "\r\n";

  private final String boundary;
  private final byte[] bytes;

  private MultipartBody(String boundary, byte[] bytes) {
    this.boundary = boundary;
    this.bytes = bytes;
  }

  static MultipartBody encode(List<MultipartField> fields) {
    return encode(fields, "----FossologyFormBoundary" + UUID.randomUUID().toString().replace("-", ""));
  }

  static MultipartBody encode(List<MultipartField> fields, String boundary) {
    requireNonNull(fields, "fields must not be null");
    requireNonNull(boundary, "boundary must not be null");

    var out = new ByteArrayOutputStream();
    for (var field : fields) {
      write(out, "--" + boundary + CRLF);
      var disposition = "Content-Disposition: form-data; name=\"" + quote(field.name()) + "\"";
      if (field.isFile()) {
        disposition += "; filename=\"" + quote(field.fileName()) + "\"";
      }
      write(out, disposition + CRLF);
      if (field.isFile()) {
        write(out, "Content-Type: " + field.contentType() + CRLF);
      }
      write(out, CRLF);
      out.writeBytes(field.content());
      write(out, CRLF);
    }
    write(out, "--" + boundary + "--" + CRLF);

    return new MultipartBody(boundary, out.toByteArray());
  }

  String boundary() {
    return boundary;
  }

  byte[] bytes() {
    return bytes;
  }

  String contentType() {
    return MediaType.create("multipart", "form-data").withParameter("boundary", boundary).toString();
  }

  private static void write(ByteArrayOutputStream out, String text) {
    out.writeBytes(text.getBytes(UTF_8));
  }

  // Quotes and line breaks would end the header value early.
  private static String quote(String value) {
    return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
  }
}
