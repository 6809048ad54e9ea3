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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * One part of a {@code multipart/form-data} submission.
 * <p>
 * A part is either a plain text field or a file. File parts carry the file name and content type
 * the browser would send with them.
 *
 * @param name        the form field name
 * @param fileName    the submitted file name, or {@code null} for a text field
 * @param contentType the content type of the file, or {@code null} for a text field
 * @param content     the raw content of the part
 */
public record MultipartField(String name, String fileName, String contentType, byte[] content) {

  public MultipartField {
    requireNonNull(name, "name must not be null");
    requireNonNull(content, "content must not be null");
    if (fileName != null && contentType == null) {
      throw new IllegalArgumentException("contentType is required for file part '" + name + "'");
    }
  }

  public static MultipartField text(String name, String value) {
    requireNonNull(value, "value must not be null");
    return new MultipartField(name, null, null, value.getBytes(UTF_8));
  }

  public static MultipartField file(String name, String fileName, String contentType, byte[] content) {
    requireNonNull(fileName, "fileName must not be null");
    return new MultipartField(name, fileName, contentType, content);
  }

  public boolean isFile() {
    return fileName != null;
  }

  @Override
  public String toString() {
    return isFile()
      ? "MultipartField[name=" + name + ", fileName=" + fileName + ", contentType=" + contentType + ", size=" + content.length + ']'
      : "MultipartField[name=" + name + ", value=" + new String(content, UTF_8) + ']';
  }
}
