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

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * Immutable, ordered set of form fields submitted to the console.
 * <p>
 * The console's form handlers follow PHP conventions: a field whose name ends with {@code []}
 * may appear several times and is read as an array. Fields are therefore kept as an ordered
 * list of name/value pairs where a name may repeat; insertion order is preserved in the
 * encoded body.
 *
 * <pre>{@code
 * var form = FormData.builder()
 *                    .add("agents[]", "agent_monk")
 *                    .add("agents[]", "agent_nomos")
 *                    .add("upload", "42")
 *                    .build();
 * }</pre>
 */
public final class FormData {
  private static final Escaper ESCAPER = UrlEscapers.urlFormParameterEscaper();

  private final List<Map.Entry<String, String>> fields;

  private FormData(List<Map.Entry<String, String>> fields) {
    this.fields = List.copyOf(fields);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FormData empty() {
    return new FormData(List.of());
  }

  /**
   * @return every field in insertion order, repeated names included
   */
  public List<Map.Entry<String, String>> entries() {
    return fields;
  }

  /**
   * @return the distinct field names in order of first appearance
   */
  public Set<String> names() {
    var names = new LinkedHashSet<String>();
    fields.forEach(field -> names.add(field.getKey()));
    return names;
  }

  /**
   * Returns the first value of the given field.
   *
   * @param name the field name
   * @return the first value, or empty if the field is absent
   */
  public Optional<String> value(String name) {
    return fields.stream()
                 .filter(field -> field.getKey().equals(name))
                 .map(Map.Entry::getValue)
                 .findFirst();
  }

  /**
   * @param name the field name
   * @return every value of the given field, in insertion order
   */
  public List<String> values(String name) {
    return fields.stream()
                 .filter(field -> field.getKey().equals(name))
                 .map(Map.Entry::getValue)
                 .collect(toList());
  }

  /**
   * Returns the fields as a map from name to values, keeping the order of first appearance.
   *
   * @return a new map view of the fields
   */
  public Map<String, List<String>> toMap() {
    var map = new LinkedHashMap<String, List<String>>();
    fields.forEach(field -> map.computeIfAbsent(field.getKey(), key -> new ArrayList<>()).add(field.getValue()));
    return map;
  }

  public int size() {
    return fields.size();
  }

  /**
   * Encodes the fields as an {@code application/x-www-form-urlencoded} body.
   *
   * @return the encoded body
   */
  public String encode() {
    return fields.stream()
                 .map(field -> ESCAPER.escape(field.getKey()) + "=" + ESCAPER.escape(field.getValue()))
                 .collect(joining("&"));
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    return fields.equals(((FormData) obj).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "FormData" + toMap();
  }

  /**
   * Builder for {@link FormData}.
   */
  public static final class Builder {
    private final List<Map.Entry<String, String>> fields = new ArrayList<>();

    private Builder() {
    }

    /**
     * Appends a field. Adding the same name twice keeps both values.
     *
     * @param name  the field name
     * @param value the field value
     * @return this builder
     * @throws NullPointerException if name or value is null
     */
    public Builder add(String name, String value) {
      requireNonNull(name, "name must not be null");
      requireNonNull(value, "value must not be null");
      fields.add(new SimpleImmutableEntry<>(name, value));
      return this;
    }

    public Builder add(String name, long value) {
      return add(name, Long.toString(value));
    }

    public Builder addAll(FormData other) {
      requireNonNull(other, "other must not be null");
      fields.addAll(other.fields);
      return this;
    }

    public FormData build() {
      return new FormData(fields);
    }
  }
}
