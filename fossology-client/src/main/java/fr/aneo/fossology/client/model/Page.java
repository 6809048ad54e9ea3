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
package fr.aneo.fossology.client.model;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One page of a collection listed by the server.
 *
 * @param items   the entries of this page, in server order
 * @param hasNext whether the server reports further pages after this one
 * @param <T>     the type of the entries
 */
public record Page<T>(List<T> items, boolean hasNext) {

  public Page {
    requireNonNull(items, "items must not be null");
    items = List.copyOf(items);
  }

  public static <T> Page<T> last(List<T> items) {
    return new Page<>(items, false);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
