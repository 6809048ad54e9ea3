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
package fr.aneo.fossology.client.license;

import fr.aneo.fossology.client.model.ItemId;
import fr.aneo.fossology.client.transport.FormData;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Builds the form of a bulk text match covering a whole upload.
 * <p>
 * Each action is submitted as three fields indexed by its position in the list:
 * <pre>{@code
 * bulkAction[0][licenseId]=10
 * bulkAction[0][licenseName]=MIT
 * bulkAction[0][action]=add
 * }</pre>
 * Actions are neither deduplicated nor checked against each other; when the same license is
 * both added and removed, the server decides which one wins.
 */
public final class BulkTextMatchRequestBuilder {
  // "u" applies the decisions to the whole upload rather than to the selected item only.
  static final String UPLOAD_SCOPE = "u";

  private BulkTextMatchRequestBuilder() {
  }

  /**
   * Builds the bulk text match form.
   *
   * @param referenceText the text to look for
   * @param itemId        the upload tree item the match starts from (not the upload identifier)
   * @param actions       the license decisions, in submission order
   * @return the form fields
   * @throws NullPointerException if any argument or action is null
   */
  public static FormData buildRequest(String referenceText, ItemId itemId, List<BulkTextMatchAction> actions) {
    requireNonNull(referenceText, "referenceText must not be null");
    requireNonNull(itemId, "itemId must not be null");
    requireNonNull(actions, "actions must not be null");

    var form = FormData.builder()
                       .add("refText", referenceText)
                       .add("bulkScope", UPLOAD_SCOPE)
                       .add("uploadTreeId", itemId.asString())
                       .add("forceDecision", "0");

    for (int row = 0; row < actions.size(); row++) {
      var action = requireNonNull(actions.get(row), "actions must not contain null");
      var prefix = "bulkAction[" + row + "]";
      form.add(prefix + "[licenseId]", action.licenseId().asString())
          .add(prefix + "[licenseName]", action.licenseName())
          .add(prefix + "[action]", action.action().value());
    }

    return form.build();
  }
}
