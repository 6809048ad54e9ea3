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
package fr.aneo.fossology.client.folder;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fr.aneo.fossology.client.exception.FossologyException;
import fr.aneo.fossology.client.model.Folder;
import fr.aneo.fossology.client.model.FolderId;
import fr.aneo.fossology.client.model.Page;
import fr.aneo.fossology.client.model.Upload;
import fr.aneo.fossology.client.model.UploadId;
import fr.aneo.fossology.client.parser.ConsoleParser;
import fr.aneo.fossology.client.transport.ConsoleEndpoints;
import fr.aneo.fossology.client.transport.ConsoleTransport;
import fr.aneo.fossology.client.transport.FormData;
import fr.aneo.fossology.client.transport.MultipartField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static fr.aneo.fossology.client.transport.ConsoleEndpoints.FOLDER_CREATE;
import static fr.aneo.fossology.client.transport.ConsoleEndpoints.UPLOAD_FILE;
import static java.util.Objects.requireNonNull;

/**
 * {@link FolderUploadLocator} reading the console's upload form and folder browse listing.
 * <p>
 * Folders are read from the folder selector of the upload form. Uploads are read from the
 * {@code browse-processPost} JSON listing, {@code pageSize} rows at a time, following the
 * {@code iTotalDisplayRecords} count reported by the server.
 */
public final class DefaultFolderUploadLocator implements FolderUploadLocator {
  private static final Logger logger = LoggerFactory.getLogger(DefaultFolderUploadLocator.class);

  static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
  static final List<String> SCAN_AGENT_CHECKBOXES = List.of(
    "Check_agent_bucket",
    "Check_agent_copyright",
    "Check_agent_ecc",
    "Check_agent_mimetype",
    "Check_agent_nomos",
    "Check_agent_monk",
    "Check_agent_pkgagent"
  );

  private final ConsoleTransport transport;
  private final ConsoleParser parser;
  private final int pageSize;

  public DefaultFolderUploadLocator(ConsoleTransport transport, ConsoleParser parser, int pageSize) {
    if (pageSize < 1) throw new IllegalArgumentException("pageSize must be at least 1, got: " + pageSize);

    this.transport = requireNonNull(transport, "transport must not be null");
    this.parser = requireNonNull(parser, "parser must not be null");
    this.pageSize = pageSize;
  }

  @Override
  public Optional<FolderId> resolveFolder(String folderName) {
    requireNonNull(folderName, "folderName must not be null");

    var uploadPage = transport.get(UPLOAD_FILE).bodyAsString();
    var folderId = parser.parseFolders(uploadPage)
                         .stream()
                         .filter(folder -> folder.name().equals(folderName))
                         .map(Folder::id)
                         .findFirst();

    if (folderId.isEmpty()) logger.debug("No folder named '{}'", folderName);
    return folderId;
  }

  @Override
  public Optional<UploadId> resolveUpload(FolderId folderId, String uploadName, boolean exactMatch) {
    requireNonNull(folderId, "folderId must not be null");
    requireNonNull(uploadName, "uploadName must not be null");

    Predicate<Upload> matcher = exactMatch
      ? upload -> upload.name().equals(uploadName)
      : upload -> upload.name().contains(uploadName);

    long start = 0;
    while (true) {
      var page = fetchUploadPage(folderId, start);
      var match = page.items().stream().filter(matcher).findFirst();
      if (match.isPresent()) return match.map(Upload::id);
      if (!page.hasNext()) break;
      start += pageSize;
    }

    logger.debug("No upload {} '{}' in {}", exactMatch ? "named" : "containing", uploadName, folderId);
    return Optional.empty();
  }

  @Override
  public List<Upload> listUploads(FolderId folderId) {
    requireNonNull(folderId, "folderId must not be null");

    var uploads = new ArrayList<Upload>();
    long start = 0;
    Page<Upload> page;
    do {
      page = fetchUploadPage(folderId, start);
      uploads.addAll(page.items());
      start += pageSize;
    } while (page.hasNext());

    return uploads;
  }

  @Override
  public void createFolder(FolderId parentId, String folderName, String description) {
    requireNonNull(parentId, "parentId must not be null");
    requireNonNull(folderName, "folderName must not be null");

    var form = FormData.builder()
                       .add("parentid", parentId.asString())
                       .add("newname", folderName)
                       .add("description", description == null ? "" : description)
                       .build();
    transport.post(FOLDER_CREATE, form);
    logger.info("Requested creation of folder '{}' under {}", folderName, parentId);
  }

  @Override
  public Optional<UploadId> uploadFile(Path file, FolderId folderId) {
    requireNonNull(file, "file must not be null");
    requireNonNull(folderId, "folderId must not be null");

    var fileName = file.getFileName().toString();
    byte[] content;
    String contentType;
    try {
      content = Files.readAllBytes(file);
      contentType = Optional.ofNullable(Files.probeContentType(file)).orElse(DEFAULT_CONTENT_TYPE);
    } catch (IOException e) {
      throw new FossologyException("Unable to read file to upload " + file, e);
    }

    var token = parser.parseUploadFormToken(transport.get(UPLOAD_FILE).bodyAsString());
    if (token.isEmpty()) {
      logger.warn("Upload form token not found, cannot upload {}", file);
      return Optional.empty();
    }

    var fields = new ArrayList<MultipartField>();
    fields.add(MultipartField.text("uploadformbuild", token.get()));
    fields.add(MultipartField.text("folder", folderId.asString()));
    fields.add(MultipartField.file("fileInput", fileName, contentType, content));
    fields.add(MultipartField.text("descriptionInputName", fileName));
    fields.add(MultipartField.text("public", "private"));
    SCAN_AGENT_CHECKBOXES.forEach(checkbox -> fields.add(MultipartField.text(checkbox, "0")));
    fields.add(MultipartField.text("deciderRules[]", ""));

    var response = transport.postMultipart(UPLOAD_FILE, fields);
    var uploadId = parser.parseNewUploadId(response.bodyAsString());
    uploadId.ifPresentOrElse(
      id -> logger.info("Uploaded {} to {} as {}", fileName, folderId, id),
      () -> logger.warn("Upload of {} to {} did not report an upload id", fileName, folderId));

    return uploadId;
  }

  private Page<Upload> fetchUploadPage(FolderId folderId, long start) {
    var body = transport.get(ConsoleEndpoints.uploadListing(folderId, start, pageSize)).bodyAsString();

    JsonObject listing;
    try {
      JsonElement element = JsonParser.parseString(body);
      if (!element.isJsonObject()) {
        logger.warn("Unexpected upload listing for {} at offset {}: not a JSON object", folderId, start);
        return Page.last(List.of());
      }
      listing = element.getAsJsonObject();
    } catch (JsonParseException e) {
      logger.warn("Unexpected upload listing for {} at offset {}: {}", folderId, start, e.getMessage());
      return Page.last(List.of());
    }

    var rows = listing.get("aaData");
    if (rows == null || !rows.isJsonArray() || rows.getAsJsonArray().isEmpty()) return Page.last(List.of());

    var uploads = parser.parseUploads(rows.getAsJsonArray(), folderId);
    var hasNext = totalCount(listing).map(total -> start + pageSize < total).orElse(false);

    return new Page<>(uploads, hasNext);
  }

  // Missing or unreadable totals end the listing after the current page.
  private static Optional<Long> totalCount(JsonObject listing) {
    var total = listing.get("iTotalDisplayRecords");
    if (total == null || !total.isJsonPrimitive()) return Optional.empty();
    try {
      return Optional.of(total.getAsLong());
    } catch (NumberFormatException e) {
      logger.warn("Ignoring unreadable iTotalDisplayRecords '{}'", total.getAsString());
      return Optional.empty();
    }
  }
}
