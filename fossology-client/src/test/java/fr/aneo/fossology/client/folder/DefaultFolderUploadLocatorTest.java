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

import com.google.gson.JsonArray;
import fr.aneo.fossology.client.TestDataFactory;
import fr.aneo.fossology.client.model.Folder;
import fr.aneo.fossology.client.model.FolderId;
import fr.aneo.fossology.client.model.Upload;
import fr.aneo.fossology.client.model.UploadId;
import fr.aneo.fossology.client.parser.ConsoleParser;
import fr.aneo.fossology.client.transport.ConsoleEndpoints;
import fr.aneo.fossology.client.transport.ConsoleTransport;
import fr.aneo.fossology.client.transport.FormData;
import fr.aneo.fossology.client.transport.MultipartField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static fr.aneo.fossology.client.TestDataFactory.ok;
import static fr.aneo.fossology.client.transport.ConsoleEndpoints.FOLDER_CREATE;
import static fr.aneo.fossology.client.transport.ConsoleEndpoints.UPLOAD_FILE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultFolderUploadLocatorTest {
  private static final FolderId FOLDER = FolderId.from(3);

  @TempDir
  Path tempDir;

  private ConsoleTransport transport;
  private ConsoleParser parser;
  private DefaultFolderUploadLocator locator;

  @BeforeEach
  void setUp() {
    transport = mock(ConsoleTransport.class);
    parser = mock(ConsoleParser.class);
    locator = new DefaultFolderUploadLocator(transport, parser, 2);
    when(parser.parseUploads(any(JsonArray.class), eq(FOLDER)))
      .thenAnswer(invocation -> TestDataFactory.uploadsOf(invocation.getArgument(0), FOLDER));
  }

  @Test
  @DisplayName("resolves a folder by exact name")
  void resolves_a_folder_by_exact_name() {
    // Given
    when(transport.get(UPLOAD_FILE)).thenReturn(ok("upload-page"));
    when(parser.parseFolders("upload-page")).thenReturn(List.of(
      new Folder(FolderId.from(1), "Software Repository"),
      new Folder(FolderId.from(3), "Releases")));

    // Then
    assertThat(locator.resolveFolder("Releases")).contains(FolderId.from(3));
    assertThat(locator.resolveFolder("releases")).isEmpty();
    assertThat(locator.resolveFolder("Release")).isEmpty();
  }

  @Test
  @DisplayName("exact lookup ignores uploads that only contain the name")
  void exact_lookup_ignores_uploads_that_only_contain_the_name() {
    // Given
    listing(0, "{\"iTotalDisplayRecords\": 2, \"aaData\": [[11, \"lib-1.0-old\"], [12, \"lib-1.0\"]]}");

    // Then
    assertThat(locator.resolveUpload(FOLDER, "lib-1.0", true)).contains(UploadId.from(12));
    assertThat(locator.resolveUpload(FOLDER, "lib-1.0", false)).contains(UploadId.from(11));
    assertThat(locator.resolveUpload(FOLDER, "1.0-old", false)).contains(UploadId.from(11));
    assertThat(locator.resolveUpload(FOLDER, "lib-2.0", true)).isEmpty();
  }

  @Test
  @DisplayName("follows the listing pages until the upload is found")
  void follows_the_listing_pages_until_the_upload_is_found() {
    // Given
    listing(0, "{\"iTotalDisplayRecords\": 5, \"aaData\": [[1, \"a\"], [2, \"b\"]]}");
    listing(2, "{\"iTotalDisplayRecords\": 5, \"aaData\": [[3, \"c\"], [4, \"d\"]]}");
    listing(4, "{\"iTotalDisplayRecords\": 5, \"aaData\": [[5, \"e\"]]}");

    // When
    var found = locator.resolveUpload(FOLDER, "d", true);

    // Then
    assertThat(found).contains(UploadId.from(4));
    verify(transport, never()).get(ConsoleEndpoints.uploadListing(FOLDER, 4, 2));
  }

  @Test
  @DisplayName("stops after the last page reported by the server")
  void stops_after_the_last_page_reported_by_the_server() {
    // Given
    listing(0, "{\"iTotalDisplayRecords\": 2, \"aaData\": [[1, \"a\"], [2, \"b\"]]}");

    // When
    var found = locator.resolveUpload(FOLDER, "z", true);

    // Then
    assertThat(found).isEmpty();
    verify(transport, never()).get(ConsoleEndpoints.uploadListing(FOLDER, 2, 2));
  }

  @Test
  @DisplayName("lists the uploads of every page")
  void lists_the_uploads_of_every_page() {
    // Given
    listing(0, "{\"iTotalDisplayRecords\": 3, \"aaData\": [[1, \"a\"], [2, \"b\"]]}");
    listing(2, "{\"iTotalDisplayRecords\": 3, \"aaData\": [[3, \"c\"]]}");

    // When
    var uploads = locator.listUploads(FOLDER);

    // Then
    assertThat(uploads).extracting(Upload::name).containsExactly("a", "b", "c");
  }

  @Test
  @DisplayName("unexpected listings are treated as empty")
  void unexpected_listings_are_treated_as_empty() {
    // Given
    listing(0, "<html>Session expired</html>");

    // Then
    assertThat(locator.resolveUpload(FOLDER, "a", false)).isEmpty();
    assertThat(locator.listUploads(FOLDER)).isEmpty();
  }

  @Test
  @DisplayName("a listing without rows or total ends the lookup")
  void a_listing_without_rows_or_total_ends_the_lookup() {
    // Given
    listing(0, "{\"aaData\": [[1, \"a\"], [2, \"b\"]]}");

    // When
    var uploads = locator.listUploads(FOLDER);

    // Then
    assertThat(uploads).hasSize(2);
    verify(transport, never()).get(ConsoleEndpoints.uploadListing(FOLDER, 2, 2));

    // Given
    listing(0, "{\"iTotalDisplayRecords\": 10}");

    // Then
    assertThat(locator.listUploads(FOLDER)).isEmpty();
  }

  @Test
  @DisplayName("creates a folder under its parent")
  void creates_a_folder_under_its_parent() {
    // When
    locator.createFolder(FolderId.from(1), "Releases", null);

    // Then
    var form = ArgumentCaptor.forClass(FormData.class);
    verify(transport).post(eq(FOLDER_CREATE), form.capture());
    assertThat(form.getValue()).isEqualTo(FormData.builder()
                                                  .add("parentid", "1")
                                                  .add("newname", "Releases")
                                                  .add("description", "")
                                                  .build());
  }

  @Test
  @DisplayName("uploads a file with the upload form token and agents unchecked")
  @SuppressWarnings("unchecked")
  void uploads_a_file_with_the_upload_form_token_and_agents_unchecked() throws IOException {
    // Given
    var file = Files.writeString(tempDir.resolve("lib-1.0.tar"), "archive", UTF_8);
    when(transport.get(UPLOAD_FILE)).thenReturn(ok("upload-page"));
    when(parser.parseUploadFormToken("upload-page")).thenReturn(Optional.of("token-123"));
    when(transport.postMultipart(eq(UPLOAD_FILE), anyList())).thenReturn(ok("upload-result"));
    when(parser.parseNewUploadId("upload-result")).thenReturn(Optional.of(UploadId.from(77)));

    // When
    var uploadId = locator.uploadFile(file, FOLDER);

    // Then
    assertThat(uploadId).contains(UploadId.from(77));
    ArgumentCaptor<List<MultipartField>> fields = ArgumentCaptor.forClass(List.class);
    verify(transport).postMultipart(eq(UPLOAD_FILE), fields.capture());
    assertThat(fields.getValue()).extracting(MultipartField::name).containsExactly(
      "uploadformbuild", "folder", "fileInput", "descriptionInputName", "public",
      "Check_agent_bucket", "Check_agent_copyright", "Check_agent_ecc", "Check_agent_mimetype",
      "Check_agent_nomos", "Check_agent_monk", "Check_agent_pkgagent", "deciderRules[]");
    assertThat(fields.getValue()).filteredOn(field -> !field.isFile())
                                 .extracting(field -> field.name() + "=" + new String(field.content(), UTF_8))
                                 .contains("uploadformbuild=token-123", "folder=3", "descriptionInputName=lib-1.0.tar",
                                           "public=private", "Check_agent_monk=0", "deciderRules[]=");
    var filePart = fields.getValue().get(2);
    assertThat(filePart.fileName()).isEqualTo("lib-1.0.tar");
    assertThat(new String(filePart.content(), UTF_8)).isEqualTo("archive");
    assertThat(filePart.contentType()).isNotBlank();
  }

  @Test
  @DisplayName("does not upload without a form token")
  void does_not_upload_without_a_form_token() throws IOException {
    // Given
    var file = Files.writeString(tempDir.resolve("a.txt"), "x", UTF_8);
    when(transport.get(UPLOAD_FILE)).thenReturn(ok("login-page"));
    when(parser.parseUploadFormToken(anyString())).thenReturn(Optional.empty());

    // When
    var uploadId = locator.uploadFile(file, FOLDER);

    // Then
    assertThat(uploadId).isEmpty();
    verify(transport, never()).postMultipart(anyString(), anyList());
  }

  private void listing(long start, String json) {
    when(transport.get(ConsoleEndpoints.uploadListing(FOLDER, start, 2))).thenReturn(ok(json));
  }
}
