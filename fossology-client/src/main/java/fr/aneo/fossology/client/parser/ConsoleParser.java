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
package fr.aneo.fossology.client.parser;

import com.google.gson.JsonArray;
import fr.aneo.fossology.client.model.FolderId;
import fr.aneo.fossology.client.model.Folder;
import fr.aneo.fossology.client.model.Job;
import fr.aneo.fossology.client.model.License;
import fr.aneo.fossology.client.model.Page;
import fr.aneo.fossology.client.model.Upload;
import fr.aneo.fossology.client.model.UploadId;

import java.util.List;
import java.util.Optional;

/**
 * Extracts structured records from the pages and AJAX payloads returned by the Fossology
 * web console.
 * <p>
 * The console is an HTML user interface; its markup is not part of any stable contract and
 * varies between server versions. The client therefore delegates every markup-level decision
 * to an implementation of this interface and only relies on the shapes returned here.
 * <p>
 * Implementations must return entries in the order they appear in the page, since lookups
 * pick the first match (job lists, for instance, are rendered most recent first). They should
 * return empty results rather than throw when a page does not contain what was asked for.
 */
public interface ConsoleParser {

  /**
   * Lists the folders offered by the upload form.
   *
   * @param uploadPage the body of the {@code upload_file} page
   * @return every folder of the page, in page order
   */
  List<Folder> parseFolders(String uploadPage);

  /**
   * Extracts the hidden one-time token that must accompany an upload form submission.
   *
   * @param uploadPage the body of the {@code upload_file} page
   * @return the token, or empty if the page holds none
   */
  Optional<String> parseUploadFormToken(String uploadPage);

  /**
   * Extracts the identifier of the upload created by a file submission.
   *
   * @param uploadResultPage the body returned by the {@code upload_file} form post
   * @return the new upload identifier, or empty if the page does not link to one
   */
  Optional<UploadId> parseNewUploadId(String uploadResultPage);

  /**
   * Converts the {@code aaData} rows of a folder browse listing into uploads.
   *
   * @param rows     the {@code aaData} array of the {@code browse-processPost} JSON response
   * @param folderId the folder the listing was requested for
   * @return the uploads of the rows, in row order
   */
  List<Upload> parseUploads(JsonArray rows, FolderId folderId);

  /**
   * Lists the licenses of a {@code view-license} page.
   *
   * @param licensePage the body of the {@code view-license} page
   * @return every license of the page, in page order
   */
  List<License> parseLicenses(String licensePage);

  /**
   * Parses one page of the job list of an upload.
   *
   * @param jobListResponse the body returned by {@code ajaxShowJobs&do=showjb}
   * @return the jobs of the page, most recent first, and whether further pages exist
   */
  Page<Job> parseJobPage(String jobListResponse);

  /**
   * Parses the detail of a single job.
   *
   * @param singleJobResponse the body returned by {@code ajaxShowJobs&do=showSingleJob}
   * @return the job, or empty if the response describes no job
   */
  Optional<Job> parseJob(String singleJobResponse);
}
