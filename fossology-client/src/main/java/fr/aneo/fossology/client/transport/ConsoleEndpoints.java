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

import fr.aneo.fossology.client.model.FolderId;
import fr.aneo.fossology.client.model.ItemId;
import fr.aneo.fossology.client.model.JobId;
import fr.aneo.fossology.client.model.UploadId;

/**
 * Paths of the Fossology web console pages driven by the client, relative to the server URL.
 */
public final class ConsoleEndpoints {
  public static final String AUTH = "/repo/?mod=auth";
  public static final String UPLOAD_FILE = "/repo/?mod=upload_file";
  public static final String FOLDER_CREATE = "/repo/?mod=folder_create";
  public static final String AGENT_ADD = "/repo/?mod=agent_add";
  public static final String JOB_LIST = "/repo/?mod=ajaxShowJobs&do=showjb";
  public static final String BULK_TEXT_MATCH = "/repo/?mod=change-license-bulk";

  private ConsoleEndpoints() {
  }

  public static String uploadListing(FolderId folderId, long start, int length) {
    return "/repo/?mod=browse-processPost&folder=" + folderId.asString() + "&iDisplayStart=" + start + "&iDisplayLength=" + length;
  }

  public static String licenses(UploadId uploadId, ItemId itemId) {
    return "/repo/?mod=view-license&upload=" + uploadId.asString() + "&item=" + itemId.asString();
  }

  public static String singleJob(JobId jobId) {
    return "/repo/?mod=ajaxShowJobs&do=showSingleJob&jobId=" + jobId.asString();
  }

  public static String reportGeneration(String outputFormat, UploadId uploadId) {
    return "/repo/?mod=ui_spdx2&outputFormat=" + outputFormat + "&upload=" + uploadId.asString();
  }

  public static String download(long reportId) {
    return "/repo/?mod=download&report=" + reportId;
  }
}
