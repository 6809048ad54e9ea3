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

import fr.aneo.fossology.client.model.FolderId;
import fr.aneo.fossology.client.model.Upload;
import fr.aneo.fossology.client.model.UploadId;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Resolves folder and upload names to server identifiers, and manages folders and uploads.
 * <p>
 * Names are not unique on the server. Lookups return the first entry, in server order, that
 * matches; callers needing to tell apart entries with the same name should work with
 * identifiers.
 *
 * @see DefaultFolderUploadLocator
 */
public interface FolderUploadLocator {

  /**
   * Finds the folder with exactly the given name.
   *
   * @param folderName the folder display name
   * @return the folder identifier, or empty if no folder has this name
   */
  Optional<FolderId> resolveFolder(String folderName);

  /**
   * Finds an upload of a folder by name.
   * <p>
   * The folder listing is read page by page until a match is found or the listing is exhausted.
   *
   * @param folderId   the folder to search
   * @param uploadName the name, or part of the name, to look for
   * @param exactMatch if true, the upload name must equal {@code uploadName};
   *                   otherwise it must contain it
   * @return the identifier of the first matching upload, or empty if none matches
   */
  Optional<UploadId> resolveUpload(FolderId folderId, String uploadName, boolean exactMatch);

  /**
   * Lists every upload of a folder, in server order.
   *
   * @param folderId the folder to list
   * @return the uploads of the folder
   */
  List<Upload> listUploads(FolderId folderId);

  /**
   * Creates a folder. The new folder's identifier is not returned by the server; resolve it by
   * name afterwards.
   *
   * @param parentId    the parent folder
   * @param folderName  the name of the new folder
   * @param description the description of the new folder, possibly empty
   */
  void createFolder(FolderId parentId, String folderName, String description);

  /**
   * Uploads a file into a folder without starting any scanning agent.
   *
   * @param file     the file to upload
   * @param folderId the folder receiving the upload
   * @return the identifier of the new upload, or empty if the server response does not reveal it
   */
  Optional<UploadId> uploadFile(Path file, FolderId folderId);
}
