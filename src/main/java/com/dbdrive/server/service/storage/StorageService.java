package com.dbdrive.server.service.storage;

import com.dbdrive.server.exception.BusinessException;
import com.dbdrive.server.model.internal.StorageFolder;
import com.dbdrive.server.model.internal.UploadResult;

import java.nio.file.Path;

/**
 * Remote storage the artifacts are uploaded to.
 */
public interface StorageService {

    /**
     * Returns the folder with the given name, creating it when absent. Two concurrent callers
     * may both create it.
     */
    StorageFolder findOrCreateFolder(String folderName) throws BusinessException;

    UploadResult upload(Path artifact, StorageFolder folder) throws BusinessException;
}
