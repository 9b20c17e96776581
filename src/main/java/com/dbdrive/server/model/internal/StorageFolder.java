package com.dbdrive.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StorageFolder {

    private String folderId;

    private String folderName;
}
