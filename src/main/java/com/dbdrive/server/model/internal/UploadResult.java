package com.dbdrive.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResult {

    private String fileId;

    private String fileName;

    private long size;

    private String webViewLink;
}
