package com.dbdrive.server.model.drive;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DriveFileList {

    @JsonProperty("files")
    private List<DriveFile> files = new ArrayList<>();

    @JsonProperty("nextPageToken")
    private String nextPageToken;
}
