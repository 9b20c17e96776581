package com.dbdrive.server.model.drive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriveFile {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("mimeType")
    private String mimeType;

    @JsonProperty("description")
    private String description;

    @JsonProperty("parents")
    private List<String> parents;

    // drive returns int64 as string
    @JsonProperty("size")
    private String size;

    @JsonProperty("webViewLink")
    private String webViewLink;
}
