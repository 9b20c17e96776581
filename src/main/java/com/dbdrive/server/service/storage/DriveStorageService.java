package com.dbdrive.server.service.storage;

import com.dbdrive.server.exception.BusinessException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.drive.DriveFile;
import com.dbdrive.server.model.drive.DriveFileList;
import com.dbdrive.server.model.drive.DriveResponse;
import com.dbdrive.server.model.internal.StorageFolder;
import com.dbdrive.server.model.internal.UploadResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Google Drive v3 over plain REST. Uploads use the resumable protocol in a single chunk.
 */
@Slf4j
@Service
public class DriveStorageService implements StorageService {

    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";

    private static final String FILE_FIELDS = "id,name,mimeType,size,webViewLink";

    private static final MediaType SQL_MEDIA_TYPE = MediaType.parseMediaType("application/sql");

    private static final DateTimeFormatter DESCRIPTION_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestClient restClient;

    private final CredentialService credentialService;

    private final String apiBaseUrl;

    // blank means drive root
    private final String parentFolderId;

    @Autowired
    public DriveStorageService(
            @Qualifier("driveRestClient") RestClient driveRestClient,
            CredentialService credentialService,
            @Value("${dbdrive.server.drive.apiBaseUrl:https://www.googleapis.com}") String apiBaseUrl,
            @Value("${dbdrive.server.drive.parentFolderId:}") String parentFolderId) {
        this.restClient = driveRestClient;
        this.credentialService = credentialService;
        this.apiBaseUrl = StringUtils.removeEnd(apiBaseUrl, "/");
        this.parentFolderId = parentFolderId;
    }

    @Override
    public StorageFolder findOrCreateFolder(String folderName) throws BusinessException {
        if (StringUtils.isBlank(folderName)) {
            throw new ValidationException("findOrCreateFolder failed. folderName is blank");
        }
        // 1. look up
        DriveFile folder = this.findFolder(folderName);
        if (ObjectUtils.isNotEmpty(folder)) {
            return new StorageFolder(folder.getId(), folder.getName());
        }
        // 2. create
        folder = this.createFolder(folderName);
        log.info("drive folder created. name is {}, id is {}", folderName, folder.getId());
        return new StorageFolder(folder.getId(), folder.getName());
    }

    @Override
    public UploadResult upload(Path artifact, StorageFolder folder) throws BusinessException {
        if (ObjectUtils.anyNull(artifact, folder) || !Files.isRegularFile(artifact)) {
            throw new ValidationException("upload failed. artifact is not a file or folder is null");
        }
        long size;
        try {
            size = Files.size(artifact);
        } catch (IOException e) {
            throw new BusinessException("upload failed. can't stat %s".formatted(artifact), e);
        }
        // 1. open a resumable session with the metadata
        DriveFile metadata = new DriveFile();
        metadata.setName(artifact.getFileName().toString());
        metadata.setDescription("Database backup created on %s".formatted(
                LocalDateTime.now().format(DESCRIPTION_FORMATTER)));
        metadata.setParents(List.of(folder.getFolderId()));
        DriveResponse<URI> sessionResponse = this.handleClientResponse(
                this.restClient.post()
                        .uri(this.apiBaseUrl + "/upload/drive/v3/files?uploadType=resumable&fields={fields}",
                                FILE_FIELDS)
                        .headers(this::authorize)
                        .header("X-Upload-Content-Type", SQL_MEDIA_TYPE.toString())
                        .header("X-Upload-Content-Length", String.valueOf(size))
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(metadata),
                (statusCode, headers, body) -> headers.getLocation());
        if (!sessionResponse.isSuccess() || ObjectUtils.isEmpty(sessionResponse.getData())) {
            throw new BusinessException("upload failed. can't open upload session.",
                    sessionResponse.getBusinessException());
        }
        // 2. send the content
        DriveResponse<DriveFile> uploadResponse = this.handleClientResponse(
                this.restClient.put()
                        .uri(sessionResponse.getData())
                        .headers(this::authorize)
                        .contentType(SQL_MEDIA_TYPE)
                        .contentLength(size)
                        .body(new FileSystemResource(artifact)),
                DriveFile.class);
        if (!uploadResponse.isSuccess()) {
            throw new BusinessException("upload failed. file is %s".formatted(artifact.getFileName()),
                    uploadResponse.getBusinessException());
        }
        DriveFile uploaded = uploadResponse.getData();
        log.info("drive upload success. file is {}, id is {}", uploaded.getName(), uploaded.getId());
        return UploadResult.builder()
                .fileId(uploaded.getId())
                .fileName(uploaded.getName())
                .size(size)
                .webViewLink(uploaded.getWebViewLink())
                .build();
    }

    private DriveFile findFolder(String folderName) throws BusinessException {
        String query = "name='%s' and mimeType='%s' and trashed=false".formatted(
                escapeQueryValue(folderName), FOLDER_MIME_TYPE);
        if (StringUtils.isNotBlank(this.parentFolderId)) {
            query += " and '%s' in parents".formatted(escapeQueryValue(this.parentFolderId));
        }
        DriveResponse<DriveFileList> driveResponse = this.handleClientResponse(
                this.restClient.get()
                        .uri(UriComponentsBuilder.fromHttpUrl(this.apiBaseUrl + "/drive/v3/files")
                                .queryParam("q", "{q}")
                                .queryParam("spaces", "drive")
                                .queryParam("fields", "{fields}")
                                .queryParam("pageSize", 10)
                                .encode()
                                .buildAndExpand(query, "files(id,name)")
                                .toUri())
                        .headers(this::authorize),
                DriveFileList.class);
        if (!driveResponse.isSuccess()) {
            throw new BusinessException("findFolder failed. folderName is %s".formatted(folderName),
                    driveResponse.getBusinessException());
        }
        DriveFileList fileList = driveResponse.getData();
        if (ObjectUtils.isEmpty(fileList) || CollectionUtils.isEmpty(fileList.getFiles())) {
            return null;
        }
        return fileList.getFiles().get(0);
    }

    private DriveFile createFolder(String folderName) throws BusinessException {
        DriveFile metadata = new DriveFile();
        metadata.setName(folderName);
        metadata.setMimeType(FOLDER_MIME_TYPE);
        if (StringUtils.isNotBlank(this.parentFolderId)) {
            metadata.setParents(List.of(this.parentFolderId));
        }
        DriveResponse<DriveFile> driveResponse = this.handleClientResponse(
                this.restClient.post()
                        .uri(this.apiBaseUrl + "/drive/v3/files?fields={fields}", "id,name")
                        .headers(this::authorize)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(metadata),
                DriveFile.class);
        if (!driveResponse.isSuccess()) {
            throw new BusinessException("createFolder failed. folderName is %s".formatted(folderName),
                    driveResponse.getBusinessException());
        }
        return driveResponse.getData();
    }

    private void authorize(HttpHeaders headers) {
        headers.setBearerAuth(this.credentialService.validCredential());
    }

    // drive query strings quote with ' and escape with \
    static String escapeQueryValue(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    private <T> DriveResponse<T> handleClientResponse(
            RestClient.RequestHeadersSpec<?> requestSpec,
            Class<T> dataType) {
        return this.handleClientResponse(
                requestSpec,
                (statusCode, headers, response) -> response.bodyTo(dataType));
    }

    private <T> DriveResponse<T> handleClientResponse(
            RestClient.RequestHeadersSpec<?> requestSpec,
            ResponseExtractor<T> extractor) {
        try {
            return requestSpec.exchange((httpRequest, httpResponse) -> {
                HttpStatusCode statusCode = httpResponse.getStatusCode();
                if (statusCode.is2xxSuccessful()) {
                    return DriveResponse.success(
                            statusCode.value(),
                            extractor.extract(statusCode, httpResponse.getHeaders(), httpResponse));
                } else {
                    // non 2xx, keep the body for the error message
                    return DriveResponse.error(
                            statusCode.value(),
                            new String(httpResponse.getBody().readAllBytes(), StandardCharsets.UTF_8));
                }
            });
        } catch (Exception e) {
            return DriveResponse.error(e);
        }
    }

    @FunctionalInterface
    private interface ResponseExtractor<T> {

        T extract(
                HttpStatusCode statusCode,
                HttpHeaders headers,
                RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse response) throws IOException;
    }
}
