package com.flagship.trade_finance.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_finance.query.DocumentUpload;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DocumentUploadResponse {

    @JsonProperty("pdf_url")
    String pdfUrl;

    @JsonProperty("file_hash")
    String fileHash;

    @JsonProperty("already_exists")
    boolean alreadyExists;

    public static DocumentUploadResponse from(DocumentUpload upload) {
        return DocumentUploadResponse.builder()
                .pdfUrl(upload.getPdfUrl())
                .fileHash(upload.getFileHash())
                .alreadyExists(upload.isAlreadyExists())
                .build();
    }
}
