package com.flagship.trade_finance.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of storing a shipment document. {@code alreadyExists} is set when the
 * shipment already had a document and the stored one was returned instead.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DocumentUpload {
    String pdfUrl;
    String fileHash;
    boolean alreadyExists;
}
