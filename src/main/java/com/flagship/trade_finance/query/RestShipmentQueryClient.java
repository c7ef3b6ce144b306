package com.flagship.trade_finance.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.trade_finance.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Optional;

/**
 * {@link ShipmentQueryClient} over the query service's REST API.
 */
@Component
@Slf4j
public class RestShipmentQueryClient implements ShipmentQueryClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public RestShipmentQueryClient(@Qualifier("queryRestTemplate") RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   @Value("${query.service.base-url}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public List<ShipmentRecord> listShipments(ShipmentFilter filter) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path("/shipments");
        if (filter != null) {
            addParam(builder, "seller", filter.getSeller());
            addParam(builder, "buyer", filter.getBuyer());
            addParam(builder, "carrier", filter.getCarrier());
            addParam(builder, "active", filter.getActive());
        }
        List<ShipmentRecord> records = call(builder.toUriString(), HttpMethod.GET, new HttpEntity<>(jsonHeaders()),
                new ParameterizedTypeReference<List<ShipmentRecord>>() { });
        return records != null ? records : List.of();
    }

    @Override
    public Optional<ShipmentRecord> getShipment(String shipmentId) {
        String endpoint = url("/shipments/{hash}", shipmentId);
        try {
            ResponseEntity<ShipmentRecord> response = restTemplate.exchange(
                    endpoint, HttpMethod.GET, new HttpEntity<>(jsonHeaders()), ShipmentRecord.class);
            return Optional.ofNullable(response.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (HttpStatusCodeException e) {
            throw new QueryServiceException("Query service rejected shipment lookup", e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new QueryServiceException("Query service unreachable", 0, e);
        }
    }

    @Override
    public List<OfferRecord> listOffers(String shipmentId) {
        String endpoint = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/offers")
                .queryParam("hash", shipmentId)
                .toUriString();
        List<OfferRecord> offers = call(endpoint, HttpMethod.GET, new HttpEntity<>(jsonHeaders()),
                new ParameterizedTypeReference<List<OfferRecord>>() { });
        return offers != null ? offers : List.of();
    }

    @Override
    public RegistrationReceipt registerShipment(RegisterShipmentCommand command) {
        ObjectNode body = command.getDocument() != null && command.getDocument().isObject()
                ? ((ObjectNode) command.getDocument()).deepCopy()
                : objectMapper.createObjectNode();
        body.put("bolHash", command.getBolHash());
        body.put("pdfUrl", command.getPdfUrl());
        body.put("carrier", command.getCarrier());
        body.put("seller", command.getSeller());
        body.put("buyer", command.getBuyer());
        if (command.getDeclaredValue() != null) {
            body.put("declaredValue", command.getDeclaredValue().toPlainString());
        }

        return call(url("/shipments"), HttpMethod.POST, new HttpEntity<>(body, jsonHeaders()),
                new ParameterizedTypeReference<RegistrationReceipt>() { });
    }

    @Override
    public DocumentUpload uploadDocument(String shipmentId, String filename, byte[] content, String contentType) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path("/shipments/upload");
        addParam(builder, "bol_hash", shipmentId);

        HttpHeaders partHeaders = new HttpHeaders();
        partHeaders.setContentType(contentType != null
                ? MediaType.parseMediaType(contentType)
                : MediaType.APPLICATION_OCTET_STREAM);
        ByteArrayResource resource = new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        };
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("file", new HttpEntity<>(resource, partHeaders));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.set(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId());

        try {
            ResponseEntity<DocumentUpload> response = restTemplate.exchange(
                    builder.toUriString(), HttpMethod.POST, new HttpEntity<>(parts, headers), DocumentUpload.class);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                // Shipment already has a document; the service returns the stored one
                return readExistingUpload(e);
            }
            throw new QueryServiceException("Document upload rejected", e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new QueryServiceException("Query service unreachable", 0, e);
        }
    }

    private DocumentUpload readExistingUpload(HttpStatusCodeException e) {
        try {
            DocumentUpload existing = objectMapper.readValue(e.getResponseBodyAsString(), DocumentUpload.class);
            log.info("Document already stored for shipment: {}", existing.getPdfUrl());
            return existing.toBuilder().alreadyExists(true).build();
        } catch (Exception parseError) {
            throw new QueryServiceException("Unreadable conflict response from document upload",
                    e.getStatusCode().value(), e);
        }
    }

    private <T> T call(String endpoint, HttpMethod method, HttpEntity<?> entity, ParameterizedTypeReference<T> type) {
        try {
            return restTemplate.exchange(endpoint, method, entity, type).getBody();
        } catch (HttpStatusCodeException e) {
            log.warn("Query service call failed: {} {} -> {}", method, endpoint, e.getStatusCode().value());
            throw new QueryServiceException("Query service call failed: " + endpoint, e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new QueryServiceException("Query service unreachable: " + endpoint, 0, e);
        }
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId());
        return headers;
    }

    private String url(String path, Object... variables) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(path)
                .buildAndExpand(variables)
                .toUriString();
    }

    private static void addParam(UriComponentsBuilder builder, String name, Object value) {
        if (value != null) {
            builder.queryParam(name, value);
        }
    }
}
