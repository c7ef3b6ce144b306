package com.flagship.trade_finance.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.trade_finance.error.LedgerFailure;
import com.flagship.trade_finance.observability.CorrelationContext;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigInteger;

/**
 * {@link LedgerClient} backed by the signing ledger gateway over HTTP.
 *
 * The gateway holds the keys, signs on behalf of the named account and
 * relays to the ledger node. A 4xx answer carrying {@code code}/{@code reason}
 * is a ledger rejection; anything else that fails is treated as the gateway
 * being unavailable.
 */
@Component
@Slf4j
public class RestLedgerGateway implements LedgerClient {

    private static final String STATUS_CONFIRMED = "CONFIRMED";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public RestLedgerGateway(@Qualifier("ledgerRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             @org.springframework.beans.factory.annotation.Value("${ledger.gateway.base-url}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public BigInteger readBalance(String holder) {
        return get(url("/balances/{holder}", holder), AmountResponse.class).getValue();
    }

    @Override
    public BigInteger readNativeBalance(String holder) {
        return get(url("/balances/{holder}/native", holder), AmountResponse.class).getValue();
    }

    @Override
    public BigInteger readAllowance(String holder, String spender) {
        return get(url("/allowances/{holder}/{spender}", holder, spender), AmountResponse.class).getValue();
    }

    @Override
    public BigInteger readClaimTokenBalance(String shipmentId, String holder) {
        return get(url("/shipments/{id}/claims/{holder}", shipmentId, holder), AmountResponse.class).getValue();
    }

    @Override
    public ContractState readContractState(String shipmentId) {
        return get(url("/shipments/{id}/state", shipmentId), ContractState.class);
    }

    @Override
    public SubmissionRef submit(LedgerOperation operation) {
        log.debug("Submitting {} for account {} on shipment {}",
                operation.getType(), operation.getAccount(), operation.getShipmentId());
        SubmitResponse response = exchange(url("/operations"), HttpMethod.POST,
                new HttpEntity<>(operation, headers()), SubmitResponse.class);
        return SubmissionRef.of(response.getRef());
    }

    @Override
    public LedgerReceipt awaitConfirmation(SubmissionRef ref, int confirmations) {
        String endpoint = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/operations/{ref}/receipt")
                .queryParam("confirmations", confirmations)
                .buildAndExpand(ref.getValue())
                .toUriString();

        ReceiptResponse receipt = get(endpoint, ReceiptResponse.class);
        if (!STATUS_CONFIRMED.equalsIgnoreCase(receipt.getStatus())) {
            throw new LedgerRejectedException(LedgerFailure.of(receipt.getCode(), receipt.getReason()));
        }
        return new LedgerReceipt(ref, receipt.getBlockNumber(), receipt.getConfirmations(), receipt.getOfferId());
    }

    /**
     * Cheap reachability probe used by the health indicator.
     */
    public boolean ping() {
        try {
            restTemplate.exchange(url("/health"), HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            return true;
        } catch (RestClientException e) {
            log.debug("Ledger gateway ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T get(String endpoint, Class<T> type) {
        return exchange(endpoint, HttpMethod.GET, new HttpEntity<>(headers()), type);
    }

    private <T> T exchange(String endpoint, HttpMethod method, HttpEntity<?> entity, Class<T> type) {
        try {
            ResponseEntity<T> response = restTemplate.exchange(endpoint, method, entity, type);
            if (response.getBody() == null) {
                throw new LedgerUnavailableException("Empty response from ledger gateway: " + endpoint, null);
            }
            return response.getBody();
        } catch (HttpClientErrorException e) {
            throw new LedgerRejectedException(parseFailure(e), e);
        } catch (RestClientException e) {
            throw new LedgerUnavailableException("Ledger gateway call failed: " + endpoint, e);
        }
    }

    private LedgerFailure parseFailure(HttpClientErrorException e) {
        String body = e.getResponseBodyAsString();
        try {
            FailureResponse failure = objectMapper.readValue(body, FailureResponse.class);
            if (failure.getCode() != null || failure.getReason() != null) {
                return LedgerFailure.of(failure.getCode(), failure.getReason());
            }
        } catch (Exception parseError) {
            log.debug("Ledger gateway error body is not structured: {}", parseError.getMessage());
        }
        return LedgerFailure.ofReason(body.isBlank() ? e.getStatusText() : body);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId());
        return headers;
    }

    private String url(String path, Object... variables) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(path)
                .buildAndExpand(variables)
                .toUriString();
    }

    @Value
    @Builder
    @Jacksonized
    static class AmountResponse {
        BigInteger value;
    }

    @Value
    @Builder
    @Jacksonized
    static class SubmitResponse {
        String ref;
    }

    @Value
    @Builder
    @Jacksonized
    static class ReceiptResponse {
        String status;
        long blockNumber;
        int confirmations;
        Long offerId;
        String code;
        String reason;
    }

    @Value
    @Builder
    @Jacksonized
    static class FailureResponse {
        String code;
        String reason;
    }
}
