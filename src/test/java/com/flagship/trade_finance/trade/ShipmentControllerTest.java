package com.flagship.trade_finance.trade;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.coordinator.TransactionCoordinator;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.ledger.LedgerClient;
import com.flagship.trade_finance.outbox.OutboxService;
import com.flagship.trade_finance.query.DocumentUpload;
import com.flagship.trade_finance.query.RegistrationReceipt;
import com.flagship.trade_finance.query.ShipmentQueryClient;
import com.flagship.trade_finance.reconcile.ShipmentStateStore;
import com.flagship.trade_finance.support.Shipments;
import com.flagship.trade_finance.trade.event.ShipmentRegisteredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigInteger;
import java.util.Map;
import java.util.UUID;

import static com.flagship.trade_finance.support.Shipments.BUYER;
import static com.flagship.trade_finance.support.Shipments.HASH;
import static com.flagship.trade_finance.support.Shipments.INVESTOR;
import static com.flagship.trade_finance.support.Shipments.SELLER;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST surface: header and body validation, outcome to status mapping,
 * idempotent replays and shipment registration.
 *
 * The coordinator and both remote services are mocked; records, idempotency
 * keys and outbox rows go to real Postgres and Redis.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ShipmentControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("trade_finance_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // No broker for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("reconciler.polling.enabled", () -> "false");
        registry.add("coordinator.resolver.enabled", () -> "false");
    }

    private static final BigInteger ONE_HUNDRED = BigInteger.TEN.pow(20);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ShipmentStateStore store;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @MockBean
    private TransactionCoordinator coordinator;

    @MockBean
    private ShipmentQueryClient queryClient;

    @MockBean
    private LedgerClient ledgerClient;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        store.replaceIfChanged(Shipments.snapshot(Shipments.fundingEnabled(1000)));
        try {
            redisTemplate.getConnectionFactory().getConnection().serverCommands().flushAll();
        } catch (Exception e) {
            System.out.println("Redis flush skipped: " + e.getMessage());
        }
    }

    private String amountBody(String amount) throws Exception {
        return objectMapper.writeValueAsString(Map.of("amount", amount));
    }

    @Test
    @DisplayName("Action requests without an Idempotency-Key are rejected")
    void idempotencyKeyRequired() throws Exception {
        printTestHeader("Missing Idempotency-Key");

        mockMvc.perform(post("/api/shipments/{hash}/fund", HASH)
                        .header("X-Account", INVESTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(amountBody("100")))
                .andExpect(status().isBadRequest());

        verify(coordinator, never()).execute(any());
    }

    @Test
    @DisplayName("A non-positive amount fails validation")
    void amountMustBePositive() throws Exception {
        printTestHeader("Zero Amount");

        mockMvc.perform(post("/api/shipments/{hash}/fund", HASH)
                        .header("X-Account", INVESTOR)
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(amountBody("0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.amount").exists());

        verify(coordinator, never()).execute(any());
    }

    @Test
    @DisplayName("A confirmed action returns 200 and a retry with the same key replays it")
    void confirmedAndReplayed() throws Exception {
        printTestHeader("Confirmed And Replayed");

        ActionRequest expected = ActionRequest.fund(HASH, INVESTOR, ONE_HUNDRED);
        when(coordinator.execute(any())).thenReturn(ActionResult.confirmed(expected, "0xfeed", 1, 1, null));
        String key = UUID.randomUUID().toString();

        MvcResult first = mockMvc.perform(post("/api/shipments/{hash}/fund", HASH)
                        .header("X-Account", INVESTOR)
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(amountBody("100")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("CONFIRMED"))
                .andExpect(jsonPath("$.submission_ref").value("0xfeed"))
                .andReturn();

        MvcResult second = mockMvc.perform(post("/api/shipments/{hash}/fund", HASH)
                        .header("X-Account", INVESTOR)
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(amountBody("100")))
                .andExpect(status().isOk())
                .andReturn();

        printOutput("First", first.getResponse().getContentAsString());
        printOutput("Replay", second.getResponse().getContentAsString());

        verify(coordinator, times(1)).execute(any());
        assertEquals(
                objectMapper.readTree(first.getResponse().getContentAsString()).get("submission_ref"),
                objectMapper.readTree(second.getResponse().getContentAsString()).get("submission_ref"));
    }

    @Test
    @DisplayName("Reusing a key for a different request is rejected")
    void keyReusedForDifferentRequest() throws Exception {
        printTestHeader("Key Reuse");

        when(coordinator.execute(any())).thenReturn(
                ActionResult.confirmed(ActionRequest.fund(HASH, INVESTOR, ONE_HUNDRED), "0xfeed", 1, 1, null));
        String key = UUID.randomUUID().toString();

        mockMvc.perform(post("/api/shipments/{hash}/fund", HASH)
                        .header("X-Account", INVESTOR)
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(amountBody("100")))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/shipments/{hash}/fund", HASH)
                        .header("X-Account", INVESTOR)
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(amountBody("200")))
                .andExpect(status().isBadRequest());

        verify(coordinator, times(1)).execute(any());
    }

    @Test
    @DisplayName("A failed action returns 422 with its error kind")
    void failedActionIs422() throws Exception {
        printTestHeader("Failed Action");

        ActionRequest request = ActionRequest.pay(HASH, BUYER, ONE_HUNDRED);
        when(coordinator.execute(any())).thenReturn(ActionResult.rejected(request, ErrorKind.INVALID_AMOUNT, null, 0));

        mockMvc.perform(post("/api/shipments/{hash}/pay", HASH)
                        .header("X-Account", BUYER)
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(amountBody("100")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.outcome").value("FAILED"))
                .andExpect(jsonPath("$.error_kind").value("INVALID_AMOUNT"));
    }

    @Test
    @DisplayName("An unconfirmed action returns 202 with its submission reference")
    void indeterminateIs202() throws Exception {
        printTestHeader("Indeterminate Action");

        ActionRequest request = ActionRequest.markReceived(HASH, BUYER);
        when(coordinator.execute(any())).thenReturn(ActionResult.indeterminate(request, "0xslow", 1));

        mockMvc.perform(post("/api/shipments/{hash}/receipt", HASH)
                        .header("X-Account", BUYER)
                        .header("Idempotency-Key", UUID.randomUUID().toString()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.outcome").value("INDETERMINATE"))
                .andExpect(jsonPath("$.submission_ref").value("0xslow"));
    }

    @Test
    @DisplayName("Known shipments are served from the cache and unknown ones are 404")
    void getShipment() throws Exception {
        printTestHeader("Get Shipment");

        mockMvc.perform(get("/api/shipments/{hash}", HASH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bol_hash").value(HASH))
                .andExpect(jsonPath("$.stage").value("FUNDING_ENABLED"))
                .andExpect(jsonPath("$.provisional").value(false));

        mockMvc.perform(get("/api/shipments/{hash}", "0x" + "ef".repeat(32)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Registration returns 201, lists the shipment and records the event")
    void registerShipment() throws Exception {
        printTestHeader("Register Shipment");

        when(queryClient.registerShipment(any())).thenReturn(RegistrationReceipt.builder()
                .success(true)
                .contractAddress("0x00000000000000000000000000000000000c0ffe")
                .transactionHash("0xmint")
                .build());

        Map<String, Object> body = Map.of(
                "document", Map.of("blNumber", "BL-" + UUID.randomUUID(), "vessel", "MV Example"),
                "declared_value", "1000",
                "carrier", "0x00000000000000000000000000000000000000c4",
                "seller", SELLER,
                "buyer", BUYER);

        MvcResult result = mockMvc.perform(post("/api/shipments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.contract_address").value("0x00000000000000000000000000000000000c0ffe"))
                .andReturn();

        String bolHash = objectMapper.readTree(result.getResponse().getContentAsString()).get("bol_hash").asText();
        printOutput("BoL hash", bolHash);

        mockMvc.perform(get("/api/shipments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].bol_hash", hasItem(bolHash)));

        assertEquals(ShipmentRegisteredEvent.EVENT_TYPE,
                outboxService.getEventsForShipment(bolHash).get(0).getEventType());
    }

    @Test
    @DisplayName("Uploading a document returns the stored URL; an empty file is rejected")
    void uploadDocument() throws Exception {
        printTestHeader("Upload Document");

        when(queryClient.uploadDocument(eq(HASH), eq("bol.pdf"), any(), eq("application/pdf")))
                .thenReturn(DocumentUpload.builder().pdfUrl("/files/bol.pdf").fileHash("0xfile").build());

        mockMvc.perform(multipart("/api/shipments/upload")
                        .file(new MockMultipartFile("file", "bol.pdf", "application/pdf", new byte[]{1, 2, 3}))
                        .param("bol_hash", HASH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pdf_url").value("/files/bol.pdf"))
                .andExpect(jsonPath("$.already_exists").value(false));

        mockMvc.perform(multipart("/api/shipments/upload")
                        .file(new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0])))
                .andExpect(status().isBadRequest());
    }
}
