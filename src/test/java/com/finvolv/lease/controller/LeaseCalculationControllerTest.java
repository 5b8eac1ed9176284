package com.finvolv.lease.controller;

import com.finvolv.lease.TestWorkbooks;
import com.finvolv.lease.config.LeaseWorkbookProperties;
import com.finvolv.lease.model.ReportingWindow;
import com.finvolv.lease.service.ContractSummaryCalculator;
import com.finvolv.lease.service.ContractWorkbookReader;
import com.finvolv.lease.service.LeaseCalculationService;
import com.finvolv.lease.service.ProrationEngine;
import com.finvolv.lease.service.ReportAggregator;
import com.finvolv.lease.service.ReportWorkbookWriter;
import com.finvolv.lease.service.TemplateWorkbookService;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.codec.multipart.Part;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LeaseCalculationController
 */
class LeaseCalculationControllerTest {

    private WebTestClient webTestClient;
    private LeaseCalculationService leaseCalculationService;
    private TemplateWorkbookService templateWorkbookService;
    private Validator validator;

    @BeforeEach
    void setUp() {
        LeaseWorkbookProperties properties = new LeaseWorkbookProperties();
        leaseCalculationService = new LeaseCalculationService(
            new ContractWorkbookReader(properties),
            new ReportAggregator(new ContractSummaryCalculator(new ProrationEngine())),
            new ReportWorkbookWriter());
        templateWorkbookService = new TemplateWorkbookService(properties);
        validator = Validation.buildDefaultValidatorFactory().getValidator();
        webTestClient = client(leaseCalculationService);
    }

    private WebTestClient client(LeaseCalculationService service) {
        LeaseCalculationController controller =
            new LeaseCalculationController(service, templateWorkbookService, validator, Duration.ofSeconds(30));
        return WebTestClient.bindToController(controller, new HealthCheckController()).build();
    }

    private static MultipartBodyBuilder upload(byte[] file, String start, String end) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        if (file != null) {
            builder.part("file", file).filename("contracts.xlsx");
        }
        if (start != null) {
            builder.part("start", start);
        }
        if (end != null) {
            builder.part("end", end);
        }
        return builder;
    }

    private WebTestClient.ResponseSpec post(MultipartBodyBuilder builder) {
        return webTestClient.post()
            .uri("/api/lease-calculations")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(builder.build()))
            .exchange();
    }

    @Test
    void testCalculate_ReturnsSummaryAndEncodedFiles() {
        post(upload(TestWorkbooks.standardWorkbook(), "2025-08", "2025-09-01"))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.contract_count").isEqualTo(2)
            .jsonPath("$.total_receivable").isEqualTo(76992.0)
            .jsonPath("$.total_bank_matched").isEqualTo(52992.0)
            .jsonPath("$.total_invoice_matched").isEqualTo(59840.96)
            .jsonPath("$.summary[0].customer").isEqualTo("北京lbcy餐饮管理有限公司")
            .jsonPath("$.summary[0].merchant_id").isEqualTo("B1-01c")
            .jsonPath("$.summary[0].receivable").isEqualTo(52992.0)
            .jsonPath("$.summary[1].notes").isEqualTo("")
            .jsonPath("$.files.lease").isNotEmpty()
            .jsonPath("$.files.single").isNotEmpty()
            .jsonPath("$.files.income").isNotEmpty()
            .jsonPath("$.error").doesNotExist();
    }

    @Test
    void testCalculate_DiagnosticsFlagAccepted() {
        MultipartBodyBuilder builder = upload(TestWorkbooks.standardWorkbook(), "2025-08", "2025-09");
        builder.part("diagnostics", "true");

        post(builder)
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.contract_count").isEqualTo(2);
    }

    @Test
    void testCalculate_MissingFileIsBadRequest() {
        post(upload(null, "2025-08", "2025-09"))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Missing file")
            .jsonPath("$.files").doesNotExist();
    }

    @Test
    void testCalculate_MissingStartIsBadRequest() {
        post(upload(TestWorkbooks.standardWorkbook(), null, "2025-09"))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Missing start month (expected yyyy-MM or yyyy-MM-dd)");
    }

    @Test
    void testCalculate_InvertedWindowIsBadRequest() {
        post(upload(TestWorkbooks.standardWorkbook(), "2025-12", "2025-08"))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Start month 2025-12 is after end month 2025-08");
    }

    @Test
    void testCalculate_UnreadableWorkbookIsBadRequest() {
        post(upload("plain text".getBytes(StandardCharsets.UTF_8), "2025-08", "2025-09"))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").exists()
            .jsonPath("$.detail").doesNotExist();
    }

    @Test
    void testCalculate_UnreadableContractDateIsBadRequest() throws IOException {
        byte[] bytes;
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            TestWorkbooks.addSheet(workbook, TestWorkbooks.CONTRACT_SHEET, TestWorkbooks.contractHeaders(1), List.<Object[]>of(
                new Object[]{"北京lbcy餐饮管理有限公司", "B1-01c", "2025-13-01", LocalDate.of(2027, 5, 11), 30, 26496.00}));
            TestWorkbooks.addSheet(workbook, TestWorkbooks.BANK_SHEET, TestWorkbooks.BANK_HEADERS, List.of());
            TestWorkbooks.addSheet(workbook, TestWorkbooks.INVOICE_SHEET, TestWorkbooks.INVOICE_HEADERS, List.of());
            bytes = TestWorkbooks.toBytes(workbook);
        }

        post(upload(bytes, "2025-08", "2025-09"))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").value(error -> assertTrue(String.valueOf(error).contains("2025-13-01")))
            .jsonPath("$.summary").doesNotExist();
    }

    @Test
    void testCalculate_EmptyFormCompletesWithBadRequest() {
        LeaseCalculationController controller =
            new LeaseCalculationController(leaseCalculationService, templateWorkbookService, validator, Duration.ofSeconds(30));

        StepVerifier.create(controller.calculate(Mono.<MultiValueMap<String, Part>>just(new LinkedMultiValueMap<>())))
            .assertNext(response -> {
                assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                assertTrue(response.getBody().getError().contains("Missing file"));
                assertNull(response.getBody().getFiles());
            })
            .verifyComplete();
    }

    @Test
    void testDownloadTemplate_EmitsSingleAttachment() {
        LeaseCalculationController controller =
            new LeaseCalculationController(leaseCalculationService, templateWorkbookService, validator, Duration.ofSeconds(30));

        StepVerifier.create(controller.downloadTemplate())
            .assertNext(response -> {
                assertEquals(HttpStatus.OK, response.getStatusCode());
                assertEquals(LeaseCalculationController.XLSX, response.getHeaders().getContentType());
                assertEquals("lease-template.xlsx", response.getHeaders().getContentDisposition().getFilename());
                assertTrue(response.getBody().length > 0);
            })
            .verifyComplete();
    }

    @Test
    void testCalculate_UnexpectedFailureIsServerError() {
        LeaseCalculationService failing = mock(LeaseCalculationService.class);
        when(failing.calculate(any(byte[].class), any(ReportingWindow.class), any()))
            .thenThrow(new IllegalStateException("boom"));

        WebTestClient client = client(failing);
        client.post()
            .uri("/api/lease-calculations")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(upload(TestWorkbooks.standardWorkbook(), "2025-08", "2025-09").build()))
            .exchange()
            .expectStatus().is5xxServerError()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Calculation failed: boom")
            .jsonPath("$.detail").value(detail -> assertTrue(
                String.valueOf(detail).contains("IllegalStateException")));
    }

    @Test
    void testDownloadTemplate_ReturnsWorkbook() {
        webTestClient.get()
            .uri("/api/lease-calculations/template")
            .exchange()
            .expectStatus().isOk()
            .expectHeader().contentType(LeaseCalculationController.XLSX)
            .expectHeader().valueMatches("Content-Disposition", ".*lease-template\\.xlsx.*")
            .expectBody(byte[].class)
            .value(bytes -> assertTrue(bytes.length > 0));
    }

    @Test
    void testHealthCheck() {
        webTestClient.get()
            .uri("/health-check")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class)
            .isEqualTo("Lease receivable service is up and Running");
    }
}
