package com.finvolv.lease.controller;

import com.finvolv.lease.dto.CalculationRequest;
import com.finvolv.lease.dto.LeaseCalculationResponse;
import com.finvolv.lease.exception.InvalidReportingWindowException;
import com.finvolv.lease.exception.WorkbookLoadException;
import com.finvolv.lease.model.ReportOptions;
import com.finvolv.lease.model.ReportingWindow;
import com.finvolv.lease.service.LeaseCalculationService;
import com.finvolv.lease.service.TemplateWorkbookService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/lease-calculations")
public class LeaseCalculationController {

    private static final Logger logger = LoggerFactory.getLogger(LeaseCalculationController.class);

    static final MediaType XLSX = MediaType.parseMediaType(
        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final LeaseCalculationService leaseCalculationService;
    private final TemplateWorkbookService templateWorkbookService;
    private final Validator validator;
    private final Duration timeout;

    public LeaseCalculationController(LeaseCalculationService leaseCalculationService,
                                      TemplateWorkbookService templateWorkbookService,
                                      Validator validator,
                                      @Value("${lease.calculation.timeout:PT60S}") Duration timeout) {
        this.leaseCalculationService = leaseCalculationService;
        this.templateWorkbookService = templateWorkbookService;
        this.validator = validator;
        this.timeout = timeout;
    }

    @PostMapping(
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<LeaseCalculationResponse>> calculate(@RequestBody Mono<MultiValueMap<String, Part>> parts) {
        return parts
            .flatMap(this::toRequest)
            .flatMap(request -> {
                logger.info("Received lease calculation request - start: {}, end: {}, file size: {} bytes, diagnostics: {}",
                    request.getStart(), request.getEnd(), request.getWorkbook().length, request.isDiagnostics());
                return Mono.fromCallable(() -> leaseCalculationService.calculate(
                        request.getWorkbook(),
                        ReportingWindow.parse(request.getStart(), request.getEnd()),
                        new ReportOptions(request.isDiagnostics(), null)))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout);
            })
            .map(result -> {
                LeaseCalculationResponse response = LeaseCalculationResponse.from(result);
                logger.info("Completed lease calculation request - contracts: {}, total receivable: {}, total income: {}",
                    response.getContractCount(), response.getTotalReceivable(), response.getTotalIncome());
                return ResponseEntity.ok(response);
            })
            .onErrorResume(this::toErrorResponse);
    }

    @GetMapping("/template")
    public Mono<ResponseEntity<byte[]>> downloadTemplate() {
        return Mono.fromCallable(templateWorkbookService::buildTemplate)
            .subscribeOn(Schedulers.boundedElastic())
            .map(bytes -> {
                HttpHeaders headers = new HttpHeaders();
                headers.setContentType(XLSX);
                headers.setContentDisposition(ContentDisposition.attachment().filename("lease-template.xlsx").build());
                headers.setContentLength(bytes.length);
                return new ResponseEntity<>(bytes, headers, HttpStatus.OK);
            })
            .doOnError(error -> logger.error("Error building input template: {}", error.getMessage()));
    }

    private Mono<CalculationRequest> toRequest(MultiValueMap<String, Part> parts) {
        Part file = parts.getFirst("file");
        Mono<byte[]> workbook = file instanceof FilePart
            ? readBytes((FilePart) file)
            : Mono.empty();

        return workbook
            .map(bytes -> buildRequest(parts, bytes))
            .switchIfEmpty(Mono.fromSupplier(() -> buildRequest(parts, null)))
            .flatMap(request -> {
                Set<ConstraintViolation<CalculationRequest>> violations = validator.validate(request);
                if (!violations.isEmpty()) {
                    return Mono.error(new ConstraintViolationException(violations));
                }
                return Mono.just(request);
            });
    }

    private static CalculationRequest buildRequest(MultiValueMap<String, Part> parts, byte[] workbook) {
        return CalculationRequest.builder()
            .workbook(workbook)
            .start(fieldValue(parts, "start"))
            .end(fieldValue(parts, "end"))
            .diagnostics(Boolean.parseBoolean(fieldValue(parts, "diagnostics")))
            .build();
    }

    private static Mono<byte[]> readBytes(FilePart filePart) {
        return DataBufferUtils.join(filePart.content())
            .map(buffer -> {
                byte[] bytes = new byte[buffer.readableByteCount()];
                buffer.read(bytes);
                DataBufferUtils.release(buffer);
                return bytes;
            })
            .defaultIfEmpty(new byte[0]);
    }

    private static String fieldValue(MultiValueMap<String, Part> parts, String name) {
        Part part = parts.getFirst(name);
        return part instanceof FormFieldPart ? ((FormFieldPart) part).value() : null;
    }

    private Mono<ResponseEntity<LeaseCalculationResponse>> toErrorResponse(Throwable error) {
        if (error instanceof ConstraintViolationException) {
            String message = ((ConstraintViolationException) error).getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.joining("; "));
            logger.warn("Rejected lease calculation request: {}", message);
            return Mono.just(ResponseEntity.badRequest().body(LeaseCalculationResponse.error(message)));
        }
        if (error instanceof InvalidReportingWindowException || error instanceof WorkbookLoadException) {
            logger.warn("Rejected lease calculation request: {}", error.getMessage());
            return Mono.just(ResponseEntity.badRequest().body(LeaseCalculationResponse.error(error.getMessage())));
        }

        String message = error instanceof TimeoutException
            ? "Calculation did not finish within " + timeout.toSeconds() + " seconds"
            : "Calculation failed: " + error.getMessage();
        logger.error("Error processing lease calculation request: {}", message, error);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(LeaseCalculationResponse.error(message, stackTrace(error))));
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
