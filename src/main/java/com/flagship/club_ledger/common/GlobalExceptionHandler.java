package com.flagship.club_ledger.common;

import com.flagship.club_ledger.dispute.InvalidDisputeStateException;
import com.flagship.club_ledger.processor.InvalidSignatureException;
import com.flagship.club_ledger.processor.ProcessorException;
import com.flagship.club_ledger.refund.InvalidRefundRequestException;
import com.flagship.club_ledger.webhook.WebhookProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to HTTP responses for every controller, the webhook
 * endpoint included. The webhook status codes drive processor redelivery: 400
 * for signature failures, 500 for failures after a claim.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignature(InvalidSignatureException e) {
        log.warn("Rejected webhook: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Signature", e.getMessage());
    }

    @ExceptionHandler(WebhookProcessingException.class)
    public ResponseEntity<ErrorResponse> handleWebhookProcessing(WebhookProcessingException e) {
        // Already logged with the cause by the ingestion service
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Webhook Processing Failed", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler(InvalidRefundRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRefund(InvalidRefundRequestException e) {
        log.warn("Refund rejected: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Refund", e.getMessage());
    }

    @ExceptionHandler(InvalidDisputeStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidDispute(InvalidDisputeStateException e) {
        log.warn("Dispute conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Dispute Conflict", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage());
    }

    @ExceptionHandler(ProcessorException.class)
    public ResponseEntity<ErrorResponse> handleProcessor(ProcessorException e) {
        log.error("Payment processor call failed: {}", e.getMessage(), e);
        return respond(HttpStatus.BAD_GATEWAY, "Processor Error", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .build());
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
