package com.investidor.backend.aggregation;

import jakarta.servlet.http.HttpServletRequest;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = AggregationController.class)
public class AggregationExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationExceptionHandler.class);

    static final String NOT_FOUND_MESSAGE = "Ativo não encontrado ou erro ao ler página.";
    static final String INTERNAL_ERROR_MESSAGE = "Erro interno ao processar dados.";

    @ExceptionHandler(AggregationValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(
            AggregationValidationException exception, HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(
            HttpMessageNotReadableException exception, HttpServletRequest request) {
        LOGGER.debug("Rejecting malformed request body on {}", request.getRequestURI(), exception);
        return buildResponse(HttpStatus.BAD_REQUEST, "Corpo da requisição inválido.", request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedBody(
            HttpMediaTypeNotSupportedException exception, HttpServletRequest request) {
        // a body that is not JSON carries no ticker
        LOGGER.debug("Rejecting {} body on {}", exception.getContentType(), request.getRequestURI());
        return buildResponse(HttpStatus.BAD_REQUEST, AggregationService.EMPTY_TICKER_MESSAGE, request);
    }

    @ExceptionHandler(EssentialDataMissingException.class)
    public ResponseEntity<Map<String, Object>> handleEssentialDataMissing(
            EssentialDataMissingException exception, HttpServletRequest request) {
        return buildResponse(HttpStatus.NOT_FOUND, NOT_FOUND_MESSAGE, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception exception, HttpServletRequest request) {
        LOGGER.error("Unexpected failure while aggregating {}", request.getRequestURI(), exception);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE, request);
    }

    private ResponseEntity<Map<String, Object>> buildResponse(
            HttpStatus status, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", OffsetDateTime.now().toString());
        body.put("status", status.value());
        body.put("error", message);
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
