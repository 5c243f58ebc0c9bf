package com.nosota.msettle.exception;

import com.nosota.msettle.dto.ErrorResponse;
import com.nosota.msettle.error.AlreadyTerminalException;
import com.nosota.msettle.error.InsufficientFundsException;
import com.nosota.msettle.error.InvalidBatchException;
import com.nosota.msettle.error.InvalidRequestException;
import com.nosota.msettle.error.InvalidStateTransitionException;
import com.nosota.msettle.error.NotFullyFundedException;
import com.nosota.msettle.error.OverfundedException;
import com.nosota.msettle.error.PriceGuardException;
import com.nosota.msettle.error.ProtocolPausedException;
import com.nosota.msettle.error.QueueOrderException;
import com.nosota.msettle.error.SettlementNotFoundException;
import com.nosota.msettle.error.TimeoutNotReachedException;
import com.nosota.msettle.error.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SettlementNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSettlementNotFound(
            SettlementNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Settlement Not Found", ex, request);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(
            UnauthorizedException ex, HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, "Unauthorized", ex, request);
    }

    @ExceptionHandler(NotFullyFundedException.class)
    public ResponseEntity<ErrorResponse> handleNotFullyFunded(
            NotFullyFundedException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Not Fully Funded", ex, request);
    }

    @ExceptionHandler(OverfundedException.class)
    public ResponseEntity<ErrorResponse> handleOverfunded(
            OverfundedException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Overfunded", ex, request);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(
            InsufficientFundsException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Insufficient Funds", ex, request);
    }

    @ExceptionHandler(InvalidBatchException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBatch(
            InvalidBatchException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid Batch", ex, request);
    }

    @ExceptionHandler(QueueOrderException.class)
    public ResponseEntity<ErrorResponse> handleQueueOrder(
            QueueOrderException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Queue Order", ex, request);
    }

    @ExceptionHandler(AlreadyTerminalException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyTerminal(
            AlreadyTerminalException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Already Terminal", ex, request);
    }

    @ExceptionHandler(PriceGuardException.class)
    public ResponseEntity<ErrorResponse> handlePriceGuard(
            PriceGuardException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Price Guard", ex, request);
    }

    @ExceptionHandler(TimeoutNotReachedException.class)
    public ResponseEntity<ErrorResponse> handleTimeoutNotReached(
            TimeoutNotReachedException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Timeout Not Reached", ex, request);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateTransition(
            InvalidStateTransitionException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Invalid State", ex, request);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            InvalidRequestException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", ex, request);
    }

    @ExceptionHandler(ProtocolPausedException.class)
    public ResponseEntity<ErrorResponse> handleProtocolPaused(
            ProtocolPausedException ex, HttpServletRequest request) {
        return respond(HttpStatus.LOCKED, "Protocol Paused", ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String title, Exception ex,
                                                  HttpServletRequest request) {
        return respond(status, title, ex.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String title, String message,
                                                  HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        if (status.is5xxServerError()) {
            log.error("{} [correlationId={}]: {}", title, correlationId, message);
        } else {
            log.warn("{} [correlationId={}]: {}", title, correlationId, message);
        }

        ErrorResponse error = ErrorResponse.of(status.value(), title, message, request.getRequestURI());
        return ResponseEntity.status(status).body(error);
    }
}
