package com.findex.backend.exception;

import com.findex.backend.dto.ApiError;
import com.findex.backend.dto.ApiErrorDetail;
import com.findex.backend.util.MdcKeys;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Malformed request body", List.of(), request, ex);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed",
                List.of(detail(ex.getName(), "invalid value " + ex.getValue())), request, ex);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException ex,
                                                           HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed",
                List.of(detail(ex.getParameterName(), "is required")), request, ex);
    }

    @ExceptionHandler(InvalidSelectionException.class)
    public ResponseEntity<ApiError> handleInvalidSelection(InvalidSelectionException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getRejectedRegions().stream()
                .map(region -> ApiErrorDetail.builder().field("regions").issue("unknown region " + region).build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "INVALID_SELECTION", ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return buildError(HttpStatus.NOT_FOUND, HttpStatus.NOT_FOUND.name(), ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException ex, HttpServletRequest request) {
        return buildError(HttpStatus.CONFLICT, HttpStatus.CONFLICT.name(), ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(RemoteServiceException.class)
    public ResponseEntity<ApiError> handleRemote(RemoteServiceException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_GATEWAY, "REMOTE_SERVICE_ERROR", ex.getMessage(), remoteDetails(ex), request, ex);
    }

    @ExceptionHandler(IncompleteRecordException.class)
    public ResponseEntity<ApiError> handleIncomplete(IncompleteRecordException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_GATEWAY, "INCOMPLETE_RECORD", ex.getMessage(),
                List.of(detail(ex.getMissingField(), "missing on finding " + ex.getFindingId())), request, ex);
    }

    @ExceptionHandler(SinkWriteException.class)
    public ResponseEntity<ApiError> handleSink(SinkWriteException ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "SINK_WRITE_ERROR", ex.getMessage(), List.of(), request, ex);
    }

    /**
     * Synchronous export that did not complete. The status follows the cause;
     * the details say how far the export got.
     */
    @ExceptionHandler(ExportFailedException.class)
    public ResponseEntity<ApiError> handleExportFailed(ExportFailedException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = new ArrayList<>();
        details.add(detail("exportId", ex.getExportId()));
        details.add(detail("fileName", ex.getFileName()));
        details.add(detail("rowsWritten", String.valueOf(ex.getRowsWritten())));
        Throwable cause = ex.getCause();
        HttpStatus status;
        String errorCode;
        if (cause instanceof RemoteServiceException remote) {
            status = HttpStatus.BAD_GATEWAY;
            errorCode = "REMOTE_SERVICE_ERROR";
            details.addAll(remoteDetails(remote));
        } else if (cause instanceof IncompleteRecordException) {
            status = HttpStatus.BAD_GATEWAY;
            errorCode = "INCOMPLETE_RECORD";
        } else if (cause instanceof ExportCancelledException) {
            status = HttpStatus.CONFLICT;
            errorCode = "EXPORT_CANCELLED";
        } else if (cause instanceof SinkWriteException) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            errorCode = "SINK_WRITE_ERROR";
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            errorCode = "EXPORT_FAILED";
        }
        return buildError(status, errorCode, ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.INTERNAL_SERVER_ERROR.name(),
                "Unexpected error", List.of(), request, ex);
    }

    private List<ApiErrorDetail> remoteDetails(RemoteServiceException ex) {
        List<ApiErrorDetail> details = new ArrayList<>();
        details.add(detail("operation", ex.getOperation()));
        if (ex.getRegion() != null) {
            details.add(detail("region", ex.getRegion()));
        }
        if (ex.getStatusCode() > 0) {
            details.add(detail("statusCode", String.valueOf(ex.getStatusCode())));
        }
        return details;
    }

    private ApiErrorDetail detail(String field, String issue) {
        return ApiErrorDetail.builder().field(field).issue(issue).build();
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String errorCode, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request, Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .requestId(MDC.get(MdcKeys.REQUEST_ID))
                .correlationId(MDC.get(MdcKeys.CORRELATION_ID))
                .details(details)
                .build();
        if (status.is5xxServerError()) {
            log.error("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message, ex);
        } else {
            log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        }
        return ResponseEntity.status(status).body(error);
    }
}
