package com.example.dutyroster.exception;

import com.example.dutyroster.common.error.ErrorLogBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorLogBuffer errorLogBuffer;

    public GlobalExceptionHandler(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, Object> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "バリデーションエラー",
                ErrorCode.VALIDATION.name(),
                "入力データに問題があります",
                errors,
                LocalDateTime.now()
        );

        logger.warn("バリデーションエラーが発生しました: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        logger.warn("不正なリクエストです: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "引数エラー",
                ErrorCode.VALIDATION.name(),
                "リクエストの形式が正しくありません",
                null,
                LocalDateTime.now()
        ));
    }

    @ExceptionHandler(RosterGenerationException.class)
    public ResponseEntity<ErrorResponse> handleStaffing(RosterGenerationException ex) {
        logger.warn("勤務表生成を中断しました: {}", ex.getMessage());
        errorLogBuffer.addError(ex.getErrorCode().name(), "勤務表生成を中断: " + ex.getDate(), ex);
        return ResponseEntity.status(ex.getErrorCode().getStatus()).body(new ErrorResponse(
                "人員不足",
                ex.getErrorCode().name(),
                ex.getMessage(),
                staffingDetails(ex),
                LocalDateTime.now()
        ));
    }

    @ExceptionHandler(PeriodGenerationException.class)
    public ResponseEntity<ErrorResponse> handlePeriodFailure(PeriodGenerationException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failedDate", ex.getFailedDate().toString());
        details.put("generatedDays", ex.getGeneratedDays());

        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String code = "INTERNAL_ERROR";
        Throwable cause = ex.getCause();
        if (cause instanceof RosterGenerationException staffing) {
            details.putAll(staffingDetails(staffing));
        }
        if (cause instanceof BusinessException business) {
            status = business.getErrorCode().getStatus();
            code = business.getErrorCode().name();
            details.put("reason", business.getMessage());
            logger.warn("期間生成を {} で停止しました: {}", ex.getFailedDate(), business.getMessage());
        } else if (cause instanceof ConcurrencyFailureException || cause instanceof DataIntegrityViolationException) {
            status = ErrorCode.CONCURRENT_MODIFICATION.getStatus();
            code = ErrorCode.CONCURRENT_MODIFICATION.name();
            details.put("reason", "同じ日付が同時に更新されました");
            logger.warn("期間生成を {} で停止しました (競合)", ex.getFailedDate(), cause);
        } else {
            logger.error("期間生成を {} で停止しました", ex.getFailedDate(), ex);
        }
        errorLogBuffer.addError(code, "期間生成を停止: " + ex.getFailedDate(), cause);
        return ResponseEntity.status(status).body(new ErrorResponse(
                "期間生成エラー",
                code,
                ex.getMessage(),
                details,
                LocalDateTime.now()
        ));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "ビジネスロジックエラー",
                ex.getErrorCode().name(),
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("ビジネスロジックエラーが発生しました [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(ex.getErrorCode().getStatus()).body(errorResponse);
    }

    @ExceptionHandler({ConcurrencyFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConcurrentModification(Exception ex) {
        logger.warn("同時更新を検出しました: {}", ex.getMessage());
        errorLogBuffer.addError(ErrorCode.CONCURRENT_MODIFICATION.name(), "同時更新", ex);
        return ResponseEntity.status(ErrorCode.CONCURRENT_MODIFICATION.getStatus()).body(new ErrorResponse(
                "競合エラー",
                ErrorCode.CONCURRENT_MODIFICATION.name(),
                "他の処理が同じデータを更新しました。再度お試しください",
                null,
                LocalDateTime.now()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "内部サーバーエラー",
                "INTERNAL_ERROR",
                "予期しないエラーが発生しました",
                null,
                LocalDateTime.now()
        );

        logger.error("予期しないエラーが発生しました", ex);
        errorLogBuffer.addError("INTERNAL_ERROR", "予期しないエラー", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private Map<String, Object> staffingDetails(RosterGenerationException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("date", ex.getDate().toString());
        details.put("post", ex.getPostName());
        details.put("requiredYears", ex.getRequiredYears());
        return details;
    }

    public record ErrorResponse(
            String error,
            String code,
            String message,
            Map<String, Object> details,
            LocalDateTime timestamp
    ) {}
}
