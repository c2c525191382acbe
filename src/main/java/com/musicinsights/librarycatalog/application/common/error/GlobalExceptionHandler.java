package com.musicinsights.librarycatalog.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * 전역 예외 처리기.
 *
 * <p>카탈로그/통계 API에서 발생한 예외를 {@link ErrorResponse} 형태로 변환한다.
 * 배치 적재는 아이템 실패를 응답 본문(rejects)으로 돌려주므로, 여기로 오는 것은 요청 자체의 오류와 reset 실패뿐이다.</p>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException e, ServerWebExchange ex) {
        return badRequest(e.getMessage(), ex, e.code());
    }

    /**
     * 검증(ConstraintViolation) 실패를 400 응답으로 변환한다.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e, ServerWebExchange ex) {
        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");

        return badRequest(msg, ex, "VALIDATION_ERROR");
    }

    /**
     * 컨트롤러 메서드 파라미터 검증({@code @Min}/{@code @Max}) 실패를 400 응답으로 변환한다.
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException e, ServerWebExchange ex) {
        String msg = e.getAllErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");

        return badRequest(msg, ex, "VALIDATION_ERROR");
    }

    /**
     * 바인딩/파라미터 검증(WebExchangeBind) 실패를 400 응답으로 변환한다.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e, ServerWebExchange ex) {
        String msg = e.getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .orElse("Validation failed");

        return badRequest(msg, ex, "VALIDATION_ERROR");
    }

    /**
     * 필수 파라미터 누락, 타입 변환 실패, 읽을 수 없는 본문을 400 응답으로 변환한다.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e, ServerWebExchange ex) {
        return badRequest(e.getReason(), ex, "INVALID_INPUT");
    }

    /**
     * DB 접근/SQL 오류를 500 응답으로 변환한다.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDb(DataAccessException e, ServerWebExchange ex) {
        log.error("Database error. path={}", path(ex), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", "Database error", path(ex), "DB_ERROR"));
    }

    /**
     * 처리되지 않은 예외를 500 응답으로 변환한다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, ServerWebExchange ex) {
        log.error("Unexpected error. path={}", path(ex), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", "Unexpected error", path(ex), "INTERNAL_ERROR"));
    }

    private static ResponseEntity<ErrorResponse> badRequest(String msg, ServerWebExchange ex, String code) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(400, "Bad Request", msg, path(ex), code));
    }

    private static String path(ServerWebExchange ex) {
        return ex.getRequest().getPath().value();
    }
}
