package com.gdin.inspection.citegraph.exception;

import com.gdin.inspection.citegraph.resp.ResultData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 全局异常处理器，统一包装成 ResultData。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GraphException.class)
    public ResponseEntity<ResultData<String>> handleGraphException(GraphException e) {
        HttpStatus status = e.getCode().getStatus();
        if (status.is5xxServerError()) log.error("业务异常[{}]: {}", e.getCode(), e.getMessage(), e);
        else log.warn("业务异常[{}]: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(status)
                .body(ResultData.fail(status.value(), e.getMessage(), e.getCode().name()));
    }

    /**
     * 参数校验异常 - @Valid
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ResultData<String>> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("参数校验异常: {}", message);
        return ResponseEntity.badRequest()
                .body(ResultData.fail(HttpStatus.BAD_REQUEST.value(), message, ErrorCode.INVALID_REQUEST.name()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ResultData<String>> handleBadRequest(Exception e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(ResultData.fail(HttpStatus.BAD_REQUEST.value(), e.getMessage(), ErrorCode.INVALID_REQUEST.name()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ResultData<String>> handleException(Exception e) {
        log.error("系统异常: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError()
                .body(ResultData.fail(HttpStatus.INTERNAL_SERVER_ERROR.value(), "系统异常,请稍后重试", e));
    }
}
