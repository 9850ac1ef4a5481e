package com.vtb.attacktree.web;

import com.vtb.attacktree.exceptions.AttackTreeException;
import com.vtb.attacktree.exceptions.IncompleteDataException;
import com.vtb.attacktree.exceptions.NodeReferenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Перевод ошибок анализа в ответы REST API
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AttackTreeException.class)
    public ResponseEntity<Map<String, Object>> handleAttackTree(AttackTreeException e) {
        HttpStatus status;
        if (e instanceof NodeReferenceException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof IncompleteDataException) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        log.warn("Запрос отклонён ({}): {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON)
            .body(body(e.getMessage(), e.getClass().getSimpleName(), e.getNodeIds()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleState(IllegalStateException e) {
        log.warn("Запрос отклонён (409): {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).contentType(MediaType.APPLICATION_JSON)
            .body(body(e.getMessage(), "IllegalState", List.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleArgument(IllegalArgumentException e) {
        log.warn("Запрос отклонён (400): {}", e.getMessage());
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
            .body(body(e.getMessage(), "IllegalArgument", List.of()));
    }

    private static Map<String, Object> body(String message, String type, List<String> nodeIds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("type", type);
        body.put("nodeIds", nodeIds);
        return body;
    }
}
