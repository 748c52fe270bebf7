package com.cmdchat.web;

import com.cmdchat.error.AuthException;
import com.cmdchat.error.CryptoException;
import com.cmdchat.error.ValidationException;
import com.cmdchat.protocol.ErrorFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps the error taxonomy onto HTTP statuses with an {@code {"error": "..."}} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorFrame> onValidation(ValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorFrame(e.getMessage()));
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorFrame> onAuth(AuthException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorFrame("unauthorized"));
    }

    @ExceptionHandler(CryptoException.class)
    public ResponseEntity<ErrorFrame> onCrypto(CryptoException e) {
        log.error("Key exchange error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorFrame("key exchange failed"));
    }
}
