package org.nowstart.grammar.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class GrammarApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public GrammarApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
