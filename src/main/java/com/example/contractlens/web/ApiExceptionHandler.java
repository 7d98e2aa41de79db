package com.example.contractlens.web;

import com.example.contractlens.parser.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LogManager.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ParseException.class)
    public ProblemDetail handleParseFailure(ParseException e) {
        log.warn("Rejected unparseable source: {}", e.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        problem.setTitle("Source could not be parsed");
        problem.setProperty("line", e.getLine());
        problem.setProperty("column", e.getColumn());
        return problem;
    }
}
