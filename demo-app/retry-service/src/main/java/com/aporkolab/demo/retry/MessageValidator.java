package com.aporkolab.demo.retry;

import java.io.IOException;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.aporkolab.retry.core.sink.ErrorType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

/**
 * Two-step check of an intake message.
 * 
 * - Not JSON at all: INVALID_MESSAGE_FORMAT
 * - JSON of the wrong shape (types, required fields, message_id pattern): INVALID_MESSAGE_SCHEMA
 */
@Component
public class MessageValidator {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public MessageValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public IntakeMessage validate(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidMessageException(ErrorType.INVALID_MESSAGE_FORMAT, "Message body is empty");
        }

        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException(ErrorType.INVALID_MESSAGE_FORMAT, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidMessageException(ErrorType.INVALID_MESSAGE_FORMAT, e.getMessage(), e);
        }

        if (tree == null || !tree.isObject()) {
            throw new InvalidMessageException(ErrorType.INVALID_MESSAGE_SCHEMA,
                    "Message must be a JSON object, was " + (tree == null ? "empty" : tree.getNodeType()));
        }

        IntakeMessage message;
        try {
            message = objectMapper.treeToValue(tree, IntakeMessage.class);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException(ErrorType.INVALID_MESSAGE_SCHEMA, e.getOriginalMessage(), e);
        }

        Set<ConstraintViolation<IntakeMessage>> violations = validator.validate(message);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidMessageException(ErrorType.INVALID_MESSAGE_SCHEMA, detail);
        }
        return message;
    }
}
