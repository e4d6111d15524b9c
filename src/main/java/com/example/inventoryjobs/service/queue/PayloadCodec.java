package com.example.inventoryjobs.service.queue;

import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.exception.InvalidPayloadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.stream.Collectors;

/**
 * JSON encoding of task payloads.
 * Decoded payloads are bean-validated, so a missing id fails the same way malformed JSON does.
 */
@Component
@RequiredArgsConstructor
public class PayloadCodec {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public Task encode(TaskType type, Object payload) {
        try {
            return Task.of(type, objectMapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException(type.getCode(), e);
        }
    }

    public <T> T decode(QueuedTask task, Class<T> payloadType) {
        var payload = task.getPayload();
        if (payload == null || payload.length == 0) {
            throw new InvalidPayloadException(task.getTaskType(), "empty payload");
        }

        T value;
        try {
            value = objectMapper.readValue(payload, payloadType);
        } catch (IOException e) {
            throw new InvalidPayloadException(task.getTaskType(), e);
        }
        if (value == null) {
            throw new InvalidPayloadException(task.getTaskType(), "null payload");
        }

        var violations = validator.validate(value);
        if (!violations.isEmpty()) {
            var message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidPayloadException(task.getTaskType(), message);
        }
        return value;
    }
}
