package com.aporkolab.demo.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.nio.charset.StandardCharsets;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import com.aporkolab.retry.core.RetrySettings;
import com.aporkolab.retry.core.exception.SinkUnavailableException;
import com.aporkolab.retry.core.sink.DeadLetterPort;
import com.aporkolab.retry.core.sink.DeadLetterRecord;
import com.aporkolab.retry.core.sink.DeadLetterSink;
import com.aporkolab.retry.core.sink.ErrorType;
import com.aporkolab.retry.metrics.RetryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;

class IntakeListenerTest {

    private static final String VALID =
            "{\"metadata\":{\"message_id\":\"6f1c3a52-0b7e-4d2a-9c1e-2b3f4a5d6e7f\"},\"data\":{\"x\":1}}";

    private ValidatorFactory validatorFactory;
    private DeadLetterPort deadLetterPort;
    private RetryServiceProperties properties;
    private RetryMetrics metrics;
    private IntakeListener listener;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        deadLetterPort = mock(DeadLetterPort.class);
        properties = new RetryServiceProperties();
        metrics = new RetryMetrics(new SimpleMeterRegistry());

        RetrySettings settings = RetrySettings.builder()
                .deadLetterDestination("final-dlq")
                .retryTarget("source-queue")
                .executionRole("scheduler-role")
                .build();

        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("retryMetrics", metrics);

        listener = new IntakeListener(
                new MessageValidator(new ObjectMapper(), validatorFactory.getValidator()),
                new MessageProcessor(properties),
                new DeadLetterSink(deadLetterPort, settings),
                beans.getBeanProvider(RetryMetrics.class));
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("should quarantine unparseable messages and acknowledge them")
    void shouldQuarantineFormatErrors() {
        listener.onMessage(record("{not json"));

        DeadLetterRecord written = captureDeadLetter();
        assertThat(written.getErrorType()).isEqualTo(ErrorType.INVALID_MESSAGE_FORMAT);
        assertThat(new String(written.getOriginalBody(), StandardCharsets.UTF_8)).isEqualTo("{not json");
        assertThat(written.getDestination()).isEqualTo("final-dlq");
        assertThat(metrics.getQuarantinedCount(ErrorType.INVALID_MESSAGE_FORMAT)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should quarantine wrongly shaped messages as schema errors")
    void shouldQuarantineSchemaErrors() {
        listener.onMessage(record("{\"metadata\":{\"message_id\":\"nope\"},\"data\":{}}"));

        DeadLetterRecord written = captureDeadLetter();
        assertThat(written.getErrorType()).isEqualTo(ErrorType.INVALID_MESSAGE_SCHEMA);
        assertThat(written.getErrorDetails()).contains("message_id must be a UUID");
    }

    @Test
    @DisplayName("should let processing failures propagate to the container")
    void shouldPropagateProcessingFailure() {
        assertThatThrownBy(() -> listener.onMessage(record(VALID)))
                .isInstanceOf(MessageProcessingException.class)
                .hasMessage("This exception is intentionally thrown");

        verifyNoInteractions(deadLetterPort);
    }

    @Test
    @DisplayName("should process valid messages when failure simulation is off")
    void shouldProcessValidMessage() {
        properties.setSimulateFailure(false);

        listener.onMessage(record(VALID));

        verifyNoInteractions(deadLetterPort);
    }

    @Test
    @DisplayName("should propagate a failed quarantine write")
    void shouldPropagateSinkFailure() {
        doThrow(new IllegalStateException("broker down")).when(deadLetterPort).send(any());

        assertThatThrownBy(() -> listener.onMessage(record("garbage")))
                .isInstanceOf(SinkUnavailableException.class);
    }

    private DeadLetterRecord captureDeadLetter() {
        ArgumentCaptor<DeadLetterRecord> captor = ArgumentCaptor.forClass(DeadLetterRecord.class);
        verify(deadLetterPort).send(captor.capture());
        return captor.getValue();
    }

    private static ConsumerRecord<String, byte[]> record(String body) {
        return new ConsumerRecord<>("source-queue", 0, 0L, "key", body.getBytes(StandardCharsets.UTF_8));
    }
}
