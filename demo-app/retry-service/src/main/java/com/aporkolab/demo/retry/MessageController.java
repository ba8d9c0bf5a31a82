package com.aporkolab.demo.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/messages")
@Tag(name = "Messages", description = "Submit messages to the source topic")
public class MessageController {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final MessagePublisher publisher;

    public MessageController(MessagePublisher publisher) {
        this.publisher = publisher;
    }

    @PostMapping
    @Operation(summary = "Submit a message", description = "Wraps the data in a metadata envelope and publishes it to the source topic")
    @ApiResponses({
        @ApiResponse(responseCode = "202", description = "Message accepted",
                content = @Content(schema = @Schema(implementation = SubmitMessageResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "503", description = "Broker unavailable")
    })
    public ResponseEntity<SubmitMessageResponse> submit(@Valid @RequestBody SubmitMessageRequest request) {
        log.info("POST /api/v1/messages - messageId: {}", request.messageId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(publisher.submit(request));
    }

    @PostMapping(path = "/raw", consumes = {MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_JSON_VALUE})
    @Operation(summary = "Submit a raw body", description = "Publishes the body unchanged, e.g. to exercise the invalid-message path")
    @ApiResponses({
        @ApiResponse(responseCode = "202", description = "Message accepted"),
        @ApiResponse(responseCode = "503", description = "Broker unavailable")
    })
    public ResponseEntity<SubmitMessageResponse> submitRaw(
            @RequestBody String body,
            @Parameter(description = "Record key") @RequestParam(required = false) String key) {
        log.info("POST /api/v1/messages/raw - {} chars", body.length());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(publisher.submitRaw(key, body));
    }
}
