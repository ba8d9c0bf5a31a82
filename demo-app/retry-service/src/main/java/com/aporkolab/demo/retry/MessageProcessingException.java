package com.aporkolab.demo.retry;

public class MessageProcessingException extends RuntimeException {

    private final String messageId;

    public MessageProcessingException(String messageId, String message) {
        super(message);
        this.messageId = messageId;
    }

    public String getMessageId() {
        return messageId;
    }
}
