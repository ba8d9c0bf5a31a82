package com.aporkolab.demo.retry;

public record SubmitMessageResponse(String messageId, String topic, int partition, long offset) {}
