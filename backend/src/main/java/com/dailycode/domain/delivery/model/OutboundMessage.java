package com.dailycode.domain.delivery.model;

public record OutboundMessage(String to, String subject, String textBody, String htmlBody) {}
