package com.danieljhkim.meshcoord.meshcoordinator.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One line of the event journal as read back for audit.
 */
public record JournalEntry(long sequence, String type, Instant recordedAt, JsonNode payload) {}
