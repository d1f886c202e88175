package com.danieljhkim.meshcoord.meshcoordinator.event;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only JSON-lines log of every processed event.
 *
 * <p>
 * Line format: {@code {"sequence":1,"type":"NodeFailed","recorded_at":"...","payload":{...}}}. Nodes are written as
 * their hex id and address.
 */
@Slf4j
public class EventJournal implements Closeable {

    private final Path file;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private BufferedWriter writer;
    private long sequence;

    public EventJournal(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        this.objectMapper = createObjectMapper();

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.sequence = Files.exists(file) ? countLines(file) : 0;
        this.writer = Files.newBufferedWriter(
                file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        log.info("Opened event journal {} at sequence {}", file, sequence);
    }

    static ObjectMapper createObjectMapper() {
        SimpleModule meshModule = new SimpleModule("mesh");
        meshModule.addSerializer(NodeId.class, new NodeIdSerializer());
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(meshModule)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Writes one event and flushes it.
     */
    public synchronized void append(MeshEvent event) throws IOException {
        if (writer == null) {
            throw new IOException("Event journal is closed: " + file);
        }
        ObjectNode line = objectMapper.createObjectNode();
        line.put("sequence", ++sequence);
        line.put("type", event.type());
        line.put("recorded_at", clock.instant().toString());
        line.set("payload", objectMapper.valueToTree(event));
        writer.write(objectMapper.writeValueAsString(line));
        writer.newLine();
        writer.flush();
    }

    /**
     * Reads every entry back in write order.
     */
    public List<JournalEntry> readAll() throws IOException {
        List<JournalEntry> entries = new ArrayList<>();
        replay(entries::add);
        return entries;
    }

    /**
     * Feeds every entry to {@code consumer} in write order. Blank lines are skipped.
     */
    public void replay(Consumer<JournalEntry> consumer) throws IOException {
        synchronized (this) {
            if (writer != null) {
                writer.flush();
            }
        }
        if (!Files.exists(file)) {
            return;
        }
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = objectMapper.readTree(line);
            consumer.accept(new JournalEntry(
                    node.path("sequence").asLong(),
                    node.path("type").asText(),
                    Instant.parse(node.path("recorded_at").asText()),
                    node.path("payload")));
        }
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }

    private static long countLines(Path file) throws IOException {
        try (var lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.filter(l -> !l.isBlank()).count();
        }
    }

    static class NodeIdSerializer extends StdSerializer<NodeId> {

        NodeIdSerializer() {
            super(NodeId.class);
        }

        @Override
        public void serialize(NodeId value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("id", value.toHex());
            gen.writeStringField("address", value.getAddress());
            gen.writeNumberField("trust_score", value.getTrustScore());
            gen.writeEndObject();
        }
    }
}
