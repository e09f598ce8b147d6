package org.geoingest.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.geoingest.models.domain.RawDataRecord;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Turns a group of records into a gzip-compressed JSON array and back. Checksums are SHA-256
 * over the compressed bytes.
 */
@Slf4j
public class BlobCodec {

    private final ObjectMapper objectMapper;
    private final int compressionLevel;

    public BlobCodec(ObjectMapper objectMapper, int compressionLevel) {
        if (compressionLevel < Deflater.NO_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Compression level must be between 0 and 9, got " + compressionLevel);
        }
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.compressionLevel = compressionLevel;
    }

    public EncodedBlob encode(List<RawDataRecord> records) throws IOException {
        byte[] json = objectMapper.writeValueAsBytes(records);
        byte[] compressed = compress(json);
        return new EncodedBlob(compressed, json.length, checksum(compressed));
    }

    public byte[] compress(byte[] raw) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
        try (OutputStream out = new LeveledGzipOutputStream(buffer, compressionLevel)) {
            out.write(raw);
        }
        return buffer.toByteArray();
    }

    public byte[] decompress(byte[] compressed) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }

    /**
     * Decodes a blob, skipping elements that do not deserialize into a record. Fails only when
     * the blob itself is unreadable.
     */
    public DecodedBlob decode(byte[] compressed) throws IOException {
        JsonNode root = objectMapper.readTree(decompress(compressed));
        if (root == null || !root.isArray()) {
            throw new IOException("Blob payload is not a JSON array");
        }
        List<RawDataRecord> records = new ArrayList<>(root.size());
        int skipped = 0;
        for (JsonNode element : root) {
            try {
                records.add(objectMapper.treeToValue(element, RawDataRecord.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping malformed stored record {}: {}", element.path("id").asText("<no id>"), e.getMessage());
            }
        }
        return new DecodedBlob(records, skipped);
    }

    public boolean verify(byte[] compressed, String expectedChecksum) {
        return checksum(compressed).equalsIgnoreCase(expectedChecksum);
    }

    public static String checksum(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest algorithm not available", e);
        }
    }

    public record EncodedBlob(byte[] compressed, long uncompressedSize, String checksum) {
    }

    public record DecodedBlob(List<RawDataRecord> records, int skipped) {
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
