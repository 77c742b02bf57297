package com.harvest.coordinator.crawl.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.coordinator.crawl.util.HashUtils;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP-compressed JSON encoding of checkpoint payloads, guarded by a SHA-256 of the compressed bytes.
 */
@Component
public class CheckpointCodec {
    private final ObjectMapper objectMapper;

    public CheckpointCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(CheckpointPayload payload) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            objectMapper.writeValue(gzip, payload);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to encode checkpoint for job " + payload.jobId(), e);
        }
        return buffer.toByteArray();
    }

    public String checksum(byte[] encoded) {
        return HashUtils.sha256Hex(encoded);
    }

    public CheckpointPayload decode(String checkpointId, byte[] encoded, String expectedChecksum) {
        if (encoded == null || encoded.length == 0) {
            throw new CheckpointCorruptException(checkpointId, "payload is empty");
        }
        if (expectedChecksum != null && !expectedChecksum.equals(checksum(encoded))) {
            throw new CheckpointCorruptException(checkpointId, "checksum mismatch");
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(encoded))) {
            CheckpointPayload payload = objectMapper.readValue(in, CheckpointPayload.class);
            if (payload == null || payload.state() == null) {
                throw new CheckpointCorruptException(checkpointId, "payload has no job state");
            }
            return payload;
        } catch (IOException e) {
            throw new CheckpointCorruptException(checkpointId, e.getMessage(), e);
        }
    }
}
