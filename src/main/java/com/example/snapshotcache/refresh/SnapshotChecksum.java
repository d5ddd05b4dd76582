package com.example.snapshotcache.refresh;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/** SHA-256 over the serialized records, used to tell a no-op refresh from a real change. */
final class SnapshotChecksum {

    private SnapshotChecksum() {
    }

    static String of(List<JsonNode> records, ObjectMapper objectMapper) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(records);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to checksum records", e);
        }
    }
}
