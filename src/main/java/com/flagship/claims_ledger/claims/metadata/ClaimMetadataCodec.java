package com.flagship.claims_ledger.claims.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.claims_ledger.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * JSON conversion and patch merging for claim metadata.
 *
 * Patches are applied on the JSON tree and re-read as the same variant, so a key
 * that the variant does not declare is rejected instead of silently stored.
 */
@Component
public class ClaimMetadataCodec {

    private static final String KIND_PROPERTY = "kind";

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ClaimMetadataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.readerFor(ClaimMetadata.class)
            .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(ClaimMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize claim metadata", e);
        }
    }

    public ClaimMetadata read(String json) {
        try {
            return strictReader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored claim metadata is unreadable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Overlays patch keys on existing metadata. A null patch value clears the field.
     *
     * @throws ValidationException if the patch names an unknown field or changes the kind
     */
    public ClaimMetadata merge(ClaimMetadata existing, Map<String, ?> patch) {
        ObjectNode tree = objectMapper.valueToTree(existing);
        String kind = tree.path(KIND_PROPERTY).asText();

        Object patchedKind = patch.get(KIND_PROPERTY);
        if (patchedKind != null && !kind.equals(patchedKind)) {
            throw new ValidationException("Metadata kind cannot change from " + kind + " to " + patchedKind);
        }

        ObjectNode patchTree = objectMapper.valueToTree(patch);
        tree.setAll(patchTree);
        tree.put(KIND_PROPERTY, kind);

        try {
            return strictReader.readValue(tree);
        } catch (IOException e) {
            throw new ValidationException("Invalid metadata patch for " + kind + " claim: " + e.getMessage());
        }
    }
}
