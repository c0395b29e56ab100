package net.tickstore.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.tickstore.core.error.MappingException;
import net.tickstore.core.model.JobExtra;

import java.io.IOException;
import java.util.UUID;

/**
 * JSON codec for the extra payload attached to a job:
 * {@code {"user_id":"<uuid>","extension_type":<int>}}.
 */
public final class JobExtraCodec {
    static final String USER_ID = "user_id";
    static final String EXTENSION_TYPE = "extension_type";

    private final ObjectMapper mapper;

    public JobExtraCodec() { this(new ObjectMapper()); }

    public JobExtraCodec(ObjectMapper mapper) { this.mapper = mapper; }

    public byte[] encode(JobExtra extra) throws MappingException {
        ObjectNode node = mapper.createObjectNode();
        node.put(USER_ID, extra.ownerId().toString());
        node.put(EXTENSION_TYPE, extra.extensionType());
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new MappingException("Failed to serialize job extra data", e);
        }
    }

    public JobExtra decode(byte[] payload) throws MappingException {
        if (payload == null || payload.length == 0) {
            throw new MappingException("Job extra data is missing");
        }
        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (IOException e) {
            throw new MappingException("Failed to deserialize job extra data", e);
        }
        if (node == null || !node.isObject()) {
            throw new MappingException("Job extra data is not a JSON object");
        }

        JsonNode user = node.get(USER_ID);
        JsonNode type = node.get(EXTENSION_TYPE);
        if (user == null || !user.isTextual()) {
            throw new MappingException("Job extra data has no " + USER_ID);
        }
        if (type == null || !type.canConvertToInt() || !type.isIntegralNumber()) {
            throw new MappingException("Job extra data has no integer " + EXTENSION_TYPE);
        }
        try {
            return new JobExtra(UUID.fromString(user.asText()), type.intValue());
        } catch (IllegalArgumentException e) {
            throw new MappingException("Job extra data has a malformed " + USER_ID, e);
        }
    }
}
