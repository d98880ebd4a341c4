package com.example.ocppcentral.ocpp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts between OCPP-J text frames and {@link OcppFrame} values.
 * <pre>
 *   [2, uniqueId, action, payload]
 *   [3, uniqueId, payload]
 *   [4, uniqueId, errorCode, errorDescription, details]
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class OcppCodec {

    private final ObjectMapper objectMapper;

    public OcppFrame decode(String raw) throws MalformedFrameException {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame is not valid JSON: " + e.getOriginalMessage(), null, e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedFrameException("Frame is not a JSON array", null);
        }

        String uniqueId = root.size() > 1 && root.get(1).isTextual() ? root.get(1).asText() : null;
        if (root.size() < 3) {
            throw new MalformedFrameException("Frame has " + root.size() + " elements, expected at least 3", uniqueId);
        }
        JsonNode typeNode = root.get(0);
        if (!typeNode.isInt()) {
            throw new MalformedFrameException("Message type id is not an integer: " + typeNode, uniqueId);
        }
        MessageType type = MessageType.fromCode(typeNode.asInt())
                .orElseThrow(() -> new MalformedFrameException("Unknown message type id " + typeNode.asInt(), uniqueId));
        if (uniqueId == null) {
            throw new MalformedFrameException("Unique id is not a string: " + root.get(1), null);
        }

        switch (type) {
            case CALL:
                if (!root.get(2).isTextual()) {
                    throw new MalformedFrameException("Action is not a string: " + root.get(2), uniqueId);
                }
                if (root.size() < 4) {
                    throw new MalformedFrameException("Call " + root.get(2).asText() + " has no payload", uniqueId);
                }
                return new Call(uniqueId, root.get(2).asText(), root.get(3));
            case CALL_RESULT:
                return new CallResult(uniqueId, root.get(2));
            case CALL_ERROR:
                if (!root.get(2).isTextual()) {
                    throw new MalformedFrameException("Error code is not a string: " + root.get(2), uniqueId);
                }
                String description = root.size() > 3 ? root.get(3).asText("") : "";
                JsonNode details = root.size() > 4 ? root.get(4) : objectMapper.createObjectNode();
                return new CallError(uniqueId, root.get(2).asText(), description, details);
            default:
                throw new MalformedFrameException("Unsupported message type " + type, uniqueId);
        }
    }

    public String encode(OcppFrame frame) {
        ArrayNode array = objectMapper.createArrayNode();
        array.add(frame.getMessageType().getCode());
        array.add(frame.getUniqueId());
        if (frame instanceof Call call) {
            array.add(call.getAction());
            array.add(orEmpty(call.getPayload()));
        } else if (frame instanceof CallResult result) {
            array.add(orEmpty(result.getPayload()));
        } else if (frame instanceof CallError error) {
            array.add(error.getErrorCode());
            array.add(error.getErrorDescription() == null ? "" : error.getErrorDescription());
            array.add(orEmpty(error.getDetails()));
        }
        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize frame " + frame.getUniqueId(), e);
        }
    }

    /**
     * Element [1] of a raw frame, or null when the text is not an array of
     * more than one element. Never throws; used for audit correlation.
     */
    public String correlationIdOf(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(raw);
            if (root != null && root.isArray() && root.size() > 1) {
                return root.get(1).asText();
            }
        } catch (JsonProcessingException e) {
            return null;
        }
        return null;
    }

    public JsonNode toTree(Object payload) {
        return payload == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(payload);
    }

    public <T> T fromTree(JsonNode payload, Class<T> type) throws JsonProcessingException {
        return objectMapper.treeToValue(payload, type);
    }

    private JsonNode orEmpty(JsonNode node) {
        return node == null ? objectMapper.createObjectNode() : node;
    }
}
