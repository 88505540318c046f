package com.example.docassembly.dto.document;

import com.example.docassembly.dto.detection.BoundingBox;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One typed unit of an assembled document. Text is empty for
 * {@link BlockType#TABLE} and {@link BlockType#IMAGE} blocks. The box is
 * handed out as a copy, so a finished block cannot be reshaped by callers.
 */
@Value
@Builder
public class Block {
    BlockType type;
    String text;
    BoundingBox bbox;
    Map<String, Object> metadata;
    PageRange pageRange;

    public BoundingBox getBbox() {
        return bbox != null ? bbox.copy() : null;
    }
}
