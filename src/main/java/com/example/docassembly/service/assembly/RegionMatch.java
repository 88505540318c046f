package com.example.docassembly.service.assembly;

import com.example.docassembly.dto.document.BlockType;
import lombok.Value;

/**
 * Result of matching one line box. {@code regionId} is null when no region
 * passed the threshold; {@code blockId} is then freshly generated.
 */
@Value
public class RegionMatch {
    String blockId;
    BlockType blockType;
    String regionId;

    public boolean isMatched() {
        return regionId != null;
    }
}
