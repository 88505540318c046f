package com.example.docassembly.dto.detection;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LayoutRegion {
    private String id;
    private LayoutLabel label;
    private BoundingBox bbox;
}
