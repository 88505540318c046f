package com.example.docassembly.dto.detection;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageDetections {
    private PageDimensions dimensions; // Raster size, passed through to document metadata
    private List<TextLine> lines = new ArrayList<>();
    private List<LayoutRegion> regions = new ArrayList<>(); // Detector order, drives tie-breaks
}
