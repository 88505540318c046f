package com.example.docassembly.dto.detection;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssemblyRequest {
    private String detectionOrigin;
    private List<PageDetections> pages = new ArrayList<>();
}
