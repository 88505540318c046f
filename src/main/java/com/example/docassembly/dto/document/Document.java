package com.example.docassembly.dto.document;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class Document {
    Map<String, Object> metadata;
    List<Block> content;
    String detectionOrigin;
}
