package com.example.docassembly.controller;

import com.example.docassembly.dto.detection.AssemblyRequest;
import com.example.docassembly.dto.document.Document;
import com.example.docassembly.service.assembly.DocumentAssemblyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/assembly")
public class AssemblyController {

    private static final Logger logger = LoggerFactory.getLogger(AssemblyController.class);

    @Autowired
    private DocumentAssemblyService documentAssemblyService;

    @PostMapping
    public ResponseEntity<Document> assemble(@RequestBody AssemblyRequest request) {
        logger.info("=== ASSEMBLY REQUEST RECEIVED: {} page(s), origin={} ===",
            request.getPages() != null ? request.getPages().size() : 0, request.getDetectionOrigin());
        Document document = documentAssemblyService.assemble(request);
        return ResponseEntity.ok(document);
    }
}
