package com.example.docassembly.service.assembly;

import com.example.docassembly.dto.detection.AssemblyRequest;
import com.example.docassembly.dto.detection.BoundingBox;
import com.example.docassembly.dto.detection.LayoutRegion;
import com.example.docassembly.dto.detection.PageDetections;
import com.example.docassembly.dto.detection.PageDimensions;
import com.example.docassembly.dto.detection.TextLine;
import com.example.docassembly.dto.detection.Word;
import com.example.docassembly.dto.document.Block;
import com.example.docassembly.dto.document.Document;
import com.example.docassembly.exception.EmptyLineGeometryException;
import com.example.docassembly.exception.InvalidGeometryException;
import com.example.docassembly.exception.InvalidRegionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns per-page text lines and layout regions into a single ordered {@link Document}.
 *
 * <p>Each page is assembled independently: lines are matched and merged in
 * detection order, picture and table regions are injected, and the page's
 * blocks are sorted top to bottom. With {@code assembly.parallelism > 1} pages
 * run on the page executor; the document is always concatenated in page order.</p>
 */
@Service
public class DocumentAssemblyService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAssemblyService.class);

    private static final Comparator<Block> READING_ORDER =
        Comparator.comparingDouble(block -> block.getBbox().getTop());

    private final RegionMatchingService regionMatchingService;
    private final BlockIdGenerator idGenerator;
    private final Executor pageExecutor;
    private final int parallelism;
    private final NonTextLinePolicy nonTextLinePolicy;
    private final String defaultDetectionOrigin;

    public DocumentAssemblyService(RegionMatchingService regionMatchingService,
                                   BlockIdGenerator idGenerator,
                                   @Qualifier("pageAssemblyExecutor") Executor pageExecutor,
                                   @Value("${assembly.parallelism:1}") int parallelism,
                                   @Value("${assembly.non-text-line-policy:DROP}") NonTextLinePolicy nonTextLinePolicy,
                                   @Value("${assembly.detection-origin:doctr}") String defaultDetectionOrigin) {
        this.regionMatchingService = regionMatchingService;
        this.idGenerator = idGenerator;
        this.pageExecutor = pageExecutor;
        this.parallelism = Math.max(1, parallelism);
        this.nonTextLinePolicy = nonTextLinePolicy;
        this.defaultDetectionOrigin = defaultDetectionOrigin;
    }

    public Document assemble(AssemblyRequest request) {
        String origin = request.getDetectionOrigin();
        if (origin == null || origin.isBlank()) {
            origin = defaultDetectionOrigin;
        }
        return assemble(request.getPages(), origin);
    }

    public Document assemble(List<PageDetections> pages, String detectionOrigin) {
        List<PageDetections> input = pages != null ? pages : Collections.emptyList();
        logger.info("Assembling document from {} page(s), origin={}, parallelism={}",
            input.size(), detectionOrigin, parallelism);

        List<List<Block>> pageBlocks = parallelism > 1 && input.size() > 1
            ? assembleConcurrently(input)
            : assembleSequentially(input);

        List<Block> content = new ArrayList<>();
        for (List<Block> blocks : pageBlocks) {
            content.addAll(blocks);
        }

        logger.info("Assembled {} block(s) across {} page(s)", content.size(), input.size());
        return new Document(buildMetadata(input), Collections.unmodifiableList(content), detectionOrigin);
    }

    /**
     * Assembles one page into blocks sorted by ascending top edge. Ties keep
     * creation order: text blocks in first-line order, then injected regions.
     */
    public List<Block> assemblePage(int pageIndex, PageDetections page) {
        List<LayoutRegion> regions = page.getRegions() != null ? page.getRegions() : Collections.emptyList();
        List<TextLine> lines = page.getLines() != null ? page.getLines() : Collections.emptyList();
        validateRegions(pageIndex, regions);

        PageBlockAccumulator accumulator = new PageBlockAccumulator(pageIndex, nonTextLinePolicy, idGenerator);

        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            TextLine line = lines.get(lineIndex);
            BoundingBox lineBox = lineBox(pageIndex, lineIndex, line);
            RegionMatch match = regionMatchingService.match(lineBox, regions);
            accumulator.accumulate(match.getBlockId(), match.getBlockType(), line.render(), lineBox);
        }

        int injected = 0;
        for (LayoutRegion region : regions) {
            if (region.getLabel().isStandalone()) {
                accumulator.inject(region.getId(), region.getLabel().getBlockType(), region.getBbox());
                injected++;
            }
        }

        List<Block> blocks = accumulator.finish();
        blocks.sort(READING_ORDER);

        logger.debug("Page {}: {} line(s), {} region(s) -> {} block(s), {} injected",
            pageIndex, lines.size(), regions.size(), blocks.size(), injected);
        return blocks;
    }

    private List<List<Block>> assembleSequentially(List<PageDetections> pages) {
        List<List<Block>> result = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            result.add(assemblePage(i, pages.get(i)));
        }
        return result;
    }

    private List<List<Block>> assembleConcurrently(List<PageDetections> pages) {
        List<CompletableFuture<List<Block>>> futures = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            final int pageIndex = i;
            final PageDetections page = pages.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> assemblePage(pageIndex, page), pageExecutor));
        }

        // Join in page order so the first failing page is the one reported
        List<List<Block>> result = new ArrayList<>(pages.size());
        for (CompletableFuture<List<Block>> future : futures) {
            try {
                result.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        }
        return result;
    }

    private BoundingBox lineBox(int pageIndex, int lineIndex, TextLine line) {
        List<Word> words = line.getWords();
        if (words == null || words.isEmpty()) {
            throw new EmptyLineGeometryException(pageIndex, lineIndex);
        }
        List<BoundingBox> geometries = new ArrayList<>(words.size());
        for (Word word : words) {
            geometries.add(word.getGeometry());
        }
        try {
            return BoxGeometry.union(geometries);
        } catch (IllegalArgumentException e) {
            throw InvalidGeometryException.forLine(pageIndex, lineIndex, e);
        }
    }

    private void validateRegions(int pageIndex, List<LayoutRegion> regions) {
        for (int i = 0; i < regions.size(); i++) {
            LayoutRegion region = regions.get(i);
            if (region.getId() == null) {
                throw new InvalidRegionException(pageIndex, i, "has no identifier");
            }
            if (region.getLabel() == null) {
                throw new InvalidRegionException(pageIndex, i, "has no label");
            }
            try {
                BoxGeometry.requireValid(region.getBbox());
            } catch (IllegalArgumentException e) {
                throw InvalidGeometryException.forRegion(pageIndex, region.getId(), e);
            }
        }
    }

    private Map<String, Object> buildMetadata(List<PageDetections> pages) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("pageCount", pages.size());

        List<Map<String, Object>> dimensions = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            PageDimensions dims = pages.get(i).getDimensions();
            if (dims != null) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("pageIndex", i);
                entry.put("width", dims.getWidth());
                entry.put("height", dims.getHeight());
                dimensions.add(entry);
            }
        }
        if (!dimensions.isEmpty()) {
            metadata.put("pageDimensions", dimensions);
        }
        return Collections.unmodifiableMap(metadata);
    }
}
