package com.example.docassembly.service.assembly;

import com.example.docassembly.dto.detection.BoundingBox;
import com.example.docassembly.dto.document.Block;
import com.example.docassembly.dto.document.BlockType;
import com.example.docassembly.dto.document.PageRange;
import com.example.docassembly.exception.ConflictingBlockException;
import com.example.docassembly.exception.NonTextLineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-progress blocks of a single page, keyed by block identifier.
 *
 * <p>Not thread-safe. One instance belongs to exactly one page worker, and
 * lines must be fed in detection order since that order becomes the text
 * order of merged blocks. {@link #finish()} turns the drafts into immutable
 * {@link Block}s and closes the accumulator.</p>
 */
public class PageBlockAccumulator {

    private static final Logger logger = LoggerFactory.getLogger(PageBlockAccumulator.class);

    private final int pageIndex;
    private final NonTextLinePolicy nonTextLinePolicy;
    private final BlockIdGenerator idGenerator;

    private final Map<String, Draft> drafts = new LinkedHashMap<>();
    // Regions already emitted through inject(), by region id
    private final Set<String> injectedRegionIds = new HashSet<>();
    private boolean finished;

    public PageBlockAccumulator(int pageIndex, NonTextLinePolicy nonTextLinePolicy, BlockIdGenerator idGenerator) {
        this.pageIndex = pageIndex;
        this.nonTextLinePolicy = nonTextLinePolicy;
        this.idGenerator = idGenerator;
    }

    /**
     * Merges one text line into the block {@code blockId}, creating it on first use.
     *
     * @return false when the line was dropped under {@link NonTextLinePolicy#DROP}
     */
    public boolean accumulate(String blockId, BlockType blockType, String lineText, BoundingBox lineBox) {
        checkOpen();
        BoxGeometry.requireValid(lineBox);

        Draft existing = drafts.get(blockId);
        if (injectedRegionIds.contains(blockId) || (existing != null && existing.injected)) {
            throw new ConflictingBlockException(pageIndex, blockId);
        }

        if (existing != null) {
            existing.text.append('\n').append(lineText);
            existing.bbox = BoxGeometry.union(existing.bbox, lineBox);
            return true;
        }

        if (!blockType.isTextBearing()) {
            if (nonTextLinePolicy == NonTextLinePolicy.REJECT) {
                throw new NonTextLineException(pageIndex, blockId, blockType);
            }
            logger.debug("Dropping text line matched to {} region {} on page {}",
                blockType.getTag(), blockId, pageIndex);
            return false;
        }

        drafts.put(blockId, new Draft(blockType, lineText, BoxGeometry.copyOf(lineBox), false));
        return true;
    }

    /**
     * Emits a non-text region as its own block under a fresh identifier.
     */
    public String inject(String regionId, BlockType blockType, BoundingBox regionBox) {
        checkOpen();
        if (blockType.isTextBearing()) {
            throw new IllegalArgumentException(blockType.getTag() + " blocks are built from text lines, not injected");
        }
        BoxGeometry.requireValid(regionBox);

        if (drafts.containsKey(regionId) || !injectedRegionIds.add(regionId)) {
            throw new ConflictingBlockException(pageIndex, regionId);
        }

        String blockId = idGenerator.nextId();
        drafts.put(blockId, new Draft(blockType, "", BoxGeometry.copyOf(regionBox), true));
        return blockId;
    }

    public int size() {
        return drafts.size();
    }

    /**
     * Finalizes the page. Blocks come back in creation order; reading order is
     * the assembler's job.
     */
    public List<Block> finish() {
        checkOpen();
        finished = true;

        List<Block> blocks = new ArrayList<>(drafts.size());
        for (Draft draft : drafts.values()) {
            blocks.add(Block.builder()
                .type(draft.type)
                .text(draft.text.toString())
                .bbox(draft.bbox)
                .metadata(Collections.emptyMap())
                .pageRange(PageRange.single(pageIndex))
                .build());
        }
        return blocks;
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Accumulator for page " + pageIndex + " is already finished");
        }
    }

    private static final class Draft {
        private final BlockType type;
        private final StringBuilder text;
        private final boolean injected;
        private BoundingBox bbox;

        private Draft(BlockType type, String text, BoundingBox bbox, boolean injected) {
            this.type = type;
            this.text = new StringBuilder(text);
            this.bbox = bbox;
            this.injected = injected;
        }
    }
}
