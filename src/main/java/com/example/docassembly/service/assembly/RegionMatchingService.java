package com.example.docassembly.service.assembly;

import com.example.docassembly.dto.detection.BoundingBox;
import com.example.docassembly.dto.detection.LayoutRegion;
import com.example.docassembly.dto.document.BlockType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Finds the layout region a text line belongs to.
 *
 * <p>The overlap ratio is the share of the <em>line's</em> area covered by the
 * region, not an IoU, so a small line inside a large region always scores 1.
 * Regions are tried in detector order and the first one strictly above the
 * threshold wins.</p>
 */
@Service
public class RegionMatchingService {

    private static final Logger logger = LoggerFactory.getLogger(RegionMatchingService.class);

    public static final double DEFAULT_THRESHOLD = 0.6;

    private final double threshold;
    private final BlockIdGenerator idGenerator;

    public RegionMatchingService(@Value("${assembly.match-threshold:0.6}") double threshold,
                                 BlockIdGenerator idGenerator) {
        this.threshold = checkThreshold(threshold);
        this.idGenerator = idGenerator;
    }

    public RegionMatch match(BoundingBox lineBox, List<LayoutRegion> regions) {
        return match(lineBox, regions, threshold);
    }

    public RegionMatch match(BoundingBox lineBox, List<LayoutRegion> regions, double threshold) {
        checkThreshold(threshold);
        double lineArea = BoxGeometry.area(lineBox);

        // A zero-area line cannot be covered by anything
        if (lineArea > 0 && regions != null) {
            for (LayoutRegion region : regions) {
                double ratio = BoxGeometry.intersectionArea(lineBox, region.getBbox()) / lineArea;
                if (ratio > threshold) {
                    logger.trace("Line {} matched region {} ({}) with ratio {}",
                        lineBox, region.getId(), region.getLabel(), ratio);
                    return new RegionMatch(region.getId(), region.getLabel().getBlockType(), region.getId());
                }
            }
        }

        return new RegionMatch(idGenerator.nextId(), BlockType.UNDEFINED, null);
    }

    private static double checkThreshold(double threshold) {
        if (!Double.isFinite(threshold) || threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Match threshold must be within [0, 1], got " + threshold);
        }
        return threshold;
    }
}
