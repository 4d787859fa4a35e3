package org.fairway.core;

import org.fairway.diversity.KBestResult;
import org.fairway.geometry.Fairway;
import org.fairway.level.Level;
import org.fairway.par.ParEstimate;
import org.fairway.placement.CupCandidate;
import org.fairway.preview.PathPreview;

import java.util.List;

/**
 * Difficulty analysis operations offered to the level editor.
 *
 * <p>Every call is a pure function of its arguments and the analyzer's configuration.</p>
 */
public interface CourseAnalyzer {

    /**
     * Suggests par for the level's current cup.
     */
    ParEstimate estimatePar(Level level, Fairway fairway, double cellSize);

    /**
     * Returns overlay data for the base path.
     */
    PathPreview previewPath(Level level, Fairway fairway, double cellSize);

    /**
     * Suggests up to {@code k} distinct routes with independent stroke estimates.
     */
    KBestResult suggestK(Level level, Fairway fairway, double cellSize, int k);

    /**
     * Suggests up to {@code count} alternative cup placements, best first.
     */
    List<CupCandidate> suggestGoals(Level level, Fairway fairway, double cellSize, int count);

    /**
     * Lints the level's current cup placement.
     */
    List<String> lintGoal(Level level, Fairway fairway, double cellSize);
}
