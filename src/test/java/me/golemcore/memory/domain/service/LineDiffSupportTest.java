package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.DiffLine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineDiffSupportTest {

    @Test
    void identicalTextsShouldProduceOnlySameLines() {
        String text = "alpha\nbeta\ngamma";

        List<DiffLine> diff = LineDiffSupport.computeLineDiff(text, text);

        assertEquals(3, diff.size());
        assertTrue(diff.stream().allMatch(line -> line.type() == DiffLine.Type.SAME));
        assertEquals(List.of(1, 2, 3), diff.stream().map(DiffLine::lineNumber).toList());
    }

    @Test
    void singleLineReplacementShouldEmitRemoveThenAdd() {
        List<DiffLine> diff = LineDiffSupport.computeLineDiff("v1", "v2");

        assertEquals(List.of(DiffLine.remove("v1", 1), DiffLine.add("v2", 1)), diff);
    }

    @Test
    void shouldKeepCommonLinesAroundAnInsertion() {
        List<DiffLine> diff = LineDiffSupport.computeLineDiff("a\nc", "a\nb\nc");

        assertEquals(List.of(
                DiffLine.same("a", 1),
                DiffLine.add("b", 2),
                DiffLine.same("c", 3)), diff);
    }

    @Test
    void applyingDiffShouldReconstructSecondText() {
        String before = "# Plan\n- step one\n- step two\n- step three\n\nnotes";
        String after = "# Plan\n- step one\n- step 2\n- step three\n- step four\n\nnotes\nmore notes";

        List<DiffLine> diff = LineDiffSupport.computeLineDiff(before, after);
        List<String> rebuilt = LineDiffSupport.apply(LineDiffSupport.lines(before), diff);

        assertEquals(LineDiffSupport.lines(after), rebuilt);
    }

    @Test
    void diffAgainstEmptyTextShouldRemoveEverything() {
        List<DiffLine> diff = LineDiffSupport.computeLineDiff("x\ny", "");

        assertEquals(2, diff.stream().filter(line -> line.type() == DiffLine.Type.REMOVE).count());
        assertEquals(LineDiffSupport.lines(""), LineDiffSupport.apply(LineDiffSupport.lines("x\ny"), diff));
    }

    @Test
    void checkpointShouldRunOncePerRowAndMayAbort() {
        AtomicInteger rows = new AtomicInteger();
        LineDiffSupport.computeLineDiff("1\n2\n3", "1\n3", rows::incrementAndGet);
        assertEquals(3, rows.get());

        assertThrows(IllegalStateException.class, () -> LineDiffSupport.computeLineDiff("a\nb", "b", () -> {
            throw new IllegalStateException("stop");
        }));
    }
}
