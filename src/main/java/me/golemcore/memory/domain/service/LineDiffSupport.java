package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.memory.domain.model.DiffLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Longest-common-subsequence line diff. Quadratic in time and memory, which
 * is fine for short human-authored memory content.
 */
public final class LineDiffSupport {

    private LineDiffSupport() {
    }

    public static List<DiffLine> computeLineDiff(String before, String after) {
        return computeLineDiff(before, after, () -> {
        });
    }

    /**
     * Compute the diff, invoking {@code checkpoint} once per row of the LCS
     * table so callers can abort long computations.
     */
    public static List<DiffLine> computeLineDiff(String before, String after, Runnable checkpoint) {
        String[] linesA = splitLines(before);
        String[] linesB = splitLines(after);
        int m = linesA.length;
        int n = linesB.length;

        int[][] dp = new int[m + 1][n + 1];
        for (int i = 1; i <= m; i++) {
            checkpoint.run();
            for (int j = 1; j <= n; j++) {
                if (linesA[i - 1].equals(linesB[j - 1])) {
                    dp[i][j] = dp[i - 1][j - 1] + 1;
                } else {
                    dp[i][j] = Math.max(dp[i - 1][j], dp[i][j - 1]);
                }
            }
        }

        List<DiffLine> reversed = new ArrayList<>(m + n);
        int i = m;
        int j = n;
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0 && linesA[i - 1].equals(linesB[j - 1])) {
                reversed.add(DiffLine.same(linesA[i - 1], j));
                i--;
                j--;
            } else if (j > 0 && (i == 0 || dp[i][j - 1] >= dp[i - 1][j])) {
                reversed.add(DiffLine.add(linesB[j - 1], j));
                j--;
            } else {
                reversed.add(DiffLine.remove(linesA[i - 1], i));
                i--;
            }
        }
        Collections.reverse(reversed);
        return reversed;
    }

    /**
     * Replay a diff onto the lines of its first text, yielding the lines of the
     * second.
     */
    public static List<String> apply(List<String> beforeLines, List<DiffLine> diff) {
        List<String> result = new ArrayList<>();
        int cursor = 0;
        for (DiffLine line : diff) {
            switch (line.type()) {
            case SAME -> {
                result.add(beforeLines.get(cursor));
                cursor++;
            }
            case REMOVE -> cursor++;
            case ADD -> result.add(line.line());
            default -> throw new IllegalStateException("Unexpected diff line type: " + line.type());
            }
        }
        return result;
    }

    public static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        Collections.addAll(lines, splitLines(text));
        return lines;
    }

    private static String[] splitLines(String text) {
        return (text != null ? text : "").split("\n", -1);
    }
}
