package fr.lapetina.ocr.scheduler.domain.engine;

import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Page-range expressions of the form {@code 1-3,5,8-}.
 * Pages are 1-based and ranges inclusive.
 */
public final class PageRanges {

    private PageRanges() {
    }

    /**
     * Checks the syntax of a caller-supplied range expression.
     *
     * @throws ValidationException when a part is not {@code n}, {@code n-m} or {@code n-}
     */
    public static void validate(String expression) {
        if (expression == null) {
            return;
        }
        for (String part : expression.split(",")) {
            parsePart(part.trim(), Integer.MAX_VALUE);
        }
    }

    /**
     * Resolves an expression against a document, dropping pages beyond {@code totalPages}.
     *
     * @return distinct pages in ascending order
     */
    public static List<Integer> resolve(String expression, int totalPages) {
        TreeSet<Integer> pages = new TreeSet<>();
        if (expression == null) {
            for (int page = 1; page <= totalPages; page++) {
                pages.add(page);
            }
            return new ArrayList<>(pages);
        }
        for (String part : expression.split(",")) {
            int[] bounds = parsePart(part.trim(), totalPages);
            for (int page = bounds[0]; page <= Math.min(bounds[1], totalPages); page++) {
                pages.add(page);
            }
        }
        return new ArrayList<>(pages);
    }

    /**
     * Splits {@code 1..totalPages} into contiguous batches of at most {@code batchSize} pages.
     *
     * @return range expressions such as {@code 1-50}, {@code 51-100}, {@code 101-120}
     */
    public static List<String> batches(int totalPages, int batchSize) {
        int size = Math.max(1, batchSize);
        List<String> batches = new ArrayList<>();
        for (int start = 1; start <= totalPages; start += size) {
            int end = Math.min(start + size - 1, totalPages);
            batches.add(start + "-" + end);
        }
        return batches;
    }

    private static int[] parsePart(String part, int totalPages) {
        if (part.isEmpty()) {
            throw invalid(part);
        }
        int dash = part.indexOf('-');
        int start;
        int end;
        try {
            if (dash < 0) {
                start = Integer.parseInt(part);
                end = start;
            } else {
                start = Integer.parseInt(part.substring(0, dash).trim());
                String tail = part.substring(dash + 1).trim();
                end = tail.isEmpty() ? Math.max(start, totalPages) : Integer.parseInt(tail);
            }
        } catch (NumberFormatException e) {
            throw invalid(part);
        }
        if (start < 1 || end < start) {
            throw invalid(part);
        }
        return new int[]{start, end};
    }

    private static ValidationException invalid(String part) {
        return new ValidationException("Invalid page range: '" + part + "'");
    }
}
