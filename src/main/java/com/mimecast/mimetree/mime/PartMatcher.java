package com.mimecast.mimetree.mime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Searches over a parsed MIME tree.
 *
 * <p>Breadth-first searches visit a level completely before descending.
 * <br>Depth-first searches visit a part, then its children, then its next sibling.
 * <br>The root itself is included in every search.
 */
public final class PartMatcher {

    /**
     * Private constructor.
     */
    private PartMatcher() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Finds the first matching part breadth-first.
     *
     * @param root    Root part.
     * @param matcher Predicate.
     * @return Optional of MimePart.
     */
    public static Optional<MimePart> breadthMatchFirst(MimePart root, Predicate<MimePart> matcher) {
        List<MimePart> all = breadthMatch(root, matcher, true);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /**
     * Finds all matching parts breadth-first.
     *
     * @param root    Root part.
     * @param matcher Predicate.
     * @return List of MimePart in visiting order.
     */
    public static List<MimePart> breadthMatchAll(MimePart root, Predicate<MimePart> matcher) {
        return breadthMatch(root, matcher, false);
    }

    /**
     * Finds the first matching part depth-first.
     *
     * @param root    Root part.
     * @param matcher Predicate.
     * @return Optional of MimePart.
     */
    public static Optional<MimePart> depthMatchFirst(MimePart root, Predicate<MimePart> matcher) {
        List<MimePart> all = depthMatch(root, matcher, true);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /**
     * Finds all matching parts depth-first.
     *
     * @param root    Root part.
     * @param matcher Predicate.
     * @return List of MimePart in document order.
     */
    public static List<MimePart> depthMatchAll(MimePart root, Predicate<MimePart> matcher) {
        return depthMatch(root, matcher, false);
    }

    /**
     * Matches parts of the given media type, case-insensitive.
     *
     * @param contentType Media type such as {@code text/html}.
     * @return Predicate.
     */
    public static Predicate<MimePart> contentType(String contentType) {
        String wanted = contentType.toLowerCase(Locale.ROOT);
        return part -> part.getContentType().equals(wanted);
    }

    /**
     * Matches attachment parts: disposition attachment, or a file name on a leaf.
     *
     * @return Predicate.
     */
    public static Predicate<MimePart> attachment() {
        return part -> "attachment".equals(part.getDisposition())
                || (!part.isMultipart() && !part.getFileName().isEmpty());
    }

    private static List<MimePart> breadthMatch(MimePart root, Predicate<MimePart> matcher, boolean first) {
        List<MimePart> matches = new ArrayList<>();
        Deque<MimePart> queue = new ArrayDeque<>();
        queue.add(root);

        while (!queue.isEmpty()) {
            MimePart part = queue.poll();
            if (matcher.test(part)) {
                matches.add(part);
                if (first) {
                    break;
                }
            }
            for (MimePart child = part.getFirstChild(); child != null; child = child.getNextSibling()) {
                queue.add(child);
            }
        }

        return matches;
    }

    private static List<MimePart> depthMatch(MimePart root, Predicate<MimePart> matcher, boolean first) {
        List<MimePart> matches = new ArrayList<>();
        Deque<MimePart> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            MimePart part = stack.pop();
            if (matcher.test(part)) {
                matches.add(part);
                if (first) {
                    break;
                }
            }

            // Push children last to first so the first child pops next.
            List<MimePart> children = part.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return matches;
    }
}
