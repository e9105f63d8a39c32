package com.linlay.taskrunner.agent.stream;

import org.springframework.util.StringUtils;

/**
 * Splits a model's streamed text into visible output and private reasoning delimited by an
 * opening and a closing marker. Markers may be cut across chunks, and an open reasoning span
 * survives across model invocations, so one instance is kept for a whole adapter stream.
 * Not thread-safe.
 */
public final class ReasoningTextFilter {

    public static final String DEFAULT_OPEN_MARKER = "<think>";
    public static final String DEFAULT_CLOSE_MARKER = "</think>";

    private final String openMarker;
    private final String closeMarker;
    private final StringBuilder reasoning = new StringBuilder();
    private String buffer = "";
    private boolean inside;

    public ReasoningTextFilter() {
        this(DEFAULT_OPEN_MARKER, DEFAULT_CLOSE_MARKER);
    }

    public ReasoningTextFilter(String openMarker, String closeMarker) {
        this.openMarker = StringUtils.hasLength(openMarker) ? openMarker : DEFAULT_OPEN_MARKER;
        this.closeMarker = StringUtils.hasLength(closeMarker) ? closeMarker : DEFAULT_CLOSE_MARKER;
        if (this.openMarker.equals(this.closeMarker)) {
            throw new IllegalArgumentException("reasoning markers must differ");
        }
    }

    /**
     * Feeds one chunk and returns the text that is safe to show now. May be empty.
     */
    public String feed(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return "";
        }
        buffer = buffer + chunk;
        StringBuilder visible = new StringBuilder();
        while (!buffer.isEmpty()) {
            if (inside) {
                int close = buffer.indexOf(closeMarker);
                if (close >= 0) {
                    reasoning.append(buffer, 0, close);
                    buffer = buffer.substring(close + closeMarker.length());
                    inside = false;
                    continue;
                }
                int hold = heldSuffixLength(buffer, closeMarker);
                reasoning.append(buffer, 0, buffer.length() - hold);
                buffer = buffer.substring(buffer.length() - hold);
                break;
            }

            int open = buffer.indexOf(openMarker);
            int close = buffer.indexOf(closeMarker);
            if (open >= 0 && (close < 0 || open < close)) {
                visible.append(buffer, 0, open);
                buffer = buffer.substring(open + openMarker.length());
                inside = true;
                continue;
            }
            if (close >= 0) {
                // closing marker without an opener: the text before it was reasoning
                reasoning.append(buffer, 0, close);
                buffer = buffer.substring(close + closeMarker.length());
                continue;
            }
            int hold = Math.max(heldSuffixLength(buffer, openMarker), heldSuffixLength(buffer, closeMarker));
            visible.append(buffer, 0, buffer.length() - hold);
            buffer = buffer.substring(buffer.length() - hold);
            break;
        }
        return visible.toString();
    }

    /**
     * Returns the reasoning collected since the last call and clears it. The inside/outside
     * state is left untouched.
     */
    public String drainReasoning() {
        String drained = reasoning.toString();
        reasoning.setLength(0);
        return drained;
    }

    /**
     * Ends the stream. Text still inside a reasoning span is dropped; a dangling partial marker
     * is stripped; whatever is left is returned as visible output.
     */
    public String flush() {
        String remaining = buffer;
        buffer = "";
        if (inside) {
            reasoning.append(remaining);
            inside = false;
            return "";
        }
        int hold = Math.max(heldSuffixLength(remaining, openMarker), heldSuffixLength(remaining, closeMarker));
        return remaining.substring(0, remaining.length() - hold);
    }

    public boolean inside() {
        return inside;
    }

    /**
     * Length of the longest suffix of {@code text} that is a strict prefix of {@code marker}.
     */
    static int heldSuffixLength(String text, String marker) {
        int max = Math.min(text.length(), marker.length() - 1);
        for (int len = max; len > 0; len--) {
            if (text.regionMatches(text.length() - len, marker, 0, len)) {
                return len;
            }
        }
        return 0;
    }
}
