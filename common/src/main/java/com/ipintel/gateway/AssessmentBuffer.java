package com.ipintel.gateway;

/**
 * Accumulates a streamed assessment response chunk by chunk.
 *
 * <p>Chunks are concatenated in arrival order.  The text only becomes available after
 * {@link #complete()} has been called; a stream that ends without that signal is a
 * truncated response and is reported as an {@link AssessmentException}.  Not thread-safe:
 * one buffer per call.</p>
 */
public class AssessmentBuffer {

    private final StringBuilder text = new StringBuilder();
    private boolean complete;
    private int chunks;

    public void append(String chunk) {
        if (complete) {
            throw new IllegalStateException("Chunk received after stream completion");
        }
        if (chunk != null) {
            text.append(chunk);
            chunks++;
        }
    }

    /** Marks the stream as fully delivered. */
    public void complete() {
        complete = true;
    }

    public boolean isComplete() {
        return complete;
    }

    public int chunkCount() {
        return chunks;
    }

    /**
     * @return the concatenated text
     * @throws AssessmentException if the stream never signalled completion
     */
    public String text() throws AssessmentException {
        if (!complete) {
            throw new AssessmentException("Assessment stream ended before completion after "
                    + chunks + " chunks");
        }
        return text.toString();
    }
}
