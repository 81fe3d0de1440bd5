package com.z254.gridpulse.capability;

import java.util.function.Consumer;

/**
 * Turns structured results into prose.
 *
 * <p>Implementations may block. Text is passed to {@code onChunk} as it is
 * produced; the concatenation of all chunks equals the returned text.
 */
public interface Narrator {

    /**
     * @param request what to write
     * @param onChunk receives text increments, in order
     * @return the full text
     * @throws com.z254.gridpulse.exception.NarratorException when no text could be produced
     */
    String narrate(NarrativeRequest request, Consumer<String> onChunk) throws Exception;
}
