package org.sfiles.notation.core;

import org.sfiles.notation.graph.FlowsheetGraph;

import java.util.List;

/**
 * Public encode/decode contract of the flowsheet notation.
 *
 * <p>Implementations are expected to be stateless and to throw reason-coded
 * {@link FlowsheetCodecException}s for malformed input.</p>
 */
public interface NotationService {
    /**
     * Encodes a graph.
     *
     * @param graph graph to encode; not mutated.
     * @param options encode options.
     * @return numbered and generalized notation.
     */
    EncodeResult encode(FlowsheetGraph graph, EncodeOptions options);

    /**
     * Decodes a notation string.
     *
     * @param notation notation text.
     * @param options decode options.
     * @return decoded graph.
     */
    DecodeResult decode(String notation, DecodeOptions options);

    /**
     * Decodes an already split token list.
     *
     * @param tokens one token per entry.
     * @param options decode options.
     * @return decoded graph.
     */
    DecodeResult decode(List<String> tokens, DecodeOptions options);

    default EncodeResult encode(FlowsheetGraph graph) {
        return encode(graph, EncodeOptions.canonicalV2());
    }

    default DecodeResult decode(String notation) {
        return decode(notation, DecodeOptions.defaults());
    }

    default DecodeResult decode(List<String> tokens) {
        return decode(tokens, DecodeOptions.defaults());
    }
}
