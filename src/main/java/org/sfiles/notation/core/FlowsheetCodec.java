package org.sfiles.notation.core;

import lombok.extern.slf4j.Slf4j;
import org.sfiles.notation.decode.NotationDecoder;
import org.sfiles.notation.decode.NotationLexer;
import org.sfiles.notation.encode.NotationEncoder;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.SignalTag;
import org.sfiles.notation.graph.Stream;
import org.sfiles.notation.graph.StreamTags;
import org.sfiles.notation.graph.UnitIds;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Default notation facade.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>encode: heat-integration split, ranking, traversal, rendering.</li>
 * <li>decode: lexing, unit naming, structural parse, heat-integration merge.</li>
 * </ul>
 *
 * <p>The codec holds no state; one instance can be shared across threads.</p>
 */
@Slf4j
public final class FlowsheetCodec implements NotationService {
    private static final int AUGMENT_ATTEMPTS_PER_RESULT = 8;

    @Override
    public EncodeResult encode(FlowsheetGraph graph, EncodeOptions options) {
        EncodeResult result = NotationEncoder.encode(graph, options);
        log.debug("encode: {} units -> {} chars", graph.unitCount(), result.getNotation().length());
        return result;
    }

    @Override
    public DecodeResult decode(String notation, DecodeOptions options) {
        Objects.requireNonNull(options, "options");
        DecodeResult result = NotationDecoder.decode(NotationLexer.tokenize(notation), options);
        log.debug("decode: {} chars -> {} units", notation.length(), result.getGraph().unitCount());
        return result;
    }

    @Override
    public DecodeResult decode(List<String> tokens, DecodeOptions options) {
        Objects.requireNonNull(options, "options");
        DecodeResult result = NotationDecoder.decode(NotationLexer.tokenize(tokens), options);
        log.debug("decode: {} tokens -> {} units", tokens.size(), result.getGraph().unitCount());
        return result;
    }

    /**
     * Canonical generalized form of a notation. Two notations of isomorphic
     * flowsheets yield the same string.
     *
     * @param notation notation text.
     * @return canonical generalized notation.
     */
    public String canonicalize(String notation) {
        FlowsheetGraph graph = decode(notation).getGraph();
        return encode(graph, EncodeOptions.canonicalV2()).getGeneralizedNotation();
    }

    /**
     * Alternative spellings of one flowsheet for training-data augmentation.
     *
     * @param notation notation text.
     * @param count maximum number of variants.
     * @param seed base seed; variant {@code i} is drawn with {@code seed + i}.
     * @return up to {@code count} distinct generalized notations, none equal to
     *         the canonical one, in discovery order.
     */
    public List<String> augment(String notation, int count, long seed) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        FlowsheetGraph graph = decode(notation).getGraph();
        String canonical = encode(graph, EncodeOptions.canonicalV2()).getGeneralizedNotation();
        Set<String> variants = new LinkedHashSet<>();
        int attempts = count * AUGMENT_ATTEMPTS_PER_RESULT;
        for (int i = 0; i < attempts && variants.size() < count; i++) {
            String variant = encode(graph, EncodeOptions.augmentation(seed + i)).getGeneralizedNotation();
            if (!variant.equals(canonical)) {
                variants.add(variant);
            }
        }
        if (variants.size() < count) {
            log.debug("augment: {} of {} variants after {} attempts", variants.size(), count, attempts);
        }
        return new ArrayList<>(variants);
    }

    /**
     * Drops the control layer of a notation. Each control unit is removed;
     * a unit feeding it is connected straight to the units it passes its
     * stream on to, keeping the tags of the incoming stream.
     *
     * @param notation notation text, possibly with control units.
     * @return canonical generalized notation of the remaining process graph.
     * @throws EmptyInputException when nothing but control units remains.
     */
    public String stripControl(String notation) {
        FlowsheetGraph graph = decode(notation).getGraph();
        for (String unitId : new ArrayList<>(graph.unitIds())) {
            if (UnitIds.isControlUnit(unitId)) {
                bypass(graph, unitId);
            }
        }
        return encode(graph, EncodeOptions.canonicalV2()).getGeneralizedNotation();
    }

    private static void bypass(FlowsheetGraph graph, String controlUnit) {
        List<Stream> inbound = graph.inStreams(controlUnit);
        List<Stream> outbound = graph.outStreams(controlUnit);
        for (Stream in : inbound) {
            if (in.isRemoteSignal() || in.isSelfLoop()) {
                continue;
            }
            for (Stream out : outbound) {
                if (!out.getTags().isSignal(SignalTag.NEXT_UNIT) || out.isSelfLoop()) {
                    continue;
                }
                String source = in.getSource();
                String target = out.getTarget();
                if (!graph.hasStream(source, target)) {
                    StreamTags tags = in.getTags().signal().isPresent()
                            ? StreamTags.parse(in.getTags().notationTags(true))
                            : in.getTags();
                    graph.addStream(source, target, tags);
                }
            }
        }
        graph.removeUnit(controlUnit);
    }
}
