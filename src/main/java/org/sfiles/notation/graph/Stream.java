package org.sfiles.notation.graph;

import lombok.Value;

/**
 * A directed material or signal stream between two units.
 */
@Value
public class Stream {
    String source;
    String target;
    StreamTags tags;

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    /**
     * True for signal streams that drive a non-adjacent unit. These do not take
     * part in traversal or in heat-integration pairing.
     */
    public boolean isRemoteSignal() {
        return tags.isSignal(SignalTag.NOT_NEXT_UNIT);
    }

    public Stream withTags(StreamTags newTags) {
        return new Stream(source, target, newTags);
    }

    public Stream reconnect(String newSource, String newTarget) {
        return new Stream(newSource, newTarget, tags);
    }

    @Override
    public String toString() {
        return source + " -> " + target + (tags.isEmpty() ? "" : " " + tags);
    }
}
