package com.flashback.liveness.detection;

import com.flashback.liveness.domain.FacePosition;
import com.flashback.liveness.domain.FrameObservation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-capacity ring buffer of the most recent frame observations, oldest first.
 */
public class FrameHistory {

    private final FrameObservation[] buffer;
    private int count;
    private int index;

    public FrameHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.buffer = new FrameObservation[capacity];
    }

    public void add(FrameObservation observation) {
        buffer[index] = observation;
        index = (index + 1) % buffer.length;
        if (count < buffer.length) {
            count++;
        }
    }

    public List<FrameObservation> snapshot() {
        List<FrameObservation> frames = new ArrayList<>(count);
        int start = count < buffer.length ? 0 : index;
        for (int i = 0; i < count; i++) {
            frames.add(buffer[(start + i) % buffer.length]);
        }
        return Collections.unmodifiableList(frames);
    }

    /**
     * Majority face position over the buffered frames that had a face.
     * Ties resolve in {@link FacePosition} declaration order, so CENTER wins a tie.
     */
    public FacePosition dominantFacePosition() {
        Map<FacePosition, Integer> votes = new EnumMap<>(FacePosition.class);
        for (FrameObservation frame : snapshot()) {
            FacePosition position = frame.facePosition();
            if (position != FacePosition.UNKNOWN) {
                votes.merge(position, 1, Integer::sum);
            }
        }
        FacePosition best = FacePosition.UNKNOWN;
        int bestVotes = 0;
        for (Map.Entry<FacePosition, Integer> entry : votes.entrySet()) {
            if (entry.getValue() > bestVotes) {
                best = entry.getKey();
                bestVotes = entry.getValue();
            }
        }
        return best;
    }

    public int size() {
        return count;
    }

    public int capacity() {
        return buffer.length;
    }

    public void clear() {
        Arrays.fill(buffer, null);
        count = 0;
        index = 0;
    }
}
