package com.smartlists.ruleengine.api.model;

import java.util.List;

/**
 * Decoded media stream facts of one item.
 */
public record MediaStreamInfo(
        VideoStream video,
        List<AudioStream> audioStreams,
        List<SubtitleStream> subtitleStreams
) {

    public MediaStreamInfo {
        audioStreams = audioStreams != null ? List.copyOf(audioStreams) : List.of();
        subtitleStreams = subtitleStreams != null ? List.copyOf(subtitleStreams) : List.of();
    }

    public static MediaStreamInfo empty() {
        return new MediaStreamInfo(null, List.of(), List.of());
    }

    /**
     * The stream audio quality fields read: the default stream, else the first one.
     */
    public AudioStream primaryAudio() {
        for (AudioStream stream : audioStreams) {
            if (stream.isDefault()) {
                return stream;
            }
        }
        return audioStreams.isEmpty() ? null : audioStreams.get(0);
    }

    public record VideoStream(
            Integer width,
            Integer height,
            Double framerate,
            String codec,
            String profile,
            String videoRange,
            String videoRangeType
    ) {}

    public record AudioStream(
            String language,
            boolean isDefault,
            String codec,
            String profile,
            Integer bitrate,
            Integer sampleRate,
            Integer bitDepth,
            Integer channels
    ) {}

    public record SubtitleStream(String language, boolean isDefault) {}
}
