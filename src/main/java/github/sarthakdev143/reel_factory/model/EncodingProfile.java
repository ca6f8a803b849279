package github.sarthakdev143.reel_factory.model;

/**
 * Codec settings shared by every segment of a request. Segments are joined with a stream copy, so any
 * difference between them breaks the final concatenation.
 */
public record EncodingProfile(
        String videoCodec,
        String preset,
        int crf,
        int frameRate,
        String pixelFormat,
        String audioCodec,
        String audioBitrate,
        int audioSampleRate,
        int audioChannels) {

    public static final EncodingProfile DEFAULT = new EncodingProfile(
            "libx264",
            "veryfast",
            23,
            30,
            "yuv420p",
            "aac",
            "192k",
            44100,
            2);
}
