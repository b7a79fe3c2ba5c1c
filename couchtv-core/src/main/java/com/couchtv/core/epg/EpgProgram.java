package com.couchtv.core.epg;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * One program guide entry for a channel.
 *
 * @param channelId   channel the program airs on
 * @param title       program title
 * @param description program description, may be empty
 * @param start       start time in unix seconds, inclusive
 * @param end         end time in unix seconds, exclusive
 */
public record EpgProgram(String channelId, String title, String description, long start, long end) {

    private static final DateTimeFormatter TIME_LABEL =
        DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    public EpgProgram {
        channelId = channelId != null ? channelId : "";
        title = title != null ? title : "";
        description = description != null ? description : "";
    }

    /**
     * True iff {@code start <= now < end}.
     */
    public boolean isAiring(long now) {
        return start <= now && now < end;
    }

    /**
     * Fraction of the program elapsed at {@code now}, clamped to [0, 1].
     * Zero for a degenerate interval ({@code end <= start}).
     */
    public float progress(long now) {
        if (end <= start) {
            return 0.0f;
        }
        float fraction = (float) (now - start) / (float) (end - start);
        return Math.max(0.0f, Math.min(1.0f, fraction));
    }

    public long durationSeconds() {
        return Math.max(0, end - start);
    }

    public String startTimeLabel() {
        return timeLabel(start);
    }

    public String endTimeLabel() {
        return timeLabel(end);
    }

    private static String timeLabel(long epochSeconds) {
        if (epochSeconds == 0) {
            return "";
        }
        return TIME_LABEL.format(Instant.ofEpochSecond(epochSeconds));
    }
}
