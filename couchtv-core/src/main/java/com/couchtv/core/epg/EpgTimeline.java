package com.couchtv.core.epg;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time view over one channel's programs: what is on now, what is on next.
 *
 * Programs are copied and stably sorted by start time, so guide data that arrives
 * out of order still yields the temporally nearest next program. Among entries with
 * equal start times the original list order is kept. Overlapping entries are not
 * rejected; the first airing entry in that order is reported as current.
 */
public final class EpgTimeline {

    private static final EpgTimeline EMPTY = new EpgTimeline(List.of());

    private final List<EpgProgram> programs;

    private EpgTimeline(List<EpgProgram> sortedPrograms) {
        this.programs = sortedPrograms;
    }

    public static EpgTimeline of(List<EpgProgram> programs) {
        if (programs == null || programs.isEmpty()) {
            return EMPTY;
        }
        List<EpgProgram> sorted = new ArrayList<>(programs);
        sorted.sort(Comparator.comparingLong(EpgProgram::start));
        return new EpgTimeline(List.copyOf(sorted));
    }

    public static EpgTimeline empty() {
        return EMPTY;
    }

    /**
     * The program with {@code start <= now < end}.
     */
    public Optional<EpgProgram> currentProgram(long now) {
        for (EpgProgram program : programs) {
            if (program.isAiring(now)) {
                return Optional.of(program);
            }
        }
        return Optional.empty();
    }

    /**
     * The program with the smallest start strictly after {@code now}.
     */
    public Optional<EpgProgram> nextProgram(long now) {
        for (EpgProgram program : programs) {
            if (program.start() > now) {
                return Optional.of(program);
            }
        }
        return Optional.empty();
    }

    /**
     * Progress of the current program, or 0 when nothing is airing.
     */
    public float progress(long now) {
        return currentProgram(now).map(p -> p.progress(now)).orElse(0.0f);
    }

    /**
     * Up to {@code limit} programs starting after {@code now}, earliest first.
     */
    public List<EpgProgram> upcoming(long now, int limit) {
        List<EpgProgram> result = new ArrayList<>();
        for (EpgProgram program : programs) {
            if (result.size() >= limit) break;
            if (program.start() > now) {
                result.add(program);
            }
        }
        return result;
    }

    public List<EpgProgram> programs() {
        return programs;
    }

    public boolean isEmpty() {
        return programs.isEmpty();
    }

    public int size() {
        return programs.size();
    }
}
