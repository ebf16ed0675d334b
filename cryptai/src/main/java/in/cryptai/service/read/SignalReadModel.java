package in.cryptai.service.read;

import in.cryptai.domain.signal.BestOfDayDate;
import in.cryptai.domain.signal.GenerationSlot;
import in.cryptai.domain.signal.Signal;
import in.cryptai.repository.GenerationSlotRepository;
import in.cryptai.repository.SignalRepository;
import in.cryptai.util.UtcDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only queries over committed signals. Never writes, never triggers a run.
 * Dates or hours with nothing to show yield an empty list.
 */
public final class SignalReadModel {
    private static final Logger log = LoggerFactory.getLogger(SignalReadModel.class);

    private static final Comparator<Signal> LIVE_ORDER =
        Comparator.comparingDouble(Signal::score).reversed()
            .thenComparing(Signal::candidateId)
            .thenComparingLong(Signal::signalId);

    private final SignalRepository signalRepo;
    private final GenerationSlotRepository slotRepo;
    private final int bestOfDayLimit;
    private final Clock clock;

    public SignalReadModel(SignalRepository signalRepo,
                           GenerationSlotRepository slotRepo,
                           int bestOfDayLimit,
                           Clock clock) {
        this.signalRepo = signalRepo;
        this.slotRepo = slotRepo;
        this.bestOfDayLimit = bestOfDayLimit;
        this.clock = clock;
    }

    /**
     * Winners of one hourly slot, best first.
     */
    public List<Signal> topForHour(LocalDate date, int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be 0..23, got " + hour);
        }
        return signalRepo.findValidBySlot(date, hour);
    }

    /**
     * Past dates: the materialized snapshot, restricted to rows created on the date.
     * Today: live top N of valid signals created today, not persisted.
     * Future dates: empty.
     */
    public List<Signal> bestForDate(LocalDate date) {
        LocalDate today = UtcDates.today(clock);
        if (date.isAfter(today)) {
            return List.of();
        }
        if (date.isBefore(today)) {
            return signalRepo.findBestOfDay(date);
        }

        List<Signal> live = new ArrayList<>(signalRepo.findValidCreatedOn(date));
        live.sort(LIVE_ORDER);
        List<Signal> top = live.size() > bestOfDayLimit ? live.subList(0, bestOfDayLimit) : live;
        log.debug("[READ] live best for {}: {} of {}", date, top.size(), live.size());
        return List.copyOf(top);
    }

    /**
     * Dates with a best-of-day snapshot, newest first.
     */
    public List<LocalDate> availableBestOfDayDates() {
        return bestOfDayDateCounts().stream().map(BestOfDayDate::date).toList();
    }

    public List<BestOfDayDate> bestOfDayDateCounts() {
        return signalRepo.findBestOfDayDates();
    }

    public List<GenerationSlot> slotsForDate(LocalDate date) {
        return slotRepo.findByDate(date);
    }
}
