package de.bsommerfeld.rentalprice.features.temporal;

import de.bsommerfeld.rentalprice.core.domain.Availability;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.ReviewScores;
import de.bsommerfeld.rentalprice.core.domain.Season;
import de.bsommerfeld.rentalprice.features.engine.PerListingFeatureEngine;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static de.bsommerfeld.rentalprice.features.engine.Sentinels.UNKNOWN;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.clamp;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.flag;

/**
 * Calendar encoding of the reference date plus demand signals from the
 * listing's availability calendar and review velocity.
 *
 * <p>
 * The calendar block is identical for every listing of a run and is
 * computed once. The static helpers are pure and used directly by tests
 * and callers that need a single value.
 */
public class TemporalFeatureEngine extends PerListingFeatureEngine {

    public static final String NAME = "temporal";

    private static final List<String> COLUMNS = List.of(
            "month", "quarter", "month_sin", "month_cos", "day_of_week_sin", "day_of_week_cos",
            "is_weekend", "season_summer", "season_autumn", "season_winter", "season_spring",
            "is_high_season", "is_holiday", "is_holiday_window",
            "occupancy_rate_30", "occupancy_rate_60", "occupancy_rate_90", "demand_index",
            "recent_demand", "popularity_score", "days_since_last_review");

    private static final int CALENDAR_WIDTH = 14;

    private final LocalDate referenceDate;
    private final double[] calendar;

    public TemporalFeatureEngine(LocalDate referenceDate, List<MonthDay> holidays, int holidayWindowDays) {
        this.referenceDate = Objects.requireNonNull(referenceDate, "referenceDate");
        this.calendar = calendarBlock(referenceDate, List.copyOf(holidays), holidayWindowDays);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> columns() {
        return COLUMNS;
    }

    public LocalDate referenceDate() {
        return referenceDate;
    }

    @Override
    protected double[] computeRow(Listing listing, List<String> warnings) {
        double[] row = new double[COLUMNS.size()];
        System.arraycopy(calendar, 0, row, 0, CALENDAR_WIDTH);

        Availability availability = listing.availability();
        double r30 = occupancyRate(availability.next30(), 30);
        double r60 = occupancyRate(availability.next60(), 60);
        double r90 = occupancyRate(availability.next90(), 90);
        ReviewScores reviews = listing.reviews();
        double perMonth = reviews.reviewsPerMonth() == null || reviews.reviewsPerMonth().isNaN()
                ? 0.0 : reviews.reviewsPerMonth();

        int col = CALENDAR_WIDTH;
        row[col++] = r30;
        row[col++] = r60;
        row[col++] = r90;
        row[col++] = demandIndex(r30, r60, r90);
        row[col++] = perMonth;
        row[col++] = popularity(reviews.numberOfReviews(), perMonth);
        row[col] = daysSince(listing.lastReview(), referenceDate);
        return row;
    }

    @Override
    public double[] sentinelRow() {
        double[] row = filled(COLUMNS.size(), UNKNOWN);
        System.arraycopy(calendar, 0, row, 0, CALENDAR_WIDTH);
        return row;
    }

    private static double[] calendarBlock(LocalDate date, List<MonthDay> holidays, int windowDays) {
        int month = date.getMonthValue();
        int dow = date.getDayOfWeek().getValue() - 1;
        Season season = Season.of(date.getMonth());
        return new double[] {
                month,
                (month - 1) / 3 + 1,
                Math.sin(2 * Math.PI * month / 12.0),
                Math.cos(2 * Math.PI * month / 12.0),
                Math.sin(2 * Math.PI * dow / 7.0),
                Math.cos(2 * Math.PI * dow / 7.0),
                flag(isWeekend(date)),
                flag(season == Season.SUMMER),
                flag(season == Season.AUTUMN),
                flag(season == Season.WINTER),
                flag(season == Season.SPRING),
                flag(season == Season.SUMMER),
                flag(isHoliday(date, holidays)),
                flag(isInHolidayWindow(date, holidays, windowDays))
        };
    }

    /** Friday, Saturday and Sunday. */
    public static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.FRIDAY || day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public static boolean isHoliday(LocalDate date, List<MonthDay> holidays) {
        return holidays.contains(MonthDay.from(date));
    }

    /**
     * True when a holiday falls within {@code windowDays} of {@code date},
     * across year boundaries.
     */
    public static boolean isInHolidayWindow(LocalDate date, List<MonthDay> holidays, int windowDays) {
        for (int offset = -windowDays; offset <= windowDays; offset++) {
            if (holidays.contains(MonthDay.from(date.plusDays(offset)))) {
                return true;
            }
        }
        return false;
    }

    /** {@code 1 - available / horizon} clamped to [0, 1]; UNKNOWN without data. */
    public static double occupancyRate(Integer availableDays, int horizon) {
        if (availableDays == null) {
            return UNKNOWN;
        }
        return clamp(1.0 - availableDays / (double) horizon, 0.0, 1.0);
    }

    static double demandIndex(double... rates) {
        List<Double> known = new ArrayList<>(rates.length);
        for (double rate : rates) {
            if (rate != UNKNOWN) {
                known.add(rate);
            }
        }
        return known.isEmpty() ? UNKNOWN : known.stream().mapToDouble(Double::doubleValue).average().orElse(UNKNOWN);
    }

    public static double popularity(int numberOfReviews, double reviewsPerMonth) {
        return 0.5 * numberOfReviews + 0.5 * 100.0 * reviewsPerMonth;
    }

    /** Days from {@code lastReview} to {@code referenceDate}; UNKNOWN when absent or in the future. */
    public static double daysSince(LocalDate lastReview, LocalDate referenceDate) {
        if (lastReview == null || lastReview.isAfter(referenceDate)) {
            return UNKNOWN;
        }
        return ChronoUnit.DAYS.between(lastReview, referenceDate);
    }
}
